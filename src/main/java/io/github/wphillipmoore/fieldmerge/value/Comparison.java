package io.github.wphillipmoore.fieldmerge.value;

import io.github.wphillipmoore.fieldmerge.path.FieldSet;
import java.util.Objects;

/**
 * Result of comparing two typed values of the same schema.
 *
 * @param added paths present only in the right-hand value
 * @param modified paths present in both values with different contents
 * @param removed paths present only in the left-hand value
 */
public record Comparison(FieldSet added, FieldSet modified, FieldSet removed) {

  /** Validates that all sets are non-null. */
  public Comparison {
    Objects.requireNonNull(added, "added");
    Objects.requireNonNull(modified, "modified");
    Objects.requireNonNull(removed, "removed");
  }

  /** Returns true if the two values were structurally equal. */
  public boolean isSame() {
    return added.isEmpty() && modified.isEmpty() && removed.isEmpty();
  }

  /** Returns every path that differs, whichever way. */
  public FieldSet changed() {
    return added.union(modified).union(removed);
  }
}
