package io.github.wphillipmoore.fieldmerge.merge;

import io.github.wphillipmoore.fieldmerge.managed.ManagedFields;
import io.github.wphillipmoore.fieldmerge.value.TypedValue;
import java.util.Objects;

/**
 * Outcome of a successful merge. Both parts belong together: a caller persists both or neither.
 *
 * @param object the merged object, never null
 * @param managed the managed fields after the merge, never null
 */
public record MergeResult(TypedValue object, ManagedFields managed) {

  /** Validates that both fields are non-null. */
  public MergeResult {
    Objects.requireNonNull(object, "object");
    Objects.requireNonNull(managed, "managed");
  }
}
