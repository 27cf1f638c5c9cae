package io.github.wphillipmoore.fieldmerge.merge;

import io.github.wphillipmoore.fieldmerge.path.FieldPath;
import java.util.Objects;

/**
 * A path an apply would change while another manager owns it.
 *
 * @param manager the manager owning the path, never null
 * @param path the contested path, never null
 */
public record Conflict(String manager, FieldPath path) {

  /** Validates that both fields are non-null. */
  public Conflict {
    Objects.requireNonNull(manager, "manager");
    Objects.requireNonNull(path, "path");
  }
}
