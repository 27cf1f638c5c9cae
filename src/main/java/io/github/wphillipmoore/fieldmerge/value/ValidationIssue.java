package io.github.wphillipmoore.fieldmerge.value;

import io.github.wphillipmoore.fieldmerge.path.FieldPath;
import java.util.Objects;

/**
 * Single problem found while checking a value against its schema.
 *
 * @param reason category of the problem, never null
 * @param path where the problem was found, never null (the root path for document-level problems)
 * @param detail human-readable description, never null
 */
public record ValidationIssue(ValidationReason reason, FieldPath path, String detail) {

  /** Validates that all fields are non-null. */
  public ValidationIssue {
    Objects.requireNonNull(reason, "reason");
    Objects.requireNonNull(path, "path");
    Objects.requireNonNull(detail, "detail");
  }
}
