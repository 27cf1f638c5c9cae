package io.github.wphillipmoore.fieldmerge.value;

import java.util.List;
import java.util.Objects;
import java.util.StringJoiner;

/**
 * Raised when a value does not conform to its schema, or when values of different schemas are
 * combined.
 *
 * <p>Contains one or more {@link ValidationIssue} instances. The merge engine never catches this
 * exception; it reaches the caller unchanged.
 *
 * <p>This exception extends {@link RuntimeException} directly, <em>not</em> {@code
 * FieldMergeException}, because it describes malformed input rather than a merge outcome.
 */
public final class ValidationException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  private final List<ValidationIssue> issues;

  /**
   * Creates a validation exception with an auto-generated message.
   *
   * @param issues the issues found, must not be null or empty
   */
  public ValidationException(List<ValidationIssue> issues) {
    super(buildMessage(validateIssues(issues)));
    this.issues = List.copyOf(issues);
  }

  /**
   * Creates a validation exception with an auto-generated message and a cause.
   *
   * @param issues the issues found, must not be null or empty
   * @param cause the underlying cause
   */
  public ValidationException(List<ValidationIssue> issues, Throwable cause) {
    super(buildMessage(validateIssues(issues)), cause);
    this.issues = List.copyOf(issues);
  }

  /**
   * Returns the issues that caused this exception.
   *
   * @return unmodifiable list of issues, never empty
   */
  public List<ValidationIssue> getIssues() {
    return issues;
  }

  private static List<ValidationIssue> validateIssues(List<ValidationIssue> issues) {
    Objects.requireNonNull(issues, "issues");
    if (issues.isEmpty()) {
      throw new IllegalArgumentException("issues must not be empty");
    }
    return issues;
  }

  private static String buildMessage(List<ValidationIssue> issues) {
    StringBuilder sb = new StringBuilder();
    sb.append("Validation failed with ").append(issues.size()).append(" issue(s):");
    for (ValidationIssue issue : issues) {
      sb.append('\n');
      StringJoiner joiner = new StringJoiner(" | ");
      joiner.add("reason=" + issue.reason());
      joiner.add("path=" + issue.path());
      joiner.add("detail=" + issue.detail());
      sb.append(joiner);
    }
    return sb.toString();
  }
}
