package io.github.wphillipmoore.fieldmerge.exception;

/**
 * Base exception for all merge engine errors.
 *
 * <p>This is an unchecked exception hierarchy. All merge outcomes reported as errors extend this
 * sealed class. Malformed input is reported separately, by {@link
 * io.github.wphillipmoore.fieldmerge.value.ValidationException}.
 */
public sealed class FieldMergeException extends RuntimeException permits ConflictException {

  /** Creates an exception with the given message. */
  public FieldMergeException(String message) {
    super(message);
  }

  /** Creates an exception with the given message and cause. */
  public FieldMergeException(String message, Throwable cause) {
    super(message, cause);
  }
}
