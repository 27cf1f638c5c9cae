package io.github.wphillipmoore.fieldmerge.value;

/** Category of a {@link ValidationIssue}. */
public enum ValidationReason {

  /** The text is not valid JSON. */
  INVALID_JSON,

  /** A map field is neither declared nor covered by an element type. */
  UNKNOWN_FIELD,

  /** The JSON shape does not match the schema, or two values of different types were combined. */
  TYPE_MISMATCH,

  /** An item of a keyed list lacks a key field, or holds a non-scalar key. */
  MISSING_KEY,

  /** Two items of a keyed list share the same key. */
  DUPLICATE_KEY,

  /** Two items of a set-like list are equal. */
  DUPLICATE_VALUE
}
