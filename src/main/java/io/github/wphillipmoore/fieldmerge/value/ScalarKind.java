package io.github.wphillipmoore.fieldmerge.value;

/** The kind of JSON primitive a {@link ScalarType} accepts. */
public enum ScalarKind {

  /** A JSON number. */
  NUMERIC,

  /** A JSON string. */
  STRING,

  /** A JSON boolean. */
  BOOLEAN,

  /** Any JSON primitive. */
  UNTYPED
}
