package io.github.wphillipmoore.fieldmerge.value;

/**
 * Schema of one node of a typed tree.
 *
 * <p>Schemas are built programmatically:
 *
 * <pre>{@code
 * MapType deployment = MapType.builder()
 *     .field("replicas", TypeDef.numeric())
 *     .field("labels", MapType.builder().elementType(TypeDef.string()).build())
 *     .field("ports", ListType.keyed(port, "port"))
 *     .build();
 * }</pre>
 */
public sealed interface TypeDef permits ScalarType, MapType, ListType {

  /** Returns true if this node is owned and merged as a single value. */
  boolean isAtomic();

  /** Returns the numeric scalar type. */
  static ScalarType numeric() {
    return ScalarType.NUMERIC;
  }

  /** Returns the string scalar type. */
  static ScalarType string() {
    return ScalarType.STRING;
  }

  /** Returns the boolean scalar type. */
  static ScalarType bool() {
    return ScalarType.BOOLEAN;
  }

  /** Returns the scalar type that accepts any JSON primitive. */
  static ScalarType untyped() {
    return ScalarType.UNTYPED;
  }
}
