package io.github.wphillipmoore.fieldmerge.value;

/**
 * How the children of a map or list relate to ownership.
 *
 * <p>Maps are {@link #SEPARABLE} or {@link #ATOMIC}; lists are {@link #ASSOCIATIVE} or {@link
 * #ATOMIC}.
 */
public enum ElementRelationship {

  /** Map fields are owned individually. */
  SEPARABLE,

  /** List items are owned individually, addressed by key fields or by value. */
  ASSOCIATIVE,

  /** The container is owned as one value and replaced wholesale on merge. */
  ATOMIC
}
