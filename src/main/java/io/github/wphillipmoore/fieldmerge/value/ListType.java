package io.github.wphillipmoore.fieldmerge.value;

import java.util.List;
import java.util.Objects;

/**
 * A list node.
 *
 * <p>Three shapes are supported:
 *
 * <ul>
 *   <li>keyed: {@link ElementRelationship#ASSOCIATIVE} with key fields; items are maps addressed by
 *       the values of their key fields;
 *   <li>set: {@link ElementRelationship#ASSOCIATIVE} without key fields; items are unique scalars
 *       addressed by value;
 *   <li>atomic: {@link ElementRelationship#ATOMIC}; the list is owned and replaced as one value.
 * </ul>
 *
 * @param elementType the item type, never null
 * @param relationship {@link ElementRelationship#ASSOCIATIVE} or {@link ElementRelationship#ATOMIC}
 * @param keys the key field names of a keyed list, empty otherwise
 */
public record ListType(TypeDef elementType, ElementRelationship relationship, List<String> keys)
    implements TypeDef {

  /** Validates the combination of relationship, keys and element type. */
  public ListType {
    Objects.requireNonNull(elementType, "elementType");
    Objects.requireNonNull(relationship, "relationship");
    keys = List.copyOf(Objects.requireNonNull(keys, "keys"));
    if (relationship == ElementRelationship.SEPARABLE) {
      throw new IllegalArgumentException("list relationship must be ASSOCIATIVE or ATOMIC");
    }
    if (relationship == ElementRelationship.ATOMIC && !keys.isEmpty()) {
      throw new IllegalArgumentException("atomic lists must not declare keys");
    }
    if (relationship == ElementRelationship.ASSOCIATIVE) {
      if (keys.isEmpty() && !(elementType instanceof ScalarType)) {
        throw new IllegalArgumentException("set-like lists must have scalar elements");
      }
      if (!keys.isEmpty() && !(elementType instanceof MapType)) {
        throw new IllegalArgumentException("keyed lists must have map elements");
      }
    }
  }

  /** Creates a keyed list of maps. */
  public static ListType keyed(MapType elementType, String... keys) {
    if (keys.length == 0) {
      throw new IllegalArgumentException("keyed lists need at least one key");
    }
    return new ListType(elementType, ElementRelationship.ASSOCIATIVE, List.of(keys));
  }

  /** Creates a set-like list of unique scalars. */
  public static ListType set(ScalarType elementType) {
    return new ListType(elementType, ElementRelationship.ASSOCIATIVE, List.of());
  }

  /** Creates an atomic list. */
  public static ListType atomic(TypeDef elementType) {
    return new ListType(elementType, ElementRelationship.ATOMIC, List.of());
  }

  @Override
  public boolean isAtomic() {
    return relationship == ElementRelationship.ATOMIC;
  }

  /** Returns true for a keyed list. */
  public boolean isKeyed() {
    return !keys.isEmpty();
  }

  /** Returns true for a set-like list. */
  public boolean isSet() {
    return relationship == ElementRelationship.ASSOCIATIVE && keys.isEmpty();
  }
}
