package io.github.wphillipmoore.fieldmerge.value;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * A map node: named fields with their own types, and optionally an element type for fields not
 * declared by name.
 *
 * @param fields the declared fields by name, never null, unmodifiable
 * @param elementType the type of undeclared fields, or null if undeclared fields are rejected
 * @param relationship {@link ElementRelationship#SEPARABLE} or {@link ElementRelationship#ATOMIC}
 */
public record MapType(
    Map<String, TypeDef> fields,
    @Nullable TypeDef elementType,
    ElementRelationship relationship)
    implements TypeDef {

  /** Validates the relationship and defensively copies the fields. */
  public MapType {
    Objects.requireNonNull(fields, "fields");
    Objects.requireNonNull(relationship, "relationship");
    if (relationship == ElementRelationship.ASSOCIATIVE) {
      throw new IllegalArgumentException("map relationship must be SEPARABLE or ATOMIC");
    }
    fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
  }

  /** Returns a new builder for a separable map. */
  public static Builder builder() {
    return new Builder();
  }

  @Override
  public boolean isAtomic() {
    return relationship == ElementRelationship.ATOMIC;
  }

  /**
   * Returns the type of the named field: the declared type if there is one, else the element type.
   *
   * @param name the field name
   * @return the field type, or null if the field is not allowed
   */
  public @Nullable TypeDef fieldType(String name) {
    TypeDef declared = fields.get(name);
    return declared != null ? declared : elementType;
  }

  /** Builder for {@link MapType}. */
  public static final class Builder {

    private final Map<String, TypeDef> fields = new LinkedHashMap<>();
    private @Nullable TypeDef elementType;
    private ElementRelationship relationship = ElementRelationship.SEPARABLE;

    private Builder() {}

    /** Declares a named field. */
    public Builder field(String name, TypeDef type) {
      fields.put(Objects.requireNonNull(name, "name"), Objects.requireNonNull(type, "type"));
      return this;
    }

    /** Sets the type of undeclared fields. By default undeclared fields are rejected. */
    public Builder elementType(@Nullable TypeDef elementType) {
      this.elementType = elementType;
      return this;
    }

    /** Makes the map atomic. */
    public Builder atomic() {
      this.relationship = ElementRelationship.ATOMIC;
      return this;
    }

    /** Builds the map type. */
    public MapType build() {
      return new MapType(fields, elementType, relationship);
    }
  }
}
