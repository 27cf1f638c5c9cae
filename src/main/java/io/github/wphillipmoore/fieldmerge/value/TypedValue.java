package io.github.wphillipmoore.fieldmerge.value;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import io.github.wphillipmoore.fieldmerge.path.CanonicalJson;
import io.github.wphillipmoore.fieldmerge.path.FieldPath;
import io.github.wphillipmoore.fieldmerge.path.FieldSet;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * An immutable, schema-checked object: a {@link MapType} and a JSON tree conforming to it.
 *
 * <p>Construction validates the JSON, normalizes numbers and drops {@code null} fields. Every
 * accessor that exposes JSON returns a copy, so a typed value can be shared freely.
 *
 * <pre>{@code
 * TypedValue live = TypedValue.fromJson(schema, "{\"numeric\": 1, \"string\": \"a\"}");
 * FieldSet owned = live.toFieldSet();
 * }</pre>
 */
public final class TypedValue {

  private final MapType type;
  private final JsonObject root;

  private TypedValue(MapType type, JsonObject root) {
    this.type = type;
    this.root = root;
  }

  /**
   * Creates a typed value from a JSON tree.
   *
   * @param type the schema of the object, must be a {@link MapType}
   * @param value the JSON tree; JSON null stands for the empty object
   * @return the typed value
   * @throws IllegalArgumentException if the type is not a map type
   * @throws ValidationException if the tree does not conform to the type
   */
  public static TypedValue of(TypeDef type, JsonElement value) {
    MapType mapType = requireMapType(type);
    Objects.requireNonNull(value, "value");
    if (value.isJsonNull()) {
      return empty(mapType);
    }
    List<ValidationIssue> issues = new ArrayList<>();
    JsonElement cleaned = ValueValidator.check(mapType, value, FieldPath.root(), issues);
    if (!issues.isEmpty()) {
      throw new ValidationException(issues);
    }
    return new TypedValue(mapType, cleaned.getAsJsonObject());
  }

  /**
   * Parses a typed value from JSON text. Blank text stands for the empty object.
   *
   * @param type the schema of the object, must be a {@link MapType}
   * @param json the JSON text, must not be null
   * @return the typed value
   * @throws ValidationException if the text is not JSON or does not conform to the type
   */
  public static TypedValue fromJson(TypeDef type, String json) {
    requireMapType(type);
    Objects.requireNonNull(json, "json");
    if (json.isBlank()) {
      return empty(type);
    }
    JsonElement parsed;
    try {
      parsed = JsonParser.parseString(json);
    } catch (JsonParseException e) {
      throw new ValidationException(
          List.of(
              new ValidationIssue(
                  ValidationReason.INVALID_JSON, FieldPath.root(), String.valueOf(e.getMessage()))),
          e);
    }
    return of(type, parsed);
  }

  /**
   * Returns the empty object of the given type.
   *
   * @param type the schema of the object, must be a {@link MapType}
   * @return the empty typed value
   */
  public static TypedValue empty(TypeDef type) {
    return new TypedValue(requireMapType(type), new JsonObject());
  }

  /** Returns the schema of this value. */
  public MapType type() {
    return type;
  }

  /** Returns a copy of the JSON tree. */
  public JsonObject asJson() {
    return root.deepCopy();
  }

  /** Returns the compact JSON text of this value. */
  public String toJson() {
    return CanonicalJson.toJson(root);
  }

  /** Returns true if the object holds no fields. */
  public boolean isEmpty() {
    return root.size() == 0;
  }

  /**
   * Returns every path present in this value: each leaf and atomic node, plus a whole-value
   * marker for each non-atomic container below the root.
   */
  public FieldSet toFieldSet() {
    FieldSet.Builder builder = FieldSet.builder();
    ValueWalker.collect(type, root, FieldPath.root(), builder);
    return builder.build();
  }

  /**
   * Compares this value (left) with another value of the same schema (right).
   *
   * @param other the right-hand value, must not be null
   * @return the paths added, modified and removed going from this value to {@code other}
   * @throws ValidationException if the schemas differ
   */
  public Comparison compare(TypedValue other) {
    requireSameType(other);
    FieldSet.Builder added = FieldSet.builder();
    FieldSet.Builder modified = FieldSet.builder();
    FieldSet.Builder removed = FieldSet.builder();
    ValueWalker.compare(type, root, other.root, FieldPath.root(), added, modified, removed);
    return new Comparison(added.build(), modified.build(), removed.build());
  }

  /**
   * Returns this value with {@code overrides} merged on top. Every path of {@code overrides} takes
   * its value from {@code overrides}; all other paths keep their value from this one. Keyed list
   * items are merged by key and set items are unioned; atomic nodes are replaced.
   *
   * @param overrides the value to merge on top, must not be null
   * @return the merged value
   * @throws ValidationException if the schemas differ
   */
  public TypedValue merge(TypedValue overrides) {
    requireSameType(overrides);
    return new TypedValue(type, ValueWalker.merge(type, root, overrides.root).getAsJsonObject());
  }

  /**
   * Returns this value without the given paths. Paths that are not present are ignored.
   *
   * @param paths the paths to remove, must not be null
   * @return the reduced value
   */
  public TypedValue removeItems(FieldSet paths) {
    Objects.requireNonNull(paths, "paths");
    if (paths.isEmpty()) {
      return this;
    }
    JsonObject copy = root.deepCopy();
    ItemRemover.remove(type, copy, paths);
    return new TypedValue(type, copy);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    return o instanceof TypedValue other && type.equals(other.type) && root.equals(other.root);
  }

  @Override
  public int hashCode() {
    return Objects.hash(type, root);
  }

  @Override
  public String toString() {
    return toJson();
  }

  private void requireSameType(TypedValue other) {
    Objects.requireNonNull(other, "other");
    if (!type.equals(other.type)) {
      throw new ValidationException(
          List.of(
              new ValidationIssue(
                  ValidationReason.TYPE_MISMATCH,
                  FieldPath.root(),
                  "values of different schemas cannot be combined")));
    }
  }

  private static MapType requireMapType(TypeDef type) {
    Objects.requireNonNull(type, "type");
    if (!(type instanceof MapType mapType)) {
      throw new IllegalArgumentException("the root type of an object must be a map type");
    }
    return mapType;
  }
}
