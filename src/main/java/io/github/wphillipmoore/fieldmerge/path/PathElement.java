package io.github.wphillipmoore.fieldmerge.path;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import java.util.Map;
import java.util.Objects;
import java.util.StringJoiner;

/**
 * One step into a typed tree.
 *
 * <p>A path element is one of four cases:
 *
 * <ul>
 *   <li>{@link FieldName}: a map field, addressed by name;
 *   <li>{@link Key}: an item of a keyed list, addressed by the values of its key fields;
 *   <li>{@link Value}: an item of a set-like list, addressed by its own value;
 *   <li>{@link WholeValue}: the enclosing container itself, as opposed to its children.
 * </ul>
 *
 * <p>Elements are immutable and compare by structure. They are totally ordered: first by case in
 * the order listed above, then by payload.
 *
 * <p>The serialized form used for persisted field sets is {@code f:<name>}, {@code k:<json
 * object>}, {@code v:<json value>} or {@code .}, with JSON payloads in canonical form.
 */
public sealed interface PathElement extends Comparable<PathElement>
    permits PathElement.FieldName, PathElement.Key, PathElement.Value, PathElement.WholeValue {

  /** The single {@link WholeValue} instance. */
  WholeValue WHOLE_VALUE = new WholeValue();

  /** Position of this element's case in the ordering of cases. */
  int kindOrder();

  /** Returns the serialized form of this element. */
  String serialize();

  @Override
  default int compareTo(PathElement other) {
    int byKind = Integer.compare(kindOrder(), other.kindOrder());
    if (byKind != 0) {
      return byKind;
    }
    if (this instanceof FieldName name) {
      return name.name().compareTo(((FieldName) other).name());
    }
    return serialize().compareTo(other.serialize());
  }

  /**
   * Parses an element from its serialized form.
   *
   * @param serialized the serialized element, must not be null
   * @return the parsed element
   * @throws IllegalArgumentException if the text is not a serialized path element
   */
  static PathElement parse(String serialized) {
    Objects.requireNonNull(serialized, "serialized");
    if (".".equals(serialized)) {
      return WHOLE_VALUE;
    }
    if (serialized.startsWith("f:")) {
      return new FieldName(serialized.substring(2));
    }
    if (serialized.startsWith("k:")) {
      JsonElement fields = parsePayload(serialized);
      if (!fields.isJsonObject()) {
        throw new IllegalArgumentException("Key element must hold a JSON object: " + serialized);
      }
      return new Key(fields.getAsJsonObject());
    }
    if (serialized.startsWith("v:")) {
      return new Value(parsePayload(serialized));
    }
    throw new IllegalArgumentException("Unknown path element: " + serialized);
  }

  private static JsonElement parsePayload(String serialized) {
    try {
      return JsonParser.parseString(serialized.substring(2));
    } catch (JsonParseException e) {
      throw new IllegalArgumentException("Invalid JSON in path element: " + serialized, e);
    }
  }

  /**
   * A map field.
   *
   * @param name the field name, never null
   */
  record FieldName(String name) implements PathElement {

    /** Validates that the name is non-null. */
    public FieldName {
      Objects.requireNonNull(name, "name");
    }

    @Override
    public int kindOrder() {
      return 0;
    }

    @Override
    public String serialize() {
      return "f:" + name;
    }

    @Override
    public String toString() {
      return "." + name;
    }
  }

  /**
   * A keyed list item. The key fields are held sorted by name with normalized values.
   *
   * @param fields the key field values, never null or empty, scalar values only
   */
  record Key(JsonObject fields) implements PathElement {

    /** Validates the key fields and stores a sorted, normalized copy. */
    public Key {
      Objects.requireNonNull(fields, "fields");
      if (fields.size() == 0) {
        throw new IllegalArgumentException("fields must not be empty");
      }
      for (Map.Entry<String, JsonElement> entry : fields.entrySet()) {
        JsonElement value = entry.getValue();
        if (value.isJsonObject() || value.isJsonArray()) {
          throw new IllegalArgumentException("key field must be a scalar: " + entry.getKey());
        }
      }
      fields = CanonicalJson.sorted(fields).getAsJsonObject();
    }

    /** Returns a copy of the key fields. */
    @Override
    public JsonObject fields() {
      return fields.deepCopy();
    }

    @Override
    public int kindOrder() {
      return 1;
    }

    @Override
    public String serialize() {
      return "k:" + CanonicalJson.toCanonicalString(fields);
    }

    @Override
    public String toString() {
      StringJoiner joiner = new StringJoiner(",", "[", "]");
      for (Map.Entry<String, JsonElement> entry : fields.entrySet()) {
        joiner.add(entry.getKey() + "=" + CanonicalJson.toCanonicalString(entry.getValue()));
      }
      return joiner.toString();
    }
  }

  /**
   * A set-like list item, addressed by value.
   *
   * @param value the item value, never null
   */
  record Value(JsonElement value) implements PathElement {

    /** Stores a normalized copy of the value. */
    public Value {
      Objects.requireNonNull(value, "value");
      value = CanonicalJson.sorted(value);
    }

    /** Returns a copy of the item value. */
    @Override
    public JsonElement value() {
      return value.deepCopy();
    }

    @Override
    public int kindOrder() {
      return 2;
    }

    @Override
    public String serialize() {
      return "v:" + CanonicalJson.toCanonicalString(value);
    }

    @Override
    public String toString() {
      return "[=" + CanonicalJson.toCanonicalString(value) + "]";
    }
  }

  /** The enclosing container as a whole. Use {@link PathElement#WHOLE_VALUE}. */
  record WholeValue() implements PathElement {

    @Override
    public int kindOrder() {
      return 3;
    }

    @Override
    public String serialize() {
      return ".";
    }

    @Override
    public String toString() {
      return "[.]";
    }
  }
}
