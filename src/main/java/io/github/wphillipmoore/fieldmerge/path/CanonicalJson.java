package io.github.wphillipmoore.fieldmerge.path;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonPrimitive;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Canonical forms of JSON values, shared by path elements and typed values.
 *
 * <p>Numbers are normalized to a {@link BigDecimal} without trailing zeros, so that {@code 1},
 * {@code 1.0} and {@code 1.00} are the same value. The canonical string form additionally sorts
 * object members by name, which makes it suitable as a total order over values.
 */
public final class CanonicalJson {

  private static final Gson GSON = new GsonBuilder().disableHtmlEscaping().create();

  private CanonicalJson() {}

  /**
   * Returns a deep copy of the element with every number normalized. Object member order is
   * preserved.
   *
   * @param element the element to normalize, must not be null
   * @return a normalized deep copy
   */
  public static JsonElement normalize(JsonElement element) {
    Objects.requireNonNull(element, "element");
    if (element.isJsonObject()) {
      JsonObject copy = new JsonObject();
      for (Map.Entry<String, JsonElement> entry : element.getAsJsonObject().entrySet()) {
        copy.add(entry.getKey(), normalize(entry.getValue()));
      }
      return copy;
    }
    if (element.isJsonArray()) {
      JsonArray copy = new JsonArray();
      for (JsonElement item : element.getAsJsonArray()) {
        copy.add(normalize(item));
      }
      return copy;
    }
    if (element.isJsonPrimitive() && element.getAsJsonPrimitive().isNumber()) {
      BigDecimal stripped = element.getAsJsonPrimitive().getAsBigDecimal().stripTrailingZeros();
      return new JsonPrimitive(new BigDecimal(stripped.toPlainString()));
    }
    return element.deepCopy();
  }

  /**
   * Returns a deep copy of the element with numbers normalized and object members sorted by name.
   *
   * @param element the element to sort, must not be null
   * @return a sorted, normalized deep copy
   */
  public static JsonElement sorted(JsonElement element) {
    Objects.requireNonNull(element, "element");
    if (element.isJsonObject()) {
      JsonObject source = element.getAsJsonObject();
      List<String> names = new ArrayList<>(source.keySet());
      Collections.sort(names);
      JsonObject copy = new JsonObject();
      for (String name : names) {
        copy.add(name, sorted(source.get(name)));
      }
      return copy;
    }
    if (element.isJsonArray()) {
      JsonArray copy = new JsonArray();
      for (JsonElement item : element.getAsJsonArray()) {
        copy.add(sorted(item));
      }
      return copy;
    }
    return normalize(element);
  }

  /**
   * Returns the canonical JSON text of the element: normalized numbers, sorted members, no
   * insignificant whitespace.
   *
   * @param element the element to render, must not be null
   * @return the canonical JSON text
   */
  public static String toCanonicalString(JsonElement element) {
    return GSON.toJson(sorted(element));
  }

  /**
   * Renders the element as compact JSON text without reordering members.
   *
   * @param element the element to render, must not be null
   * @return the JSON text
   */
  public static String toJson(JsonElement element) {
    return GSON.toJson(Objects.requireNonNull(element, "element"));
  }
}
