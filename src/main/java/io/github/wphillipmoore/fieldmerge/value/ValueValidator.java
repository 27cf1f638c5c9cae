package io.github.wphillipmoore.fieldmerge.value;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonNull;
import com.google.gson.JsonObject;
import io.github.wphillipmoore.fieldmerge.path.CanonicalJson;
import io.github.wphillipmoore.fieldmerge.path.FieldPath;
import io.github.wphillipmoore.fieldmerge.path.PathElement;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Checks JSON against a {@link TypeDef} and produces the cleaned copy a {@link TypedValue} holds.
 *
 * <p>Cleaning normalizes numbers and drops map fields whose value is JSON {@code null}: an
 * explicit null is the same as an absent field.
 */
final class ValueValidator {

  private ValueValidator() {}

  static JsonElement check(
      TypeDef type, JsonElement value, FieldPath path, List<ValidationIssue> issues) {
    if (type instanceof ScalarType scalar) {
      return checkScalar(scalar, value, path, issues);
    }
    if (type instanceof MapType map) {
      return checkMap(map, value, path, issues);
    }
    return checkList((ListType) type, value, path, issues);
  }

  private static JsonElement checkScalar(
      ScalarType scalar, JsonElement value, FieldPath path, List<ValidationIssue> issues) {
    if (!value.isJsonPrimitive() || !scalar.accepts(value.getAsJsonPrimitive())) {
      issues.add(mismatch(path, scalar.kind().name().toLowerCase(Locale.ROOT), value));
      return JsonNull.INSTANCE;
    }
    try {
      return CanonicalJson.normalize(value);
    } catch (NumberFormatException e) {
      issues.add(
          new ValidationIssue(
              ValidationReason.TYPE_MISMATCH,
              path,
              "number out of range: " + value.getAsJsonPrimitive().getAsString()));
      return JsonNull.INSTANCE;
    }
  }

  private static JsonElement checkMap(
      MapType map, JsonElement value, FieldPath path, List<ValidationIssue> issues) {
    if (!value.isJsonObject()) {
      issues.add(mismatch(path, "map", value));
      return JsonNull.INSTANCE;
    }
    JsonObject cleaned = new JsonObject();
    for (Map.Entry<String, JsonElement> entry : value.getAsJsonObject().entrySet()) {
      if (entry.getValue().isJsonNull()) {
        continue;
      }
      FieldPath fieldPath = path.append(new PathElement.FieldName(entry.getKey()));
      TypeDef fieldType = map.fieldType(entry.getKey());
      if (fieldType == null) {
        issues.add(
            new ValidationIssue(
                ValidationReason.UNKNOWN_FIELD,
                fieldPath,
                "field '" + entry.getKey() + "' is not declared"));
        continue;
      }
      cleaned.add(entry.getKey(), check(fieldType, entry.getValue(), fieldPath, issues));
    }
    return cleaned;
  }

  private static JsonElement checkList(
      ListType list, JsonElement value, FieldPath path, List<ValidationIssue> issues) {
    if (!value.isJsonArray()) {
      issues.add(mismatch(path, "list", value));
      return JsonNull.INSTANCE;
    }
    JsonArray cleaned = new JsonArray();
    Set<PathElement> seen = new HashSet<>();
    for (JsonElement item : value.getAsJsonArray()) {
      if (list.isAtomic()) {
        cleaned.add(check(list.elementType(), item, path, issues));
      } else if (list.isKeyed()) {
        checkKeyedItem(list, item, path, seen, cleaned, issues);
      } else {
        JsonElement scalar = checkScalar((ScalarType) list.elementType(), item, path, issues);
        if (!scalar.isJsonNull() && !seen.add(new PathElement.Value(scalar))) {
          issues.add(
              new ValidationIssue(
                  ValidationReason.DUPLICATE_VALUE,
                  path,
                  "value " + CanonicalJson.toJson(scalar) + " appears more than once"));
          continue;
        }
        cleaned.add(scalar);
      }
    }
    return cleaned;
  }

  private static void checkKeyedItem(
      ListType list,
      JsonElement item,
      FieldPath path,
      Set<PathElement> seen,
      JsonArray cleaned,
      List<ValidationIssue> issues) {
    if (!item.isJsonObject()) {
      issues.add(mismatch(path, "map", item));
      return;
    }
    JsonObject object = item.getAsJsonObject();
    for (String key : list.keys()) {
      JsonElement keyValue = object.get(key);
      if (keyValue == null || !keyValue.isJsonPrimitive()) {
        issues.add(
            new ValidationIssue(
                ValidationReason.MISSING_KEY,
                path,
                "item " + CanonicalJson.toJson(item) + " has no scalar key field '" + key + "'"));
        return;
      }
    }
    PathElement key = Items.elementOf(list, object);
    JsonElement checked = check(list.elementType(), object, path.append(key), issues);
    if (!seen.add(key)) {
      issues.add(
          new ValidationIssue(
              ValidationReason.DUPLICATE_KEY, path.append(key), "key appears more than once"));
      return;
    }
    cleaned.add(checked);
  }

  private static ValidationIssue mismatch(FieldPath path, String expected, JsonElement found) {
    return new ValidationIssue(
        ValidationReason.TYPE_MISMATCH,
        path,
        "expected " + expected + ", found " + CanonicalJson.toJson(found));
  }
}
