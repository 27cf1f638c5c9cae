package io.github.wphillipmoore.fieldmerge.value;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import io.github.wphillipmoore.fieldmerge.path.FieldPath;
import io.github.wphillipmoore.fieldmerge.path.FieldSet;
import io.github.wphillipmoore.fieldmerge.path.PathElement;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import org.jspecify.annotations.Nullable;

/** Path enumeration and structural comparison over cleaned JSON trees. */
final class ValueWalker {

  private ValueWalker() {}

  /**
   * Adds every path of the value below {@code prefix}: one path per leaf or atomic node, and a
   * {@link PathElement#WHOLE_VALUE} marker for every non-atomic container except the root.
   */
  static void collect(TypeDef type, JsonElement value, FieldPath prefix, FieldSet.Builder out) {
    if (type.isAtomic()) {
      out.insert(prefix);
      return;
    }
    if (!prefix.isEmpty()) {
      out.insert(prefix.append(PathElement.WHOLE_VALUE));
    }
    if (type instanceof MapType map) {
      for (Map.Entry<String, JsonElement> entry : value.getAsJsonObject().entrySet()) {
        FieldPath fieldPath = prefix.append(new PathElement.FieldName(entry.getKey()));
        collect(map.fieldType(entry.getKey()), entry.getValue(), fieldPath, out);
      }
      return;
    }
    ListType list = (ListType) type;
    for (JsonElement item : value.getAsJsonArray()) {
      PathElement element = Items.elementOf(list, item);
      if (list.isKeyed()) {
        collect(list.elementType(), item, prefix.append(element), out);
      } else {
        out.insert(prefix.append(element));
      }
    }
  }

  /** Records how {@code right} differs from {@code left} below {@code prefix}. */
  static void compare(
      TypeDef type,
      @Nullable JsonElement left,
      @Nullable JsonElement right,
      FieldPath prefix,
      FieldSet.Builder added,
      FieldSet.Builder modified,
      FieldSet.Builder removed) {
    if (left == null && right == null) {
      return;
    }
    if (left == null) {
      collect(type, right, prefix, added);
      return;
    }
    if (right == null) {
      collect(type, left, prefix, removed);
      return;
    }
    if (type.isAtomic()) {
      if (!left.equals(right)) {
        modified.insert(prefix);
      }
      return;
    }
    if (type instanceof MapType map) {
      JsonObject leftMap = left.getAsJsonObject();
      JsonObject rightMap = right.getAsJsonObject();
      Set<String> names = new LinkedHashSet<>(leftMap.keySet());
      names.addAll(rightMap.keySet());
      for (String name : names) {
        compare(
            map.fieldType(name),
            leftMap.get(name),
            rightMap.get(name),
            prefix.append(new PathElement.FieldName(name)),
            added,
            modified,
            removed);
      }
      return;
    }
    ListType list = (ListType) type;
    Map<PathElement, JsonElement> leftItems = Items.index(list, left.getAsJsonArray());
    Map<PathElement, JsonElement> rightItems = Items.index(list, right.getAsJsonArray());
    Set<PathElement> elements = new LinkedHashSet<>(leftItems.keySet());
    elements.addAll(rightItems.keySet());
    for (PathElement element : elements) {
      if (list.isKeyed()) {
        compare(
            list.elementType(),
            leftItems.get(element),
            rightItems.get(element),
            prefix.append(element),
            added,
            modified,
            removed);
      } else if (!leftItems.containsKey(element)) {
        added.insert(prefix.append(element));
      } else if (!rightItems.containsKey(element)) {
        removed.insert(prefix.append(element));
      }
    }
  }

  /** Merges {@code overrides} onto {@code base}; values of {@code overrides} win. */
  static @Nullable JsonElement merge(
      TypeDef type, @Nullable JsonElement base, @Nullable JsonElement overrides) {
    if (overrides == null) {
      return base == null ? null : base.deepCopy();
    }
    if (base == null || type.isAtomic()) {
      return overrides.deepCopy();
    }
    if (type instanceof MapType map) {
      JsonObject result = base.getAsJsonObject().deepCopy();
      JsonObject baseMap = base.getAsJsonObject();
      for (Map.Entry<String, JsonElement> entry : overrides.getAsJsonObject().entrySet()) {
        String name = entry.getKey();
        result.add(name, merge(map.fieldType(name), baseMap.get(name), entry.getValue()));
      }
      return result;
    }
    ListType list = (ListType) type;
    Map<PathElement, JsonElement> overrideItems = Items.index(list, overrides.getAsJsonArray());
    Set<PathElement> seen = new LinkedHashSet<>();
    JsonArray result = new JsonArray();
    for (JsonElement item : base.getAsJsonArray()) {
      PathElement element = Items.elementOf(list, item);
      seen.add(element);
      JsonElement override = overrideItems.get(element);
      result.add(list.isKeyed() ? merge(list.elementType(), item, override) : item.deepCopy());
    }
    for (Map.Entry<PathElement, JsonElement> entry : overrideItems.entrySet()) {
      if (!seen.contains(entry.getKey())) {
        result.add(entry.getValue().deepCopy());
      }
    }
    return result;
  }
}
