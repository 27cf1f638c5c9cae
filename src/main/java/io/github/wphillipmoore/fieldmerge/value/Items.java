package io.github.wphillipmoore.fieldmerge.value;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import io.github.wphillipmoore.fieldmerge.path.PathElement;
import java.util.LinkedHashMap;
import java.util.Map;

/** Addressing of list items by {@link PathElement}. */
final class Items {

  private Items() {}

  /** Returns the element addressing the item: its key for keyed lists, its value for sets. */
  static PathElement elementOf(ListType list, JsonElement item) {
    if (list.isKeyed()) {
      JsonObject source = item.getAsJsonObject();
      JsonObject key = new JsonObject();
      for (String name : list.keys()) {
        key.add(name, source.get(name));
      }
      return new PathElement.Key(key);
    }
    return new PathElement.Value(item);
  }

  /** Returns the items of the array by element, in array order. */
  static Map<PathElement, JsonElement> index(ListType list, JsonArray array) {
    Map<PathElement, JsonElement> items = new LinkedHashMap<>();
    for (JsonElement item : array) {
      items.put(elementOf(list, item), item);
    }
    return items;
  }

  /** Returns the position of the addressed item, or -1 if the array does not hold it. */
  static int indexOf(ListType list, JsonArray array, PathElement element) {
    for (int i = 0; i < array.size(); i++) {
      if (elementOf(list, array.get(i)).equals(element)) {
        return i;
      }
    }
    return -1;
  }
}
