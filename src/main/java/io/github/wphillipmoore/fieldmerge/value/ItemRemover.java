package io.github.wphillipmoore.fieldmerge.value;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import io.github.wphillipmoore.fieldmerge.path.FieldPath;
import io.github.wphillipmoore.fieldmerge.path.FieldSet;
import io.github.wphillipmoore.fieldmerge.path.PathElement;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * Removes paths from a cleaned JSON tree in place.
 *
 * <p>Leaf paths are removed outright, except key fields of keyed list items, which only go away
 * with their item. A {@link PathElement#WHOLE_VALUE} marker removes its container only if nothing
 * but key fields is left in it; markers are processed after leaves, deepest first.
 */
final class ItemRemover {

  private ItemRemover() {}

  /** A node of the tree with its type, and the keyed list holding it when it is a keyed item. */
  private record Location(TypeDef type, JsonElement node, @Nullable ListType enclosingList) {}

  static void remove(TypeDef rootType, JsonObject root, FieldSet paths) {
    List<FieldPath> containers = new ArrayList<>();
    for (FieldPath path : paths) {
      if (path.isEmpty()) {
        continue;
      }
      if (path.isWholeValueMarker()) {
        containers.add(path.parent());
        continue;
      }
      Location parent = locate(rootType, root, path.parent());
      if (parent != null) {
        removeChild(parent, path.lastElement());
      }
    }
    containers.sort(Comparator.comparingInt(FieldPath::size).reversed());
    for (FieldPath container : containers) {
      if (container.isEmpty()) {
        continue;
      }
      Location location = locate(rootType, root, container);
      if (location == null || !isEmpty(location)) {
        continue;
      }
      Location parent = locate(rootType, root, container.parent());
      if (parent != null) {
        removeChild(parent, container.lastElement());
      }
    }
  }

  private static @Nullable Location locate(TypeDef rootType, JsonElement root, FieldPath path) {
    Location current = new Location(rootType, root, null);
    for (PathElement element : path.elements()) {
      current = step(current, element);
      if (current == null) {
        return null;
      }
    }
    return current;
  }

  private static @Nullable Location step(Location location, PathElement element) {
    JsonElement node = location.node();
    if (location.type() instanceof MapType map
        && element instanceof PathElement.FieldName field
        && node.isJsonObject()) {
      JsonElement child = node.getAsJsonObject().get(field.name());
      TypeDef childType = map.fieldType(field.name());
      if (child == null || childType == null) {
        return null;
      }
      return new Location(childType, child, null);
    }
    if (location.type() instanceof ListType list && !list.isAtomic() && node.isJsonArray()) {
      JsonArray array = node.getAsJsonArray();
      int index = Items.indexOf(list, array, element);
      if (index < 0) {
        return null;
      }
      return new Location(list.elementType(), array.get(index), list.isKeyed() ? list : null);
    }
    return null;
  }

  private static void removeChild(Location parent, PathElement element) {
    JsonElement node = parent.node();
    if (element instanceof PathElement.FieldName field && node.isJsonObject()) {
      ListType enclosing = parent.enclosingList();
      if (enclosing != null && enclosing.keys().contains(field.name())) {
        return;
      }
      node.getAsJsonObject().remove(field.name());
      return;
    }
    if (parent.type() instanceof ListType list && node.isJsonArray()) {
      int index = Items.indexOf(list, node.getAsJsonArray(), element);
      if (index >= 0) {
        node.getAsJsonArray().remove(index);
      }
    }
  }

  private static boolean isEmpty(Location location) {
    JsonElement node = location.node();
    if (node.isJsonArray()) {
      return node.getAsJsonArray().isEmpty();
    }
    if (!node.isJsonObject()) {
      return false;
    }
    ListType enclosing = location.enclosingList();
    for (String name : node.getAsJsonObject().keySet()) {
      if (enclosing == null || !enclosing.keys().contains(name)) {
        return false;
      }
    }
    return true;
  }
}
