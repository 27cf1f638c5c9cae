package io.github.wphillipmoore.fieldmerge.managed;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import com.google.gson.reflect.TypeToken;
import io.github.wphillipmoore.fieldmerge.path.FieldPath;
import io.github.wphillipmoore.fieldmerge.path.FieldSet;
import java.lang.reflect.Type;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * JSON form of {@link ManagedFields}, meant to be stored next to the object it describes.
 *
 * <pre>{@code
 * {
 *   "controller": {"apiVersion": "v1", "applied": false, "fields": [["f:bool"]]},
 *   "operator": {
 *     "apiVersion": "v1",
 *     "applied": true,
 *     "fields": [["f:spec", "."], ["f:spec", "f:replicas"]]
 *   }
 * }
 * }</pre>
 *
 * <p>Each path is the list of its serialized elements (see {@link
 * io.github.wphillipmoore.fieldmerge.path.PathElement}). Managers and paths are written in sorted
 * order, so equal snapshots always produce identical text.
 */
public final class ManagedFieldsCodec {

  private static final Gson GSON = new GsonBuilder().disableHtmlEscaping().create();
  private static final Type MAP_TYPE = new TypeToken<LinkedHashMap<String, Entry>>() {}.getType();

  private ManagedFieldsCodec() {}

  /** Persisted shape of one manager's entry. */
  private record Entry(
      @Nullable String apiVersion, boolean applied, @Nullable List<List<String>> fields) {}

  /**
   * Serializes managed fields to JSON.
   *
   * @param managed the managed fields, must not be null
   * @return the JSON text
   */
  public static String toJson(ManagedFields managed) {
    Objects.requireNonNull(managed, "managed");
    Map<String, Entry> document = new LinkedHashMap<>();
    for (Map.Entry<String, VersionedSet> entry : managed.entries().entrySet()) {
      VersionedSet set = entry.getValue();
      List<List<String>> fields = new ArrayList<>(set.fields().size());
      for (FieldPath path : set.fields()) {
        fields.add(path.serialize());
      }
      document.put(entry.getKey(), new Entry(set.apiVersion(), set.applied(), fields));
    }
    return GSON.toJson(document, MAP_TYPE);
  }

  /**
   * Parses managed fields from JSON. Entries without fields are dropped.
   *
   * @param json the JSON text, must not be null or empty
   * @return the managed fields
   * @throws NullPointerException if json is null
   * @throws IllegalArgumentException if json is empty, not valid JSON, or not in the managed
   *     fields layout
   */
  public static ManagedFields fromJson(String json) {
    Objects.requireNonNull(json, "json");
    if (json.isEmpty()) {
      throw new IllegalArgumentException("json must not be empty");
    }
    Map<String, Entry> document;
    try {
      document = GSON.fromJson(json, MAP_TYPE);
    } catch (JsonParseException e) {
      throw new IllegalArgumentException("json is not a managed fields document", e);
    }
    if (document == null) {
      throw new IllegalArgumentException("json must not be empty");
    }
    Map<String, VersionedSet> entries = new LinkedHashMap<>();
    for (Map.Entry<String, Entry> entry : document.entrySet()) {
      entries.put(entry.getKey(), toVersionedSet(entry.getKey(), entry.getValue()));
    }
    return ManagedFields.of(entries);
  }

  private static VersionedSet toVersionedSet(String manager, @Nullable Entry entry) {
    if (entry == null || entry.apiVersion() == null) {
      throw new IllegalArgumentException("entry for manager '" + manager + "' has no apiVersion");
    }
    FieldSet.Builder fields = FieldSet.builder();
    if (entry.fields() != null) {
      for (List<String> path : entry.fields()) {
        if (path == null) {
          throw new IllegalArgumentException("entry for manager '" + manager + "' has a null path");
        }
        if (path.contains(null)) {
          throw new IllegalArgumentException(
              "entry for manager '" + manager + "' has a null path element");
        }
        fields.insert(FieldPath.parse(path));
      }
    }
    return new VersionedSet(fields.build(), entry.apiVersion(), entry.applied());
  }
}
