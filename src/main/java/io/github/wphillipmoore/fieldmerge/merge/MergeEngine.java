package io.github.wphillipmoore.fieldmerge.merge;

import io.github.wphillipmoore.fieldmerge.exception.ConflictException;
import io.github.wphillipmoore.fieldmerge.managed.ManagedFields;
import io.github.wphillipmoore.fieldmerge.managed.VersionedSet;
import io.github.wphillipmoore.fieldmerge.path.FieldPath;
import io.github.wphillipmoore.fieldmerge.path.FieldSet;
import io.github.wphillipmoore.fieldmerge.value.Comparison;
import io.github.wphillipmoore.fieldmerge.value.TypedValue;
import io.github.wphillipmoore.fieldmerge.value.ValidationException;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jspecify.annotations.Nullable;

/**
 * Merges a manager's write into a shared object and keeps track of who owns which field.
 *
 * <p>Each call is a pure function of its arguments: it reads the live object and its managed
 * fields and returns a new object and new managed fields, or throws. Nothing the caller passes in
 * is modified, and the engine keeps no state between calls, so one instance can serve any number
 * of threads.
 *
 * <pre>{@code
 * MergeEngine engine = new MergeEngine.Builder().build();
 * MergeResult result = engine.apply(live, managed, config, "operator", "v1");
 * store(result.object(), result.managed());
 * }</pre>
 *
 * <p>Malformed input surfaces as {@link ValidationException} from the typed values, unchanged.
 */
public final class MergeEngine {

  private static final Logger LOGGER = LogManager.getLogger(MergeEngine.class);

  private final boolean removeDanglingFields;

  private MergeEngine(Builder builder) {
    this.removeDanglingFields = builder.removeDanglingFields;
  }

  /** Returns whether fields withdrawn by an applier and owned by nobody are removed. */
  public boolean isRemoveDanglingFields() {
    return removeDanglingFields;
  }

  /**
   * Writes {@code incoming} unconditionally. See {@link MergeOperation#UPDATE}.
   *
   * @param live the current object, or null if it does not exist yet
   * @param liveManaged the current managed fields
   * @param incoming the values written
   * @param manager the writing manager
   * @param apiVersion the schema version the write was made against
   * @return the merged object and managed fields
   */
  public MergeResult update(
      @Nullable TypedValue live,
      ManagedFields liveManaged,
      TypedValue incoming,
      String manager,
      String apiVersion) {
    return merge(MergeOperation.UPDATE, live, liveManaged, incoming, manager, apiVersion);
  }

  /**
   * Applies the configuration {@code incoming}. See {@link MergeOperation#APPLY}.
   *
   * @param live the current object, or null if it does not exist yet
   * @param liveManaged the current managed fields
   * @param incoming the declared configuration
   * @param manager the applying manager
   * @param apiVersion the schema version the configuration was written against
   * @return the merged object and managed fields
   * @throws ConflictException if the configuration changes fields other managers own
   */
  public MergeResult apply(
      @Nullable TypedValue live,
      ManagedFields liveManaged,
      TypedValue incoming,
      String manager,
      String apiVersion) {
    return merge(MergeOperation.APPLY, live, liveManaged, incoming, manager, apiVersion);
  }

  /**
   * Applies the configuration {@code incoming}, taking over conflicting fields. See {@link
   * MergeOperation#FORCE_APPLY}.
   *
   * @param live the current object, or null if it does not exist yet
   * @param liveManaged the current managed fields
   * @param incoming the declared configuration
   * @param manager the applying manager
   * @param apiVersion the schema version the configuration was written against
   * @return the merged object and managed fields
   */
  public MergeResult forceApply(
      @Nullable TypedValue live,
      ManagedFields liveManaged,
      TypedValue incoming,
      String manager,
      String apiVersion) {
    return merge(MergeOperation.FORCE_APPLY, live, liveManaged, incoming, manager, apiVersion);
  }

  /**
   * Runs the given operation.
   *
   * @param operation the kind of write
   * @param live the current object, or null if it does not exist yet
   * @param liveManaged the current managed fields
   * @param incoming the written values or declared configuration
   * @param manager the acting manager, must not be empty
   * @param apiVersion the schema version of {@code incoming}, must not be blank
   * @return the merged object and managed fields
   * @throws ConflictException if {@code operation} is {@link MergeOperation#APPLY} and the
   *     configuration changes fields other managers own
   * @throws ValidationException if {@code live} and {@code incoming} have different schemas
   */
  public MergeResult merge(
      MergeOperation operation,
      @Nullable TypedValue live,
      ManagedFields liveManaged,
      TypedValue incoming,
      String manager,
      String apiVersion) {
    Objects.requireNonNull(operation, "operation");
    Objects.requireNonNull(liveManaged, "liveManaged");
    Objects.requireNonNull(incoming, "incoming");
    Objects.requireNonNull(manager, "manager");
    Objects.requireNonNull(apiVersion, "apiVersion");
    if (manager.isEmpty()) {
      throw new IllegalArgumentException("manager must not be empty");
    }
    if (apiVersion.isBlank()) {
      throw new IllegalArgumentException("apiVersion must not be blank");
    }

    // 1. A missing object is the empty object of the incoming schema
    TypedValue current = live != null ? live : TypedValue.empty(incoming.type());

    // 2. Overlay the incoming values; this is the merged object for every operation
    TypedValue merged = current.merge(incoming);
    Comparison comparison = current.compare(merged);

    if (operation == MergeOperation.UPDATE) {
      return update(merged, comparison, liveManaged, manager, apiVersion);
    }
    return apply(operation, merged, comparison, liveManaged, incoming, manager, apiVersion);
  }

  private MergeResult update(
      TypedValue merged,
      Comparison comparison,
      ManagedFields liveManaged,
      String manager,
      String apiVersion) {

    // 3. The writer owns exactly the paths it changed, and nobody else does
    FieldSet touched = comparison.added().union(comparison.modified());
    ManagedFields managed = liveManaged;
    for (Map.Entry<String, VersionedSet> entry : liveManaged.entries().entrySet()) {
      if (entry.getKey().equals(manager)) {
        continue;
      }
      managed = release(managed, entry.getKey(), entry.getValue(), touched);
    }
    managed = managed.set(manager, new VersionedSet(touched, apiVersion, false));

    LOGGER.debug(
        "UPDATE by {} at {}: {} path(s) changed, {} manager(s) tracked",
        manager,
        apiVersion,
        touched.size(),
        managed.size());
    return new MergeResult(merged, managed);
  }

  private MergeResult apply(
      MergeOperation operation,
      TypedValue merged,
      Comparison comparison,
      ManagedFields liveManaged,
      TypedValue incoming,
      String manager,
      String apiVersion) {

    // 3. Only changes to declared paths can conflict; equal values never do
    FieldSet declared = incoming.toFieldSet();
    FieldSet changed = comparison.changed().intersection(declared);
    List<Conflict> conflicts = ConflictDetector.detect(changed, liveManaged, manager);
    if (!conflicts.isEmpty() && operation == MergeOperation.APPLY) {
      LOGGER.debug("APPLY by {} rejected with {} conflict(s)", manager, conflicts.size());
      throw new ConflictException(conflicts);
    }

    // 4. Force-apply takes the contested paths from their owners
    ManagedFields managed = liveManaged;
    for (Map.Entry<String, FieldSet> taken : groupByManager(conflicts).entrySet()) {
      VersionedSet owner = liveManaged.get(taken.getKey());
      if (owner != null) {
        managed = release(managed, taken.getKey(), owner, taken.getValue());
      }
    }

    // 5. The applier's ownership is replaced by its declaration
    VersionedSet previous = liveManaged.get(manager);
    managed = managed.set(manager, new VersionedSet(declared, apiVersion, true));

    // 6. Optionally drop what the applier let go of and nobody else holds
    TypedValue result = merged;
    if (removeDanglingFields && previous != null) {
      FieldSet dangling = dangling(previous.fields().difference(declared), managed, manager);
      if (!dangling.isEmpty()) {
        LOGGER.debug("{} by {} removes {} dangling path(s)", operation, manager, dangling.size());
        result = merged.removeItems(dangling);
      }
    }

    LOGGER.debug(
        "{} by {} at {}: {} path(s) declared, {} taken over, {} manager(s) tracked",
        operation,
        manager,
        apiVersion,
        declared.size(),
        conflicts.size(),
        managed.size());
    return new MergeResult(result, managed);
  }

  private static ManagedFields release(
      ManagedFields managed, String owner, VersionedSet owned, FieldSet released) {
    FieldSet remaining = owned.fields().difference(released);
    if (remaining.size() == owned.fields().size()) {
      return managed;
    }
    if (remaining.isEmpty()) {
      LOGGER.debug("{} no longer owns any field; entry pruned", owner);
    }
    return managed.set(owner, owned.withFields(remaining));
  }

  private static Map<String, FieldSet> groupByManager(List<Conflict> conflicts) {
    Map<String, FieldSet.Builder> builders = new TreeMap<>();
    for (Conflict conflict : conflicts) {
      builders.computeIfAbsent(conflict.manager(), m -> FieldSet.builder()).insert(conflict.path());
    }
    Map<String, FieldSet> grouped = new TreeMap<>();
    builders.forEach((owner, builder) -> grouped.put(owner, builder.build()));
    return grouped;
  }

  private static FieldSet dangling(FieldSet withdrawn, ManagedFields managed, String manager) {
    FieldSet.Builder dangling = FieldSet.builder();
    for (FieldPath path : withdrawn) {
      if (!ownedByOthers(managed, manager, path)) {
        dangling.insert(path);
      }
    }
    return dangling.build();
  }

  private static boolean ownedByOthers(ManagedFields managed, String manager, FieldPath path) {
    for (Map.Entry<String, VersionedSet> entry : managed.entries().entrySet()) {
      if (!entry.getKey().equals(manager) && entry.getValue().fields().contains(path)) {
        return true;
      }
    }
    return false;
  }

  /** Builder for {@link MergeEngine}. */
  public static final class Builder {

    private boolean removeDanglingFields;

    /** Creates a builder with default settings. */
    public Builder() {}

    /**
     * Sets whether an apply removes the values of fields the applier stopped declaring when no
     * other manager owns them. Defaults to {@code false}: withdrawn fields keep their value and
     * simply become unowned.
     */
    public Builder removeDanglingFields(boolean removeDanglingFields) {
      this.removeDanglingFields = removeDanglingFields;
      return this;
    }

    /**
     * Builds the engine.
     *
     * @return the configured engine
     */
    public MergeEngine build() {
      return new MergeEngine(this);
    }
  }
}
