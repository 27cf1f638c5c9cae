package io.github.wphillipmoore.fieldmerge.managed;

import java.util.Collections;
import java.util.Map;
import java.util.NavigableMap;
import java.util.NavigableSet;
import java.util.Objects;
import java.util.TreeMap;
import org.jspecify.annotations.Nullable;

/**
 * Immutable table of which manager owns which fields of one object.
 *
 * <p>Entries are sorted by manager name. A manager never maps to an empty {@link VersionedSet}:
 * such entries are dropped on construction and by {@link #set(String, VersionedSet)}. Mutators
 * return a new snapshot and leave this one untouched.
 */
public final class ManagedFields {

  private static final ManagedFields EMPTY = new ManagedFields(new TreeMap<>());

  private final NavigableMap<String, VersionedSet> entries;

  private ManagedFields(TreeMap<String, VersionedSet> entries) {
    this.entries = Collections.unmodifiableNavigableMap(entries);
  }

  /** Returns the snapshot with no managers. */
  public static ManagedFields empty() {
    return EMPTY;
  }

  /**
   * Creates a snapshot from a map of manager to versioned set. Empty sets are skipped.
   *
   * @param entries the entries, must not be null or hold null keys or values
   * @return the snapshot
   */
  public static ManagedFields of(Map<String, VersionedSet> entries) {
    Objects.requireNonNull(entries, "entries");
    TreeMap<String, VersionedSet> copy = new TreeMap<>();
    for (Map.Entry<String, VersionedSet> entry : entries.entrySet()) {
      String manager = requireManager(entry.getKey());
      VersionedSet set = Objects.requireNonNull(entry.getValue(), "versionedSet");
      if (!set.isEmpty()) {
        copy.put(manager, set);
      }
    }
    return copy.isEmpty() ? EMPTY : new ManagedFields(copy);
  }

  /**
   * Returns a snapshot in which the manager's entry is replaced by {@code versionedSet}, or
   * removed if {@code versionedSet} is empty.
   *
   * @param manager the manager name, must not be null or empty
   * @param versionedSet the manager's new fields, must not be null
   * @return the new snapshot
   */
  public ManagedFields set(String manager, VersionedSet versionedSet) {
    requireManager(manager);
    Objects.requireNonNull(versionedSet, "versionedSet");
    if (versionedSet.isEmpty()) {
      return remove(manager);
    }
    TreeMap<String, VersionedSet> copy = new TreeMap<>(entries);
    copy.put(manager, versionedSet);
    return new ManagedFields(copy);
  }

  /**
   * Returns a snapshot without the manager's entry.
   *
   * @param manager the manager name, must not be null
   * @return the new snapshot, or this one if the manager had no entry
   */
  public ManagedFields remove(String manager) {
    Objects.requireNonNull(manager, "manager");
    if (!entries.containsKey(manager)) {
      return this;
    }
    TreeMap<String, VersionedSet> copy = new TreeMap<>(entries);
    copy.remove(manager);
    return copy.isEmpty() ? EMPTY : new ManagedFields(copy);
  }

  /** Returns the manager's versioned set, or {@code null} if the manager owns nothing. */
  public @Nullable VersionedSet get(String manager) {
    return entries.get(Objects.requireNonNull(manager, "manager"));
  }

  /** Returns the managers in sorted order. The set is unmodifiable. */
  public NavigableSet<String> managers() {
    return entries.navigableKeySet();
  }

  /** Returns the entries sorted by manager. The map is unmodifiable. */
  public NavigableMap<String, VersionedSet> entries() {
    return entries;
  }

  /** Returns true if no manager owns anything. */
  public boolean isEmpty() {
    return entries.isEmpty();
  }

  /** Returns the number of managers. */
  public int size() {
    return entries.size();
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    return o instanceof ManagedFields other && entries.equals(other.entries);
  }

  @Override
  public int hashCode() {
    return entries.hashCode();
  }

  @Override
  public String toString() {
    return entries.toString();
  }

  private static String requireManager(String manager) {
    Objects.requireNonNull(manager, "manager");
    if (manager.isEmpty()) {
      throw new IllegalArgumentException("manager must not be empty");
    }
    return manager;
  }
}
