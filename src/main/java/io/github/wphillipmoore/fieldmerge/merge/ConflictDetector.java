package io.github.wphillipmoore.fieldmerge.merge;

import io.github.wphillipmoore.fieldmerge.managed.ManagedFields;
import io.github.wphillipmoore.fieldmerge.managed.VersionedSet;
import io.github.wphillipmoore.fieldmerge.path.FieldPath;
import io.github.wphillipmoore.fieldmerge.path.FieldSet;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/** Finds the paths a manager is changing while other managers own them. */
public final class ConflictDetector {

  private ConflictDetector() {}

  /**
   * Returns one {@link Conflict} for every changed path covered by the fields of a manager other
   * than {@code manager}. Versions are not compared: a path owned at any version conflicts.
   *
   * @param changed the paths whose value the operation changes, must not be null
   * @param managed the current owners, must not be null
   * @param manager the manager making the change, must not be null
   * @return the conflicts, sorted by manager then path; empty if there are none
   */
  public static List<Conflict> detect(FieldSet changed, ManagedFields managed, String manager) {
    Objects.requireNonNull(changed, "changed");
    Objects.requireNonNull(managed, "managed");
    Objects.requireNonNull(manager, "manager");
    List<Conflict> conflicts = new ArrayList<>();
    for (Map.Entry<String, VersionedSet> entry : managed.entries().entrySet()) {
      if (entry.getKey().equals(manager)) {
        continue;
      }
      FieldSet owned = entry.getValue().fields();
      for (FieldPath path : changed) {
        if (owned.contains(path)) {
          conflicts.add(new Conflict(entry.getKey(), path));
        }
      }
    }
    return conflicts;
  }
}
