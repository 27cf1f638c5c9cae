package io.github.wphillipmoore.fieldmerge.managed;

import io.github.wphillipmoore.fieldmerge.path.FieldSet;
import java.util.Objects;

/**
 * The fields one manager owns, as of the schema version they were computed against.
 *
 * <p>Any field set is accepted, including the empty one. {@link ManagedFields} never stores an
 * empty versioned set.
 *
 * @param fields the owned paths, never null
 * @param apiVersion the schema version the paths were computed against, never null
 * @param applied true if the set was produced by an apply, false if by an update
 */
public record VersionedSet(FieldSet fields, String apiVersion, boolean applied) {

  /** Validates that the fields and version are non-null. */
  public VersionedSet {
    Objects.requireNonNull(fields, "fields");
    Objects.requireNonNull(apiVersion, "apiVersion");
  }

  /** Returns true if no paths are owned. */
  public boolean isEmpty() {
    return fields.isEmpty();
  }

  /** Returns a versioned set with the same version and flag and the given fields. */
  public VersionedSet withFields(FieldSet newFields) {
    return new VersionedSet(newFields, apiVersion, applied);
  }
}
