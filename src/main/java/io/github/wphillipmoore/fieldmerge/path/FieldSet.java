package io.github.wphillipmoore.fieldmerge.path;

import java.util.Collection;
import java.util.Collections;
import java.util.Iterator;
import java.util.NavigableSet;
import java.util.Objects;
import java.util.TreeSet;
import java.util.stream.Stream;

/**
 * An immutable set of {@link FieldPath}s.
 *
 * <p>Paths are kept sorted, so iteration and serialization are deterministic. The set operations
 * understand containment: a path in the set covers itself and all of its descendants. See {@link
 * #contains(FieldPath)}.
 *
 * <p>Instances are created with {@link #of(FieldPath...)} or a {@link Builder}, and are never
 * mutated afterwards.
 */
public final class FieldSet implements Iterable<FieldPath> {

  private static final FieldSet EMPTY = new FieldSet(new TreeSet<>());

  private final NavigableSet<FieldPath> paths;

  private FieldSet(TreeSet<FieldPath> paths) {
    this.paths = Collections.unmodifiableNavigableSet(paths);
  }

  /** Returns the empty set. */
  public static FieldSet empty() {
    return EMPTY;
  }

  /**
   * Creates a set holding the given paths.
   *
   * @param paths the paths, must not contain null
   * @return the set
   */
  public static FieldSet of(FieldPath... paths) {
    Builder builder = builder();
    for (FieldPath path : paths) {
      builder.insert(path);
    }
    return builder.build();
  }

  /**
   * Creates a set holding the given paths.
   *
   * @param paths the paths, must not be null or contain null
   * @return the set
   */
  public static FieldSet of(Collection<FieldPath> paths) {
    Objects.requireNonNull(paths, "paths");
    Builder builder = builder();
    for (FieldPath path : paths) {
      builder.insert(path);
    }
    return builder.build();
  }

  /** Returns a new builder. */
  public static Builder builder() {
    return new Builder();
  }

  /** Returns true if the set holds no paths. */
  public boolean isEmpty() {
    return paths.isEmpty();
  }

  /** Returns the number of paths in the set. */
  public int size() {
    return paths.size();
  }

  /** Returns true if the set holds exactly this path. */
  public boolean has(FieldPath path) {
    return paths.contains(Objects.requireNonNull(path, "path"));
  }

  /**
   * Returns true if the set holds the path or one of its ancestors.
   *
   * @param path the path to test, must not be null
   * @return whether the path is covered by this set
   */
  public boolean contains(FieldPath path) {
    Objects.requireNonNull(path, "path");
    for (int length = 0; length <= path.size(); length++) {
      if (paths.contains(path.prefix(length))) {
        return true;
      }
    }
    return false;
  }

  /** Returns the set of paths in either set. */
  public FieldSet union(FieldSet other) {
    Objects.requireNonNull(other, "other");
    if (other.isEmpty()) {
      return this;
    }
    if (isEmpty()) {
      return other;
    }
    TreeSet<FieldPath> result = new TreeSet<>(paths);
    result.addAll(other.paths);
    return new FieldSet(result);
  }

  /** Returns the paths of this set that are not covered by {@code other}. */
  public FieldSet difference(FieldSet other) {
    Objects.requireNonNull(other, "other");
    if (isEmpty() || other.isEmpty()) {
      return this;
    }
    TreeSet<FieldPath> result = new TreeSet<>();
    for (FieldPath path : paths) {
      if (!other.contains(path)) {
        result.add(path);
      }
    }
    return new FieldSet(result);
  }

  /**
   * Returns the paths of this set covered by {@code other}, together with the paths of {@code
   * other} covered by this set.
   */
  public FieldSet intersection(FieldSet other) {
    Objects.requireNonNull(other, "other");
    TreeSet<FieldPath> result = new TreeSet<>();
    for (FieldPath path : paths) {
      if (other.contains(path)) {
        result.add(path);
      }
    }
    for (FieldPath path : other.paths) {
      if (contains(path)) {
        result.add(path);
      }
    }
    return new FieldSet(result);
  }

  /** Returns the paths that are not an ancestor of any other path in this set. */
  public FieldSet leaves() {
    TreeSet<FieldPath> result = new TreeSet<>();
    for (FieldPath path : paths) {
      // Descendants sort directly after their ancestor.
      FieldPath next = paths.higher(path);
      if (next == null || !path.isPrefixOf(next)) {
        result.add(path);
      }
    }
    return new FieldSet(result);
  }

  /** Returns the paths in sorted order. */
  @Override
  public Iterator<FieldPath> iterator() {
    return paths.iterator();
  }

  /** Returns a sequential stream over the paths in sorted order. */
  public Stream<FieldPath> stream() {
    return paths.stream();
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    return o instanceof FieldSet other && paths.equals(other.paths);
  }

  @Override
  public int hashCode() {
    return paths.hashCode();
  }

  @Override
  public String toString() {
    return paths.toString();
  }

  /** Accumulates paths for a new {@link FieldSet}. Not thread-safe. */
  public static final class Builder {

    private final TreeSet<FieldPath> paths = new TreeSet<>();

    private Builder() {}

    /** Adds a path. */
    public Builder insert(FieldPath path) {
      paths.add(Objects.requireNonNull(path, "path"));
      return this;
    }

    /** Adds every path of the given set. */
    public Builder insertAll(FieldSet set) {
      paths.addAll(Objects.requireNonNull(set, "set").paths);
      return this;
    }

    /** Returns true if nothing has been inserted yet. */
    public boolean isEmpty() {
      return paths.isEmpty();
    }

    /** Builds the set. The builder may be reused; later inserts do not affect built sets. */
    public FieldSet build() {
      return paths.isEmpty() ? EMPTY : new FieldSet(new TreeSet<>(paths));
    }
  }
}
