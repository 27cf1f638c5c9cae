package io.github.wphillipmoore.fieldmerge.path;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * An immutable sequence of {@link PathElement}s from the root of a typed tree.
 *
 * <p>Paths are ordered lexicographically by element; a path sorts immediately before its own
 * descendants. The empty path addresses the root.
 */
public final class FieldPath implements Comparable<FieldPath> {

  private static final FieldPath ROOT = new FieldPath(List.of());

  private final List<PathElement> elements;

  private FieldPath(List<PathElement> elements) {
    this.elements = elements;
  }

  /** Returns the empty path, addressing the root. */
  public static FieldPath root() {
    return ROOT;
  }

  /**
   * Creates a path from the given elements.
   *
   * @param elements the path elements, must not be null or contain null
   * @return the path
   */
  public static FieldPath of(PathElement... elements) {
    return of(Arrays.asList(elements));
  }

  /**
   * Creates a path from the given elements.
   *
   * @param elements the path elements, must not be null or contain null
   * @return the path
   */
  public static FieldPath of(List<PathElement> elements) {
    Objects.requireNonNull(elements, "elements");
    return elements.isEmpty() ? ROOT : new FieldPath(List.copyOf(elements));
  }

  /**
   * Creates a path made only of map field names.
   *
   * @param names the field names, outermost first
   * @return the path
   */
  public static FieldPath fields(String... names) {
    List<PathElement> elements = new ArrayList<>(names.length);
    for (String name : names) {
      elements.add(new PathElement.FieldName(name));
    }
    return of(elements);
  }

  /**
   * Parses a path from its serialized elements.
   *
   * @param serialized the serialized elements, outermost first
   * @return the parsed path
   * @throws IllegalArgumentException if any element is malformed
   */
  public static FieldPath parse(List<String> serialized) {
    Objects.requireNonNull(serialized, "serialized");
    List<PathElement> elements = new ArrayList<>(serialized.size());
    for (String element : serialized) {
      elements.add(PathElement.parse(element));
    }
    return of(elements);
  }

  /** Returns the elements of this path, outermost first. The list is unmodifiable. */
  public List<PathElement> elements() {
    return elements;
  }

  /** Returns the number of elements. */
  public int size() {
    return elements.size();
  }

  /** Returns true for the root path. */
  public boolean isEmpty() {
    return elements.isEmpty();
  }

  /**
   * Returns the last element.
   *
   * @throws IllegalStateException if this is the root path
   */
  public PathElement lastElement() {
    if (elements.isEmpty()) {
      throw new IllegalStateException("root path has no elements");
    }
    return elements.get(elements.size() - 1);
  }

  /**
   * Returns the path without its last element.
   *
   * @throws IllegalStateException if this is the root path
   */
  public FieldPath parent() {
    if (elements.isEmpty()) {
      throw new IllegalStateException("root path has no parent");
    }
    return prefix(elements.size() - 1);
  }

  /**
   * Returns the first {@code length} elements of this path as a path.
   *
   * @param length the prefix length, between 0 and {@link #size()}
   * @return the prefix
   */
  public FieldPath prefix(int length) {
    if (length == elements.size()) {
      return this;
    }
    return of(elements.subList(0, length));
  }

  /**
   * Returns a new path with the element appended.
   *
   * @param element the element to append, must not be null
   * @return the extended path
   */
  public FieldPath append(PathElement element) {
    Objects.requireNonNull(element, "element");
    List<PathElement> extended = new ArrayList<>(elements.size() + 1);
    extended.addAll(elements);
    extended.add(element);
    return new FieldPath(List.copyOf(extended));
  }

  /** Returns true if this path is {@code other} or one of its ancestors. */
  public boolean isPrefixOf(FieldPath other) {
    if (other.elements.size() < elements.size()) {
      return false;
    }
    return other.elements.subList(0, elements.size()).equals(elements);
  }

  /** Returns true if the last element is the {@link PathElement.WholeValue} marker. */
  public boolean isWholeValueMarker() {
    return !elements.isEmpty() && lastElement() instanceof PathElement.WholeValue;
  }

  /** Returns the serialized elements of this path, outermost first. */
  public List<String> serialize() {
    List<String> serialized = new ArrayList<>(elements.size());
    for (PathElement element : elements) {
      serialized.add(element.serialize());
    }
    return serialized;
  }

  @Override
  public int compareTo(FieldPath other) {
    int common = Math.min(elements.size(), other.elements.size());
    for (int i = 0; i < common; i++) {
      int c = elements.get(i).compareTo(other.elements.get(i));
      if (c != 0) {
        return c;
      }
    }
    return Integer.compare(elements.size(), other.elements.size());
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    return o instanceof FieldPath other && elements.equals(other.elements);
  }

  @Override
  public int hashCode() {
    return elements.hashCode();
  }

  /** Returns the readable form, for example {@code .spec.ports[port=80].protocol}. */
  @Override
  public String toString() {
    if (elements.isEmpty()) {
      return "<root>";
    }
    StringBuilder sb = new StringBuilder();
    for (PathElement element : elements) {
      sb.append(element);
    }
    return sb.toString();
  }
}
