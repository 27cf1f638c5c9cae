package io.github.wphillipmoore.fieldmerge.exception;

import io.github.wphillipmoore.fieldmerge.merge.Conflict;
import java.util.List;
import java.util.Objects;
import java.util.StringJoiner;

/**
 * Thrown when an apply would change fields owned by other managers.
 *
 * <p>Carries every {@link Conflict} found. Nothing was merged: the caller can resolve the
 * disagreement and apply again, or repeat the operation as a force-apply.
 */
public final class ConflictException extends FieldMergeException {

  private static final long serialVersionUID = 1L;

  private final List<Conflict> conflicts;

  /**
   * Creates a conflict exception with an auto-generated message.
   *
   * @param conflicts the conflicts found, must not be null or empty
   */
  public ConflictException(List<Conflict> conflicts) {
    super(buildMessage(validateConflicts(conflicts)));
    this.conflicts = List.copyOf(conflicts);
  }

  /**
   * Returns the conflicts that caused this exception.
   *
   * @return unmodifiable list of conflicts, never empty
   */
  public List<Conflict> getConflicts() {
    return conflicts;
  }

  private static List<Conflict> validateConflicts(List<Conflict> conflicts) {
    Objects.requireNonNull(conflicts, "conflicts");
    if (conflicts.isEmpty()) {
      throw new IllegalArgumentException("conflicts must not be empty");
    }
    return conflicts;
  }

  private static String buildMessage(List<Conflict> conflicts) {
    StringBuilder sb = new StringBuilder();
    sb.append("Apply failed with ").append(conflicts.size()).append(" conflict(s):");
    for (Conflict conflict : conflicts) {
      sb.append('\n');
      StringJoiner joiner = new StringJoiner(" | ");
      joiner.add("manager=" + conflict.manager());
      joiner.add("path=" + conflict.path());
      sb.append(joiner);
    }
    return sb.toString();
  }
}
