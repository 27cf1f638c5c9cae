package io.github.wphillipmoore.fieldmerge.merge;

/** The kind of write a manager makes. */
public enum MergeOperation {

  /**
   * An unconditional write. The manager takes sole ownership of every path whose value it changes,
   * displacing any other owner.
   */
  UPDATE,

  /**
   * A declaration of intent. The manager's owned fields become exactly what it declares; changing
   * a value another manager owns is a conflict.
   */
  APPLY,

  /** An apply that proceeds despite conflicts, taking the conflicting paths from their owners. */
  FORCE_APPLY
}
