package io.b2mash.projecthealth.project;

/** Project lifecycle status as maintained by the editing layer. */
public enum ProjectStatus {
  DRAFT,
  ACTIVE,
  ON_HOLD,
  COMPLETED,
  CANCELLED;

  /** Returns true for statuses where work is not currently progressing (draft, on hold). */
  public boolean isPaused() {
    return this == DRAFT || this == ON_HOLD;
  }

  /** Lower-case label used in reasoning text, e.g. "on hold". */
  public String label() {
    return name().toLowerCase().replace('_', ' ');
  }
}
