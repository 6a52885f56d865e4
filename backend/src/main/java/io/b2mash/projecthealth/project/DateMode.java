package io.b2mash.projecthealth.project;

import java.util.Map;
import java.util.Set;

/** Whether a project's start/end dates follow its milestones or are frozen by hand. */
public enum DateMode {
  AUTO,
  MANUAL;

  private static final Map<DateMode, Set<DateMode>> ALLOWED_TRANSITIONS =
      Map.of(
          AUTO, Set.of(MANUAL),
          MANUAL, Set.of(AUTO));

  public static DateMode of(boolean datesOverridden) {
    return datesOverridden ? MANUAL : AUTO;
  }

  /** Returns true if switching from this mode to the target is allowed. */
  public boolean canTransitionTo(DateMode target) {
    return ALLOWED_TRANSITIONS.getOrDefault(this, Set.of()).contains(target);
  }
}
