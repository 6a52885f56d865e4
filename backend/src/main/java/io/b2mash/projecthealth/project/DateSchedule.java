package io.b2mash.projecthealth.project;

import java.time.LocalDate;

/** Caller-owned start/end dates together with the flag saying whether they are overridden. */
public interface DateSchedule {

  LocalDate getStartDate();

  LocalDate getEndDate();

  boolean isDatesOverridden();

  void setDates(LocalDate startDate, LocalDate endDate);

  void setDatesOverridden(boolean datesOverridden);
}
