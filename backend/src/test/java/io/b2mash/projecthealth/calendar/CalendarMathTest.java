package io.b2mash.projecthealth.calendar;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.LocalDate;
import org.junit.jupiter.api.Test;

class CalendarMathTest {

  private static final LocalDate MON_JAN_1 = LocalDate.of(2024, 1, 1);
  private static final LocalDate FRI_JAN_5 = LocalDate.of(2024, 1, 5);

  @Test
  void workWeekCountsFiveCalendarAndFiveWorkingDays() {
    assertThat(CalendarMath.totalDays(MON_JAN_1, FRI_JAN_5)).isEqualTo(5);
    assertThat(CalendarMath.workingDays(MON_JAN_1, FRI_JAN_5)).isEqualTo(5);
  }

  @Test
  void singleDayCountsAsOne() {
    assertThat(CalendarMath.totalDays(MON_JAN_1, MON_JAN_1)).isEqualTo(1);
    assertThat(CalendarMath.workingDays(MON_JAN_1, MON_JAN_1)).isEqualTo(1);
  }

  @Test
  void spansAreSymmetric() {
    LocalDate sunJan14 = LocalDate.of(2024, 1, 14);
    assertThat(CalendarMath.totalDays(sunJan14, MON_JAN_1))
        .isEqualTo(CalendarMath.totalDays(MON_JAN_1, sunJan14))
        .isEqualTo(14);
    assertThat(CalendarMath.workingDays(sunJan14, MON_JAN_1))
        .isEqualTo(CalendarMath.workingDays(MON_JAN_1, sunJan14))
        .isEqualTo(10);
  }

  @Test
  void weekendOnlyRangeHasNoWorkingDays() {
    assertThat(CalendarMath.workingDays(LocalDate.of(2024, 1, 6), LocalDate.of(2024, 1, 7)))
        .isZero();
  }

  @Test
  void workingDaysNeverExceedTotalDays() {
    for (int offset = 0; offset < 60; offset++) {
      LocalDate end = MON_JAN_1.plusDays(offset);
      assertThat(CalendarMath.workingDays(MON_JAN_1, end))
          .isLessThanOrEqualTo(CalendarMath.totalDays(MON_JAN_1, end));
    }
  }

  @Test
  void signedCountsAreNegativeForPastDates() {
    LocalDate wedJan10 = LocalDate.of(2024, 1, 10);
    assertThat(CalendarMath.signedDaysBetween(wedJan10, FRI_JAN_5)).isEqualTo(-5);
    // Fri 5, Mon 8, Tue 9, Wed 10
    assertThat(CalendarMath.signedWorkingDaysBetween(wedJan10, FRI_JAN_5)).isEqualTo(-4);
    assertThat(CalendarMath.signedWorkingDaysBetween(MON_JAN_1, FRI_JAN_5)).isEqualTo(5);
  }

  @Test
  void workingDaysMatchDayByDayCount() {
    for (int startOffset = 0; startOffset < 7; startOffset++) {
      LocalDate start = MON_JAN_1.plusDays(startOffset);
      for (int length = 0; length < 60; length++) {
        LocalDate end = start.plusDays(length);
        int expected = 0;
        for (LocalDate day = start; !day.isAfter(end); day = day.plusDays(1)) {
          if (CalendarMath.isWorkingDay(day)) {
            expected++;
          }
        }
        assertThat(CalendarMath.workingDays(start, end))
            .as("%s..%s", start, end)
            .isEqualTo(expected);
      }
    }
  }

  @Test
  void extremeDatesSaturateInsteadOfOverflowing() {
    assertThat(CalendarMath.totalDays(LocalDate.MIN, LocalDate.MAX)).isEqualTo(Integer.MAX_VALUE);
    assertThat(CalendarMath.workingDays(LocalDate.MAX, LocalDate.MIN)).isEqualTo(Integer.MAX_VALUE);
    assertThat(CalendarMath.signedDaysBetween(LocalDate.MAX, LocalDate.MIN))
        .isEqualTo(-Integer.MAX_VALUE);
    assertThat(CalendarMath.signedWorkingDaysBetween(LocalDate.MAX, LocalDate.MIN))
        .isEqualTo(-Integer.MAX_VALUE);
  }

  @Test
  void workingDaysUpToTheLastRepresentableDate() {
    // two whole weeks hold ten working days wherever they fall
    assertThat(CalendarMath.workingDays(LocalDate.MAX.minusDays(13), LocalDate.MAX)).isEqualTo(10);
    assertThat(CalendarMath.workingDays(LocalDate.MAX, LocalDate.MAX)).isBetween(0, 1);
  }
}
