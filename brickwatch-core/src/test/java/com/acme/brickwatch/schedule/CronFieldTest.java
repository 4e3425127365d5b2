package com.acme.brickwatch.schedule;

import static org.assertj.core.api.Assertions.*;

import java.time.LocalDate;
import java.time.LocalDateTime;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/** Unit tests for cron field and pattern parsing */
class CronFieldTest {

  @Nested
  @DisplayName("Field syntax")
  class FieldSyntaxTests {

    @Test
    @DisplayName("wildcard should match the whole range")
    void testWildcard() {
      CronField field = CronField.hours("*");

      assertThat(field.values().cardinality()).isEqualTo(24);
      assertThat(field.isWildcard()).isTrue();
    }

    @Test
    @DisplayName("steps should apply to wildcards, ranges and start values")
    void testSteps() {
      assertThat(CronField.minutes("*/15").values().stream()).containsExactly(0, 15, 30, 45);
      assertThat(CronField.minutes("10-30/10").values().stream()).containsExactly(10, 20, 30);
      assertThat(CronField.minutes("5/20").values().stream()).containsExactly(5, 25, 45);
    }

    @Test
    @DisplayName("lists and ranges should combine")
    void testListsAndRanges() {
      CronField field = CronField.hours("0-2,12,22-23");

      assertThat(field.values().stream()).containsExactly(0, 1, 2, 12, 22, 23);
      assertThat(field.isWildcard()).isFalse();
    }

    @Test
    @DisplayName("month and weekday names should be case-insensitive")
    void testNames() {
      assertThat(CronField.months("Jan,MAR-apr").values().stream()).containsExactly(1, 3, 4);
      assertThat(CronField.daysOfWeek("MON-fri").values().stream()).containsExactly(1, 2, 3, 4, 5);
    }

    @Test
    @DisplayName("day-of-week 7 should mean Sunday")
    void testSundayAsSeven() {
      assertThat(CronField.daysOfWeek("7").values().stream()).containsExactly(0);
      assertThat(CronField.daysOfWeek("sat-7").values().stream()).containsExactly(0, 6);
    }

    @Test
    @DisplayName("out of range and malformed values should be rejected")
    void testInvalidValues() {
      assertThatThrownBy(() -> CronField.minutes("60"))
          .isInstanceOf(PeriodicityParseException.class)
          .hasMessageContaining("out of range");
      assertThatThrownBy(() -> CronField.hours("5-2"))
          .isInstanceOf(PeriodicityParseException.class)
          .hasMessageContaining("Descending");
      assertThatThrownBy(() -> CronField.minutes("*/0")).isInstanceOf(PeriodicityParseException.class);
      assertThatThrownBy(() -> CronField.daysOfMonth("0")).isInstanceOf(PeriodicityParseException.class);
      assertThatThrownBy(() -> CronField.months("foo")).isInstanceOf(PeriodicityParseException.class);
      assertThatThrownBy(() -> CronField.hours("1,,2")).isInstanceOf(PeriodicityParseException.class);
    }
  }

  @Nested
  @DisplayName("Pattern matching")
  class PatternMatchingTests {

    @Test
    @DisplayName("both restricted day fields should match when either matches")
    void testDayFieldsOr() {
      // 1st of the month or any Monday
      CronPattern pattern = CronPattern.of("*", "*", "1", "*", "mon");

      assertThat(pattern.matchesDay(LocalDate.of(2024, 2, 1))).isTrue(); // Thursday the 1st
      assertThat(pattern.matchesDay(LocalDate.of(2024, 1, 8))).isTrue(); // Monday
      assertThat(pattern.matchesDay(LocalDate.of(2024, 1, 9))).isFalse(); // Tuesday the 9th
    }

    @Test
    @DisplayName("a wildcard day field should require the other one to match")
    void testDayFieldsAnd() {
      CronPattern pattern = CronPattern.of("*", "*", "*/2", "*", "mon");

      // Jan 1 2024 is a Monday and an odd day of month
      assertThat(pattern.matchesDay(LocalDate.of(2024, 1, 1))).isTrue();
      assertThat(pattern.matchesDay(LocalDate.of(2024, 1, 15))).isTrue();
      assertThat(pattern.matchesDay(LocalDate.of(2024, 1, 2))).isFalse();
    }

    @Test
    @DisplayName("minute mask should combine hours and minutes")
    void testMinuteMask() {
      CronPattern pattern = CronPattern.of("0,30", "9-10", "*", "*", "*");

      assertThat(pattern.minuteMask().stream()).containsExactly(540, 570, 600, 630);
      assertThat(pattern.matches(LocalDateTime.of(2024, 1, 1, 9, 30))).isTrue();
      assertThat(pattern.matches(LocalDateTime.of(2024, 1, 1, 9, 31))).isFalse();
      assertThat(pattern.nextMinuteOfDay(571)).isEqualTo(600);
      assertThat(pattern.nextMinuteOfDay(631)).isEqualTo(-1);
    }
  }
}
