package io.plaindate.calendar;

import java.util.Optional;

/** Represents a day of the week, indexed from Sunday. */
public enum Weekday {
  SUNDAY("Sunday"),
  MONDAY("Monday"),
  TUESDAY("Tuesday"),
  WEDNESDAY("Wednesday"),
  THURSDAY("Thursday"),
  FRIDAY("Friday"),
  SATURDAY("Saturday");

  private final String displayName;

  Weekday(String displayName) {
    this.displayName = displayName;
  }

  /**
   * Returns the day index (Sunday=0, Monday=1, ..., Saturday=6).
   *
   * @return the day index
   */
  public int index() {
    return ordinal();
  }

  /**
   * Returns the ISO 8601 day number (Monday=1, Sunday=7).
   *
   * @return the ISO day number
   */
  public int isoNumber() {
    return this == SUNDAY ? 7 : ordinal();
  }

  @Override
  public String toString() {
    return displayName;
  }

  /**
   * Returns a Weekday from a day index.
   *
   * @param index the day index (0-6, Sunday first)
   * @return the weekday if valid
   */
  public static Optional<Weekday> fromIndex(int index) {
    if (index < 0 || index > 6) {
      return Optional.empty();
    }
    return Optional.of(values()[index]);
  }

  /**
   * Returns a Weekday from a java.time.DayOfWeek.
   *
   * @param dow the DayOfWeek
   * @return the corresponding Weekday
   */
  public static Weekday fromDayOfWeek(java.time.DayOfWeek dow) {
    return values()[dow.getValue() % 7];
  }

  /**
   * Converts this Weekday to a java.time.DayOfWeek.
   *
   * @return the corresponding DayOfWeek
   */
  public java.time.DayOfWeek toDayOfWeek() {
    return java.time.DayOfWeek.of(isoNumber());
  }
}
