package io.plaindate.calendar;

/**
 * Rules of the proleptic Gregorian calendar.
 *
 * <p>The rules are applied to every year, including years before the 1582 reform and years below
 * 1. There is no Julian cutover.
 */
public final class Gregorian {
  private static final int[] COMMON_YEAR = {31, 28, 31, 30, 31, 30, 31, 31, 30, 31, 30, 31};

  private Gregorian() {}

  /**
   * Returns true if the year is a leap year: divisible by 4 and not by 100, or divisible by 400.
   *
   * @param year the year
   * @return true for a leap year
   */
  public static boolean isLeapYear(int year) {
    return (year % 4 == 0 && year % 100 != 0) || year % 400 == 0;
  }

  /**
   * Returns the number of days in each month of the year, January first.
   *
   * @param year the year
   * @return a new 12-entry array
   */
  public static int[] daysInMonth(int year) {
    int[] table = COMMON_YEAR.clone();
    if (isLeapYear(year)) {
      table[1] = 29;
    }
    return table;
  }

  /**
   * Returns the number of days in one month.
   *
   * <p>A month outside 1-12 has no days, which keeps arithmetic over invalid dates total.
   *
   * @param year the year
   * @param month the month (1-12)
   * @return the month length, or 0 for a month outside 1-12
   */
  public static int daysInMonth(int year, int month) {
    if (month < 1 || month > 12) {
      return 0;
    }
    if (month == 2 && isLeapYear(year)) {
      return 29;
    }
    return COMMON_YEAR[month - 1];
  }

  /**
   * Returns the number of days in the year.
   *
   * @param year the year
   * @return 366 for a leap year, otherwise 365
   */
  public static int daysInYear(int year) {
    return isLeapYear(year) ? 366 : 365;
  }
}
