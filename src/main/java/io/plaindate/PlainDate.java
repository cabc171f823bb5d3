package io.plaindate;

import io.plaindate.calendar.Gregorian;
import io.plaindate.calendar.Weekday;
import io.plaindate.parser.IsoDateParser;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.List;
import java.util.Objects;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A calendar date without time of day or timezone, in the proleptic Gregorian calendar.
 *
 * <p>Construction never validates: {@code new PlainDate(2023, 2, 30)} is a legal value whose
 * {@link #isValid()} is false. Operations other than {@link #fromISOString(String)} accept invalid
 * dates and never throw.
 *
 * <p>Example usage:
 *
 * <pre>{@code
 * PlainDate due = PlainDate.fromISOString("2024-02-15").addDays(14);
 * System.out.println(due + " is a " + due.getDayOfWeekStr()); // 2024-02-29 is a Thursday
 * }</pre>
 *
 * @param year the year, valid from 1
 * @param month the month of the year, valid from 1 to 12
 * @param day the day of the month, valid from 1 to the length of the month
 */
public record PlainDate(int year, int month, int day) implements Comparable<PlainDate> {
  private static final Logger LOG = LoggerFactory.getLogger(PlainDate.class);

  /** English weekday names, Sunday first. */
  public static final List<String> WEEKDAYS =
      List.of("Sunday", "Monday", "Tuesday", "Wednesday", "Thursday", "Friday", "Saturday");

  /** Reference date for weekday computation, a Thursday. */
  private static final PlainDate EPOCH = new PlainDate(1970, 1, 1);

  private static final int EPOCH_WEEKDAY = 4;

  // Conversions

  /**
   * Reads the calendar fields of an instant in the system default timezone.
   *
   * <p>Near midnight the result depends on the timezone; see {@link #fromUTCInstant(Instant)} for
   * the UTC reading of the same instant.
   *
   * @param instant the instant
   * @return the local date of the instant
   */
  public static PlainDate fromInstant(Instant instant) {
    return fromInstant(instant, ZoneId.systemDefault());
  }

  /**
   * Reads the calendar fields of an instant in the given timezone.
   *
   * @param instant the instant
   * @param zone the timezone whose calendar is used
   * @return the date of the instant in that timezone
   */
  public static PlainDate fromInstant(Instant instant, ZoneId zone) {
    ZonedDateTime local = instant.atZone(zone);
    return new PlainDate(local.getYear(), local.getMonthValue(), local.getDayOfMonth());
  }

  /**
   * Reads the calendar fields of an instant in UTC.
   *
   * @param instant the instant
   * @return the UTC date of the instant
   */
  public static PlainDate fromUTCInstant(Instant instant) {
    return fromInstant(instant, ZoneOffset.UTC);
  }

  /**
   * Parses a {@code YYYY-MM-DD} string.
   *
   * @param isoString the text to parse
   * @return the parsed date, always valid
   * @throws PlainDateException if the text is malformed or names no calendar day
   */
  public static PlainDate fromISOString(String isoString) throws PlainDateException {
    return IsoDateParser.parse(isoString);
  }

  /**
   * Parses a {@code YYYY-MM-DD} string, returning a fallback when it cannot be read.
   *
   * <p>The fallback is returned as given, without validation. It is only consulted on failure, so a
   * {@code null} fallback is tolerated for readable input.
   *
   * @param isoString the text to parse
   * @param fallback the date to return on failure
   * @return the parsed date, or the fallback
   * @throws NullPointerException if the text cannot be read and the fallback is null
   */
  public static PlainDate fromISOString(String isoString, PlainDate fallback) {
    try {
      return IsoDateParser.parse(isoString);
    } catch (PlainDateException e) {
      Objects.requireNonNull(fallback, e.getMessage());
      LOG.debug("Using fallback {}: {}", fallback, e.getMessage());
      return fallback;
    }
  }

  /**
   * Validates a {@code YYYY-MM-DD} string without throwing.
   *
   * @param isoString the text to check
   * @return true if {@link #fromISOString(String)} would succeed
   */
  public static boolean validate(String isoString) {
    try {
      IsoDateParser.parse(isoString);
      return true;
    } catch (PlainDateException e) {
      return false;
    }
  }

  /**
   * Returns the current date in the system default timezone.
   *
   * @return today's date
   */
  public static PlainDate today() {
    return today(Clock.systemDefaultZone());
  }

  /**
   * Returns the date of the instant supplied by {@code now}, in the system default timezone.
   *
   * @param now the clock function
   * @return the date of that instant
   */
  public static PlainDate today(Supplier<Instant> now) {
    return fromInstant(now.get(), ZoneId.systemDefault());
  }

  /**
   * Returns the current date of a clock, in the clock's timezone.
   *
   * @param clock the clock
   * @return the clock's current date
   */
  public static PlainDate today(Clock clock) {
    return fromInstant(clock.instant(), clock.getZone());
  }

  /**
   * Returns the start of this date in the system default timezone.
   *
   * @return the instant of local midnight
   * @throws java.time.DateTimeException if the year is outside the range of {@link LocalDate}
   */
  public Instant toInstant() {
    return toInstant(ZoneId.systemDefault());
  }

  /**
   * Returns the start of this date in the given timezone.
   *
   * <p>Months and days out of range roll over, so {@code 2023-02-30} starts on March 2nd. When
   * midnight falls in a DST gap, the first valid time of the day is used.
   *
   * @param zone the timezone
   * @return the instant of midnight in that timezone
   * @throws java.time.DateTimeException if the year is outside the range of {@link LocalDate}
   */
  public Instant toInstant(ZoneId zone) {
    return rolledOver().atStartOfDay(zone).toInstant();
  }

  /**
   * Returns the start of this date in UTC.
   *
   * @return the instant of UTC midnight
   * @throws java.time.DateTimeException if the year is outside the range of {@link LocalDate}
   */
  public Instant toUTCInstant() {
    return toInstant(ZoneOffset.UTC);
  }

  private LocalDate rolledOver() {
    return LocalDate.of(year, 1, 1).plusMonths(month - 1L).plusDays(day - 1L);
  }

  /**
   * Formats the date as {@code YYYY-MM-DD}. Month and day are padded to two digits, the year is
   * not padded.
   *
   * @return the ISO string
   */
  public String toISOString() {
    return year + "-" + twoDigits(month) + "-" + twoDigits(day);
  }

  private static String twoDigits(int value) {
    return value < 10 ? "0" + value : String.valueOf(value);
  }

  /**
   * Returns a new date equal to this one.
   *
   * @return a copy of this date
   */
  public PlainDate copy() {
    return new PlainDate(year, month, day);
  }

  // Calendar rules

  /**
   * Returns true if the year is a leap year.
   *
   * @param year the year
   * @return true for a leap year
   */
  public static boolean isLeapYear(int year) {
    return Gregorian.isLeapYear(year);
  }

  /**
   * Returns the number of days in each month of the year, January first.
   *
   * @param year the year
   * @return a new 12-entry array
   */
  public static int[] daysInMonth(int year) {
    return Gregorian.daysInMonth(year);
  }

  /**
   * Checks whether this is a real calendar date.
   *
   * @return true if the year is at least 1, the month is 1-12 and the day exists in that month
   */
  public boolean isValid() {
    if (year < 1 || month < 1 || month > 12 || day < 1) {
      return false;
    }
    return day <= Gregorian.daysInMonth(year, month);
  }

  // Arithmetic

  /**
   * Returns the date a number of days later. A negative count moves backwards.
   *
   * @param days the number of days to add
   * @return the new date
   */
  public PlainDate addDays(int days) {
    return plusDays(days);
  }

  /**
   * Returns the date a number of days earlier. A negative count moves forwards.
   *
   * @param days the number of days to subtract
   * @return the new date
   */
  public PlainDate subDays(int days) {
    return minusDays(days);
  }

  private PlainDate plusDays(long days) {
    if (days < 0) {
      return minusDays(-days);
    }

    int y = year;
    int m = month;
    int d = day;
    while (days > 0) {
      int monthDays = Gregorian.daysInMonth(y, m);
      if (d + days > monthDays) {
        // Move to the first day of the next month
        days -= monthDays - d + 1;
        d = 1;
        m++;
        if (m > 12) {
          m = 1;
          y++;
        }
      } else {
        d += (int) days;
        days = 0;
      }
    }
    return new PlainDate(y, m, d);
  }

  private PlainDate minusDays(long days) {
    if (days < 0) {
      return plusDays(-days);
    }

    int y = year;
    int m = month;
    int d = day;
    while (days > 0) {
      if (d > days) {
        d -= (int) days;
        days = 0;
      } else {
        // Move to the last day of the previous month
        days -= d;
        m--;
        if (m < 1) {
          m = 12;
          y--;
        }
        d = Gregorian.daysInMonth(y, m);
      }
    }
    return new PlainDate(y, m, d);
  }

  /**
   * Returns the number of days from this date to another, positive when {@code to} is later.
   *
   * @param to the other date
   * @return the signed number of days
   */
  public long getDaysDifference(PlainDate to) {
    if (isAfter(to)) {
      return -to.getDaysDifference(this);
    }

    if (year == to.year) {
      if (month == to.month) {
        return (long) to.day - day;
      }
      long total = Gregorian.daysInMonth(year, month) - (long) day;
      for (int m = month + 1; m < to.month; m++) {
        total += Gregorian.daysInMonth(year, m);
      }
      return total + to.day;
    }

    long total = getDaysDifference(new PlainDate(year, 12, 31)) + 1;
    for (int y = year + 1; y < to.year; y++) {
      total += Gregorian.daysInYear(y);
    }
    return total + new PlainDate(to.year, 1, 1).getDaysDifference(to);
  }

  // Day of week

  /**
   * Returns the day of the week as an index, Sunday=0 to Saturday=6.
   *
   * @return the weekday index
   */
  public int getDayOfWeek() {
    return Math.floorMod(EPOCH_WEEKDAY + EPOCH.getDaysDifference(this), 7);
  }

  /**
   * Returns the day of the week.
   *
   * @return the weekday
   */
  public Weekday getWeekday() {
    return Weekday.fromIndex(getDayOfWeek()).orElseThrow();
  }

  /**
   * Returns the English name of the day of the week, such as {@code "Thursday"}.
   *
   * @return the weekday name
   */
  public String getDayOfWeekStr() {
    return WEEKDAYS.get(getDayOfWeek());
  }

  // Comparison

  /**
   * Checks whether both dates have the same year, month and day.
   *
   * @param date the other date
   * @return true if the fields are equal
   */
  public boolean isEqual(PlainDate date) {
    return year == date.year && month == date.month && day == date.day;
  }

  /**
   * Checks whether this date comes strictly before another, comparing year, then month, then day.
   *
   * @param date the other date
   * @return true if this date is earlier
   */
  public boolean isBefore(PlainDate date) {
    if (year != date.year) {
      return year < date.year;
    }
    if (month != date.month) {
      return month < date.month;
    }
    return day < date.day;
  }

  /**
   * Checks whether this date comes strictly after another.
   *
   * @param date the other date
   * @return true if this date is later
   */
  public boolean isAfter(PlainDate date) {
    return !isBefore(date) && !isEqual(date);
  }

  /**
   * Checks whether this date is earlier than or equal to another.
   *
   * @param date the other date
   * @return true unless this date is later
   */
  public boolean isBeforeOrEqual(PlainDate date) {
    return isBefore(date) || isEqual(date);
  }

  /**
   * Checks whether this date is later than or equal to another.
   *
   * @param date the other date
   * @return true unless this date is earlier
   */
  public boolean isAfterOrEqual(PlainDate date) {
    return isAfter(date) || isEqual(date);
  }

  /**
   * Checks whether this date lies between two dates, both included. The bounds may be given in
   * either order.
   *
   * @param from one bound
   * @param to the other bound
   * @return true if this date is within the interval
   */
  public boolean isInInterval(PlainDate from, PlainDate to) {
    if (to.isBefore(from)) {
      return isInInterval(to, from);
    }
    return isAfterOrEqual(from) && isBeforeOrEqual(to);
  }

  /**
   * Orders dates by year, then month, then day, consistently with {@link #isBefore(PlainDate)}.
   *
   * @param other the other date
   * @return a negative number, zero or a positive number as this date is earlier, equal or later
   */
  @Override
  public int compareTo(PlainDate other) {
    if (year != other.year) {
      return Integer.compare(year, other.year);
    }
    if (month != other.month) {
      return Integer.compare(month, other.month);
    }
    return Integer.compare(day, other.day);
  }

  /**
   * Returns the ISO form of this date.
   *
   * @return the same text as {@link #toISOString()}
   */
  @Override
  public String toString() {
    return toISOString();
  }
}
