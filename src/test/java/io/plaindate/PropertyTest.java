package io.plaindate;

import static org.junit.jupiter.api.Assertions.*;

import io.plaindate.calendar.Weekday;
import java.time.LocalDate;
import java.time.YearMonth;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;
import org.junit.jupiter.api.DynamicTest;
import org.junit.jupiter.api.TestFactory;

/**
 * Laws that hold for every date, checked over whole years and against java.time.LocalDate, which
 * uses the same proleptic Gregorian rules.
 */
public class PropertyTest {
  private static final List<Integer> YEARS =
      List.of(
          1, 4, 100, 1582, 1600, 1899, 1900, 1969, 1970, 1999, 2000, 2023, 2024, 2100, 2400, 9999);

  private static final int[] OFFSETS = {
    -100000, -1000, -366, -365, -59, -31, -29, -28, -1, 0, 1, 28, 29, 31, 59, 365, 366, 1000, 100000
  };

  private static PlainDate of(LocalDate d) {
    return new PlainDate(d.getYear(), d.getMonthValue(), d.getDayOfMonth());
  }

  private static LocalDate toLocalDate(PlainDate d) {
    return LocalDate.of(d.year(), d.month(), d.day());
  }

  private static List<LocalDate> daysOf(int year) {
    List<LocalDate> days = new ArrayList<>();
    for (LocalDate d = LocalDate.of(year, 1, 1); d.getYear() == year; d = d.plusDays(1)) {
      days.add(d);
    }
    return days;
  }

  private static Stream<DynamicTest> perYear(String property, YearCheck check) {
    return YEARS.stream()
        .map(year -> DynamicTest.dynamicTest(property + "/" + year, () -> check.run(year)));
  }

  @FunctionalInterface
  private interface YearCheck {
    void run(int year) throws Exception;
  }

  @TestFactory
  Stream<DynamicTest> isoStringRoundTrip() {
    return perYear(
        "roundtrip",
        year -> {
          for (LocalDate d : daysOf(year)) {
            PlainDate date = of(d);
            assertTrue(PlainDate.fromISOString(date.toISOString()).isEqual(date), date.toString());
            if (year >= 1000) {
              assertEquals(d.toString(), date.toISOString());
            }
          }
        });
  }

  @TestFactory
  Stream<DynamicTest> validityMatchesCalendar() {
    return perYear(
        "valid",
        year -> {
          for (int month = 0; month <= 13; month++) {
            for (int day = -1; day <= 32; day++) {
              boolean expected =
                  month >= 1
                      && month <= 12
                      && day >= 1
                      && YearMonth.of(year, month).isValidDay(day);
              assertEquals(
                  expected,
                  new PlainDate(year, month, day).isValid(),
                  year + "-" + month + "-" + day);
            }
          }
        });
  }

  @TestFactory
  Stream<DynamicTest> addAndSubAreInverse() {
    return perYear(
        "inverse",
        year -> {
          for (LocalDate d : daysOf(year)) {
            PlainDate date = of(d);
            for (int n : OFFSETS) {
              assertTrue(date.addDays(n).subDays(n).isEqual(date), date + " +/- " + n);
              assertTrue(date.subDays(n).addDays(n).isEqual(date), date + " -/+ " + n);
            }
          }
        });
  }

  @TestFactory
  Stream<DynamicTest> addDaysMatchesLocalDate() {
    return perYear(
        "addDays",
        year -> {
          for (LocalDate d : daysOf(year)) {
            PlainDate date = of(d);
            for (int n : OFFSETS) {
              assertEquals(of(d.plusDays(n)), date.addDays(n), date + " + " + n);
              assertEquals(of(d.minusDays(n)), date.subDays(n), date + " - " + n);
            }
          }
        });
  }

  @TestFactory
  Stream<DynamicTest> daysDifferenceMatchesLocalDate() {
    return perYear(
        "difference",
        year -> {
          LocalDate anchor = LocalDate.of(2000, 3, 1);
          PlainDate plainAnchor = of(anchor);
          for (LocalDate d : daysOf(year)) {
            PlainDate date = of(d);
            long expected = ChronoUnit.DAYS.between(d, anchor);
            assertEquals(expected, date.getDaysDifference(plainAnchor), date.toString());
            assertEquals(-expected, plainAnchor.getDaysDifference(date), date.toString());
          }
        });
  }

  @TestFactory
  Stream<DynamicTest> weekdayMatchesLocalDate() {
    return perYear(
        "weekday",
        year -> {
          for (LocalDate d : daysOf(year)) {
            PlainDate date = of(d);
            Weekday weekday = date.getWeekday();
            assertEquals(Weekday.fromDayOfWeek(d.getDayOfWeek()), weekday, date.toString());
            assertEquals(d.getDayOfWeek(), weekday.toDayOfWeek());
            int index = date.getDayOfWeek();
            assertTrue(index >= 0 && index <= 6);
          }
        });
  }

  @TestFactory
  Stream<DynamicTest> orderingIsTotal() {
    List<PlainDate> dates =
        List.of(
            new PlainDate(1, 1, 1),
            new PlainDate(1969, 12, 31),
            new PlainDate(1970, 1, 1),
            new PlainDate(2024, 1, 31),
            new PlainDate(2024, 2, 1),
            new PlainDate(2024, 2, 29),
            new PlainDate(2024, 3, 1),
            new PlainDate(2024, 12, 31),
            new PlainDate(2025, 1, 1),
            new PlainDate(9999, 12, 31));
    List<DynamicTest> tests = new ArrayList<>();
    for (PlainDate a : dates) {
      tests.add(
          DynamicTest.dynamicTest(
              "trichotomy/" + a,
              () -> {
                for (PlainDate b : dates) {
                  int holds =
                      (a.isBefore(b) ? 1 : 0) + (a.isEqual(b) ? 1 : 0) + (a.isAfter(b) ? 1 : 0);
                  assertEquals(1, holds, a + " vs " + b);
                  assertEquals(a.isBefore(b), b.isAfter(a));
                  assertEquals(
                      Integer.signum(toLocalDate(a).compareTo(toLocalDate(b))),
                      Integer.signum(a.compareTo(b)),
                      a + " vs " + b);
                  assertEquals(-a.getDaysDifference(b), b.getDaysDifference(a));
                  assertEquals(a.isBefore(b), a.getDaysDifference(b) > 0);
                }
              }));
    }
    return tests.stream();
  }

  @TestFactory
  Stream<DynamicTest> intervalIsInclusiveInEitherOrder() {
    PlainDate from = new PlainDate(2023, 11, 15);
    PlainDate to = new PlainDate(2024, 3, 15);
    return Stream.of(2023, 2024)
        .map(
            year ->
                DynamicTest.dynamicTest(
                    "interval/" + year,
                    () -> {
                      for (LocalDate d : daysOf(year)) {
                        PlainDate date = of(d);
                        boolean expected = !date.isBefore(from) && !date.isAfter(to);
                        assertEquals(expected, date.isInInterval(from, to), date.toString());
                        assertEquals(expected, date.isInInterval(to, from), date.toString());
                      }
                    }));
  }
}
