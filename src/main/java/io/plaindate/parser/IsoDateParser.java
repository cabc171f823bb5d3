package io.plaindate.parser;

import io.plaindate.PlainDate;
import io.plaindate.PlainDateException;
import io.plaindate.Span;
import java.util.ArrayList;
import java.util.List;
import java.util.OptionalInt;

/**
 * Reads {@code YYYY-MM-DD} text into a {@link PlainDate}.
 *
 * <p>Parsing happens in two phases: the text is split into three integer components and a date is
 * built from them without validation, then the date is validated. A leading {@code -} produces an
 * empty first component, so negative years cannot be written.
 *
 * <p>A component is accepted when it is a canonical decimal integer ({@code 0}, or a non-zero digit
 * followed by digits), optionally prefixed by one extra {@code 0}. {@code 05}, {@code 00} and
 * {@code 010} are accepted; {@code 007}, {@code +5}, {@code 5.0} and the empty string are not.
 * An accepted component too large for an int names no calendar day and fails as an invalid date.
 */
public final class IsoDateParser {
  private static final char SEPARATOR = '-';

  private final String input;

  private IsoDateParser(String input) {
    this.input = input;
  }

  /**
   * Parses an ISO date string.
   *
   * @param input the text to parse
   * @return the parsed date, always valid
   * @throws PlainDateException if the text is malformed or names no calendar day
   */
  public static PlainDate parse(String input) throws PlainDateException {
    return new IsoDateParser(input).parseDate();
  }

  /**
   * Checks the syntax of a single integer component. The value may be too large for an int.
   *
   * @param token the component text
   * @return true if the text is an accepted integer token
   */
  public static boolean isIntegerToken(String token) {
    String digits = withoutExtraZero(token);
    if (digits.isEmpty() || !allDigits(digits)) {
      return false;
    }
    return digits.length() == 1 || digits.charAt(0) != '0';
  }

  /**
   * Reads a single integer component.
   *
   * @param token the component text
   * @return the value, or empty if the text is not an accepted integer token or overflows an int
   */
  public static OptionalInt integerToken(String token) {
    if (!isIntegerToken(token)) {
      return OptionalInt.empty();
    }
    try {
      return OptionalInt.of(Integer.parseInt(withoutExtraZero(token)));
    } catch (NumberFormatException e) {
      // more digits than an int holds
      return OptionalInt.empty();
    }
  }

  private PlainDate parseDate() throws PlainDateException {
    List<Component> components = split();
    if (components.size() != 3) {
      throw PlainDateException.notIsoString(input);
    }

    for (Component component : components) {
      if (!isIntegerToken(component.text())) {
        throw PlainDateException.invalidToken(component.text(), component.span(), input);
      }
    }

    int year = readComponent(components.get(0));
    int month = readComponent(components.get(1));
    int day = readComponent(components.get(2));

    PlainDate date = new PlainDate(year, month, day);
    if (!date.isValid()) {
      throw PlainDateException.invalidDate(input);
    }
    return date;
  }

  private int readComponent(Component component) throws PlainDateException {
    OptionalInt value = integerToken(component.text());
    if (value.isEmpty()) {
      // well formed, but beyond any year, month or day
      throw PlainDateException.invalidDate(input);
    }
    return value.getAsInt();
  }

  /** Splits on every separator, keeping empty components and their positions. */
  private List<Component> split() {
    List<Component> components = new ArrayList<>();
    int start = 0;
    for (int pos = 0; pos < input.length(); pos++) {
      if (input.charAt(pos) == SEPARATOR) {
        components.add(new Component(input.substring(start, pos), new Span(start, pos)));
        start = pos + 1;
      }
    }
    components.add(new Component(input.substring(start), new Span(start, input.length())));
    return components;
  }

  private static String withoutExtraZero(String token) {
    return token.length() > 1 && token.charAt(0) == '0' ? token.substring(1) : token;
  }

  private static boolean allDigits(String s) {
    for (int i = 0; i < s.length(); i++) {
      char c = s.charAt(i);
      if (c < '0' || c > '9') {
        return false;
      }
    }
    return true;
  }

  private record Component(String text, Span span) {}
}
