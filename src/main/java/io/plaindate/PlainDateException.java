package io.plaindate;

import java.util.Optional;

/** Exception thrown when a string cannot be read as a {@link PlainDate}. */
public final class PlainDateException extends Exception {
  /** The error kind. */
  private final ErrorKind kind;

  /** The original input string. */
  private final String input;

  /** The component of the input that was rejected, if the failure is about one component. */
  private final String token;

  /** The location of the rejected text in the input. */
  private final Span span;

  private PlainDateException(
      ErrorKind kind, String message, String input, String token, Span span) {
    super(message);
    this.kind = kind;
    this.input = input;
    this.token = token;
    this.span = span;
  }

  /**
   * Creates an error for input that does not split into three components.
   *
   * @param input the original input string
   * @return a new PlainDateException for malformed input
   */
  public static PlainDateException notIsoString(String input) {
    return new PlainDateException(
        ErrorKind.MALFORMED_INPUT,
        "Expression '" + input + "' is not a valid ISO string",
        input,
        null,
        Span.of(input));
  }

  /**
   * Creates an error for a component that is not an integer token.
   *
   * @param token the rejected component
   * @param span the location of the component in the input
   * @param input the original input string
   * @return a new PlainDateException for malformed input
   */
  public static PlainDateException invalidToken(String token, Span span, String input) {
    return new PlainDateException(
        ErrorKind.MALFORMED_INPUT,
        "Expression '" + token + "' in '" + input + "' is not valid",
        input,
        token,
        span);
  }

  /**
   * Creates an error for integer components that do not form a calendar date.
   *
   * @param input the original input string
   * @return a new PlainDateException for an invalid date
   */
  public static PlainDateException invalidDate(String input) {
    return new PlainDateException(
        ErrorKind.INVALID_DATE,
        "Expression '" + input + "' is not a valid date",
        input,
        null,
        Span.of(input));
  }

  /**
   * Returns the kind of error.
   *
   * @return the error kind
   */
  public ErrorKind kind() {
    return kind;
  }

  /**
   * Returns the original input string.
   *
   * @return the input
   */
  public String input() {
    return input;
  }

  /**
   * Returns the rejected component, if the error concerns a single component.
   *
   * @return the token, or empty if the whole input was rejected
   */
  public Optional<String> token() {
    return Optional.ofNullable(token);
  }

  /**
   * Returns the location of the rejected text.
   *
   * @return the span
   */
  public Span span() {
    return span;
  }

  /**
   * Formats the message with the input and an underline below the rejected text.
   *
   * <pre>
   * error: Expression 'NOV' in '2125-NOV-29' is not valid
   *   2125-NOV-29
   *        ^^^
   * </pre>
   *
   * @return a formatted error message
   */
  public String displayRich() {
    StringBuilder sb = new StringBuilder();
    sb.append("error: ").append(getMessage()).append("\n");
    sb.append("  ").append(input).append("\n");
    sb.append(" ".repeat(span.start() + 2));
    sb.append("^".repeat(span.length()));
    return sb.toString();
  }
}
