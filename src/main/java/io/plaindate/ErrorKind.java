package io.plaindate;

/** The type of error raised when text cannot be read as a date. */
public enum ErrorKind {
  /** Malformed input - wrong number of components or a component that is not an integer. */
  MALFORMED_INPUT("malformed_input"),
  /** Invalid date - the components are integers but do not name a calendar day. */
  INVALID_DATE("invalid_date");

  private final String value;

  ErrorKind(String value) {
    this.value = value;
  }

  /**
   * Returns the lowercase string representation.
   *
   * @return the kind as a lowercase string
   */
  public String value() {
    return value;
  }

  @Override
  public String toString() {
    return value;
  }
}
