package io.plaindate;

/**
 * Represents a range of character positions in the parsed input.
 *
 * @param start the start position (inclusive)
 * @param end the end position (exclusive)
 */
public record Span(int start, int end) {
  /**
   * Returns a span covering the whole of the given text.
   *
   * @param text the text
   * @return a span from 0 to the text length
   */
  public static Span of(String text) {
    return new Span(0, text.length());
  }

  /**
   * Returns the length of this span, at least 1 so that empty components can be pointed at.
   *
   * @return the number of characters covered by this span
   */
  public int length() {
    return Math.max(1, end - start);
  }
}
