package io.verbatim.syntax.api;

/**
 * Half-open character range {@code [start, end)} into the source text.
 *
 * @param start first offset, inclusive
 * @param end last offset, exclusive
 */
public record TextRange(int start, int end) {

  public TextRange {
    if (start < 0 || end < start) {
      throw new IllegalArgumentException("Invalid text range: " + start + ".." + end);
    }
  }

  public static TextRange of(int start, int end) {
    return new TextRange(start, end);
  }

  public static TextRange empty(int offset) {
    return new TextRange(offset, offset);
  }

  public int length() {
    return end - start;
  }

  public boolean isEmpty() {
    return start == end;
  }

  public boolean contains(int offset) {
    return offset >= start && offset < end;
  }

  public boolean contains(TextRange other) {
    return start <= other.start && other.end <= end;
  }

  /** Smallest range covering both this range and {@code other}. */
  public TextRange cover(TextRange other) {
    return new TextRange(Math.min(start, other.start), Math.max(end, other.end));
  }

  public String slice(CharSequence text) {
    return text.subSequence(start, end).toString();
  }

  @Override
  public String toString() {
    return start + ".." + end;
  }
}
