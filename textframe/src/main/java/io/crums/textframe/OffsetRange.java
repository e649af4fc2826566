/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.textframe;

/**
 * An absolute, end-exclusive range of offsets. The offsets may be chars,
 * bytes, or line no.s, depending on context.
 * 
 * @param begin     &ge; 0
 * @param end       &ge; {@code begin}
 */
public record OffsetRange(long begin, long end) {
  
  public OffsetRange {
    if (begin < 0)
      throw new IllegalArgumentException("begin " + begin);
    if (end < begin)
      throw new InvertedRangeException(begin, end);
  }
  
  /** Returns {@code end - begin}. */
  public long length() {
    return end - begin;
  }
  
  /** Returns {@code true} iff the range is empty. */
  public boolean isEmpty() {
    return begin == end;
  }

}
