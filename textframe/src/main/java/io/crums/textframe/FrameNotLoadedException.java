/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.textframe;

/**
 * Thrown by the non-loading accessors when no loaded frame covers the
 * requested range. The range is reported in the units it was requested in:
 * characters for {@linkplain TextFile#get(long, long)}, bytes otherwise.
 * 
 * @see TextFile#get(long, long)
 * @see TextFile#getOrLoad(long, long)
 */
@SuppressWarnings("serial")
public class FrameNotLoadedException extends TextFrameException {
  
  /** Creates an instance for the given character range. */
  public static FrameNotLoadedException forChars(long begin, long end) {
    return new FrameNotLoadedException(begin, end, false);
  }
  
  /** Creates an instance for the given byte range. */
  public static FrameNotLoadedException forBytes(long begin, long end) {
    return new FrameNotLoadedException(begin, end, true);
  }
  
  
  private final long begin;
  private final long end;
  private final boolean byteRange;

  private FrameNotLoadedException(long begin, long end, boolean byteRange) {
    super("text not loaded: %s [%d, %d)".formatted(
        byteRange ? "bytes" : "chars", begin, end));
    this.begin = begin;
    this.end = end;
    this.byteRange = byteRange;
  }
  
  
  /** Returns the requested range's beginning offset (inclusive). */
  public final long begin() {
    return begin;
  }
  
  /** Returns the requested range's ending offset (exclusive). */
  public final long end() {
    return end;
  }
  
  /**
   * Returns {@code true} if the range is in bytes; {@code false}, if in
   * characters.
   */
  public final boolean isByteRange() {
    return byteRange;
  }

}
