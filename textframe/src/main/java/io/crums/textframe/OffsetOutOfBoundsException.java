/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.textframe;

/**
 * Thrown when a (resolved) offset falls outside the text. Negative offsets
 * are end-relative; those that resolve below zero end up here too.
 */
@SuppressWarnings("serial")
public class OffsetOutOfBoundsException extends TextFrameException {

  private final long requested;
  private final long total;
  
  
  /**
   * @param requested   the offending offset (after resolution, if relative)
   * @param total       the total length offsets are bounded by
   */
  public OffsetOutOfBoundsException(long requested, long total) {
    this(requested, total,
        "offset %d out of bounds [0, %d]".formatted(requested, total));
  }
  

  public OffsetOutOfBoundsException(long requested, long total, String message) {
    super(message);
    this.requested = requested;
    this.total = total;
  }
  
  
  /** Returns the offending offset. */
  public final long requested() {
    return requested;
  }
  
  /** Returns the upper bound (inclusive) the offset violated. */
  public final long total() {
    return total;
  }

}
