/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.textframe;

/**
 * Resolves relative (end-relative) ranges to absolute ones. The same rules
 * apply to char offsets and line no.s:
 * <ol>
 * <li>A non-negative value is absolute.</li>
 * <li>A negative value {@code v} means {@code total + v}.</li>
 * <li>An <em>end</em> value of exactly zero means {@code total}. So
 * {@code (0, 0)} is everything, and {@code (-10, 0)} is the last 10 units.</li>
 * </ol>
 * Negative values are resolved before bounds are checked, so a value that
 * resolves below zero is out of bounds (it is not clamped). Bounds are checked
 * before the range's order is.
 */
public final class RangeResolver {
  
  private RangeResolver() {  }   // never
  
  
  /** What is being resolved. Determines the exception type on bounds errors. */
  public enum Unit {
    /** Character (code point) offsets. */
    CHAR,
    /** Line numbers. */
    LINE;
    
    
    TextFrameException outOfBounds(long requested, long total) {
      return this == CHAR ?
          new OffsetOutOfBoundsException(requested, total) :
            new LineOutOfBoundsException(requested, total);
    }
  }
  
  
  /**
   * Resolves the given range.
   * 
   * @param start       start offset (inclusive); negative is end-relative
   * @param end         end offset (exclusive); negative is end-relative;
   *                    zero means {@code total}
   * @param total       the total no. of units (&ge; 0)
   * @param unit        the unit being resolved
   * 
   * @return the absolute range
   * @throws OffsetOutOfBoundsException
   *         if a {@linkplain Unit#CHAR CHAR} offset resolves outside [0, total]
   * @throws LineOutOfBoundsException
   *         if a {@linkplain Unit#LINE LINE} no. resolves outside [0, total]
   * @throws InvertedRangeException
   *         if the resolved start exceeds the resolved end
   */
  public static OffsetRange resolve(long start, long end, long total, Unit unit) {
    if (total < 0)
      throw new IllegalArgumentException("total " + total);
    
    long absStart = start < 0 ? total + start : start;
    long absEnd = end <= 0 ? total + end : end;
    
    if (absStart < 0 || absStart > total)
      throw unit.outOfBounds(absStart, total);
    if (absEnd < 0 || absEnd > total)
      throw unit.outOfBounds(absEnd, total);
    if (absStart > absEnd)
      throw new InvertedRangeException(absStart, absEnd);
    
    return new OffsetRange(absStart, absEnd);
  }
  
  
  /**
   * Resolves a single, possibly negative, position. Unlike a range's end,
   * zero here means zero.
   * 
   * @return {@code pos < 0 ? total + pos : pos}, bounds-checked to [0, total]
   */
  public static long resolvePosition(long pos, long total, Unit unit) {
    long abs = pos < 0 ? total + pos : pos;
    if (abs < 0 || abs > total)
      throw unit.outOfBounds(abs, total);
    return abs;
  }

}
