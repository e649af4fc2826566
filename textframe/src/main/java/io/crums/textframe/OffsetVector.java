/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.textframe;


import java.nio.BufferOverflowException;
import java.nio.BufferUnderflowException;
import java.nio.ByteBuffer;
import java.util.Arrays;

import io.crums.textframe.io.Serial;
import io.crums.textframe.io.SerialFormatException;

/**
 * Append-only sequence of non-negative, non-decreasing offsets. Values are
 * kept in an {@code int[]} while they fit, and switch to a {@code long[]}
 * after the first one that doesn't. The serial form likewise uses 4-byte
 * words when it can.
 * 
 * <h2>Serial Format</h2>
 * <p>
 * {@code byte width (4|8)}, {@code int count}, followed by {@code count}
 * words of the given width.
 * </p>
 */
final class OffsetVector implements Serial {
  
  private final static int INIT_CAPACITY = 16;
  
  private int[] ints;
  private long[] longs;
  private int count;
  
  
  OffsetVector() {
    this(INIT_CAPACITY);
  }
  
  OffsetVector(int capacity) {
    ints = new int[Math.max(1, capacity)];
  }
  
  
  /**
   * Appends the given offset.
   * 
   * @param offset      &ge; the last offset
   * @return {@code this}
   */
  OffsetVector add(long offset) {
    if (count > 0 && offset < last())
      throw new IllegalArgumentException(
          "offset %d < last offset %d".formatted(offset, last()));
    if (offset < 0)
      throw new IllegalArgumentException("negative offset " + offset);
    
    if (longs != null) {
      if (count == longs.length)
        longs = Arrays.copyOf(longs, grow(count));
      longs[count++] = offset;
    } else if (offset > Integer.MAX_VALUE) {
      longs = new long[Math.max(ints.length, count + 1)];
      for (int index = count; index-- > 0; )
        longs[index] = ints[index];
      ints = null;
      longs[count++] = offset;
    } else {
      if (count == ints.length)
        ints = Arrays.copyOf(ints, grow(count));
      ints[count++] = (int) offset;
    }
    return this;
  }
  
  
  private int grow(int size) {
    int newSize = size + (size >> 1) + 1;
    if (newSize < 0 || newSize > Integer.MAX_VALUE - 8)
      throw new IllegalStateException("capacity overflow at " + size);
    return newSize;
  }
  
  
  /** Returns the number of offsets. */
  int size() {
    return count;
  }
  
  
  boolean isEmpty() {
    return count == 0;
  }
  
  
  long get(int index) {
    if (index < 0 || index >= count)
      throw new IndexOutOfBoundsException(
          "index " + index + " out of bounds; size " + count);
    return longs == null ? ints[index] : longs[index];
  }
  
  
  /** Returns the last offset. */
  long last() {
    return get(count - 1);
  }
  
  
  /**
   * Returns the index of the last element with value &le; {@code key}, or
   * -1 if every element is greater. With duplicate values, the highest
   * index among them is returned.
   */
  int floorIndex(long key) {
    int lo = 0;
    int hi = count - 1;
    int floor = -1;
    while (lo <= hi) {
      int mid = (lo + hi) >>> 1;
      if (get(mid) <= key) {
        floor = mid;
        lo = mid + 1;
      } else
        hi = mid - 1;
    }
    return floor;
  }
  
  
  /** Releases unused capacity. */
  OffsetVector trimToSize() {
    if (longs != null) {
      if (longs.length > count)
        longs = Arrays.copyOf(longs, count);
    } else if (ints.length > count && count > 0)
      ints = Arrays.copyOf(ints, count);
    return this;
  }
  
  
  /** Returns the serial word width: 4 or 8. */
  int width() {
    return longs == null ? 4 : 8;
  }
  
  
  @Override
  public boolean equals(Object o) {
    if (o == this)
      return true;
    if (!(o instanceof OffsetVector other) || other.count != count)
      return false;
    for (int index = count; index-- > 0; )
      if (get(index) != other.get(index))
        return false;
    return true;
  }
  
  
  @Override
  public int hashCode() {
    return count == 0 ? 0 : Long.hashCode(last()) * 31 + count;
  }
  
  
  @Override
  public String toString() {
    return "OffsetVector[size=" + count + ", width=" + width() + "]";
  }
  
  
  //      S  E  R  I  A  L
  
  @Override
  public int serialSize() {
    return 5 + count * width();
  }
  
  
  @Override
  public ByteBuffer writeTo(ByteBuffer out) throws BufferOverflowException {
    out.put((byte) width()).putInt(count);
    if (longs == null)
      for (int index = 0; index < count; ++index)
        out.putInt(ints[index]);
    else
      for (int index = 0; index < count; ++index)
        out.putLong(longs[index]);
    return out;
  }
  
  
  /**
   * Loads and returns an instance from its serial form. On return, the
   * buffer is positioned after the last byte read.
   * 
   * @throws SerialFormatException
   *         if the data is malformed or the offsets are not ascending
   */
  static OffsetVector load(ByteBuffer in) throws SerialFormatException {
    try {
      final int width = in.get();
      final int count = in.getInt();
      if (width != 4 && width != 8)
        throw new SerialFormatException("bad offset width " + width);
      if (count < 0)
        throw new SerialFormatException("negative offset count " + count);
      if ((long) count * width > in.remaining())
        throw new SerialFormatException(
            "offset count %d (width %d) exceeds remaining bytes %d"
            .formatted(count, width, in.remaining()));
      
      var vector = new OffsetVector(count);
      for (int index = 0; index < count; ++index) {
        long offset = width == 4 ? in.getInt() : in.getLong();
        if (offset < 0 || (index > 0 && offset < vector.last()))
          throw new SerialFormatException(
              "offset %d at index %d out of sequence".formatted(offset, index));
        vector.add(offset);
      }
      return vector;
      
    } catch (BufferUnderflowException bux) {
      throw new SerialFormatException("offset vector truncated: " + in, bux);
    }
  }

}
