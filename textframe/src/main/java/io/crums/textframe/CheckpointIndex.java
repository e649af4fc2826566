/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.textframe;


import java.nio.BufferOverflowException;
import java.nio.BufferUnderflowException;
import java.nio.ByteBuffer;

import io.crums.textframe.io.Serial;
import io.crums.textframe.io.SerialFormatException;

/**
 * Sampled character-to-byte offset index. Checkpoints are recorded every
 * {@linkplain #stride()} characters, beginning with (0,0). Any character
 * offset is resolved to its byte offset by decoding forward from the greatest
 * checkpoint at or before it; so the decoding work per lookup is bounded by the
 * stride.
 * 
 * <h2>Segments</h2>
 * <p>
 * The bytes between 2 consecutive checkpoints (or between the last checkpoint
 * and the end of text) form a <em>segment</em>. Segments whose characters are
 * all 1 byte wide, or all 4 bytes wide, are resolved arithmetically. Others
 * require reading (a prefix of) the segment's bytes thru a
 * {@linkplain SegmentReader}.
 * </p>
 */
final class CheckpointIndex implements Serial {
  
  /**
   * Supplies the bytes of a byte range of the text.
   */
  @FunctionalInterface
  interface SegmentReader {
    
    /**
     * Returns the bytes in the range [{@code beginByte}, {@code endByte}) as
     * the remaining bytes of the returned buffer.
     */
    ByteBuffer read(long beginByte, long endByte);
  }
  
  
  private final int stride;
  private final OffsetVector chars;
  private final OffsetVector bytes;
  private final long charSize;
  private final long byteSize;
  
  
  /**
   * 
   * @param stride      the sampling stride
   * @param chars       checkpoint character offsets
   * @param bytes       checkpoint byte offsets (same size as {@code chars})
   * @param charSize    total no. of characters
   * @param byteSize    total no. of bytes
   * 
   * @throws IllegalArgumentException
   *         if the arguments are not mutually consistent
   */
  CheckpointIndex(
      int stride, OffsetVector chars, OffsetVector bytes,
      long charSize, long byteSize) {
    
    this.stride = TextFrameConstants.checkStride(stride);
    this.chars = chars.trimToSize();
    this.bytes = bytes.trimToSize();
    this.charSize = charSize;
    this.byteSize = byteSize;
    
    if (charSize <= 0 || byteSize < charSize)
      throw new IllegalArgumentException(
          "charSize %d, byteSize %d".formatted(charSize, byteSize));
    if (chars.size() != bytes.size())
      throw new IllegalArgumentException(
          "chars.size() %d != bytes.size() %d".formatted(chars.size(), bytes.size()));
    if (chars.isEmpty() || chars.get(0) != 0 || bytes.get(0) != 0)
      throw new IllegalArgumentException("missing (0,0) checkpoint");
    
    long prevChar = 0;
    long prevByte = 0;
    for (int index = 1; index <= chars.size(); ++index) {
      long c, b;
      if (index == chars.size()) {
        c = charSize;
        b = byteSize;
      } else {
        c = chars.get(index);
        b = bytes.get(index);
      }
      long dc = c - prevChar;
      long db = b - prevByte;
      if (dc <= 0 || db < dc || db > 4 * dc)
        throw new IllegalArgumentException(
            "inconsistent checkpoint at index %d: (%d,%d) after (%d,%d)"
            .formatted(index, c, b, prevChar, prevByte));
      prevChar = c;
      prevByte = b;
    }
  }
  
  
  /** Returns the character stride the checkpoints were sampled at. */
  int stride() {
    return stride;
  }
  
  /** Returns the number of checkpoints. */
  int count() {
    return chars.size();
  }
  
  /** Returns the checkpoint at the given index. */
  Checkpoint checkpoint(int index) {
    return new Checkpoint(chars.get(index), bytes.get(index));
  }
  
  long charSize() {
    return charSize;
  }
  
  long byteSize() {
    return byteSize;
  }
  
  
  /**
   * Returns the checkpoint index of the segment containing the given
   * character offset.
   * 
   * @param charOffset  &ge; 0 and &lt; {@linkplain #charSize()}
   */
  int segmentIndex(long charOffset) {
    return chars.floorIndex(charOffset);
  }
  
  
  /** Returns the ending byte offset (exclusive) of the segment at the given index. */
  long segmentEndByte(int index) {
    return index + 1 == chars.size() ? byteSize : bytes.get(index + 1);
  }
  
  /** Returns the ending char offset (exclusive) of the segment at the given index. */
  long segmentEndChar(int index) {
    return index + 1 == chars.size() ? charSize : chars.get(index + 1);
  }
  
  
  /**
   * Resolves the given character offset to its byte offset.
   * 
   * @param charOffset  in the range [0, {@linkplain #charSize()}]
   * @param reader      used only if the segment containing the offset
   *                    has characters of mixed width
   *                    
   * @return the byte offset the character at {@code charOffset} begins at
   * @throws OffsetOutOfBoundsException if {@code charOffset} is out of bounds
   */
  long resolve(long charOffset, SegmentReader reader)
      throws OffsetOutOfBoundsException {
    
    long byteOffset = resolveFixed(charOffset);
    if (byteOffset != -1)
      return byteOffset;
    
    final int index = segmentIndex(charOffset);
    final long cpByte = bytes.get(index);
    final long delta = charOffset - chars.get(index);
    
    long endByte = cpByte + Math.min(segmentEndByte(index) - cpByte, 4 * delta);
    ByteBuffer segment = reader.read(cpByte, endByte);
    return cpByte + Utf8.skipChars(segment, delta);
  }
  
  
  /**
   * Resolves the given character offset to its byte offset without reading
   * any text, if possible. This is the case when the offset is at a
   * checkpoint (or the end of text), or when its segment's characters are
   * uniformly 1 or 4 bytes wide.
   * 
   * @param charOffset  in the range [0, {@linkplain #charSize()}]
   * 
   * @return the byte offset, or -1 if the text must be decoded
   * @throws OffsetOutOfBoundsException if {@code charOffset} is out of bounds
   */
  long resolveFixed(long charOffset) throws OffsetOutOfBoundsException {
    if (charOffset < 0 || charOffset > charSize)
      throw new OffsetOutOfBoundsException(charOffset, charSize);
    if (charOffset == charSize)
      return byteSize;
    
    final int index = segmentIndex(charOffset);
    final long cpChar = chars.get(index);
    final long cpByte = bytes.get(index);
    final long delta = charOffset - cpChar;
    if (delta == 0)
      return cpByte;
    
    final long segChars = segmentEndChar(index) - cpChar;
    final long segBytes = segmentEndByte(index) - cpByte;
    if (segBytes == segChars)
      return cpByte + delta;
    if (segBytes == 4 * segChars)
      return cpByte + 4 * delta;
    return -1;
  }
  
  
  /**
   * Returns the greatest checkpoint at or before the given character offset.
   * 
   * @param charOffset  &ge; 0
   */
  Checkpoint floor(long charOffset) {
    return checkpoint(segmentIndex(charOffset));
  }
  
  
  /**
   * Resolves the given byte offset to its character offset. The byte offset
   * is assumed to be on a character boundary.
   * 
   * @param byteOffset  in the range [0, {@linkplain #byteSize()}]
   * @param reader      used only if the segment containing the offset
   *                    has characters of mixed width
   * 
   * @return the no. of characters before {@code byteOffset}
   * @throws OffsetOutOfBoundsException if {@code byteOffset} is out of bounds
   */
  long charOffsetOf(long byteOffset, SegmentReader reader)
      throws OffsetOutOfBoundsException {
    
    if (byteOffset < 0 || byteOffset > byteSize)
      throw new OffsetOutOfBoundsException(byteOffset, byteSize);
    if (byteOffset == byteSize)
      return charSize;
    
    final int index = bytes.floorIndex(byteOffset);
    final long cpChar = chars.get(index);
    final long cpByte = bytes.get(index);
    final long delta = byteOffset - cpByte;
    if (delta == 0)
      return cpChar;
    
    final long segChars = segmentEndChar(index) - cpChar;
    final long segBytes = segmentEndByte(index) - cpByte;
    if (segBytes == segChars)
      return cpChar + delta;
    if (segBytes == 4 * segChars)
      return cpChar + delta / 4;
    
    return cpChar + Utf8.countChars(reader.read(cpByte, byteOffset));
  }
  
  
  @Override
  public boolean equals(Object o) {
    return
        o == this ||
        o instanceof CheckpointIndex other &&
        other.stride == stride &&
        other.charSize == charSize &&
        other.byteSize == byteSize &&
        other.chars.equals(chars) &&
        other.bytes.equals(bytes);
  }
  
  
  @Override
  public int hashCode() {
    return Long.hashCode(charSize * 31 + byteSize) ^ stride;
  }
  
  
  //      S  E  R  I  A  L
  
  @Override
  public int serialSize() {
    return 4 + chars.serialSize() + bytes.serialSize();
  }

  /** Writes the stride and the checkpoints. The totals are not written. */
  @Override
  public ByteBuffer writeTo(ByteBuffer out) throws BufferOverflowException {
    out.putInt(stride);
    chars.writeTo(out);
    return bytes.writeTo(out);
  }
  
  
  /**
   * Loads and returns an instance from its serial form.
   * 
   * @param in          positioned at the start of the serial form
   * @param charSize    total no. of characters (recorded elsewhere)
   * @param byteSize    total no. of bytes (recorded elsewhere)
   * 
   * @throws SerialFormatException if malformed or inconsistent
   */
  static CheckpointIndex load(ByteBuffer in, long charSize, long byteSize)
      throws SerialFormatException {
    try {
      int stride = in.getInt();
      var chars = OffsetVector.load(in);
      var bytes = OffsetVector.load(in);
      return new CheckpointIndex(stride, chars, bytes, charSize, byteSize);
    
    } catch (SerialFormatException sfx) {
      throw sfx;
    } catch (IllegalArgumentException | BufferUnderflowException x) {
      throw new SerialFormatException(
          "on loading checkpoint index: " + x.getMessage(), x);
    }
  }

}
