/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.textframe;


import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;

import com.google.common.primitives.Ints;

import io.crums.textframe.io.ChannelUtils;

/**
 * An immutable, validated excerpt of a text's bytes. A frame begins and ends
 * on character boundaries, and knows both its byte and its character bounds,
 * so offsets within it are resolved from its own bytes. Its backing array is
 * never modified or replaced.
 */
final class Frame {
  
  /** Maximum frame size in bytes. */
  final static int MAX_SIZE = Integer.MAX_VALUE - 8;
  
  
  /**
   * Reads, validates, and returns a new frame.
   * 
   * @param file        the text file
   * @param beginByte   starting offset (inclusive), on a character boundary
   * @param endByte     ending offset (exclusive), on a character boundary
   * @param beginChar   the character offset {@code beginByte} corresponds to
   * 
   * @throws InvalidEncodingException
   *         if the bytes read are not valid UTF-8
   * @throws IllegalArgumentException
   *         if the range is larger than {@linkplain #MAX_SIZE}
   */
  static Frame load(FileChannel file, long beginByte, long endByte, long beginChar)
      throws IOException {
    
    int size = Ints.checkedCast(endByte - beginByte);
    if (size > MAX_SIZE || size <= 0)
      throw new IllegalArgumentException(
          "frame size %d for range [%d, %d)".formatted(size, beginByte, endByte));
    
    byte[] bytes = new byte[size];
    ChannelUtils.readRemaining(file, beginByte, ByteBuffer.wrap(bytes));
    long chars = Utf8.validate(bytes, beginByte);
    return new Frame(beginByte, beginChar, bytes, chars);
  }
  
  
  
  private final long beginByte;
  private final long beginChar;
  private final byte[] bytes;
  private final long chars;
  
  
  private Frame(long beginByte, long beginChar, byte[] bytes, long chars) {
    this.beginByte = beginByte;
    this.beginChar = beginChar;
    this.bytes = bytes;
    this.chars = chars;
  }
  
  
  long beginByte() {
    return beginByte;
  }
  
  long endByte() {
    return beginByte + bytes.length;
  }
  
  long beginChar() {
    return beginChar;
  }
  
  long endChar() {
    return beginChar + chars;
  }
  
  /** Returns the frame's size in bytes. */
  int size() {
    return bytes.length;
  }
  
  /** Returns the number of characters in this frame. */
  long chars() {
    return chars;
  }
  
  
  /** Returns {@code true} iff this frame contains the given byte range. */
  boolean covers(long begin, long end) {
    return beginByte <= begin && end <= endByte();
  }
  
  
  /** Returns {@code true} iff this frame contains the given character range. */
  boolean coversChars(long begin, long end) {
    return beginChar <= begin && end <= endChar();
  }
  
  
  /**
   * Returns the byte offset of the given character offset. Decoding starts
   * from the checkpoint preceding the offset, or from this frame's beginning,
   * whichever is nearer; so no more than a stride's worth of characters
   * are skipped.
   * 
   * @param checkpoints the text's checkpoints
   * @param charOffset  in the range [{@linkplain #beginChar()}, {@linkplain #endChar()}]
   */
  long byteOffset(CheckpointIndex checkpoints, long charOffset) {
    if (!coversChars(charOffset, charOffset))
      throw new IndexOutOfBoundsException(
          "char offset %d not in frame chars [%d, %d)"
          .formatted(charOffset, beginChar, endChar()));
    
    long offset = checkpoints.resolveFixed(charOffset);
    if (offset != -1)
      return offset;
    
    Checkpoint floor = checkpoints.floor(charOffset);
    long fromChar = beginChar;
    long fromByte = beginByte;
    if (floor.charOffset() > beginChar) {
      fromChar = floor.charOffset();
      fromByte = floor.byteOffset();
    }
    var from = ByteBuffer.wrap(
        bytes, (int) (fromByte - beginByte), (int) (endByte() - fromByte));
    return fromByte + Utf8.skipChars(from, charOffset - fromChar);
  }
  
  
  /**
   * Returns {@code true} iff the given byte offset, within this frame,
   * falls on a character boundary.
   */
  boolean isCharBoundary(long offset) {
    checkCovers(offset, offset);
    return offset == endByte() || !Utf8.isContinuation(bytes[(int) (offset - beginByte)]);
  }
  
  
  /**
   * Decodes and returns the text in the given byte range.
   * 
   * @param begin       starting file offset (inclusive) on a char boundary
   * @param end         ending file offset (exclusive) on a char boundary
   */
  String text(long begin, long end) {
    checkCovers(begin, end);
    return new String(
        bytes, (int) (begin - beginByte), (int) (end - begin),
        StandardCharsets.UTF_8);
  }
  
  
  /**
   * Returns a read-only view of the bytes in the given range.
   */
  ByteBuffer slice(long begin, long end) {
    checkCovers(begin, end);
    return ByteBuffer.wrap(
        bytes, (int) (begin - beginByte), (int) (end - begin))
        .slice().asReadOnlyBuffer();
  }
  
  
  private void checkCovers(long begin, long end) {
    if (begin > end || !covers(begin, end))
      throw new IndexOutOfBoundsException(
          "[%d, %d) not in frame [%d, %d)"
          .formatted(begin, end, beginByte, endByte()));
  }
  
  
  @Override
  public String toString() {
    return
        "Frame[bytes [%d, %d), chars [%d, %d)]"
        .formatted(beginByte, endByte(), beginChar, endChar());
  }

}
