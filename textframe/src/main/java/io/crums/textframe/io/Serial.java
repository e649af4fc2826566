/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.textframe.io;


import java.nio.BufferOverflowException;
import java.nio.ByteBuffer;

/**
 * An object with a fixed-size binary representation. Loading is by
 * convention a static {@code load(ByteBuffer)} method on the implementing class.
 */
public interface Serial {
  
  /**
   * Returns the number of bytes {@linkplain #writeTo(ByteBuffer)} writes.
   */
  int serialSize();
  
  
  /**
   * Writes the serial representation of this instance to the given buffer
   * and returns it. On return, the buffer is positioned at the end of what
   * was written.
   * 
   * @param out         with at least {@linkplain #serialSize()} remaining bytes
   * 
   * @return {@code out}
   */
  ByteBuffer writeTo(ByteBuffer out) throws BufferOverflowException;
  
  
  /**
   * Returns the serial representation of this instance in a new buffer.
   * 
   * @return a flipped buffer with {@linkplain #serialSize()} remaining bytes
   */
  default ByteBuffer serialize() {
    ByteBuffer out = ByteBuffer.allocate(serialSize());
    return writeTo(out).flip();
  }

}
