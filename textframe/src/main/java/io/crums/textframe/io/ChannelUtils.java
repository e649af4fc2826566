/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.textframe.io;


import java.io.EOFException;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.channels.ReadableByteChannel;
import java.nio.channels.WritableByteChannel;

/**
 * Positional and remaining-bytes channel I/O.
 */
public class ChannelUtils {
  
  private ChannelUtils() {  }   // never
  
  
  /**
   * Reads the remaining bytes of the given buffer starting from the specified
   * file position. The channel's own position is not touched.
   * 
   * @param file        the file
   * @param position    the file position the read begins at
   * @param buffer      read into (its remaining bytes)
   * 
   * @return {@code buffer} (not flipped)
   * 
   * @throws EOFException if the end of file is reached before {@code buffer}
   *                      is filled
   */
  public static ByteBuffer readRemaining(FileChannel file, long position, ByteBuffer buffer)
      throws IOException {
    
    if (position < 0)
      throw new IllegalArgumentException("position " + position);
    
    while (buffer.hasRemaining()) {
      int bytesRead = file.read(buffer, position);
      if (bytesRead == -1)
        throw new EOFException(
            "EOF at offset %d with %d bytes remaining to read"
            .formatted(position, buffer.remaining()));
      position += bytesRead;
    }
    return buffer;
  }
  
  
  /**
   * Reads the given channel until the buffer is filled or the end of stream
   * is reached.
   * 
   * @return the number of bytes read, or {@code -1}, if the stream had already
   *         ended (and nothing was read)
   */
  public static int readAvailable(ReadableByteChannel ch, ByteBuffer buffer)
      throws IOException {
    
    int total = 0;
    while (buffer.hasRemaining()) {
      int bytesRead = ch.read(buffer);
      if (bytesRead == -1)
        return total == 0 ? -1 : total;
      total += bytesRead;
    }
    return total;
  }
  
  
  /**
   * Writes the remaining bytes of the given buffer to the channel.
   * 
   * @return {@code ch}
   */
  public static <T extends WritableByteChannel> T writeRemaining(T ch, ByteBuffer buffer)
      throws IOException {
    while (buffer.hasRemaining())
      ch.write(buffer);
    return ch;
  }

}
