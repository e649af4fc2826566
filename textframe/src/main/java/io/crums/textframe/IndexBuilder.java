/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.textframe;


import java.io.File;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.lang.System.Logger.Level;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.channels.ReadableByteChannel;
import java.nio.file.StandardOpenOption;
import java.security.MessageDigest;

import com.google.common.base.Stopwatch;

import io.crums.textframe.io.ChannelUtils;

/**
 * Builds a {@linkplain TextIndex} in a single streaming pass over the text.
 * The pass validates the UTF-8 encoding, computes the content digest, records
 * checkpoints every <em>stride</em> characters, and, optionally, records
 * where each line starts.
 */
final class IndexBuilder {
  
  private final static int BUFFER_SIZE = 64 * 1024;
  
  private final int stride;
  private final boolean indexLines;
  
  
  /**
   * @param stride      checkpoint stride in characters
   * @param indexLines  if {@code true}, a line index is also built
   */
  IndexBuilder(int stride, boolean indexLines) {
    this.stride = TextFrameConstants.checkStride(stride);
    this.indexLines = indexLines;
  }
  
  
  /**
   * Builds and returns the index for the given file.
   * 
   * @throws EmptyTextException if the file is empty
   * @throws InvalidEncodingException if the file is not valid UTF-8
   * @throws UncheckedIOException on I/O error
   */
  TextIndex build(File text) {
    if (text.isFile() && text.length() == 0)
      throw new EmptyTextException(text);
    
    Stopwatch watch = Stopwatch.createStarted();
    TextIndex index;
    try (var ch = FileChannel.open(text.toPath(), StandardOpenOption.READ)) {
      index = build(ch, text.toString());
    } catch (IOException iox) {
      throw new UncheckedIOException("on indexing " + text, iox);
    }
    
    TextFrameConstants.sysLogger().log(
        Level.DEBUG,
        "indexed {0} in {1}: {2}", text, watch.stop(), index);
    return index;
  }
  
  
  /**
   * Builds and returns the index of the text read from the given stream.
   * The stream is read to its end, but not closed.
   * 
   * @param text        the stream
   * @param source      description of the stream (for error messages)
   */
  TextIndex build(ReadableByteChannel text, String source) throws IOException {
    
    final MessageDigest digest = TextFrameConstants.DIGEST.newDigest();
    final var decoder = new Utf8.Decoder();
    final var cpChars = new OffsetVector();
    final var cpBytes = new OffsetVector();
    final OffsetVector lineChars = indexLines ? new OffsetVector() : null;
    final OffsetVector lineBytes = indexLines ? new OffsetVector() : null;
    if (indexLines) {
      lineChars.add(0);
      lineBytes.add(0);
    }
    
    long chars = 0;
    long offset = 0;
    
    ByteBuffer buffer = ByteBuffer.allocate(BUFFER_SIZE);
    final byte[] array = buffer.array();
    
    while (ChannelUtils.readAvailable(text, buffer.clear()) != -1) {
      buffer.flip();
      final int limit = buffer.limit();
      digest.update(array, 0, limit);
      
      for (int index = 0; index < limit; ++index, ++offset) {
        final byte b = array[index];
        if (decoder.atBoundary() && chars % stride == 0) {
          cpChars.add(chars);
          cpBytes.add(offset);
        }
        if (decoder.next(b, offset)) {
          ++chars;
          if (b == '\n' && indexLines) {
            lineChars.add(chars);
            lineBytes.add(offset + 1);
          }
        }
      }
    }
    decoder.finish();
    
    if (offset == 0)
      throw new EmptyTextException("text is empty: " + source);
    
    // a trailing '\n' already recorded the terminal entry
    if (indexLines && lineChars.last() != chars) {
      lineChars.add(chars);
      lineBytes.add(offset);
    }
    
    var checkpoints = new CheckpointIndex(stride, cpChars, cpBytes, chars, offset);
    var lines = indexLines ? new LineIndex(lineChars, lineBytes) : null;
    return new TextIndex(digest.digest(), checkpoints, lines);
  }

}
