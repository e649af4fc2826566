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
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;

import io.crums.textframe.io.ChannelUtils;
import io.crums.textframe.io.SerialFormatException;

/**
 * Index file naming conventions and I/O. Index files begin with a 4-byte
 * header encoding the format version no., followed by the
 * {@linkplain TextIndex#writeTo(java.nio.ByteBuffer) serial representation}
 * of the index.
 */
public class IndexFiles {
  
  private IndexFiles() {  }  // never
  
  /** File format version no. */
  public final static byte VERSION = 1;
  
  /** 3-byte magic {@code 'tfx'} and one byte version no.*/
  private final static byte[] HEADER = { 't', 'f', 'x', VERSION };
  
  /** 4-byte header length. */
  public final static int HEADER_LENGTH = HEADER.length;
  
  /** Index file extension. Dot-prefixed. */
  public final static String EXT = ".tfx";
  
  
  /** Returns the standard index file header. */
  public static ByteBuffer fileHeader() {
    return ByteBuffer.wrap(HEADER).asReadOnlyBuffer();
  }
  
  
  /**
   * Returns the conventional index file for the given text file: a hidden
   * sibling file named after it.
   * 
   * @return {@code new File(text.getAbsoluteFile().getParentFile(), "." + text.getName() + EXT)}
   */
  public static File defaultIndexFile(File text) {
    return new File(
        text.getAbsoluteFile().getParentFile(), "." + text.getName() + EXT);
  }
  
  
  /**
   * Computes and returns the SHA-256 digest of the given file's contents.
   */
  static byte[] digest(File file) throws UncheckedIOException {
    try (var ch = FileChannel.open(file.toPath(), StandardOpenOption.READ)) {
      return TextFrameConstants.DIGEST.digest(ch);
    } catch (IOException iox) {
      throw new UncheckedIOException("on computing digest of " + file, iox);
    }
  }
  
  
  /**
   * Writes the given index to the specified file, overwriting it if it
   * exists. The contents are first staged to a temp file in the same directory
   * which is then moved into place.
   */
  static void writeIndex(TextIndex index, File file) throws UncheckedIOException {
    Path target = file.toPath().toAbsolutePath();
    Path dir = target.getParent();
    Path temp = null;
    try {
      Files.createDirectories(dir);
      temp = Files.createTempFile(dir, "." + target.getFileName(), ".tmp");
      try (var ch = FileChannel.open(temp, StandardOpenOption.WRITE)) {
        ChannelUtils.writeRemaining(ch, fileHeader());
        ChannelUtils.writeRemaining(ch, index.serialize());
        ch.force(false);
      }
      try {
        Files.move(
            temp, target,
            StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
      } catch (AtomicMoveNotSupportedException amnsx) {
        Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
      }
      temp = null;
    } catch (IOException iox) {
      throw new UncheckedIOException("on writing index to " + file, iox);
    } finally {
      if (temp != null)
        temp.toFile().delete();
    }
  }
  
  
  /**
   * Loads and returns the index recorded in the given file.
   * 
   * @throws BadHeaderException if the header is missing or of an unsupported version
   * @throws SerialFormatException if the contents are corrupt
   * @throws UncheckedIOException on I/O error
   */
  static TextIndex loadIndex(File file)
      throws BadHeaderException, SerialFormatException, UncheckedIOException {
    return TextIndex.load(loadSansHeader(file));
  }
  
  
  static ByteBuffer loadSansHeader(File file) throws UncheckedIOException {
    ByteBuffer buffer;
    try (var ch = FileChannel.open(file.toPath(), StandardOpenOption.READ)) {
      long size = ch.size();
      if (size > Frame.MAX_SIZE)
        throw new SerialFormatException(
            "index file too large (%d bytes): %s".formatted(size, file));
      buffer = ByteBuffer.allocate((int) size);
      ChannelUtils.readRemaining(ch, 0, buffer).flip();
    } catch (IOException iox) {
      throw new UncheckedIOException("on loading " + file, iox);
    }
    readVersion(buffer, file);
    return buffer;
  }
  
  
  private static int readVersion(ByteBuffer buffer, File path) {
    if (buffer.remaining() < HEADER_LENGTH)
      throw new BadHeaderException(
          "file too short (%d bytes) for header: %s".formatted(buffer.remaining(), path));
    for (int index = 0; index < HEADER.length - 1; ++index) {
      if (HEADER[index] != buffer.get())
        throw new BadHeaderException(
            "bad or missing header: offset " + index + " in file " + path);
    }
    byte version = buffer.get();
    final int fileVersion = 0xff & version;
    if (version != VERSION) {
      if (version == 0)
        throw new BadHeaderException(
            "illegal version (0) in header: " + path);
      
      TextFrameConstants.sysLogger().log(
          Level.WARNING,
          "index file {0} has a newer format version ({1}) than this library''s ({2})",
          path, fileVersion, VERSION);
      throw new BadHeaderException(
          "unsupported version (%d) in header: %s".formatted(fileVersion, path));
    }
    return fileVersion;
  }

}
