/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.textframe;


import java.io.File;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.lang.System.Logger;
import java.lang.System.Logger.Level;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.StandardOpenOption;
import java.util.Objects;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.LongSupplier;

import org.apache.commons.codec.binary.Hex;

import com.google.common.base.Stopwatch;
import com.google.common.primitives.Ints;

import io.crums.textframe.RangeResolver.Unit;
import io.crums.textframe.io.ChannelUtils;
import io.crums.textframe.io.SerialFormatException;

/**
 * Random access to excerpts of an immutable UTF-8 text file, addressed by
 * character (code point) offsets or line no.s.
 *
 * <h2>Indexing</h2>
 * <p>
 * On opening, the text is indexed in a single streaming pass (see
 * {@linkplain #open(File, File, TextFileMode, int)}). If an index file is
 * given, a previously written index is reused if the text's SHA-256 digest still
 * matches; otherwise the index is rebuilt and the index file rewritten.
 * </p>
 * <h2>Frames</h2>
 * <p>
 * Text is read from disk in <em>frames</em>: contiguous byte ranges that are
 * loaded once and kept for the life of the instance. The {@code getOrLoad}
 * methods return text from an existing frame covering the requested range, or
 * else load a new frame for exactly that range. The {@code get} methods never
 * load frames: they fail with {@linkplain FrameNotLoadedException} if no
 * frame covers the requested range.
 * </p>
 * <h2>Ranges</h2>
 * <p>
 * Ranges are end-exclusive. Negative offsets are end-relative, and an end
 * offset of zero means the end of the text (or of the lines). See
 * {@linkplain RangeResolver}. Only {@code '\n'} terminates a line, and it
 * belongs to the line it ends.
 * </p>
 * <h2>Concurrency</h2>
 * <p>
 * Instances are safe for use by multiple threads. Non-loading reads share a
 * read lock; loading a frame takes the write lock. The underlying file must
 * not be modified while an instance is in use (this is not detected).
 * </p>
 * <h2>Offset Resolution</h2>
 * <p>
 * Character offsets are resolved to byte offsets by decoding forward from the
 * nearest checkpoint (or loaded frame's beginning). The non-loading
 * {@code get} methods resolve entirely from loaded frames and never touch the
 * file. The loading methods (and the offset conversion methods) decode from a
 * loaded frame when one covers the offset; otherwise they may make a small
 * positional read (less than 4 &times; the checkpoint stride). Such reads do
 * not create frames.
 * </p>
 */
public class TextFile {

  /**
   * Opens the given text file with a line index, and no index file.
   *
   * @see #open(File, File, TextFileMode, int)
   */
  public static TextFile open(File text) {
    return open(text, null);
  }


  /**
   * Opens the given text file with a line index.
   *
   * @see #open(File, File, TextFileMode, int)
   */
  public static TextFile open(File text, File indexFile) {
    return open(text, indexFile, TextFileMode.defaultMode());
  }


  /**
   * Opens the given text file with the default checkpoint stride.
   *
   * @see #open(File, File, TextFileMode, int)
   */
  public static TextFile open(File text, File indexFile, TextFileMode mode) {
    return open(text, indexFile, mode, TextFrameConstants.DEFAULT_CHECKPOINT_STRIDE);
  }


  /**
   * Opens and indexes the given text file.
   * <p>
   * If {@code indexFile} is given and exists, its index is used if it matches
   * the text's SHA-256 digest. A cached index that is corrupt, stale, of an
   * unsupported version, or lacks a line index that {@code mode} calls for,
   * is discarded (with a logged warning). Whenever the index is built here,
   * it is written to {@code indexFile} (if given).
   * </p>
   *
   * @param text        the UTF-8 text file
   * @param indexFile   optional index (cache) file; may be {@code null}
   * @param mode        whether to index lines
   * @param checkpointStride    no. of characters between checkpoints, used
   *                    only if the index is built
   *
   * @throws EmptyTextException if {@code text} is empty
   * @throws InvalidEncodingException if {@code text} is not valid UTF-8
   * @throws UncheckedIOException on I/O error
   * @throws IllegalArgumentException if {@code checkpointStride} is out of range
   *
   * @see IndexFiles#defaultIndexFile(File)
   */
  public static TextFile open(
      File text, File indexFile, TextFileMode mode, int checkpointStride) {

    Objects.requireNonNull(text, "null text file");
    Objects.requireNonNull(mode, "null mode");
    TextFrameConstants.checkStride(checkpointStride);

    final long mtime = text.lastModified() / 1000;

    TextIndex index = null;
    if (indexFile != null && indexFile.exists())
      index = loadCachedIndex(text, indexFile, mode);

    final boolean fromCache = index != null;
    if (!fromCache) {
      index = new IndexBuilder(checkpointStride, mode.indexLines()).build(text);
      if (indexFile != null)
        IndexFiles.writeIndex(index, indexFile);
    }
    return new TextFile(text, mtime, index, fromCache);
  }



  /**
   * Returns the cached index, if usable; {@code null} otherwise.
   */
  private static TextIndex loadCachedIndex(
      File text, File indexFile, TextFileMode mode) {

    final Logger log = TextFrameConstants.sysLogger();
    Stopwatch watch = Stopwatch.createStarted();

    TextIndex cached;
    try {
      cached = IndexFiles.loadIndex(indexFile);
    } catch (BadHeaderException | SerialFormatException | UncheckedIOException x) {
      log.log(Level.WARNING,
          "discarding unreadable index file {0} (rebuilding): {1}", indexFile, x.getMessage());
      return null;
    }

    if (cached.byteSize() != text.length() ||
        !cached.digestEquals(IndexFiles.digest(text))) {
      log.log(Level.WARNING,
          "discarding stale index file {0} (rebuilding)", indexFile);
      return null;
    }

    if (mode.indexLines() && !cached.hasLines()) {
      log.log(Level.WARNING,
          "index file {0} has no line index (rebuilding)", indexFile);
      return null;
    }
    if (!mode.indexLines())
      cached = cached.withoutLines();

    log.log(Level.DEBUG,
        "loaded index for {0} from {1} in {2}: {3}", text, indexFile, watch.stop(), cached);
    return cached;
  }






  private final File path;
  private final long mtime;
  private final TextIndex index;
  private final boolean fromCache;

  private final FrameStore frames = new FrameStore();
  private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();


  private TextFile(File path, long mtime, TextIndex index, boolean fromCache) {
    this.path = path;
    this.mtime = mtime;
    this.index = index;
    this.fromCache = fromCache;
  }



  /** Returns the text file's path. */
  public File path() {
    return path;
  }


  /** Returns the length of the text in characters (code points). */
  public long length() {
    return index.charSize();
  }


  /** Returns the length of the text in bytes. */
  public long byteLength() {
    return index.byteSize();
  }


  /** Returns {@code true} iff this instance has a line index. */
  public boolean hasLineIndex() {
    return index.hasLines();
  }


  /**
   * Returns the number of lines. A trailing {@code '\n'} does not begin a
   * new line.
   *
   * @throws LineIndexDisabledException if there is no line index
   */
  public long lineCount() {
    return lines().lineCount();
  }


  /**
   * Returns the text file's last-modified time (at open), in seconds since
   * the epoch.
   */
  public long mtime() {
    return mtime;
  }


  /**
   * Returns the SHA-256 digest of the text file's contents.
   *
   * @return a read-only 32-byte buffer
   */
  public ByteBuffer checksum() {
    return index.digest();
  }


  /** Returns the {@linkplain #checksum()} in lowercase hex. */
  public String checksumHex() {
    return Hex.encodeHexString(checksum());
  }


  /**
   * Returns {@code true} iff the index was loaded from an index file
   * (rather than built).
   */
  public boolean fromCache() {
    return fromCache;
  }


  /** Returns the number of checkpoints in the index. */
  public int checkpointCount() {
    return index.checkpoints().count();
  }


  /** Returns the number of frames loaded so far. */
  public int frameCount() {
    Lock readLock = lock.readLock();
    readLock.lock();
    try {
      return frames.size();
    } finally {
      readLock.unlock();
    }
  }



  /**
   * Writes the index to the given file (overwriting it, if it exists).
   * The file may later be passed to {@linkplain #open(File, File)}.
   */
  public void writeIndex(File indexFile) throws UncheckedIOException {
    IndexFiles.writeIndex(index, Objects.requireNonNull(indexFile, "null indexFile"));
  }



  //        C H A R   R A N G E S


  /**
   * Returns the text in the given character range, if already loaded. This
   * method never reads the file.
   *
   * @param begin       starting offset (inclusive); negative is end-relative
   * @param end         ending offset (exclusive); negative is end-relative;
   *                    zero means the end of the text
   *
   * @throws FrameNotLoadedException if no loaded frame covers the range
   * @throws OffsetOutOfBoundsException if either offset is out of bounds
   * @throws InvertedRangeException if {@code begin} resolves past {@code end}
   */
  public String get(long begin, long end) {
    var chars = absolutePos(begin, end);
    if (chars.isEmpty())
      return "";
    Lock readLock = lock.readLock();
    readLock.lock();
    try {
      Frame frame = frames.findCoveringChars(chars.begin(), chars.end());
      if (frame == null)
        throw FrameNotLoadedException.forChars(chars.begin(), chars.end());
      return text(frame, chars);
    } finally {
      readLock.unlock();
    }
  }


  /**
   * Returns the text in the given character range, loading it from disk
   * if not already loaded.
   *
   * @param begin       starting offset (inclusive); negative is end-relative
   * @param end         ending offset (exclusive); negative is end-relative;
   *                    zero means the end of the text
   *
   * @throws OffsetOutOfBoundsException if either offset is out of bounds
   * @throws InvertedRangeException if {@code begin} resolves past {@code end}
   */
  public String getOrLoad(long begin, long end) {
    var chars = absolutePos(begin, end);
    if (chars.isEmpty())
      return "";
    return text(frameForChars(chars), chars);
  }


  /**
   * Ensures the given character range is loaded.
   *
   * @see #getOrLoad(long, long)
   */
  public void load(long begin, long end) {
    var chars = absolutePos(begin, end);
    if (!chars.isEmpty())
      frameForChars(chars);
  }


  /**
   * Resolves the given (possibly relative) character range to an absolute
   * one.
   *
   * @see RangeResolver
   */
  public OffsetRange absolutePos(long begin, long end) {
    return RangeResolver.resolve(begin, end, length(), Unit.CHAR);
  }


  /**
   * Returns the byte offset the character at the given offset begins at.
   * The offset is resolved from a loaded frame, if one covers it; otherwise,
   * this may involve a small read from disk.
   *
   * @param charOffset  absolute offset in the range [0, {@linkplain #length()}]
   *
   * @throws OffsetOutOfBoundsException if out of bounds
   */
  public long charsToBytes(long charOffset) {
    Lock readLock = lock.readLock();
    readLock.lock();
    try {
      return locate(charOffset);
    } finally {
      readLock.unlock();
    }
  }


  /**
   * Returns the byte offset of the given char offset, decoding from a loaded
   * frame, if possible; from disk, otherwise. Invoked with a lock held.
   */
  private long locate(long charOffset) {
    var checkpoints = index.checkpoints();
    long byteOffset = checkpoints.resolveFixed(charOffset);
    if (byteOffset != -1)
      return byteOffset;
    Frame frame = frames.findCoveringChars(charOffset, charOffset);
    return frame == null ?
        checkpoints.resolve(charOffset, this::readSegment) :
        frame.byteOffset(checkpoints, charOffset);
  }


  /** Returns the text in the given char range, which {@code frame} covers. */
  private String text(Frame frame, OffsetRange chars) {
    var checkpoints = index.checkpoints();
    return frame.text(
        frame.byteOffset(checkpoints, chars.begin()),
        frame.byteOffset(checkpoints, chars.end()));
  }



  //        L I N E   R A N G E S


  /**
   * Returns the text in the given line range, if already loaded. Line no.s
   * are 0-based.
   *
   * @param begin       starting line no. (inclusive); negative is end-relative
   * @param end         ending line no. (exclusive); negative is end-relative;
   *                    zero means past the last line
   *
   * @throws LineIndexDisabledException if there is no line index
   * @throws FrameNotLoadedException if no loaded frame covers the lines
   * @throws LineOutOfBoundsException if either line no. is out of bounds
   * @throws InvertedRangeException if {@code begin} resolves past {@code end}
   */
  public String getLines(long begin, long end) {
    return getBytes(lineRangeToByteRange(begin, end));
  }


  /**
   * Returns the text in the given line range, loading it from disk if not
   * already loaded.
   *
   * @see #getLines(long, long)
   */
  public String getOrLoadLines(long begin, long end) {
    var lines = lines();
    var range = RangeResolver.resolve(begin, end, lines.lineCount(), Unit.LINE);
    var bytes = lines.toByteRange(range);
    if (bytes.isEmpty())
      return "";
    long beginChar = lines.toCharRange(range).begin();
    return frameForBytes(bytes, () -> beginChar).text(bytes.begin(), bytes.end());
  }


  /**
   * Returns the byte offset the given line begins at.
   *
   * @param line        line no.; negative is end-relative;
   *                    {@linkplain #lineCount()} maps to {@linkplain #byteLength()}
   *
   * @throws LineIndexDisabledException if there is no line index
   * @throws LineOutOfBoundsException if out of bounds
   */
  public long lineToBytes(long line) {
    var lines = lines();
    return lines.startByte(
        RangeResolver.resolvePosition(line, lines.lineCount(), Unit.LINE));
  }


  /**
   * Resolves the given (possibly relative) line range to an absolute byte
   * range.
   *
   * @throws LineIndexDisabledException if there is no line index
   */
  public OffsetRange lineRangeToByteRange(long begin, long end) {
    var lines = lines();
    return lines.toByteRange(
        RangeResolver.resolve(begin, end, lines.lineCount(), Unit.LINE));
  }


  /**
   * Resolves the given (possibly relative) line range to an absolute
   * character range.
   *
   * @throws LineIndexDisabledException if there is no line index
   */
  public OffsetRange lineRangeToCharRange(long begin, long end) {
    var lines = lines();
    return lines.toCharRange(
        RangeResolver.resolve(begin, end, lines.lineCount(), Unit.LINE));
  }


  /**
   * Returns the location of the given line.
   *
   * @param lineNo      0-based; negative is end-relative ({@code -1} is the
   *                    last line)
   *
   * @throws LineIndexDisabledException if there is no line index
   * @throws LineOutOfBoundsException if out of bounds
   */
  public LineEntry line(long lineNo) {
    var lines = lines();
    return lines.entry(
        RangeResolver.resolvePosition(lineNo, lines.lineCount(), Unit.LINE));
  }


  /**
   * Returns the 0-based no. of the line the character at the given offset
   * belongs to.
   *
   * @param charOffset  absolute offset in the range [0, {@linkplain #length()})
   *
   * @throws LineIndexDisabledException if there is no line index
   * @throws OffsetOutOfBoundsException if {@code charOffset} is out of bounds
   */
  public long lineNoOf(long charOffset) {
    return lines().lineNoOf(charOffset);
  }


  private LineIndex lines() {
    return index.lines().orElseThrow(LineIndexDisabledException::new);
  }



  //        B Y T E   R A N G E S


  /**
   * Returns the text in the given byte range, if already loaded. This
   * method never reads the file: the offsets' alignment is checked against
   * the loaded frame. So, except at the beginning and end of the text,
   * even an empty range must be covered by a loaded frame.
   *
   * @param beginByte   starting byte offset (inclusive), on a character boundary
   * @param endByte     ending byte offset (exclusive), on a character boundary
   *
   * @throws OffsetOutOfBoundsException if either offset is out of bounds
   * @throws InvertedRangeException if {@code beginByte > endByte}
   * @throws FrameNotLoadedException if no loaded frame covers the range
   * @throws MisalignedByteOffsetException
   *         if either offset falls inside a multi-byte character
   */
  public String getByteRange(long beginByte, long endByte) {
    checkByteBounds(beginByte, endByte);
    if (beginByte == endByte && (beginByte == 0 || beginByte == byteLength()))
      return "";

    Lock readLock = lock.readLock();
    readLock.lock();
    try {
      Frame frame = frames.findCovering(beginByte, endByte);
      if (frame == null)
        throw FrameNotLoadedException.forBytes(beginByte, endByte);
      if (!frame.isCharBoundary(beginByte))
        throw new MisalignedByteOffsetException(beginByte);
      if (!frame.isCharBoundary(endByte))
        throw new MisalignedByteOffsetException(endByte);
      return frame.text(beginByte, endByte);
    } finally {
      readLock.unlock();
    }
  }


  /**
   * Returns the text in the given byte range, loading it if not already
   * loaded.
   *
   * @param beginByte   starting byte offset (inclusive), on a character boundary
   * @param endByte     ending byte offset (exclusive), on a character boundary
   *
   * @throws OffsetOutOfBoundsException if either offset is out of bounds
   * @throws InvertedRangeException if {@code beginByte > endByte}
   * @throws MisalignedByteOffsetException
   *         if either offset falls inside a multi-byte character
   */
  public String getOrLoadByteRange(long beginByte, long endByte) {
    checkByteBounds(beginByte, endByte);
    Lock readLock = lock.readLock();
    readLock.lock();
    try {
      checkAligned(beginByte);
      if (endByte != beginByte)
        checkAligned(endByte);
    } finally {
      readLock.unlock();
    }
    if (beginByte == endByte)
      return "";

    var checkpoints = index.checkpoints();
    return
        frameForBytes(
            new OffsetRange(beginByte, endByte),
            () -> checkpoints.charOffsetOf(beginByte, this::readSegment))
        .text(beginByte, endByte);
  }


  private void checkByteBounds(long beginByte, long endByte) {
    final long size = byteLength();
    if (beginByte < 0 || beginByte > size)
      throw new OffsetOutOfBoundsException(beginByte, size);
    if (endByte < 0 || endByte > size)
      throw new OffsetOutOfBoundsException(endByte, size);
    if (beginByte > endByte)
      throw new InvertedRangeException(beginByte, endByte);
  }


  /** Invoked with a lock held. */
  private void checkAligned(long offset) {
    if (offset == 0 || offset == byteLength())
      return;
    byte b = readSegment(offset, offset + 1).get();
    if (Utf8.isContinuation(b))
      throw new MisalignedByteOffsetException(offset);
  }



  //        F R A M E S


  private String getBytes(OffsetRange bytes) {
    if (bytes.isEmpty())
      return "";
    Lock readLock = lock.readLock();
    readLock.lock();
    try {
      Frame frame = frames.findCovering(bytes.begin(), bytes.end());
      if (frame == null)
        throw FrameNotLoadedException.forBytes(bytes.begin(), bytes.end());
      return frame.text(bytes.begin(), bytes.end());
    } finally {
      readLock.unlock();
    }
  }


  /**
   * Returns a frame covering the given (non-empty, absolute) character range,
   * loading a new one, if necessary.
   */
  private Frame frameForChars(OffsetRange chars) {
    OffsetRange bytes;
    Lock readLock = lock.readLock();
    readLock.lock();
    try {
      Frame frame = frames.findCoveringChars(chars.begin(), chars.end());
      if (frame != null)
        return frame;
      bytes = new OffsetRange(locate(chars.begin()), locate(chars.end()));
    } finally {
      readLock.unlock();
    }
    return frameForBytes(bytes, chars::begin);
  }


  /**
   * Returns a frame covering the given byte range, loading a new one, if
   * necessary.
   *
   * @param bytes       non-empty, on character boundaries
   * @param beginChar   supplies the character offset of {@code bytes.begin()};
   *                    invoked only if a frame is loaded (with the write
   *                    lock held)
   */
  private Frame frameForBytes(OffsetRange bytes, LongSupplier beginChar) {
    Lock readLock = lock.readLock();
    readLock.lock();
    try {
      Frame frame = frames.findCovering(bytes.begin(), bytes.end());
      if (frame != null)
        return frame;
    } finally {
      readLock.unlock();
    }

    Lock writeLock = lock.writeLock();
    writeLock.lock();
    try {
      Frame frame = frames.findCovering(bytes.begin(), bytes.end());
      if (frame == null)
        frame = frames.add(loadFrame(bytes, beginChar.getAsLong()));
      return frame;
    } finally {
      writeLock.unlock();
    }
  }


  private Frame loadFrame(OffsetRange bytes, long beginChar) {
    try (var ch = FileChannel.open(path.toPath(), StandardOpenOption.READ)) {
      Frame frame = Frame.load(ch, bytes.begin(), bytes.end(), beginChar);
      TextFrameConstants.sysLogger().log(
          Level.TRACE,
          "loaded {0} ({1} chars) from {2}", frame, frame.chars(), path);
      return frame;
    } catch (IOException iox) {
      throw new UncheckedIOException(
          "on loading bytes [%d, %d) from %s"
          .formatted(bytes.begin(), bytes.end(), path), iox);
    }
  }


  /**
   * Returns the given byte range, from a loaded frame, if possible; from disk,
   * otherwise. Invoked with a lock held, and only on the loading and
   * offset-conversion paths.
   */
  private ByteBuffer readSegment(long beginByte, long endByte) {
    Frame frame = frames.findCovering(beginByte, endByte);
    if (frame != null)
      return frame.slice(beginByte, endByte);

    var buffer = ByteBuffer.allocate(Ints.checkedCast(endByte - beginByte));
    try (var ch = FileChannel.open(path.toPath(), StandardOpenOption.READ)) {
      return ChannelUtils.readRemaining(ch, beginByte, buffer).flip();
    } catch (IOException iox) {
      throw new UncheckedIOException(
          "on reading bytes [%d, %d) from %s".formatted(beginByte, endByte, path),
          iox);
    }
  }



  @Override
  public String toString() {
    Lock readLock = lock.readLock();
    readLock.lock();
    try {
      return
          "TextFile[%s, chars=%d, bytes=%d, frames=%d (%d bytes)]"
          .formatted(
              path, length(), byteLength(), frames.size(), frames.totalBytes());
    } finally {
      readLock.unlock();
    }
  }

}
