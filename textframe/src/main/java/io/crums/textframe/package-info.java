/*
 * Copyright 2026 Babak Farhang
 */
/**
 * Random access to excerpts of large, immutable UTF-8 text files by
 * character offset or line no.
 * 
 * <h2>Design</h2>
 * <p>
 * A text file is indexed once, in a single streaming pass. The pass validates
 * the UTF-8 encoding, computes the file's SHA-256 digest, and samples
 * (char offset, byte offset) {@linkplain io.crums.textframe.Checkpoint checkpoint}s
 * at a fixed character stride. Optionally, it also records where every line
 * begins. The index may be saved to a side-car file and reused, so long as the
 * file's digest still matches.
 * </p>
 * <h3>Frames</h3>
 * <p>
 * Text is loaded on demand in immutable <em>frames</em>, each covering a
 * contiguous byte range. Frames are kept for the life of the
 * {@linkplain io.crums.textframe.TextFile TextFile}; they are never merged or
 * evicted, and they may overlap.
 * </p>
 * <h3>Ranges</h3>
 * <p>
 * Ranges are end-exclusive. Negative values count from the end, and an end
 * value of zero means the end. See
 * {@linkplain io.crums.textframe.RangeResolver RangeResolver}.
 * </p>
 * 
 * @see io.crums.textframe.TextFile
 * @see io.crums.textframe.IndexFiles
 */
package io.crums.textframe;
