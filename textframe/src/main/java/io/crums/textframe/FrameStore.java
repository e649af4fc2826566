/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.textframe;


import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Append-only collection of {@linkplain Frame}s. Frames are never merged,
 * moved, or evicted; they may overlap. Lookups are indexed by the frames'
 * beginning byte offsets, and by their beginning character offsets.
 * <p>
 * A hit stops at the nearest qualifying frame, but a miss walks every frame
 * beginning at or before the requested range: O(frames). Frame counts are
 * expected to stay small.
 * </p><p>
 * Not thread-safe. {@linkplain TextFile} guards access.
 * </p>
 */
final class FrameStore {
  
  private final List<Frame> frames = new ArrayList<>();
  
  /** Frame handles (indexes into {@code frames}) keyed by begin-byte. */
  private final TreeMap<Long, List<Integer>> byBegin = new TreeMap<>();
  /** Frame handles keyed by begin-char. */
  private final TreeMap<Long, List<Integer>> byBeginChar = new TreeMap<>();
  
  
  /**
   * Returns a frame covering the given byte range, or {@code null}
   * if none is loaded.
   */
  Frame findCovering(long beginByte, long endByte) {
    for (Map.Entry<Long, List<Integer>> entry :
        byBegin.headMap(beginByte, true).descendingMap().entrySet()) {
      for (int handle : entry.getValue()) {
        Frame frame = frames.get(handle);
        if (frame.endByte() >= endByte)
          return frame;
      }
    }
    return null;
  }
  
  
  /**
   * Returns a frame covering the given character range, or {@code null}
   * if none is loaded.
   */
  Frame findCoveringChars(long beginChar, long endChar) {
    for (Map.Entry<Long, List<Integer>> entry :
        byBeginChar.headMap(beginChar, true).descendingMap().entrySet()) {
      for (int handle : entry.getValue()) {
        Frame frame = frames.get(handle);
        if (frame.endChar() >= endChar)
          return frame;
      }
    }
    return null;
  }
  
  
  /**
   * Adds the given frame and returns it.
   */
  Frame add(Frame frame) {
    int handle = frames.size();
    frames.add(frame);
    byBegin.computeIfAbsent(frame.beginByte(), k -> new ArrayList<>(1)).add(handle);
    byBeginChar.computeIfAbsent(frame.beginChar(), k -> new ArrayList<>(1)).add(handle);
    return frame;
  }
  
  
  /** Returns the number of frames. */
  int size() {
    return frames.size();
  }
  
  
  /** Returns the total no. of bytes held in frames. */
  long totalBytes() {
    long total = 0;
    for (var frame : frames)
      total += frame.size();
    return total;
  }

}
