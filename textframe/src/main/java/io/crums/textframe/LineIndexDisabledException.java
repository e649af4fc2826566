/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.textframe;

/**
 * Thrown on a line-based query when the text was indexed without lines.
 * 
 * @see TextFileMode#NO_LINE_INDEX
 */
@SuppressWarnings("serial")
public class LineIndexDisabledException extends TextFrameException {

  public LineIndexDisabledException() {
    super("no line index enabled");
  }

}
