/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.textframe;

import java.io.File;

/**
 * Thrown on attempting to index a zero-byte file.
 */
@SuppressWarnings("serial")
public class EmptyTextException extends TextFrameException {
  
  public EmptyTextException(File file) {
    super("text is empty: " + file);
  }

  public EmptyTextException(String message) {
    super(message);
  }

}
