/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.textframe;

import java.io.File;

/**
 * Signifies a bad (or unsupported) header in an index file.
 * 
 * @see IndexFiles
 */
@SuppressWarnings("serial")
public class BadHeaderException extends TextFrameException {
  
  
  public BadHeaderException(File file) {
    this("expected header bytes not found: " + file);
  }

  public BadHeaderException(String message) {
    super(message);
  }

}
