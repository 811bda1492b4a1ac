package com.slack.inlet.labels;

/** Thrown when a label set string is malformed or declares the same label name twice. */
public class InvalidLabelSetException extends RuntimeException {
  public InvalidLabelSetException(String msg) {
    super(msg);
  }
}
