package com.slack.inlet.chunk;

/** An entry older than the newest entry already accepted for its stream. */
public class OutOfOrderEntryException extends ChunkAppendException {
  public OutOfOrderEntryException(String msg) {
    super(msg);
  }
}
