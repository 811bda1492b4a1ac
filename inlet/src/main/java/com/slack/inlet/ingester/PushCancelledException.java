package com.slack.inlet.ingester;

/** The push request's context was cancelled before its entries were applied. */
public class PushCancelledException extends RuntimeException {
  public PushCancelledException(String msg, Throwable cause) {
    super(msg, cause);
  }
}
