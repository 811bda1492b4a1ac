package com.slack.inlet.chunk;

/**
 * Thrown when entries can't be appended to a chunk. A single rejected entry reports 1 out of 1;
 * a stream summarizing a whole batch reports how many of the batch's entries were ignored.
 */
public class ChunkAppendException extends RuntimeException {
  private final int failedEntries;
  private final int totalEntries;

  public ChunkAppendException(String msg) {
    this(msg, 1, 1, null);
  }

  public ChunkAppendException(String msg, int failedEntries, int totalEntries, Throwable cause) {
    super(msg, cause);
    this.failedEntries = failedEntries;
    this.totalEntries = totalEntries;
  }

  public int getFailedEntries() {
    return failedEntries;
  }

  public int getTotalEntries() {
    return totalEntries;
  }
}
