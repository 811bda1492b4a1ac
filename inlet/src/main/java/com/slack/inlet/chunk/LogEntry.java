package com.slack.inlet.chunk;

import java.time.Instant;
import java.util.Objects;

/** A single timestamped log line. */
public record LogEntry(Instant timestamp, String line) {
  public LogEntry {
    Objects.requireNonNull(timestamp, "timestamp can't be null");
    Objects.requireNonNull(line, "line can't be null");
  }
}
