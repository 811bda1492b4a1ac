package com.slack.inlet.chunk;

import java.time.Duration;
import java.time.Instant;

/** The oldest and newest entry timestamps in a chunk. */
public record ChunkBounds(Instant minTime, Instant maxTime) {
  public Duration span() {
    return Duration.between(minTime, maxTime);
  }
}
