package com.slack.inlet.chunkrollover;

import com.slack.inlet.chunk.Chunk;
import java.time.Instant;

/**
 * Decides whether a stream's active chunk should be cut before the next entry is appended. Hard
 * size bounds are enforced by the chunk itself, so a strategy only covers the soft, policy based
 * cuts.
 */
public interface ChunkRollOverStrategy {
  /**
   * @param activeChunk the non-empty chunk currently accepting appends.
   * @param lastCutTime timestamp of the first entry appended to the active chunk.
   * @param nextEntryTimestamp timestamp of the entry about to be appended.
   */
  boolean shouldRollOver(Chunk activeChunk, Instant lastCutTime, Instant nextEntryTimestamp);
}
