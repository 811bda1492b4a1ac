package com.slack.inlet.chunk;

/** Creates the empty chunks a stream appends to. */
@FunctionalInterface
public interface ChunkFactory {
  Chunk newChunk();
}
