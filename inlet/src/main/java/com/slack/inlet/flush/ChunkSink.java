package com.slack.inlet.flush;

import com.slack.inlet.chunk.Chunk;
import com.slack.inlet.labels.LabelSet;
import java.io.IOException;

/** Destination of closed chunks. Once a chunk is flushed the sink owns its data. */
@FunctionalInterface
public interface ChunkSink {
  void flush(String tenant, LabelSet labels, Chunk chunk) throws IOException;
}
