package com.slack.inlet.flush;

import com.slack.inlet.chunk.Chunk;
import com.slack.inlet.chunk.ChunkBounds;
import com.slack.inlet.labels.Fingerprints;
import com.slack.inlet.labels.LabelSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** A sink that only logs a summary of every chunk it receives and drops the data. */
public class LoggingChunkSink implements ChunkSink {
  private static final Logger LOG = LoggerFactory.getLogger(LoggingChunkSink.class);

  @Override
  public void flush(String tenant, LabelSet labels, Chunk chunk) {
    ChunkBounds bounds = chunk.bounds();
    LOG.info(
        "Flushed chunk tenant={} stream={} fingerprint={} entries={} from={} to={} encodedBytes={} utilization={}",
        tenant,
        labels,
        Fingerprints.toHexString(labels.fingerprint()),
        chunk.entryCount(),
        bounds.minTime(),
        bounds.maxTime(),
        chunk.encodedSizeBytes(),
        chunk.utilization());
  }
}
