package com.slack.inlet.flush;

import static com.google.common.base.Preconditions.checkNotNull;
import static com.slack.inlet.util.ArgValidationUtils.ensureTrue;

import com.google.common.util.concurrent.AbstractScheduledService;
import com.slack.inlet.chunk.Chunk;
import com.slack.inlet.ingester.Instance;
import com.slack.inlet.ingester.Stream;
import com.slack.inlet.proto.config.InletConfigs;
import com.slack.inlet.server.Ingester;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Duration;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * ClosedChunkFlushService periodically hands the closed chunks of every stream to a {@link
 * ChunkSink}. The chunks of a stream are flushed oldest first. If the sink fails on a chunk, the
 * remaining chunks of that stream wait for the next run so the order is kept.
 *
 * <p>When the service stops it runs one last pass, which picks up the chunks closed by the
 * ingester's shutdown as long as the ingester stopped first.
 */
public class ClosedChunkFlushService extends AbstractScheduledService {
  private static final Logger LOG = LoggerFactory.getLogger(ClosedChunkFlushService.class);

  public static final String CHUNKS_FLUSHED = "chunks_flushed_total";
  public static final String CHUNK_FLUSH_FAILURES = "chunk_flush_failures_total";

  private static final long DEFAULT_FLUSH_CHECK_PERIOD_SECS = 30;

  private final Ingester ingester;
  private final ChunkSink chunkSink;
  private final Duration flushCheckPeriod;

  private final Counter chunksFlushed;
  private final Counter flushFailures;

  public static ClosedChunkFlushService fromConfig(
      Ingester ingester,
      ChunkSink chunkSink,
      InletConfigs.IngesterConfig ingesterConfig,
      MeterRegistry meterRegistry) {
    long periodSecs =
        ingesterConfig.getFlushCheckPeriodSecs() > 0
            ? ingesterConfig.getFlushCheckPeriodSecs()
            : DEFAULT_FLUSH_CHECK_PERIOD_SECS;
    return new ClosedChunkFlushService(
        ingester, chunkSink, Duration.ofSeconds(periodSecs), meterRegistry);
  }

  public ClosedChunkFlushService(
      Ingester ingester,
      ChunkSink chunkSink,
      Duration flushCheckPeriod,
      MeterRegistry meterRegistry) {
    this.ingester = checkNotNull(ingester, "ingester can't be null");
    this.chunkSink = checkNotNull(chunkSink, "chunkSink can't be null");
    ensureTrue(
        flushCheckPeriod != null && !flushCheckPeriod.isNegative() && !flushCheckPeriod.isZero(),
        "Flush check period should be a positive duration.");
    this.flushCheckPeriod = flushCheckPeriod;

    this.chunksFlushed = meterRegistry.counter(CHUNKS_FLUSHED);
    this.flushFailures = meterRegistry.counter(CHUNK_FLUSH_FAILURES);
  }

  @Override
  protected void runOneIteration() {
    flushClosedChunks();
  }

  /** Flushes all currently closed chunks. Returns the number of chunks flushed. */
  public synchronized int flushClosedChunks() {
    int flushed = 0;
    for (Instance instance : ingester.instances()) {
      for (Stream stream : instance.streams()) {
        flushed += flushStream(stream);
      }
    }
    if (flushed > 0) {
      LOG.debug("Flushed {} closed chunks", flushed);
    }
    return flushed;
  }

  private int flushStream(Stream stream) {
    int flushed = 0;
    for (Chunk chunk : stream.closedChunksPendingFlush()) {
      try {
        chunkSink.flush(stream.tenant(), stream.labels(), chunk);
      } catch (Exception e) {
        flushFailures.increment();
        LOG.warn(
            "Failed to flush chunk {} of stream {} for tenant {}, retrying on the next run",
            chunk,
            stream.labels(),
            stream.tenant(),
            e);
        break;
      }
      stream.markFlushed(chunk);
      chunksFlushed.increment();
      flushed++;
    }
    return flushed;
  }

  @Override
  protected Scheduler scheduler() {
    return Scheduler.newFixedDelaySchedule(
        flushCheckPeriod.toMillis(), flushCheckPeriod.toMillis(), TimeUnit.MILLISECONDS);
  }

  @Override
  protected void startUp() throws Exception {
    LOG.info("Starting closed chunk flush service, checking every {}", flushCheckPeriod);
  }

  @Override
  protected void shutDown() throws Exception {
    int flushed = flushClosedChunks();
    LOG.info("Closed chunk flush service, flushed {} chunks on shutdown", flushed);
  }
}
