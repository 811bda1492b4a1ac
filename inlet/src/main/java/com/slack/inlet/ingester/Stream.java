package com.slack.inlet.ingester;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.annotations.VisibleForTesting;
import com.slack.inlet.chunk.Chunk;
import com.slack.inlet.chunk.ChunkAppendException;
import com.slack.inlet.chunk.ChunkFactory;
import com.slack.inlet.chunk.LogEntry;
import com.slack.inlet.chunk.OutOfOrderEntryException;
import com.slack.inlet.chunkrollover.ChunkRollOverStrategy;
import com.slack.inlet.chunkrollover.SyncPeriodRollOverStrategy;
import com.slack.inlet.labels.LabelSet;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A Stream holds the chunks of a single label set of a tenant. All chunks except the last one are
 * closed. The last chunk is the active chunk and receives every append until it is cut, at which
 * point it is closed and a new active chunk is opened.
 *
 * <p>A chunk is cut before an append when either the chunk has no space left for the entry, or the
 * roll over strategy says so. A chunk that can't take any more data is never cut while empty, so an
 * entry that is too big for an empty chunk still lands somewhere.
 *
 * <p>All mutation of a stream is serialized by the stream's own lock, so appends to one stream are
 * applied in the order callers acquire the lock, while appends to different streams never block
 * each other.
 */
public class Stream {
  private static final Logger LOG = LoggerFactory.getLogger(Stream.class);

  public static final String CHUNKS_CREATED = "chunks_created_total";
  public static final String CHUNKS_CUT = "chunks_cut_total";
  public static final String ENTRIES_APPENDED = "entries_appended_total";
  public static final String ENTRIES_FAILED = "entries_failed_total";

  public static final String CUT_REASON_TAG = "reason";
  public static final String CUT_REASON_SYNC = "sync";
  public static final String CUT_REASON_FULL = "full";
  public static final String CUT_REASON_CLOSE = "close";

  private final String tenant;
  private final LabelSet labels;
  private final ChunkFactory chunkFactory;
  private final OutOfOrderPolicy outOfOrderPolicy;
  private final int maxReturnedErrors;

  private final Counter chunksCreated;
  private final Counter syncCuts;
  private final Counter fullCuts;
  private final Counter closeCuts;
  private final Counter entriesAppended;
  private final Counter entriesFailed;

  private final ReentrantLock lock = new ReentrantLock();

  // All fields below are guarded by lock.
  private final List<Chunk> chunks = new ArrayList<>();
  // The first flushedChunks chunks have been handed to the flush path.
  private int flushedChunks;
  // Timestamp of the first entry in the active chunk, null while the active chunk is empty.
  private Instant lastCutTime;
  private Instant highestSeenTimestamp;

  public Stream(
      String tenant,
      LabelSet labels,
      ChunkFactory chunkFactory,
      OutOfOrderPolicy outOfOrderPolicy,
      int maxReturnedErrors,
      MeterRegistry meterRegistry) {
    this.tenant = checkNotNull(tenant, "tenant can't be null");
    this.labels = checkNotNull(labels, "labels can't be null");
    this.chunkFactory = checkNotNull(chunkFactory, "chunkFactory can't be null");
    this.outOfOrderPolicy = checkNotNull(outOfOrderPolicy, "outOfOrderPolicy can't be null");
    this.maxReturnedErrors = maxReturnedErrors;

    this.chunksCreated = meterRegistry.counter(CHUNKS_CREATED);
    this.syncCuts = meterRegistry.counter(CHUNKS_CUT, CUT_REASON_TAG, CUT_REASON_SYNC);
    this.fullCuts = meterRegistry.counter(CHUNKS_CUT, CUT_REASON_TAG, CUT_REASON_FULL);
    this.closeCuts = meterRegistry.counter(CHUNKS_CUT, CUT_REASON_TAG, CUT_REASON_CLOSE);
    this.entriesAppended = meterRegistry.counter(ENTRIES_APPENDED);
    this.entriesFailed = meterRegistry.counter(ENTRIES_FAILED);
  }

  public void append(List<LogEntry> entries, Duration syncPeriod, double minUtilizationForSyncCut) {
    append(entries, new SyncPeriodRollOverStrategy(syncPeriod, minUtilizationForSyncCut));
  }

  /**
   * Appends the entries in the given order. An entry that can't be appended doesn't stop the rest
   * of the batch. Once the whole batch is processed a single ChunkAppendException describing the
   * ignored entries is thrown.
   *
   * @throws ChunkAppendException if one or more entries were ignored.
   */
  public void append(List<LogEntry> entries, ChunkRollOverStrategy rollOverStrategy) {
    List<Failure> failures = new ArrayList<>();
    lock.lock();
    try {
      Chunk activeChunk = getOrCreateActiveChunk();
      for (LogEntry entry : entries) {
        if (outOfOrderPolicy == OutOfOrderPolicy.REJECT
            && highestSeenTimestamp != null
            && entry.timestamp().isBefore(highestSeenTimestamp)) {
          failures.add(
              new Failure(
                  entry,
                  new OutOfOrderEntryException(
                      "entry out of order, newest entry is at " + highestSeenTimestamp)));
          continue;
        }

        if (!activeChunk.isEmpty()) {
          if (!activeChunk.spaceFor(entry)) {
            activeChunk = cut(activeChunk, fullCuts, CUT_REASON_FULL);
          } else if (rollOverStrategy.shouldRollOver(
              activeChunk, lastCutTime, entry.timestamp())) {
            activeChunk = cut(activeChunk, syncCuts, CUT_REASON_SYNC);
          }
        }

        try {
          activeChunk.append(entry);
        } catch (ChunkAppendException e) {
          failures.add(new Failure(entry, e));
          continue;
        }

        if (lastCutTime == null) {
          lastCutTime = entry.timestamp();
        }
        if (highestSeenTimestamp == null || entry.timestamp().isAfter(highestSeenTimestamp)) {
          highestSeenTimestamp = entry.timestamp();
        }
      }
    } finally {
      lock.unlock();
    }

    entriesAppended.increment(entries.size() - failures.size());
    if (!failures.isEmpty()) {
      entriesFailed.increment(failures.size());
      throw toAppendException(failures, entries.size());
    }
  }

  /**
   * Closes the active chunk so the flush path can pick it up. An empty active chunk is left open.
   */
  public void closeActiveChunk() {
    lock.lock();
    try {
      if (chunks.isEmpty()) {
        return;
      }
      Chunk last = chunks.get(chunks.size() - 1);
      if (!last.isClosed() && !last.isEmpty()) {
        last.close();
        lastCutTime = null;
        closeCuts.increment();
        LOG.debug("Closed active chunk {} of stream {} for tenant {}", last, labels, tenant);
      }
    } finally {
      lock.unlock();
    }
  }

  /** Closed chunks that haven't been marked as flushed yet, oldest first. */
  public List<Chunk> closedChunksPendingFlush() {
    lock.lock();
    try {
      int closed = chunks.size();
      if (closed > 0 && !chunks.get(closed - 1).isClosed()) {
        closed--;
      }
      return new ArrayList<>(chunks.subList(flushedChunks, closed));
    } finally {
      lock.unlock();
    }
  }

  /**
   * Records that the flush path took ownership of a closed chunk. Chunks are flushed oldest first,
   * so the chunk must be the oldest one still pending. The stream keeps a read-only reference to
   * it.
   */
  public void markFlushed(Chunk chunk) {
    lock.lock();
    try {
      if (flushedChunks >= chunks.size()
          || chunks.get(flushedChunks) != chunk
          || !chunk.isClosed()) {
        throw new IllegalArgumentException(
            "Chunk " + chunk + " is not the oldest unflushed closed chunk of stream " + labels);
      }
      flushedChunks++;
    } finally {
      lock.unlock();
    }
  }

  public LabelSet labels() {
    return labels;
  }

  public long fingerprint() {
    return labels.fingerprint();
  }

  public String tenant() {
    return tenant;
  }

  /** Snapshot of all the chunks of this stream, oldest first. */
  public List<Chunk> chunks() {
    lock.lock();
    try {
      return new ArrayList<>(chunks);
    } finally {
      lock.unlock();
    }
  }

  public long entryCount() {
    lock.lock();
    try {
      long count = 0;
      for (Chunk chunk : chunks) {
        count += chunk.entryCount();
      }
      return count;
    } finally {
      lock.unlock();
    }
  }

  public Instant lastCutTime() {
    lock.lock();
    try {
      return lastCutTime;
    } finally {
      lock.unlock();
    }
  }

  public Instant highestSeenTimestamp() {
    lock.lock();
    try {
      return highestSeenTimestamp;
    } finally {
      lock.unlock();
    }
  }

  @VisibleForTesting
  int flushedChunkCount() {
    lock.lock();
    try {
      return flushedChunks;
    } finally {
      lock.unlock();
    }
  }

  private Chunk getOrCreateActiveChunk() {
    if (chunks.isEmpty() || chunks.get(chunks.size() - 1).isClosed()) {
      return newChunk();
    }
    return chunks.get(chunks.size() - 1);
  }

  private Chunk cut(Chunk activeChunk, Counter reasonCounter, String reason) {
    activeChunk.close();
    reasonCounter.increment();
    LOG.debug(
        "Cut chunk {} of stream {} for tenant {}, reason: {}", activeChunk, labels, tenant, reason);
    return newChunk();
  }

  private Chunk newChunk() {
    Chunk chunk = chunkFactory.newChunk();
    chunks.add(chunk);
    lastCutTime = null;
    chunksCreated.increment();
    return chunk;
  }

  private ChunkAppendException toAppendException(List<Failure> failures, int totalEntries) {
    List<Failure> reported = failures;
    if (maxReturnedErrors > 0 && failures.size() > maxReturnedErrors) {
      reported = failures.subList(0, maxReturnedErrors);
    }

    StringBuilder sb = new StringBuilder();
    for (Failure failure : reported) {
      sb.append(
          String.format(
              "entry with timestamp %s ignored, reason: '%s' for stream: %s,%n",
              failure.entry().timestamp(), failure.error().getMessage(), labels));
    }
    sb.append(String.format("total ignored: %d out of %d", failures.size(), totalEntries));

    LOG.warn(
        "Ignored {} out of {} entries for stream {} of tenant {}",
        failures.size(),
        totalEntries,
        labels,
        tenant);
    return new ChunkAppendException(
        sb.toString(),
        failures.size(),
        totalEntries,
        failures.get(failures.size() - 1).error());
  }

  @Override
  public String toString() {
    return "Stream{tenant=" + tenant + ", labels=" + labels + '}';
  }

  private record Failure(LogEntry entry, ChunkAppendException error) {}
}
