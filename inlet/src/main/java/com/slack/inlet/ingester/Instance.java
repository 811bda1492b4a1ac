package com.slack.inlet.ingester;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.annotations.VisibleForTesting;
import com.google.protobuf.Timestamp;
import com.google.protobuf.util.Timestamps;
import com.slack.inlet.chunk.ChunkAppendException;
import com.slack.inlet.chunk.ChunkFactory;
import com.slack.inlet.chunk.LogEntry;
import com.slack.inlet.chunkrollover.ChunkRollOverStrategy;
import com.slack.inlet.chunkrollover.SyncPeriodRollOverStrategy;
import com.slack.inlet.labels.InvalidLabelSetException;
import com.slack.inlet.labels.LabelSet;
import com.slack.inlet.labels.LabelSetParser;
import com.slack.inlet.proto.push.Push;
import io.grpc.Context;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * An Instance owns all the streams of one tenant on this ingester.
 *
 * <p>Streams are indexed by the fingerprint of their label set. Distinct label sets can share a
 * fingerprint, so every fingerprint maps to a small list of streams and a lookup always compares
 * the full label set. The index lock is only held while a stream is looked up or registered.
 * Appends run under the lock of the stream they target.
 */
public class Instance {
  private static final Logger LOG = LoggerFactory.getLogger(Instance.class);

  public static final String STREAMS_CREATED = "streams_created_total";
  public static final String STREAMS_REJECTED = "streams_rejected_total";
  public static final String LIVE_STREAMS = "live_streams";
  public static final String TENANT_TAG = "tenant";

  static final String INVALID_TIMESTAMP_REASON = "timestamp out of range";

  private final String tenant;
  private final ChunkFactory chunkFactory;
  private final Limiter limiter;
  private final ChunkRollOverStrategy rollOverStrategy;
  private final OutOfOrderPolicy outOfOrderPolicy;
  private final int maxReturnedErrors;
  private final MeterRegistry meterRegistry;

  private final Counter streamsCreated;
  private final Counter streamsRejected;

  private final ReentrantLock streamsLock = new ReentrantLock();
  // Guarded by streamsLock.
  private final Map<Long, List<Stream>> streamsByFingerprint = new HashMap<>();
  // Only updated under streamsLock, read without it.
  private final AtomicInteger streamCount;

  public Instance(
      String tenant,
      ChunkFactory chunkFactory,
      Limiter limiter,
      Duration syncPeriod,
      double minUtilizationForSyncCut,
      MeterRegistry meterRegistry) {
    this(
        tenant,
        chunkFactory,
        limiter,
        new SyncPeriodRollOverStrategy(syncPeriod, minUtilizationForSyncCut),
        OutOfOrderPolicy.ACCEPT,
        0,
        meterRegistry);
  }

  public Instance(
      String tenant,
      ChunkFactory chunkFactory,
      Limiter limiter,
      ChunkRollOverStrategy rollOverStrategy,
      OutOfOrderPolicy outOfOrderPolicy,
      int maxReturnedErrors,
      MeterRegistry meterRegistry) {
    this.tenant = checkNotNull(tenant, "tenant can't be null");
    this.chunkFactory = checkNotNull(chunkFactory, "chunkFactory can't be null");
    this.limiter = checkNotNull(limiter, "limiter can't be null");
    this.rollOverStrategy = checkNotNull(rollOverStrategy, "rollOverStrategy can't be null");
    this.outOfOrderPolicy = checkNotNull(outOfOrderPolicy, "outOfOrderPolicy can't be null");
    this.maxReturnedErrors = maxReturnedErrors;
    this.meterRegistry = checkNotNull(meterRegistry, "meterRegistry can't be null");

    Tags tenantTags = Tags.of(TENANT_TAG, tenant);
    this.streamsCreated = meterRegistry.counter(STREAMS_CREATED, tenantTags);
    this.streamsRejected = meterRegistry.counter(STREAMS_REJECTED, tenantTags);
    this.streamCount = meterRegistry.gauge(LIVE_STREAMS, tenantTags, new AtomicInteger(0));
  }

  /**
   * Applies a push request. Stream groups are applied one at a time in request order. A group that
   * fails doesn't stop the groups after it. The first failure is rethrown once all groups were
   * processed, any later failures are attached to it as suppressed exceptions.
   *
   * <p>The context is checked before the first group and between groups. A cancelled context stops
   * the push, groups that were already applied stay applied.
   *
   * @throws PushCancelledException if the context was cancelled.
   * @throws InvalidLabelSetException if a group's labels don't parse.
   * @throws StreamLimitExceededException if a group needed a new stream the tenant can't have.
   * @throws ChunkAppendException if some entries of a group were ignored.
   */
  public void push(Context context, Push.PushRequest request) {
    if (context.isCancelled()) {
      throw new PushCancelledException(
          "Push for tenant " + tenant + " cancelled before it started",
          context.cancellationCause());
    }

    RuntimeException firstError = null;
    for (Push.StreamEntries streamEntries : request.getStreamsList()) {
      if (context.isCancelled()) {
        PushCancelledException cancelled =
            new PushCancelledException(
                "Push for tenant " + tenant + " cancelled", context.cancellationCause());
        if (firstError == null) {
          throw cancelled;
        }
        firstError.addSuppressed(cancelled);
        break;
      }

      try {
        appendGroup(streamEntries);
      } catch (InvalidLabelSetException
          | StreamLimitExceededException
          | ChunkAppendException e) {
        if (firstError == null) {
          firstError = e;
        } else {
          firstError.addSuppressed(e);
        }
      }
    }

    if (firstError != null) {
      throw firstError;
    }
  }

  public Stream getOrCreateStream(String labels) {
    return getOrCreateStream(LabelSetParser.parse(labels));
  }

  /**
   * Returns the stream with exactly these labels, creating it if the tenant is still allowed
   * another stream. Callers racing on the same new label set all get the same stream.
   *
   * @throws StreamLimitExceededException if the stream doesn't exist and the tenant is at its
   *     limit.
   */
  public Stream getOrCreateStream(LabelSet labels) {
    long fingerprint = labels.fingerprint();
    streamsLock.lock();
    try {
      List<Stream> streams = streamsByFingerprint.get(fingerprint);
      if (streams != null) {
        for (Stream stream : streams) {
          if (stream.labels().equals(labels)) {
            return stream;
          }
        }
      }

      int currentStreams = streamCount.get();
      if (!limiter.allowNewStream(tenant, currentStreams)) {
        streamsRejected.increment();
        StreamLimitExceededException e =
            new StreamLimitExceededException(
                tenant, currentStreams, limiter.effectiveLimit(tenant), labels.toString());
        LOG.warn(e.getMessage());
        throw e;
      }

      Stream stream =
          new Stream(
              tenant, labels, chunkFactory, outOfOrderPolicy, maxReturnedErrors, meterRegistry);
      if (streams == null) {
        streams = new ArrayList<>(1);
        streamsByFingerprint.put(fingerprint, streams);
      } else {
        LOG.debug(
            "Fingerprint collision for tenant {} on {}, {} streams share it",
            tenant,
            labels,
            streams.size() + 1);
      }
      streams.add(stream);
      streamCount.incrementAndGet();
      streamsCreated.increment();
      return stream;
    } finally {
      streamsLock.unlock();
    }
  }

  public Optional<Stream> getStream(LabelSet labels) {
    streamsLock.lock();
    try {
      List<Stream> streams = streamsByFingerprint.get(labels.fingerprint());
      if (streams == null) {
        return Optional.empty();
      }
      return streams.stream().filter(s -> s.labels().equals(labels)).findFirst();
    } finally {
      streamsLock.unlock();
    }
  }

  /** Snapshot of all the streams of this tenant. */
  public List<Stream> streams() {
    streamsLock.lock();
    try {
      List<Stream> result = new ArrayList<>(streamCount.get());
      for (List<Stream> streams : streamsByFingerprint.values()) {
        result.addAll(streams);
      }
      return result;
    } finally {
      streamsLock.unlock();
    }
  }

  public int streamCount() {
    return streamCount.get();
  }

  /**
   * Drops a stream from the index, freeing its slot against the tenant's limit. Returns false if
   * the stream isn't registered with this instance.
   *
   * <p>This doesn't fence pushes in flight. A push that resolved the stream before it was removed
   * still appends to the removed stream, and those entries are only reachable through the caller's
   * reference to it. Callers evicting streams must stop pushes to them or drain the removed stream
   * afterwards.
   */
  public boolean removeStream(Stream stream) {
    streamsLock.lock();
    try {
      List<Stream> streams = streamsByFingerprint.get(stream.fingerprint());
      if (streams == null || !streams.removeIf(s -> s == stream)) {
        return false;
      }
      if (streams.isEmpty()) {
        streamsByFingerprint.remove(stream.fingerprint());
      }
      streamCount.decrementAndGet();
      LOG.debug("Removed stream {} of tenant {}", stream.labels(), tenant);
      return true;
    } finally {
      streamsLock.unlock();
    }
  }

  /** Closes the active chunk of every stream. */
  public void closeActiveChunks() {
    for (Stream stream : streams()) {
      stream.closeActiveChunk();
    }
  }

  public String getTenant() {
    return tenant;
  }

  @VisibleForTesting
  List<Stream> streamsForFingerprint(long fingerprint) {
    streamsLock.lock();
    try {
      List<Stream> streams = streamsByFingerprint.get(fingerprint);
      return streams == null ? List.of() : new ArrayList<>(streams);
    } finally {
      streamsLock.unlock();
    }
  }

  /**
   * Appends one group of a push. Entries are converted before the stream is resolved, so a group
   * whose timestamps are all out of range never takes a stream slot. Entries with an out of range
   * timestamp are ignored and reported together with any append failures of the valid entries.
   */
  private void appendGroup(Push.StreamEntries streamEntries) {
    LabelSet labels = LabelSetParser.parse(streamEntries.getLabels());
    List<Push.Entry> pushEntries = streamEntries.getEntriesList();
    List<LogEntry> entries = new ArrayList<>(pushEntries.size());
    List<Push.Entry> invalidEntries = new ArrayList<>();
    for (Push.Entry entry : pushEntries) {
      if (Timestamps.isValid(entry.getTimestamp())) {
        entries.add(new LogEntry(toInstant(entry.getTimestamp()), entry.getLine()));
      } else {
        invalidEntries.add(entry);
      }
    }

    if (invalidEntries.isEmpty()) {
      getOrCreateStream(labels).append(entries, rollOverStrategy);
      return;
    }

    ChunkAppendException appendError = null;
    if (!entries.isEmpty()) {
      try {
        getOrCreateStream(labels).append(entries, rollOverStrategy);
      } catch (ChunkAppendException e) {
        appendError = e;
      }
    }
    throw invalidTimestampsException(labels, invalidEntries, pushEntries.size(), appendError);
  }

  private ChunkAppendException invalidTimestampsException(
      LabelSet labels,
      List<Push.Entry> invalidEntries,
      int totalEntries,
      ChunkAppendException appendError) {
    List<Push.Entry> reported = invalidEntries;
    if (maxReturnedErrors > 0 && invalidEntries.size() > maxReturnedErrors) {
      reported = invalidEntries.subList(0, maxReturnedErrors);
    }
    StringBuilder sb = new StringBuilder();
    for (Push.Entry entry : reported) {
      sb.append(
          String.format(
              "entry with timestamp seconds=%d nanos=%d ignored, reason: '%s' for stream: %s,%n",
              entry.getTimestamp().getSeconds(),
              entry.getTimestamp().getNanos(),
              INVALID_TIMESTAMP_REASON,
              labels));
    }
    int failedEntries =
        invalidEntries.size() + (appendError == null ? 0 : appendError.getFailedEntries());
    sb.append(String.format("total ignored: %d out of %d", failedEntries, totalEntries));

    LOG.warn(
        "Ignored {} entries with an out of range timestamp for stream {} of tenant {}",
        invalidEntries.size(),
        labels,
        tenant);
    return new ChunkAppendException(sb.toString(), failedEntries, totalEntries, appendError);
  }

  private static Instant toInstant(Timestamp timestamp) {
    return Instant.ofEpochSecond(timestamp.getSeconds(), timestamp.getNanos());
  }

  @Override
  public String toString() {
    return "Instance{tenant=" + tenant + ", streams=" + streamCount.get() + '}';
  }
}
