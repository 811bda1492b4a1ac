package com.slack.inlet.chunkrollover;

import static com.slack.inlet.util.ArgValidationUtils.ensureFraction;
import static com.slack.inlet.util.ArgValidationUtils.ensureTrue;

import com.slack.inlet.chunk.Chunk;
import com.slack.inlet.proto.config.InletConfigs;
import java.time.Duration;
import java.time.Instant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Cuts a chunk once the data in it spans the sync period, so that chunks of different streams (and
 * of different replicas of the same stream) end up covering similar time ranges.
 *
 * <p>A chunk that has not reached {@code minUtilization} by the end of its sync period is left open
 * and keeps growing until it does. Every chunk cut by this strategy satisfies {@code span <
 * syncPeriod || utilization >= minUtilization}.
 *
 * <p>Time is measured on entry timestamps, not the wall clock, so the outcome doesn't depend on
 * when entries arrive.
 */
public class SyncPeriodRollOverStrategy implements ChunkRollOverStrategy {
  private static final Logger LOG = LoggerFactory.getLogger(SyncPeriodRollOverStrategy.class);

  private final Duration syncPeriod;
  private final double minUtilization;

  public static SyncPeriodRollOverStrategy fromConfig(InletConfigs.IngesterConfig ingesterConfig) {
    return new SyncPeriodRollOverStrategy(
        Duration.ofSeconds(ingesterConfig.getSyncPeriodSecs()),
        ingesterConfig.getSyncMinUtilization());
  }

  /**
   * @param syncPeriod a zero period disables time based cuts.
   * @param minUtilization a zero utilization cuts on the time span alone.
   */
  public SyncPeriodRollOverStrategy(Duration syncPeriod, double minUtilization) {
    ensureTrue(
        syncPeriod != null && !syncPeriod.isNegative(),
        "Sync period can't be a negative duration.");
    ensureFraction(minUtilization, "Min utilization should be between 0 and 1.");
    this.syncPeriod = syncPeriod;
    this.minUtilization = minUtilization;
  }

  @Override
  public boolean shouldRollOver(
      Chunk activeChunk, Instant lastCutTime, Instant nextEntryTimestamp) {
    if (syncPeriod.isZero() || lastCutTime == null) {
      return false;
    }
    if (Duration.between(lastCutTime, nextEntryTimestamp).compareTo(syncPeriod) < 0) {
      return false;
    }

    double utilization = activeChunk.utilization();
    if (minUtilization > 0 && utilization < minUtilization) {
      LOG.trace(
          "Keeping underutilized chunk open past its sync period, utilization {} < {}",
          utilization,
          minUtilization);
      return false;
    }
    LOG.debug(
        "Sync period {} reached, rolling over chunk with utilization {}", syncPeriod, utilization);
    return true;
  }

  public Duration getSyncPeriod() {
    return syncPeriod;
  }

  public double getMinUtilization() {
    return minUtilization;
  }
}
