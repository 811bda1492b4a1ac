package com.slack.inlet.ingester;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.math.IntMath;
import java.math.RoundingMode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Limiter decides whether a tenant may create another stream on this ingester.
 *
 * <p>A tenant's stream limit applies to the whole cluster, so each replica enforces its share of
 * it: the limit divided by the replica count, rounded up so the shares never add up to less than
 * the tenant's entitlement, and never below 1. The check is local to this replica. Concurrent
 * stream creation on several replicas, or a changing replica count, can briefly admit more streams
 * than the cluster wide limit.
 */
public class Limiter {
  private static final Logger LOG = LoggerFactory.getLogger(Limiter.class);

  private final TenantLimits limits;
  private final ClusterMembership clusterMembership;

  public Limiter(TenantLimits limits, ClusterMembership clusterMembership) {
    this.limits = checkNotNull(limits, "limits can't be null");
    this.clusterMembership = checkNotNull(clusterMembership, "clusterMembership can't be null");
  }

  /**
   * Returns true if a tenant that already owns {@code currentStreams} streams on this replica may
   * create one more. Nothing is reserved, the caller accounts for the new stream itself.
   */
  public boolean allowNewStream(String tenant, int currentStreams) {
    return currentStreams < effectiveLimit(tenant);
  }

  /** This replica's share of the tenant's stream limit, or Integer.MAX_VALUE if unlimited. */
  public int effectiveLimit(String tenant) {
    int maxStreams = limits.maxLocalStreamsPerUser(tenant);
    if (maxStreams <= 0) {
      return Integer.MAX_VALUE;
    }

    int replicas = clusterMembership.replicaCount();
    if (replicas <= 0) {
      LOG.warn(
          "Cluster reported {} replicas, using the full limit for tenant {}", replicas, tenant);
      replicas = 1;
    }
    return Math.max(1, IntMath.divide(maxStreams, replicas, RoundingMode.CEILING));
  }
}
