package com.slack.inlet.ingester;

import static com.slack.inlet.util.ArgValidationUtils.ensureTrue;

import com.slack.inlet.proto.config.InletConfigs;

/** A cluster whose replica count is fixed by configuration. */
public class StaticClusterMembership implements ClusterMembership {
  private final int replicaCount;

  public static StaticClusterMembership fromConfig(InletConfigs.ClusterConfig clusterConfig) {
    return new StaticClusterMembership(Math.max(1, clusterConfig.getReplicaCount()));
  }

  public StaticClusterMembership(int replicaCount) {
    ensureTrue(replicaCount > 0, "Replica count should be a positive number.");
    this.replicaCount = replicaCount;
  }

  @Override
  public int replicaCount() {
    return replicaCount;
  }
}
