package com.slack.inlet.ingester;

/** Read-only view of the ingester cluster used to split a tenant's limits across replicas. */
public interface ClusterMembership {
  /** Number of ingester replicas currently sharing each tenant's streams. */
  int replicaCount();
}
