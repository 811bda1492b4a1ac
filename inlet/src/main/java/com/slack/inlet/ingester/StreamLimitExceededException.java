package com.slack.inlet.ingester;

/** Thrown when creating a stream would take a tenant over its per replica stream limit. */
public class StreamLimitExceededException extends RuntimeException {
  private final String tenant;
  private final int limit;

  public StreamLimitExceededException(String tenant, int streams, int limit, String labels) {
    super(
        String.format(
            "Per-user streams limit (local: %d) exceeded for tenant %s with %d streams, rejected stream %s",
            limit, tenant, streams, labels));
    this.tenant = tenant;
    this.limit = limit;
  }

  public String getTenant() {
    return tenant;
  }

  public int getLimit() {
    return limit;
  }
}
