package com.slack.inlet.ingester;

/** Source of per-tenant limits. */
public interface TenantLimits {
  /**
   * Max number of streams the tenant may have across the whole cluster. A value of 0 or less means
   * the tenant is not limited.
   */
  int maxLocalStreamsPerUser(String tenant);
}
