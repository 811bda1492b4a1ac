package com.slack.inlet.ingester;

import com.google.common.collect.ImmutableMap;
import com.slack.inlet.proto.config.InletConfigs;
import java.util.Map;

/** Default limits that individual tenants can override. */
public class TenantLimitsOverrides implements TenantLimits {
  private final InletConfigs.LimitsConfig defaultLimits;
  private final ImmutableMap<String, InletConfigs.LimitsConfig> overrides;

  public static TenantLimitsOverrides fromConfig(InletConfigs.InletConfig inletConfig) {
    return new TenantLimitsOverrides(
        inletConfig.getDefaultLimits(), inletConfig.getTenantLimitsMap());
  }

  public TenantLimitsOverrides(
      InletConfigs.LimitsConfig defaultLimits,
      Map<String, InletConfigs.LimitsConfig> overrides) {
    this.defaultLimits = defaultLimits;
    this.overrides = ImmutableMap.copyOf(overrides);
  }

  @Override
  public int maxLocalStreamsPerUser(String tenant) {
    return overrides.getOrDefault(tenant, defaultLimits).getMaxLocalStreamsPerUser();
  }
}
