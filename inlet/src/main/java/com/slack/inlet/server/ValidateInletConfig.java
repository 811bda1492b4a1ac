package com.slack.inlet.server;

import static com.google.common.base.Preconditions.checkArgument;

import com.slack.inlet.proto.config.InletConfigs;
import java.util.Map;

public class ValidateInletConfig {

  /**
   * ValidateConfig ensures that the config values are consistent with each other. The classes
   * using a config are still expected to validate the values they use.
   */
  public static void validateConfig(InletConfigs.InletConfig inletConfig) {
    validateIngesterConfig(inletConfig.getIngesterConfig());
    validateLimitsConfig("default", inletConfig.getDefaultLimits());
    for (Map.Entry<String, InletConfigs.LimitsConfig> override :
        inletConfig.getTenantLimitsMap().entrySet()) {
      checkArgument(!override.getKey().isEmpty(), "Tenant limits can't use an empty tenant name");
      validateLimitsConfig(override.getKey(), override.getValue());
    }
    checkArgument(
        inletConfig.getClusterConfig().getReplicaCount() >= 0,
        "ClusterConfig replicaCount cannot be negative");
  }

  private static void validateIngesterConfig(InletConfigs.IngesterConfig ingesterConfig) {
    checkArgument(
        ingesterConfig.getSyncPeriodSecs() >= 0,
        "IngesterConfig syncPeriodSecs cannot be negative");
    checkArgument(
        ingesterConfig.getSyncMinUtilization() >= 0 && ingesterConfig.getSyncMinUtilization() <= 1,
        "IngesterConfig syncMinUtilization must be between 0 and 1");
    checkArgument(
        ingesterConfig.getMaxReturnedErrors() >= 0,
        "IngesterConfig maxReturnedErrors cannot be negative");
    checkArgument(
        ingesterConfig.getFlushCheckPeriodSecs() >= 0,
        "IngesterConfig flushCheckPeriodSecs cannot be negative");
    validateChunkConfig(ingesterConfig.getChunkConfig());
  }

  private static void validateChunkConfig(InletConfigs.ChunkConfig chunkConfig) {
    checkArgument(
        chunkConfig.getBlockSizeBytes() > 0, "ChunkConfig blockSizeBytes must be positive");
    checkArgument(
        chunkConfig.getTargetSizeBytes() >= 0, "ChunkConfig targetSizeBytes cannot be negative");
    checkArgument(
        chunkConfig.getTargetSizeBytes() == 0
            || chunkConfig.getTargetSizeBytes() >= chunkConfig.getBlockSizeBytes(),
        "ChunkConfig targetSizeBytes cannot be smaller than blockSizeBytes");
    checkArgument(
        chunkConfig.getMaxLineSizeBytes() >= 0, "ChunkConfig maxLineSizeBytes cannot be negative");
  }

  private static void validateLimitsConfig(String tenant, InletConfigs.LimitsConfig limitsConfig) {
    // 0 means unlimited
    checkArgument(
        limitsConfig.getMaxLocalStreamsPerUser() >= 0,
        "LimitsConfig maxLocalStreamsPerUser cannot be negative for tenant %s",
        tenant);
  }
}
