package com.slack.inlet.ingester;

import com.slack.inlet.proto.config.InletConfigs;

/** How a stream treats an entry older than the newest entry it has already accepted. */
public enum OutOfOrderPolicy {
  ACCEPT,
  REJECT;

  public static OutOfOrderPolicy fromConfig(InletConfigs.OutOfOrderPolicy policy) {
    return policy == InletConfigs.OutOfOrderPolicy.REJECT ? REJECT : ACCEPT;
  }
}
