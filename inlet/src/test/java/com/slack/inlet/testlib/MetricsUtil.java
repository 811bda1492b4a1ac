package com.slack.inlet.testlib;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.search.MeterNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

// Counters that haven't been registered yet read as 0, so the getters can be polled from await()
// before the code under test creates the meter.
public class MetricsUtil {

  private static final Logger LOG = LoggerFactory.getLogger(MetricsUtil.class);

  public static double getCount(String counterName, MeterRegistry metricsRegistry) {
    try {
      return metricsRegistry.get(counterName).counter().count();
    } catch (MeterNotFoundException e) {
      LOG.warn("Metric not found", e);
      return 0;
    }
  }

  public static double getCount(
      String counterName, MeterRegistry metricsRegistry, String... tags) {
    try {
      return metricsRegistry.get(counterName).tags(tags).counter().count();
    } catch (MeterNotFoundException e) {
      LOG.warn("Metric not found", e);
      return 0;
    }
  }

  // Sums the counter over all its tag values.
  public static double getTotalCount(String counterName, MeterRegistry metricsRegistry) {
    return metricsRegistry.find(counterName).counters().stream()
        .mapToDouble(counter -> counter.count())
        .sum();
  }

  public static double getValue(String gaugeName, MeterRegistry metricsRegistry, String... tags) {
    try {
      return metricsRegistry.get(gaugeName).tags(tags).gauge().value();
    } catch (MeterNotFoundException e) {
      LOG.warn("Metric not found", e);
      return 0;
    }
  }
}
