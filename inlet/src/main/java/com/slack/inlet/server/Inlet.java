package com.slack.inlet.server;

import com.google.common.util.concurrent.MoreExecutors;
import com.google.common.util.concurrent.Service;
import com.google.common.util.concurrent.ServiceManager;
import com.slack.inlet.flush.ClosedChunkFlushService;
import com.slack.inlet.flush.LoggingChunkSink;
import com.slack.inlet.proto.config.InletConfigs;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Metrics;
import io.micrometer.core.instrument.binder.jvm.JvmGcMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmMemoryMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmThreadMetrics;
import io.micrometer.core.instrument.binder.system.ProcessorMetrics;
import io.micrometer.prometheusmetrics.PrometheusConfig;
import io.micrometer.prometheusmetrics.PrometheusMeterRegistry;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.TimeUnit;
import org.apache.logging.log4j.LogManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Main class of Inlet. Loads the config, registers the metrics registry and runs the ingester
 * together with the service that drains its closed chunks.
 */
public class Inlet {
  private static final Logger LOG = LoggerFactory.getLogger(Inlet.class);

  private final InletConfigs.InletConfig inletConfig;
  private final PrometheusMeterRegistry prometheusMeterRegistry;
  private Ingester ingester;
  private ClosedChunkFlushService flushService;
  private ServiceManager serviceManager;

  Inlet(InletConfigs.InletConfig inletConfig, PrometheusMeterRegistry prometheusMeterRegistry) {
    this.inletConfig = inletConfig;
    this.prometheusMeterRegistry = prometheusMeterRegistry;
    Metrics.addRegistry(prometheusMeterRegistry);
    LOG.info("Started Inlet process with config: {}", inletConfig);
  }

  public static void main(String[] args) throws Exception {
    if (args.length == 0) {
      LOG.error("Config file is needed as the first argument");
      System.exit(1);
    }
    InletConfigs.InletConfig config = InletConfig.fromFile(Path.of(args[0]));
    Inlet inlet = new Inlet(config, initPrometheusMeterRegistry(config));
    inlet.start();
  }

  static PrometheusMeterRegistry initPrometheusMeterRegistry(InletConfigs.InletConfig config) {
    PrometheusMeterRegistry prometheusMeterRegistry =
        new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);
    prometheusMeterRegistry
        .config()
        .commonTags(
            "inlet_cluster_name",
            config.getClusterConfig().getClusterName(),
            "inlet_env",
            config.getClusterConfig().getEnv());
    return prometheusMeterRegistry;
  }

  public void start() {
    setupSystemMetrics(prometheusMeterRegistry);
    addShutdownHook();

    ingester = Ingester.fromConfig(inletConfig, prometheusMeterRegistry);
    flushService =
        ClosedChunkFlushService.fromConfig(
            ingester,
            new LoggingChunkSink(),
            inletConfig.getIngesterConfig(),
            prometheusMeterRegistry);

    List<Service> services = List.of(ingester, flushService);
    serviceManager = new ServiceManager(services);
    serviceManager.addListener(getServiceManagerListener(), MoreExecutors.directExecutor());
    serviceManager.startAsync();
  }

  private static ServiceManager.Listener getServiceManagerListener() {
    return new ServiceManager.Listener() {
      @Override
      public void failure(Service service) {
        LOG.error(
            String.format("Service %s failed with cause ", service.getClass().toString()),
            service.failureCause());
      }
    };
  }

  void shutdown() {
    LOG.info("Running shutdown hook.");
    try {
      // The ingester closes its active chunks on shutdown, the flush service drains them after.
      ingester
          .stopAsync()
          .awaitTerminated(
              InletConfig.DEFAULT_START_STOP_DURATION.toMillis(), TimeUnit.MILLISECONDS);
      serviceManager.stopAsync().awaitStopped(30, TimeUnit.SECONDS);
    } catch (Exception e) {
      // stopping timed out
      LOG.error("ServiceManager shutdown timed out", e);
    }
    LOG.info("Shutting down LogManager");
    LogManager.shutdown();
  }

  private void addShutdownHook() {
    Runtime.getRuntime().addShutdownHook(new Thread(this::shutdown));
  }

  private static void setupSystemMetrics(MeterRegistry meterRegistry) {
    // Expose JVM metrics.
    new JvmMemoryMetrics().bindTo(meterRegistry);
    new JvmGcMetrics().bindTo(meterRegistry);
    new ProcessorMetrics().bindTo(meterRegistry);
    new JvmThreadMetrics().bindTo(meterRegistry);

    LOG.info("Done registering standard JVM metrics for inlet");
  }
}
