package com.slack.inlet.server;

import static com.google.common.base.Preconditions.checkNotNull;
import static com.slack.inlet.util.ArgValidationUtils.ensureNonEmptyString;

import com.google.common.util.concurrent.AbstractIdleService;
import com.slack.inlet.chunk.ChunkFactories;
import com.slack.inlet.chunk.ChunkFactory;
import com.slack.inlet.chunkrollover.ChunkRollOverStrategy;
import com.slack.inlet.chunkrollover.SyncPeriodRollOverStrategy;
import com.slack.inlet.ingester.ClusterMembership;
import com.slack.inlet.ingester.Instance;
import com.slack.inlet.ingester.Limiter;
import com.slack.inlet.ingester.OutOfOrderPolicy;
import com.slack.inlet.ingester.StaticClusterMembership;
import com.slack.inlet.ingester.Stream;
import com.slack.inlet.ingester.TenantLimitsOverrides;
import com.slack.inlet.proto.config.InletConfigs;
import com.slack.inlet.proto.push.Push;
import io.grpc.Context;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Ingester is the entry point of the write path. It keeps one {@link Instance} per tenant and
 * routes push requests to it. Instances are created on a tenant's first push.
 *
 * <p>Pushes are only accepted while the service is running. On shutdown the active chunk of every
 * stream is closed so the flush path can drain them.
 */
public class Ingester extends AbstractIdleService {
  private static final Logger LOG = LoggerFactory.getLogger(Ingester.class);

  private final ConcurrentMap<String, Instance> instances = new ConcurrentHashMap<>();

  private final ChunkFactory chunkFactory;
  private final Limiter limiter;
  private final ChunkRollOverStrategy rollOverStrategy;
  private final OutOfOrderPolicy outOfOrderPolicy;
  private final int maxReturnedErrors;
  private final MeterRegistry meterRegistry;

  public static Ingester fromConfig(InletConfigs.InletConfig inletConfig, MeterRegistry registry) {
    return fromConfig(
        inletConfig,
        StaticClusterMembership.fromConfig(inletConfig.getClusterConfig()),
        registry);
  }

  public static Ingester fromConfig(
      InletConfigs.InletConfig inletConfig,
      ClusterMembership clusterMembership,
      MeterRegistry registry) {
    InletConfigs.IngesterConfig ingesterConfig = inletConfig.getIngesterConfig();
    return new Ingester(
        ChunkFactories.fromConfig(ingesterConfig.getChunkConfig()),
        new Limiter(TenantLimitsOverrides.fromConfig(inletConfig), clusterMembership),
        SyncPeriodRollOverStrategy.fromConfig(ingesterConfig),
        OutOfOrderPolicy.fromConfig(ingesterConfig.getOutOfOrderPolicy()),
        ingesterConfig.getMaxReturnedErrors(),
        registry);
  }

  public Ingester(
      ChunkFactory chunkFactory,
      Limiter limiter,
      ChunkRollOverStrategy rollOverStrategy,
      OutOfOrderPolicy outOfOrderPolicy,
      int maxReturnedErrors,
      MeterRegistry meterRegistry) {
    this.chunkFactory = checkNotNull(chunkFactory, "chunkFactory can't be null");
    this.limiter = checkNotNull(limiter, "limiter can't be null");
    this.rollOverStrategy = checkNotNull(rollOverStrategy, "rollOverStrategy can't be null");
    this.outOfOrderPolicy = checkNotNull(outOfOrderPolicy, "outOfOrderPolicy can't be null");
    this.maxReturnedErrors = maxReturnedErrors;
    this.meterRegistry = checkNotNull(meterRegistry, "meterRegistry can't be null");
  }

  /**
   * Applies a tenant's push request.
   *
   * @throws IllegalStateException if the ingester isn't running.
   * @see Instance#push(Context, Push.PushRequest)
   */
  public void push(Context context, String tenant, Push.PushRequest request) {
    if (state() != State.RUNNING) {
      throw new IllegalStateException("Ingester is not accepting pushes in state " + state());
    }
    getOrCreateInstance(tenant).push(context, request);
  }

  public Stream getOrCreateStream(String tenant, String labels) {
    return getOrCreateInstance(tenant).getOrCreateStream(labels);
  }

  public Instance getOrCreateInstance(String tenant) {
    ensureNonEmptyString(tenant, "tenant can't be null or empty");
    return instances.computeIfAbsent(
        tenant,
        t -> {
          LOG.info("Creating instance for tenant {}", t);
          return new Instance(
              t,
              chunkFactory,
              limiter,
              rollOverStrategy,
              outOfOrderPolicy,
              maxReturnedErrors,
              meterRegistry);
        });
  }

  public Optional<Instance> getInstance(String tenant) {
    return Optional.ofNullable(instances.get(tenant));
  }

  /** Snapshot of the instances of all tenants that pushed to this ingester. */
  public List<Instance> instances() {
    return new ArrayList<>(instances.values());
  }

  /**
   * Removes a tenant's instance. A later push from the tenant starts from an empty instance. The
   * removed instance is returned so its chunks can still be drained.
   */
  public Optional<Instance> evictInstance(String tenant) {
    Instance removed = instances.remove(tenant);
    if (removed != null) {
      LOG.info("Evicted instance for tenant {} with {} streams", tenant, removed.streamCount());
    }
    return Optional.ofNullable(removed);
  }

  @Override
  protected void startUp() throws Exception {
    LOG.info("Starting ingester");
  }

  @Override
  protected void shutDown() throws Exception {
    LOG.info("Closing ingester with {} tenants", instances.size());
    for (Instance instance : instances.values()) {
      instance.closeActiveChunks();
    }
    LOG.info("Closed ingester");
  }
}
