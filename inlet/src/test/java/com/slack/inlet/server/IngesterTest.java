package com.slack.inlet.server;

import static com.slack.inlet.server.InletConfig.DEFAULT_START_STOP_DURATION;
import static com.slack.inlet.testlib.ChunkUtil.makePushRequest;
import static com.slack.inlet.testlib.ChunkUtil.makeStreamEntries;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatExceptionOfType;
import static org.assertj.core.api.Assertions.assertThatIllegalArgumentException;
import static org.assertj.core.api.Assertions.assertThatIllegalStateException;

import com.slack.inlet.chunk.ChunkAppendException;
import com.slack.inlet.ingester.Instance;
import com.slack.inlet.ingester.Stream;
import com.slack.inlet.ingester.StreamLimitExceededException;
import com.slack.inlet.proto.config.InletConfigs;
import com.slack.inlet.testlib.InletConfigUtil;
import io.grpc.Context;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Instant;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

public class IngesterTest {
  private static final Instant START = Instant.parse("2024-01-01T00:00:00Z");

  private SimpleMeterRegistry metricsRegistry;
  private Ingester ingester;

  @BeforeEach
  public void setUp() throws TimeoutException {
    metricsRegistry = new SimpleMeterRegistry();
    ingester = Ingester.fromConfig(InletConfigUtil.makeInletConfig(10, 2), metricsRegistry);
    ingester.startAsync().awaitRunning(DEFAULT_START_STOP_DURATION.toSeconds(), TimeUnit.SECONDS);
  }

  @AfterEach
  public void tearDown() throws TimeoutException {
    if (ingester.isRunning()) {
      ingester
          .stopAsync()
          .awaitTerminated(DEFAULT_START_STOP_DURATION.toSeconds(), TimeUnit.SECONDS);
    }
    metricsRegistry.close();
  }

  @Test
  public void testTenantsAreIsolated() {
    ingester.push(
        Context.ROOT, "tenant1", makePushRequest(makeStreamEntries("{app=\"api\"}", START, 5, 1)));
    ingester.push(
        Context.ROOT, "tenant2", makePushRequest(makeStreamEntries("{app=\"api\"}", START, 3, 1)));

    assertThat(ingester.instances()).hasSize(2);
    Stream first = ingester.getOrCreateStream("tenant1", "{app=\"api\"}");
    Stream second = ingester.getOrCreateStream("tenant2", "{app=\"api\"}");
    assertThat(first).isNotSameAs(second);
    assertThat(first.entryCount()).isEqualTo(5);
    assertThat(second.entryCount()).isEqualTo(3);
    assertThat(first.tenant()).isEqualTo("tenant1");
  }

  @Test
  public void testLimitsApplyPerTenantAndReplica() {
    // 10 streams across 2 replicas.
    for (int i = 0; i < 5; i++) {
      ingester.getOrCreateStream("tenant1", "{id=\"" + i + "\"}");
    }
    assertThatExceptionOfType(StreamLimitExceededException.class)
        .isThrownBy(() -> ingester.getOrCreateStream("tenant1", "{id=\"5\"}"));
    // Another tenant has its own budget.
    assertThat(ingester.getOrCreateStream("tenant2", "{id=\"5\"}")).isNotNull();
  }

  @Test
  public void testInstanceLifecycle() {
    assertThat(ingester.getInstance("tenant1")).isEmpty();
    Instance instance = ingester.getOrCreateInstance("tenant1");
    assertThat(ingester.getOrCreateInstance("tenant1")).isSameAs(instance);
    assertThat(ingester.getInstance("tenant1")).containsSame(instance);

    assertThat(ingester.evictInstance("tenant1")).containsSame(instance);
    assertThat(ingester.evictInstance("tenant1")).isEmpty();
    assertThat(ingester.getOrCreateInstance("tenant1")).isNotSameAs(instance);
  }

  @Test
  public void testEmptyTenantIsRejected() {
    assertThatIllegalArgumentException().isThrownBy(() -> ingester.getOrCreateInstance(""));
    assertThatIllegalArgumentException().isThrownBy(() -> ingester.getOrCreateInstance(null));
  }

  @Test
  public void testShutdownClosesActiveChunks() throws TimeoutException {
    ingester.push(
        Context.ROOT,
        "tenant1",
        makePushRequest(
            makeStreamEntries("{app=\"a\"}", START, 5, 1),
            makeStreamEntries("{app=\"b\"}", START, 5, 1)));
    ingester.stopAsync().awaitTerminated(DEFAULT_START_STOP_DURATION.toSeconds(), TimeUnit.SECONDS);

    for (Stream stream : ingester.getInstance("tenant1").get().streams()) {
      assertThat(stream.closedChunksPendingFlush()).hasSize(1);
    }
    assertThatIllegalStateException()
        .isThrownBy(
            () ->
                ingester.push(
                    Context.ROOT,
                    "tenant1",
                    makePushRequest(makeStreamEntries("{app=\"a\"}", START, 1, 1))));
  }

  @Test
  public void testPushBeforeStartIsRejected() {
    Ingester notStarted =
        Ingester.fromConfig(InletConfigUtil.makeInletConfig(10, 1), metricsRegistry);
    assertThatIllegalStateException()
        .isThrownBy(
            () ->
                notStarted.push(
                    Context.ROOT,
                    "tenant1",
                    makePushRequest(makeStreamEntries("{app=\"a\"}", START, 1, 1))));
  }

  @Test
  public void testOutOfOrderPolicyFromConfig() {
    InletConfigs.InletConfig config =
        InletConfigUtil.makeInletConfig(0, 1).toBuilder()
            .setIngesterConfig(
                InletConfigUtil.makeIngesterConfig().toBuilder()
                    .setOutOfOrderPolicy(InletConfigs.OutOfOrderPolicy.REJECT))
            .build();
    Ingester rejecting = Ingester.fromConfig(config, metricsRegistry);
    Stream stream = rejecting.getOrCreateStream("tenant1", "{app=\"a\"}");
    Instance instance = rejecting.getInstance("tenant1").get();

    instance.push(Context.ROOT, makePushRequest(makeStreamEntries("{app=\"a\"}", START, 1, 1)));
    assertThatExceptionOfType(ChunkAppendException.class)
        .isThrownBy(
            () ->
                instance.push(
                    Context.ROOT,
                    makePushRequest(
                        makeStreamEntries("{app=\"a\"}", START.minusSeconds(1), 1, 1))))
        .withMessageContaining("total ignored: 1 out of 1");
    assertThat(stream.entryCount()).isEqualTo(1);
  }
}
