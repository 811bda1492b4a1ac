package com.slack.inlet;

import com.google.protobuf.Timestamp;
import com.slack.inlet.chunk.ChunkEncoding;
import com.slack.inlet.chunk.ChunkFactories;
import com.slack.inlet.chunkrollover.SyncPeriodRollOverStrategy;
import com.slack.inlet.ingester.Instance;
import com.slack.inlet.ingester.Limiter;
import com.slack.inlet.ingester.OutOfOrderPolicy;
import com.slack.inlet.ingester.StaticClusterMembership;
import com.slack.inlet.ingester.TenantLimitsOverrides;
import com.slack.inlet.proto.config.InletConfigs;
import com.slack.inlet.proto.push.Push;
import io.grpc.Context;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import java.util.Map;
import org.openjdk.jmh.annotations.*;

@State(Scope.Thread)
public class PushBenchmark {

  private static final int STREAMS = 100;
  private static final int ENTRIES_PER_STREAM = 100;

  private static final String LINE =
      "level=info ts=2024-01-01T00:00:00.000Z caller=handler.go:42 method=POST"
          + " path=/api/chat.postMessage status=200 duration_ms=17 team=T98765XYZ12 user=U000111222A";

  private MeterRegistry registry;
  private Instance instance;
  private long nextSecond;

  @Setup(Level.Iteration)
  public void createInstance() {
    registry = new SimpleMeterRegistry();
    Limiter limiter =
        new Limiter(
            new TenantLimitsOverrides(InletConfigs.LimitsConfig.getDefaultInstance(), Map.of()),
            new StaticClusterMembership(1));
    instance =
        new Instance(
            "benchmark",
            ChunkFactories.memChunkFactory(ChunkEncoding.GZIP, 256 * 1024, 1536 * 1024, 10, 0),
            limiter,
            new SyncPeriodRollOverStrategy(Duration.ofMinutes(15), 0.2),
            OutOfOrderPolicy.ACCEPT,
            10,
            registry);
    nextSecond = 1704067200L;
  }

  @TearDown(Level.Iteration)
  public void tearDown() {
    registry.close();
  }

  @Benchmark
  public void measurePushManyStreams() {
    Push.PushRequest.Builder request = Push.PushRequest.newBuilder();
    for (int s = 0; s < STREAMS; s++) {
      Push.StreamEntries.Builder streamEntries =
          Push.StreamEntries.newBuilder()
              .setLabels("{app=\"api\", host=\"host-" + s + "\", env=\"prod\"}");
      for (int i = 0; i < ENTRIES_PER_STREAM; i++) {
        streamEntries.addEntries(
            Push.Entry.newBuilder()
                .setTimestamp(Timestamp.newBuilder().setSeconds(nextSecond).setNanos(i * 1000))
                .setLine(LINE));
      }
      request.addStreams(streamEntries);
    }
    nextSecond++;
    instance.push(Context.ROOT, request.build());
  }
}
