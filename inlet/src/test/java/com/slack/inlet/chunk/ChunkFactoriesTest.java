package com.slack.inlet.chunk;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatIllegalArgumentException;

import com.slack.inlet.proto.config.InletConfigs;
import java.time.Instant;
import org.junit.jupiter.api.Test;

public class ChunkFactoriesTest {

  @Test
  public void testFromConfig() {
    InletConfigs.ChunkConfig chunkConfig =
        InletConfigs.ChunkConfig.newBuilder()
            .setEncoding(InletConfigs.ChunkEncoding.NONE)
            .setBlockSizeBytes(10)
            .build();
    ChunkFactory chunkFactory = ChunkFactories.fromConfig(chunkConfig);

    Chunk first = chunkFactory.newChunk();
    Chunk second = chunkFactory.newChunk();
    assertThat(first).isNotSameAs(second);
    assertThat(first.encoding()).isEqualTo(ChunkEncoding.NONE);

    // Unset blocks per chunk falls back to the default.
    for (int i = 0; i < MemChunk.DEFAULT_BLOCKS_PER_CHUNK; i++) {
      assertThat(first.spaceFor(new LogEntry(Instant.EPOCH, "0123456789"))).isTrue();
      first.append(new LogEntry(Instant.EPOCH, "0123456789"));
    }
    assertThat(first.spaceFor(new LogEntry(Instant.EPOCH, "0123456789"))).isFalse();
  }

  @Test
  public void testDefaultEncodingIsGzip() {
    InletConfigs.ChunkConfig chunkConfig =
        InletConfigs.ChunkConfig.newBuilder().setBlockSizeBytes(1024).build();
    assertThat(ChunkFactories.fromConfig(chunkConfig).newChunk().encoding())
        .isEqualTo(ChunkEncoding.GZIP);
  }

  @Test
  public void testInvalidConfigFailsEagerly() {
    assertThatIllegalArgumentException()
        .isThrownBy(
            () -> ChunkFactories.fromConfig(InletConfigs.ChunkConfig.newBuilder().build()));
    assertThatIllegalArgumentException()
        .isThrownBy(() -> ChunkFactories.memChunkFactory(ChunkEncoding.GZIP, 10, -5, 1, 0));
  }
}
