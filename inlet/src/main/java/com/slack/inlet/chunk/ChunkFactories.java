package com.slack.inlet.chunk;

import com.slack.inlet.proto.config.InletConfigs;

public class ChunkFactories {
  private ChunkFactories() {}

  public static ChunkFactory fromConfig(InletConfigs.ChunkConfig chunkConfig) {
    ChunkEncoding encoding = ChunkEncoding.fromConfig(chunkConfig.getEncoding());
    int blocksPerChunk =
        chunkConfig.getBlocksPerChunk() > 0
            ? chunkConfig.getBlocksPerChunk()
            : MemChunk.DEFAULT_BLOCKS_PER_CHUNK;
    return memChunkFactory(
        encoding,
        chunkConfig.getBlockSizeBytes(),
        chunkConfig.getTargetSizeBytes(),
        blocksPerChunk,
        chunkConfig.getMaxLineSizeBytes());
  }

  public static ChunkFactory memChunkFactory(
      ChunkEncoding encoding,
      int blockSizeBytes,
      int targetSizeBytes,
      int blocksPerChunk,
      int maxLineSizeBytes) {
    // Throws on invalid sizes.
    new MemChunk(encoding, blockSizeBytes, targetSizeBytes, blocksPerChunk, maxLineSizeBytes);
    return () ->
        new MemChunk(encoding, blockSizeBytes, targetSizeBytes, blocksPerChunk, maxLineSizeBytes);
  }
}
