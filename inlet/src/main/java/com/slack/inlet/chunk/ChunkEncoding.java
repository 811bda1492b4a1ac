package com.slack.inlet.chunk;

import com.slack.inlet.proto.config.InletConfigs;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.zip.GZIPInputStream;
import java.util.zip.GZIPOutputStream;

/** Encodings for the blocks of a {@link MemChunk}. */
public enum ChunkEncoding {
  NONE {
    @Override
    OutputStream encoder(OutputStream out) {
      return out;
    }

    @Override
    InputStream decoder(InputStream in) {
      return in;
    }
  },
  GZIP {
    @Override
    OutputStream encoder(OutputStream out) throws IOException {
      return new GZIPOutputStream(out);
    }

    @Override
    InputStream decoder(InputStream in) throws IOException {
      return new GZIPInputStream(in);
    }
  };

  abstract OutputStream encoder(OutputStream out) throws IOException;

  abstract InputStream decoder(InputStream in) throws IOException;

  public static ChunkEncoding fromConfig(InletConfigs.ChunkEncoding encoding) {
    return switch (encoding) {
      case NONE -> NONE;
      case GZIP -> GZIP;
      default -> throw new IllegalArgumentException("Unsupported chunk encoding " + encoding);
    };
  }
}
