package com.slack.inlet.chunk;

/**
 * A Chunk is an append-only buffer of timestamped log lines for a single stream. A chunk starts
 * empty, accepts appends while it is active and becomes immutable once closed. The stream that owns
 * a chunk decides when to close it; the chunk only reports how full it is.
 *
 * <p>Implementations are not thread safe. The owning stream serializes all access to an active
 * chunk. A closed chunk may be read from any thread once it has been safely published.
 */
public interface Chunk extends Iterable<LogEntry> {

  /** Returns true if the entry fits into this chunk without going over its hard size bound. */
  boolean spaceFor(LogEntry entry);

  /**
   * Append an entry to the chunk.
   *
   * @throws ChunkAppendException if the chunk rejects the entry. The chunk is unchanged.
   * @throws IllegalStateException if the chunk is closed.
   */
  void append(LogEntry entry);

  /**
   * Time bounds of the entries in the chunk.
   *
   * @throws IllegalStateException if the chunk is empty.
   */
  ChunkBounds bounds();

  /** How full the chunk is relative to its target size, in [0, 1]. */
  double utilization();

  int entryCount();

  default boolean isEmpty() {
    return entryCount() == 0;
  }

  long uncompressedSizeBytes();

  long encodedSizeBytes();

  ChunkEncoding encoding();

  /** Encodes any buffered data and makes the chunk immutable. Closing twice is a no-op. */
  void close();

  boolean isClosed();
}
