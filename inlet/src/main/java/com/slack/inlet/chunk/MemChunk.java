package com.slack.inlet.chunk;

import static com.google.common.base.Preconditions.checkState;
import static com.slack.inlet.util.ArgValidationUtils.ensureTrue;

import com.google.common.base.Utf8;
import com.google.common.collect.Iterators;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;

/**
 * MemChunk is an in-memory chunk made of encoded blocks. New entries go into an uncompressed head
 * block. Once the head block holds {@code blockSizeBytes} of line data it is encoded with the
 * chunk's {@link ChunkEncoding} and sealed as an immutable block.
 *
 * <p>A chunk has a hard size bound. Without a target size the chunk is full once it holds {@code
 * blocksPerChunk} blocks. With a target size the chunk is full once its encoded blocks plus the
 * raw head block reach the target. Either way a full chunk reports a utilization of 1.
 */
public class MemChunk implements Chunk {
  public static final int DEFAULT_BLOCKS_PER_CHUNK = 10;

  private final ChunkEncoding encoding;
  private final int blockSizeBytes;
  private final int targetSizeBytes;
  private final int blocksPerChunk;
  private final int maxLineSizeBytes;

  private final List<Block> blocks = new ArrayList<>();
  private final List<LogEntry> head = new ArrayList<>();
  private long headSizeBytes;
  private long blocksRawSizeBytes;
  private long blocksEncodedSizeBytes;

  private int entryCount;
  private Instant minTime;
  private Instant maxTime;
  private boolean closed;
  // Utilization when the chunk was closed, encoding the head block doesn't change it.
  private double closedUtilization;

  public MemChunk(ChunkEncoding encoding, int blockSizeBytes, int targetSizeBytes) {
    this(encoding, blockSizeBytes, targetSizeBytes, DEFAULT_BLOCKS_PER_CHUNK, 0);
  }

  public MemChunk(
      ChunkEncoding encoding,
      int blockSizeBytes,
      int targetSizeBytes,
      int blocksPerChunk,
      int maxLineSizeBytes) {
    ensureTrue(encoding != null, "Chunk encoding can't be null.");
    ensureTrue(blockSizeBytes > 0, "Block size should be a positive number.");
    ensureTrue(targetSizeBytes >= 0, "Target size can't be negative.");
    ensureTrue(blocksPerChunk > 0, "Blocks per chunk should be a positive number.");
    ensureTrue(maxLineSizeBytes >= 0, "Max line size can't be negative.");
    this.encoding = encoding;
    this.blockSizeBytes = blockSizeBytes;
    this.targetSizeBytes = targetSizeBytes;
    this.blocksPerChunk = blocksPerChunk;
    this.maxLineSizeBytes = maxLineSizeBytes;
  }

  @Override
  public boolean spaceFor(LogEntry entry) {
    if (closed) {
      return false;
    }
    if (targetSizeBytes > 0) {
      return blocksEncodedSizeBytes + headSizeBytes < targetSizeBytes;
    }
    return blocks.size() < blocksPerChunk;
  }

  @Override
  public void append(LogEntry entry) {
    checkState(!closed, "Can't append to a closed chunk");
    int lineSize = Utf8.encodedLength(entry.line());
    if (maxLineSizeBytes > 0 && lineSize > maxLineSizeBytes) {
      throw new ChunkAppendException(
          String.format(
              "line of %d bytes exceeds the max line size of %d bytes",
              lineSize, maxLineSizeBytes));
    }

    head.add(entry);
    headSizeBytes += lineSize;
    entryCount++;
    Instant ts = entry.timestamp();
    if (minTime == null || ts.isBefore(minTime)) {
      minTime = ts;
    }
    if (maxTime == null || ts.isAfter(maxTime)) {
      maxTime = ts;
    }

    if (headSizeBytes >= blockSizeBytes) {
      cutHeadBlock();
    }
  }

  @Override
  public ChunkBounds bounds() {
    checkState(entryCount > 0, "An empty chunk has no bounds");
    return new ChunkBounds(minTime, maxTime);
  }

  @Override
  public double utilization() {
    if (closed) {
      return closedUtilization;
    }
    double utilization;
    if (targetSizeBytes > 0) {
      utilization = (double) (blocksEncodedSizeBytes + headSizeBytes) / targetSizeBytes;
    } else {
      utilization = (double) uncompressedSizeBytes() / ((long) blocksPerChunk * blockSizeBytes);
    }
    return Math.min(1.0, utilization);
  }

  @Override
  public int entryCount() {
    return entryCount;
  }

  @Override
  public long uncompressedSizeBytes() {
    return blocksRawSizeBytes + headSizeBytes;
  }

  /** Size of the sealed blocks. Entries still in the head block aren't encoded yet. */
  @Override
  public long encodedSizeBytes() {
    return blocksEncodedSizeBytes;
  }

  @Override
  public ChunkEncoding encoding() {
    return encoding;
  }

  public int blockCount() {
    return blocks.size();
  }

  @Override
  public void close() {
    if (closed) {
      return;
    }
    closedUtilization = utilization();
    cutHeadBlock();
    closed = true;
  }

  @Override
  public boolean isClosed() {
    return closed;
  }

  @Override
  public Iterator<LogEntry> iterator() {
    List<Iterator<LogEntry>> iterators = new ArrayList<>(blocks.size() + 1);
    for (Block block : blocks) {
      iterators.add(decode(block).iterator());
    }
    iterators.add(Collections.unmodifiableList(new ArrayList<>(head)).iterator());
    return Iterators.concat(iterators.iterator());
  }

  private void cutHeadBlock() {
    if (head.isEmpty()) {
      return;
    }
    byte[] data = encode(head);
    blocks.add(new Block(data, head.size()));
    blocksRawSizeBytes += headSizeBytes;
    blocksEncodedSizeBytes += data.length;
    head.clear();
    headSizeBytes = 0;
  }

  private byte[] encode(List<LogEntry> entries) {
    ByteArrayOutputStream bytes = new ByteArrayOutputStream();
    try (DataOutputStream out = new DataOutputStream(encoding.encoder(bytes))) {
      for (LogEntry entry : entries) {
        byte[] line = entry.line().getBytes(StandardCharsets.UTF_8);
        out.writeLong(entry.timestamp().getEpochSecond());
        out.writeInt(entry.timestamp().getNano());
        out.writeInt(line.length);
        out.write(line);
      }
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to encode block", e);
    }
    return bytes.toByteArray();
  }

  private List<LogEntry> decode(Block block) {
    List<LogEntry> entries = new ArrayList<>(block.entryCount());
    try (DataInputStream in =
        new DataInputStream(encoding.decoder(new ByteArrayInputStream(block.data())))) {
      for (int i = 0; i < block.entryCount(); i++) {
        long seconds = in.readLong();
        int nanos = in.readInt();
        byte[] line = new byte[in.readInt()];
        in.readFully(line);
        entries.add(
            new LogEntry(
                Instant.ofEpochSecond(seconds, nanos), new String(line, StandardCharsets.UTF_8)));
      }
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to decode block", e);
    }
    return entries;
  }

  @Override
  public String toString() {
    return "MemChunk{"
        + "encoding="
        + encoding
        + ", entries="
        + entryCount
        + ", blocks="
        + blocks.size()
        + ", uncompressedBytes="
        + uncompressedSizeBytes()
        + ", closed="
        + closed
        + '}';
  }

  private record Block(byte[] data, int entryCount) {}
}
