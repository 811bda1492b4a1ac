package com.slack.inlet.labels;

import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Computes the 64-bit fingerprint of a label set. Each name/value pair is hashed with FNV-1a over
 * {@code name, 0xFF, value} and the per-pair hashes are XOR-ed together.
 *
 * <p>The fingerprint is only a lookup key. Distinct label sets can and do collide, for example
 * {@code {app="l", uniq0="0", uniq1="1"}} and {@code {app="m", uniq0="1", uniq1="1"}}, so callers
 * must always confirm a match by comparing the label sets themselves.
 */
public final class Fingerprints {
  static final long OFFSET_64 = 0xcbf29ce484222325L;
  static final long PRIME_64 = 0x100000001b3L;
  private static final byte SEPARATOR = (byte) 0xFF;

  private Fingerprints() {}

  /** Fingerprint of the given labels, which must already be in canonical (name-sorted) order. */
  public static long fastFingerprint(List<Label> sortedLabels) {
    if (sortedLabels.isEmpty()) {
      return OFFSET_64;
    }
    long result = 0;
    for (Label label : sortedLabels) {
      long sum = OFFSET_64;
      sum = add(sum, label.name().getBytes(StandardCharsets.UTF_8));
      sum = add(sum, SEPARATOR);
      sum = add(sum, label.value().getBytes(StandardCharsets.UTF_8));
      result ^= sum;
    }
    return result;
  }

  public static String toHexString(long fingerprint) {
    return String.format("%016x", fingerprint);
  }

  private static long add(long hash, byte[] bytes) {
    for (byte b : bytes) {
      hash = add(hash, b);
    }
    return hash;
  }

  private static long add(long hash, byte b) {
    hash ^= (b & 0xFF);
    return hash * PRIME_64;
  }
}
