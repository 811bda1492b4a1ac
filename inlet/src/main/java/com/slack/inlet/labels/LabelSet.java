package com.slack.inlet.labels;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;

/**
 * LabelSet is the canonical identity of a log stream: the label pairs sorted by name, plus the
 * fingerprint computed over that sorted form. Two label sets are equal iff their sorted pairs are
 * identical, no matter the order the pairs were declared in.
 *
 * <p>Names are expected to be unique. Inputs with duplicate names are rejected by {@link
 * LabelSetParser} before they get here.
 */
public final class LabelSet {
  private static final Comparator<Label> BY_NAME =
      Comparator.comparing(Label::name).thenComparing(Label::value);

  private static final LabelSet EMPTY = new LabelSet(List.of());

  private final List<Label> labels;
  private final long fingerprint;

  private LabelSet(List<Label> sortedLabels) {
    this.labels = sortedLabels;
    this.fingerprint = Fingerprints.fastFingerprint(sortedLabels);
  }

  public static LabelSet canonicalize(Collection<Label> labels) {
    if (labels.isEmpty()) {
      return EMPTY;
    }
    List<Label> sorted = new ArrayList<>(labels);
    sorted.sort(BY_NAME);
    return new LabelSet(List.copyOf(sorted));
  }

  public static LabelSet empty() {
    return EMPTY;
  }

  public List<Label> labels() {
    return labels;
  }

  public long fingerprint() {
    return fingerprint;
  }

  public int size() {
    return labels.size();
  }

  public boolean isEmpty() {
    return labels.isEmpty();
  }

  /** Returns the value of the named label or null if the label isn't present. */
  public String get(String name) {
    for (Label label : labels) {
      if (label.name().equals(name)) {
        return label.value();
      }
    }
    return null;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof LabelSet)) return false;
    LabelSet other = (LabelSet) o;
    return fingerprint == other.fingerprint && labels.equals(other.labels);
  }

  @Override
  public int hashCode() {
    return Long.hashCode(fingerprint);
  }

  /** Canonical display form, e.g. {@code {app="api", env="prod"}}. */
  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder("{");
    for (int i = 0; i < labels.size(); i++) {
      if (i > 0) {
        sb.append(", ");
      }
      Label label = labels.get(i);
      sb.append(label.name()).append("=\"");
      appendEscaped(sb, label.value());
      sb.append('"');
    }
    return sb.append('}').toString();
  }

  private static void appendEscaped(StringBuilder sb, String value) {
    for (int i = 0; i < value.length(); i++) {
      char c = value.charAt(i);
      switch (c) {
        case '"' -> sb.append("\\\"");
        case '\\' -> sb.append("\\\\");
        case '\n' -> sb.append("\\n");
        default -> sb.append(c);
      }
    }
  }
}
