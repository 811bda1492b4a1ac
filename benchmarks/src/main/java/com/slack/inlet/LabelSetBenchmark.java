package com.slack.inlet;

import com.slack.inlet.labels.Fingerprints;
import com.slack.inlet.labels.LabelSet;
import com.slack.inlet.labels.LabelSetParser;
import org.openjdk.jmh.annotations.*;

@State(Scope.Thread)
public class LabelSetBenchmark {

  private static final String LABELS =
      "{namespace=\"ingest\", container=\"distributor\", pod=\"distributor-6d8f9c7b5-x2k4q\","
          + " cluster=\"prod-us-east-1\", app=\"api\", level=\"info\"}";

  private LabelSet labelSet;

  @Setup(Level.Trial)
  public void parseLabels() {
    labelSet = LabelSetParser.parse(LABELS);
  }

  @Benchmark
  public LabelSet measureParse() {
    return LabelSetParser.parse(LABELS);
  }

  @Benchmark
  public long measureFingerprint() {
    return Fingerprints.fastFingerprint(labelSet.labels());
  }

  @Benchmark
  public boolean measureEquals() {
    return labelSet.equals(LabelSetParser.parse(LABELS));
  }
}
