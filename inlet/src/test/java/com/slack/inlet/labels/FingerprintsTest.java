package com.slack.inlet.labels;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import org.junit.jupiter.api.Test;

public class FingerprintsTest {

  @Test
  public void testEmptyLabelSetFingerprint() {
    assertThat(Fingerprints.fastFingerprint(List.of())).isEqualTo(0xcbf29ce484222325L);
  }

  @Test
  public void testKnownCollisions() {
    assertCollision(
        "{app=\"l\", uniq0=\"0\", uniq1=\"1\"}",
        "{uniq0=\"1\", app=\"m\", uniq1=\"1\"}",
        0xe002a3a451262627L);
    assertCollision(
        "{app=\"l\", uniq0=\"1\", uniq1=\"0\"}",
        "{uniq1=\"0\", app=\"m\", uniq0=\"0\"}",
        0xe002a3a451262247L);
    assertCollision(
        "{app=\"l\", uniq0=\"0\", uniq1=\"0\"}",
        "{uniq0=\"1\", uniq1=\"0\", app=\"m\"}",
        0xe002a2a4512624f4L);
  }

  @Test
  public void testPairBoundariesMatter() {
    // Without the separator these two would hash the same bytes.
    LabelSet first = LabelSetParser.parse("{ab=\"c\"}");
    LabelSet second = LabelSetParser.parse("{a=\"bc\"}");
    assertThat(first.fingerprint()).isNotEqualTo(second.fingerprint());
  }

  @Test
  public void testToHexString() {
    assertThat(Fingerprints.toHexString(0xe002a3a451262627L)).isEqualTo("e002a3a451262627");
    assertThat(Fingerprints.toHexString(1L)).isEqualTo("0000000000000001");
  }

  private static void assertCollision(String first, String second, long fingerprint) {
    LabelSet firstSet = LabelSetParser.parse(first);
    LabelSet secondSet = LabelSetParser.parse(second);
    assertThat(firstSet.fingerprint()).isEqualTo(fingerprint);
    assertThat(secondSet.fingerprint()).isEqualTo(fingerprint);
    assertThat(firstSet).isNotEqualTo(secondSet);
  }
}
