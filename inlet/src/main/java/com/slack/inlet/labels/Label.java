package com.slack.inlet.labels;

import static com.slack.inlet.util.ArgValidationUtils.ensureNonEmptyString;

import java.util.Objects;

/** A single name/value pair of a {@link LabelSet}. */
public record Label(String name, String value) {
  public Label {
    ensureNonEmptyString(name, "Label name can't be empty");
    Objects.requireNonNull(value, "Label value can't be null");
  }
}
