package com.slack.inlet.labels;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Parses the display form of a label set, {@code {name="value", other="value"}}, into a canonical
 * {@link LabelSet}. The pairs may be declared in any order. Values are double-quoted and support
 * the {@code \"}, {@code \\} and {@code \n} escapes.
 */
public class LabelSetParser {
  private final String input;
  private int pos;

  private LabelSetParser(String input) {
    this.input = input;
    this.pos = 0;
  }

  public static LabelSet parse(String labels) {
    if (labels == null) {
      throw new InvalidLabelSetException("Label set can't be null");
    }
    return new LabelSetParser(labels).parseLabelSet();
  }

  private LabelSet parseLabelSet() {
    skipWhitespace();
    expect('{');
    List<Label> pairs = new ArrayList<>();
    Set<String> names = new HashSet<>();

    skipWhitespace();
    if (peek() == '}') {
      pos++;
    } else {
      while (true) {
        skipWhitespace();
        String name = parseName();
        skipWhitespace();
        expect('=');
        skipWhitespace();
        String value = parseQuotedValue();
        if (!names.add(name)) {
          throw error("duplicate label name '" + name + "'");
        }
        pairs.add(new Label(name, value));

        skipWhitespace();
        char c = next();
        if (c == '}') {
          break;
        } else if (c != ',') {
          pos--;
          throw error("expected ',' or '}'");
        }
      }
    }

    skipWhitespace();
    if (pos != input.length()) {
      throw error("unexpected trailing characters");
    }
    return LabelSet.canonicalize(pairs);
  }

  private String parseName() {
    int start = pos;
    if (pos >= input.length() || !isNameStart(input.charAt(pos))) {
      throw error("expected a label name");
    }
    pos++;
    while (pos < input.length() && isNamePart(input.charAt(pos))) {
      pos++;
    }
    return input.substring(start, pos);
  }

  private String parseQuotedValue() {
    expect('"');
    StringBuilder sb = new StringBuilder();
    while (true) {
      if (pos >= input.length()) {
        throw error("unterminated label value");
      }
      char c = input.charAt(pos++);
      if (c == '"') {
        return sb.toString();
      }
      if (c == '\\') {
        if (pos >= input.length()) {
          throw error("unterminated escape sequence");
        }
        char escaped = input.charAt(pos++);
        switch (escaped) {
          case '"' -> sb.append('"');
          case '\\' -> sb.append('\\');
          case 'n' -> sb.append('\n');
          default -> throw error("unknown escape sequence '\\" + escaped + "'");
        }
      } else {
        sb.append(c);
      }
    }
  }

  private static boolean isNameStart(char c) {
    return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
  }

  private static boolean isNamePart(char c) {
    return isNameStart(c) || (c >= '0' && c <= '9');
  }

  private void skipWhitespace() {
    while (pos < input.length() && Character.isWhitespace(input.charAt(pos))) {
      pos++;
    }
  }

  private char peek() {
    return pos < input.length() ? input.charAt(pos) : '\0';
  }

  private char next() {
    if (pos >= input.length()) {
      throw error("unexpected end of input");
    }
    return input.charAt(pos++);
  }

  private void expect(char expected) {
    if (pos >= input.length() || input.charAt(pos) != expected) {
      throw error("expected '" + expected + "'");
    }
    pos++;
  }

  private InvalidLabelSetException error(String reason) {
    return new InvalidLabelSetException(
        String.format("Invalid label set %s at position %d: %s", input, pos, reason));
  }
}
