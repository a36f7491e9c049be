package com.serialpdf.render;

import com.fasterxml.jackson.annotation.JsonValue;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import java.util.List;
import java.util.Objects;

/**
 * Value supplied for one placeholder key.
 *
 * <p>Scalar: {@code "Bob"} - List: {@code ["first", "second"]}
 */
@JsonDeserialize(using = PlaceholderValueDeserializer.class)
public sealed interface PlaceholderValue {

  static PlaceholderValue of(String value) {
    return new Scalar(value);
  }

  static PlaceholderValue of(List<String> values) {
    return new ListValue(values);
  }

  /** Single string substituted for a scalar placeholder. */
  record Scalar(String value) implements PlaceholderValue {
    public Scalar {
      Objects.requireNonNull(value, "value");
    }

    @JsonValue
    @Override
    public String value() {
      return value;
    }

    @Override
    public String toString() {
      return value;
    }
  }

  /** Ordered strings rendered as a list block. */
  record ListValue(List<String> values) implements PlaceholderValue {
    public ListValue {
      Objects.requireNonNull(values, "values");
      values = List.copyOf(values);
    }

    @JsonValue
    @Override
    public List<String> values() {
      return values;
    }

    @Override
    public String toString() {
      return values.toString();
    }
  }
}
