package com.serialpdf.render;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads a {@link PlaceholderValue} from JSON. Strings, numbers and booleans become scalars,
 * arrays of those become lists; objects, nulls and nested arrays are rejected.
 */
public final class PlaceholderValueDeserializer extends StdDeserializer<PlaceholderValue> {

  public PlaceholderValueDeserializer() {
    super(PlaceholderValue.class);
  }

  @Override
  public PlaceholderValue deserialize(JsonParser p, DeserializationContext ctxt)
      throws IOException {
    JsonNode node = p.getCodec().readTree(p);
    if (node.isValueNode() && !node.isNull()) {
      return new PlaceholderValue.Scalar(node.asText());
    }
    if (node.isArray()) {
      List<String> values = new ArrayList<>(node.size());
      for (JsonNode item : node) {
        if (!item.isValueNode() || item.isNull()) {
          return (PlaceholderValue)
              ctxt.handleUnexpectedToken(
                  PlaceholderValue.class,
                  p.currentToken(),
                  p,
                  "List placeholder values may only contain strings, numbers or booleans");
        }
        values.add(item.asText());
      }
      return new PlaceholderValue.ListValue(values);
    }
    return (PlaceholderValue)
        ctxt.handleUnexpectedToken(
            PlaceholderValue.class,
            p.currentToken(),
            p,
            "Placeholder values must be a string or a list of strings");
  }

  @Override
  public PlaceholderValue getNullValue(DeserializationContext ctxt) {
    return null;
  }
}
