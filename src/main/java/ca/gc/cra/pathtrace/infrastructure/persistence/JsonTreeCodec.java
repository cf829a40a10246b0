package ca.gc.cra.pathtrace.infrastructure.persistence;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.core.util.DefaultIndenter;
import com.fasterxml.jackson.core.util.DefaultPrettyPrinter;
import com.fasterxml.jackson.core.util.Separators;
import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Streams JSON documents to and from plain {@link Map}/{@link List} graphs.
 *
 * <p>Floating point literals are read as {@link BigDecimal} so a document can be rewritten without
 * reformatting numbers it already contained. Output sorts object keys and indents by four spaces.</p>
 *
 * @since 0.1.0
 */
final class JsonTreeCodec {
  private static final DefaultIndenter INDENTER = new DefaultIndenter("    ", "\n");
  private static final Separators SEPARATORS = Separators.createDefaultInstance()
      .withObjectFieldValueSpacing(Separators.Spacing.AFTER)
      .withObjectEmptySeparator("")
      .withArrayEmptySeparator("");

  private final JsonFactory factory = new JsonFactory();

  /**
   * Parses one JSON document.
   *
   * @param reader document source; not closed
   * @return parsed graph; {@code null} for an empty document
   * @throws IOException if the document is not valid JSON
   */
  Object read(Reader reader) throws IOException {
    Objects.requireNonNull(reader, "reader");
    try (JsonParser parser = factory.createParser(reader)) {
      parser.disable(JsonParser.Feature.AUTO_CLOSE_SOURCE);
      JsonToken token = parser.nextToken();
      if (token == null) {
        return null;
      }
      Object value = readValue(parser, token);
      if (parser.nextToken() != null) {
        throw new IOException("JSON document contains trailing content");
      }
      return value;
    }
  }

  /**
   * Writes a graph of maps, lists, strings, numbers, booleans and nulls.
   *
   * @param value graph root
   * @param writer destination; flushed but not closed
   * @throws IOException if writing fails
   * @throws IllegalArgumentException if the graph contains an unsupported value type
   */
  void write(Object value, Writer writer) throws IOException {
    Objects.requireNonNull(writer, "writer");
    try (JsonGenerator generator = factory.createGenerator(writer)) {
      generator.disable(JsonGenerator.Feature.AUTO_CLOSE_TARGET);
      generator.setPrettyPrinter(prettyPrinter());
      writeValue(generator, value);
    }
    writer.write('\n');
    writer.flush();
  }

  // Pretty printers track nesting, so each generator gets its own.
  private static DefaultPrettyPrinter prettyPrinter() {
    return new DefaultPrettyPrinter()
        .withObjectIndenter(INDENTER)
        .withArrayIndenter(INDENTER)
        .withSeparators(SEPARATORS);
  }

  private Object readValue(JsonParser parser, JsonToken token) throws IOException {
    return switch (token) {
      case START_OBJECT -> readObject(parser);
      case START_ARRAY -> readArray(parser);
      case VALUE_STRING -> parser.getText();
      case VALUE_NUMBER_INT -> parser.getNumberValue();
      case VALUE_NUMBER_FLOAT -> parser.getDecimalValue();
      case VALUE_TRUE -> Boolean.TRUE;
      case VALUE_FALSE -> Boolean.FALSE;
      case VALUE_NULL -> null;
      default -> throw new IOException("Unsupported JSON token: " + token);
    };
  }

  private Map<String, Object> readObject(JsonParser parser) throws IOException {
    Map<String, Object> map = new LinkedHashMap<>();
    JsonToken token;
    while ((token = parser.nextToken()) != JsonToken.END_OBJECT) {
      if (token != JsonToken.FIELD_NAME) {
        throw new IOException("Expected field name but found " + token);
      }
      String fieldName = parser.currentName();
      map.put(fieldName, readValue(parser, parser.nextToken()));
    }
    return map;
  }

  private List<Object> readArray(JsonParser parser) throws IOException {
    List<Object> list = new ArrayList<>();
    JsonToken token;
    while ((token = parser.nextToken()) != JsonToken.END_ARRAY) {
      list.add(readValue(parser, token));
    }
    return list;
  }

  private void writeValue(JsonGenerator generator, Object value) throws IOException {
    if (value == null) {
      generator.writeNull();
    } else if (value instanceof Map<?, ?> map) {
      generator.writeStartObject();
      Map<String, Object> sorted = new TreeMap<>();
      map.forEach((key, entry) -> sorted.put(String.valueOf(key), entry));
      for (Map.Entry<String, Object> entry : sorted.entrySet()) {
        generator.writeFieldName(entry.getKey());
        writeValue(generator, entry.getValue());
      }
      generator.writeEndObject();
    } else if (value instanceof List<?> list) {
      generator.writeStartArray();
      for (Object item : list) {
        writeValue(generator, item);
      }
      generator.writeEndArray();
    } else if (value instanceof String text) {
      generator.writeString(text);
    } else if (value instanceof Boolean flag) {
      generator.writeBoolean(flag);
    } else if (value instanceof BigDecimal decimal) {
      generator.writeNumber(decimal);
    } else if (value instanceof BigInteger integer) {
      generator.writeNumber(integer);
    } else if (value instanceof Double || value instanceof Float) {
      generator.writeNumber(((Number) value).doubleValue());
    } else if (value instanceof Number number) {
      generator.writeNumber(number.longValue());
    } else {
      throw new IllegalArgumentException("Unsupported JSON value type: " + value.getClass().getName());
    }
  }
}
