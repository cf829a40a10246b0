package ca.gc.cra.pathtrace.infrastructure.persistence;

import ca.gc.cra.pathtrace.domain.probe.HopRecord;
import ca.gc.cra.pathtrace.domain.probe.RunResult;
import java.math.BigDecimal;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.temporal.ChronoField;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Converts {@link RunResult} values to and from the persisted run object layout.
 * <p><strong>Layout:</strong>
 * <pre>{@code
 * {
 *     "cmd": "traceroute -m 64 --udp -p 33434 -q 3 -w 3 example.org",
 *     "data": [ {"addresses": ["192.0.2.1"], "hostname": "gw", "index": 1, "results": [0.3, 0.2, 0.2], "timeouts": 0} ],
 *     "description": "traceroute to example.org (93.184.216.34), 64 hops max, 60 byte packets",
 *     "time_taken_in_secs": 4.02,
 *     "timestamp": "2024-05-01T12:00:00Z"
 * }
 * }</pre>
 * {@code data} is the string {@code "No data"} for a run without hops.</p>
 * <p><strong>Legacy input accepted:</strong> {@code ip_address} instead of {@code addresses}; scalar fields
 * wrapped in one-element arrays; local {@code yyyy-MM-dd HH:mm:ss[.ffffff]} timestamps; hops without
 * {@code index} or {@code timeouts}.</p>
 * <p><strong>Thread-safety:</strong> Immutable; safe for concurrent use.</p>
 *
 * @since 0.1.0
 */
public final class RunJsonMapper {
  private static final Logger log = LoggerFactory.getLogger(RunJsonMapper.class);
  static final String NO_DATA = "No data";
  private static final DateTimeFormatter LEGACY_TIMESTAMP = new DateTimeFormatterBuilder()
      .appendPattern("yyyy-MM-dd HH:mm:ss")
      .optionalStart()
      .appendFraction(ChronoField.NANO_OF_SECOND, 1, 9, true)
      .optionalEnd()
      .toFormatter();

  private final ZoneId legacyZone;

  /**
   * Creates a mapper reading legacy local timestamps in the system time zone.
   */
  public RunJsonMapper() {
    this(ZoneId.systemDefault());
  }

  /**
   * Creates a mapper.
   *
   * @param legacyZone zone applied to legacy timestamps that carry no offset
   */
  public RunJsonMapper(ZoneId legacyZone) {
    this.legacyZone = Objects.requireNonNull(legacyZone, "legacyZone");
  }

  /**
   * Encodes a run.
   *
   * @param run run to encode
   * @return mutable JSON object graph
   */
  public Map<String, Object> toJson(RunResult run) {
    Map<String, Object> json = new LinkedHashMap<>();
    json.put("cmd", run.command());
    json.put("timestamp", run.timestamp().toString());
    json.put("description", run.description());
    json.put("time_taken_in_secs", run.durationSeconds());
    if (!run.hasData()) {
      json.put("data", NO_DATA);
      return json;
    }
    List<Object> hops = new ArrayList<>(run.hops().size());
    for (HopRecord hop : run.hops()) {
      Map<String, Object> entry = new LinkedHashMap<>();
      entry.put("index", hop.index());
      if (!hop.addresses().isEmpty()) {
        entry.put("addresses", new ArrayList<Object>(hop.addresses()));
      }
      hop.hostname().ifPresent(name -> entry.put("hostname", name));
      entry.put("results", new ArrayList<Object>(hop.samples()));
      entry.put("timeouts", hop.timeouts());
      hops.add(entry);
    }
    json.put("data", hops);
    return json;
  }

  /**
   * Decodes a persisted run.
   *
   * @param target target the run is filed under
   * @param node run object
   * @return decoded run
   * @throws IllegalArgumentException if the node is not a run object or a field has the wrong type
   */
  public RunResult fromJson(String target, Object node) {
    if (!(node instanceof Map<?, ?> json)) {
      throw new IllegalArgumentException("run entry for " + target + " must be an object");
    }
    String command = text(json.get("cmd"), "cmd");
    String description = text(unwrap(json.get("description")), "description");
    Instant timestamp = timestamp(unwrap(json.get("timestamp")));
    Object duration = unwrap(json.get("time_taken_in_secs"));
    double durationSeconds = duration == null ? 0d : number(duration, "time_taken_in_secs");

    List<HopRecord> hops = new ArrayList<>();
    if (json.get("data") instanceof List<?> entries) {
      for (int position = 0; position < entries.size(); position++) {
        Object entry = entries.get(position);
        if (!(entry instanceof Map<?, ?> hop)) {
          log.warn("Skipping non-object hop entry {} of a run to {}", position, target);
          continue;
        }
        hops.add(hop(hop, position));
      }
    }
    return new RunResult(target, command, description, timestamp, Math.max(0d, durationSeconds), hops);
  }

  private HopRecord hop(Map<?, ?> json, int position) {
    Object rawIndex = json.get("index");
    int index = rawIndex == null ? position + 1 : integer(rawIndex, "index");
    Object rawAddresses = json.containsKey("addresses") ? json.get("addresses") : json.get("ip_address");
    Set<String> addresses = new LinkedHashSet<>();
    if (rawAddresses instanceof List<?> list) {
      for (Object address : list) {
        addresses.add(text(address, "addresses"));
      }
    } else if (rawAddresses != null) {
      addresses.add(text(rawAddresses, "addresses"));
    }
    Object rawHostname = json.get("hostname");
    Optional<String> hostname = rawHostname == null
        ? Optional.empty()
        : Optional.of(text(rawHostname, "hostname"));
    List<Double> samples = new ArrayList<>();
    if (json.get("results") instanceof List<?> results) {
      for (Object sample : results) {
        samples.add(number(sample, "results"));
      }
    }
    Object rawTimeouts = json.get("timeouts");
    int timeouts = rawTimeouts == null ? 0 : integer(rawTimeouts, "timeouts");
    return new HopRecord(index, addresses, hostname, samples, timeouts);
  }

  private Instant timestamp(Object raw) {
    if (raw == null) {
      return Instant.EPOCH;
    }
    String text = text(raw, "timestamp");
    try {
      return Instant.parse(text);
    } catch (DateTimeException ignored) {
      try {
        return LocalDateTime.parse(text, LEGACY_TIMESTAMP).atZone(legacyZone).toInstant();
      } catch (DateTimeException ex) {
        throw new IllegalArgumentException("timestamp is not a recognised date-time: " + text, ex);
      }
    }
  }

  private static Object unwrap(Object value) {
    if (value instanceof List<?> list && list.size() == 1) {
      return list.get(0);
    }
    return value;
  }

  private static String text(Object value, String field) {
    if (value == null) {
      return "";
    }
    if (!(value instanceof String string)) {
      throw new IllegalArgumentException(field + " must be a string (was " + value + ")");
    }
    return string;
  }

  private static double number(Object value, String field) {
    if (!(value instanceof Number number)) {
      throw new IllegalArgumentException(field + " must be a number (was " + value + ")");
    }
    return number.doubleValue();
  }

  private static int integer(Object value, String field) {
    number(value, field);
    try {
      return new BigDecimal(value.toString()).intValueExact();
    } catch (ArithmeticException | NumberFormatException ex) {
      throw new IllegalArgumentException(field + " must be a whole number (was " + value + ")", ex);
    }
  }
}
