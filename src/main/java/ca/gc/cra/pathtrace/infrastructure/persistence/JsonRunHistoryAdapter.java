package ca.gc.cra.pathtrace.infrastructure.persistence;

import ca.gc.cra.pathtrace.application.port.RunHistoryPort;
import ca.gc.cra.pathtrace.domain.history.RunStore;
import ca.gc.cra.pathtrace.domain.probe.RunResult;
import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> {@link RunHistoryPort} backed by a single JSON file mapping target to runs.
 * <p><strong>Why:</strong> Keeps histories human-readable and compatible with files written by earlier
 * tooling.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Decode the whole file into a {@link RunStore}.</li>
 *   <li>Append a run by editing the raw JSON tree so existing run objects are rewritten unchanged.</li>
 *   <li>Replace the file through a sibling temporary file.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Not safe for concurrent writers; the read-modify-write cycle is not
 * locked, so two processes appending to the same file can lose a run.</p>
 *
 * @since 0.1.0
 */
public final class JsonRunHistoryAdapter implements RunHistoryPort {
  private static final Logger log = LoggerFactory.getLogger(JsonRunHistoryAdapter.class);

  private final Path file;
  private final RunJsonMapper mapper;
  private final JsonTreeCodec codec = new JsonTreeCodec();

  public JsonRunHistoryAdapter(Path file) {
    this(file, new RunJsonMapper());
  }

  public JsonRunHistoryAdapter(Path file, RunJsonMapper mapper) {
    this.file = Objects.requireNonNull(file, "file");
    this.mapper = Objects.requireNonNull(mapper, "mapper");
  }

  public Path file() {
    return file;
  }

  @Override
  public RunStore load() throws IOException {
    RunStore store = new RunStore();
    for (Map.Entry<String, Object> entry : readTree().entrySet()) {
      if (!(entry.getValue() instanceof List<?> runs)) {
        throw new IOException("History " + file + " entry " + entry.getKey() + " must be an array of runs");
      }
      for (Object run : runs) {
        try {
          store.append(mapper.fromJson(entry.getKey(), run));
        } catch (IllegalArgumentException ex) {
          throw new IOException("History " + file + " has an invalid run for " + entry.getKey()
              + ": " + ex.getMessage(), ex);
        }
      }
    }
    log.debug("Loaded {} runs for {} targets from {}", store.size(), store.targets().size(), file);
    return store;
  }

  @Override
  public void append(RunResult run) throws IOException {
    Objects.requireNonNull(run, "run");
    Map<String, Object> tree = readTree();
    Object existing = tree.get(run.target());
    List<Object> runs;
    if (existing == null) {
      runs = new ArrayList<>();
    } else if (existing instanceof List<?> list) {
      runs = new ArrayList<>(list);
    } else {
      throw new IOException("History " + file + " entry " + run.target() + " must be an array of runs");
    }
    runs.add(mapper.toJson(run));
    tree.put(run.target(), runs);
    writeTree(tree);
    log.info("Appended run to {} ({} runs recorded for {})", file, runs.size(), run.target());
  }

  private Map<String, Object> readTree() throws IOException {
    if (!Files.exists(file)) {
      return new LinkedHashMap<>();
    }
    Object root;
    try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
      root = codec.read(reader);
    }
    if (root == null) {
      return new LinkedHashMap<>();
    }
    if (!(root instanceof Map<?, ?> map)) {
      throw new IOException("History " + file + " must contain a JSON object");
    }
    Map<String, Object> tree = new LinkedHashMap<>();
    map.forEach((key, value) -> tree.put(String.valueOf(key), value));
    return tree;
  }

  private void writeTree(Map<String, Object> tree) throws IOException {
    Path absolute = file.toAbsolutePath();
    Path directory = absolute.getParent();
    Path temp = Files.createTempFile(directory, absolute.getFileName().toString(), ".tmp");
    try {
      try (Writer writer = Files.newBufferedWriter(temp, StandardCharsets.UTF_8)) {
        codec.write(tree, writer);
      }
      try {
        Files.move(temp, absolute, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
      } catch (AtomicMoveNotSupportedException ex) {
        log.debug("Atomic move unsupported for {}; replacing in place", absolute);
        Files.move(temp, absolute, StandardCopyOption.REPLACE_EXISTING);
      }
    } finally {
      Files.deleteIfExists(temp);
    }
  }
}
