package shepherd.runner.cache;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import shepherd.util.exceptions.UncheckedIO;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * A small JSON file of string values that is discarded wholesale once it is older than a time-to-live.
 * @see #invalidate
 */
public class DiskCache {
  private static final Logger LOG = LoggerFactory.getLogger(DiskCache.class);
  private static final ObjectMapper MAPPER = new ObjectMapper();
  private static final String CREATED = "created";
  private static final String VALUES = "values";

  private final Path file;
  private final Clock clock;
  private final Map<String, String> values = new LinkedHashMap<>();
  private Instant created;

  private DiskCache(Path file, Clock clock, Instant created) {
    this.file = file;
    this.clock = clock;
    this.created = created;
  }

  /**
   * Reads the cache at the given path. A missing or unreadable file yields an empty cache.
   */
  public static DiskCache load(Path file, Clock clock) {
    if (!Files.exists(file)) return new DiskCache(file, clock, clock.instant());
    try {
      JsonNode root = MAPPER.readTree(file.toFile());
      DiskCache cache = new DiskCache(file, clock, Instant.ofEpochSecond(root.path(CREATED).asLong()));
      root.path(VALUES).fields().forEachRemaining(entry -> cache.values.put(entry.getKey(), entry.getValue().asText()));
      return cache;
    } catch (IOException e) {
      LOG.warn("Discarding unreadable cache file {}", file, e);
      return new DiskCache(file, clock, clock.instant());
    }
  }

  /**
   * Clears every entry if the cache was created more than {@code ttl} ago, restarting its clock.
   */
  public synchronized void invalidate(Duration ttl) {
    Instant now = clock.instant();
    if (created.plus(ttl).isBefore(now)) {
      LOG.debug("Cache {} expired (created {})", file, created);
      values.clear();
      created = now;
      save();
    }
  }

  public synchronized Optional<String> get(String key) {
    return Optional.ofNullable(values.get(key));
  }

  /**
   * Returns the cached value for the key, computing and persisting it if absent.
   */
  public synchronized String lookup(String key, Supplier<String> compute) {
    String value = values.get(key);
    if (value == null) {
      value = compute.get();
      put(key, value);
    }
    return value;
  }

  public synchronized void put(String key, String value) {
    values.put(key, value);
    save();
  }

  public synchronized Instant created() {
    return created;
  }

  public Path file() {
    return file;
  }

  /**
   * Writes the cache through a temporary sibling file, which then replaces the cache file.
   */
  public synchronized void save() {
    ObjectNode root = MAPPER.createObjectNode();
    root.put(CREATED, created.getEpochSecond());
    ObjectNode valuesNode = root.putObject(VALUES);
    values.forEach(valuesNode::put);
    UncheckedIO.runUnchecked(() -> {
      Path dir = file.toAbsolutePath().getParent();
      Files.createDirectories(dir);
      Path temp = Files.createTempFile(dir, file.getFileName().toString(), ".tmp");
      MAPPER.writerWithDefaultPrettyPrinter().writeValue(temp.toFile(), root);
      Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    });
  }
}
