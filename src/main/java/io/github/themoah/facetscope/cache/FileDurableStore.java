package io.github.themoah.facetscope.cache;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.HashSet;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Durable store keeping one {@code <key>.json} file per entry in a directory.
 * Keys must be usable as file names.
 */
public class FileDurableStore implements DurableStore {

  private static final Logger log = LoggerFactory.getLogger(FileDurableStore.class);
  private static final String SUFFIX = ".json";

  private final Path directory;

  public FileDurableStore(Path directory) {
    this.directory = directory;
    try {
      Files.createDirectories(directory);
    } catch (IOException e) {
      throw new UncheckedIOException("Cannot create cache directory: " + directory, e);
    }
    log.info("Using file-backed investigation cache at {}", directory);
  }

  @Override
  public Optional<String> get(String key) {
    try {
      return Optional.of(Files.readString(pathOf(key), StandardCharsets.UTF_8));
    } catch (NoSuchFileException e) {
      return Optional.empty();
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to read cache entry " + key, e);
    }
  }

  @Override
  public void set(String key, String value) {
    Path target = pathOf(key);
    Path tmp = directory.resolve(key + SUFFIX + ".tmp");
    try {
      Files.writeString(tmp, value, StandardCharsets.UTF_8);
      Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to write cache entry " + key, e);
    }
  }

  @Override
  public Set<String> keys() {
    Set<String> keys = new HashSet<>();
    try (Stream<Path> files = Files.list(directory)) {
      files.map(p -> p.getFileName().toString())
        .filter(name -> name.endsWith(SUFFIX))
        .forEach(name -> keys.add(name.substring(0, name.length() - SUFFIX.length())));
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to list cache directory " + directory, e);
    }
    return keys;
  }

  @Override
  public void remove(String key) {
    try {
      Files.deleteIfExists(pathOf(key));
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to remove cache entry " + key, e);
    }
  }

  private Path pathOf(String key) {
    return directory.resolve(key + SUFFIX);
  }
}
