package org.waabox.radarkeep.catalog;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A {@link CatalogLoader} that reads radar editions from JSON files on the
 * local filesystem.
 *
 * <p>The snapshot directory holds an index plus one file per edition:
 * <pre>
 * {dir}/
 *   index.json                    [ { "filename": "Volume 33 (Nov 2025).json" }, ... ]
 *   Volume 33 (Nov 2025).json     [ { "name", "ring", "quadrant", "description" }, ... ]
 * </pre>
 *
 * <p>Files listed in the index but missing on disk, unreadable edition
 * files and entries with an unknown ring or quadrant are skipped and
 * logged. Only a missing or unreadable index makes the whole source
 * unavailable.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class JsonCatalogLoader implements CatalogLoader {

  /** The class logger. */
  private static final Logger log =
      LoggerFactory.getLogger(JsonCatalogLoader.class);

  /** The name of the index file within the snapshot directory. */
  static final String INDEX_FILE = "index.json";

  /** The "Volume N (date)" fragment of an edition file name. */
  private static final Pattern VOLUME_LABEL =
      Pattern.compile("Volume (\\d+) \\(([^)]+)\\)");

  /** The JSON file extension, stripped from fallback labels. */
  private static final String JSON_EXTENSION = ".json";

  /** The directory holding the index and the edition files. */
  private final Path directory;

  /** The Jackson object mapper used to read every file. */
  private final ObjectMapper mapper;

  /**
   * Creates a new JsonCatalogLoader reading from the given directory.
   *
   * @param theDirectory the snapshot directory, never null
   *
   * @throws NullPointerException if theDirectory is null
   */
  public JsonCatalogLoader(final Path theDirectory) {
    directory = Objects.requireNonNull(theDirectory,
        "directory must not be null");
    mapper = new ObjectMapper();
  }

  /**
   * Returns whether the index file exists.
   *
   * @return {@code true} if the snapshot source has been provisioned
   */
  public boolean isAvailable() {
    return Files.isRegularFile(directory.resolve(INDEX_FILE));
  }

  /**
   * Returns the directory this loader reads from.
   *
   * @return the snapshot directory, never null
   */
  public Path directory() {
    return directory;
  }

  /**
   * {@inheritDoc}
   *
   * @throws CatalogNotAvailableException if the index file is missing or
   *                                      is not a JSON array
   */
  @Override
  public RadarCatalog load() {
    final Path indexFile = directory.resolve(INDEX_FILE);
    if (!Files.isRegularFile(indexFile)) {
      throw new CatalogNotAvailableException(indexFile.toString());
    }

    final JsonNode index;
    try {
      index = mapper.readTree(indexFile.toFile());
    } catch (final IOException e) {
      throw new CatalogNotAvailableException(indexFile.toString(), e);
    }
    if (index == null || !index.isArray()) {
      throw new CatalogNotAvailableException(indexFile
          + " (index is not a JSON array)");
    }

    final List<Edition> editions = new ArrayList<>();
    for (final JsonNode indexEntry : index) {
      final String filename = indexEntry.path("filename").asText("");
      if (filename.isEmpty()) {
        log.warn("Skipping index entry without a filename in {}", indexFile);
        continue;
      }
      readEdition(filename).ifPresent(editions::add);
    }

    final RadarCatalog catalog = RadarCatalog.of(editions);
    log.info("Loaded {} radar edition(s) with {} entries from {}",
        catalog.editions().size(), catalog.entryCount(), directory);
    return catalog;
  }

  /**
   * Reads one edition file.
   *
   * @param filename the file name as listed in the index, never null
   *
   * @return the edition, or empty if the file is missing or unreadable
   */
  private Optional<Edition> readEdition(final String filename) {
    final Path file = directory.resolve(filename);
    if (!Files.isRegularFile(file)) {
      log.warn("Radar edition file {} listed in the index is missing", file);
      return Optional.empty();
    }

    final JsonNode blips;
    try {
      blips = mapper.readTree(file.toFile());
    } catch (final IOException e) {
      log.warn("Skipping unreadable radar edition {}: {}", file,
          e.getMessage());
      return Optional.empty();
    }
    if (blips == null || !blips.isArray()) {
      log.warn("Skipping radar edition {}: not a JSON array", file);
      return Optional.empty();
    }

    final String label = labelOf(filename);
    final List<CatalogEntry> entries = new ArrayList<>(blips.size());
    for (final JsonNode blip : blips) {
      toEntry(blip, label).ifPresent(entries::add);
    }
    return Optional.of(Edition.of(label, entries));
  }

  /**
   * Converts one JSON blip into a catalog entry.
   *
   * @param blip  the JSON object, never null
   * @param label the edition label, never null
   *
   * @return the entry, or empty if the blip has no name or carries an
   *         unknown ring or quadrant
   */
  private Optional<CatalogEntry> toEntry(final JsonNode blip,
      final String label) {
    final String name = blip.path("name").asText("");
    if (name.isBlank()) {
      log.warn("Skipping unnamed blip in {}", label);
      return Optional.empty();
    }
    try {
      return Optional.of(new CatalogEntry(
          name,
          Ring.fromLabel(blip.path("ring").asText("")),
          Quadrant.fromLabel(blip.path("quadrant").asText("")),
          blip.path("description").asText(""),
          label));
    } catch (final IllegalArgumentException e) {
      log.warn("Skipping blip '{}' in {}: {}", name, label, e.getMessage());
      return Optional.empty();
    }
  }

  /**
   * Derives the display label of an edition from its file name.
   *
   * <p>"Tech Radar Volume 33 (Nov 2025).json" yields
   * "Volume 33 (Nov 2025)"; a name without that fragment yields the name
   * without its extension.
   *
   * @param filename the edition file name, never null
   *
   * @return the label, never null
   */
  static String labelOf(final String filename) {
    final Matcher matcher = VOLUME_LABEL.matcher(filename);
    if (matcher.find()) {
      return "Volume " + matcher.group(1) + " (" + matcher.group(2) + ")";
    }
    if (filename.endsWith(JSON_EXTENSION)) {
      return filename.substring(0,
          filename.length() - JSON_EXTENSION.length());
    }
    return filename;
  }
}
