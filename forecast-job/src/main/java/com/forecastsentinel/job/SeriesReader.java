package com.forecastsentinel.job;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.forecastsentinel.core.model.Series;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Reads a {@link SeriesDocument} from JSON into a {@link Series}.
 *
 * <p>
 * {@link #readAll(Path)} also accepts a batch of named series, one per data
 * source of the monitored host:
 * </p>
 *
 * <pre>
 * {"series": [{"name": "cpu", "step": "PT1H", "points": [...]},
 *             {"name": "mem", "step": "PT1H", "points": [...]}]}
 * </pre>
 *
 * <p>
 * Unlike a streaming consumer, a batch run has exactly one input: a
 * malformed document is an error, not a record to skip.
 * </p>
 */
public class SeriesReader {

    private static final Logger LOG = LoggerFactory.getLogger(SeriesReader.class);

    /** Name given to an unnamed single series read from a stream. */
    public static final String DEFAULT_NAME = "series";

    private static final String BATCH_FIELD = "series";

    private final ObjectMapper mapper;

    public SeriesReader() {
        mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    /**
     * @param path JSON file; must not be {@code null}
     * @return the parsed series, gaps included
     * @throws IllegalArgumentException if the file does not exist or the
     *                                  document is invalid
     * @throws IllegalStateException    if the file cannot be read
     */
    public Series read(Path path) {
        Objects.requireNonNull(path, "Series path must not be null");
        try (InputStream is = Files.newInputStream(path)) {
            Series series = read(is);
            LOG.info("Read {} points ({} known) from {}", series.size(), series.knownCount(), path);
            return series;
        } catch (NoSuchFileException e) {
            throw new IllegalArgumentException("Series file not found: " + path, e);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read series file: " + path, e);
        }
    }

    /**
     * @param is JSON stream; not closed by this method
     * @return the parsed series, gaps included
     * @throws IllegalArgumentException if the document is invalid
     * @throws IOException              if the stream cannot be read
     */
    public Series read(InputStream is) throws IOException {
        SeriesDocument document;
        try {
            document = mapper.readValue(is, SeriesDocument.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Malformed series document: " + e.getOriginalMessage(), e);
        }
        if (document == null) {
            throw new IllegalArgumentException("Series document is empty");
        }
        return document.toSeries();
    }

    /**
     * Read either a single series document or a batch document.
     *
     * @param path JSON file; must not be {@code null}
     * @return the series by name, in document order; an unnamed single
     *         series is named after the file
     * @throws IllegalArgumentException if the file does not exist or the
     *                                  document is invalid
     * @throws IllegalStateException    if the file cannot be read
     */
    public Map<String, Series> readAll(Path path) {
        Objects.requireNonNull(path, "Series path must not be null");
        try (InputStream is = Files.newInputStream(path)) {
            Map<String, Series> all = readAll(is, baseName(path));
            LOG.info("Read {} series from {}: {}", all.size(), path, all.keySet());
            return all;
        } catch (NoSuchFileException e) {
            throw new IllegalArgumentException("Series file not found: " + path, e);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read series file: " + path, e);
        }
    }

    /**
     * @param is          JSON stream; not closed by this method
     * @param defaultName name of a single series that carries none
     * @return the series by name, in document order
     * @throws IllegalArgumentException if the document is invalid, or a batch
     *                                  entry is unnamed or reuses a name
     * @throws IOException              if the stream cannot be read
     */
    public Map<String, Series> readAll(InputStream is, String defaultName) throws IOException {
        JsonNode root;
        try {
            root = mapper.readTree(is);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Malformed series document: " + e.getOriginalMessage(), e);
        }
        if (root == null || root.isMissingNode() || root.isNull()) {
            throw new IllegalArgumentException("Series document is empty");
        }

        Map<String, Series> all = new LinkedHashMap<>();
        JsonNode batch = root.get(BATCH_FIELD);
        if (batch == null) {
            SeriesDocument document = bind(root);
            all.put(document.getName() != null ? document.getName() : defaultName, document.toSeries());
            return all;
        }
        if (!batch.isArray() || batch.isEmpty()) {
            throw new IllegalArgumentException("'" + BATCH_FIELD + "' must be a non-empty array");
        }
        for (int i = 0; i < batch.size(); i++) {
            SeriesDocument document = bind(batch.get(i));
            String name = document.getName();
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("Series #" + i + " in the batch has no 'name'");
            }
            if (all.containsKey(name)) {
                throw new IllegalArgumentException("Series name '" + name + "' appears more than once");
            }
            try {
                all.put(name, document.toSeries());
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("Series '" + name + "': " + e.getMessage(), e);
            }
        }
        return all;
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private SeriesDocument bind(JsonNode node) {
        try {
            return mapper.treeToValue(node, SeriesDocument.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Malformed series document: " + e.getOriginalMessage(), e);
        }
    }

    private static String baseName(Path path) {
        String file = path.getFileName().toString();
        int dot = file.lastIndexOf('.');
        return dot > 0 ? file.substring(0, dot) : file;
    }
}
