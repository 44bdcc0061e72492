package com.grantradar.catalog.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.grantradar.catalog.model.Opportunity;
import com.grantradar.catalog.normalize.OpportunityNormalizer;
import com.grantradar.config.RadarProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Reads and writes the flat catalog file. A {@code .jsonl} path holds one JSON object per line;
 * any other path holds a single JSON array.
 */
@Component
public class CatalogStore {
    private static final Logger log = LoggerFactory.getLogger(CatalogStore.class);

    private final ObjectMapper objectMapper;
    private final OpportunityNormalizer normalizer;
    private final RadarProperties properties;

    public CatalogStore(ObjectMapper objectMapper, OpportunityNormalizer normalizer, RadarProperties properties) {
        this.objectMapper = objectMapper;
        this.normalizer = normalizer;
        this.properties = properties;
    }

    /**
     * The configured data file when set, otherwise the first existing default candidate.
     */
    public Optional<Path> locateDataFile() {
        String configured = properties.getData().getPath();
        if (configured != null && !configured.isBlank()) {
            return Optional.of(Path.of(configured.trim()));
        }
        for (String candidate : properties.getData().getCandidates()) {
            if (candidate == null || candidate.isBlank()) {
                continue;
            }
            Path path = Path.of(candidate.trim());
            if (Files.exists(path)) {
                return Optional.of(path);
            }
        }
        return Optional.empty();
    }

    public List<Opportunity> load(Path path) {
        List<ObjectNode> raw = readRaw(path);
        List<Opportunity> out = new ArrayList<>(raw.size());
        for (ObjectNode node : raw) {
            out.add(normalizer.normalize(node));
        }
        log.info("Loaded {} records from {}", out.size(), path);
        return out;
    }

    public List<ObjectNode> readRaw(Path path) {
        if (path == null || !Files.isRegularFile(path)) {
            throw new CatalogLoadException(path, "Catalog file not found: " + path);
        }
        String content;
        try {
            content = Files.readString(path, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new CatalogLoadException(path, "Failed to read " + path + ": " + e.getMessage(), e);
        }
        return isJsonLines(path) ? parseLines(path, content) : parseArray(path, content);
    }

    public void write(Path path, List<Opportunity> rows) {
        try {
            String payload;
            if (isJsonLines(path)) {
                List<String> lines = new ArrayList<>(rows.size());
                for (Opportunity row : rows) {
                    lines.add(objectMapper.writeValueAsString(toJson(row)));
                }
                payload = String.join("\n", lines);
            } else {
                ArrayNode array = objectMapper.createArrayNode();
                rows.forEach(row -> array.add(toJson(row)));
                payload = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(array);
            }
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(path, payload, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new CatalogWriteException(path, "Failed to write " + path + ": " + e.getMessage(), e);
        }
        log.info("Wrote {} records to {}", rows.size(), path);
    }

    /**
     * Storage form of a record: the known attributes in their canonical order followed by any
     * pass-through keys. Derived attributes are not written.
     */
    public ObjectNode toJson(Opportunity row) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put("id", row.id());
        node.put("source", row.source());
        node.put("type", row.type());
        node.put("url", row.url());
        node.put("title", row.title());
        node.put("description", row.description());
        node.put("agency", row.agency());
        node.put("jurisdiction", row.jurisdiction());
        node.put("lga", row.lga());
        ArrayNode audience = node.putArray("audience");
        row.audience().forEach(audience::add);
        ArrayNode discipline = node.putArray("discipline");
        row.discipline().forEach(discipline::add);
        node.put("open_date", row.openDate());
        node.put("close_date", row.closeDate());
        node.put("status", row.status());
        putAmount(node, "amount_min", row.amountMin());
        putAmount(node, "amount_max", row.amountMax());
        node.put("last_seen", row.lastSeen());
        row.extras().forEach(node::set);
        return node;
    }

    public static boolean isJsonLines(Path path) {
        Path fileName = path.getFileName();
        return fileName != null && fileName.toString().toLowerCase(Locale.ROOT).endsWith(".jsonl");
    }

    private List<ObjectNode> parseLines(Path path, String content) {
        List<ObjectNode> out = new ArrayList<>();
        String[] lines = content.split("\\R");
        for (int i = 0; i < lines.length; i++) {
            String line = lines[i];
            if (line.isBlank()) {
                continue;
            }
            JsonNode node;
            try {
                node = objectMapper.readTree(line);
            } catch (JsonProcessingException e) {
                throw new CatalogLoadException(path, "Invalid JSON on line " + (i + 1) + " of " + path, e);
            }
            out.add(requireObject(path, node, "line " + (i + 1)));
        }
        return out;
    }

    private List<ObjectNode> parseArray(Path path, String content) {
        JsonNode root;
        try {
            root = objectMapper.readTree(content);
        } catch (JsonProcessingException e) {
            throw new CatalogLoadException(path, "Invalid JSON in " + path, e);
        }
        if (root == null || root.isMissingNode() || !root.isArray()) {
            throw new CatalogLoadException(path, "Expected a JSON array of listings in " + path);
        }
        List<ObjectNode> out = new ArrayList<>(root.size());
        for (int i = 0; i < root.size(); i++) {
            out.add(requireObject(path, root.get(i), "element " + i));
        }
        return out;
    }

    private ObjectNode requireObject(Path path, JsonNode node, String position) {
        if (node == null || !node.isObject()) {
            throw new CatalogLoadException(path, "Listing at " + position + " of " + path + " is not a JSON object");
        }
        return (ObjectNode) node;
    }

    private void putAmount(ObjectNode node, String field, Double value) {
        if (value == null) {
            node.putNull(field);
        } else if (value == Math.rint(value) && !Double.isInfinite(value) && Math.abs(value) < 1e15) {
            node.put(field, value.longValue());
        } else {
            node.put(field, value);
        }
    }
}
