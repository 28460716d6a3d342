package io.cwrelay.core.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.cwrelay.core.ConfigurationException;
import io.cwrelay.core.WatermarkStore;
import io.cwrelay.core.model.MatchRule;
import io.cwrelay.core.model.SourceDirective;
import io.cwrelay.core.model.StatKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.PosixFileAttributeView;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;
import java.util.Set;
import java.util.regex.PatternSyntaxException;

/**
 * JSON rule file holding the metric rules and the watermark of the last successful run.
 *
 * Example:
 * <pre>
 * {
 *   "metrics": {
 *     "aws\\.ec2\\..*": { "stats": ["Average", "Maximum"], "priority": 1 },
 *     "aws\\.elb\\..*": { "stats": ["Sum"], "source_names": ["LoadBalancerName", 0, "=elb"] }
 *   },
 *   "lastRunTimestamp": 1700000000
 * }
 * </pre>
 * In {@code source_names} a number selects a dimension by position, a string starting
 * with '=' is a literal and any other string names a point tag.
 */
public class RuleStore implements WatermarkStore {

    private static final Logger log = LoggerFactory.getLogger(RuleStore.class);

    static final String METRICS = "metrics";
    static final String LAST_RUN = "lastRunTimestamp";
    static final String LEGACY_LAST_RUN = "last_run_timestamp";
    static final String STATS = "stats";
    static final String SOURCE_NAMES = "source_names";
    static final String PRIORITY = "priority";

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final Path path;

    public RuleStore(Path path) {
        this.path = path;
    }

    /**
     * Reads and validates the rule file.
     *
     * @throws ConfigurationException when the file is missing or invalid
     */
    public StoredRules load() {
        ObjectNode root = readRoot();
        JsonNode metrics = root.get(METRICS);
        if (metrics == null || !metrics.isObject()) {
            throw new ConfigurationException("Configuration file (" + path + ") is not valid: missing '" + METRICS + "'");
        }

        List<MatchRule> rules = new ArrayList<>();
        Iterator<Map.Entry<String, JsonNode>> fields = metrics.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> entry = fields.next();
            rules.add(parseRule(entry.getKey(), entry.getValue()));
        }

        Instant watermark = readWatermark(root);
        log.info("Loaded {} metric rules from {} (last run: {})", rules.size(), path,
                watermark == null ? "never" : watermark);
        return new StoredRules(rules, watermark);
    }

    /**
     * Rewrites the file with the new watermark in epoch seconds. Everything else in the
     * document is kept. The new content goes to a temporary file in the same directory
     * which then replaces the original.
     */
    @Override
    public void saveWatermark(Instant watermark) {
        ObjectNode root = readRoot();
        root.remove(LEGACY_LAST_RUN);
        root.put(LAST_RUN, watermark.getEpochSecond());
        writeAtomically(root);
        log.info("Saved last run timestamp {} to {}", watermark.getEpochSecond(), path);
    }

    private ObjectNode readRoot() {
        if (!Files.exists(path)) {
            throw new ConfigurationException("Configuration file (" + path + ") does not exist");
        }
        JsonNode node;
        try {
            node = MAPPER.readTree(path.toFile());
        } catch (IOException e) {
            throw new ConfigurationException("Configuration file (" + path + ") cannot be read: " + e.getMessage(), e);
        }
        if (node == null || !node.isObject()) {
            throw new ConfigurationException("Configuration file (" + path + ") is not a JSON object");
        }
        return (ObjectNode) node;
    }

    private void writeAtomically(ObjectNode root) {
        Path dir = path.toAbsolutePath().getParent();
        Path tmp = null;
        try {
            tmp = Files.createTempFile(dir, path.getFileName().toString(), ".tmp");
            MAPPER.writerWithDefaultPrettyPrinter().writeValue(tmp.toFile(), root);
            copyPermissions(path, tmp);
            try {
                Files.move(tmp, path, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            deleteIfPresent(tmp);
            throw new UncheckedIOException("Failed to write " + path, e);
        }
    }

    // Temp files are created owner-only; the replaced file keeps the mode it had
    private static void copyPermissions(Path source, Path target) throws IOException {
        if (Files.exists(source) && Files.getFileAttributeView(source, PosixFileAttributeView.class) != null) {
            Files.setPosixFilePermissions(target, Files.getPosixFilePermissions(source));
        }
    }

    private static void deleteIfPresent(Path tmp) {
        if (tmp == null) {
            return;
        }
        try {
            Files.deleteIfExists(tmp);
        } catch (IOException e) {
            log.warn("Could not delete temporary file {}: {}", tmp, e.getMessage());
        }
    }

    private Instant readWatermark(ObjectNode root) {
        JsonNode node = root.hasNonNull(LAST_RUN) ? root.get(LAST_RUN) : root.get(LEGACY_LAST_RUN);
        if (node == null || node.isNull()) {
            return null;
        }
        if (!node.isNumber()) {
            throw new ConfigurationException("Configuration file (" + path + ") has a non numeric " + LAST_RUN);
        }
        return Instant.ofEpochSecond(node.asLong());
    }

    static MatchRule parseRule(String pattern, JsonNode node) {
        if (node == null || !node.isObject()) {
            throw new ConfigurationException("Rule '" + pattern + "' must be an object");
        }

        Set<StatKind> stats = new LinkedHashSet<>();
        JsonNode statsNode = node.get(STATS);
        if (statsNode != null && !statsNode.isNull()) {
            if (!statsNode.isArray()) {
                throw new ConfigurationException("Rule '" + pattern + "': '" + STATS + "' must be an array");
            }
            for (JsonNode s : statsNode) {
                String name = s.asText();
                stats.add(StatKind.fromUpstreamName(name).orElseThrow(() ->
                        new ConfigurationException("Rule '" + pattern + "': unknown statistic '" + name + "'")));
            }
        }

        List<SourceDirective> directives = new ArrayList<>();
        JsonNode sourceNode = node.get(SOURCE_NAMES);
        if (sourceNode != null && !sourceNode.isNull()) {
            if (!sourceNode.isArray()) {
                throw new ConfigurationException("Rule '" + pattern + "': '" + SOURCE_NAMES + "' must be an array");
            }
            for (JsonNode d : sourceNode) {
                directives.add(parseDirective(pattern, d));
            }
        }

        OptionalInt priority = OptionalInt.empty();
        JsonNode priorityNode = node.get(PRIORITY);
        if (priorityNode != null && !priorityNode.isNull()) {
            if (!priorityNode.isNumber()) {
                throw new ConfigurationException("Rule '" + pattern + "': '" + PRIORITY + "' must be a number");
            }
            priority = OptionalInt.of(priorityNode.asInt());
        }

        try {
            return new MatchRule(pattern, new ArrayList<>(stats), directives, priority);
        } catch (PatternSyntaxException e) {
            throw new ConfigurationException("Rule '" + pattern + "' is not a valid regular expression", e);
        }
    }

    static SourceDirective parseDirective(String pattern, JsonNode node) {
        if (node.isIntegralNumber()) {
            return new SourceDirective.DimensionIndex(node.asInt());
        }
        if (node.isTextual()) {
            String text = node.asText();
            if (text.startsWith("=")) {
                return new SourceDirective.Literal(text.substring(1));
            }
            return new SourceDirective.TagName(text);
        }
        throw new ConfigurationException("Rule '" + pattern + "': unsupported source name " + node);
    }
}
