package io.cwrelay.core.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.cwrelay.core.ConfigurationException;
import io.cwrelay.core.model.MatchRule;
import io.cwrelay.core.model.SourceDirective;
import io.cwrelay.core.model.StatKind;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFileAttributeView;
import java.nio.file.attribute.PosixFilePermissions;
import java.time.Instant;
import java.util.List;
import java.util.OptionalInt;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

class RuleStoreTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @TempDir
    Path tempDir;

    private Path write(String json) throws Exception {
        Path file = tempDir.resolve("aws-metrics.json.conf");
        Files.writeString(file, json);
        return file;
    }

    @Test
    @DisplayName("Should load rules in file order with stats, directives and priority")
    void loadRules() throws Exception {
        Path file = write("""
                {
                  "metrics": {
                    "aws\\\\.elb\\\\..*": {
                      "stats": ["Sum", "SampleCount", "Sum"],
                      "source_names": ["LoadBalancerName", 1, "=elb"]
                    },
                    "aws\\\\.ec2\\\\..*": { "stats": ["Average"], "priority": 3 }
                  },
                  "lastRunTimestamp": 1709294400
                }
                """);

        StoredRules stored = new RuleStore(file).load();

        assertEquals(2, stored.rules().size());
        MatchRule elb = stored.rules().get(0);
        assertEquals("aws\\.elb\\..*", elb.pattern());
        assertEquals(List.of(StatKind.SUM, StatKind.SAMPLE_COUNT), elb.stats());
        assertEquals(List.of(
                new SourceDirective.TagName("LoadBalancerName"),
                new SourceDirective.DimensionIndex(1),
                new SourceDirective.Literal("elb")), elb.sourceDirectives());
        assertEquals(OptionalInt.empty(), elb.priority());

        MatchRule ec2 = stored.rules().get(1);
        assertEquals(OptionalInt.of(3), ec2.priority());
        assertTrue(ec2.sourceDirectives().isEmpty());

        assertEquals(Instant.ofEpochSecond(1709294400), stored.watermark());
    }

    @Test
    @DisplayName("Missing timestamp means first run")
    void noWatermark() throws Exception {
        Path file = write("{\"metrics\": {}}");

        assertNull(new RuleStore(file).load().watermark());
    }

    @Test
    @DisplayName("Should read the legacy timestamp key")
    void legacyWatermark() throws Exception {
        Path file = write("{\"metrics\": {}, \"last_run_timestamp\": 1700000000}");

        assertEquals(Instant.ofEpochSecond(1700000000), new RuleStore(file).load().watermark());
    }

    @Test
    @DisplayName("Missing file is a configuration error")
    void missingFile() {
        RuleStore store = new RuleStore(tempDir.resolve("absent.json"));

        ConfigurationException e = assertThrows(ConfigurationException.class, store::load);
        assertTrue(e.getMessage().contains("does not exist"));
    }

    @Test
    @DisplayName("File without metrics is a configuration error")
    void missingMetrics() throws Exception {
        Path file = write("{\"lastRunTimestamp\": 1}");

        assertThrows(ConfigurationException.class, () -> new RuleStore(file).load());
    }

    @Test
    @DisplayName("Malformed JSON is a configuration error")
    void malformed() throws Exception {
        Path file = write("{\"metrics\": ");

        assertThrows(ConfigurationException.class, () -> new RuleStore(file).load());
    }

    @Test
    @DisplayName("Unknown statistic is a configuration error")
    void unknownStat() throws Exception {
        Path file = write("{\"metrics\": {\"aws\\\\..*\": {\"stats\": [\"p99\"]}}}");

        ConfigurationException e = assertThrows(ConfigurationException.class, () -> new RuleStore(file).load());
        assertTrue(e.getMessage().contains("p99"));
    }

    @Test
    @DisplayName("Invalid regular expression is a configuration error")
    void invalidPattern() throws Exception {
        Path file = write("{\"metrics\": {\"aws(\": {\"stats\": [\"Sum\"]}}}");

        assertThrows(ConfigurationException.class, () -> new RuleStore(file).load());
    }

    @Test
    @DisplayName("Saving the watermark keeps every other field")
    void saveWatermarkPreservesDocument() throws Exception {
        Path file = write("""
                {
                  "metrics": { "aws\\\\.ec2\\\\..*": { "stats": ["Average"], "priority": 1 } },
                  "owner": "ops",
                  "last_run_timestamp": 1
                }
                """);
        RuleStore store = new RuleStore(file);

        store.saveWatermark(Instant.ofEpochSecond(1709294400));

        JsonNode root = MAPPER.readTree(file.toFile());
        assertEquals(1709294400L, root.get("lastRunTimestamp").asLong());
        assertEquals("ops", root.get("owner").asText());
        assertFalse(root.has("last_run_timestamp"));
        assertEquals("Average", root.get("metrics").get("aws\\.ec2\\..*").get("stats").get(0).asText());
        assertEquals(Instant.ofEpochSecond(1709294400), store.load().watermark());

        try (Stream<Path> files = Files.list(tempDir)) {
            assertEquals(List.of(file.getFileName().toString()),
                    files.map(p -> p.getFileName().toString()).collect(Collectors.toList()),
                    "No temporary file may be left behind");
        }
    }

    @Test
    @DisplayName("Saving the watermark keeps the file permissions")
    void saveWatermarkKeepsPermissions() throws Exception {
        Path file = write("{ \"metrics\": {} }");
        assumeTrue(Files.getFileAttributeView(file, PosixFileAttributeView.class) != null);
        Files.setPosixFilePermissions(file, PosixFilePermissions.fromString("rw-r--r--"));

        new RuleStore(file).saveWatermark(Instant.ofEpochSecond(1709294400));

        assertEquals("rw-r--r--", PosixFilePermissions.toString(Files.getPosixFilePermissions(file)));
    }

    @Test
    @DisplayName("Saving into a missing file is a configuration error")
    void saveWithoutFile() {
        RuleStore store = new RuleStore(tempDir.resolve("absent.json"));

        assertThrows(ConfigurationException.class, () -> store.saveWatermark(Instant.EPOCH));
    }
}
