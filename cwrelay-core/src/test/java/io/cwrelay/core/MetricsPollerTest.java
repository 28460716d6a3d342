package io.cwrelay.core;

import io.cwrelay.core.model.Datapoint;
import io.cwrelay.core.model.MatchRule;
import io.cwrelay.core.model.MetricDescriptor;
import io.cwrelay.core.model.OutputRecord;
import io.cwrelay.core.model.StatKind;
import io.cwrelay.core.sink.MetricSink;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class MetricsPollerTest {

    private static final Instant NOW = Instant.parse("2024-03-01T12:00:00Z");
    private static final Clock CLOCK = Clock.fixed(NOW, ZoneOffset.UTC);

    /** Keeps the watermark in memory. */
    private static class MemoryWatermarkStore implements WatermarkStore {
        Instant watermark;
        int saves;

        MemoryWatermarkStore(Instant watermark) {
            this.watermark = watermark;
        }

        @Override
        public void saveWatermark(Instant watermark) {
            this.watermark = watermark;
            saves++;
        }
    }

    private static class CollectingSink implements MetricSink {
        final List<OutputRecord> records = new ArrayList<>();

        @Override
        public void send(OutputRecord record) {
            records.add(record);
        }

        @Override
        public void close() {
        }
    }

    private static MetricDescriptor ec2(String metric) {
        return new MetricDescriptor("AWS/EC2", metric, List.of());
    }

    private static List<Datapoint> value(double v) {
        return List.of(new Datapoint(NOW.minusSeconds(60), Map.of(StatKind.AVERAGE, v)));
    }

    private static MetricsPoller poller(InMemoryMetricsProvider provider, MemoryWatermarkStore store, int threads) {
        ConfigMatcher matcher = new ConfigMatcher(List.of(
                new MatchRule("aws\\.ec2\\..*", List.of(StatKind.AVERAGE), List.of(), OptionalInt.empty())));
        MetricTransformer transformer = new MetricTransformer(matcher, new SourceResolver(), provider, "", true);
        return new MetricsPoller(provider, transformer, new WindowManager(store), Retrier.none(), CLOCK, 5, threads);
    }

    private static InMemoryMetricsProvider threePages() {
        return new InMemoryMetricsProvider(List.of(
                List.of(ec2("A"), ec2("B")),
                List.of(ec2("C"), new MetricDescriptor("AWS/RDS", "Ignored", List.of())),
                List.of(ec2("D"))))
                .withDatapoints("A", value(1))
                .withDatapoints("B", value(2))
                .withDatapoints("C", value(3))
                .withDatapoints("D", value(4));
    }

    @Test
    @DisplayName("Should walk every page, emit in order and commit the window end")
    void pollsAllPages() {
        InMemoryMetricsProvider provider = threePages();
        MemoryWatermarkStore store = new MemoryWatermarkStore(NOW.minus(Duration.ofMinutes(10)));
        CollectingSink sink = new CollectingSink();

        PollSummary summary = poller(provider, store, 1).poll(store.watermark, sink);

        assertEquals(List.of(1.0, 2.0, 3.0, 4.0),
                sink.records.stream().map(OutputRecord::value).collect(Collectors.toList()));
        assertEquals(3, provider.listCalls.get());
        assertEquals(List.of("A", "B", "C", "D"), provider.statisticsRequests);
        assertEquals(NOW, store.watermark);
        assertEquals(1, store.saves);

        assertEquals(3, summary.pages());
        assertEquals(5, summary.descriptors());
        assertEquals(4, summary.matched());
        assertEquals(4, summary.records());
        assertEquals(NOW.minus(Duration.ofMinutes(10)), summary.window().start());
    }

    @Test
    @DisplayName("Failure on the second of three pages leaves the watermark untouched")
    void failureKeepsWatermark() {
        Instant before = NOW.minus(Duration.ofMinutes(10));
        InMemoryMetricsProvider provider = threePages().failingFor("C");
        MemoryWatermarkStore store = new MemoryWatermarkStore(before);
        CollectingSink sink = new CollectingSink();

        assertThrows(UpstreamException.class, () -> poller(provider, store, 1).poll(before, sink));

        assertEquals(before, store.watermark);
        assertEquals(0, store.saves);
        assertEquals(2, provider.listCalls.get(), "Third page must not be requested");
    }

    @Test
    @DisplayName("Sink failure leaves the watermark untouched")
    void sinkFailureKeepsWatermark() {
        MemoryWatermarkStore store = new MemoryWatermarkStore(null);
        MetricSink failing = new CollectingSink() {
            @Override
            public void send(OutputRecord record) {
                throw new SinkException("connection reset", null);
            }
        };

        assertThrows(SinkException.class, () -> poller(threePages(), store, 1).poll(null, failing));

        assertNull(store.watermark);
    }

    @Test
    @DisplayName("First run without watermark uses the default delay")
    void firstRun() {
        MemoryWatermarkStore store = new MemoryWatermarkStore(null);

        PollSummary summary = poller(threePages(), store, 1).poll(null, new CollectingSink());

        assertEquals(NOW.minus(Duration.ofMinutes(5)), summary.window().start());
        assertEquals(NOW, store.watermark);
    }

    @Test
    @DisplayName("Parallel fetching keeps emission order")
    void parallelFetchKeepsOrder() {
        List<MetricDescriptor> page = new ArrayList<>();
        InMemoryMetricsProvider provider = new InMemoryMetricsProvider(List.of(page));
        for (int i = 0; i < 50; i++) {
            page.add(ec2("M" + i));
            provider.withDatapoints("M" + i, value(i));
        }
        MemoryWatermarkStore store = new MemoryWatermarkStore(null);
        CollectingSink sink = new CollectingSink();

        poller(provider, store, 8).poll(null, sink);

        List<Double> expected = new ArrayList<>();
        for (int i = 0; i < 50; i++) {
            expected.add((double) i);
        }
        assertEquals(expected, sink.records.stream().map(OutputRecord::value).collect(Collectors.toList()));
        assertEquals(NOW, store.watermark);
    }

    @Test
    @DisplayName("Parallel fetch failure leaves the watermark untouched")
    void parallelFetchFailure() {
        Instant before = NOW.minus(Duration.ofMinutes(3));
        MemoryWatermarkStore store = new MemoryWatermarkStore(before);

        assertThrows(UpstreamException.class,
                () -> poller(threePages().failingFor("B"), store, 4).poll(before, new CollectingSink()));

        assertEquals(before, store.watermark);
    }
}
