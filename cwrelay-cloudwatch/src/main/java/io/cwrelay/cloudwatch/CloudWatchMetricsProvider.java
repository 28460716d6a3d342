package io.cwrelay.cloudwatch;

import io.cwrelay.core.UpstreamException;
import io.cwrelay.core.model.Datapoint;
import io.cwrelay.core.model.MetricDescriptor;
import io.cwrelay.core.model.StatKind;
import io.cwrelay.core.provider.DescriptorPage;
import io.cwrelay.core.provider.MetricsProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.cloudwatch.CloudWatchClient;
import software.amazon.awssdk.services.cloudwatch.CloudWatchClientBuilder;
import software.amazon.awssdk.services.cloudwatch.model.Dimension;
import software.amazon.awssdk.services.cloudwatch.model.GetMetricStatisticsRequest;
import software.amazon.awssdk.services.cloudwatch.model.GetMetricStatisticsResponse;
import software.amazon.awssdk.services.cloudwatch.model.ListMetricsRequest;
import software.amazon.awssdk.services.cloudwatch.model.ListMetricsResponse;
import software.amazon.awssdk.services.cloudwatch.model.Metric;
import software.amazon.awssdk.services.cloudwatch.model.Statistic;

import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * {@link MetricsProvider} backed by the CloudWatch ListMetrics and GetMetricStatistics APIs.
 * Credentials come from the SDK default provider chain.
 */
public class CloudWatchMetricsProvider implements MetricsProvider {

    private static final Logger log = LoggerFactory.getLogger(CloudWatchMetricsProvider.class);

    private final CloudWatchClient client;

    public CloudWatchMetricsProvider(CloudWatchClient client) {
        this.client = client;
    }

    /**
     * Creates a client for {@code region}, or for the SDK default region when it is null or empty.
     */
    public static CloudWatchMetricsProvider create(String region) {
        CloudWatchClientBuilder builder = CloudWatchClient.builder();
        if (region != null && !region.isEmpty()) {
            builder.region(Region.of(region));
        }
        return new CloudWatchMetricsProvider(builder.build());
    }

    @Override
    public DescriptorPage listDescriptors(String nextToken) {
        ListMetricsRequest request = ListMetricsRequest.builder()
                .nextToken(nextToken)
                .build();
        ListMetricsResponse response;
        try {
            response = client.listMetrics(request);
        } catch (SdkException e) {
            throw new UpstreamException("ListMetrics failed: " + e.getMessage(), e);
        }

        List<MetricDescriptor> descriptors = new ArrayList<>(response.metrics().size());
        for (Metric metric : response.metrics()) {
            descriptors.add(toDescriptor(metric));
        }
        String token = response.nextToken();
        log.debug("ListMetrics returned {} metrics, more={}", descriptors.size(), token != null);
        return new DescriptorPage(descriptors, token == null || token.isEmpty() ? null : token);
    }

    @Override
    public List<Datapoint> getStatistics(MetricDescriptor descriptor, Instant start, Instant end,
                                         int periodSeconds, List<StatKind> stats) {
        List<Statistic> statistics = new ArrayList<>(stats.size());
        for (StatKind kind : stats) {
            statistics.add(Statistic.fromValue(kind.upstreamName()));
        }
        List<Dimension> dimensions = new ArrayList<>(descriptor.dimensions().size());
        for (MetricDescriptor.Dimension d : descriptor.dimensions()) {
            dimensions.add(Dimension.builder().name(d.name()).value(d.value()).build());
        }

        GetMetricStatisticsRequest request = GetMetricStatisticsRequest.builder()
                .namespace(descriptor.namespace())
                .metricName(descriptor.metricName())
                .dimensions(dimensions)
                .startTime(start)
                .endTime(end)
                .period(periodSeconds)
                .statistics(statistics)
                .build();
        GetMetricStatisticsResponse response;
        try {
            response = client.getMetricStatistics(request);
        } catch (SdkException e) {
            throw new UpstreamException("GetMetricStatistics failed for "
                    + descriptor.namespace() + "/" + descriptor.metricName() + ": " + e.getMessage(), e);
        }

        List<Datapoint> datapoints = new ArrayList<>(response.datapoints().size());
        for (software.amazon.awssdk.services.cloudwatch.model.Datapoint dp : response.datapoints()) {
            datapoints.add(toDatapoint(dp));
        }
        return datapoints;
    }

    static MetricDescriptor toDescriptor(Metric metric) {
        List<MetricDescriptor.Dimension> dimensions = new ArrayList<>(metric.dimensions().size());
        for (Dimension d : metric.dimensions()) {
            dimensions.add(new MetricDescriptor.Dimension(d.name(), d.value()));
        }
        return new MetricDescriptor(metric.namespace(), metric.metricName(), dimensions);
    }

    static Datapoint toDatapoint(software.amazon.awssdk.services.cloudwatch.model.Datapoint dp) {
        Map<StatKind, Double> values = new EnumMap<>(StatKind.class);
        putIfPresent(values, StatKind.AVERAGE, dp.average());
        putIfPresent(values, StatKind.MAXIMUM, dp.maximum());
        putIfPresent(values, StatKind.MINIMUM, dp.minimum());
        putIfPresent(values, StatKind.SUM, dp.sum());
        putIfPresent(values, StatKind.SAMPLE_COUNT, dp.sampleCount());
        return new Datapoint(dp.timestamp(), values);
    }

    private static void putIfPresent(Map<StatKind, Double> values, StatKind kind, Double value) {
        if (value != null) {
            values.put(kind, value);
        }
    }

    @Override
    public void close() {
        client.close();
    }
}
