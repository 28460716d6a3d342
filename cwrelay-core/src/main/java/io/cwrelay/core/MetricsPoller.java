package io.cwrelay.core;

import io.cwrelay.core.MetricTransformer.FetchedMetric;
import io.cwrelay.core.model.MetricDescriptor;
import io.cwrelay.core.model.TimeWindow;
import io.cwrelay.core.provider.DescriptorPage;
import io.cwrelay.core.provider.MetricsProvider;
import io.cwrelay.core.sink.MetricSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Runs one poll cycle: computes the window, walks every descriptor page, emits the records
 * and commits the watermark once every page has been emitted.
 *
 * Any exception leaves the stored watermark untouched so the next run covers the same window.
 */
public class MetricsPoller {

    private static final Logger log = LoggerFactory.getLogger(MetricsPoller.class);

    private final MetricsProvider provider;
    private final MetricTransformer transformer;
    private final WindowManager windowManager;
    private final Retrier retrier;
    private final Clock clock;
    private final int defaultDelayMinutes;
    private final int fetchThreads;

    public MetricsPoller(MetricsProvider provider, MetricTransformer transformer, WindowManager windowManager,
                         Retrier retrier, Clock clock, int defaultDelayMinutes, int fetchThreads) {
        this.provider = provider;
        this.transformer = transformer;
        this.windowManager = windowManager;
        this.retrier = retrier;
        this.clock = clock;
        this.defaultDelayMinutes = defaultDelayMinutes;
        this.fetchThreads = Math.max(1, fetchThreads);
    }

    /**
     * @param watermark stored watermark, null on the first run
     * @param sink      open sink; the caller owns its lifetime
     */
    public PollSummary poll(Instant watermark, MetricSink sink) {
        Instant now = clock.instant();
        TimeWindow window = windowManager.computeWindow(now, watermark, defaultDelayMinutes);
        log.info("Polling window {} - {}", window.start(), window.end());

        AtomicInteger pages = new AtomicInteger();
        AtomicInteger descriptors = new AtomicInteger();
        AtomicInteger matched = new AtomicInteger();
        AtomicLong records = new AtomicLong();

        ExecutorService pool = fetchThreads > 1 ? newFetchPool(fetchThreads) : null;
        try {
            String token = null;
            do {
                DescriptorPage page = listPage(token);
                pages.incrementAndGet();
                descriptors.addAndGet(page.descriptors().size());

                List<Optional<FetchedMetric>> fetched = pool == null
                        ? fetchSequentially(page.descriptors(), window)
                        : fetchInParallel(pool, page.descriptors(), window);
                for (Optional<FetchedMetric> f : fetched) {
                    if (f.isEmpty()) {
                        continue;
                    }
                    matched.incrementAndGet();
                    transformer.records(f.get()).forEach(r -> {
                        sink.send(r);
                        records.incrementAndGet();
                    });
                }
                log.debug("Processed page {} with {} descriptors", pages.get(), page.descriptors().size());
                token = page.nextToken();
            } while (token != null);
        } finally {
            if (pool != null) {
                shutdownPool(pool);
            }
        }

        windowManager.commit(window.end());
        PollSummary summary = new PollSummary(window, pages.get(), descriptors.get(), matched.get(), records.get());
        log.info("Poll complete: pages={}, descriptors={}, matched={}, records={}",
                summary.pages(), summary.descriptors(), summary.matched(), summary.records());
        return summary;
    }

    private DescriptorPage listPage(String token) {
        try {
            return retrier.call("List metrics", () -> provider.listDescriptors(token));
        } catch (UpstreamException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new UpstreamException("Failed to list metrics", e);
        }
    }

    private List<Optional<FetchedMetric>> fetchSequentially(List<MetricDescriptor> page, TimeWindow window) {
        List<Optional<FetchedMetric>> result = new ArrayList<>(page.size());
        for (MetricDescriptor descriptor : page) {
            result.add(transformer.fetch(descriptor, window));
        }
        return result;
    }

    private List<Optional<FetchedMetric>> fetchInParallel(ExecutorService pool, List<MetricDescriptor> page,
                                                          TimeWindow window) {
        List<Future<Optional<FetchedMetric>>> futures = new ArrayList<>(page.size());
        for (MetricDescriptor descriptor : page) {
            futures.add(pool.submit(() -> transformer.fetch(descriptor, window)));
        }
        List<Optional<FetchedMetric>> result = new ArrayList<>(page.size());
        try {
            for (Future<Optional<FetchedMetric>> future : futures) {
                result.add(future.get());
            }
        } catch (ExecutionException e) {
            futures.forEach(f -> f.cancel(true));
            if (e.getCause() instanceof RuntimeException re) {
                throw re;
            }
            throw new UpstreamException("Statistics fetch failed", e.getCause());
        } catch (InterruptedException e) {
            futures.forEach(f -> f.cancel(true));
            Thread.currentThread().interrupt();
            throw new UpstreamException("Interrupted while fetching statistics", e);
        }
        return result;
    }

    private static ExecutorService newFetchPool(int threads) {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newFixedThreadPool(threads, r -> {
            Thread t = new Thread(r, "metrics-fetch-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    private static void shutdownPool(ExecutorService pool) {
        pool.shutdown();
        try {
            if (!pool.awaitTermination(5, TimeUnit.SECONDS)) {
                pool.shutdownNow();
                log.warn("Fetch pool did not terminate gracefully");
            }
        } catch (InterruptedException e) {
            pool.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
