package com.phillippitts.livefacts.service.content;

import com.phillippitts.livefacts.config.properties.TrackingProperties;
import com.phillippitts.livefacts.domain.ContentResult;
import com.phillippitts.livefacts.domain.Coordinates;
import com.phillippitts.livefacts.exception.ContentGenerationException;
import com.phillippitts.livefacts.service.metrics.TrackingMetrics;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs {@link ContentGenerator} calls on the generation pool with a bounded timeout.
 *
 * <p>The calling delivery loop blocks in {@link #generate} and stays interruptible: a
 * cancelled session abandons the wait immediately and the pending call is cancelled
 * best-effort.
 */
@Service
public class GenerationService {

    private static final Logger LOG = LogManager.getLogger(GenerationService.class);

    private final ContentGenerator generator;
    private final Executor executor;
    private final TrackingProperties props;
    private final TrackingMetrics metrics;

    public GenerationService(ContentGenerator generator,
                             @Qualifier("generationExecutor") Executor executor,
                             TrackingProperties props,
                             TrackingMetrics metrics) {
        this.generator = Objects.requireNonNull(generator, "generator");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.props = Objects.requireNonNull(props, "props");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
    }

    /**
     * Generates content for a position, waiting at most {@code tracking.generation-timeout}.
     *
     * @return the generator's result
     * @throws ContentGenerationException on generator failure, timeout or pool rejection
     * @throws InterruptedException if the calling thread is interrupted while waiting
     */
    public ContentResult generate(Coordinates position, List<String> exclusions) throws InterruptedException {
        Duration timeout = props.getGenerationTimeout();
        long t0 = System.nanoTime();

        CompletableFuture<ContentResult> future;
        try {
            future = CompletableFuture.supplyAsync(() -> generator.generate(position, exclusions), executor);
        } catch (RejectedExecutionException rejected) {
            throw new ContentGenerationException("Generation pool saturated", "rejected", rejected);
        }

        try {
            ContentResult result = future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            metrics.recordGenerationLatency("success", System.nanoTime() - t0);
            return result;
        } catch (TimeoutException te) {
            future.cancel(true);
            metrics.recordGenerationLatency("timeout", System.nanoTime() - t0);
            throw new ContentGenerationException("Generation timed out after " + timeout.toMillis() + " ms", "timeout");
        } catch (InterruptedException ie) {
            future.cancel(true);
            throw ie;
        } catch (ExecutionException ee) {
            metrics.recordGenerationLatency("error", System.nanoTime() - t0);
            Throwable cause = ee.getCause();
            if (cause instanceof ContentGenerationException cge) {
                throw cge;
            }
            LOG.warn("Content generator failed unexpectedly: {}", String.valueOf(cause));
            throw new ContentGenerationException("Generator failed", "error", cause);
        }
    }
}
