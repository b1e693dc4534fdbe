package com.source.deblend.api;

import com.source.deblend.catalog.Schema;
import com.source.deblend.catalog.SourceCatalog;
import com.source.deblend.catalog.SourceRecord;
import com.source.deblend.core.model.Box2I;
import com.source.deblend.core.model.Footprint;
import com.source.deblend.core.model.Peak;
import com.source.deblend.deblender.DeblendException;
import com.source.deblend.deblender.DeblendRequest;
import com.source.deblend.deblender.DeblendResult;
import com.source.deblend.deblender.Deblender;
import com.source.deblend.deblender.DeblenderParameters;
import com.source.deblend.image.MaskedImage;
import com.source.deblend.image.MedianNoiseEstimator;
import com.source.deblend.image.NoiseEstimator;
import com.source.deblend.logging.LogContext;
import com.source.deblend.metrics.MetricsService;
import com.source.deblend.metrics.NoOpMetricsService;
import com.source.deblend.psf.Psf;
import com.source.deblend.tracing.NoOpTracingService;
import com.source.deblend.tracing.Span;
import com.source.deblend.tracing.TracingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Splits blended sources of a catalog into per-peak children.
 *
 * <h2>Run semantics</h2>
 * <ul>
 *   <li>The catalog size is captured when {@link #run} starts; only those rows are examined,
 *       so children appended during the run are never deblended again.</li>
 *   <li>Rows with fewer than two peaks are left untouched.</li>
 *   <li>A failure while deblending one parent flags that parent {@code deblend.failed}
 *       and never stops the run.</li>
 * </ul>
 *
 * <h2>Example usage:</h2>
 * <pre>
 * Schema schema = new Schema();
 * SourceDeblender deblender = SourceDeblender.builder()
 *     .schema(schema)
 *     .deblender(templateDeblender)
 *     .options(DeblendOptions.builder().maxNumberOfPeaks(10).build())
 *     .build();
 *
 * SourceCatalog catalog = new SourceCatalog(schema);
 * // ... detection fills the catalog ...
 * DeblendReport report = deblender.run(image, catalog, psf);
 * </pre>
 */
public class SourceDeblender {
    private static final Logger log = LoggerFactory.getLogger(SourceDeblender.class);

    /** Gaussian sigma to full width at half maximum. */
    static final double FWHM_PER_SIGMA = 2.35;

    private final Deblender deblender;
    private final NoiseEstimator noiseEstimator;
    private final DeblendOptions options;
    private final DeblendKeys keys;
    private final ResultMapper resultMapper;
    private final PreDeblendHook preHook;
    private final PostDeblendHook postHook;
    private final MetricsService metricsService;
    private final TracingService tracingService;

    private SourceDeblender(Builder builder) {
        this.deblender = Objects.requireNonNull(builder.deblender, "deblender is required");
        Objects.requireNonNull(builder.schema, "schema is required");
        this.keys = DeblendKeys.register(builder.schema);
        this.noiseEstimator = builder.noiseEstimator != null
                ? builder.noiseEstimator : new MedianNoiseEstimator();
        this.options = builder.options != null ? builder.options : DeblendOptions.defaults();
        this.preHook = builder.preHook != null ? builder.preHook : PreDeblendHook.NOOP;
        this.postHook = builder.postHook != null ? builder.postHook : PostDeblendHook.NOOP;
        this.metricsService = builder.metricsService != null
                ? builder.metricsService : new NoOpMetricsService();
        this.tracingService = builder.tracingService != null
                ? builder.tracingService : new NoOpTracingService();
        this.resultMapper = new ResultMapper(keys);

        log.debug("Added keys to schema: {}", keys);
    }

    public DeblendKeys getKeys() {
        return keys;
    }

    public DeblendOptions getOptions() {
        return options;
    }

    /**
     * Deblends every multi-peak source present in {@code catalog} when the call starts.
     * The catalog is modified in place; the returned report summarises the run.
     *
     * @throws IllegalStateException if the catalog's schema does not carry the deblend fields
     */
    public DeblendReport run(MaskedImage image, SourceCatalog catalog, Psf psf) {
        Objects.requireNonNull(image, "image is required");
        Objects.requireNonNull(catalog, "catalog is required");
        Objects.requireNonNull(psf, "psf is required");
        checkSchema(catalog.getSchema());

        long startNanos = System.nanoTime();
        String runId = LogContext.generateRunId();
        int n0 = catalog.size();

        try (LogContext logCtx = LogContext.forRun(runId)
                .with("parallelism", Integer.toString(options.getParallelism()));
             Span runSpan = tracingService.startRunSpan(runId, n0)) {
            log.info("Deblending {} sources", n0);

            double sigma1 = noiseEstimator.estimate(image);
            DeblenderParameters parameters = options.toDeblenderParameters();

            List<DeblendOutcome> outcomes = options.getParallelism() > 1
                    ? runParallel(runId, image, catalog, psf, n0, sigma1, parameters)
                    : runSequential(runId, image, catalog, psf, n0, sigma1, parameters);

            int n1 = catalog.size();
            int childrenCreated = 0;
            for (DeblendOutcome outcome : outcomes) {
                if (outcome instanceof DeblendOutcome.Deblended deblended) {
                    childrenCreated += deblended.nChild();
                }
            }
            DeblendReport report = new DeblendReport(runId, n0, outcomes.size(), childrenCreated, n1, outcomes);

            log.info("Deblended: of {} sources, {} were deblended, creating {} children, total {} sources",
                    n0, outcomes.size(), childrenCreated, n1);
            if (report.hasFailures()) {
                log.warn("deblend.run.failures runId={} failed={}", runId, report.failedCount());
            }

            metricsService.recordRunDuration(Duration.ofNanos(System.nanoTime() - startNanos));
            runSpan.setAttribute("candidates", outcomes.size());
            runSpan.setAttribute("children", childrenCreated);
            runSpan.setAttribute("failed", report.failedCount());
            runSpan.markSucceeded();
            return report;
        }
    }

    private List<DeblendOutcome> runSequential(String runId, MaskedImage image, SourceCatalog catalog, Psf psf,
                                               int n0, double sigma1, DeblenderParameters parameters) {
        List<DeblendOutcome> outcomes = new ArrayList<>();
        for (int i = 0; i < n0; i++) {
            SourceRecord source = catalog.get(i);
            if (!isCandidate(source)) {
                continue;
            }
            outcomes.add(deblendSource(runId, image, catalog, psf, i, source, sigma1, parameters));
        }
        return outcomes;
    }

    private List<DeblendOutcome> runParallel(String runId, MaskedImage image, SourceCatalog catalog, Psf psf,
                                             int n0, double sigma1, DeblenderParameters parameters) {
        ExecutorService executor = Executors.newFixedThreadPool(options.getParallelism(), new WorkerThreadFactory());
        try {
            List<Future<DeblendOutcome>> futures = new ArrayList<>();
            List<SourceRecord> submitted = new ArrayList<>();
            List<Integer> indices = new ArrayList<>();
            for (int i = 0; i < n0; i++) {
                SourceRecord source = catalog.get(i);
                if (!isCandidate(source)) {
                    continue;
                }
                int index = i;
                futures.add(executor.submit(() ->
                        deblendSource(runId, image, catalog, psf, index, source, sigma1, parameters)));
                submitted.add(source);
                indices.add(index);
            }

            List<DeblendOutcome> outcomes = new ArrayList<>(futures.size());
            for (int k = 0; k < futures.size(); k++) {
                SourceRecord source = submitted.get(k);
                try {
                    outcomes.add(futures.get(k).get());
                } catch (ExecutionException e) {
                    // Failures escaping deblendSource come from mapping results into the catalog
                    Throwable cause = e.getCause() != null ? e.getCause() : e;
                    log.warn("Error deblending source {}: {}", source.getId(), cause.getMessage(), cause);
                    source.set(keys.failed(), true);
                    metricsService.incrementDeblendFailed();
                    outcomes.add(new DeblendOutcome.Failed(source.getId(), indices.get(k),
                            source.getPeakCount(), String.valueOf(cause.getMessage()), cause));
                }
            }
            return outcomes;
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while deblending", e);
        } finally {
            executor.shutdown();
        }
    }

    private DeblendOutcome deblendSource(String runId, MaskedImage image, SourceCatalog catalog, Psf psf,
                                         int index, SourceRecord source, double sigma1,
                                         DeblenderParameters parameters) {
        long sourceId = source.getId();
        Footprint footprint = source.getFootprint();
        int peakCount = footprint.getPeakCount();

        try (LogContext logCtx = LogContext.forSource(runId, sourceId);
             Span span = tracingService.startSourceSpan(sourceId, peakCount)) {

            DeblendContext context;
            DeblendResult result;
            int rowsBefore;
            try {
                double psfFwhm = computePsfFwhm(psf, footprint.getBBox());
                log.debug("Parent {}: deblending {} peaks", sourceId, peakCount);

                context = preHook.beforeDeblend(
                        new DeblendContext(image, catalog, index, source, footprint, psf, psfFwhm, sigma1));
                Objects.requireNonNull(context, "pre-deblend hook returned null context");
                rowsBefore = catalog.size();

                // Records the input condition; the deblender enforces the cap itself
                source.set(keys.tooManyPeaks(), options.exceedsPeakCap(context.footprint().getPeakCount()));

                result = deblender.deblend(new DeblendRequest(context.footprint(), image, psf,
                        context.psfFwhm(), context.sigma1(), parameters));
                if (result == null) {
                    throw new DeblendException("Deblender returned no result");
                }
                source.set(keys.failed(), false);
            } catch (Exception e) {
                log.warn("Error deblending source {}: {}", sourceId, e.getMessage(), e);
                source.set(keys.failed(), true);
                metricsService.incrementDeblendFailed();
                span.markFailed(e);
                return new DeblendOutcome.Failed(sourceId, index, peakCount, String.valueOf(e.getMessage()), e);
            }

            List<Peak> peaks = context.footprint().getPeaks();
            ResultMapper.Mapping mapping = resultMapper.map(catalog, source, peaks, result);

            metricsService.incrementParentsDeblended();
            metricsService.recordPeakCount(peaks.size());
            metricsService.incrementChildrenCreated(mapping.children().size());
            for (PeakSkip skip : mapping.skippedPeaks()) {
                metricsService.incrementPeakSkipped(skip.reason());
            }
            span.setAttribute("children", mapping.children().size());

            try {
                postHook.afterDeblend(context, rowsBefore, mapping.children(), result);
            } catch (Exception e) {
                log.warn("Post-deblend hook failed for source {}: {}", sourceId, e.getMessage(), e);
            }

            span.markSucceeded();
            return new DeblendOutcome.Deblended(sourceId, index, peakCount,
                    mapping.childIds(), mapping.skippedPeaks());
        }
    }

    static boolean isCandidate(SourceRecord source) {
        return source.getPeakCount() >= 2;
    }

    static double computePsfFwhm(Psf psf, Box2I bbox) {
        return psf.computeShape(bbox).getDeterminantRadius() * FWHM_PER_SIGMA;
    }

    private void checkSchema(Schema schema) {
        if (!schema.contains(keys.nChild()) || !schema.contains(keys.failed())) {
            throw new IllegalStateException(
                    "Catalog schema does not contain the deblend fields; build the deblender with the catalog's schema");
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private Schema schema;
        private Deblender deblender;
        private NoiseEstimator noiseEstimator;
        private DeblendOptions options;
        private PreDeblendHook preHook;
        private PostDeblendHook postHook;
        private MetricsService metricsService;
        private TracingService tracingService;

        /**
         * Schema to register the deblend fields in; catalogs passed to {@link #run} must use it.
         */
        public Builder schema(Schema schema) {
            this.schema = schema;
            return this;
        }

        public Builder deblender(Deblender deblender) {
            this.deblender = deblender;
            return this;
        }

        public Builder noiseEstimator(NoiseEstimator noiseEstimator) {
            this.noiseEstimator = noiseEstimator;
            return this;
        }

        public Builder options(DeblendOptions options) {
            this.options = options;
            return this;
        }

        public Builder preDeblendHook(PreDeblendHook preHook) {
            this.preHook = preHook;
            return this;
        }

        public Builder postDeblendHook(PostDeblendHook postHook) {
            this.postHook = postHook;
            return this;
        }

        public Builder metricsService(MetricsService metricsService) {
            this.metricsService = metricsService;
            return this;
        }

        public Builder tracingService(TracingService tracingService) {
            this.tracingService = tracingService;
            return this;
        }

        public SourceDeblender build() {
            return new SourceDeblender(this);
        }
    }

    private static final class WorkerThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable r) {
            Thread thread = new Thread(r, "deblend-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
