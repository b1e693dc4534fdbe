package com.source.deblend.metrics;

import com.source.deblend.api.PeakSkip;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;

/**
 * Micrometer-based implementation of {@link MetricsService}.
 * Requires {@code micrometer-core} on the classpath (optional dependency).
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code deblend.run.duration} - Timer</li>
 *   <li>{@code deblend.peaks} - DistributionSummary of peak counts per parent</li>
 *   <li>{@code deblend.parents} - Counter</li>
 *   <li>{@code deblend.children} - Counter</li>
 *   <li>{@code deblend.failed} - Counter</li>
 *   <li>{@code deblend.peaks.skipped} - Counter (tag: reason)</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {

    private final Timer runTimer;
    private final DistributionSummary peakCountSummary;
    private final Counter parentsCounter;
    private final Counter childrenCounter;
    private final Counter failedCounter;
    private final Map<PeakSkip.Reason, Counter> skippedCounters = new EnumMap<>(PeakSkip.Reason.class);

    public MicrometerMetricsService(MeterRegistry registry) {
        this.runTimer = Timer.builder("deblend.run.duration")
                .description("Duration of deblend runs over a catalog")
                .register(registry);
        this.peakCountSummary = DistributionSummary.builder("deblend.peaks")
                .description("Number of peaks in deblended parents")
                .register(registry);
        this.parentsCounter = Counter.builder("deblend.parents")
                .description("Number of parents successfully deblended")
                .register(registry);
        this.childrenCounter = Counter.builder("deblend.children")
                .description("Number of child sources created")
                .register(registry);
        this.failedCounter = Counter.builder("deblend.failed")
                .description("Number of parents whose deblend failed")
                .register(registry);
        for (PeakSkip.Reason reason : PeakSkip.Reason.values()) {
            skippedCounters.put(reason, Counter.builder("deblend.peaks.skipped")
                    .description("Number of peaks that produced no child")
                    .tag("reason", reason.name())
                    .register(registry));
        }
    }

    @Override
    public void recordRunDuration(Duration duration) {
        runTimer.record(duration);
    }

    @Override
    public void recordPeakCount(int peaks) {
        peakCountSummary.record(peaks);
    }

    @Override
    public void incrementParentsDeblended() {
        parentsCounter.increment();
    }

    @Override
    public void incrementChildrenCreated(int children) {
        childrenCounter.increment(children);
    }

    @Override
    public void incrementDeblendFailed() {
        failedCounter.increment();
    }

    @Override
    public void incrementPeakSkipped(PeakSkip.Reason reason) {
        skippedCounters.get(reason).increment();
    }
}
