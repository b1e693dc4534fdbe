package com.source.deblend.metrics;

import com.source.deblend.api.PeakSkip;

import java.time.Duration;

/**
 * Interface for recording deblending metrics.
 * Implementations can integrate with Micrometer, Prometheus, or other metrics systems.
 * The default {@link NoOpMetricsService} does nothing, so the library works
 * without any metrics dependencies on the classpath.
 */
public interface MetricsService {

    void recordRunDuration(Duration duration);

    void recordPeakCount(int peaks);

    void incrementParentsDeblended();

    void incrementChildrenCreated(int children);

    void incrementDeblendFailed();

    void incrementPeakSkipped(PeakSkip.Reason reason);
}
