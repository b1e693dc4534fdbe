package com.source.deblend.metrics;

import com.source.deblend.api.PeakSkip;

import java.time.Duration;

/**
 * No-op implementation of {@link MetricsService}.
 */
public class NoOpMetricsService implements MetricsService {

    @Override
    public void recordRunDuration(Duration duration) {
    }

    @Override
    public void recordPeakCount(int peaks) {
    }

    @Override
    public void incrementParentsDeblended() {
    }

    @Override
    public void incrementChildrenCreated(int children) {
    }

    @Override
    public void incrementDeblendFailed() {
    }

    @Override
    public void incrementPeakSkipped(PeakSkip.Reason reason) {
    }
}
