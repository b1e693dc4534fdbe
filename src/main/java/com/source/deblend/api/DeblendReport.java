package com.source.deblend.api;

import java.util.List;
import java.util.Optional;

/**
 * Summary of one deblend run over a catalog.
 *
 * @param runId           id also placed in the MDC of every log line of the run
 * @param inputCount      rows in the catalog when the run started
 * @param candidateCount  rows with two or more peaks (deblended or failed)
 * @param childrenCreated child rows appended by the run
 * @param finalCount      rows in the catalog when the run finished
 * @param outcomes        one outcome per candidate, in catalog order
 */
public record DeblendReport(
        String runId,
        int inputCount,
        int candidateCount,
        int childrenCreated,
        int finalCount,
        List<DeblendOutcome> outcomes
) {
    public DeblendReport {
        outcomes = outcomes != null ? List.copyOf(outcomes) : List.of();
    }

    public List<DeblendOutcome.Failed> failures() {
        return outcomes.stream()
                .filter(o -> o instanceof DeblendOutcome.Failed)
                .map(o -> (DeblendOutcome.Failed) o)
                .toList();
    }

    public int failedCount() {
        return failures().size();
    }

    public boolean hasFailures() {
        return outcomes.stream().anyMatch(o -> !o.isSuccess());
    }

    public Optional<DeblendOutcome> findOutcome(long sourceId) {
        return outcomes.stream()
                .filter(o -> o.sourceId() == sourceId)
                .findFirst();
    }

    @Override
    public String toString() {
        return "DeblendReport{" +
                "runId=" + runId +
                ", input=" + inputCount +
                ", candidates=" + candidateCount +
                ", children=" + childrenCreated +
                ", total=" + finalCount +
                ", failed=" + failedCount() +
                '}';
    }
}
