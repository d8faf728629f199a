package com.z254.arbiter.registry;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Live routing tallies for one A/B test.
 */
public class ABTestMetrics {

    private final AtomicLong requests = new AtomicLong();
    private final AtomicLong championRequests = new AtomicLong();
    private final AtomicLong candidateRequests = new AtomicLong();

    public void recordChampion() {
        requests.incrementAndGet();
        championRequests.incrementAndGet();
    }

    public void recordCandidate() {
        requests.incrementAndGet();
        candidateRequests.incrementAndGet();
    }

    public long requests() {
        return requests.get();
    }

    public long championRequests() {
        return championRequests.get();
    }

    public long candidateRequests() {
        return candidateRequests.get();
    }

    /**
     * Observed candidate share, 0 before any request.
     */
    public double candidateShare() {
        long total = requests.get();
        return total == 0 ? 0.0 : candidateRequests.get() / (double) total;
    }
}
