package com.openforge.gateway.cost;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;

/**
 * Drives {@link CostAnalytics#recordSnapshot()} on the configured cadence.
 *
 * The job ticks at the snapshot interval; the analytics object itself
 * drops a tick that arrives early, so clock drift never doubles a snapshot.
 */
@Slf4j
@RequiredArgsConstructor
public class CostSnapshotJob {

    private final CostAnalytics analytics;

    @Scheduled(fixedRateString = "${gateway.cost.snapshot-interval:1m}",
               initialDelayString = "${gateway.cost.snapshot-interval:1m}")
    public void snapshot() {
        if (analytics.recordSnapshot()) {
            log.debug("[CostSnapshotJob] Snapshot recorded, history size={}", analytics.historySize());
        }
    }
}
