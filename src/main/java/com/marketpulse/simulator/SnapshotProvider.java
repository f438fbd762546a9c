package com.marketpulse.simulator;

import com.marketpulse.domain.model.MarketSnapshot;

/**
 * Source of the per-cycle market snapshot.
 *
 * <p>Implementations may fail; the caller replaces a failed fetch with
 * {@link MarketSnapshot#neutral(java.time.LocalDateTime)} so the pipeline itself never
 * sees the failure.
 */
public interface SnapshotProvider {

    MarketSnapshot latestSnapshot();
}
