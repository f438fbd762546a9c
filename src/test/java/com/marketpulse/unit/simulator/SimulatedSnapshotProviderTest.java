package com.marketpulse.unit.simulator;

import static com.marketpulse.support.TestSnapshots.START;
import static org.assertj.core.api.Assertions.assertThat;

import com.marketpulse.config.MarketPulseConfig;
import com.marketpulse.domain.model.MarketSnapshot;
import com.marketpulse.simulator.SimulatedSnapshotProvider;
import com.marketpulse.support.MutableClock;
import java.util.List;
import java.util.stream.IntStream;
import org.junit.jupiter.api.Test;

class SimulatedSnapshotProviderTest {

    private static final List<String> SECTORS =
            List.of("Semiconductor", "Banking", "Liquor", "New Energy", "Medicine");

    private static SimulatedSnapshotProvider seeded(long seed) {
        MarketPulseConfig config = new MarketPulseConfig();
        config.getSimulator().setSeed(seed);
        return new SimulatedSnapshotProvider(config, new MutableClock(START));
    }

    @Test
    void valuesStayWithinTheirRanges() {
        SimulatedSnapshotProvider provider = seeded(7L);

        for (int i = 0; i < 500; i++) {
            MarketSnapshot snapshot = provider.latestSnapshot();

            assertThat(snapshot.getTimestamp()).isEqualTo(START);
            assertThat(snapshot.getVolume()).isBetween(800_000.0, 1_500_000.0);
            assertThat(snapshot.getIndexChangePct()).isBetween(-1.2, 1.2);
            assertThat(snapshot.getNorthBoundFlow()).isBetween(-15_000_000.0, 15_000_000.0);
            assertThat(snapshot.getLimitDownCount()).isBetween(0, 12);
            assertThat(snapshot.getBombRate()).isBetween(0.0, 100.0);
            assertThat(snapshot.getTopSector()).isIn(SECTORS);
            assertThat(snapshot.getTopSectorChangePct()).isBetween(-2.5, 2.5);
        }
    }

    @Test
    void sameSeedGivesSameSequence() {
        SimulatedSnapshotProvider first = seeded(42L);
        SimulatedSnapshotProvider second = seeded(42L);

        List<MarketSnapshot> a = IntStream.range(0, 20).mapToObj(i -> first.latestSnapshot()).toList();
        List<MarketSnapshot> b = IntStream.range(0, 20).mapToObj(i -> second.latestSnapshot()).toList();

        assertThat(a).isEqualTo(b);
    }
}
