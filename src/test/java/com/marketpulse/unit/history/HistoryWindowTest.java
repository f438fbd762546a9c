package com.marketpulse.unit.history;

import static com.marketpulse.support.TestSnapshots.START;
import static com.marketpulse.support.TestSnapshots.baseline;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.marketpulse.domain.model.MarketSnapshot;
import com.marketpulse.history.HistoryWindow;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class HistoryWindowTest {

    private static MarketSnapshot at(int minute) {
        return baseline().toBuilder().timestamp(START.plusMinutes(minute)).build();
    }

    @Test
    @DisplayName("keeps at most capacity snapshots and evicts the oldest first")
    void evictsOldest() {
        HistoryWindow window = new HistoryWindow(100);
        for (int i = 0; i < 150; i++) {
            window.append(at(i));
        }

        List<MarketSnapshot> snapshots = window.snapshots();
        assertThat(snapshots).hasSize(100);
        assertThat(snapshots.get(0).getTimestamp()).isEqualTo(START.plusMinutes(50));
        assertThat(window.latest()).contains(at(149));
    }

    @Test
    @DisplayName("snapshots() is an immutable copy")
    void snapshotsIsCopy() {
        HistoryWindow window = new HistoryWindow(3);
        window.append(at(0));
        List<MarketSnapshot> copy = window.snapshots();

        window.append(at(1));

        assertThat(copy).hasSize(1);
        assertThatThrownBy(() -> copy.add(at(2))).isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void emptyWindow() {
        HistoryWindow window = new HistoryWindow(5);

        assertThat(window.size()).isZero();
        assertThat(window.latest()).isEmpty();
        assertThat(window.getCapacity()).isEqualTo(5);
    }

    @Test
    void rejectsNonPositiveCapacity() {
        assertThatThrownBy(() -> new HistoryWindow(0))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("0");
    }
}
