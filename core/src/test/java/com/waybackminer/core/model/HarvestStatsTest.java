package com.waybackminer.core.model;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class HarvestStatsTest {

    @Test
    void snapshot_totals_and_per_kind_counts() {
        HarvestStats st = new HarvestStats();
        st.addIndexUrls(5);
        st.recordOutOfScope();
        st.recordEmitted("wayback");
        st.recordEmitted("wayback");
        st.recordEmitted("wayback:robots");
        st.recordFailure(FailureKind.TRANSPORT);
        st.recordFailure(null); // 분류 없음 → UNEXPECTED
        st.observeConcurrency(3);
        st.observeConcurrency(1);

        HarvestStats.Snapshot s = st.snapshot(7);

        assertThat(s.requestsTotal).isEqualTo(7);
        assertThat(s.indexUrls).isEqualTo(5);
        assertThat(s.outOfScope).isEqualTo(1);
        assertThat(s.emittedTotal()).isEqualTo(3);
        assertThat(s.emittedBySource).containsEntry("wayback", 2L).containsEntry("wayback:robots", 1L);
        assertThat(s.failuresTotal()).isEqualTo(2);
        assertThat(s.failures(FailureKind.UNEXPECTED)).isEqualTo(1);
        assertThat(s.failures(FailureKind.CAPTURE_UNAVAILABLE)).isZero();
        assertThat(s.maxObservedConcurrency).isEqualTo(3);
    }
}
