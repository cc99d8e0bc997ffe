package com.mnp.stats.config;

import com.mnp.stats.statistics.OutlierFilter;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for ReportSelection.
 */
class ReportSelectionTest {

    @Test
    void testSeasonCodes() {
        ReportSelection one = ReportSelection.builder().season(22).build();
        ReportSelection two = ReportSelection.builder().season(21).season(22).build();

        assertThat(one.seasonsCode()).isEqualTo("22");
        assertThat(one.seasonsTitle()).isEqualTo("Season 22");
        assertThat(two.seasonsCode()).isEqualTo("21-22");
        assertThat(two.seasonsTitle()).isEqualTo("Seasons 21, 22");
    }

    @Test
    void testIprRange() {
        ReportSelection both = ReportSelection.builder().minIpr(3).maxIpr(5).build();
        ReportSelection min = ReportSelection.builder().minIpr(4).build();
        ReportSelection max = ReportSelection.builder().maxIpr(2).build();

        assertThat(both.iprCode()).isEqualTo("_ipr3-5");
        assertThat(min.iprCode()).isEqualTo("_ipr4plus");
        assertThat(max.iprCode()).isEqualTo("_ipr2minus");
        assertThat(ReportSelection.builder().build().iprCode()).isEmpty();

        assertThat(both.acceptsIpr(3)).isTrue();
        assertThat(both.acceptsIpr(6)).isFalse();
        assertThat(max.acceptsIpr(0)).isTrue();
        assertThat(ReportSelection.builder().build().hasIprFilter()).isFalse();
    }

    @Test
    void testCommandLineValuesWinOverDefaults() {
        ReportSelection config = ReportSelection.builder()
                .season(21)
                .venue("T4B")
                .team("DTP")
                .machines(List.of("MB"))
                .outlierFilter(OutlierFilter.builder().method(OutlierFilter.Method.IQR).build())
                .build();
        ReportSelection cli = ReportSelection.builder()
                .season(22)
                .team("JUP")
                .build();

        ReportSelection merged = cli.withDefaults(config);

        assertThat(merged.getSeasons()).containsExactly(22);
        assertThat(merged.getTeam()).isEqualTo("JUP");
        assertThat(merged.getVenue()).isEqualTo("T4B");
        assertThat(merged.getMachines()).containsExactly("MB");
        assertThat(merged.getOutlierFilter().getMethod()).isEqualTo(OutlierFilter.Method.IQR);
    }

    @Test
    void testReliablePositionsDefaultToEverySeat() {
        ReportSelection all = ReportSelection.builder().build();
        ReportSelection narrowed = ReportSelection.builder().doublesPosition(1).doublesPosition(2).build();

        assertThat(all.acceptsPosition(1, 4)).isTrue();
        assertThat(all.acceptsPosition(2, 2)).isTrue();
        assertThat(narrowed.acceptsPosition(4, 3)).isFalse();
        assertThat(narrowed.acceptsPosition(4, 2)).isTrue();
        assertThat(narrowed.acceptsPosition(3, 2)).isTrue();

        ReportSelection merged = ReportSelection.builder().singlesPosition(1).build().withDefaults(narrowed);
        assertThat(merged.getDoublesPositions()).containsExactly(1, 2);
        assertThat(merged.getSinglesPositions()).containsExactly(1);
    }
}
