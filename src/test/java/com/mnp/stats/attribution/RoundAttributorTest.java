package com.mnp.stats.attribution;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.HashSet;
import java.util.Set;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for RoundAttributor.
 */
class RoundAttributorTest {

    @Test
    void testPositionTable() {
        assertThat(RoundAttributor.positionsFor(1, Side.HOME)).containsExactlyInAnyOrder(2, 4);
        assertThat(RoundAttributor.positionsFor(1, Side.AWAY)).containsExactlyInAnyOrder(1, 3);
        assertThat(RoundAttributor.positionsFor(2, Side.HOME)).containsExactly(1);
        assertThat(RoundAttributor.positionsFor(2, Side.AWAY)).containsExactly(2);
        assertThat(RoundAttributor.positionsFor(3, Side.HOME)).containsExactly(2);
        assertThat(RoundAttributor.positionsFor(3, Side.AWAY)).containsExactly(1);
        assertThat(RoundAttributor.positionsFor(4, Side.HOME)).containsExactlyInAnyOrder(1, 3);
        assertThat(RoundAttributor.positionsFor(4, Side.AWAY)).containsExactlyInAnyOrder(2, 4);
    }

    @ParameterizedTest
    @ValueSource(ints = {1, 2, 3, 4})
    void testSidesPartitionSeatedPositions(int round) {
        Set<Integer> home = RoundAttributor.positionsFor(round, true);
        Set<Integer> away = RoundAttributor.positionsFor(round, false);

        assertThat(home).doesNotContainAnyElementsOf(away);
        Set<Integer> union = new HashSet<>(home);
        union.addAll(away);
        assertThat(union).isEqualTo(RoundAttributor.presentPositions(round));
        assertThat(union).hasSize(RoundAttributor.modeOf(round).getPlayerCount());
    }

    @ParameterizedTest
    @CsvSource({
            "1, 1, AWAY",
            "1, 2, HOME",
            "2, 1, HOME",
            "3, 1, AWAY",
            "4, 4, AWAY",
            "4, 3, HOME"
    })
    void testSideOfPosition(int round, int position, Side expected) {
        assertThat(RoundAttributor.sideOf(round, position)).isEqualTo(expected);
    }

    @Test
    void testSinglesRoundHasNoThirdPosition() {
        assertThatThrownBy(() -> RoundAttributor.sideOf(2, 3))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("not played");
    }

    @ParameterizedTest
    @ValueSource(ints = {0, 5, -1})
    void testInvalidRoundRejected(int round) {
        assertThatThrownBy(() -> RoundAttributor.positionsFor(round, Side.HOME))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Round must be between 1 and 4, got " + round);
        assertThat(RoundAttributor.isValidRound(round)).isFalse();
    }

    @Test
    void testPickingSide() {
        assertThat(RoundAttributor.pickingSide(1)).isEqualTo(Side.AWAY);
        assertThat(RoundAttributor.pickingSide(2)).isEqualTo(Side.HOME);
        assertThat(RoundAttributor.pickingSide(3)).isEqualTo(Side.AWAY);
        assertThat(RoundAttributor.pickingSide(4)).isEqualTo(Side.HOME);
        assertThat(RoundAttributor.pickedRounds(Side.HOME)).containsExactly(2, 4);
        assertThat(RoundAttributor.isPickedBy(3, Side.AWAY)).isTrue();
    }

    @Test
    void testModes() {
        assertThat(RoundAttributor.modeOf(1)).isEqualTo(RoundMode.DOUBLES);
        assertThat(RoundAttributor.modeOf(2)).isEqualTo(RoundMode.SINGLES);
        assertThat(RoundAttributor.modeOf(3)).isEqualTo(RoundMode.SINGLES);
        assertThat(RoundAttributor.modeOf(4)).isEqualTo(RoundMode.DOUBLES);
        assertThat(Side.HOME.opposite()).isEqualTo(Side.AWAY);
    }
}
