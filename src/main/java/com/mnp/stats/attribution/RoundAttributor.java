package com.mnp.stats.attribution;

import java.util.List;
import java.util.Set;

/**
 * Fixed league rules mapping player positions and machine picks to sides.
 *
 * <pre>
 * Round  Mode     Home    Away    Picked by
 *   1    doubles  {2,4}   {1,3}   away
 *   2    singles  {1}     {2}     home
 *   3    singles  {2}     {1}     away
 *   4    doubles  {1,3}   {2,4}   home
 * </pre>
 *
 * Score-side attribution ({@link #positionsFor}) and pick attribution
 * ({@link #pickingSide}) are separate questions: in round 1 the away side
 * picks and also plays positions 1 and 3.
 */
public final class RoundAttributor {
    public static final int FIRST_ROUND = 1;
    public static final int LAST_ROUND = 4;

    private static final Set<Integer> DOUBLES_POSITIONS = Set.of(1, 2, 3, 4);
    private static final Set<Integer> SINGLES_POSITIONS = Set.of(1, 2);

    private static final List<Integer> HOME_PICKS = List.of(2, 4);
    private static final List<Integer> AWAY_PICKS = List.of(1, 3);

    private RoundAttributor() {
        // Utility class
    }

    public static boolean isValidRound(int round) {
        return round >= FIRST_ROUND && round <= LAST_ROUND;
    }

    public static RoundMode modeOf(int round) {
        requireValid(round);
        return round == 1 || round == 4 ? RoundMode.DOUBLES : RoundMode.SINGLES;
    }

    /**
     * All positions seated in the round.
     */
    public static Set<Integer> presentPositions(int round) {
        return modeOf(round) == RoundMode.DOUBLES ? DOUBLES_POSITIONS : SINGLES_POSITIONS;
    }

    /**
     * Positions whose score and points belong to {@code side} in the given round.
     *
     * @throws IllegalArgumentException if the round is not 1..4
     */
    public static Set<Integer> positionsFor(int round, Side side) {
        requireValid(round);
        Set<Integer> home = switch (round) {
            case 1 -> Set.of(2, 4);
            case 2 -> Set.of(1);
            case 3 -> Set.of(2);
            default -> Set.of(1, 3);
        };
        if (side == Side.HOME) {
            return home;
        }
        return Set.copyOf(presentPositions(round).stream().filter(p -> !home.contains(p)).toList());
    }

    public static Set<Integer> positionsFor(int round, boolean home) {
        return positionsFor(round, Side.of(home));
    }

    /**
     * The side owning a seated position.
     *
     * @throws IllegalArgumentException if the round is invalid or the position is not seated
     */
    public static Side sideOf(int round, int position) {
        if (!presentPositions(round).contains(position)) {
            throw new IllegalArgumentException("Position " + position + " is not played in round " + round);
        }
        return positionsFor(round, Side.HOME).contains(position) ? Side.HOME : Side.AWAY;
    }

    /**
     * The side that chose the machine for the round: home picks rounds 2 and 4, away picks 1 and 3.
     */
    public static Side pickingSide(int round) {
        requireValid(round);
        return HOME_PICKS.contains(round) ? Side.HOME : Side.AWAY;
    }

    public static List<Integer> pickedRounds(Side side) {
        return side == Side.HOME ? HOME_PICKS : AWAY_PICKS;
    }

    public static boolean isPickedBy(int round, Side side) {
        return pickingSide(round) == side;
    }

    private static void requireValid(int round) {
        if (!isValidRound(round)) {
            throw new IllegalArgumentException("Round must be between 1 and 4, got " + round);
        }
    }
}
