package com.tony.powerRank.engine.ml;

import com.tony.powerRank.engine.WeightedGame;

import java.util.Map;

/**
 * Vecteur de features d'un match : (force équipe, force adverse, différence, écart d'âge, mixte).
 */
public final class GameFeatures {

    public static final int TEAM_POWER = 0;
    public static final int OPP_POWER = 1;
    public static final int POWER_DIFF = 2;
    public static final int AGE_GAP = 3;
    public static final int CROSS_GENDER = 4;
    public static final int COUNT = 5;

    private static final double UNKNOWN_POWER = 0.5;

    private GameFeatures() {
    }

    public static double[] of(WeightedGame game, Map<String, Double> power) {
        double team = power.getOrDefault(game.getTeamId(), UNKNOWN_POWER);
        double opp = power.getOrDefault(game.getOpponentId(), UNKNOWN_POWER);
        double[] x = new double[COUNT];
        x[TEAM_POWER] = team;
        x[OPP_POWER] = opp;
        x[POWER_DIFF] = team - opp;
        x[AGE_GAP] = game.getOpponentAge() == null ? 0.0 : Math.abs(game.getCohort().age() - game.getOpponentAge());
        x[CROSS_GENDER] = game.getOpponentGender() != null
                && !game.getOpponentGender().trim().equalsIgnoreCase(game.getCohort().gender()) ? 1.0 : 0.0;
        return x;
    }
}
