package com.tony.winProbability.model;

/**
 * Ordre des colonnes d'un état de match : [écart de score, temps restant].
 * L'import CSV et la grille passent tous deux par ici pour que les apprenants voient les mêmes colonnes.
 */
public final class GameStateFeatures {

    public static final int SCORE_DIFFERENTIAL = 0;
    public static final int TIME_LEFT = 1;
    public static final int WIDTH = 2;

    private GameStateFeatures() {
    }

    public static double[] of(int scoreDifferential, int timeLeft) {
        return new double[]{scoreDifferential, timeLeft};
    }

    public static GameStateKey keyOf(Observation o) {
        return new GameStateKey((int) Math.round(o.feature(SCORE_DIFFERENTIAL)), (int) Math.round(o.feature(TIME_LEFT)));
    }
}
