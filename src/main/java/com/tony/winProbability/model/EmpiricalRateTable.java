package com.tony.winProbability.model;

import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.function.ToIntFunction;

/**
 * Fréquences observées d'un événement par état de match exact (écart, temps restant).
 * Une absence de données reste une absence : {@link OptionalDouble#empty()}, jamais zéro.
 */
public final class EmpiricalRateTable {

    public record Rate(double rate, int sampleCount) {
    }

    private static final EmpiricalRateTable EMPTY = new EmpiricalRateTable(Map.of());

    private final Map<GameStateKey, Rate> rates;

    private EmpiricalRateTable(Map<GameStateKey, Rate> rates) {
        this.rates = Collections.unmodifiableMap(rates);
    }

    public static EmpiricalRateTable empty() {
        return EMPTY;
    }

    public static EmpiricalRateTable of(Map<GameStateKey, Double> rates) {
        Map<GameStateKey, Rate> copy = new HashMap<>();
        rates.forEach((key, rate) -> copy.put(key, new Rate(rate, 1)));
        return new EmpiricalRateTable(copy);
    }

    /**
     * Taux de labels positifs par état de match exact.
     */
    public static EmpiricalRateTable fromObservations(Collection<Observation> observations) {
        return fromObservations(observations, Observation::label);
    }

    public static EmpiricalRateTable fromObservations(Collection<Observation> observations, ToIntFunction<Observation> outcome) {
        Map<GameStateKey, int[]> counts = new HashMap<>();
        for (Observation o : observations) {
            int[] c = counts.computeIfAbsent(GameStateFeatures.keyOf(o), k -> new int[2]);
            c[0] += outcome.applyAsInt(o);
            c[1]++;
        }
        Map<GameStateKey, Rate> rates = new HashMap<>();
        counts.forEach((key, c) -> rates.put(key, new Rate((double) c[0] / c[1], c[1])));
        return new EmpiricalRateTable(rates);
    }

    public OptionalDouble rateAt(GameStateKey key) {
        Rate rate = rates.get(key);
        return rate == null ? OptionalDouble.empty() : OptionalDouble.of(rate.rate());
    }

    public OptionalDouble rateAt(int scoreDifferential, int timeLeft) {
        return rateAt(new GameStateKey(scoreDifferential, timeLeft));
    }

    public int size() {
        return rates.size();
    }

    public boolean isEmpty() {
        return rates.isEmpty();
    }
}
