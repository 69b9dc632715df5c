package com.tony.winProbability.service;

import com.tony.winProbability.exception.ConfigurationException;
import com.tony.winProbability.model.FoldAssignment;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.random.RandomDataGenerator;
import org.apache.commons.math3.random.Well19937c;
import org.springframework.stereotype.Service;

import java.util.Arrays;

@Service
@Slf4j
public class FoldPlanService {

    /**
     * Découpage sans mélange : la ligne i va dans le fold {@code i mod v}.
     * Deux runs sur les mêmes données produisent exactement les mêmes folds.
     */
    public FoldAssignment assign(int n, int v) {
        return assign(n, v, false, 0L);
    }

    /**
     * Avec {@code shuffle}, les lignes sont d'abord permutées par un générateur initialisé sur {@code seed},
     * puis la même règle modulo s'applique à la position dans la permutation.
     */
    public FoldAssignment assign(int n, int v, boolean shuffle, long seed) {
        if (v < 2) {
            throw new ConfigurationException("Il faut au moins 2 folds (reçu " + v + ")");
        }
        if (v > n) {
            throw new ConfigurationException("Impossible de répartir " + n + " observations dans " + v + " folds");
        }

        int[] order;
        if (shuffle) {
            order = new RandomDataGenerator(new Well19937c(seed)).nextPermutation(n, n);
        } else {
            order = new int[n];
            for (int i = 0; i < n; i++) order[i] = i;
        }

        int[] folds = new int[n];
        for (int position = 0; position < n; position++) {
            folds[order[position]] = position % v;
        }

        FoldAssignment assignment = new FoldAssignment(folds, v);
        log.debug("Plan de folds : n={}, v={}, shuffle={}, tailles={}", n, v, shuffle, Arrays.toString(assignment.foldSizes()));
        return assignment;
    }
}
