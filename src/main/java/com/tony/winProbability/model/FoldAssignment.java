package com.tony.winProbability.model;

import com.tony.winProbability.exception.ConfigurationException;

import java.util.ArrayList;
import java.util.List;

/**
 * Affectation ligne -> fold. Chaque ligne appartient à exactement un fold, aucun fold n'est vide.
 */
public final class FoldAssignment {

    private final int[] folds;
    private final int foldCount;
    private final List<int[]> validationRows;

    public FoldAssignment(int[] folds, int foldCount) {
        this.folds = folds.clone();
        this.foldCount = foldCount;

        int[] sizes = new int[foldCount];
        for (int i = 0; i < this.folds.length; i++) {
            int f = this.folds[i];
            if (f < 0 || f >= foldCount) {
                throw new ConfigurationException("Ligne " + i + " affectée au fold " + f + " hors de [0, " + foldCount + ")");
            }
            sizes[f]++;
        }

        this.validationRows = new ArrayList<>(foldCount);
        for (int f = 0; f < foldCount; f++) {
            if (sizes[f] == 0) {
                throw new ConfigurationException("Le fold " + f + " est vide");
            }
            int[] rows = new int[sizes[f]];
            int k = 0;
            for (int i = 0; i < this.folds.length; i++) {
                if (this.folds[i] == f) rows[k++] = i;
            }
            validationRows.add(rows);
        }
    }

    public int size() {
        return folds.length;
    }

    public int foldCount() {
        return foldCount;
    }

    public int foldOf(int row) {
        return folds[row];
    }

    public int[] validationRows(int fold) {
        return validationRows.get(fold).clone();
    }

    public int[] trainingRows(int fold) {
        int[] rows = new int[folds.length - validationRows.get(fold).length];
        int k = 0;
        for (int i = 0; i < folds.length; i++) {
            if (folds[i] != fold) rows[k++] = i;
        }
        return rows;
    }

    public int[] foldSizes() {
        int[] sizes = new int[foldCount];
        for (int f = 0; f < foldCount; f++) sizes[f] = validationRows.get(f).length;
        return sizes;
    }

    public int[] toArray() {
        return folds.clone();
    }
}
