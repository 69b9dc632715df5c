package com.tony.winProbability.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Matrice Z (N x L) des prédictions hors-fold. Les colonnes sont adressées par nom d'apprenant :
 * changer l'ordre des apprenants ne peut pas décaler silencieusement une colonne.
 */
public final class PredictionMatrix {

    private final List<String> learnerNames;
    private final Map<String, Integer> columnIndex;
    private final double[][] values;

    public PredictionMatrix(List<String> learnerNames, double[][] values) {
        this.learnerNames = List.copyOf(learnerNames);
        Map<String, Integer> index = new LinkedHashMap<>();
        for (int l = 0; l < this.learnerNames.size(); l++) {
            if (index.put(this.learnerNames.get(l), l) != null) {
                throw new IllegalArgumentException("Nom d'apprenant dupliqué : " + this.learnerNames.get(l));
            }
        }
        this.columnIndex = Collections.unmodifiableMap(index);

        this.values = new double[values.length][];
        for (int i = 0; i < values.length; i++) {
            if (values[i].length != this.learnerNames.size()) {
                throw new IllegalArgumentException("Ligne " + i + " : " + values[i].length
                        + " colonnes pour " + this.learnerNames.size() + " apprenants");
            }
            this.values[i] = values[i].clone();
        }
    }

    public static PredictionMatrix fromColumns(Map<String, double[]> columns) {
        List<String> names = List.copyOf(columns.keySet());
        int n = columns.isEmpty() ? 0 : columns.values().iterator().next().length;
        double[][] values = new double[n][names.size()];
        for (int l = 0; l < names.size(); l++) {
            double[] column = columns.get(names.get(l));
            if (column.length != n) {
                throw new IllegalArgumentException("Colonne " + names.get(l) + " de longueur " + column.length + " au lieu de " + n);
            }
            for (int i = 0; i < n; i++) values[i][l] = column[i];
        }
        return new PredictionMatrix(names, values);
    }

    public int rowCount() {
        return values.length;
    }

    public int learnerCount() {
        return learnerNames.size();
    }

    public List<String> learnerNames() {
        return learnerNames;
    }

    public double get(int row, String learnerName) {
        return values[row][indexOf(learnerName)];
    }

    public double[] column(String learnerName) {
        int l = indexOf(learnerName);
        double[] out = new double[values.length];
        for (int i = 0; i < values.length; i++) out[i] = values[i][l];
        return out;
    }

    public double[] row(int row) {
        return values[row].clone();
    }

    public double[][] toArray() {
        double[][] out = new double[values.length][];
        for (int i = 0; i < values.length; i++) out[i] = values[i].clone();
        return out;
    }

    /**
     * Z · poids, jointure par nom.
     */
    public double[] combine(CombinationWeights weights) {
        double[] out = new double[values.length];
        for (Map.Entry<String, Double> e : weights.getWeights().entrySet()) {
            int l = indexOf(e.getKey());
            double w = e.getValue();
            for (int i = 0; i < values.length; i++) out[i] += w * values[i][l];
        }
        return out;
    }

    private int indexOf(String learnerName) {
        Integer l = columnIndex.get(learnerName);
        if (l == null) {
            throw new IllegalArgumentException("Apprenant inconnu dans Z : " + learnerName);
        }
        return l;
    }
}
