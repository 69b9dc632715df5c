package com.tony.winProbability.model.dto;

import com.tony.winProbability.model.PipelineReport;
import com.tony.winProbability.model.PredictionMatrix;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Matrice Z exposée ligne par ligne, avec le fold et le label de chaque observation.
 */
public record OutOfFoldPredictionsResponse(List<String> learners, List<Row> rows) {

    public record Row(int index, int fold, int label, Map<String, Double> predictions) {
    }

    public static OutOfFoldPredictionsResponse from(PipelineReport report) {
        PredictionMatrix z = report.getOutOfFold();
        int[] labels = report.getDataset().labels();
        List<Row> rows = new ArrayList<>(z.rowCount());
        for (int i = 0; i < z.rowCount(); i++) {
            Map<String, Double> predictions = new LinkedHashMap<>();
            for (String name : z.learnerNames()) predictions.put(name, z.get(i, name));
            rows.add(new Row(i, report.getFolds().foldOf(i), labels[i], predictions));
        }
        return new OutOfFoldPredictionsResponse(z.learnerNames(), rows);
    }
}
