package com.tony.winProbability.service;

import com.tony.winProbability.exception.ConfigurationException;
import com.tony.winProbability.model.Dataset;
import com.tony.winProbability.model.EnsembleModel;
import com.tony.winProbability.model.GameStateFeatures;
import com.tony.winProbability.model.IntRange;
import com.tony.winProbability.model.Observation;
import com.tony.winProbability.model.PredictionGridCell;
import com.tony.winProbability.model.TieProbabilityCell;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

@Service
@Slf4j
public class GridPredictionService {

    /**
     * Toutes les paires (écart, temps restant) : écart croissant, puis temps restant décroissant (compte à rebours).
     */
    public List<PredictionGridCell> buildGrid(IntRange timeLeftRange, IntRange differentialRange) {
        timeLeftRange.requireValid("temps restant");
        differentialRange.requireValid("écart de score");

        List<PredictionGridCell> cells = new ArrayList<>(timeLeftRange.size() * differentialRange.size());
        for (int d = differentialRange.min(); d <= differentialRange.max(); d++) {
            for (int t = timeLeftRange.max(); t >= timeLeftRange.min(); t--) {
                cells.add(PredictionGridCell.empty(d, t));
            }
        }
        return cells;
    }

    /**
     * Un seul appel à l'ensemble pour toute la grille.
     */
    public List<PredictionGridCell> predict(EnsembleModel ensemble, List<PredictionGridCell> cells) {
        if (cells.isEmpty()) return List.of();

        double[][] features = new double[cells.size()][];
        for (int i = 0; i < cells.size(); i++) features[i] = cells.get(i).features();
        double[] predictions = ensemble.predict(features);

        List<PredictionGridCell> filled = new ArrayList<>(cells.size());
        for (int i = 0; i < cells.size(); i++) {
            filled.add(cells.get(i).withPrediction(predictions[i]));
        }
        return List.copyOf(filled);
    }

    public List<PredictionGridCell> winSurface(EnsembleModel ensemble, IntRange timeLeftRange, IntRange differentialRange) {
        List<PredictionGridCell> grid = buildGrid(timeLeftRange, nonNegative(differentialRange));
        List<PredictionGridCell> surface = predict(ensemble, grid);
        log.info("🗺️ Surface de victoire : {} cellules", surface.size());
        return surface;
    }

    /**
     * P(nul | d, t) = 1 - (P(victoire | d, t) + P(victoire | -d, t)) pour d >= 0, sans écrêtage.
     */
    public List<TieProbabilityCell> tieSurface(EnsembleModel ensemble, IntRange timeLeftRange, IntRange differentialRange) {
        List<PredictionGridCell> leading = predict(ensemble, buildGrid(timeLeftRange, nonNegative(differentialRange)));

        List<PredictionGridCell> mirrored = new ArrayList<>(leading.size());
        for (PredictionGridCell cell : leading) {
            mirrored.add(PredictionGridCell.empty(-cell.scoreDifferential(), cell.timeLeft()));
        }
        mirrored = predict(ensemble, mirrored);

        List<TieProbabilityCell> surface = new ArrayList<>(leading.size());
        int negative = 0;
        for (int i = 0; i < leading.size(); i++) {
            PredictionGridCell lead = leading.get(i);
            TieProbabilityCell cell = TieProbabilityCell.derive(lead.scoreDifferential(), lead.timeLeft(),
                    lead.predictedProbability(), mirrored.get(i).predictedProbability());
            if (cell.tieProbability() < 0) negative++;
            surface.add(cell);
        }
        if (negative > 0) {
            log.warn("⚠️ {} cellules avec une probabilité de nul négative (p(d) + p(-d) > 1)", negative);
        }
        return List.copyOf(surface);
    }

    /**
     * Plage symétrique [-m, m] avec m le plus grand écart absolu observé, pour que -d existe toujours.
     */
    public IntRange observedDifferentialRange(Dataset dataset) {
        int m = 0;
        for (Observation o : dataset.observations()) {
            m = Math.max(m, Math.abs((int) Math.round(o.feature(GameStateFeatures.SCORE_DIFFERENTIAL))));
        }
        return IntRange.of(-m, m);
    }

    private static IntRange nonNegative(IntRange differentialRange) {
        differentialRange.requireValid("écart de score");
        if (differentialRange.max() < 0) {
            throw new ConfigurationException("Plage d'écart " + differentialRange + " sans écart positif ou nul");
        }
        return IntRange.of(Math.max(0, differentialRange.min()), differentialRange.max());
    }
}
