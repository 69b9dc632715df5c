package com.tony.winProbability.service;

import com.tony.winProbability.exception.ConfigurationException;
import com.tony.winProbability.learner.TrainedModel;
import com.tony.winProbability.model.CombinationMethod;
import com.tony.winProbability.model.CombinationWeights;
import com.tony.winProbability.model.Dataset;
import com.tony.winProbability.model.EnsembleModel;
import com.tony.winProbability.model.GameStateFeatures;
import com.tony.winProbability.model.IntRange;
import com.tony.winProbability.model.Observation;
import com.tony.winProbability.model.PredictionGridCell;
import com.tony.winProbability.model.TieProbabilityCell;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

class GridPredictionServiceTest {

    private GridPredictionService gridService;

    @BeforeEach
    void setUp() {
        gridService = new GridPredictionService();
    }

    @Test
    @DisplayName("La grille parcourt les écarts puis le temps restant en compte à rebours")
    void gridIsDifferentialMajorWithCountdown() {
        List<PredictionGridCell> cells = gridService.buildGrid(IntRange.of(0, 2), IntRange.of(-1, 1));

        assertThat(cells).hasSize(9);
        assertThat(cells).extracting(PredictionGridCell::scoreDifferential, PredictionGridCell::timeLeft)
                .startsWith(tuple(-1, 2), tuple(-1, 1), tuple(-1, 0), tuple(0, 2))
                .endsWith(tuple(1, 0));
        assertThat(cells).noneMatch(PredictionGridCell::isPredicted);
    }

    @Test
    @DisplayName("Une plage min > max est une erreur de configuration")
    void rejectsInvertedRange() {
        assertThatThrownBy(() -> gridService.buildGrid(IntRange.of(10, 0), IntRange.of(0, 1)))
                .isInstanceOf(ConfigurationException.class);
        assertThatThrownBy(() -> gridService.buildGrid(IntRange.of(0, 10), IntRange.of(3, -3)))
                .isInstanceOf(ConfigurationException.class);
    }

    @Test
    @DisplayName("Toute la grille est prédite en un seul appel à l'ensemble")
    void predictsWholeGridInOneBatch() {
        AtomicInteger calls = new AtomicInteger();
        EnsembleModel ensemble = ensembleOf(x -> {
            calls.incrementAndGet();
            double[] out = new double[x.length];
            for (int i = 0; i < x.length; i++) out[i] = x[i][GameStateFeatures.TIME_LEFT] / 100.0;
            return out;
        });

        List<PredictionGridCell> filled = gridService.predict(ensemble, gridService.buildGrid(IntRange.of(0, 59), IntRange.of(-3, 3)));

        assertThat(calls.get()).isEqualTo(1);
        assertThat(filled).hasSize(60 * 7).allMatch(PredictionGridCell::isPredicted);
        assertThat(filled.get(0).predictedProbability()).isEqualTo(0.59);
    }

    @Test
    @DisplayName("La surface de victoire ne garde que les écarts positifs ou nuls")
    void winSurfaceKeepsNonNegativeDifferentials() {
        List<PredictionGridCell> surface = gridService.winSurface(ensembleOf(constant(0.5)), IntRange.of(0, 3), IntRange.of(-4, 4));

        assertThat(surface).hasSize(5 * 4);
        assertThat(surface).allMatch(c -> c.scoreDifferential() >= 0);
    }

    @Test
    @DisplayName("Symétrie du nul : p(3) = 0.7 et p(-3) = 0.25 donnent 1 - (0.7 + 0.25)")
    void tieProbabilityUsesMirroredDifferential() {
        EnsembleModel ensemble = ensembleOf(x -> {
            double[] out = new double[x.length];
            for (int i = 0; i < x.length; i++) {
                double d = x[i][GameStateFeatures.SCORE_DIFFERENTIAL];
                out[i] = d == 3 ? 0.7 : d == -3 ? 0.25 : 0.5;
            }
            return out;
        });

        List<TieProbabilityCell> ties = gridService.tieSurface(ensemble, IntRange.of(10, 10), IntRange.of(-3, 3));

        TieProbabilityCell three = ties.stream().filter(c -> c.scoreDifferential() == 3).findFirst().orElseThrow();
        assertThat(three.winProbability()).isEqualTo(0.7);
        assertThat(three.mirroredWinProbability()).isEqualTo(0.25);
        assertThat(three.tieProbability()).isEqualTo(1 - (0.7 + 0.25));
        assertThat(ties).extracting(TieProbabilityCell::scoreDifferential).containsExactly(0, 1, 2, 3);
    }

    @Test
    @DisplayName("Une probabilité de nul négative est conservée telle quelle")
    void negativeTieIsNotClamped() {
        EnsembleModel ensemble = ensembleOf(x -> {
            double[] out = new double[x.length];
            for (int i = 0; i < x.length; i++) out[i] = x[i][GameStateFeatures.SCORE_DIFFERENTIAL] >= 0 ? 0.8 : 0.3;
            return out;
        });

        List<TieProbabilityCell> ties = gridService.tieSurface(ensemble, IntRange.of(0, 0), IntRange.of(-1, 1));

        assertThat(ties).filteredOn(c -> c.scoreDifferential() == 1)
                .singleElement()
                .satisfies(c -> assertThat(c.tieProbability()).isNegative());
    }

    @Test
    @DisplayName("La plage d'écarts observée est symétrique autour de zéro")
    void observedRangeIsSymmetric() {
        Dataset dataset = new Dataset(List.of(
                new Observation(GameStateFeatures.of(-2, 10), 0, "a"),
                new Observation(GameStateFeatures.of(5, 3), 1, "b"),
                new Observation(GameStateFeatures.of(1, 0), 1, "c")));

        assertThat(gridService.observedDifferentialRange(dataset)).isEqualTo(IntRange.of(-5, 5));
    }

    private static EnsembleModel ensembleOf(TrainedModel model) {
        CombinationWeights weights = CombinationWeights.of(CombinationMethod.NNLOGLIK, List.of("stub"),
                new double[]{1.0}, new double[]{0.0}, true);
        return new EnsembleModel(Map.of("stub", model), weights);
    }

    private static TrainedModel constant(double value) {
        return x -> {
            double[] out = new double[x.length];
            Arrays.fill(out, value);
            return out;
        };
    }
}
