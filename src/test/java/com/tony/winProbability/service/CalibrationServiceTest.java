package com.tony.winProbability.service;

import com.tony.winProbability.exception.ConfigurationException;
import com.tony.winProbability.model.CalibrationBin;
import com.tony.winProbability.model.EmpiricalRateTable;
import com.tony.winProbability.model.GameStateKey;
import com.tony.winProbability.model.PredictionGridCell;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class CalibrationServiceTest {

    private CalibrationService calibrationService;

    @BeforeEach
    void setUp() {
        calibrationService = new CalibrationService();
    }

    @Test
    @DisplayName("Prédiction = fréquence observée : moyennes prédite et empirique identiques dans chaque tranche")
    void perfectCalibrationGivesEqualMeans() {
        List<PredictionGridCell> cells = new ArrayList<>();
        Map<GameStateKey, Double> rates = new HashMap<>();
        for (int d = 0; d < 10; d++) {
            for (int t = 0; t < 20; t++) {
                double p = (d * 20 + t) / 200.0;
                cells.add(new PredictionGridCell(d, t, p));
                rates.put(new GameStateKey(d, t), p);
            }
        }

        List<CalibrationBin> bins = calibrationService.bin(cells, EmpiricalRateTable.of(rates), 0.1);

        assertThat(bins).hasSize(10);
        assertThat(bins).allSatisfy(b -> {
            assertThat(b.getMeanEmpirical()).isNotNull();
            assertThat(b.getMeanPredicted()).isCloseTo(b.getMeanEmpirical(), within(1e-12));
            assertThat(b.getEmpiricalCount()).isEqualTo(b.getCount());
        });
        assertThat(bins.stream().mapToInt(CalibrationBin::getCount).sum()).isEqualTo(200);
    }

    @Test
    @DisplayName("Une prédiction égale à 1 tombe dans la dernière tranche, fermée à droite")
    void predictionOfOneFallsInLastBin() {
        List<CalibrationBin> bins = calibrationService.bin(
                List.of(new PredictionGridCell(0, 0, 1.0)), EmpiricalRateTable.empty(), 0.01);

        assertThat(bins).singleElement().satisfies(b -> {
            assertThat(b.getLowerBound()).isEqualTo(0.99);
            assertThat(b.getUpperBound()).isEqualTo(1.0);
            assertThat(b.getCount()).isEqualTo(1);
        });
    }

    @Test
    @DisplayName("Les bornes de tranche sont exactes en décimal (0.3 reste dans [0.3, 0.4))")
    void binBoundariesAreExact() {
        List<CalibrationBin> bins = calibrationService.bin(
                List.of(new PredictionGridCell(0, 0, 0.3), new PredictionGridCell(0, 1, 0.29999)),
                EmpiricalRateTable.empty(), 0.1);

        assertThat(bins).extracting(CalibrationBin::getLowerBound).containsExactly(0.2, 0.3);
        assertThat(bins.get(1).getUpperBound()).isEqualTo(0.4);
    }

    @Test
    @DisplayName("Les prédictions hors de [0,1] gardent leur propre tranche, triée avec les autres")
    void outOfRangePredictionsAreNotClamped() {
        List<CalibrationBin> bins = calibrationService.bin(List.of(
                new PredictionGridCell(0, 0, -0.05),
                new PredictionGridCell(0, 1, 0.55),
                new PredictionGridCell(0, 2, 1.05)), EmpiricalRateTable.empty(), 0.1);

        assertThat(bins).extracting(CalibrationBin::getLowerBound).containsExactly(-0.1, 0.5, 1.0);
        assertThat(bins.get(0).getUpperBound()).isEqualTo(0.0);
        assertThat(bins.get(2).getUpperBound()).isEqualTo(1.1);
        assertThat(bins.get(0).getMeanPredicted()).isEqualTo(-0.05);
    }

    @Test
    @DisplayName("Une fréquence manquante est comptée mais exclue de la moyenne empirique")
    void missingEmpiricalRatesAreExplicit() {
        EmpiricalRateTable rates = EmpiricalRateTable.of(Map.of(new GameStateKey(1, 10), 1.0));
        List<PredictionGridCell> cells = List.of(
                new PredictionGridCell(1, 10, 0.62),
                new PredictionGridCell(2, 10, 0.64),
                new PredictionGridCell(3, 10, 0.91));

        List<CalibrationBin> bins = calibrationService.bin(cells, rates, 0.1);

        assertThat(bins).hasSize(2);
        CalibrationBin sixty = bins.get(0);
        assertThat(sixty.getCount()).isEqualTo(2);
        assertThat(sixty.getEmpiricalCount()).isEqualTo(1);
        assertThat(sixty.getMeanEmpirical()).isEqualTo(1.0);
        assertThat(sixty.getMeanPredicted()).isCloseTo(0.63, within(1e-12));

        CalibrationBin ninety = bins.get(1);
        assertThat(ninety.getMeanEmpirical()).isNull();
        assertThat(ninety.getEmpiricalCount()).isZero();
    }

    @Test
    @DisplayName("Largeur de tranche hors de ]0, 1] : erreur de configuration")
    void rejectsInvalidBinWidth() {
        List<PredictionGridCell> cells = List.of(new PredictionGridCell(0, 0, 0.5));

        assertThatThrownBy(() -> calibrationService.bin(cells, EmpiricalRateTable.empty(), 0.0))
                .isInstanceOf(ConfigurationException.class);
        assertThatThrownBy(() -> calibrationService.bin(cells, EmpiricalRateTable.empty(), 1.5))
                .isInstanceOf(ConfigurationException.class);
        assertThatThrownBy(() -> calibrationService.bin(cells, EmpiricalRateTable.empty(), Double.NaN))
                .isInstanceOf(ConfigurationException.class);
        assertThat(calibrationService.bin(cells, EmpiricalRateTable.empty(), 1.0)).singleElement()
                .satisfies(b -> assertThat(b.getUpperBound()).isEqualTo(1.0));
    }

    @Test
    @DisplayName("Une largeur de 1e-7 isole quasiment chaque prédiction")
    void tinyBinWidthSeparatesPredictions() {
        List<CalibrationBin> bins = calibrationService.bin(List.of(
                new PredictionGridCell(0, 0, 0.1234567),
                new PredictionGridCell(0, 1, 0.1234568),
                new PredictionGridCell(0, 2, 0.12345675)), EmpiricalRateTable.empty(), 1e-7);

        assertThat(bins).hasSize(2);
        assertThat(bins.get(0).getCount()).isEqualTo(2);
    }

    @Test
    @DisplayName("Une cellule non prédite est refusée")
    void rejectsUnpredictedCell() {
        assertThatThrownBy(() -> calibrationService.bin(List.of(PredictionGridCell.empty(0, 0)), EmpiricalRateTable.empty(), 0.1))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
