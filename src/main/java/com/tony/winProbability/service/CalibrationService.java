package com.tony.winProbability.service;

import com.tony.winProbability.exception.ConfigurationException;
import com.tony.winProbability.model.CalibrationBin;
import com.tony.winProbability.model.EmpiricalRateTable;
import com.tony.winProbability.model.PredictionGridCell;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.concurrent.ConcurrentMap;
import java.util.stream.Collector;
import java.util.stream.Collectors;

@Service
@Slf4j
public class CalibrationService {

    /**
     * Regroupe les cellules prédites par tranche de probabilité et compare à la fréquence observée au même état exact.
     * <p>
     * Tranches [k·w, (k+1)·w), calculées en décimal exact sur la représentation décimale de la prédiction ;
     * une prédiction égale à 1 tombe dans la dernière tranche, fermée à droite.
     * Une prédiction hors de [0,1] (surface de nul non écrêtée) garde sa propre tranche.
     * Seules les tranches non vides sont renvoyées, triées par borne inférieure.
     */
    public List<CalibrationBin> bin(List<PredictionGridCell> cells, EmpiricalRateTable empirical, double binWidth) {
        requireValidBinWidth(binWidth);
        BigDecimal width = BigDecimal.valueOf(binWidth);
        long lastIndex = BigDecimal.ONE.divide(width, 0, RoundingMode.CEILING).longValueExact() - 1;

        ConcurrentMap<BinKey, BinAccumulator> groups = cells.parallelStream()
                .collect(Collectors.groupingByConcurrent(
                        cell -> keyOf(predictionOf(cell), width, lastIndex),
                        Collector.of(BinAccumulator::new,
                                (acc, cell) -> acc.add(predictionOf(cell), empirical.rateAt(cell.key())),
                                BinAccumulator::merge)));

        List<CalibrationBin> bins = groups.entrySet().stream()
                .sorted(Map.Entry.comparingByKey(Comparator.comparingLong(BinKey::index)))
                .map(e -> e.getValue().toBin(e.getKey()))
                .toList();

        log.debug("Calibration : {} cellules réparties en {} tranches non vides", cells.size(), bins.size());
        return bins;
    }

    public static void requireValidBinWidth(double binWidth) {
        if (!(binWidth > 0 && binWidth <= 1)) {
            throw new ConfigurationException("Largeur de tranche invalide : " + binWidth + " (attendu dans ]0, 1])");
        }
    }

    /**
     * Rapport lisible dans les logs, une ligne par tranche.
     */
    public void logReport(String label, List<CalibrationBin> bins) {
        log.info("🎯 --- CALIBRATION {} ---", label);
        log.info(String.format("%-22s | %-12s | %-12s | %-8s", "Tranche Prob", "Moy. Prédite", "Fréq. Réelle", "Nb Cas"));
        for (CalibrationBin b : bins) {
            String empiricalMean = b.getMeanEmpirical() == null ? "-" : String.format("%.4f", b.getMeanEmpirical());
            log.info(String.format("[%.4f - %.4f]      | %-12.4f | %-12s | %-8d",
                    b.getLowerBound(), b.getUpperBound(), b.getMeanPredicted(), empiricalMean, b.getCount()));
        }
    }

    static BinKey keyOf(double prediction, BigDecimal width, long lastIndex) {
        BigDecimal p = BigDecimal.valueOf(prediction);
        int vsOne = p.compareTo(BigDecimal.ONE);
        if (vsOne == 0) {
            BigDecimal lower = width.multiply(BigDecimal.valueOf(lastIndex));
            return new BinKey(lastIndex, lower.doubleValue(), 1.0);
        }
        if (vsOne > 0) {
            // Au-delà de 1 les tranches repartent de 1 : [1 + k·w, 1 + (k+1)·w)
            long k = p.subtract(BigDecimal.ONE).divide(width, 0, RoundingMode.FLOOR).longValueExact();
            BigDecimal lower = BigDecimal.ONE.add(width.multiply(BigDecimal.valueOf(k)));
            return new BinKey(lastIndex + 1 + k, lower.doubleValue(), lower.add(width).doubleValue());
        }
        long index = p.divide(width, 0, RoundingMode.FLOOR).longValueExact();
        BigDecimal lower = width.multiply(BigDecimal.valueOf(index));
        BigDecimal upper = index == lastIndex ? BigDecimal.ONE : lower.add(width);
        return new BinKey(index, lower.doubleValue(), upper.doubleValue());
    }

    private static double predictionOf(PredictionGridCell cell) {
        if (!cell.isPredicted()) {
            throw new IllegalArgumentException("Cellule non prédite : " + cell.key());
        }
        double p = cell.predictedProbability();
        if (!Double.isFinite(p)) {
            throw new IllegalArgumentException("Prédiction non finie " + p + " en " + cell.key());
        }
        return p;
    }

    record BinKey(long index, double lowerBound, double upperBound) {
    }

    private static final class BinAccumulator {
        private double sumPredicted;
        private int count;
        private double sumEmpirical;
        private int empiricalCount;

        void add(double predicted, OptionalDouble empiricalRate) {
            sumPredicted += predicted;
            count++;
            if (empiricalRate.isPresent()) {
                sumEmpirical += empiricalRate.getAsDouble();
                empiricalCount++;
            }
        }

        BinAccumulator merge(BinAccumulator other) {
            sumPredicted += other.sumPredicted;
            count += other.count;
            sumEmpirical += other.sumEmpirical;
            empiricalCount += other.empiricalCount;
            return this;
        }

        CalibrationBin toBin(BinKey key) {
            return CalibrationBin.builder()
                    .lowerBound(key.lowerBound())
                    .upperBound(key.upperBound())
                    .meanPredicted(sumPredicted / count)
                    .meanEmpirical(empiricalCount == 0 ? null : sumEmpirical / empiricalCount)
                    .count(count)
                    .empiricalCount(empiricalCount)
                    .build();
        }
    }
}
