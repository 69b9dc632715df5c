package com.tony.winProbability.service;

import com.opencsv.bean.CsvBindByName;
import com.opencsv.bean.CsvToBean;
import com.opencsv.bean.CsvToBeanBuilder;
import com.opencsv.exceptions.CsvException;
import com.tony.winProbability.exception.DatasetImportException;
import com.tony.winProbability.model.Dataset;
import com.tony.winProbability.model.EmpiricalRateTable;
import com.tony.winProbability.model.GameStateDataset;
import com.tony.winProbability.model.GameStateFeatures;
import com.tony.winProbability.model.Observation;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Import d'un historique d'états de match au format CSV :
 * game_id, score_differential, time_left, win (0/1) et, optionnellement, tie (0/1).
 */
@Service
@Slf4j
public class DatasetImportService {

    public GameStateDataset importFile(Path path) {
        log.info("📥 Import du jeu de données {}", path);
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return importFrom(reader, path.toString());
        } catch (IOException e) {
            throw new DatasetImportException("Lecture impossible de " + path, e);
        }
    }

    public GameStateDataset importFrom(Reader reader, String source) {
        List<GameStateRow> rows;
        List<CsvException> rejected;
        try {
            CsvToBean<GameStateRow> csv = new CsvToBeanBuilder<GameStateRow>(reader)
                    .withType(GameStateRow.class)
                    .withSeparator(',')
                    .withIgnoreLeadingWhiteSpace(true)
                    .withThrowExceptions(false)
                    .build();
            rows = csv.parse();
            rejected = csv.getCapturedExceptions();
        } catch (RuntimeException e) {
            throw new DatasetImportException("CSV illisible : " + source, e);
        }

        List<Observation> observations = new ArrayList<>(rows.size());
        List<Observation> tieOutcomes = new ArrayList<>();
        int skipped = rejected.size();
        for (CsvException e : rejected) {
            log.debug("Ligne {} rejetée : {}", e.getLineNumber(), e.getMessage());
        }

        for (GameStateRow row : rows) {
            if (!row.isComplete()) {
                skipped++;
                continue;
            }
            double[] features = GameStateFeatures.of(row.getScoreDifferential(), row.getTimeLeft());
            observations.add(new Observation(features, row.getWin(), row.getGameId()));
            if (row.getTie() != null && isBinary(row.getTie())) {
                tieOutcomes.add(new Observation(features, row.getTie(), row.getGameId()));
            }
        }

        if (skipped > 0) {
            log.warn("⚠️ {} lignes ignorées dans {} (valeurs manquantes ou hors 0/1)", skipped, source);
        }
        if (observations.isEmpty()) {
            throw new DatasetImportException("Aucune ligne exploitable dans " + source);
        }

        Dataset dataset = new Dataset(observations);
        EmpiricalRateTable winRates = EmpiricalRateTable.fromObservations(observations);
        EmpiricalRateTable tieRates = tieOutcomes.isEmpty()
                ? EmpiricalRateTable.empty()
                : EmpiricalRateTable.fromObservations(tieOutcomes);

        log.info("✅ {} observations importées ({} états distincts, colonne tie {})",
                dataset.size(), winRates.size(), tieRates.isEmpty() ? "absente" : "présente");
        return new GameStateDataset(dataset, winRates, tieRates);
    }

    private static boolean isBinary(Integer value) {
        return value == 0 || value == 1;
    }

    @Data
    public static class GameStateRow {
        @CsvBindByName(column = "game_id") private String gameId;
        @CsvBindByName(column = "score_differential") private Integer scoreDifferential;
        @CsvBindByName(column = "time_left") private Integer timeLeft;
        @CsvBindByName(column = "win") private Integer win;
        @CsvBindByName(column = "tie") private Integer tie;

        boolean isComplete() {
            return scoreDifferential != null && timeLeft != null && win != null && isBinary(win);
        }
    }
}
