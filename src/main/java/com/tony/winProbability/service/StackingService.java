package com.tony.winProbability.service;

import com.tony.winProbability.exception.ConfigurationException;
import com.tony.winProbability.exception.LearnerTrainingException;
import com.tony.winProbability.exception.SuperLearnerException;
import com.tony.winProbability.learner.BaseLearner;
import com.tony.winProbability.learner.TrainedModel;
import com.tony.winProbability.model.Dataset;
import com.tony.winProbability.model.FoldAssignment;
import com.tony.winProbability.model.PredictionMatrix;
import com.tony.winProbability.model.StackingResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;

@Service
@RequiredArgsConstructor
@Slf4j
public class StackingService {

    private final ExecutorService stackingExecutor;

    /**
     * Construit Z hors-fold puis réajuste chaque apprenant sur toutes les lignes.
     * Chaque unité (apprenant, fold) tourne sur le pool et n'écrit que les lignes de validation de son fold
     * dans la colonne de son apprenant : aucune écriture partagée, donc aucun verrou.
     * Le moindre échec interrompt le run (pas d'imputation d'une matrice partielle).
     */
    public StackingResult fit(Dataset dataset, List<BaseLearner> learners, FoldAssignment folds, long seed) {
        validate(dataset, learners, folds);

        int n = dataset.size();
        double[][] columns = new double[learners.size()][n];
        List<CompletableFuture<?>> tasks = new ArrayList<>();

        for (int l = 0; l < learners.size(); l++) {
            BaseLearner learner = learners.get(l);
            double[] column = columns[l];
            for (int f = 0; f < folds.foldCount(); f++) {
                int fold = f;
                tasks.add(CompletableFuture.runAsync(
                        () -> fitFold(dataset, learner, folds, fold, seed, column), stackingExecutor));
            }
        }

        Map<String, CompletableFuture<TrainedModel>> fullFits = new LinkedHashMap<>();
        for (BaseLearner learner : learners) {
            CompletableFuture<TrainedModel> fit = CompletableFuture.supplyAsync(
                    () -> fitFull(dataset, learner, seed), stackingExecutor);
            fullFits.put(learner.name(), fit);
            tasks.add(fit);
        }

        awaitAll(tasks);

        Map<String, double[]> byName = new LinkedHashMap<>();
        Map<String, TrainedModel> fullModels = new LinkedHashMap<>();
        for (int l = 0; l < learners.size(); l++) {
            String name = learners.get(l).name();
            byName.put(name, columns[l]);
            fullModels.put(name, fullFits.get(name).join());
        }

        log.info("🧱 Stacking terminé : {} apprenants x {} folds sur {} observations", learners.size(), folds.foldCount(), n);
        return new StackingResult(PredictionMatrix.fromColumns(byName), fullModels);
    }

    private void fitFold(Dataset dataset, BaseLearner learner, FoldAssignment folds, int fold, long seed, double[] column) {
        int[] trainRows = folds.trainingRows(fold);
        int[] validRows = folds.validationRows(fold);

        double[] predictions;
        try {
            TrainedModel model = learner.train(dataset.subsetFeatures(trainRows), dataset.subsetLabels(trainRows), seed);
            predictions = model.predict(dataset.subsetFeatures(validRows));
        } catch (RuntimeException e) {
            throw new LearnerTrainingException(learner.name(), fold, String.valueOf(e.getMessage()), e);
        }
        checkPredictions(learner.name(), fold, predictions, validRows.length);

        for (int k = 0; k < validRows.length; k++) {
            column[validRows[k]] = predictions[k];
        }
        log.debug("   -> {} / fold {} : {} lignes prédites", learner.name(), fold, validRows.length);
    }

    private TrainedModel fitFull(Dataset dataset, BaseLearner learner, long seed) {
        try {
            return learner.train(dataset.features(), dataset.labels(), seed);
        } catch (RuntimeException e) {
            throw new LearnerTrainingException(learner.name(), null, String.valueOf(e.getMessage()), e);
        }
    }

    private void checkPredictions(String learnerName, int fold, double[] predictions, int expected) {
        if (predictions == null || predictions.length != expected) {
            throw new LearnerTrainingException(learnerName, fold, (predictions == null ? 0 : predictions.length)
                    + " prédictions pour " + expected + " lignes de validation");
        }
        for (int k = 0; k < predictions.length; k++) {
            double p = predictions[k];
            if (!Double.isFinite(p) || p < 0.0 || p > 1.0) {
                throw new LearnerTrainingException(learnerName, fold, "probabilité invalide " + p + " (ligne de validation " + k + ")");
            }
        }
    }

    private void awaitAll(List<CompletableFuture<?>> tasks) {
        // Dès qu'une unité échoue, les unités encore en file sont annulées
        for (CompletableFuture<?> task : tasks) {
            task.whenComplete((ignored, error) -> {
                if (error != null) tasks.forEach(t -> t.cancel(false));
            });
        }
        try {
            CompletableFuture.allOf(tasks.toArray(new CompletableFuture[0])).join();
        } catch (CompletionException | CancellationException e) {
            throw firstFailure(tasks, e);
        }
    }

    private RuntimeException firstFailure(List<CompletableFuture<?>> tasks, RuntimeException fallback) {
        for (CompletableFuture<?> task : tasks) {
            if (task.isCompletedExceptionally() && !task.isCancelled()) {
                try {
                    task.join();
                } catch (CompletionException e) {
                    Throwable cause = e.getCause();
                    if (cause instanceof SuperLearnerException) {
                        log.error("❌ Stacking interrompu : {}", cause.getMessage());
                        return (SuperLearnerException) cause;
                    }
                    return new IllegalStateException("Échec inattendu d'une unité de stacking", cause);
                }
            }
        }
        return new IllegalStateException("Stacking interrompu", fallback);
    }

    private void validate(Dataset dataset, List<BaseLearner> learners, FoldAssignment folds) {
        if (learners == null || learners.isEmpty()) {
            throw new ConfigurationException("Aucun apprenant à empiler");
        }
        Set<String> names = new HashSet<>();
        for (BaseLearner learner : learners) {
            if (!names.add(learner.name())) {
                throw new ConfigurationException("Nom d'apprenant dupliqué : " + learner.name());
            }
        }
        if (folds.size() != dataset.size()) {
            throw new ConfigurationException("Plan de folds pour " + folds.size() + " lignes, jeu de données de " + dataset.size());
        }
    }
}
