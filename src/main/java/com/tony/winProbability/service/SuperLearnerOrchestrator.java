package com.tony.winProbability.service;

import com.tony.winProbability.config.SuperLearnerProperties;
import com.tony.winProbability.exception.ConfigurationException;
import com.tony.winProbability.exception.ReportNotFoundException;
import com.tony.winProbability.learner.BaseLearner;
import com.tony.winProbability.learner.LearnerRegistry;
import com.tony.winProbability.model.CalibrationBin;
import com.tony.winProbability.model.CombinationWeights;
import com.tony.winProbability.model.Dataset;
import com.tony.winProbability.model.EnsembleModel;
import com.tony.winProbability.model.EvaluationReport;
import com.tony.winProbability.model.FoldAssignment;
import com.tony.winProbability.model.GameStateDataset;
import com.tony.winProbability.model.IntRange;
import com.tony.winProbability.model.PipelineReport;
import com.tony.winProbability.model.PipelineSettings;
import com.tony.winProbability.model.PredictionGridCell;
import com.tony.winProbability.model.StackingResult;
import com.tony.winProbability.model.TieProbabilityCell;
import com.tony.winProbability.model.dto.PipelineRunRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

@Service
@RequiredArgsConstructor
@Slf4j
public class SuperLearnerOrchestrator {

    private final SuperLearnerProperties properties;
    private final LearnerRegistry learnerRegistry;
    private final DatasetImportService datasetImportService;
    private final FoldPlanService foldPlanService;
    private final StackingService stackingService;
    private final WeightSolverService weightSolverService;
    private final CvEvaluationService cvEvaluationService;
    private final GridPredictionService gridPredictionService;
    private final CalibrationService calibrationService;

    // Dernier rapport complet ; les artefacts sont immuables, les lecteurs ne verrouillent rien
    private final AtomicReference<PipelineReport> latest = new AtomicReference<>();

    /**
     * Chaîne complète : folds, stacking, méta-modèle, évaluation, grilles, calibration.
     * Toute la configuration est validée avant le premier entraînement.
     */
    public PipelineReport run(GameStateDataset data, PipelineSettings settings) {
        long start = System.currentTimeMillis();
        Dataset dataset = data.dataset();

        List<BaseLearner> learners = learnerRegistry.resolve(settings.getLearners());
        validate(settings, dataset);
        IntRange differentialRange = settings.getDifferentialRange() != null
                ? settings.getDifferentialRange()
                : gridPredictionService.observedDifferentialRange(dataset);

        log.info("🚀 Super learner : {} observations, {} apprenants {}, V={}, méthode {}",
                dataset.size(), learners.size(), settings.getLearners(), settings.getFolds(), settings.getMethod());

        FoldAssignment folds = foldPlanService.assign(dataset.size(), settings.getFolds(), settings.isShuffle(), settings.getSeed());
        StackingResult stacking = stackingService.fit(dataset, learners, folds, settings.getSeed());

        int[] labels = dataset.labels();
        CombinationWeights weights = weightSolverService.solve(stacking.outOfFold(), labels, settings.getMethod(), folds,
                settings.getLoglikMaxIterations(), settings.getLoglikTolerance());
        EnsembleModel ensemble = new EnsembleModel(stacking.fullModels(), weights);
        EvaluationReport evaluation = cvEvaluationService.evaluate(stacking.outOfFold(), labels, folds, weights);

        List<PredictionGridCell> winGrid = gridPredictionService.winSurface(ensemble, settings.getTimeLeftRange(), differentialRange);
        List<TieProbabilityCell> tieGrid = gridPredictionService.tieSurface(ensemble, settings.getTimeLeftRange(), differentialRange);

        List<CalibrationBin> winCalibration = calibrationService.bin(winGrid, data.winRates(), settings.getBinWidth());
        List<CalibrationBin> tieCalibration = calibrationService.bin(
                tieGrid.stream().map(TieProbabilityCell::asGridCell).toList(), data.tieRates(), settings.getBinWidth());
        calibrationService.logReport("VICTOIRE", winCalibration);
        if (!data.tieRates().isEmpty()) {
            calibrationService.logReport("NUL", tieCalibration);
        }

        PipelineReport report = PipelineReport.builder()
                .completedAt(Instant.now())
                .durationMs(System.currentTimeMillis() - start)
                .settings(settings)
                .observationCount(dataset.size())
                .dataset(dataset)
                .folds(folds)
                .outOfFold(stacking.outOfFold())
                .weights(weights)
                .ensemble(ensemble)
                .evaluation(evaluation)
                .differentialRange(differentialRange)
                .winGrid(winGrid)
                .tieGrid(tieGrid)
                .winCalibration(winCalibration)
                .tieCalibration(tieCalibration)
                .build();
        latest.set(report);

        log.info("✅ Super learner terminé en {} ms : cvAUC ensemble={}", report.getDurationMs(),
                String.format("%.4f", evaluation.getEnsemble().getCvAuc()));
        return report;
    }

    public PipelineReport run(PipelineRunRequest request) {
        PipelineSettings settings = resolveSettings(request);
        String path = request != null && request.getDatasetPath() != null ? request.getDatasetPath() : properties.getDatasetPath();
        return run(importDataset(path), settings);
    }

    public PipelineReport runFromConfiguredDataset() {
        return run(importDataset(properties.getDatasetPath()), PipelineSettings.fromProperties(properties));
    }

    public Optional<PipelineReport> latestReport() {
        return Optional.ofNullable(latest.get());
    }

    public PipelineReport requireLatestReport() {
        return latestReport().orElseThrow(ReportNotFoundException::new);
    }

    /**
     * Configuration superlearner.* surchargée champ par champ par la requête.
     */
    public PipelineSettings resolveSettings(PipelineRunRequest request) {
        PipelineSettings base = PipelineSettings.fromProperties(properties);
        if (request == null) return base;

        PipelineSettings.PipelineSettingsBuilder b = base.toBuilder();
        if (request.getFolds() != null) b.folds(request.getFolds());
        if (request.getShuffle() != null) b.shuffle(request.getShuffle());
        if (request.getSeed() != null) b.seed(request.getSeed());
        if (request.getMethod() != null) b.method(request.getMethod());
        if (request.getLearners() != null) b.learners(List.copyOf(request.getLearners()));
        if (request.getBinWidth() != null) b.binWidth(request.getBinWidth());

        if (request.getTimeLeftMin() != null || request.getTimeLeftMax() != null) {
            b.timeLeftRange(IntRange.of(
                    request.getTimeLeftMin() != null ? request.getTimeLeftMin() : base.getTimeLeftRange().min(),
                    request.getTimeLeftMax() != null ? request.getTimeLeftMax() : base.getTimeLeftRange().max()));
        }
        if (request.getDifferentialMin() != null || request.getDifferentialMax() != null) {
            if (request.getDifferentialMin() == null || request.getDifferentialMax() == null) {
                throw new ConfigurationException("differentialMin et differentialMax doivent être fournis ensemble");
            }
            b.differentialRange(IntRange.of(request.getDifferentialMin(), request.getDifferentialMax()));
        }
        return b.build();
    }

    private GameStateDataset importDataset(String path) {
        if (path == null || path.isBlank()) {
            throw new ConfigurationException("Aucun jeu de données : renseigner superlearner.dataset-path ou datasetPath");
        }
        return datasetImportService.importFile(Path.of(path));
    }

    private void validate(PipelineSettings settings, Dataset dataset) {
        if (settings.getMethod() == null) {
            throw new ConfigurationException("Méthode de combinaison non renseignée");
        }
        if (settings.getFolds() < 2 || settings.getFolds() > dataset.size()) {
            throw new ConfigurationException("V=" + settings.getFolds() + " invalide pour " + dataset.size() + " observations");
        }
        if (settings.getLoglikMaxIterations() < 1 || !(settings.getLoglikTolerance() > 0)) {
            throw new ConfigurationException("Critères d'arrêt NNLOGLIK invalides : " + settings.getLoglikMaxIterations()
                    + " itérations, tolérance " + settings.getLoglikTolerance());
        }
        CalibrationService.requireValidBinWidth(settings.getBinWidth());
        if (settings.getTimeLeftRange() == null) {
            throw new ConfigurationException("Plage de temps restant non renseignée");
        }
        settings.getTimeLeftRange().requireValid("temps restant");
        if (settings.getDifferentialRange() != null) {
            settings.getDifferentialRange().requireValid("écart de score");
            if (settings.getDifferentialRange().max() < 0) {
                throw new ConfigurationException("Plage d'écart sans écart positif ou nul : " + settings.getDifferentialRange());
            }
        }
    }
}
