package com.tony.winProbability.controller;

import com.tony.winProbability.learner.LearnerRegistry;
import com.tony.winProbability.model.CalibrationBin;
import com.tony.winProbability.model.PipelineReport;
import com.tony.winProbability.model.PredictionGridCell;
import com.tony.winProbability.model.TieProbabilityCell;
import com.tony.winProbability.model.dto.OutOfFoldPredictionsResponse;
import com.tony.winProbability.model.dto.PipelineRunRequest;
import com.tony.winProbability.model.dto.PipelineSummary;
import com.tony.winProbability.service.SuperLearnerOrchestrator;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Set;

@RestController
@RequestMapping("/api/v1/superlearner")
@RequiredArgsConstructor
@Slf4j
public class SuperLearnerController {

    private final SuperLearnerOrchestrator orchestrator;
    private final LearnerRegistry learnerRegistry;

    /**
     * Lance un run complet. Corps optionnel : surcharges de superlearner.* et chemin du CSV.
     */
    @PostMapping("/run")
    public ResponseEntity<PipelineSummary> run(@Valid @RequestBody(required = false) PipelineRunRequest request) {
        log.info("🚀 Run super learner demandé via l'API");
        PipelineReport report = orchestrator.run(request);
        return ResponseEntity.ok(PipelineSummary.from(report));
    }

    @GetMapping("/latest")
    public ResponseEntity<PipelineSummary> latest() {
        return ResponseEntity.ok(PipelineSummary.from(orchestrator.requireLatestReport()));
    }

    @GetMapping("/latest/oof-predictions")
    public ResponseEntity<OutOfFoldPredictionsResponse> outOfFoldPredictions() {
        return ResponseEntity.ok(OutOfFoldPredictionsResponse.from(orchestrator.requireLatestReport()));
    }

    @GetMapping("/latest/grid/win")
    public ResponseEntity<List<PredictionGridCell>> winGrid() {
        return ResponseEntity.ok(orchestrator.requireLatestReport().getWinGrid());
    }

    @GetMapping("/latest/grid/tie")
    public ResponseEntity<List<TieProbabilityCell>> tieGrid() {
        return ResponseEntity.ok(orchestrator.requireLatestReport().getTieGrid());
    }

    @GetMapping("/latest/calibration/win")
    public ResponseEntity<List<CalibrationBin>> winCalibration() {
        return ResponseEntity.ok(orchestrator.requireLatestReport().getWinCalibration());
    }

    @GetMapping("/latest/calibration/tie")
    public ResponseEntity<List<CalibrationBin>> tieCalibration() {
        return ResponseEntity.ok(orchestrator.requireLatestReport().getTieCalibration());
    }

    @GetMapping("/learners")
    public ResponseEntity<Set<String>> learners() {
        return ResponseEntity.ok(learnerRegistry.names());
    }
}
