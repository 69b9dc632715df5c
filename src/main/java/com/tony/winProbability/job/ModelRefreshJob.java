package com.tony.winProbability.job;

import com.tony.winProbability.config.SuperLearnerProperties;
import com.tony.winProbability.service.SuperLearnerOrchestrator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@Slf4j
public class ModelRefreshJob {

    private final SuperLearnerOrchestrator orchestrator;
    private final SuperLearnerProperties properties;

    /**
     * Ré-import du CSV configuré et ré-entraînement complet.
     * Désactivé par défaut (cron "-") ; exemple : superlearner.refresh-cron=0 0 6 * * *
     */
    @Scheduled(cron = "${superlearner.refresh-cron:-}")
    public void refreshModel() {
        if (properties.getDatasetPath() == null || properties.getDatasetPath().isBlank()) {
            log.warn("⏰ [CRON] Aucun superlearner.dataset-path configuré, ré-entraînement ignoré");
            return;
        }
        log.info("⏰ [CRON] Démarrage automatique : ré-entraînement du super learner...");
        try {
            orchestrator.runFromConfiguredDataset();
            log.info("✅ [CRON] Super learner ré-entraîné avec succès.");
        } catch (Exception e) {
            log.error("❌ [CRON] Echec du ré-entraînement du super learner", e);
        }
    }
}
