package com.tony.winProbability.config;

import com.tony.winProbability.model.CombinationMethod;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

@Configuration
@ConfigurationProperties(prefix = "superlearner")
@Data
public class SuperLearnerProperties {
    // --- Validation croisée ---
    private int folds = 10;
    private boolean shuffle = false;
    private long seed = 2024L;

    // --- Méta-modèle ---
    private CombinationMethod method = CombinationMethod.NNLOGLIK;
    private int loglikMaxIterations = 100_000;
    private double loglikTolerance = 1e-12;

    // --- Apprenants (résolus par nom dans le LearnerRegistry) ---
    private List<String> learners = new ArrayList<>(List.of("mean", "logistic", "knn"));
    private int knnNeighbors = 25;
    private double logisticRidge = 1e-4;

    // --- Grille d'états de match ---
    private int timeLeftMin = 0;
    private int timeLeftMax = 60;
    // Null = déduit des écarts observés dans les données
    private Integer differentialMin;
    private Integer differentialMax;

    // --- Calibration ---
    // 1e-7 dans l'analyse d'origine (quasi un point par tranche), 0.01 pour une courbe lissée
    private double binWidth = 0.01;

    // --- Exécution ---
    private int workerThreads = 4;
    private String datasetPath;
    private String refreshCron = "-";
}
