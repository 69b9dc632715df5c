package com.tony.winProbability.learner;

import com.tony.winProbability.exception.ConfigurationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LearnerRegistryTest {

    private final LearnerRegistry registry = new LearnerRegistry(List.of(
            new MeanLearner(), new LogisticRegressionLearner(1e-4), new KNearestNeighborsLearner(5)));

    @Test
    @DisplayName("Les apprenants sont résolus par nom, dans l'ordre demandé")
    void resolvesByNameInRequestedOrder() {
        List<BaseLearner> learners = registry.resolve(List.of("knn", "mean"));

        assertThat(learners).extracting(BaseLearner::name).containsExactly("knn", "mean");
        assertThat(registry.names()).containsExactly("mean", "logistic", "knn");
    }

    @Test
    @DisplayName("Nom inconnu, doublon ou sélection vide : erreur de configuration")
    void rejectsInvalidSelections() {
        assertThatThrownBy(() -> registry.resolve(List.of("gam")))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("gam");
        assertThatThrownBy(() -> registry.resolve(List.of("mean", "mean")))
                .isInstanceOf(ConfigurationException.class);
        assertThatThrownBy(() -> registry.resolve(List.of()))
                .isInstanceOf(ConfigurationException.class);
    }

    @Test
    @DisplayName("Deux beans avec le même nom font échouer le démarrage")
    void duplicateBeanNamesFail() {
        assertThatThrownBy(() -> new LearnerRegistry(List.of(new MeanLearner(), new MeanLearner())))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("mean");
    }
}
