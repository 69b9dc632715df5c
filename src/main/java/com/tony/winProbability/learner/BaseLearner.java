package com.tony.winProbability.learner;

/**
 * Contrat commun à tous les algorithmes de base du super learner.
 * Chaque implémentation Spring est enregistrée sous son {@link #name()} dans le {@link LearnerRegistry}.
 */
public interface BaseLearner {

    String name();

    /**
     * Entraîne un modèle sur les lignes fournies.
     *
     * @param features matrice n x p (copie propre à l'appel, peut être lue sans verrou)
     * @param labels   labels 0/1
     * @param seed     graine explicite pour les apprenants stochastiques
     */
    TrainedModel train(double[][] features, int[] labels, long seed);
}
