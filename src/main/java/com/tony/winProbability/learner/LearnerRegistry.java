package com.tony.winProbability.learner;

import com.tony.winProbability.exception.ConfigurationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Table de correspondance nom -> apprenant, alimentée par tous les beans {@link BaseLearner}.
 */
@Component
@Slf4j
public class LearnerRegistry {

    private final Map<String, BaseLearner> learners;

    public LearnerRegistry(List<BaseLearner> available) {
        Map<String, BaseLearner> byName = new LinkedHashMap<>();
        for (BaseLearner learner : available) {
            if (byName.put(learner.name(), learner) != null) {
                throw new ConfigurationException("Deux apprenants partagent le nom '" + learner.name() + "'");
            }
        }
        this.learners = Collections.unmodifiableMap(byName);
        log.info("🧩 Apprenants disponibles : {}", learners.keySet());
    }

    public Set<String> names() {
        return learners.keySet();
    }

    /**
     * Résout une sélection d'apprenants par nom, dans l'ordre demandé.
     */
    public List<BaseLearner> resolve(List<String> names) {
        if (names == null || names.isEmpty()) {
            throw new ConfigurationException("Aucun apprenant sélectionné");
        }
        Set<String> seen = new HashSet<>();
        List<BaseLearner> selected = new ArrayList<>(names.size());
        for (String name : names) {
            if (!seen.add(name)) {
                throw new ConfigurationException("Apprenant sélectionné deux fois : " + name);
            }
            BaseLearner learner = learners.get(name);
            if (learner == null) {
                throw new ConfigurationException("Apprenant inconnu : '" + name + "' (disponibles : " + learners.keySet() + ")");
            }
            selected.add(learner);
        }
        return selected;
    }
}
