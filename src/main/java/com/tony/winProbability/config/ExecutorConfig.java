package com.tony.winProbability.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
public class ExecutorConfig {

    /**
     * Pool des unités (apprenant, fold) du stacking. Arrêté à la fermeture du contexte.
     */
    @Bean(destroyMethod = "shutdown")
    public ExecutorService stackingExecutor(SuperLearnerProperties properties) {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newFixedThreadPool(Math.max(1, properties.getWorkerThreads()), r -> {
            Thread t = new Thread(r);
            t.setName("stacking-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }
}
