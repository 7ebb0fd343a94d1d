package org.lime.foodrecommender.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Configuration
public class ExecutorConfig {

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService gatewayExecutor(FoodRecommenderProperties properties) {
        return Executors.newFixedThreadPool(
                Math.max(1, properties.getGateway().getThreads()),
                daemonFactory("llm-gateway-"));
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService shardSearchExecutor(FoodRecommenderProperties properties) {
        return Executors.newFixedThreadPool(
                Math.max(1, properties.getRetrieval().getThreads()),
                daemonFactory("shard-search-"));
    }

    private static CustomizableThreadFactory daemonFactory(String prefix) {
        CustomizableThreadFactory factory = new CustomizableThreadFactory(prefix);
        factory.setDaemon(true);
        return factory;
    }
}
