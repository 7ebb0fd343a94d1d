package org.lime.foodrecommender.config;

import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;
import org.lime.foodrecommender.ai.GatewayException;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class ResilienceConfig {

    @Bean
    public TimeLimiter gatewayTimeLimiter(FoodRecommenderProperties properties) {
        return TimeLimiter.of("llm-gateway", TimeLimiterConfig.custom()
                .timeoutDuration(properties.getGateway().getTimeout())
                .cancelRunningFuture(true)
                .build());
    }

    @Bean
    public Retry gatewayRetry(FoodRecommenderProperties properties) {
        FoodRecommenderProperties.Gateway gateway = properties.getGateway();
        return Retry.of("llm-gateway", RetryConfig.custom()
                .maxAttempts(Math.max(1, gateway.getMaxAttempts()))
                .waitDuration(gateway.getRetryBackoff())
                .retryOnException(e -> e instanceof GatewayException failure && failure.isRetryable())
                .build());
    }

    // permits are taken per attempt, retries included
    @Bean
    public RateLimiter gatewayRateLimiter(FoodRecommenderProperties properties) {
        FoodRecommenderProperties.RateLimit limit = properties.getGateway().getRateLimit();
        return RateLimiter.of("llm-gateway", RateLimiterConfig.custom()
                .limitForPeriod(Math.max(1, limit.getLimitForPeriod()))
                .limitRefreshPeriod(limit.getRefreshPeriod())
                .timeoutDuration(limit.getPermitWait())
                .build());
    }
}
