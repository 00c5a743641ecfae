package com.groviate.feedbackrewards.integration.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.groviate.feedbackrewards.config.FeedbackRewardsProperties;
import com.groviate.feedbackrewards.exception.QualityScoringException;
import com.groviate.feedbackrewards.exception.QualityScoringRejectedException;
import com.groviate.feedbackrewards.health.QualityScoringHealthIndicator;
import com.groviate.feedbackrewards.model.QualityMetrics;
import com.groviate.feedbackrewards.service.AiChatGateway;
import com.groviate.feedbackrewards.service.FeedbackQualityAnalyzer;
import com.groviate.feedbackrewards.service.LocalQualityHeuristic;
import com.groviate.feedbackrewards.service.QualityPromptService;
import com.groviate.feedbackrewards.service.RemoteQualityScoringService;
import com.groviate.feedbackrewards.service.RewardMetricsService;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.aop.support.AopUtils;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.SpringBootConfiguration;
import org.springframework.boot.actuate.health.Status;
import org.springframework.boot.autoconfigure.EnableAutoConfiguration;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.context.bean.override.mockito.MockitoBean;

import java.util.concurrent.Executor;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Проверяет, что @CircuitBreaker на внешней оценке реально работает через AOP-прокси
 * и что при открытом breaker'е анализ качества уходит на локальную эвристику.
 */
@SpringBootTest(classes = QualityScoringCircuitBreakerIntegrationTest.TestApp.class)
@TestPropertySource(properties = {
        "feedback-rewards.quality.remote-enabled=true",
        "resilience4j.circuitbreaker.instances.quality-scoring.sliding-window-type=COUNT_BASED",
        "resilience4j.circuitbreaker.instances.quality-scoring.sliding-window-size=1",
        "resilience4j.circuitbreaker.instances.quality-scoring.minimum-number-of-calls=1",
        "resilience4j.circuitbreaker.instances.quality-scoring.failure-rate-threshold=1",
        "resilience4j.circuitbreaker.instances.quality-scoring.wait-duration-in-open-state=60s"
})
class QualityScoringCircuitBreakerIntegrationTest {

    private static final String TEXT = "The checkout form should remember my address";

    @SpringBootConfiguration
    @EnableAutoConfiguration
    @Import({
            RemoteQualityScoringService.class,
            FeedbackQualityAnalyzer.class,
            LocalQualityHeuristic.class,
            FeedbackRewardsProperties.class,
            QualityScoringHealthIndicator.class
    })
    static class TestApp {
        @Bean
        ObjectMapper objectMapper() {
            return new ObjectMapper();
        }

        @Bean(name = "scoringExecutor")
        Executor scoringExecutor() {
            return Executors.newFixedThreadPool(2);
        }
    }

    @MockitoBean
    AiChatGateway aiChatGateway;
    @MockitoBean
    QualityPromptService promptService;
    @MockitoBean
    RewardMetricsService metrics;

    @Autowired
    RemoteQualityScoringService remoteScoringService;
    @Autowired
    FeedbackQualityAnalyzer analyzer;
    @Autowired
    QualityScoringHealthIndicator healthIndicator;
    @Autowired
    CircuitBreakerRegistry circuitBreakerRegistry;

    @BeforeEach
    void setUp() {
        circuitBreakerRegistry.circuitBreaker(RemoteQualityScoringService.CIRCUIT_BREAKER_NAME).reset();

        when(promptService.getSystemPrompt()).thenReturn("SYS");
        when(promptService.prepareUserPrompt(anyString())).thenReturn("USER");
    }

    @Test
    @DisplayName("Модель падает -> эвристика, breaker открывается, второй вызов модель не трогает")
    void givenModelFailsWhenAnalyzeThenHeuristicUsedAndBreakerOpens() {
        assertThat(AopUtils.isAopProxy(remoteScoringService))
                .as("RemoteQualityScoringService должен быть AOP proxy, иначе @CircuitBreaker не работает")
                .isTrue();

        when(aiChatGateway.ask("SYS", "USER")).thenThrow(new QualityScoringException("HTTP 503"));
        QualityMetrics expected = new LocalQualityHeuristic().analyze(TEXT);

        QualityMetrics first = analyzer.analyze(TEXT);

        assertThat(first).isEqualTo(expected);
        CircuitBreaker cb = circuitBreakerRegistry.circuitBreaker(RemoteQualityScoringService.CIRCUIT_BREAKER_NAME);
        assertThat(cb.getState()).isEqualTo(CircuitBreaker.State.OPEN);
        assertThat(healthIndicator.health().getStatus()).isEqualTo(Status.OUT_OF_SERVICE);

        QualityMetrics second = analyzer.analyze(TEXT);

        assertThat(second).isEqualTo(expected);
        verify(aiChatGateway, times(1)).ask("SYS", "USER");
        verify(metrics, times(2)).markAnalysisFallback();
    }

    @Test
    @DisplayName("Модель отклонила запрос -> эвристика, но breaker остаётся закрытым")
    void givenModelRejectsWhenAnalyzeThenHeuristicUsedAndBreakerStaysClosed() {
        when(aiChatGateway.ask("SYS", "USER"))
                .thenThrow(new QualityScoringRejectedException("invalid api key", new RuntimeException("401")));

        QualityMetrics result = analyzer.analyze(TEXT);

        assertThat(result).isEqualTo(new LocalQualityHeuristic().analyze(TEXT));
        CircuitBreaker cb = circuitBreakerRegistry.circuitBreaker(RemoteQualityScoringService.CIRCUIT_BREAKER_NAME);
        assertThat(cb.getState()).isEqualTo(CircuitBreaker.State.CLOSED);
        assertThat(healthIndicator.health().getStatus()).isEqualTo(Status.UP);
    }

    @Test
    @DisplayName("Модель ответила -> её оценки, breaker закрыт")
    void givenModelAnswersWhenAnalyzeThenRemoteMetricsUsed() {
        when(aiChatGateway.ask("SYS", "USER"))
                .thenReturn("{\"specificity\":0.9,\"actionability\":0.9,\"novelty\":0.7,\"sentiment\":0.1}");

        QualityMetrics result = analyzer.analyze(TEXT);

        assertThat(result).isEqualTo(new QualityMetrics(0.9, 0.9, 0.7, 0.1));
        verify(metrics).markAnalysisRemote();
    }
}
