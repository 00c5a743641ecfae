package com.groviate.feedbackrewards.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.groviate.feedbackrewards.config.FeedbackRewardsProperties;
import com.groviate.feedbackrewards.exception.QualityScoringException;
import com.groviate.feedbackrewards.exception.QualityScoringRejectedException;
import com.groviate.feedbackrewards.model.QualityMetrics;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Внешняя оценка качества отзыва через модель.
 * <p>
 * Процесс:
 * 1. Собрать промпт через {@link QualityPromptService}
 * 2. Вызвать {@link AiChatGateway} в scoringExecutor с жёстким таймаутом
 * 3. Вытащить из ответа первый JSON-объект и распарсить четыре оценки
 * 4. Привести значения к допустимым диапазонам
 * <p>
 * Любая ошибка считается провалом circuit breaker'а и уходит в fallback,
 * который возвращает пустой результат (вызывающий переходит на локальную эвристику).
 */
@Service
@Slf4j
public class RemoteQualityScoringService {

    public static final String CIRCUIT_BREAKER_NAME = "quality-scoring";

    private static final String[] REQUIRED_FIELDS = {"specificity", "actionability", "novelty", "sentiment"};

    private final AiChatGateway aiChatGateway;
    private final QualityPromptService promptService;
    private final ObjectMapper objectMapper;
    private final FeedbackRewardsProperties props;
    private final Executor scoringExecutor;

    public RemoteQualityScoringService(AiChatGateway aiChatGateway,
                                       QualityPromptService promptService,
                                       ObjectMapper objectMapper,
                                       FeedbackRewardsProperties props,
                                       @Qualifier("scoringExecutor") Executor scoringExecutor) {
        this.aiChatGateway = aiChatGateway;
        this.promptService = promptService;
        this.objectMapper = objectMapper;
        this.props = props;
        this.scoringExecutor = scoringExecutor;
    }

    /**
     * @param content текст отзыва
     * @return оценки модели или пустой Optional, если модель недоступна / circuit breaker открыт
     */
    @CircuitBreaker(name = CIRCUIT_BREAKER_NAME, fallbackMethod = "scoreFallback")
    public Optional<QualityMetrics> score(String content) {
        String systemPrompt = promptService.getSystemPrompt();
        String userPrompt = promptService.prepareUserPrompt(content);

        String response = askWithTimeout(systemPrompt, userPrompt);
        if (response == null || response.isBlank()) {
            throw new QualityScoringException("Модель вернула пустой ответ");
        }

        return Optional.of(parseScores(response));
    }

    private String askWithTimeout(String systemPrompt, String userPrompt) {
        long timeoutMs = props.getQuality().getScoringTimeoutMs();
        CompletableFuture<String> future =
                CompletableFuture.supplyAsync(() -> aiChatGateway.ask(systemPrompt, userPrompt), scoringExecutor);
        try {
            return future.get(timeoutMs, TimeUnit.MILLISECONDS);

        } catch (TimeoutException e) {
            // поток пула держит HTTP-вызов до read-timeout клиента
            future.cancel(true);
            throw new QualityScoringException("Оценка качества не уложилась в " + timeoutMs + " мс", e);

        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new QualityScoringException("Ожидание оценки качества прервано", e);

        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof QualityScoringRejectedException rejected) {
                throw rejected;
            }
            if (cause instanceof QualityScoringException scoring) {
                throw scoring;
            }
            throw new QualityScoringException("Ошибка внешней оценки качества", cause);
        }
    }

    /**
     * Парсит ответ модели. Отсутствующее поле или нечисловое значение = ошибка ответа.
     */
    QualityMetrics parseScores(String raw) {
        String json = extractJsonObject(raw);
        if (json == null) {
            throw new QualityScoringException("В ответе модели нет JSON-объекта");
        }

        try {
            JsonNode node = objectMapper.readTree(json);
            for (String field : REQUIRED_FIELDS) {
                JsonNode value = node.get(field);
                if (value == null || !value.isNumber()) {
                    throw new QualityScoringException("В ответе модели нет числового поля " + field);
                }
            }
            return QualityMetrics.clamped(
                    node.get("specificity").asDouble(),
                    node.get("actionability").asDouble(),
                    node.get("novelty").asDouble(),
                    node.get("sentiment").asDouble()
            );
        } catch (QualityScoringException e) {
            throw e;
        } catch (Exception e) {
            throw new QualityScoringException("Не удалось разобрать ответ модели", e);
        }
    }

    /**
     * Извлекает первый JSON-объект из произвольного текста
     * (модель иногда оборачивает ответ в markdown или пояснения).
     */
    private String extractJsonObject(String raw) {
        if (raw == null) return null;
        String s = raw.trim();

        int start = s.indexOf('{');
        if (start < 0) return null;

        int end = findJsonEnd(s, start);
        if (end < 0) return null;

        return s.substring(start, end + 1);
    }

    private int findJsonEnd(String s, int start) {
        boolean inString = false;
        boolean escaped = false;
        int depth = 0;

        for (int i = start; i < s.length(); i++) {
            char c = s.charAt(i);

            if (escaped) {
                escaped = false;
                continue;
            }
            if (c == '\\') {
                escaped = true;
                continue;
            }
            if (c == '"') {
                inString = !inString;
                continue;
            }
            if (inString) continue;

            if (c == '{') {
                depth++;
            } else if (c == '}') {
                depth--;
                if (depth == 0) return i;
            }
        }
        return -1;
    }

    /**
     * Fallback для {@link #score(String)}: модель недоступна, ответ битый или circuit breaker открыт.
     * Оценка никогда не роняет конвейер, поэтому здесь глушатся и non-retryable ошибки.
     */
    @SuppressWarnings("unused")
    private Optional<QualityMetrics> scoreFallback(String content, Throwable t) {
        if (t instanceof QualityScoringRejectedException) {
            log.error("Модель отклонила запрос оценки, используем локальную эвристику: {}", safeMsg(t));
        } else {
            log.warn("Внешняя оценка недоступна, используем локальную эвристику: {}", safeMsg(t));
        }
        return Optional.empty();
    }

    private String safeMsg(Throwable t) {
        if (t == null) return "unknown";
        String m = t.getMessage();
        if (m == null) return t.getClass().getSimpleName();
        return (m.length() > 200) ? m.substring(0, 200) : m;
    }
}
