package com.groviate.feedbackrewards.service;

import com.groviate.feedbackrewards.exception.QualityScoringException;
import com.groviate.feedbackrewards.exception.QualityScoringRejectedException;
import io.github.resilience4j.retry.annotation.Retry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.retry.NonTransientAiException;
import org.springframework.stereotype.Service;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.reactive.function.client.WebClientResponseException;

/**
 * Шлюз к модели через Spring AI {@link ChatClient}.
 * <p>
 * Non-retryable ошибки (4xx, кроме 408/429, и NonTransientAiException) пробрасываются как
 * {@link QualityScoringRejectedException}, остальные считаются временными и оборачиваются
 * в {@link QualityScoringException}.
 */
@Service
@Slf4j
public class OpenAiChatGateway implements AiChatGateway {

    private final ChatClient chatClient;

    public OpenAiChatGateway(ChatClient chatClient) {
        this.chatClient = chatClient;
    }

    /**
     * Выполняет запрос к модели и возвращает текст ответа.
     * Обёрнут {@link Retry} (name = {@code quality-scoring}).
     *
     * @throws QualityScoringRejectedException запрос отклонён, повтор не поможет
     * @throws QualityScoringException         временная ошибка
     */
    @Override
    @Retry(name = "quality-scoring")
    public String ask(String systemPrompt, String userPrompt) {
        try {
            return chatClient.prompt()
                    .system(systemPrompt)
                    .user(userPrompt)
                    .call()
                    .content();

        } catch (NonTransientAiException e) {
            throw new QualityScoringRejectedException("Model non-transient error: " + safeMsg(e), e);

        } catch (HttpClientErrorException e) {
            int code = e.getStatusCode().value();
            if (isNonRetryable4xx(code)) {
                throw new QualityScoringRejectedException("Model rejected request (HTTP " + code + ")", e);
            }
            throw new QualityScoringException("Model transient client error (HTTP " + code + ")", e);

        } catch (WebClientResponseException e) {
            int code = e.getStatusCode().value();
            if (isNonRetryable4xx(code)) {
                throw new QualityScoringRejectedException("Model rejected request (HTTP " + code + ")", e);
            }
            throw new QualityScoringException("Model error (HTTP " + code + ")", e);

        } catch (Exception e) {
            // timeouts, IO, 5xx без статуса
            throw new QualityScoringException("Ошибка обращения к модели оценки", e);
        }
    }

    private boolean isNonRetryable4xx(int statusCode) {
        if (statusCode < 400 || statusCode >= 500) {
            return false;
        }
        return statusCode != 429 && statusCode != 408;
    }

    private String safeMsg(Throwable t) {
        if (t == null) return "unknown";
        String m = t.getMessage();
        if (m == null) return t.getClass().getSimpleName();
        return (m.length() > 200) ? m.substring(0, 200) : m;
    }
}
