package com.groviate.feedbackrewards.service;

import com.groviate.feedbackrewards.config.FeedbackRewardsProperties;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.Resource;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;

/**
 * Промпты для внешней оценки качества отзыва.
 * Шаблоны лежат в src/main/resources/prompts/ и читаются один раз при старте.
 */
@Service
@Slf4j
public class QualityPromptService {

    @Getter
    private final String systemPrompt;
    private final String userPromptTemplate;
    private final FeedbackRewardsProperties props;

    /**
     * @throws IllegalStateException если файлы промптов не найдены
     */
    public QualityPromptService(
            @Value("classpath:prompts/quality-system-prompt.txt") Resource systemPromptResource,
            @Value("classpath:prompts/quality-user-prompt.txt") Resource userPromptTemplateResource,
            FeedbackRewardsProperties props
    ) {
        this.props = props;

        try {
            this.systemPrompt = systemPromptResource.getContentAsString(StandardCharsets.UTF_8);
            this.userPromptTemplate = userPromptTemplateResource.getContentAsString(StandardCharsets.UTF_8);
            log.info("Промпты оценки качества загружены: system={} символов, user={} символов",
                    systemPrompt.length(), userPromptTemplate.length());
        } catch (Exception e) {
            log.error("Не удалось загрузить промпты из файлов", e);
            throw new IllegalStateException("""
                    Не удалось загрузить промпты из resources/prompts/
                    Проверь что существуют файлы:
                    - src/main/resources/prompts/quality-system-prompt.txt
                    - src/main/resources/prompts/quality-user-prompt.txt
                    """, e);
        }
    }

    /**
     * Подставляет текст отзыва в шаблон, обрезая его по лимиту.
     */
    public String prepareUserPrompt(String feedback) {
        String text = feedback == null ? "" : feedback;
        int max = props.getQuality().getMaxPromptContentChars();
        if (text.length() > max) {
            text = text.substring(0, max);
        }
        return userPromptTemplate.replace("{feedback}", text);
    }
}
