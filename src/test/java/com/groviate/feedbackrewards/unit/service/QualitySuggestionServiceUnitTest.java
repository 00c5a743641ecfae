package com.groviate.feedbackrewards.unit.service;

import com.groviate.feedbackrewards.model.QualityMetrics;
import com.groviate.feedbackrewards.model.QualitySuggestion;
import com.groviate.feedbackrewards.service.QualitySuggestionService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class QualitySuggestionServiceUnitTest {

    private final QualitySuggestionService service = new QualitySuggestionService();

    @Test
    @DisplayName("Все метрики низкие и тон негативный -> четыре подсказки в фиксированном порядке")
    void givenAllLowMetricsWhenSuggestThenFourSuggestions() {
        List<QualitySuggestion> suggestions = service.suggest(new QualityMetrics(0.1, 0.2, 0.3, -0.8));

        assertThat(suggestions)
                .extracting(QualitySuggestion::metric)
                .containsExactly("specificity", "actionability", "novelty", "sentiment");
        assertThat(suggestions).allSatisfy(s -> assertThat(s.examples()).hasSize(3));
    }

    @Test
    @DisplayName("Хорошие оценки -> подсказок нет")
    void givenGoodMetricsWhenSuggestThenEmpty() {
        assertThat(service.suggest(new QualityMetrics(0.9, 0.7, 0.6, 0.2))).isEmpty();
        assertThat(service.suggest(null)).isEmpty();
    }

    @Test
    @DisplayName("Порог 0.4 строгий: ровно 0.4 подсказку не вызывает")
    void givenScoreExactlyAtThresholdWhenSuggestThenNoSuggestion() {
        assertThat(service.suggest(new QualityMetrics(0.4, 0.39, 0.4, -0.3)))
                .extracting(QualitySuggestion::metric)
                .containsExactly("actionability");
    }
}
