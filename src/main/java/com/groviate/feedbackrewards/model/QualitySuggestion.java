package com.groviate.feedbackrewards.model;

import java.util.List;

/**
 * Подсказка, как улучшить отзыв по конкретной метрике.
 */
public record QualitySuggestion(String metric, String suggestion, List<String> examples) {
}
