package com.groviate.feedbackrewards.dto;

import com.groviate.feedbackrewards.model.QualityMetrics;
import com.groviate.feedbackrewards.model.QualitySuggestion;

import java.util.List;

/**
 * Предпросмотр оценки качества без сохранения отзыва.
 *
 * @param qualityPoints бонус, который получит отзыв (без базовых очков)
 */
public record QualityPreviewResponse(
        QualityMetrics metrics,
        double qualityScore,
        int qualityPoints,
        String category,
        String subcategory,
        List<QualitySuggestion> suggestions
) {
}
