package com.groviate.feedbackrewards.service;

import com.groviate.feedbackrewards.model.QualityMetrics;
import org.springframework.stereotype.Component;

/**
 * Перевод оценок качества в бонусные очки. Чистая функция.
 * Базовые очки за отзыв ({@link #BASE_SUBMISSION_POINTS}) добавляет вызывающий код.
 */
@Component
public class QualityPointsCalculator {

    public static final int BASE_SUBMISSION_POINTS = 10;
    public static final double MIN_QUALITY_FOR_BONUS = 0.6;
    public static final int MAX_QUALITY_POINTS = 25;

    public int calculate(QualityMetrics metrics) {
        if (metrics == null) return 0;

        double qualityScore = metrics.qualityScore();
        if (Double.isNaN(qualityScore) || qualityScore < MIN_QUALITY_FOR_BONUS) {
            return 0;
        }

        long bonus = Math.round(qualityScore * MAX_QUALITY_POINTS);
        return (int) Math.max(0, Math.min(MAX_QUALITY_POINTS, bonus));
    }
}
