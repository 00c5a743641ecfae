package com.groviate.feedbackrewards.model;

/**
 * Оценки качества текста отзыва.
 * specificity, actionability, novelty в [0, 1], sentiment в [-1, 1].
 */
public record QualityMetrics(double specificity,
                             double actionability,
                             double novelty,
                             double sentiment) {

    private static final QualityMetrics NEUTRAL = new QualityMetrics(0.5, 0.5, 0.5, 0.0);

    /**
     * Нейтральные оценки, если не сработал ни один способ анализа.
     */
    public static QualityMetrics neutral() {
        return NEUTRAL;
    }

    /**
     * Приводит значения к допустимым диапазонам.
     *
     * @throws IllegalArgumentException если какое-либо значение NaN
     */
    public static QualityMetrics clamped(double specificity, double actionability, double novelty, double sentiment) {
        if (Double.isNaN(specificity) || Double.isNaN(actionability)
                || Double.isNaN(novelty) || Double.isNaN(sentiment)) {
            throw new IllegalArgumentException("Quality score is NaN");
        }
        return new QualityMetrics(
                clamp(specificity, 0.0, 1.0),
                clamp(actionability, 0.0, 1.0),
                clamp(novelty, 0.0, 1.0),
                clamp(sentiment, -1.0, 1.0)
        );
    }

    /**
     * Среднее трёх оценок (specificity + actionability + novelty) / 3.
     */
    public double qualityScore() {
        return (specificity + actionability + novelty) / 3.0;
    }

    private static double clamp(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }
}
