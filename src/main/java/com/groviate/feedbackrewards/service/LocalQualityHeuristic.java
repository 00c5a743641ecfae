package com.groviate.feedbackrewards.service;

import com.groviate.feedbackrewards.model.QualityMetrics;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Детерминированная локальная оценка качества отзыва.
 * <p>
 * Используется, когда внешняя оценка недоступна. Чистая функция без I/O:
 * <ul>
 *   <li>specificity = min(0.5 + wordCount / 100, 0.9)</li>
 *   <li>actionability = 0.7, если в тексте есть "should", "could" или "would" (подстрока), иначе 0.5</li>
 *   <li>novelty = 0.6 (эвристике не на что опереться)</li>
 *   <li>sentiment = (positive - negative) / max(1, positive + negative)</li>
 * </ul>
 */
@Component
public class LocalQualityHeuristic {

    static final double BASE_SPECIFICITY = 0.5;
    static final double MAX_SPECIFICITY = 0.9;
    static final double WORDS_PER_SPECIFICITY_UNIT = 100.0;
    static final double ACTIONABLE_SCORE = 0.7;
    static final double NON_ACTIONABLE_SCORE = 0.5;
    static final double FIXED_NOVELTY = 0.6;

    private static final Pattern NON_WORD = Pattern.compile("\\W+");

    private static final Set<String> POSITIVE_WORDS = Set.of(
            "good", "great", "excellent", "amazing", "love", "like", "helpful", "useful", "impressive"
    );

    private static final Set<String> NEGATIVE_WORDS = Set.of(
            "bad", "poor", "terrible", "awful", "hate", "dislike", "confusing", "difficult", "frustrating"
    );

    private static final String[] ACTION_MARKERS = {"should", "could", "would"};

    public QualityMetrics analyze(String content) {
        String text = content == null ? "" : content.toLowerCase(Locale.ROOT);

        int wordCount = 0;
        int positiveCount = 0;
        int negativeCount = 0;

        for (String token : NON_WORD.split(text)) {
            if (token.isEmpty()) continue; // split даёт пустой первый токен на ведущем разделителе
            wordCount++;
            if (POSITIVE_WORDS.contains(token)) {
                positiveCount++;
            } else if (NEGATIVE_WORDS.contains(token)) {
                negativeCount++;
            }
        }

        double specificity = Math.min(BASE_SPECIFICITY + wordCount / WORDS_PER_SPECIFICITY_UNIT, MAX_SPECIFICITY);
        double actionability = containsActionMarker(text) ? ACTIONABLE_SCORE : NON_ACTIONABLE_SCORE;
        double sentiment = (double) (positiveCount - negativeCount) / Math.max(1, positiveCount + negativeCount);

        return new QualityMetrics(specificity, actionability, FIXED_NOVELTY, sentiment);
    }

    private boolean containsActionMarker(String lowerText) {
        for (String marker : ACTION_MARKERS) {
            if (lowerText.contains(marker)) {
                return true;
            }
        }
        return false;
    }
}
