package com.groviate.feedbackrewards.service;

import com.groviate.feedbackrewards.model.QualityMetrics;
import com.groviate.feedbackrewards.model.QualitySuggestion;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Подсказки автору: что улучшить в отзыве, чтобы получить бонус за качество.
 */
@Service
public class QualitySuggestionService {

    static final double LOW_SCORE_THRESHOLD = 0.4;
    static final double NEGATIVE_SENTIMENT_THRESHOLD = -0.3;

    public List<QualitySuggestion> suggest(QualityMetrics metrics) {
        List<QualitySuggestion> suggestions = new ArrayList<>();
        if (metrics == null) return suggestions;

        if (metrics.specificity() < LOW_SCORE_THRESHOLD) {
            suggestions.add(new QualitySuggestion(
                    "specificity",
                    "Add more specific details about what you observed",
                    List.of(
                            "Mention specific elements or features you're providing feedback on",
                            "Include exact steps to reproduce an issue",
                            "Reference specific sections or pages")));
        }

        if (metrics.actionability() < LOW_SCORE_THRESHOLD) {
            suggestions.add(new QualitySuggestion(
                    "actionability",
                    "Include clear suggestions for improvement",
                    List.of(
                            "Suggest specific changes that would address your concerns",
                            "Provide alternative approaches or solutions",
                            "Explain how your suggestions would improve the experience")));
        }

        if (metrics.novelty() < LOW_SCORE_THRESHOLD) {
            suggestions.add(new QualitySuggestion(
                    "novelty",
                    "Try to provide unique insights not mentioned before",
                    List.of(
                            "Review existing feedback to avoid duplication",
                            "Consider different use cases or perspectives",
                            "Share personal experiences that provide new context")));
        }

        if (metrics.sentiment() < NEGATIVE_SENTIMENT_THRESHOLD) {
            suggestions.add(new QualitySuggestion(
                    "sentiment",
                    "Consider using more constructive language",
                    List.of(
                            "Focus on the issue rather than assigning blame",
                            "Balance criticism with positive observations",
                            "Use neutral language to describe problems")));
        }

        return suggestions;
    }
}
