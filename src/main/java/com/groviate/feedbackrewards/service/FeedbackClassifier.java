package com.groviate.feedbackrewards.service;

import com.groviate.feedbackrewards.model.FeedbackClassification;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * Категория и подкатегория отзыва по ключевым словам (поиск подстрок, первое совпадение побеждает).
 */
@Component
public class FeedbackClassifier {

    static final String UI_DESIGN = "UI Design";
    static final String USER_EXPERIENCE = "User Experience";
    static final String CONTENT = "Content";
    static final String FUNCTIONALITY = "Functionality";
    static final String PERFORMANCE = "Performance";
    static final String OTHER = "Other";

    /**
     * @param content         текст отзыва
     * @param declaredCategory категория от автора (может быть null/пустой - тогда определяем сами)
     */
    public FeedbackClassification classify(String content, String declaredCategory) {
        String lower = content == null ? "" : content.toLowerCase(Locale.ROOT);
        String category = (declaredCategory == null || declaredCategory.isBlank())
                ? determineCategory(lower)
                : declaredCategory.trim();
        return new FeedbackClassification(category, determineSubcategory(category, lower));
    }

    String determineCategory(String lower) {
        if (containsAny(lower, "design", "look", "ui", "interface")) return UI_DESIGN;
        if (containsAny(lower, "use", "experience", "ux", "flow")) return USER_EXPERIENCE;
        if (containsAny(lower, "text", "content", "wording", "message")) return CONTENT;
        if (containsAny(lower, "function", "feature", "work", "bug")) return FUNCTIONALITY;
        if (containsAny(lower, "slow", "fast", "speed", "performance")) return PERFORMANCE;
        return OTHER;
    }

    String determineSubcategory(String category, String lower) {
        switch (category) {
            case UI_DESIGN -> {
                if (containsAny(lower, "color", "theme")) return "Color Scheme";
                if (containsAny(lower, "button", "icon")) return "UI Elements";
                if (containsAny(lower, "layout", "position")) return "Layout";
                return "General Design";
            }
            case USER_EXPERIENCE -> {
                if (containsAny(lower, "navigation", "menu")) return "Navigation";
                if (containsAny(lower, "form", "input")) return "Forms & Inputs";
                if (containsAny(lower, "flow", "process")) return "User Flow";
                return "General UX";
            }
            case FUNCTIONALITY -> {
                if (containsAny(lower, "bug", "error")) return "Bug Report";
                if (containsAny(lower, "feature", "add")) return "Feature Request";
                return "General Functionality";
            }
            default -> {
                return "General Feedback";
            }
        }
    }

    private static boolean containsAny(String text, String... needles) {
        for (String needle : needles) {
            if (text.contains(needle)) return true;
        }
        return false;
    }
}
