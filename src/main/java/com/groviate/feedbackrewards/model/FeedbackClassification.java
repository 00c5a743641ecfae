package com.groviate.feedbackrewards.model;

public record FeedbackClassification(String category, String subcategory) {
}
