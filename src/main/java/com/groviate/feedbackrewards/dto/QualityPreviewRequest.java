package com.groviate.feedbackrewards.dto;

import jakarta.validation.constraints.NotNull;

public record QualityPreviewRequest(@NotNull String content) {
}
