package com.groviate.feedbackrewards.service;

import com.groviate.feedbackrewards.config.FeedbackRewardsProperties;
import com.groviate.feedbackrewards.model.QualityMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Анализ качества текста отзыва. Никогда не бросает исключений вызывающему.
 * <p>
 * Порядок:
 * <ol>
 *   <li>внешняя оценка ({@link RemoteQualityScoringService}), если включена и текст не пустой</li>
 *   <li>локальная эвристика ({@link LocalQualityHeuristic})</li>
 *   <li>нейтральные оценки {0.5, 0.5, 0.5, 0}, если не сработало ничего</li>
 * </ol>
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class FeedbackQualityAnalyzer {

    private final RemoteQualityScoringService remoteScoringService;
    private final LocalQualityHeuristic localHeuristic;
    private final FeedbackRewardsProperties props;
    private final RewardMetricsService metrics;

    public QualityMetrics analyze(String content) {
        String text = content == null ? "" : content;

        if (props.getQuality().isRemoteEnabled() && !text.isBlank()) {
            try {
                Optional<QualityMetrics> remote = remoteScoringService.score(text);
                if (remote.isPresent()) {
                    metrics.markAnalysisRemote();
                    return remote.get();
                }
            } catch (RuntimeException e) {
                log.warn("Внешняя оценка завершилась ошибкой, переходим на эвристику: {}", e.getMessage());
                log.debug("Remote scoring failure details", e);
            }
        }

        try {
            QualityMetrics local = localHeuristic.analyze(text);
            metrics.markAnalysisFallback();
            return local;
        } catch (RuntimeException e) {
            log.error("Локальная эвристика упала, возвращаем нейтральные оценки", e);
            metrics.markAnalysisNeutral();
            return QualityMetrics.neutral();
        }
    }
}
