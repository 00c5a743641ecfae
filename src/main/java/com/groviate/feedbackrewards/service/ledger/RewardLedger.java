package com.groviate.feedbackrewards.service.ledger;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.groviate.feedbackrewards.entity.ActivityRecord;
import com.groviate.feedbackrewards.entity.ActivityType;
import com.groviate.feedbackrewards.exception.LedgerPersistenceException;
import com.groviate.feedbackrewards.repository.ActivityRecordRepository;
import com.groviate.feedbackrewards.service.RewardMetricsService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Журнал начислений: единственная точка записи наград и изменения баланса.
 * <p>
 * Гарантии:
 * <ul>
 *   <li>идемпотентность по correlationKey: повтор возвращает существующую запись и не начисляет второй раз</li>
 *   <li>уровни записи перебираются по порядку, следующий пробуется только при недоступности предыдущего</li>
 *   <li>ошибка валидации прерывает цепочку сразу</li>
 * </ul>
 */
@Service
@Slf4j
public class RewardLedger {

    static final int MAX_USER_ID_LENGTH = 64;
    static final int MAX_CORRELATION_KEY_LENGTH = 200;
    static final int MAX_METADATA_LENGTH = 4000;

    private final List<LedgerWriteTier> tiers;
    private final ActivityRecordRepository activityRecordRepository;
    private final RewardStateWriter stateWriter;
    private final ObjectMapper objectMapper;
    private final RewardMetricsService metrics;

    /**
     * @param tiers уровни записи, отсортированные Spring по {@code @Order}
     */
    public RewardLedger(List<LedgerWriteTier> tiers,
                        ActivityRecordRepository activityRecordRepository,
                        RewardStateWriter stateWriter,
                        ObjectMapper objectMapper,
                        RewardMetricsService metrics) {
        this.tiers = List.copyOf(tiers);
        this.activityRecordRepository = activityRecordRepository;
        this.stateWriter = stateWriter;
        this.objectMapper = objectMapper;
        this.metrics = metrics;
        log.info("Уровни записи журнала: {}", this.tiers.stream().map(LedgerWriteTier::name).toList());
    }

    /**
     * Записывает награду в журнал и увеличивает баланс пользователя.
     *
     * @param points         количество очков (может быть отрицательным)
     * @param correlationKey ключ логического события, граница идемпотентности
     * @param metadata       произвольные данные события (сериализуются в JSON), может быть null
     * @return результат записи; исключений не бросает
     */
    public AwardResult recordAward(String userId,
                                   ActivityType activityType,
                                   int points,
                                   String correlationKey,
                                   Map<String, Object> metadata) {
        AwardRequest request;
        try {
            request = buildRequest(userId, activityType, points, correlationKey, metadata);
        } catch (IllegalArgumentException e) {
            log.warn("Начисление отклонено валидацией: userId={}, key={}, reason={}",
                    userId, correlationKey, e.getMessage());
            metrics.markAward("rejected");
            return AwardResult.rejected(e);
        }

        Optional<ActivityRecord> existing = findExisting(correlationKey);
        if (existing.isPresent()) {
            log.debug("Начисление уже есть в журнале, пропускаем: key={}", correlationKey);
            metrics.markAward("duplicate");
            return AwardResult.duplicate(existing.get());
        }

        try {
            stateWriter.ensureState(userId);
        } catch (RuntimeException e) {
            log.warn("Не удалось подготовить строку баланса: userId={}, cause={}", userId, e.getMessage());
        }

        RuntimeException lastFailure = null;

        for (LedgerWriteTier tier : tiers) {
            if (!tier.isEnabled()) {
                log.debug("Уровень {} выключен конфигом", tier.name());
                continue;
            }

            TierOutcome outcome = tier.write(request);

            switch (outcome.status()) {
                case WRITTEN -> {
                    log.info("Начислено: userId={}, type={}, points={}, key={}, tier={}, aggregatePending={}",
                            userId, activityType, points, correlationKey, tier.name(), outcome.aggregatePending());
                    metrics.markAward("recorded");
                    return AwardResult.recorded(outcome.record(), tier.name(), outcome.aggregatePending());
                }
                case DUPLICATE -> {
                    log.info("Параллельный повтор начисления, запись уже есть: key={}, tier={}",
                            correlationKey, tier.name());
                    metrics.markAward("duplicate");
                    return AwardResult.duplicate(outcome.record());
                }
                case REJECTED -> {
                    log.warn("Уровень {} отклонил начисление, цепочка прервана: key={}, cause={}",
                            tier.name(), correlationKey, safeMsg(outcome.cause()));
                    metrics.markAward("rejected");
                    return AwardResult.rejected(outcome.cause());
                }
                case UNAVAILABLE -> {
                    log.warn("Уровень {} недоступен, пробуем следующий: key={}, cause={}",
                            tier.name(), correlationKey, safeMsg(outcome.cause()));
                    metrics.markTierFallthrough(tier.name());
                    lastFailure = outcome.cause();
                }
            }
        }

        LedgerPersistenceException error = new LedgerPersistenceException(
                "Ни один уровень журнала не записал начисление: key=" + correlationKey, lastFailure);
        log.error("Начисление не записано: userId={}, type={}, points={}, key={}",
                userId, activityType, points, correlationKey, error);
        metrics.markAward("failed");
        return AwardResult.failed(error);
    }

    private AwardRequest buildRequest(String userId,
                                      ActivityType activityType,
                                      int points,
                                      String correlationKey,
                                      Map<String, Object> metadata) {
        if (userId == null || userId.isBlank()) {
            throw new IllegalArgumentException("userId is blank");
        }
        if (userId.length() > MAX_USER_ID_LENGTH) {
            throw new IllegalArgumentException("userId is longer than " + MAX_USER_ID_LENGTH);
        }
        if (activityType == null) {
            throw new IllegalArgumentException("activityType is null");
        }
        if (correlationKey == null || correlationKey.isBlank()) {
            throw new IllegalArgumentException("correlationKey is blank");
        }
        if (correlationKey.length() > MAX_CORRELATION_KEY_LENGTH) {
            throw new IllegalArgumentException("correlationKey is longer than " + MAX_CORRELATION_KEY_LENGTH);
        }

        String metadataJson = null;
        if (metadata != null && !metadata.isEmpty()) {
            try {
                metadataJson = objectMapper.writeValueAsString(metadata);
            } catch (JsonProcessingException e) {
                throw new IllegalArgumentException("metadata is not serializable: " + e.getOriginalMessage(), e);
            }
            if (metadataJson.length() > MAX_METADATA_LENGTH) {
                throw new IllegalArgumentException("metadata is longer than " + MAX_METADATA_LENGTH);
            }
        }

        return new AwardRequest(userId, activityType, points, correlationKey, metadataJson);
    }

    private Optional<ActivityRecord> findExisting(String correlationKey) {
        try {
            return activityRecordRepository.findByCorrelationKey(correlationKey);
        } catch (DataAccessException e) {
            // дубль всё равно отсечёт уникальный индекс на уровне записи
            log.warn("Не удалось проверить ключ в журнале: key={}, cause={}", correlationKey, e.getMessage());
            return Optional.empty();
        }
    }

    private String safeMsg(Throwable t) {
        if (t == null) return "unknown";
        String m = t.getMessage();
        if (m == null) return t.getClass().getSimpleName();
        return (m.length() > 200) ? m.substring(0, 200) : m;
    }
}
