package com.groviate.feedbackrewards.service.ledger;

import com.groviate.feedbackrewards.entity.ActivityRecord;
import com.groviate.feedbackrewards.repository.ActivityRecordRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.InvalidDataAccessApiUsageException;
import org.springframework.dao.InvalidDataAccessResourceUsageException;
import org.springframework.dao.RecoverableDataAccessException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.CannotCreateTransactionException;
import org.springframework.transaction.TransactionTimedOutException;

import java.util.Optional;

/**
 * Классификация ошибок уровней записи.
 * <ul>
 *   <li>нарушение целостности + запись с таким ключом уже есть → DUPLICATE</li>
 *   <li>нарушение целостности без записи / неверное использование API → REJECTED (цепочка прерывается)</li>
 *   <li>недоступность хранилища, таймауты, отсутствующий запрос/процедура и прочее → UNAVAILABLE</li>
 * </ul>
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class LedgerFailureClassifier {

    private final ActivityRecordRepository activityRecordRepository;

    public TierOutcome classify(AwardRequest request, RuntimeException failure) {
        if (failure instanceof DataIntegrityViolationException) {
            return classifyIntegrityViolation(request, failure);
        }

        if (failure instanceof InvalidDataAccessApiUsageException || failure instanceof IllegalArgumentException) {
            return TierOutcome.rejected(failure);
        }

        if (!isAvailabilityFailure(failure)) {
            log.debug("Неизвестная ошибка уровня записи считается недоступностью: key={}, type={}",
                    request.correlationKey(), failure.getClass().getSimpleName());
        }
        return TierOutcome.unavailable(failure);
    }

    boolean isAvailabilityFailure(RuntimeException failure) {
        return failure instanceof TransientDataAccessException
                || failure instanceof DataAccessResourceFailureException
                || failure instanceof RecoverableDataAccessException
                || failure instanceof InvalidDataAccessResourceUsageException
                || failure instanceof CannotCreateTransactionException
                || failure instanceof TransactionTimedOutException;
    }

    private TierOutcome classifyIntegrityViolation(AwardRequest request, RuntimeException failure) {
        Optional<ActivityRecord> existing;
        try {
            existing = activityRecordRepository.findByCorrelationKey(request.correlationKey());
        } catch (DataAccessException readFailure) {
            // не можем отличить дубль от битых данных - пусть решает следующий уровень
            return TierOutcome.unavailable(failure);
        }
        return existing
                .map(TierOutcome::duplicate)
                .orElseGet(() -> TierOutcome.rejected(failure));
    }
}
