package com.groviate.feedbackrewards.unit.service.ledger;

import com.groviate.feedbackrewards.entity.ActivityRecord;
import com.groviate.feedbackrewards.entity.ActivityType;
import com.groviate.feedbackrewards.repository.ActivityRecordRepository;
import com.groviate.feedbackrewards.service.ledger.AwardRequest;
import com.groviate.feedbackrewards.service.ledger.LedgerFailureClassifier;
import com.groviate.feedbackrewards.service.ledger.TierOutcome;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.InvalidDataAccessApiUsageException;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.jdbc.BadSqlGrammarException;
import org.springframework.jdbc.CannotGetJdbcConnectionException;

import java.sql.SQLException;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class LedgerFailureClassifierUnitTest {

    private static final AwardRequest REQUEST =
            new AwardRequest("u1", ActivityType.FEEDBACK_GIVEN, 10, "feedback:1:base", null);

    @Mock
    ActivityRecordRepository activityRecordRepository;

    private LedgerFailureClassifier classifier;

    @BeforeEach
    void setUp() {
        classifier = new LedgerFailureClassifier(activityRecordRepository);
    }

    @Test
    @DisplayName("Нарушение уникальности и запись с ключом есть -> DUPLICATE с существующей записью")
    void givenIntegrityViolationAndExistingRecordWhenClassifyThenDuplicate() {
        ActivityRecord existing = ActivityRecord.builder().id(3L).points(10).build();
        when(activityRecordRepository.findByCorrelationKey("feedback:1:base")).thenReturn(Optional.of(existing));

        TierOutcome outcome = classifier.classify(REQUEST, new DataIntegrityViolationException("uk violation"));

        assertThat(outcome.status()).isEqualTo(TierOutcome.Status.DUPLICATE);
        assertThat(outcome.record()).isSameAs(existing);
    }

    @Test
    @DisplayName("Нарушение целостности без записи -> REJECTED")
    void givenIntegrityViolationWithoutRecordWhenClassifyThenRejected() {
        when(activityRecordRepository.findByCorrelationKey("feedback:1:base")).thenReturn(Optional.empty());

        TierOutcome outcome = classifier.classify(REQUEST, new DataIntegrityViolationException("not null"));

        assertThat(outcome.status()).isEqualTo(TierOutcome.Status.REJECTED);
    }

    @Test
    @DisplayName("Нарушение целостности и повторное чтение упало -> UNAVAILABLE")
    void givenIntegrityViolationAndReadFailsWhenClassifyThenUnavailable() {
        when(activityRecordRepository.findByCorrelationKey("feedback:1:base"))
                .thenThrow(new CannotGetJdbcConnectionException("no connection"));

        TierOutcome outcome = classifier.classify(REQUEST, new DataIntegrityViolationException("uk violation"));

        assertThat(outcome.status()).isEqualTo(TierOutcome.Status.UNAVAILABLE);
    }

    @Test
    @DisplayName("Недоступность, таймаут, отсутствующая таблица и неизвестная ошибка -> UNAVAILABLE")
    void givenAvailabilityFailuresWhenClassifyThenUnavailable() {
        assertThat(classifier.classify(REQUEST, new CannotGetJdbcConnectionException("down")).status())
                .isEqualTo(TierOutcome.Status.UNAVAILABLE);
        assertThat(classifier.classify(REQUEST, new QueryTimeoutException("timeout")).status())
                .isEqualTo(TierOutcome.Status.UNAVAILABLE);
        assertThat(classifier.classify(REQUEST,
                new BadSqlGrammarException("insert", "insert into x", new SQLException("no table"))).status())
                .isEqualTo(TierOutcome.Status.UNAVAILABLE);
        assertThat(classifier.classify(REQUEST, new IllegalStateException("no state row")).status())
                .isEqualTo(TierOutcome.Status.UNAVAILABLE);

        verifyNoInteractions(activityRecordRepository);
    }

    @Test
    @DisplayName("Неверное использование API -> REJECTED")
    void givenApiMisuseWhenClassifyThenRejected() {
        assertThat(classifier.classify(REQUEST, new InvalidDataAccessApiUsageException("bad param")).status())
                .isEqualTo(TierOutcome.Status.REJECTED);
        assertThat(classifier.classify(REQUEST, new IllegalArgumentException("bad")).status())
                .isEqualTo(TierOutcome.Status.REJECTED);
    }
}
