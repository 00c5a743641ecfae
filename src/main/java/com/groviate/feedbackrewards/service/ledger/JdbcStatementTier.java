package com.groviate.feedbackrewards.service.ledger;

import com.groviate.feedbackrewards.config.FeedbackRewardsProperties;
import com.groviate.feedbackrewards.entity.ActivityRecord;
import com.groviate.feedbackrewards.entity.RewardLevel;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.Order;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import javax.sql.DataSource;
import java.sql.Timestamp;
import java.time.Clock;
import java.time.Instant;

/**
 * Уровень 2: та же атомарная семантика, но через прямые SQL-операторы (JdbcTemplate) в одной транзакции.
 * Используется, когда JPA-путь недоступен.
 */
@Component
@Order(2)
@Slf4j
public class JdbcStatementTier implements LedgerWriteTier {

    public static final String NAME = "jdbc-statement";

    private static final String INSERT_RECORD_SQL = """
            insert into activity_records (user_id, activity_type, points, correlation_key, metadata, created_at)
            values (?, ?, ?, ?, ?, ?)
            """;
    private static final String SELECT_ID_SQL =
            "select id from activity_records where correlation_key = ?";
    private static final String INCREMENT_POINTS_SQL =
            "update user_reward_states set points = points + ?, updated_at = ? where user_id = ?";
    private static final String SELECT_POINTS_SQL =
            "select points from user_reward_states where user_id = ?";
    private static final String UPDATE_LEVEL_SQL =
            "update user_reward_states set reward_level = ?, points_to_next_level = ? where user_id = ?";

    private final JdbcTemplate jdbcTemplate;
    private final LedgerFailureClassifier failureClassifier;
    private final FeedbackRewardsProperties props;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;

    public JdbcStatementTier(DataSource dataSource,
                             LedgerFailureClassifier failureClassifier,
                             FeedbackRewardsProperties props,
                             PlatformTransactionManager transactionManager,
                             Clock clock) {
        this.failureClassifier = failureClassifier;
        this.props = props;
        this.clock = clock;

        int timeoutSeconds = props.getLedger().getStatementTimeoutSeconds();
        this.jdbcTemplate = new JdbcTemplate(dataSource);
        this.jdbcTemplate.setQueryTimeout(timeoutSeconds);
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.transactionTemplate.setTimeout(timeoutSeconds);
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public boolean isEnabled() {
        return props.getLedger().getTiers().getJdbcStatement().isEnabled();
    }

    @Override
    public TierOutcome write(AwardRequest request) {
        try {
            ActivityRecord saved = transactionTemplate.execute(status -> insertAndIncrement(request));
            return TierOutcome.written(saved);
        } catch (RuntimeException e) {
            return failureClassifier.classify(request, e);
        }
    }

    private ActivityRecord insertAndIncrement(AwardRequest request) {
        Instant now = clock.instant();
        ActivityRecord record = request.toRecord(now);

        jdbcTemplate.update(INSERT_RECORD_SQL,
                record.getUserId(),
                record.getActivityType().name(),
                record.getPoints(),
                record.getCorrelationKey(),
                record.getMetadata(),
                Timestamp.from(now));

        // id по уникальному ключу: RETURN_GENERATED_KEYS ведёт себя по-разному в разных драйверах
        record.setId(jdbcTemplate.queryForObject(SELECT_ID_SQL, Long.class, record.getCorrelationKey()));

        int updated = jdbcTemplate.update(INCREMENT_POINTS_SQL, record.getPoints(), Timestamp.from(now), record.getUserId());
        if (updated == 0) {
            throw new IllegalStateException("Нет строки баланса для userId=" + record.getUserId());
        }

        Long points = jdbcTemplate.queryForObject(SELECT_POINTS_SQL, Long.class, record.getUserId());
        RewardLevel level = RewardLevel.forPoints(points != null ? points : 0L);
        jdbcTemplate.update(UPDATE_LEVEL_SQL, level.getNumber(), level.getNextThreshold(), record.getUserId());

        log.debug("[{}] key={} записан, баланс={}", NAME, record.getCorrelationKey(), points);
        return record;
    }
}
