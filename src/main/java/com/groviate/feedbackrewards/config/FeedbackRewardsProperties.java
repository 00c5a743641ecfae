package com.groviate.feedbackrewards.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Настройки движка оценки отзывов и начисления наград.
 * Свойства загружаются из application.yml с префиксом "feedback-rewards".
 */
@Component
@ConfigurationProperties(prefix = "feedback-rewards")
@Data
public class FeedbackRewardsProperties {

    private Quality quality = new Quality();
    private Submission submission = new Submission();
    private Ledger ledger = new Ledger();
    private Achievements achievements = new Achievements();
    private Reconciliation reconciliation = new Reconciliation();

    @Data
    public static class Quality {

        /**
         * Использовать внешнюю модель для оценки (false = всегда локальная эвристика)
         */
        private boolean remoteEnabled = true;

        /**
         * Жёсткий таймаут вызова внешней оценки (мс), после него сразу локальная эвристика
         */
        private long scoringTimeoutMs = 5000;

        /**
         * Лимит символов отзыва, которые уходят в промпт
         */
        private int maxPromptContentChars = 4000;

        /**
         * Таймаут соединения HTTP-клиента модели (мс)
         */
        private int connectTimeoutMs = 1000;

        /**
         * Таймаут чтения ответа модели (мс). Не больше scoringTimeoutMs:
         * отмена по таймауту оценки не прерывает уже идущий HTTP-вызов
         */
        private int readTimeoutMs = 2000;
    }

    @Data
    public static class Submission {

        /**
         * Максимальная длина текста отзыва
         */
        private int maxContentLength = 10000;

        /**
         * Сколько ждать завершения начисления наград перед ответом клиенту (мс)
         */
        private long rewardAwaitMs = 3000;
    }

    @Data
    public static class Ledger {

        /**
         * Таймаут транзакции / SQL-запроса для каждого уровня записи (сек)
         */
        private int statementTimeoutSeconds = 5;

        private Tiers tiers = new Tiers();
    }

    /**
     * Включение/выключение отдельных уровней цепочки записи в журнал.
     */
    @Data
    public static class Tiers {
        private Tier combinedTransaction = new Tier();
        private Tier jdbcStatement = new Tier();
        private Tier twoStep = new Tier();
    }

    @Data
    public static class Tier {
        private boolean enabled = true;
    }

    @Data
    public static class Achievements {

        /**
         * Сколько последних оценённых отзывов учитывать для "Quality Reviewer"
         */
        private int qualityWindow = 100;
    }

    @Data
    public static class Reconciliation {

        /**
         * Включать/выключать плановую сверку балансов
         */
        private boolean schedulerEnabled = false;

        /**
         * Cron плановой сверки (по умолчанию раз в сутки, 03:00)
         */
        private String cron = "0 0 3 * * *";

        /**
         * Сколько отзывов без начислений дозачислять за один прогон сверки
         */
        private int rewardSweepBatchSize = 500;
    }
}
