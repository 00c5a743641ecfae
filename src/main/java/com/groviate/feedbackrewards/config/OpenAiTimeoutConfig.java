package com.groviate.feedbackrewards.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.web.client.RestClientCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;

/**
 * Таймауты HTTP-клиента Spring AI.
 * Оценка короткого текста должна укладываться в секунды, поэтому значения небольшие.
 */
@Configuration
@Slf4j
public class OpenAiTimeoutConfig {

    @Bean
    public RestClientCustomizer restClientCustomizer(FeedbackRewardsProperties props) {
        int connectTimeoutMs = props.getQuality().getConnectTimeoutMs();
        int readTimeoutMs = props.getQuality().getReadTimeoutMs();

        return restClientBuilder -> {
            SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
            requestFactory.setConnectTimeout(connectTimeoutMs);
            requestFactory.setReadTimeout(readTimeoutMs);

            restClientBuilder.requestFactory(requestFactory);

            log.info("RestClient timeout настроен: connect={} мс, read={} мс", connectTimeoutMs, readTimeoutMs);
        };
    }
}
