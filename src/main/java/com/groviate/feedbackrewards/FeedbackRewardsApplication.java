package com.groviate.feedbackrewards;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.domain.EntityScan;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication(scanBasePackages = "com.groviate.feedbackrewards")
@EnableJpaRepositories(basePackages = "com.groviate.feedbackrewards.repository")
@EntityScan(basePackages = "com.groviate.feedbackrewards.entity")
@EnableScheduling
public class FeedbackRewardsApplication {

    public static void main(String[] args) {
        SpringApplication.run(FeedbackRewardsApplication.class, args);
    }
}
