package com.groviate.feedbackrewards.entity;

import lombok.Getter;

import java.util.Arrays;
import java.util.Comparator;

/**
 * Уровни пользователя по накопленным очкам.
 * nextThreshold - порог следующего уровня (для последнего уровня условная планка).
 */
@Getter
public enum RewardLevel {

    LEVEL_1(1, 0, 100),
    LEVEL_2(2, 100, 250),
    LEVEL_3(3, 250, 500),
    LEVEL_4(4, 500, 1000),
    LEVEL_5(5, 1000, 2000),
    LEVEL_6(6, 2000, 3500),
    LEVEL_7(7, 3500, 5000),
    LEVEL_8(8, 5000, 7500),
    LEVEL_9(9, 7500, 10000),
    LEVEL_10(10, 10000, 15000);

    private final int number;
    private final int minPoints;
    private final int nextThreshold;

    RewardLevel(int number, int minPoints, int nextThreshold) {
        this.number = number;
        this.minPoints = minPoints;
        this.nextThreshold = nextThreshold;
    }

    /**
     * Максимальный уровень, порог которого достигнут. Отрицательный баланс = уровень 1.
     */
    public static RewardLevel forPoints(long points) {
        return Arrays.stream(values())
                .filter(level -> points >= level.getMinPoints())
                .max(Comparator.comparingInt(RewardLevel::getNumber))
                .orElse(LEVEL_1);
    }
}
