package com.groviate.feedbackrewards.controller;

import com.groviate.feedbackrewards.dto.ActivityRecordView;
import com.groviate.feedbackrewards.dto.EarnedAchievementView;
import com.groviate.feedbackrewards.dto.RewardStateResponse;
import com.groviate.feedbackrewards.model.ReconciliationReport;
import com.groviate.feedbackrewards.service.ReconciliationJob;
import com.groviate.feedbackrewards.service.RewardQueryService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/v1/rewards")
public class RewardsController {

    private final RewardQueryService queryService;
    private final ReconciliationJob reconciliationJob;

    public RewardsController(RewardQueryService queryService, ReconciliationJob reconciliationJob) {
        this.queryService = queryService;
        this.reconciliationJob = reconciliationJob;
    }

    @GetMapping("/{userId}")
    public RewardStateResponse state(@PathVariable String userId) {
        return queryService.getState(userId);
    }

    @GetMapping("/{userId}/activity")
    public List<ActivityRecordView> activity(@PathVariable String userId,
                                             @RequestParam(required = false) Integer limit) {
        return queryService.getRecentActivity(userId, limit);
    }

    @GetMapping("/{userId}/achievements")
    public List<EarnedAchievementView> achievements(@PathVariable String userId) {
        return queryService.getAchievements(userId);
    }

    /**
     * Ручная сверка баланса с журналом, например после инцидента с БД.
     */
    @PostMapping("/{userId}/reconcile")
    public ReconciliationReport reconcile(@PathVariable String userId) {
        return reconciliationJob.reconcile(userId);
    }
}
