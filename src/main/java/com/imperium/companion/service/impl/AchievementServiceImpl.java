package com.imperium.companion.service.impl;

import com.imperium.companion.model.entity.Milestone;
import com.imperium.companion.model.enums.AchievementType;
import com.imperium.companion.service.AchievementService;
import com.imperium.companion.service.CheckInService;
import com.imperium.companion.service.JournalService;
import com.imperium.companion.service.MilestoneService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

@Service
public class AchievementServiceImpl implements AchievementService {

    private static final Logger log = LoggerFactory.getLogger(AchievementServiceImpl.class);

    private final CheckInService checkInService;
    private final JournalService journalService;
    private final MilestoneService milestoneService;

    public AchievementServiceImpl(CheckInService checkInService,
            JournalService journalService,
            MilestoneService milestoneService) {
        this.checkInService = checkInService;
        this.journalService = journalService;
        this.milestoneService = milestoneService;
    }

    @Override
    public List<Milestone> checkAndCreateAutoAchievements(String userId) {
        List<Milestone> granted = new ArrayList<>();
        int streak;
        long journalCount;
        Set<String> existing;
        try {
            streak = checkInService.currentStreak(userId);
            journalCount = journalService.countForUser(userId);
            existing = milestoneService.typesFor(userId);
        } catch (RuntimeException e) {
            log.warn("Achievement metrics unavailable: userId={}, error={}", userId, e.getMessage());
            return granted;
        }

        for (AchievementType achievement : AchievementType.values()) {
            if (existing.contains(achievement.getType()) || !achievement.isReached(streak, journalCount)) {
                continue;
            }
            try {
                milestoneService.grantIfAbsent(userId, achievement.getType(),
                        achievement.getDisplayName(), achievement.getDescription())
                        .ifPresent(granted::add);
            } catch (RuntimeException e) {
                log.warn("Achievement grant failed: userId={}, type={}, error={}",
                        userId, achievement.getType(), e.getMessage());
            }
        }

        if (!granted.isEmpty()) {
            log.info("Achievements granted: userId={}, types={}, checkInStreak={}, journalCount={}",
                    userId, granted.stream().map(Milestone::getType).toList(), streak, journalCount);
        }
        return granted;
    }
}
