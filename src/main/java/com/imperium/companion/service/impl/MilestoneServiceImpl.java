package com.imperium.companion.service.impl;

import com.baomidou.mybatisplus.extension.service.impl.ServiceImpl;
import com.imperium.companion.config.RequestIdSupport;
import com.imperium.companion.exception.DomainValidationException;
import com.imperium.companion.exception.OwnershipViolationException;
import com.imperium.companion.exception.ResourceNotFoundException;
import com.imperium.companion.mapper.MilestoneMapper;
import com.imperium.companion.model.dto.stats.MilestoneAggregate;
import com.imperium.companion.model.dto.stats.MilestoneStatsResponse;
import com.imperium.companion.model.entity.Milestone;
import com.imperium.companion.service.MilestoneService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

@Service
public class MilestoneServiceImpl extends ServiceImpl<MilestoneMapper, Milestone> implements MilestoneService {

    private static final Logger log = LoggerFactory.getLogger(MilestoneServiceImpl.class);

    public static final int PROGRESS_COMPLETE = 100;

    @Override
    public Milestone createMilestone(String userId, String type, String name, String description, Integer progress) {
        int value = progress != null ? progress : 0;
        validateProgress(value);
        Milestone milestone = newMilestone(userId, type, name, description);
        milestone.setProgress(value);
        milestone.setUnlocked(false);
        save(milestone);
        return milestone;
    }

    @Override
    public Milestone updateProgress(String userId, String milestoneId, int progress) {
        validateProgress(progress);
        Milestone milestone = getOwned(userId, milestoneId);
        milestone.setProgress(progress);
        if (progress < PROGRESS_COMPLETE) {
            milestone.setUnlocked(false);
            milestone.setUnlockedAt(null);
        } else if (!Boolean.TRUE.equals(milestone.getUnlocked())) {
            milestone.setUnlocked(true);
            milestone.setUnlockedAt(LocalDateTime.now());
        }
        updateById(milestone);
        return milestone;
    }

    @Override
    public Milestone unlock(String userId, String milestoneId) {
        Milestone milestone = getOwned(userId, milestoneId);
        milestone.setProgress(PROGRESS_COMPLETE);
        milestone.setUnlocked(true);
        milestone.setUnlockedAt(LocalDateTime.now());
        updateById(milestone);
        return milestone;
    }

    @Override
    public List<Milestone> listForUser(String userId) {
        return lambdaQuery()
                .eq(Milestone::getUserId, userId)
                .orderByDesc(Milestone::getCreatedAt)
                .list();
    }

    @Override
    public List<Milestone> recent(String userId, int limit) {
        return lambdaQuery()
                .eq(Milestone::getUserId, userId)
                .orderByDesc(Milestone::getCreatedAt)
                .last("LIMIT " + Math.max(1, limit))
                .list();
    }

    @Override
    public Set<String> typesFor(String userId) {
        return lambdaQuery()
                .select(Milestone::getType)
                .eq(Milestone::getUserId, userId)
                .list()
                .stream()
                .map(Milestone::getType)
                .collect(Collectors.toSet());
    }

    @Override
    public Optional<Milestone> grantIfAbsent(String userId, String type, String name, String description) {
        // 单条插入即为已解锁状态，不存在“已占用类型键但未解锁”的中间行
        Milestone milestone = newMilestone(userId, type, name, description);
        milestone.setProgress(PROGRESS_COMPLETE);
        milestone.setUnlocked(true);
        milestone.setUnlockedAt(milestone.getCreatedAt());
        try {
            save(milestone);
        } catch (DuplicateKeyException e) {
            // (user_id, type) 唯一索引：并发轮次已授予
            log.info("Milestone already granted concurrently: userId={}, type={}", userId, type);
            return Optional.empty();
        }
        return Optional.of(milestone);
    }

    @Override
    public MilestoneStatsResponse stats(String userId) {
        MilestoneAggregate aggregate = baseMapper.aggregate(userId);
        if (aggregate == null || aggregate.getTotal() == null) {
            return new MilestoneStatsResponse(0, 0, 0, 0);
        }
        long total = aggregate.getTotal();
        long unlocked = aggregate.getUnlocked() != null ? aggregate.getUnlocked() : 0L;
        long average = aggregate.getAverageProgress() != null ? Math.round(aggregate.getAverageProgress()) : 0L;
        return MilestoneStatsResponse.builder()
                .total(total)
                .unlocked(unlocked)
                .inProgress(total - unlocked)
                .percentageComplete(average)
                .build();
    }

    private Milestone getOwned(String userId, String milestoneId) {
        Milestone milestone = getById(milestoneId);
        if (milestone == null) {
            throw new ResourceNotFoundException("Milestone", milestoneId);
        }
        if (!Objects.equals(milestone.getUserId(), userId)) {
            throw new OwnershipViolationException("milestone");
        }
        return milestone;
    }

    private static Milestone newMilestone(String userId, String type, String name, String description) {
        if (type == null || type.isBlank() || name == null || name.isBlank()) {
            throw new DomainValidationException("Milestone type and name are required");
        }
        Milestone milestone = new Milestone();
        milestone.setId(RequestIdSupport.newId("ms"));
        milestone.setUserId(userId);
        milestone.setType(type);
        milestone.setName(name);
        milestone.setDescription(description);
        milestone.setCreatedAt(LocalDateTime.now());
        return milestone;
    }

    private static void validateProgress(int progress) {
        if (progress < 0 || progress > PROGRESS_COMPLETE) {
            throw new DomainValidationException("progress", "Milestone progress must be between 0 and 100");
        }
    }
}
