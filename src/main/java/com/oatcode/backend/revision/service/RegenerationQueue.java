package com.oatcode.backend.revision.service;

import com.oatcode.backend.revision.entity.RegenerationTaskEntity;
import com.oatcode.backend.revision.entity.RegenerationTaskEntity.TaskStatus;
import com.oatcode.backend.revision.repo.RegenerationTaskRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;

/**
 * 「請重產」事件寫進 regeneration_tasks（跟 request 同一個交易），worker 輪詢領取
 * 行程掛掉也不會丟：QUEUED 留在表裡，RUNNING 由 reaper 放回去
 */
@Slf4j
@RequiredArgsConstructor
@Service
public class RegenerationQueue {

    private final RegenerationTaskRepository taskRepo;

    @Transactional(propagation = Propagation.MANDATORY)
    public RegenerationTaskEntity enqueue(Long requestId, Long customerId, Instant now) {
        var latest = taskRepo.findFirstByRequestIdOrderByCreatedAtUtcDesc(requestId).orElse(null);

        if (latest != null) {
            // 已經排隊中：不用再排
            if (latest.getTaskStatus() == TaskStatus.QUEUED) return latest;

            // 等退避重試中：直接拉回 QUEUED，次數歸零（新的輸入）
            if (latest.getTaskStatus() == TaskStatus.FAILED) {
                latest.requeue(now);
                log.info("regeneration task requeued. taskId={} requestId={}", latest.getId(), requestId);
                return taskRepo.save(latest);
            }
            // RUNNING：讓它跑完（完成時 inputRevision 對不上就不會進審核），另排一筆
        }

        RegenerationTaskEntity t = RegenerationTaskEntity.queued(requestId, customerId);
        RegenerationTaskEntity saved = taskRepo.save(t);
        log.info("regeneration task queued. taskId={} requestId={} customerId={}", saved.getId(), requestId, customerId);
        return saved;
    }

    @Transactional(readOnly = true)
    public boolean hasPendingRun(Long requestId) {
        return taskRepo.findFirstByRequestIdOrderByCreatedAtUtcDesc(requestId)
                .map(RegenerationTaskEntity::isPending)
                .orElse(false);
    }
}
