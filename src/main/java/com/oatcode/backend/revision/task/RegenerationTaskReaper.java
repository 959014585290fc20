package com.oatcode.backend.revision.task;

import com.oatcode.backend.revision.config.RevisionProperties;
import com.oatcode.backend.revision.repo.RegenerationTaskRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;

/**
 * worker 在 RUNNING 中途掛掉（重啟、OOM）時，把任務放回可重領
 */
@Slf4j
@RequiredArgsConstructor
@Component
@ConditionalOnProperty(prefix = "app.revision.worker", name = "enabled", havingValue = "true", matchIfMissing = true)
public class RegenerationTaskReaper {

    private final RegenerationTaskRepository taskRepo;
    private final RevisionProperties props;

    @Scheduled(fixedDelayString = "${app.revision.worker.reap-delay-ms:60000}")
    @Transactional
    public void reap() {
        Instant now = Instant.now();
        Instant staleBefore = now.minus(props.getWorker().getStaleRunningAfter());

        int n = taskRepo.resetStaleRunning(
                staleBefore,
                now,
                "WORKER_STALE_RUNNING",
                "RUNNING timeout, reset to FAILED"
        );

        if (n > 0) {
            log.warn("reaped stale RUNNING regeneration tasks: count={}", n);
        }
    }
}
