package com.oatcode.backend.revision.task;

import com.oatcode.backend.renderer.WebsiteRenderer;
import com.oatcode.backend.revision.config.RevisionProperties;
import com.oatcode.backend.revision.entity.RegenerationTaskEntity.TaskStatus;
import com.oatcode.backend.revision.model.RequestStatus;
import com.oatcode.backend.revision.repo.CustomizationRequestRepository;
import com.oatcode.backend.revision.repo.RegenerationTaskRepository;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * ✅ 佇列狀態（只查 DB，不打 renderer）：
 * - worker 關閉但還有 QUEUED -> DOWN（沒人會處理）
 * - 其他 -> UP，附上各狀態數量
 */
@Component
public class RegenerationQueueHealthIndicator implements HealthIndicator {

    private final RegenerationTaskRepository taskRepo;
    private final CustomizationRequestRepository requestRepo;
    private final WebsiteRenderer renderer;
    private final RevisionProperties props;

    public RegenerationQueueHealthIndicator(RegenerationTaskRepository taskRepo,
                                            CustomizationRequestRepository requestRepo,
                                            WebsiteRenderer renderer,
                                            RevisionProperties props) {
        this.taskRepo = taskRepo;
        this.requestRepo = requestRepo;
        this.renderer = renderer;
        this.props = props;
    }

    @Override
    public Health health() {
        long queued = taskRepo.countByTaskStatus(TaskStatus.QUEUED);
        long running = taskRepo.countByTaskStatus(TaskStatus.RUNNING);
        long retrying = taskRepo.countByTaskStatus(TaskStatus.FAILED);
        boolean workerEnabled = props.getWorker().isEnabled();

        Health.Builder b = (!workerEnabled && queued > 0)
                ? Health.down().withDetail("reason", "WORKER_DISABLED")
                : Health.up();

        return b.withDetail("renderer", renderer.rendererCode())
                .withDetail("workerEnabled", workerEnabled)
                .withDetail("queued", queued)
                .withDetail("running", running)
                .withDetail("retrying", retrying)
                .withDetail("processingRequests", requestRepo.countByStatus(RequestStatus.PROCESSING))
                .withDetail("pendingApproval", requestRepo.countByStatus(RequestStatus.PENDING_APPROVAL))
                .build();
    }
}
