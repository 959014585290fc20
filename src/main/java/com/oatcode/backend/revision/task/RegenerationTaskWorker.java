package com.oatcode.backend.revision.task;

import com.oatcode.backend.customer.entity.Customer;
import com.oatcode.backend.customer.repo.CustomerRepo;
import com.oatcode.backend.notify.NotificationContext;
import com.oatcode.backend.notify.NotificationDispatcher;
import com.oatcode.backend.notify.TemplateKind;
import com.oatcode.backend.renderer.RenderFailedException;
import com.oatcode.backend.renderer.WebsiteRenderer;
import com.oatcode.backend.renderer.WebsiteRenderer.RenderInput;
import com.oatcode.backend.renderer.WebsiteRenderer.RenderedWebsite;
import com.oatcode.backend.revision.config.RevisionProperties;
import com.oatcode.backend.revision.entity.CustomizationRequestEntity;
import com.oatcode.backend.revision.entity.RegenerationTaskEntity;
import com.oatcode.backend.revision.entity.WebsiteVersionEntity;
import com.oatcode.backend.revision.model.RequestStatus;
import com.oatcode.backend.revision.model.RequestType;
import com.oatcode.backend.revision.repo.CustomizationRequestRepository;
import com.oatcode.backend.revision.repo.RegenerationTaskRepository;
import com.oatcode.backend.revision.repo.WebsiteVersionRepository;
import com.oatcode.backend.revision.service.RevisionLinks;
import com.oatcode.backend.revision.service.WebsiteVersionService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.data.domain.PageRequest;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionOperations;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * 輪詢 regeneration_tasks：
 * 1) 短交易領任務（SKIP LOCKED）並記下 inputRevision
 * 2) 交易外呼叫 renderer（限時）
 * 3) 短交易寫新版本 + request -> PENDING_APPROVAL（inputRevision 對不上就只留版本）
 * 4) commit 後通知管理員審核；失敗則排重試並寄 failure alert
 */
@Slf4j
@Component
public class RegenerationTaskWorker {

    private final RegenerationTaskRepository taskRepo;
    private final CustomizationRequestRepository requestRepo;
    private final CustomerRepo customerRepo;
    private final WebsiteVersionRepository versionRepo;
    private final WebsiteVersionService versionService;
    private final WebsiteRenderer renderer;
    private final AsyncTaskExecutor rendererExecutor;
    private final NotificationDispatcher notifier;
    private final RevisionLinks links;
    private final RevisionProperties props;
    private final TransactionOperations tx;

    public RegenerationTaskWorker(RegenerationTaskRepository taskRepo,
                                  CustomizationRequestRepository requestRepo,
                                  CustomerRepo customerRepo,
                                  WebsiteVersionRepository versionRepo,
                                  WebsiteVersionService versionService,
                                  WebsiteRenderer renderer,
                                  @Qualifier("rendererExecutor") AsyncTaskExecutor rendererExecutor,
                                  NotificationDispatcher notifier,
                                  RevisionLinks links,
                                  RevisionProperties props,
                                  TransactionOperations tx) {
        this.taskRepo = taskRepo;
        this.requestRepo = requestRepo;
        this.customerRepo = customerRepo;
        this.versionRepo = versionRepo;
        this.versionService = versionService;
        this.renderer = renderer;
        this.rendererExecutor = rendererExecutor;
        this.notifier = notifier;
        this.links = links;
        this.props = props;
        this.tx = tx;
    }

    /** 領到的任務快照；交易結束後就不再碰 entity */
    record Job(
            String taskId,
            Long requestId,
            Long customerId,
            RequestType requestType,
            String requestText,
            int inputRevision,
            int attempt,
            String customerEmail,
            String businessName,
            boolean payingCustomer,
            RenderInput input
    ) {}

    @Scheduled(
            fixedDelayString = "${app.revision.worker.poll-delay-ms:5000}",
            initialDelayString = "${app.revision.worker.initial-delay-ms:10000}"
    )
    public void runOnce() {
        if (!props.getWorker().isEnabled()) return;

        Instant now = Instant.now();
        Claimed claimed = tx.execute(s -> claim(now));
        if (claimed == null) return;

        // reaper 放回來但次數已用完：claim 時直接放棄，commit 後才通知
        int maxAttempts = props.getWorker().getMaxAttempts();
        for (Job job : claimed.exhausted()) {
            sendFailureAlert(job, "MAX_ATTEMPTS_EXCEEDED", "cancelled after max attempts", maxAttempts, false);
        }

        for (Job job : claimed.runnable()) {
            try {
                process(job);
            } catch (RuntimeException e) {
                // 連失敗都記不進 DB：任務留在 RUNNING，reaper 之後會放回去
                log.error("regeneration bookkeeping failed, left for reaper. taskId={} requestId={}",
                        job.taskId(), job.requestId(), e);
            }
        }
    }

    // ===== 1) claim =====

    record Claimed(List<Job> runnable, List<Job> exhausted) {}

    Claimed claim(Instant now) {
        int batch = Math.max(1, props.getWorker().getBatchSize());
        int maxAttempts = props.getWorker().getMaxAttempts();
        List<RegenerationTaskEntity> tasks = taskRepo.claimRunnableForUpdate(now, PageRequest.of(0, batch));

        List<Job> jobs = new ArrayList<>();
        List<Job> exhausted = new ArrayList<>();
        for (RegenerationTaskEntity task : tasks) {
            CustomizationRequestEntity r = requestRepo.findById(task.getRequestId()).orElse(null);

            if (r == null) {
                task.markCancelled(now, "REQUEST_MISSING", "customization request not found");
                taskRepo.save(task);
                continue;
            }

            if (r.getStatus() != RequestStatus.PROCESSING) {
                task.markCancelled(now, "ALREADY_DONE", "request is " + r.getStatus());
                taskRepo.save(task);
                continue;
            }

            Customer c = customerRepo.findById(r.getCustomerId()).orElse(null);
            if (c == null) {
                task.markCancelled(now, "CUSTOMER_MISSING", "customer not found");
                taskRepo.save(task);
                continue;
            }

            if (TaskRetryPolicy.shouldGiveUp(task.getAttempts(), maxAttempts)) {
                task.markCancelled(now, "MAX_ATTEMPTS_EXCEEDED", "cancelled after max attempts");
                taskRepo.save(task);
                requestRepo.recordFailure(r.getId(), "MAX_ATTEMPTS_EXCEEDED", "cancelled after max attempts", now);
                exhausted.add(toJob(task, r, c, null));
                continue;
            }

            String currentHtml = versionRepo.findFirstByCustomerIdAndCurrentTrue(c.getId())
                    .map(WebsiteVersionEntity::getHtmlContent)
                    .orElse(null);

            task.markRunning(now, r.getInputRevision());
            taskRepo.save(task);
            jobs.add(toJob(task, r, c, currentHtml));
        }
        return new Claimed(jobs, exhausted);
    }

    private static Job toJob(RegenerationTaskEntity task, CustomizationRequestEntity r, Customer c, String currentHtml) {
        return new Job(
                task.getId(),
                r.getId(),
                c.getId(),
                r.getRequestType(),
                r.getRequestText(),
                r.getInputRevision(),
                task.getAttempts(),
                c.getEmail(),
                c.displayName(),
                c.isPaying(),
                new RenderInput(c.getId(), c.getBusinessName(), c.getIndustry(), c.getEmail(), c.getPhone(),
                        r.getRequestText(), currentHtml)
        );
    }

    // ===== 2) render + 3) complete =====

    void process(Job job) {
        RenderedWebsite out;
        try {
            out = renderBounded(job.input());
            if (out == null || out.html() == null || out.html().isBlank()) {
                throw new RenderFailedException("RENDER_EMPTY_OUTPUT", "renderer returned no html");
            }
        } catch (Exception e) {
            handleFailure(job, e);
            return;
        }

        Completion done = tx.execute(s -> complete(job, out));
        if (done != null && done.advanced()) {
            notifyReview(job, done.version());
        }
    }

    RenderedWebsite renderBounded(RenderInput input) throws Exception {
        Duration timeout = props.getRendererTimeout();
        Future<RenderedWebsite> f = rendererExecutor.submit(() -> renderer.render(input));
        try {
            return f.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException te) {
            f.cancel(true);
            throw new RenderFailedException("RENDER_TIMEOUT", "renderer exceeded " + timeout, te);
        } catch (ExecutionException ee) {
            Throwable cause = ee.getCause();
            if (cause instanceof Exception ex) throw ex;
            throw new RenderFailedException("RENDER_FAILED", String.valueOf(cause), cause);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            f.cancel(true);
            throw new RenderFailedException("RENDER_INTERRUPTED", "worker interrupted", ie);
        }
    }

    record Completion(boolean advanced, WebsiteVersionEntity version) {}

    Completion complete(Job job, RenderedWebsite out) {
        Instant now = Instant.now();

        // 版本一律保留（稽核用），就算 request 已經往前走了
        WebsiteVersionEntity v = versionService.appendVersion(
                job.customerId(), job.requestId(), out.html(), out.versionDescription());

        int n = requestRepo.markPendingApproval(job.requestId(), job.inputRevision(), v.getId(), now);
        boolean advanced = n == 1;
        if (!advanced) {
            // 同一份輸入被跑了兩次：指到最新版本，不再通知
            int relinked = requestRepo.relinkPendingVersion(job.requestId(), job.inputRevision(), v.getId(), now);
            log.info("render result not advanced. requestId={} inputRevision={} versionId={} relinked={}",
                    job.requestId(), job.inputRevision(), v.getId(), relinked == 1);
        }

        taskRepo.findById(job.taskId()).ifPresent(t -> {
            t.markSucceeded(now);
            taskRepo.save(t);
        });

        log.info("regeneration done. taskId={} requestId={} version={} advanced={} renderer={}",
                job.taskId(), job.requestId(), v.getVersionNumber(), advanced, renderer.rendererCode());
        return new Completion(advanced, v);
    }

    // ===== 4) failure =====

    void handleFailure(Job job, Exception e) {
        log.warn("regeneration failed. taskId={} requestId={} attempt={}", job.taskId(), job.requestId(), job.attempt(), e);

        RenderErrorMapper.Mapped mapped = RenderErrorMapper.map(e);
        int maxAttempts = props.getWorker().getMaxAttempts();
        Instant now = Instant.now();

        Boolean willRetry = tx.execute(s -> {
            RegenerationTaskEntity task = taskRepo.findById(job.taskId()).orElse(null);
            boolean retry;
            String code = mapped.code();
            String msg = mapped.message();

            if (TaskRetryPolicy.isNonRetryable(code)) {
                retry = false;
                if (task != null) task.markCancelled(now, code, msg);
            } else if (TaskRetryPolicy.shouldGiveUp(job.attempt(), maxAttempts)) {
                retry = false;
                msg = ("[" + code + "] " + (msg == null ? "" : msg)).trim();
                code = "RENDER_GIVE_UP";
                if (task != null) task.markCancelled(now, code, msg);
            } else {
                retry = true;
                int delaySec = TaskRetryPolicy.nextDelaySec(job.attempt());
                if (mapped.retryAfterSec() != null) delaySec = Math.max(delaySec, mapped.retryAfterSec());
                if (task != null) task.markFailed(now, code, msg, delaySec);
            }
            if (task != null) taskRepo.save(task);

            // request 維持 PROCESSING，只記錯誤
            requestRepo.recordFailure(job.requestId(), code, msg, now);
            return retry;
        });

        sendFailureAlert(job, mapped.code(), mapped.message(), maxAttempts, Boolean.TRUE.equals(willRetry));
    }

    private void sendFailureAlert(Job job, String code, String message, int maxAttempts, boolean willRetry) {
        notifier.send(TemplateKind.FAILURE_ALERT, props.getAdminEmail(), NotificationContext.builder()
                .customerId(job.customerId())
                .requestId(job.requestId())
                .customerEmail(job.customerEmail())
                .businessName(job.businessName())
                .payingCustomer(job.payingCustomer())
                .requestType(job.requestType().name())
                .description(job.requestText())
                .errorCode(code)
                .errorMessage(message)
                .attempt(job.attempt())
                .maxAttempts(maxAttempts)
                .willRetry(willRetry)
                .reviewUrl(links.reviewUrl(job.customerId(), job.requestId()))
                .build());
    }

    private void notifyReview(Job job, WebsiteVersionEntity v) {
        notifier.send(TemplateKind.ADMIN_REVIEW_REQUEST, props.getAdminEmail(), NotificationContext.builder()
                .customerId(job.customerId())
                .requestId(job.requestId())
                .customerEmail(job.customerEmail())
                .businessName(job.businessName())
                .payingCustomer(job.payingCustomer())
                .requestType(job.requestType().name())
                .description(job.requestText())
                .versionNumber(v.getVersionNumber())
                .reviewUrl(links.reviewUrl(job.customerId(), job.requestId()))
                .build());
    }
}
