package com.oatcode.backend.revision;

import com.oatcode.backend.customer.entity.Customer;
import com.oatcode.backend.customer.repo.CustomerRepo;
import com.oatcode.backend.notify.NotificationContext;
import com.oatcode.backend.notify.NotificationDispatcher;
import com.oatcode.backend.notify.TemplateKind;
import com.oatcode.backend.renderer.RenderFailedException;
import com.oatcode.backend.renderer.WebsiteRenderer;
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
import com.oatcode.backend.revision.task.RegenerationTaskWorker;
import com.oatcode.backend.revision.task.TaskRetryPolicy;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mockito;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.core.task.SimpleAsyncTaskExecutor;
import org.springframework.core.task.support.TaskExecutorAdapter;
import org.springframework.data.domain.Pageable;
import org.springframework.transaction.support.TransactionOperations;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.never;

class RegenerationTaskWorkerTest {

    private RegenerationTaskRepository taskRepo;
    private CustomizationRequestRepository requestRepo;
    private CustomerRepo customerRepo;
    private WebsiteVersionRepository versionRepo;
    private WebsiteVersionService versionService;
    private WebsiteRenderer renderer;
    private NotificationDispatcher notifier;
    private RevisionProperties props;

    private RegenerationTaskEntity task;
    private CustomizationRequestEntity request;

    @BeforeEach
    void setUp() {
        taskRepo = Mockito.mock(RegenerationTaskRepository.class);
        requestRepo = Mockito.mock(CustomizationRequestRepository.class);
        customerRepo = Mockito.mock(CustomerRepo.class);
        versionRepo = Mockito.mock(WebsiteVersionRepository.class);
        versionService = Mockito.mock(WebsiteVersionService.class);
        renderer = Mockito.mock(WebsiteRenderer.class);
        notifier = Mockito.mock(NotificationDispatcher.class);

        props = new RevisionProperties();
        props.setAdminEmail("admin@test.local");
        props.setPublicBaseUrl("http://test.local");
        props.setRendererTimeout(Duration.ofSeconds(5));

        task = RegenerationTaskEntity.queued(10L, 1L);
        task.setId("t1");

        request = CustomizationRequestEntity.open(1L, RequestType.REVISION, "Make the header blue", "a@b.com");
        request.setId(10L);

        Customer c = new Customer();
        c.setId(1L);
        c.setEmail("a@b.com");
        c.setBusinessName("Joe's Plumbing");

        Mockito.when(taskRepo.claimRunnableForUpdate(any(Instant.class), any(Pageable.class))).thenReturn(List.of(task));
        Mockito.when(taskRepo.findById("t1")).thenReturn(Optional.of(task));
        Mockito.when(requestRepo.findById(10L)).thenReturn(Optional.of(request));
        Mockito.when(customerRepo.findById(1L)).thenReturn(Optional.of(c));
        Mockito.when(versionRepo.findFirstByCustomerIdAndCurrentTrue(1L)).thenReturn(Optional.empty());
        Mockito.when(renderer.rendererCode()).thenReturn("MOCK");
    }

    private RegenerationTaskWorker worker(AsyncTaskExecutor executor) {
        return new RegenerationTaskWorker(taskRepo, requestRepo, customerRepo, versionRepo, versionService,
                renderer, executor, notifier, new RevisionLinks(props), props,
                TransactionOperations.withoutTransaction());
    }

    private RegenerationTaskWorker worker() {
        return worker(new TaskExecutorAdapter(Runnable::run));
    }

    private static WebsiteVersionEntity version(long id, int number) {
        WebsiteVersionEntity v = new WebsiteVersionEntity();
        v.setId(id);
        v.setVersionNumber(number);
        return v;
    }

    @Test
    void success_should_store_version_move_to_pending_and_notify_admin() throws Exception {
        Mockito.when(renderer.render(any())).thenReturn(new WebsiteRenderer.RenderedWebsite("<html></html>", "blue header"));
        Mockito.when(versionService.appendVersion(1L, 10L, "<html></html>", "blue header")).thenReturn(version(100L, 1));
        Mockito.when(requestRepo.markPendingApproval(eq(10L), eq(1), eq(100L), any())).thenReturn(1);

        worker().runOnce();

        assertEquals(RegenerationTaskEntity.TaskStatus.SUCCEEDED, task.getTaskStatus());
        assertEquals(1, task.getAttempts());

        ArgumentCaptor<NotificationContext> ctx = ArgumentCaptor.forClass(NotificationContext.class);
        Mockito.verify(notifier).send(eq(TemplateKind.ADMIN_REVIEW_REQUEST), eq("admin@test.local"), ctx.capture());
        assertEquals(10L, ctx.getValue().requestId());
        assertEquals(1, ctx.getValue().versionNumber());
        assertEquals("http://test.local/admin/review?customerId=1&requestId=10", ctx.getValue().reviewUrl());
    }

    @Test
    void stale_input_revision_keeps_version_but_does_not_notify() throws Exception {
        Mockito.when(renderer.render(any())).thenReturn(new WebsiteRenderer.RenderedWebsite("<html></html>", "d"));
        Mockito.when(versionService.appendVersion(anyLong(), anyLong(), anyString(), anyString())).thenReturn(version(100L, 2));
        Mockito.when(requestRepo.markPendingApproval(anyLong(), anyInt(), anyLong(), any())).thenReturn(0);
        Mockito.when(requestRepo.relinkPendingVersion(anyLong(), anyInt(), anyLong(), any())).thenReturn(0);

        worker().runOnce();

        Mockito.verify(versionService).appendVersion(1L, 10L, "<html></html>", "d");
        Mockito.verify(notifier, never()).send(eq(TemplateKind.ADMIN_REVIEW_REQUEST), anyString(), any());
        assertEquals(RegenerationTaskEntity.TaskStatus.SUCCEEDED, task.getTaskStatus());
    }

    @Test
    void renderer_failure_should_schedule_retry_keep_processing_and_alert() throws Exception {
        Mockito.when(renderer.render(any())).thenThrow(new RuntimeException("boom"));

        worker().runOnce();

        assertEquals(RegenerationTaskEntity.TaskStatus.FAILED, task.getTaskStatus());
        assertNotNull(task.getNextRetryAtUtc());
        assertEquals(RequestStatus.PROCESSING, request.getStatus());
        Mockito.verify(requestRepo).recordFailure(eq(10L), eq("RENDER_FAILED"), anyString(), any());
        Mockito.verifyNoInteractions(versionService);

        ArgumentCaptor<NotificationContext> ctx = ArgumentCaptor.forClass(NotificationContext.class);
        Mockito.verify(notifier).send(eq(TemplateKind.FAILURE_ALERT), eq("admin@test.local"), ctx.capture());
        assertEquals(1L, ctx.getValue().customerId());
        assertEquals("Make the header blue", ctx.getValue().description());
        assertTrue(ctx.getValue().willRetry());
    }

    @Test
    void last_attempt_should_give_up() throws Exception {
        task.setAttempts(props.getWorker().getMaxAttempts() - 1);
        Mockito.when(renderer.render(any())).thenThrow(new RenderFailedException("RENDER_UPSTREAM_ERROR", "503"));

        worker().runOnce();

        assertEquals(RegenerationTaskEntity.TaskStatus.CANCELLED, task.getTaskStatus());
        assertEquals("RENDER_GIVE_UP", task.getLastErrorCode());
        Mockito.verify(requestRepo).recordFailure(eq(10L), eq("RENDER_GIVE_UP"), anyString(), any());

        ArgumentCaptor<NotificationContext> ctx = ArgumentCaptor.forClass(NotificationContext.class);
        Mockito.verify(notifier).send(eq(TemplateKind.FAILURE_ALERT), anyString(), ctx.capture());
        assertFalse(ctx.getValue().willRetry());
    }

    @Test
    void reaped_task_without_attempts_left_is_cancelled_and_alerted() throws Exception {
        // reaper 把 RUNNING 放回 FAILED，但最後一次已經用掉了
        task.setAttempts(props.getWorker().getMaxAttempts());
        task.setTaskStatus(RegenerationTaskEntity.TaskStatus.FAILED);

        worker().runOnce();

        assertEquals(RegenerationTaskEntity.TaskStatus.CANCELLED, task.getTaskStatus());
        assertEquals("MAX_ATTEMPTS_EXCEEDED", task.getLastErrorCode());
        Mockito.verify(renderer, never()).render(any());
        Mockito.verify(requestRepo).recordFailure(eq(10L), eq("MAX_ATTEMPTS_EXCEEDED"), anyString(), any());

        ArgumentCaptor<NotificationContext> ctx = ArgumentCaptor.forClass(NotificationContext.class);
        Mockito.verify(notifier).send(eq(TemplateKind.FAILURE_ALERT), eq("admin@test.local"), ctx.capture());
        assertEquals(10L, ctx.getValue().requestId());
        assertEquals("MAX_ATTEMPTS_EXCEEDED", ctx.getValue().errorCode());
        assertEquals(props.getWorker().getMaxAttempts(), ctx.getValue().attempt());
        assertFalse(ctx.getValue().willRetry());
        assertEquals("http://test.local/admin/review?customerId=1&requestId=10", ctx.getValue().reviewUrl());
    }

    @Test
    void failure_alert_links_to_review_page() throws Exception {
        Mockito.when(renderer.render(any())).thenThrow(new RuntimeException("boom"));

        worker().runOnce();

        ArgumentCaptor<NotificationContext> ctx = ArgumentCaptor.forClass(NotificationContext.class);
        Mockito.verify(notifier).send(eq(TemplateKind.FAILURE_ALERT), anyString(), ctx.capture());
        assertEquals(new RevisionLinks(props).reviewUrl(1L, 10L), ctx.getValue().reviewUrl());
        assertNotNull(ctx.getValue().reviewUrl());
    }

    @Test
    void auth_failure_is_not_retried() throws Exception {
        Mockito.when(renderer.render(any())).thenThrow(new RenderFailedException("RENDER_AUTH_FAILED", "401"));

        worker().runOnce();

        assertEquals(RegenerationTaskEntity.TaskStatus.CANCELLED, task.getTaskStatus());
        assertEquals("RENDER_AUTH_FAILED", task.getLastErrorCode());
        assertTrue(TaskRetryPolicy.isNonRetryable("RENDER_AUTH_FAILED"));
    }

    @Test
    void request_no_longer_processing_should_cancel_without_render() throws Exception {
        request.setStatus(RequestStatus.APPROVED);

        worker().runOnce();

        assertEquals(RegenerationTaskEntity.TaskStatus.CANCELLED, task.getTaskStatus());
        assertEquals("ALREADY_DONE", task.getLastErrorCode());
        Mockito.verify(renderer, never()).render(any());
        Mockito.verifyNoInteractions(notifier);
    }

    @Test
    void empty_html_counts_as_failure() throws Exception {
        Mockito.when(renderer.render(any())).thenReturn(new WebsiteRenderer.RenderedWebsite("  ", "x"));

        worker().runOnce();

        assertEquals(RegenerationTaskEntity.TaskStatus.FAILED, task.getTaskStatus());
        assertEquals("RENDER_EMPTY_OUTPUT", task.getLastErrorCode());
        Mockito.verifyNoInteractions(versionService);
    }

    @Test
    void slow_renderer_should_time_out() throws Exception {
        props.setRendererTimeout(Duration.ofMillis(100));
        CountDownLatch never = new CountDownLatch(1);
        Mockito.when(renderer.render(any())).thenAnswer(inv -> {
            never.await();
            return null;
        });

        worker(new SimpleAsyncTaskExecutor("render-test-")).runOnce();

        assertEquals(RegenerationTaskEntity.TaskStatus.FAILED, task.getTaskStatus());
        assertEquals("RENDER_TIMEOUT", task.getLastErrorCode());
        Mockito.verify(notifier).send(eq(TemplateKind.FAILURE_ALERT), anyString(), any());
    }

    @Test
    void disabled_worker_does_nothing() {
        props.getWorker().setEnabled(false);

        worker().runOnce();

        Mockito.verifyNoInteractions(taskRepo, renderer, notifier);
    }
}
