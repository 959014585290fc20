package com.oatcode.backend.revision;

import com.oatcode.backend.renderer.RenderFailedException;
import com.oatcode.backend.revision.task.RenderErrorMapper;
import com.oatcode.backend.revision.task.TaskRetryPolicy;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.ResourceAccessException;

import java.net.SocketTimeoutException;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class TaskRetryPolicyTest {

    @Test
    void backoff_grows_and_caps() {
        assertEquals(30, TaskRetryPolicy.nextDelaySec(1));
        assertEquals(120, TaskRetryPolicy.nextDelaySec(2));
        assertEquals(600, TaskRetryPolicy.nextDelaySec(3));
        assertEquals(1800, TaskRetryPolicy.nextDelaySec(9));
    }

    @Test
    void give_up_at_max_attempts() {
        assertFalse(TaskRetryPolicy.shouldGiveUp(2, 3));
        assertTrue(TaskRetryPolicy.shouldGiveUp(3, 3));
    }

    @Test
    void config_and_auth_errors_are_not_retried() {
        assertTrue(TaskRetryPolicy.isNonRetryable("RENDER_AUTH_FAILED"));
        assertTrue(TaskRetryPolicy.isNonRetryable("OPENAI_API_KEY_MISSING"));
        assertFalse(TaskRetryPolicy.isNonRetryable("RENDER_TIMEOUT"));
        assertFalse(TaskRetryPolicy.isNonRetryable(null));
    }

    @Test
    void mapper_keeps_renderer_code() {
        var m = RenderErrorMapper.map(new RenderFailedException("RENDER_BAD_OUTPUT", "no html"));
        assertEquals("RENDER_BAD_OUTPUT", m.code());
        assertEquals("no html", m.message());
    }

    @Test
    void mapper_reads_retry_after_on_429() {
        HttpHeaders h = new HttpHeaders();
        h.add("Retry-After", "90");
        var e = HttpClientErrorException.create(HttpStatus.TOO_MANY_REQUESTS, "Too Many Requests", h,
                new byte[0], StandardCharsets.UTF_8);

        var m = RenderErrorMapper.map(e);

        assertEquals("RENDER_RATE_LIMITED", m.code());
        assertEquals(90, m.retryAfterSec());
    }

    @Test
    void mapper_detects_timeouts_and_network_errors() {
        assertEquals("RENDER_TIMEOUT",
                RenderErrorMapper.map(new ResourceAccessException("io", new SocketTimeoutException("read timed out"))).code());
        assertEquals("RENDER_NETWORK_ERROR",
                RenderErrorMapper.map(new ResourceAccessException("connection refused")).code());
        assertEquals("RENDER_FAILED", RenderErrorMapper.map(new RuntimeException("boom")).code());
    }
}
