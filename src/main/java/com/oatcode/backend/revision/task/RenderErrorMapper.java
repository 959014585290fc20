package com.oatcode.backend.revision.task;

import com.oatcode.backend.renderer.RenderFailedException;
import org.springframework.http.HttpHeaders;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientResponseException;

import java.net.SocketTimeoutException;
import java.util.concurrent.TimeoutException;

/**
 * renderer 丟出來的任何例外 -> (code, message, retryAfterSec)
 */
public final class RenderErrorMapper {

    private static final int MAX_MSG_LEN = 1000;

    private RenderErrorMapper() {}

    public record Mapped(String code, String message, Integer retryAfterSec) {}

    public static Mapped map(Throwable e) {
        if (e == null) return new Mapped("RENDER_FAILED", null, null);

        // ✅ renderer 自己給的 code 最準
        if (e instanceof RenderFailedException rfe) {
            Integer retryAfter = (rfe.getCause() instanceof RestClientResponseException re) ? retryAfter(re) : null;
            return new Mapped(rfe.code(), safeMsg(rfe), retryAfter);
        }

        if (isTimeout(e)) return new Mapped("RENDER_TIMEOUT", safeMsg(e), null);

        if (e instanceof RestClientResponseException re) {
            int status = re.getStatusCode().value();
            if (status == 401 || status == 403) return new Mapped("RENDER_AUTH_FAILED", "auth failed", null);
            if (status == 429) return new Mapped("RENDER_RATE_LIMITED", "rate limited", retryAfter(re));
            if (re.getStatusCode().is5xxServerError()) return new Mapped("RENDER_UPSTREAM_ERROR", "upstream 5xx", retryAfter(re));
            return new Mapped("RENDER_BAD_REQUEST", "bad request", null);
        }

        if (e instanceof ResourceAccessException rae) {
            return new Mapped("RENDER_NETWORK_ERROR", safeMsg(rae), null);
        }

        return new Mapped("RENDER_FAILED", safeMsg(e), null);
    }

    private static boolean isTimeout(Throwable e) {
        for (Throwable t = e; t != null; t = t.getCause()) {
            if (t instanceof TimeoutException || t instanceof SocketTimeoutException) return true;
            if (t.getCause() == t) break;
        }
        return false;
    }

    private static Integer retryAfter(RestClientResponseException re) {
        HttpHeaders headers = re.getResponseHeaders();
        if (headers == null) return null;
        String ra = headers.getFirst("Retry-After");
        if (ra == null || ra.isBlank()) return null;
        try {
            int v = Integer.parseInt(ra.trim());
            return v > 0 ? v : null;
        } catch (NumberFormatException ignore) {
            // HTTP-date 格式不處理，走預設退避
            return null;
        }
    }

    private static String safeMsg(Throwable e) {
        String m = e.getMessage();
        if (m == null || m.isBlank()) m = e.getClass().getSimpleName();
        return m.length() <= MAX_MSG_LEN ? m : m.substring(0, MAX_MSG_LEN);
    }
}
