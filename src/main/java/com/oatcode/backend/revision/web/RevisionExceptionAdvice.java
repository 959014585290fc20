package com.oatcode.backend.revision.web;

import com.oatcode.backend.common.web.RequestIdFilter;
import com.oatcode.backend.revision.controller.PublicSiteController;
import com.oatcode.backend.revision.controller.ReviewController;
import com.oatcode.backend.revision.controller.RevisionRequestController;
import com.oatcode.backend.revision.dto.RevisionErrorResponse;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

@Slf4j
@RestControllerAdvice(assignableTypes = {
        RevisionRequestController.class,
        ReviewController.class,
        PublicSiteController.class
})
@Order(Ordered.HIGHEST_PRECEDENCE)
public class RevisionExceptionAdvice {

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<RevisionErrorResponse> handleIllegalArg(IllegalArgumentException e, HttpServletRequest req) {
        String code = norm(e.getMessage(), "BAD_REQUEST");
        HttpStatus status = switch (code) {
            case "CUSTOMER_NOT_FOUND",
                 "REQUEST_NOT_FOUND",
                 "NO_PENDING_REQUEST",
                 "VERSION_NOT_FOUND",
                 "SITE_NOT_FOUND" -> HttpStatus.NOT_FOUND;

            case "EMAIL_REQUIRED",
                 "DESCRIPTION_REQUIRED",
                 "FEEDBACK_REQUIRED" -> HttpStatus.BAD_REQUEST;

            default -> HttpStatus.BAD_REQUEST;
        };
        return ResponseEntity.status(status).body(err(code, e, req));
    }

    /**
     * 冷卻期內重送：429 + Retry-After
     */
    @ExceptionHandler(SubmissionCooldownException.class)
    public ResponseEntity<RevisionErrorResponse> handleCooldown(SubmissionCooldownException e, HttpServletRequest req) {
        int seconds = Math.max(0, e.retryAfterSec());
        String nextUtc = (e.nextAllowedAtUtc() == null) ? null : e.nextAllowedAtUtc().toString();

        return ResponseEntity.status(HttpStatus.TOO_MANY_REQUESTS)
                .header(HttpHeaders.RETRY_AFTER, String.valueOf(seconds))
                .body(new RevisionErrorResponse(
                        "DUPLICATE_SUBMISSION",
                        "You already submitted a request recently. Please wait before sending another one.",
                        rid(req),
                        seconds,
                        nextUtc,
                        null
                ));
    }

    @ExceptionHandler(RequestAlreadyHandledException.class)
    public ResponseEntity<RevisionErrorResponse> handleAlreadyHandled(RequestAlreadyHandledException e, HttpServletRequest req) {
        String current = (e.currentStatus() == null) ? null : e.currentStatus().name();
        return ResponseEntity.status(HttpStatus.CONFLICT)
                .body(new RevisionErrorResponse(
                        "REQUEST_ALREADY_HANDLED",
                        "Request " + e.requestId() + " was already handled (now " + current + ")",
                        rid(req),
                        null,
                        null,
                        current
                ));
    }

    @ExceptionHandler(IllegalTransitionException.class)
    public ResponseEntity<RevisionErrorResponse> handleTransition(IllegalTransitionException e, HttpServletRequest req) {
        return ResponseEntity.status(HttpStatus.CONFLICT)
                .body(new RevisionErrorResponse(
                        "ILLEGAL_TRANSITION",
                        safeMsgOrCode(e, "ILLEGAL_TRANSITION"),
                        rid(req),
                        null,
                        null,
                        e.from().name()
                ));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<RevisionErrorResponse> handleValidation(MethodArgumentNotValidException e, HttpServletRequest req) {
        var fieldErrors = e.getBindingResult().getFieldErrors();
        String msg = fieldErrors.isEmpty()
                ? "VALIDATION_FAILED"
                : fieldErrors.get(0).getField() + " " + fieldErrors.get(0).getDefaultMessage();
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(new RevisionErrorResponse("VALIDATION_FAILED", msg, rid(req)));
    }

    @ExceptionHandler({
            HttpMessageNotReadableException.class,
            MissingServletRequestParameterException.class,
            MethodArgumentTypeMismatchException.class
    })
    public ResponseEntity<RevisionErrorResponse> handleBadInput(Exception e, HttpServletRequest req) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(err("VALIDATION_FAILED", e, req));
    }

    @ExceptionHandler(IllegalStateException.class)
    public ResponseEntity<RevisionErrorResponse> handleIllegalState(IllegalStateException e, HttpServletRequest req) {
        String code = norm(e.getMessage(), "ILLEGAL_STATE");
        HttpStatus status = "VERSION_MISSING".equals(code) ? HttpStatus.CONFLICT : HttpStatus.INTERNAL_SERVER_ERROR;
        if (status.is5xxServerError()) log.error("illegal state. rid={}", rid(req), e);
        return ResponseEntity.status(status).body(err(code, e, req));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<RevisionErrorResponse> handleUnknown(Exception e, HttpServletRequest req) {
        log.error("unhandled error. rid={}", rid(req), e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(err("INTERNAL_ERROR", e, req));
    }

    // ===== helpers =====

    private static RevisionErrorResponse err(String code, Throwable e, HttpServletRequest req) {
        return new RevisionErrorResponse(code, safeMsgOrCode(e, code), rid(req));
    }

    private static String rid(HttpServletRequest req) {
        return RequestIdFilter.getOrCreate(req);
    }

    private static String norm(String msg, String fallback) {
        if (msg == null) return fallback;
        String c = msg.trim();
        return c.isEmpty() ? fallback : c;
    }

    private static String safeMsgOrCode(Throwable t, String code) {
        String m = t.getMessage();
        if (m == null || m.isBlank()) return code;
        return m;
    }
}
