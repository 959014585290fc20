package com.oatcode.backend.revision.model;

import com.oatcode.backend.revision.web.IllegalTransitionException;

import java.util.EnumSet;
import java.util.Set;

/**
 * PROCESSING：已收到需求，等 renderer 產出（renderer 失敗也停在這裡，等重試）
 * PENDING_APPROVAL：新版本已產生，等人工審核
 * APPROVED：審核通過並寄出（終態）
 */
public enum RequestStatus {
    PROCESSING,
    PENDING_APPROVAL,
    APPROVED;

    private static final Set<RequestStatus> ACTIVE = EnumSet.of(PROCESSING, PENDING_APPROVAL);

    public boolean isActive() {
        return ACTIVE.contains(this);
    }

    public boolean isTerminal() {
        return this == APPROVED;
    }

    public boolean canTransitionTo(RequestStatus target) {
        if (target == null) return false;
        return switch (this) {
            // PROCESSING -> PROCESSING：renderer 失敗，留在原地等重試
            case PROCESSING -> target == PENDING_APPROVAL || target == PROCESSING;
            // 退件回 PROCESSING（附 admin feedback）
            case PENDING_APPROVAL -> target == APPROVED || target == PROCESSING;
            case APPROVED -> false;
        };
    }

    public void assertTransition(RequestStatus target) {
        if (!canTransitionTo(target)) {
            throw new IllegalTransitionException(this, target);
        }
    }
}
