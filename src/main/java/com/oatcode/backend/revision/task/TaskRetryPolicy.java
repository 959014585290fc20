package com.oatcode.backend.revision.task;

/**
 * 重產任務的重試規則：次數上限走設定（app.revision.worker.max-attempts），這裡只管退避跟哪些錯不重試
 * attempts 用 markRunning 之後的值（這次是第幾次真的呼叫 renderer）
 */
public final class TaskRetryPolicy {

    private TaskRetryPolicy() {}

    /** 退避：30s, 2m, 10m（上限 30m） */
    public static int nextDelaySec(int attempts) {
        if (attempts <= 1) return 30;
        if (attempts == 2) return 120;
        if (attempts == 3) return 600;
        return 1800;
    }

    public static boolean shouldGiveUp(int attempts, int maxAttempts) {
        return attempts >= maxAttempts;
    }

    /**
     * ✅ 不可重試：設定或授權問題，重跑只會一直失敗
     */
    public static boolean isNonRetryable(String code) {
        if (code == null || code.isBlank()) return false;
        return switch (code) {
            case "RENDER_AUTH_FAILED",
                 "RENDER_BAD_REQUEST",
                 "OPENAI_API_KEY_MISSING",
                 "OPENAI_BASE_URL_MISSING" -> true;
            default -> false;
        };
    }
}
