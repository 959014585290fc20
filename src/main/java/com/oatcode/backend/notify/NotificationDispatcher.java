package com.oatcode.backend.notify;

/**
 * Transactional email 出口。fire-and-forget：實作必須吞掉寄送失敗（只記 log），
 * 呼叫端的狀態轉換才是真相，通知失敗不能讓它回滾。
 */
public interface NotificationDispatcher {

    void send(TemplateKind kind, String recipient, NotificationContext context);
}
