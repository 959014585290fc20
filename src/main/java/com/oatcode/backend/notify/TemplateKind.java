package com.oatcode.backend.notify;

public enum TemplateKind {
    /** 客戶：已收到需求 */
    CUSTOMER_ACK,
    /** 審核者：有新版本待審 */
    ADMIN_REVIEW_REQUEST,
    /** 付費客戶第一次交付 */
    PAID_WELCOME,
    /** 修改版 / demo 交付 */
    REVISION_DELIVERED,
    /** 審核者：renderer 失敗 */
    FAILURE_ALERT
}
