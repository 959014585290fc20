package com.oatcode.backend.revision.model;

public enum RequestType {
    /** 付款後第一次產生網站 */
    INITIAL_PURCHASE,
    /** 客戶自己從表單送出的修改 */
    REVISION,
    /** 審核者退件重產 */
    ADMIN_REVISION
}
