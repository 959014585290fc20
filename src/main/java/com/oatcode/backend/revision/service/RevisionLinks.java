package com.oatcode.backend.revision.service;

import com.oatcode.backend.revision.config.RevisionProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@RequiredArgsConstructor
@Component
public class RevisionLinks {

    private final RevisionProperties props;

    public String reviewUrl(Long customerId, Long requestId) {
        return base() + "/admin/review?customerId=" + customerId + "&requestId=" + requestId;
    }

    public String approveUrl(Long customerId, Long requestId) {
        return base() + "/admin/approve?customerId=" + customerId + "&requestId=" + requestId;
    }

    public String regenerateUrl() {
        return base() + "/admin/regenerate";
    }

    /** 客戶看得到的網址：只會回審核通過（current）的版本 */
    public String websiteUrl(Long customerId) {
        return base() + "/sites/" + customerId;
    }

    public String revisionFormUrl(Long customerId) {
        return base() + "/request-changes?customerId=" + customerId;
    }

    private String base() {
        String b = props.getPublicBaseUrl();
        if (b == null) return "";
        return b.endsWith("/") ? b.substring(0, b.length() - 1) : b;
    }
}
