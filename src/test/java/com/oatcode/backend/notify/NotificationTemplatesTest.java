package com.oatcode.backend.notify;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class NotificationTemplatesTest {

    private final NotificationTemplates templates = new NotificationTemplates();

    @Test
    void admin_review_carries_review_link_and_version() {
        var r = templates.render(TemplateKind.ADMIN_REVIEW_REQUEST, NotificationContext.builder()
                .customerId(1L).requestId(10L).customerEmail("owner@joes.com").businessName("Joe's Plumbing")
                .versionNumber(3).reviewUrl("http://x/admin/review?customerId=1&requestId=10")
                .description("Make it blue").build());

        assertEquals("Review Website: Joe's Plumbing", r.subject());
        assertTrue(r.body().contains("v3"));
        assertTrue(r.body().contains("http://x/admin/review?customerId=1&requestId=10"));
        assertTrue(r.body().contains("Pre-Purchase Demo"));
    }

    @Test
    void failure_alert_carries_customer_and_original_description() {
        var r = templates.render(TemplateKind.FAILURE_ALERT, NotificationContext.builder()
                .customerId(42L).requestId(10L).customerEmail("owner@joes.com")
                .description("Add a gallery").errorCode("RENDER_TIMEOUT").errorMessage("slow")
                .attempt(1).maxAttempts(3).willRetry(true)
                .reviewUrl("http://x/admin/review?customerId=42&requestId=10").build());

        assertTrue(r.subject().startsWith("Regeneration Failed"));
        assertTrue(r.body().contains("Review: http://x/admin/review?customerId=42&requestId=10"));
        assertTrue(r.body().contains("Customer ID: 42"));
        assertTrue(r.body().contains("Add a gallery"));
        assertTrue(r.body().contains("RENDER_TIMEOUT"));
        assertTrue(r.body().contains("retry is scheduled"));
    }

    @Test
    void delivery_wording_follows_paying_flag() {
        var demo = templates.render(TemplateKind.REVISION_DELIVERED, NotificationContext.builder()
                .websiteUrl("http://x/sites/1").payingCustomer(false).build());
        var paid = templates.render(TemplateKind.REVISION_DELIVERED, NotificationContext.builder()
                .websiteUrl("http://x/sites/1").payingCustomer(true).build());
        var welcome = templates.render(TemplateKind.PAID_WELCOME, NotificationContext.builder()
                .businessName("Joe's Plumbing").websiteUrl("http://x/sites/1").build());

        assertEquals("Your Updated Demo is Ready!", demo.subject());
        assertEquals("Your Updated Website is Ready!", paid.subject());
        assertEquals("Welcome to OatCode - Your Website is Ready!", welcome.subject());
        assertTrue(welcome.body().contains("http://x/sites/1"));
    }
}
