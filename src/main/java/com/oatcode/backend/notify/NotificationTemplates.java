package com.oatcode.backend.notify;

import org.springframework.stereotype.Component;

/**
 * 純文字模板。版面設計不在這裡處理，只保證每種 kind 帶到必要資訊。
 */
@Component
public class NotificationTemplates {

    public record Rendered(String subject, String body) {}

    public Rendered render(TemplateKind kind, NotificationContext c) {
        return switch (kind) {
            case CUSTOMER_ACK -> customerAck(c);
            case ADMIN_REVIEW_REQUEST -> adminReview(c);
            case PAID_WELCOME -> paidWelcome(c);
            case REVISION_DELIVERED -> revisionDelivered(c);
            case FAILURE_ALERT -> failureAlert(c);
        };
    }

    private Rendered customerAck(NotificationContext c) {
        String what = c.payingCustomer() ? "website" : "demo";
        String body = "Hi there,\n\n"
                + "We received your change request!\n\n"
                + "Your requested changes:\n" + nz(c.description()) + "\n\n"
                + "You'll receive your updated " + what + " within 24-48 hours. "
                + "We review every website before sending it to you.\n\n"
                + "Revisions are free - request as many changes as you need.\n\n"
                + "Best regards,\nOatCode Team";
        return new Rendered("Changes Received - We're On It!", body);
    }

    private Rendered adminReview(NotificationContext c) {
        String body = "Website ready for review\n\n"
                + "Customer: " + nz(c.customerEmail()) + "\n"
                + "Business: " + nz(c.businessName()) + "\n"
                + "Type: " + (c.payingCustomer() ? "Paid Customer" : "Pre-Purchase Demo") + "\n"
                + "Request: #" + c.requestId() + " (" + nz(c.requestType()) + ")\n"
                + "Version: v" + c.versionNumber() + "\n\n"
                + "Changes:\n" + nz(c.description()) + "\n\n"
                + "Review: " + nz(c.reviewUrl()) + "\n\n"
                + "Options: approve & send, or request changes from the generator.";
        return new Rendered("Review Website: " + nz(c.businessName()), body);
    }

    private Rendered paidWelcome(NotificationContext c) {
        String body = "Hi " + nz(c.businessName()) + ",\n\n"
                + "Welcome to OatCode - your website is ready!\n\n"
                + "View it here: " + nz(c.websiteUrl()) + "\n\n"
                + "Want something changed? Request a revision any time: " + nz(c.revisionFormUrl()) + "\n\n"
                + "Best regards,\nOatCode Team";
        return new Rendered("Welcome to OatCode - Your Website is Ready!", body);
    }

    private Rendered revisionDelivered(NotificationContext c) {
        String what = c.payingCustomer() ? "Website" : "Demo";
        String body = "Hi there,\n\n"
                + "Your updated " + what.toLowerCase() + " is ready: " + nz(c.websiteUrl()) + "\n\n"
                + "Need more changes? " + nz(c.revisionFormUrl()) + "\n\n"
                + "Best regards,\nOatCode Team";
        return new Rendered("Your Updated " + what + " is Ready!", body);
    }

    private Rendered failureAlert(NotificationContext c) {
        String retry = c.willRetry()
                ? "An automatic retry is scheduled."
                : "No automatic retry left - re-trigger manually or resubmit feedback.";
        String body = "Website regeneration failed\n\n"
                + "Customer ID: " + c.customerId() + "\n"
                + "Customer: " + nz(c.customerEmail()) + "\n"
                + "Request: #" + c.requestId() + "\n"
                + "Attempt: " + c.attempt() + "/" + c.maxAttempts() + "\n"
                + "Error: [" + nz(c.errorCode()) + "] " + nz(c.errorMessage()) + "\n\n"
                + "Original description:\n" + nz(c.description()) + "\n\n"
                + retry + "\n"
                + "Review: " + nz(c.reviewUrl());
        return new Rendered("Regeneration Failed - " + nz(c.customerEmail()), body);
    }

    private static String nz(String s) {
        return (s == null || s.isBlank()) ? "N/A" : s;
    }
}
