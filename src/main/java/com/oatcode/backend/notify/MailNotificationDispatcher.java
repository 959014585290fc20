package com.oatcode.backend.notify;

import com.oatcode.backend.notify.entity.NotificationLogEntity;
import com.oatcode.backend.notify.repo.NotificationLogRepository;
import com.oatcode.backend.revision.config.RevisionProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.mail.SimpleMailMessage;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.stereotype.Component;

@Slf4j
@RequiredArgsConstructor
@Component
public class MailNotificationDispatcher implements NotificationDispatcher {

    private static final int MAX_ERROR_LEN = 1000;

    private final JavaMailSender mail;
    private final NotificationTemplates templates;
    private final NotificationLogRepository logRepo;
    private final RevisionProperties props;

    @Override
    public void send(TemplateKind kind, String recipient, NotificationContext context) {
        if (recipient == null || recipient.isBlank()) {
            log.warn("notification skipped, no recipient. kind={} requestId={}", kind, context.requestId());
            return;
        }

        NotificationTemplates.Rendered rendered = null;
        NotificationLogEntity.Outcome outcome;
        String error = null;
        try {
            rendered = templates.render(kind, context);

            var msg = new SimpleMailMessage();
            msg.setFrom(props.getSenderName() + " <" + props.getSenderEmail() + ">");
            msg.setTo(recipient);
            msg.setSubject(rendered.subject());
            msg.setText(rendered.body());
            mail.send(msg);

            outcome = NotificationLogEntity.Outcome.SENT;
            log.info("notification sent. kind={} to={} customerId={} requestId={}",
                    kind, recipient, context.customerId(), context.requestId());
        } catch (RuntimeException e) {
            // ✅ best-effort：寄不出去只記錄，不往上丟
            outcome = NotificationLogEntity.Outcome.FAILED;
            error = truncate(e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage());
            log.warn("notification failed. kind={} to={} customerId={} requestId={}",
                    kind, recipient, context.customerId(), context.requestId(), e);
        }

        record(kind, recipient, rendered, context, outcome, error);
    }

    private void record(TemplateKind kind,
                        String recipient,
                        NotificationTemplates.Rendered rendered,
                        NotificationContext context,
                        NotificationLogEntity.Outcome outcome,
                        String error) {
        try {
            NotificationLogEntity e = new NotificationLogEntity();
            e.setKind(kind);
            e.setRecipient(recipient);
            e.setSubject(rendered == null ? null : rendered.subject());
            e.setCustomerId(context.customerId());
            e.setRequestId(context.requestId());
            e.setOutcome(outcome);
            e.setError(error);
            logRepo.save(e);
        } catch (RuntimeException ex) {
            log.warn("notification log write failed. kind={} requestId={}", kind, context.requestId(), ex);
        }
    }

    private static String truncate(String s) {
        return s.length() <= MAX_ERROR_LEN ? s : s.substring(0, MAX_ERROR_LEN);
    }
}
