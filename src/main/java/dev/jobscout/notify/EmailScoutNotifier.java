package dev.jobscout.notify;

import dev.jobscout.config.ScoutConfig;
import jakarta.mail.MessagingException;
import jakarta.mail.internet.MimeMessage;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.mail.MailException;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.mail.javamail.MimeMessageHelper;
import org.springframework.stereotype.Service;
import org.thymeleaf.TemplateEngine;
import org.thymeleaf.context.Context;
import reactor.core.publisher.Mono;

import java.util.Locale;

/**
 * Sends run summaries as HTML e-mail rendered from the {@code email/scout-summary} template.
 */
@Slf4j
@Service
@RequiredArgsConstructor
@ConditionalOnProperty(name = "scout.notify.channel", havingValue = "email")
public class EmailScoutNotifier implements ScoutNotifier {

    private final JavaMailSender mailSender;
    private final TemplateEngine templateEngine;
    private final ScoutConfig scoutConfig;

    @Override
    @SuppressWarnings("null")
    public Mono<Boolean> notify(String recipient, ScoutNotification notification) {
        String to = recipient != null ? recipient : scoutConfig.getNotify().getRecipient();
        if (to == null || to.isBlank()) {
            log.warn("No e-mail recipient configured, summary for {} not sent", notification.runId());
            return Mono.just(false);
        }

        return Mono.fromCallable(() -> {
            try {
                MimeMessage message = mailSender.createMimeMessage();
                MimeMessageHelper helper = new MimeMessageHelper(message, true, "UTF-8");

                String from = scoutConfig.getNotify().getFrom();
                if (from != null && !from.isBlank()) {
                    helper.setFrom(from);
                }
                helper.setTo(to);
                helper.setSubject(notification.subject());
                helper.setText(generateEmailContent(notification), true);

                mailSender.send(message);
                log.info("Scout summary {} e-mailed to {}", notification.runId(), to);
                return true;

            } catch (MessagingException | MailException e) {
                log.error("Failed to send scout summary e-mail: {}", e.getMessage(), e);
                return false;
            }
        });
    }

    private String generateEmailContent(ScoutNotification notification) {
        Context context = new Context(Locale.getDefault());
        context.setVariable("runId", notification.runId());
        context.setVariable("subject", notification.subject());
        context.setVariable("lines", notification.text().split("\n"));
        context.setVariable("highlights", notification.highlights());
        return templateEngine.process("email/scout-summary", context);
    }
}
