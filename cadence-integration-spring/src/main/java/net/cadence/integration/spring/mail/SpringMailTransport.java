package net.cadence.integration.spring.mail;

import net.cadence.core.spi.MailTransport;
import org.springframework.mail.MailSender;
import org.springframework.mail.SimpleMailMessage;

import java.util.List;

/** Plain-text mail through whatever {@link MailSender} the application configured. */
public final class SpringMailTransport implements MailTransport {
    private final MailSender sender;

    public SpringMailTransport(MailSender sender) {
        this.sender = sender;
    }

    @Override
    public void send(String from, List<String> recipients, String subject, String body) {
        SimpleMailMessage msg = new SimpleMailMessage();
        msg.setFrom(from);
        msg.setTo(recipients.toArray(String[]::new));
        msg.setSubject(subject);
        msg.setText(body);
        sender.send(msg);
    }
}
