package net.cadence.integration.spring.mail;

import net.cadence.core.spi.MailTransport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/** Used when no mail server is configured: notifications only go to the log. */
public final class LoggingMailTransport implements MailTransport {
    private static final Logger log = LoggerFactory.getLogger(LoggingMailTransport.class);

    @Override
    public void send(String from, List<String> recipients, String subject, String body) {
        log.info("Mail (not sent, no mail sender configured) from={} to={} subject='{}'\n{}",
                from, recipients, subject, body);
    }
}
