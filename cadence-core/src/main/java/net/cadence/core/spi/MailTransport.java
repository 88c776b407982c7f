package net.cadence.core.spi;

import java.util.List;

public interface MailTransport {
    void send(String from, List<String> recipients, String subject, String body) throws Exception;
}
