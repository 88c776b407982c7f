package net.cadence.core.support;

import net.cadence.core.spi.MailTransport;

import java.util.ArrayList;
import java.util.List;

public final class RecordingMailTransport implements MailTransport {
    public record Sent(String from, List<String> recipients, String subject, String body) {}

    public final List<Sent> sent = new ArrayList<>();
    public Exception failWith;

    @Override
    public void send(String from, List<String> recipients, String subject, String body) throws Exception {
        if (failWith != null) throw failWith;
        sent.add(new Sent(from, List.copyOf(recipients), subject, body));
    }
}
