package net.cadence.core.notify;

import net.cadence.core.model.Job;
import net.cadence.core.model.Log;
import net.cadence.core.model.Subscriber;
import net.cadence.core.spi.MailTransport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Mails a run's outcome to the job's subscribers.
 * <ul>
 *   <li>failed run: error subscribers, with stderr and a link to the log</li>
 *   <li>successful run with output: info subscribers, with stdout</li>
 *   <li>successful run without output: nothing</li>
 * </ul>
 */
public final class NotificationDispatcher {
    private static final Logger log = LoggerFactory.getLogger(NotificationDispatcher.class);

    private final MailTransport transport;
    private final NotificationSettings settings;

    public NotificationDispatcher(MailTransport transport, NotificationSettings settings) {
        this.transport = transport;
        this.settings = settings;
    }

    /**
     * @return the notification that was sent, if any
     * @throws NotificationException when the transport fails
     */
    public Optional<Notification> dispatch(Log entry, Job job) {
        Optional<Notification> built = build(entry, job);
        if (built.isEmpty()) return built;

        Notification n = built.get();
        if (n.recipients().isEmpty()) {
            log.debug("No {} subscribers for job '{}', nothing sent", n.kind(), job.name());
            return Optional.empty();
        }
        try {
            transport.send(settings.from(), n.recipients(), n.subject(), n.body());
        } catch (Exception e) {
            throw new NotificationException("Failed to mail " + n.kind() + " notification for job '" + job.name() + "'", e);
        }
        log.info("Sent {} notification for job '{}' to {} recipient(s)", n.kind(), job.name(), n.recipients().size());
        return built;
    }

    Optional<Notification> build(Log entry, Job job) {
        Notification.Kind kind;
        List<Subscriber> subscribers;
        String infoOutput;

        if (!entry.success()) {
            kind = Notification.Kind.ERROR;
            subscribers = job.errorSubscribers();
            infoOutput = entry.id() == null ? "" : settings.logUrl(entry.id());
        } else if (!entry.stdout().isEmpty() || !entry.stderr().isEmpty()) {
            kind = Notification.Kind.INFO;
            subscribers = job.infoSubscribers();
            infoOutput = entry.stdout();
        } else {
            return Optional.empty();
        }

        var ctx = new NotificationContext(entry, job.name(), infoOutput, entry.stderr(), settings.subjectPrefix());
        List<String> recipients = subscribers.stream().map(Subscriber::address).toList();
        return Optional.of(new Notification(kind, recipients, MessageTemplates.subject(ctx), MessageTemplates.body(ctx)));
    }
}
