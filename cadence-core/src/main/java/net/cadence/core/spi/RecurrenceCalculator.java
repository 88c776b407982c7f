package net.cadence.core.spi;

import net.cadence.core.model.Frequency;
import net.cadence.core.recurrence.RecurrenceParams;

import java.time.Instant;
import java.util.Optional;

public interface RecurrenceCalculator {
    /** First occurrence strictly after {@code after}; empty once the rule is exhausted. */
    Optional<Instant> next(Frequency frequency, RecurrenceParams params, Instant after);
}
