package net.cadence.core.recurrence;

import net.cadence.core.model.Frequency;
import net.cadence.core.spi.RecurrenceCalculator;

import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Computes occurrences of a recurrence rule (frequency + parameters) in the style of iCalendar
 * RRULEs, limited to the keys in {@link #SUPPORTED_KEYS}.
 * <p>
 * The rule starts at the reference timestamp truncated to whole seconds. Time fields finer than the
 * frequency default to the start's own fields, so a DAILY rule without {@code byhour} repeats at the
 * start's time of day. {@code count} counts occurrences from the start, the start itself included
 * when it matches.
 */
public final class RecurrenceEngine implements RecurrenceCalculator {

    public static final Set<String> SUPPORTED_KEYS = Set.of(
            "interval", "count", "wkst",
            "bymonth", "bymonthday", "byyearday", "byweekday",
            "byhour", "byminute", "bysecond");

    private static final long MAX_ITERATIONS = 5_000_000L;
    private static final long MAX_HORIZON_YEARS = 100_000L;

    private final ZoneId zone;

    public RecurrenceEngine() {
        this(ZoneOffset.UTC);
    }

    public RecurrenceEngine(ZoneId zone) {
        this.zone = Objects.requireNonNull(zone);
    }

    public ZoneId zone() { return zone; }

    public static RecurrenceParams parseParams(String text) {
        return RecurrenceParams.parse(text);
    }

    public Optional<Instant> nextOccurrence(Frequency frequency, String params, Instant after) {
        return next(frequency, RecurrenceParams.parse(params), after);
    }

    @Override
    public Optional<Instant> next(Frequency frequency, RecurrenceParams params, Instant after) {
        Objects.requireNonNull(after, "after");
        Rule rule = Rule.of(frequency == null ? Frequency.DAILY : frequency,
                params == null ? RecurrenceParams.empty() : params,
                LocalDateTime.ofInstant(after.truncatedTo(ChronoUnit.SECONDS), zone),
                zone);
        try {
            return rule.firstAfter(after);
        } catch (DateTimeException e) {
            // stepped past the supported date range
            return Optional.empty();
        }
    }

    private static final class Rule {
        final Frequency freq;
        final int interval;
        final Integer count;
        final int wkst;               // 0 = Monday
        final Set<Integer> months;    // null = unrestricted
        final Set<Integer> monthDays;
        final Set<Integer> yearDays;
        final Set<Integer> weekdays;
        final TreeSet<Integer> hours;
        final TreeSet<Integer> minutes;
        final TreeSet<Integer> seconds;
        final LocalDateTime start;
        final ZoneId zone;

        private Rule(Frequency freq, int interval, Integer count, int wkst,
                     Set<Integer> months, Set<Integer> monthDays, Set<Integer> yearDays, Set<Integer> weekdays,
                     TreeSet<Integer> hours, TreeSet<Integer> minutes, TreeSet<Integer> seconds,
                     LocalDateTime start, ZoneId zone) {
            this.freq = freq;
            this.interval = interval;
            this.count = count;
            this.wkst = wkst;
            this.months = months;
            this.monthDays = monthDays;
            this.yearDays = yearDays;
            this.weekdays = weekdays;
            this.hours = hours;
            this.minutes = minutes;
            this.seconds = seconds;
            this.start = start;
            this.zone = zone;
        }

        static Rule of(Frequency freq, RecurrenceParams p, LocalDateTime start, ZoneId zone) {
            for (String key : p.keys()) {
                if (!SUPPORTED_KEYS.contains(key)) {
                    throw new RecurrenceParseException("Unsupported recurrence parameter '" + key + "'");
                }
            }
            int interval = scalar(p, "interval", 1, 1, Integer.MAX_VALUE);
            Integer count = p.has("count") ? scalar(p, "count", 1, 1, Integer.MAX_VALUE) : null;
            int wkst = scalar(p, "wkst", 0, 0, 6);

            Set<Integer> months = set(p, "bymonth", 1, 12, false);
            Set<Integer> monthDays = set(p, "bymonthday", -31, 31, true);
            Set<Integer> yearDays = set(p, "byyearday", -366, 366, true);
            Set<Integer> weekdays = set(p, "byweekday", 0, 6, false);
            TreeSet<Integer> hours = set(p, "byhour", 0, 23, false);
            TreeSet<Integer> minutes = set(p, "byminute", 0, 59, false);
            TreeSet<Integer> seconds = set(p, "bysecond", 0, 59, false);

            if (monthDays == null && yearDays == null && weekdays == null) {
                switch (freq) {
                    case YEARLY -> {
                        if (months == null) months = new TreeSet<>(Set.of(start.getMonthValue()));
                        monthDays = new TreeSet<>(Set.of(start.getDayOfMonth()));
                    }
                    case MONTHLY -> monthDays = new TreeSet<>(Set.of(start.getDayOfMonth()));
                    case WEEKLY -> weekdays = new TreeSet<>(Set.of(start.getDayOfWeek().getValue() - 1));
                    default -> { }
                }
            }
            if (hours == null && freq.coarserThan(Frequency.HOURLY)) hours = new TreeSet<>(Set.of(start.getHour()));
            if (minutes == null && freq.coarserThan(Frequency.MINUTELY)) minutes = new TreeSet<>(Set.of(start.getMinute()));
            if (seconds == null && freq.coarserThan(Frequency.SECONDLY)) seconds = new TreeSet<>(Set.of(start.getSecond()));

            return new Rule(freq, interval, count, wkst, months, monthDays, yearDays, weekdays,
                    hours, minutes, seconds, start, zone);
        }

        Optional<Instant> firstAfter(Instant after) {
            Instant startInstant = start.atZone(zone).toInstant();
            LocalDate horizon = start.toLocalDate()
                    .plusYears(Math.min(MAX_HORIZON_YEARS, 400L * interval + 1));

            long emitted = 0;
            long iterations = 0;
            LocalDateTime cursor = firstPeriod();

            while (!cursor.toLocalDate().isAfter(horizon) && iterations++ < MAX_ITERATIONS) {
                LocalDateTime skipTo = rejectedUntil(cursor);
                if (skipTo != null) {
                    cursor = skip(cursor, skipTo);
                    continue;
                }
                for (LocalDateTime candidate : candidates(cursor)) {
                    Instant at = candidate.atZone(zone).toInstant();
                    if (at.isBefore(startInstant)) continue;
                    if (count != null && emitted >= count) return Optional.empty();
                    emitted++;
                    if (at.isAfter(after)) return Optional.of(at);
                }
                cursor = nextPeriod(cursor);
            }
            return Optional.empty();
        }

        private LocalDateTime firstPeriod() {
            LocalDate d = start.toLocalDate();
            return switch (freq) {
                case YEARLY -> d.withDayOfYear(1).atStartOfDay();
                case MONTHLY -> d.withDayOfMonth(1).atStartOfDay();
                case WEEKLY -> d.minusDays(Math.floorMod(d.getDayOfWeek().getValue() - 1 - wkst, 7)).atStartOfDay();
                case DAILY -> d.atStartOfDay();
                case HOURLY -> start.truncatedTo(ChronoUnit.HOURS);
                case MINUTELY -> start.truncatedTo(ChronoUnit.MINUTES);
                case SECONDLY -> start;
            };
        }

        private LocalDateTime nextPeriod(LocalDateTime cursor) {
            return switch (freq) {
                case YEARLY -> cursor.plusYears(interval);
                case MONTHLY -> cursor.plusMonths(interval);
                case WEEKLY -> cursor.plusWeeks(interval);
                case DAILY -> cursor.plusDays(interval);
                case HOURLY -> cursor.plusHours(interval);
                case MINUTELY -> cursor.plusMinutes(interval);
                case SECONDLY -> cursor.plusSeconds(interval);
            };
        }

        /**
         * For sub-daily frequencies: the boundary to skip to when the whole period is filtered out,
         * or null when the period may produce candidates.
         */
        private LocalDateTime rejectedUntil(LocalDateTime cursor) {
            if (!Frequency.DAILY.coarserThan(freq)) return null;

            if (!dayMatches(cursor.toLocalDate())) {
                return cursor.toLocalDate().plusDays(1).atStartOfDay();
            }
            if (hours != null && !hours.contains(cursor.getHour())) {
                return cursor.truncatedTo(ChronoUnit.HOURS).plusHours(1);
            }
            if (freq == Frequency.SECONDLY && minutes != null && !minutes.contains(cursor.getMinute())) {
                return cursor.truncatedTo(ChronoUnit.MINUTES).plusMinutes(1);
            }
            return null;
        }

        private LocalDateTime skip(LocalDateTime cursor, LocalDateTime boundary) {
            long unit = switch (freq) {
                case HOURLY -> 3600L;
                case MINUTELY -> 60L;
                default -> 1L;
            };
            long step = unit * interval;
            long gap = Duration.between(cursor, boundary).getSeconds();
            long steps = Math.max(1, (gap + step - 1) / step);
            return cursor.plusSeconds(steps * step);
        }

        private List<LocalDateTime> candidates(LocalDateTime cursor) {
            List<LocalDateTime> out = new ArrayList<>();
            switch (freq) {
                case YEARLY, MONTHLY, WEEKLY, DAILY -> {
                    LocalDate from = cursor.toLocalDate();
                    LocalDate to = switch (freq) {
                        case YEARLY -> from.plusYears(1);
                        case MONTHLY -> from.plusMonths(1);
                        case WEEKLY -> from.plusWeeks(1);
                        default -> from.plusDays(1);
                    };
                    for (LocalDate d = from; d.isBefore(to); d = d.plusDays(1)) {
                        if (!dayMatches(d)) continue;
                        for (int h : hours) for (int m : minutes) for (int s : seconds) {
                            out.add(d.atTime(h, m, s));
                        }
                    }
                }
                case HOURLY -> {
                    for (int m : minutes) for (int s : seconds) {
                        out.add(cursor.withMinute(m).withSecond(s));
                    }
                }
                case MINUTELY -> {
                    if (minutes == null || minutes.contains(cursor.getMinute())) {
                        for (int s : seconds) out.add(cursor.withSecond(s));
                    }
                }
                case SECONDLY -> {
                    if (seconds == null || seconds.contains(cursor.getSecond())) out.add(cursor);
                }
            }
            return out;
        }

        private boolean dayMatches(LocalDate d) {
            if (months != null && !months.contains(d.getMonthValue())) return false;
            if (monthDays != null
                    && !monthDays.contains(d.getDayOfMonth())
                    && !monthDays.contains(d.getDayOfMonth() - d.lengthOfMonth() - 1)) return false;
            if (yearDays != null
                    && !yearDays.contains(d.getDayOfYear())
                    && !yearDays.contains(d.getDayOfYear() - d.lengthOfYear() - 1)) return false;
            return weekdays == null || weekdays.contains(d.getDayOfWeek().getValue() - 1);
        }

        private static int scalar(RecurrenceParams p, String key, int dflt, int min, int max) {
            List<Integer> v = p.ints(key);
            if (v == null) return dflt;
            if (v.size() != 1) {
                throw new RecurrenceParseException("Recurrence parameter '" + key + "' takes a single value");
            }
            int i = v.get(0);
            if (i < min || i > max) {
                throw new RecurrenceParseException("Recurrence parameter '" + key + "' out of range: " + i);
            }
            return i;
        }

        private static TreeSet<Integer> set(RecurrenceParams p, String key, int min, int max, boolean nonZero) {
            List<Integer> v = p.ints(key);
            if (v == null) return null;
            TreeSet<Integer> out = new TreeSet<>();
            for (int i : v) {
                if (i < min || i > max || (nonZero && i == 0)) {
                    throw new RecurrenceParseException("Recurrence parameter '" + key + "' out of range: " + i);
                }
                out.add(i);
            }
            return out;
        }
    }
}
