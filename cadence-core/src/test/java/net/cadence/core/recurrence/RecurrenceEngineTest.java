package net.cadence.core.recurrence;

import net.cadence.core.model.Frequency;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import java.time.Instant;
import java.time.ZoneId;
import java.util.List;
import java.util.Optional;
import java.util.Random;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RecurrenceEngineTest {

    private final RecurrenceEngine engine = new RecurrenceEngine();

    private Instant next(Frequency f, String params, String after) {
        return engine.nextOccurrence(f, params, Instant.parse(after)).orElseThrow();
    }

    @Test
    void daily_withoutParams_repeatsAtStartTimeOfDay() {
        assertThat(next(Frequency.DAILY, "", "2024-01-10T06:40:00Z"))
                .isEqualTo("2024-01-11T06:40:00Z");
    }

    @Test
    void daily_atFixedTime() {
        assertThat(next(Frequency.DAILY, "byhour:6;byminute:40;bysecond:0", "2024-01-10T12:00:00Z"))
                .isEqualTo("2024-01-11T06:40:00Z");
        assertThat(next(Frequency.DAILY, "byhour:6;byminute:40;bysecond:0", "2024-01-10T05:00:00Z"))
                .isEqualTo("2024-01-10T06:40:00Z");
    }

    @Test
    void resultIsStrictlyAfterReference() {
        assertThat(next(Frequency.DAILY, "byhour:6;byminute:40;bysecond:0", "2024-01-10T06:40:00Z"))
                .isEqualTo("2024-01-11T06:40:00Z");
    }

    private static final List<String> SWEEP_PARAMS = List.of(
            "", "interval:3", "byhour:6;byminute:40;bysecond:0", "byminute:0,15,30,45",
            "bysecond:5,35", "byweekday:0,4", "bymonthday:1,-1", "bymonth:2;bymonthday:29",
            "byyearday:100,-1", "interval:2;byhour:9,17", "count:3", "wkst:6;byweekday:6",
            "bymonth:2;bymonthday:31");

    static Stream<Arguments> sweep() {
        Random random = new Random(20240110L);
        Frequency[] frequencies = Frequency.values();
        long from = Instant.parse("2000-01-01T00:00:00Z").getEpochSecond();
        long to = Instant.parse("2040-01-01T00:00:00Z").getEpochSecond();
        return Stream.generate(() -> Arguments.of(
                        frequencies[random.nextInt(frequencies.length)],
                        SWEEP_PARAMS.get(random.nextInt(SWEEP_PARAMS.size())),
                        Instant.ofEpochSecond(from + (long) (random.nextDouble() * (to - from)),
                                random.nextInt(1_000_000_000))))
                .limit(600);
    }

    @ParameterizedTest(name = "{0} {1} after {2}")
    @MethodSource("sweep")
    void occurrenceIsAlwaysStrictlyAfterReference(Frequency frequency, String params, Instant after) {
        Optional<Instant> next = engine.nextOccurrence(frequency, params, after);

        next.ifPresent(at -> assertThat(at).isAfter(after));
        if (!params.startsWith("count") && !params.endsWith("bymonthday:31")) {
            assertThat(next).isPresent();
        }
    }

    @Test
    void hourly_onSeveralMinutes() {
        assertThat(next(Frequency.HOURLY, "byminute:0,30;bysecond:0", "2024-01-10T10:15:20Z"))
                .isEqualTo("2024-01-10T10:30:00Z");
        assertThat(next(Frequency.HOURLY, "byminute:0,30;bysecond:0", "2024-01-10T10:45:00Z"))
                .isEqualTo("2024-01-10T11:00:00Z");
    }

    @Test
    void hourly_restrictedToOneHour_skipsToNextDay() {
        assertThat(next(Frequency.HOURLY, "byhour:9;byminute:0;bysecond:0", "2024-01-10T10:00:00Z"))
                .isEqualTo("2024-01-11T09:00:00Z");
    }

    @Test
    void weekly_onMonday() {
        // 2024-01-10 is a Wednesday
        assertThat(next(Frequency.WEEKLY, "byweekday:0", "2024-01-10T09:00:00Z"))
                .isEqualTo("2024-01-15T09:00:00Z");
    }

    @Test
    void monthly_lastDayOfMonth() {
        assertThat(next(Frequency.MONTHLY, "bymonthday:-1;byhour:0;byminute:0;bysecond:0", "2024-02-10T00:00:00Z"))
                .isEqualTo("2024-02-29T00:00:00Z");
    }

    @Test
    void yearly_leapDay() {
        assertThat(next(Frequency.YEARLY, "bymonth:2;bymonthday:29;byhour:0;byminute:0;bysecond:0", "2024-03-01T00:00:00Z"))
                .isEqualTo("2028-02-29T00:00:00Z");
    }

    @Test
    void minutely_withInterval() {
        assertThat(next(Frequency.MINUTELY, "interval:15", "2024-01-10T10:07:30Z"))
                .isEqualTo("2024-01-10T10:22:30Z");
    }

    @Test
    void secondly_withInterval() {
        assertThat(next(Frequency.SECONDLY, "interval:10", "2024-01-10T10:00:05Z"))
                .isEqualTo("2024-01-10T10:00:15Z");
    }

    @Test
    void zoneDecidesWallClockTime() {
        RecurrenceEngine paris = new RecurrenceEngine(ZoneId.of("Europe/Paris"));

        Optional<Instant> next = paris.nextOccurrence(Frequency.DAILY, "byhour:6;byminute:0;bysecond:0",
                Instant.parse("2024-07-01T00:00:00Z"));

        assertThat(next).contains(Instant.parse("2024-07-01T04:00:00Z"));
    }

    @Test
    void exhaustedCount_hasNoNextOccurrence() {
        assertThat(engine.nextOccurrence(Frequency.DAILY, "count:1", Instant.parse("2024-01-10T00:00:00Z")))
                .isEmpty();
        assertThat(engine.nextOccurrence(Frequency.DAILY, "count:2", Instant.parse("2024-01-10T00:00:00Z")))
                .contains(Instant.parse("2024-01-11T00:00:00Z"));
    }

    @Test
    void impossibleDate_hasNoNextOccurrence() {
        assertThat(engine.nextOccurrence(Frequency.YEARLY, "bymonth:2;bymonthday:30", Instant.parse("2024-01-01T00:00:00Z")))
                .isEmpty();
    }

    @Test
    void unsupportedKey_isRejected() {
        assertThatThrownBy(() -> engine.nextOccurrence(Frequency.DAILY, "byeaster:0", Instant.parse("2024-01-10T00:00:00Z")))
                .isInstanceOf(RecurrenceParseException.class)
                .hasMessageContaining("byeaster");
    }

    @Test
    void outOfRangeValue_isRejected() {
        assertThatThrownBy(() -> engine.nextOccurrence(Frequency.DAILY, "byhour:24", Instant.parse("2024-01-10T00:00:00Z")))
                .isInstanceOf(RecurrenceParseException.class);
        assertThatThrownBy(() -> engine.nextOccurrence(Frequency.DAILY, "interval:0", Instant.parse("2024-01-10T00:00:00Z")))
                .isInstanceOf(RecurrenceParseException.class);
    }
}
