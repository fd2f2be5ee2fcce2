package io.clinicqueue.utils;

import org.quartz.CronExpression;

import java.text.ParseException;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeParseException;
import java.util.Date;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TimeZone;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns repeat specs of recurring jobs into run times.
 * <p>
 * Accepted specs:
 * <ul>
 *   <li>numeric seconds: "600"</li>
 *   <li>compact or spelled-out durations: "10m", "10 minutes", "1 hour 30 minutes"</li>
 *   <li>5- or 6-field cron: "*&#47;10 * * * *" (evaluated with Quartz)</li>
 *   <li>daily time of day: "AT 06:30"</li>
 * </ul>
 */
public final class IntervalParser {

    public static final String AT_PREFIX = "AT ";

    private static final Pattern NUMERIC = Pattern.compile("^\\d+$");
    private static final Pattern COMPACT = Pattern.compile("^(\\d+)\\s*([smhdw])$");
    private static final Pattern PAIR = Pattern.compile("(\\d+)\\s+([a-z]+)");

    private enum Unit {
        SECOND(Duration.ofSeconds(1)),
        MINUTE(Duration.ofMinutes(1)),
        HOUR(Duration.ofHours(1)),
        DAY(Duration.ofDays(1)),
        WEEK(Duration.ofDays(7));

        private final Duration size;

        Unit(Duration size) {
            this.size = size;
        }
    }

    private static final Map<String, Unit> UNIT_NAMES = Map.of(
            "s", Unit.SECOND, "second", Unit.SECOND,
            "m", Unit.MINUTE, "minute", Unit.MINUTE,
            "h", Unit.HOUR, "hour", Unit.HOUR,
            "d", Unit.DAY, "day", Unit.DAY,
            "w", Unit.WEEK, "week", Unit.WEEK
    );

    private IntervalParser() {
    }

    /**
     * Next run of a recurring job after it finished a run.
     *
     * @param repeatInterval the job's repeat spec; null or blank means the job does not repeat
     * @param repeatTimezone IANA zone used for cron and "AT" specs; null means system default
     * @param previousRunAt  the scheduledFor of the run that just finished
     * @param finishedAt     when the run finished
     * @return next scheduledFor, or {@code null} for one-time jobs
     */
    public static Instant computeNextRunAt(String repeatInterval,
                                           String repeatTimezone,
                                           Instant previousRunAt,
                                           Instant finishedAt) {
        if (repeatInterval == null || repeatInterval.isBlank()) {
            return null;
        }
        Objects.requireNonNull(finishedAt, "finishedAt must not be null");

        ZoneId zone = resolveZone(repeatTimezone);
        Instant base = previousRunAt != null && previousRunAt.isAfter(finishedAt) ? previousRunAt : finishedAt;

        String spec = repeatInterval.trim();
        if (spec.startsWith(AT_PREFIX)) {
            return nextTimeOfDay(parseTimeOfDay(spec.substring(AT_PREFIX.length())), zone, base);
        }
        return base.plus(parseDuration(spec, zone.getId(), base));
    }

    /**
     * Duration from {@code from} to the next run described by {@code spec}. For cron specs the
     * result depends on {@code from}; for duration specs it does not.
     */
    public static Duration parseDuration(String spec, String timezone, Instant from) {
        if (spec == null || spec.isBlank()) {
            throw new IllegalArgumentException("interval spec must not be blank");
        }
        Objects.requireNonNull(from, "from must not be null");

        String s = spec.trim();
        if (NUMERIC.matcher(s).matches()) {
            return positiveSeconds(s, spec);
        }
        if (looksLikeCron(s)) {
            return cronDelay(normalizeCron(s), resolveZone(timezone), from);
        }
        return parseHumanDuration(s);
    }

    public static Duration parseDuration(String spec) {
        return parseDuration(spec, null, Instant.now());
    }

    /**
     * Quartz wants six fields and a "?" in one of the day fields. Five-field specs get a
     * leading "0" seconds field.
     */
    public static String normalizeCron(String spec) {
        String[] f = spec.trim().split("\\s+");
        if (f.length != 5 && f.length != 6) {
            return spec.trim();
        }
        String[] six = f.length == 6 ? f : new String[]{"0", f[0], f[1], f[2], f[3], f[4]};
        if ("*".equals(six[3]) && "*".equals(six[5])) {
            six[5] = "?";
        }
        return String.join(" ", six);
    }

    public static boolean looksLikeCron(String spec) {
        if (spec == null) {
            return false;
        }
        int fields = spec.trim().split("\\s+").length;
        return (fields == 5 || fields == 6) && CronExpression.isValidExpression(normalizeCron(spec));
    }

    public static Duration parseHumanDuration(String input) {
        Objects.requireNonNull(input, "input must not be null");
        String s = input.trim().toLowerCase(Locale.ROOT);
        if (s.isEmpty()) {
            throw new IllegalArgumentException("interval must not be empty");
        }
        if (NUMERIC.matcher(s).matches()) {
            return positiveSeconds(s, input);
        }

        Matcher compact = COMPACT.matcher(s);
        if (compact.matches()) {
            return UNIT_NAMES.get(compact.group(2)).size.multipliedBy(Long.parseLong(compact.group(1)));
        }

        Matcher pairs = PAIR.matcher(s);
        Set<Unit> seen = EnumSet.noneOf(Unit.class);
        Duration total = Duration.ZERO;
        int consumed = 0;
        while (pairs.find()) {
            if (!s.substring(consumed, pairs.start()).isBlank()) {
                throw new IllegalArgumentException("invalid interval: " + input);
            }
            String word = pairs.group(2);
            String name = word.endsWith("s") ? word.substring(0, word.length() - 1) : word;
            Unit unit = name.length() > 1 ? UNIT_NAMES.get(name) : null;
            if (unit == null) {
                throw new IllegalArgumentException("unsupported interval unit: " + word);
            }
            if (!seen.add(unit)) {
                throw new IllegalArgumentException("duplicate interval unit: " + word);
            }
            total = total.plus(unit.size.multipliedBy(Long.parseLong(pairs.group(1))));
            consumed = pairs.end();
        }
        if (seen.isEmpty() || !s.substring(consumed).isBlank()) {
            throw new IllegalArgumentException("invalid interval, expected pairs like '10 minutes': " + input);
        }
        if (total.isZero()) {
            throw new IllegalArgumentException("interval must be positive: " + input);
        }
        return total;
    }

    private static Duration positiveSeconds(String digits, String original) {
        long seconds;
        try {
            seconds = Long.parseLong(digits);
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException("interval seconds out of range: " + original, ex);
        }
        if (seconds <= 0) {
            throw new IllegalArgumentException("interval seconds must be positive: " + original);
        }
        return Duration.ofSeconds(seconds);
    }

    private static Duration cronDelay(String cron, ZoneId zone, Instant from) {
        CronExpression expression;
        try {
            expression = new CronExpression(cron);
        } catch (ParseException ex) {
            throw new IllegalArgumentException("invalid cron expression: " + cron, ex);
        }
        expression.setTimeZone(TimeZone.getTimeZone(zone));
        Date next = expression.getNextValidTimeAfter(Date.from(from));
        if (next == null) {
            throw new IllegalArgumentException("cron expression has no future run: " + cron);
        }
        return Duration.between(from, next.toInstant());
    }

    private static Instant nextTimeOfDay(LocalTime timeOfDay, ZoneId zone, Instant after) {
        ZonedDateTime base = after.atZone(zone);
        ZonedDateTime candidate = base.with(timeOfDay);
        return (candidate.isAfter(base) ? candidate : candidate.plusDays(1)).toInstant();
    }

    private static LocalTime parseTimeOfDay(String text) {
        try {
            return LocalTime.parse(text.trim());
        } catch (DateTimeParseException ex) {
            throw new IllegalArgumentException("invalid time of day, expected HH:mm or HH:mm:ss: " + text, ex);
        }
    }

    private static ZoneId resolveZone(String timezone) {
        if (timezone == null || timezone.isBlank()) {
            return ZoneId.systemDefault();
        }
        try {
            return ZoneId.of(timezone);
        } catch (DateTimeException ex) {
            throw new IllegalArgumentException("unknown time zone: " + timezone, ex);
        }
    }
}
