package io.chrono4j.utils;

import java.text.ParseException;
import java.time.*;
import java.time.temporal.ChronoUnit;
import java.util.Date;
import java.util.Objects;
import java.util.TimeZone;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.quartz.CronExpression;

/**
 * Parses schedule specs: cron expressions into next firing times and interval text into {@link Duration}.
 * <p>
 * Supported formats:
 * <ul>
 *   <li>Cron: 5-field ("*&#47;5 * * * *") or 6-field with leading seconds ("0 0 2 * * *")</li>
 *   <li>Compact intervals: "100ms", "30s", "1m30s", "2h"</li>
 *   <li>Human-readable intervals: "5 minutes", "2 hours", "1 day 3 hours"</li>
 *   <li>Plain numbers, read as seconds: "90"</li>
 * </ul>
 */
public final class IntervalParser {

    private static final Pattern COMPACT = Pattern.compile("^(?:\\d+(?:ms|[smhdw]))+$");
    private static final Pattern COMPACT_PART = Pattern.compile("(\\d+)(ms|[smhdw])");

    private IntervalParser() {
    }

    /**
     * Returns the first cron firing strictly after {@code from}.
     *
     * @param spec cron spec (5 or 6 fields)
     * @param zone zone the expression is evaluated in; system default when null
     * @param from base instant
     * @throws IllegalArgumentException when the spec is not a valid cron or never fires again
     */
    public static Instant nextFireTime(String spec, ZoneId zone, Instant from) {
        Objects.requireNonNull(from, "from must not be null");
        CronExpression exp = compile(spec, zone);
        Date next = exp.getNextValidTimeAfter(Date.from(from));
        if (next == null) {
            throw new IllegalArgumentException("Cron expression produced no next execution time: " + spec);
        }
        return next.toInstant();
    }

    /**
     * Convenience overload: evaluates in the system default zone.
     */
    public static Instant nextFireTime(String spec, Instant from) {
        return nextFireTime(spec, null, from);
    }

    /**
     * Normalize cron expressions to Quartz syntax:
     * - Accepts 6-field cron with leading seconds.
     * - Accepts 5-field cron by prepending seconds "0".
     * - Quartz needs exactly one of day-of-month / day-of-week to be "?".
     */
    public static String normalizeCron(String spec) {
        if (spec == null) {
            throw new IllegalArgumentException("spec must not be null");
        }
        String s = spec.trim();
        if (s.isEmpty()) {
            throw new IllegalArgumentException("spec must not be empty");
        }

        String[] parts = s.split("\\s+");
        if (parts.length == 5) {
            return toQuartzCron("0", parts[0], parts[1], parts[2], parts[3], parts[4]);
        }
        if (parts.length == 6) {
            return toQuartzCron(parts[0], parts[1], parts[2], parts[3], parts[4], parts[5]);
        }
        return s;
    }

    private static String toQuartzCron(String sec, String min, String hour, String dayOfMonth, String month, String dayOfWeek) {
        String dom = dayOfMonth;
        String dow = dayOfWeek;

        if (!"?".equals(dom) && !"?".equals(dow)) {
            if ("*".equals(dow)) {
                dow = "?";
            } else if ("*".equals(dom)) {
                dom = "?";
            }
        }

        return String.join(" ", sec, min, hour, dom, month, dow);
    }

    /**
     * Returns true if the spec can be parsed as a Quartz {@link CronExpression} after normalization.
     */
    public static boolean looksLikeCron(String spec) {
        if (spec == null || spec.isBlank()) {
            return false;
        }
        String[] parts = spec.trim().split("\\s+");
        if (parts.length != 5 && parts.length != 6) {
            return false;
        }
        return CronExpression.isValidExpression(normalizeCron(spec));
    }

    private static CronExpression compile(String spec, ZoneId zone) {
        if (!looksLikeCron(spec)) {
            throw new IllegalArgumentException("Invalid cron expression: " + spec);
        }
        try {
            CronExpression exp = new CronExpression(normalizeCron(spec));
            exp.setTimeZone(TimeZone.getTimeZone(zone != null ? zone : ZoneId.systemDefault()));
            return exp;
        } catch (ParseException ex) {
            throw new IllegalArgumentException("Invalid cron expression: " + spec, ex);
        }
    }

    /**
     * Parse interval text into a positive {@link Duration}.
     *
     * @throws IllegalArgumentException when the text is empty, malformed or not positive
     */
    public static Duration parseDuration(String input) {
        Objects.requireNonNull(input, "input must not be null");
        String s = input.trim().toLowerCase();
        if (s.isEmpty()) {
            throw new IllegalArgumentException("Interval string must not be empty");
        }

        Duration d;
        if (s.matches("^\\d+$")) {
            try {
                d = Duration.ofSeconds(Long.parseLong(s));
            } catch (NumberFormatException ex) {
                throw new IllegalArgumentException("Interval seconds out of range: " + input);
            }
        } else if (COMPACT.matcher(s).matches()) {
            d = parseCompact(s);
        } else {
            d = parseHuman(s, input);
        }

        if (d.isZero() || d.isNegative()) {
            throw new IllegalArgumentException("Interval must be positive: " + input);
        }
        return d;
    }

    private static Duration parseCompact(String s) {
        Duration total = Duration.ZERO;
        Matcher m = COMPACT_PART.matcher(s);
        while (m.find()) {
            long n = Long.parseLong(m.group(1));
            total = total.plus(switch (m.group(2)) {
                case "ms" -> Duration.ofMillis(n);
                case "s" -> Duration.ofSeconds(n);
                case "m" -> Duration.ofMinutes(n);
                case "h" -> Duration.ofHours(n);
                case "d" -> Duration.ofDays(n);
                case "w" -> Duration.ofDays(7L * n);
                default -> throw new IllegalArgumentException("Unsupported compact unit: " + m.group(2));
            });
        }
        return total;
    }

    private static Duration parseHuman(String s, String input) {
        String[] parts = s.split("\\s+");
        if (parts.length % 2 != 0) {
            throw new IllegalArgumentException("Invalid interval format. Expected pairs like '3 minutes': " + input);
        }

        boolean seenWeek = false, seenDay = false, seenHour = false, seenMinute = false, seenSecond = false, seenMilli = false;
        Duration total = Duration.ZERO;

        for (int i = 0; i < parts.length; i += 2) {
            long n;
            try {
                n = Long.parseLong(parts[i]);
            } catch (NumberFormatException ex) {
                throw new IllegalArgumentException("Invalid number in interval: " + parts[i]);
            }
            if (n < 0) {
                throw new IllegalArgumentException("Interval values must be non-negative");
            }

            String unit = parts[i + 1];
            if (unit.endsWith("s")) {
                unit = unit.substring(0, unit.length() - 1);
            }

            switch (unit) {
                case "week" -> {
                    if (seenWeek) throw new IllegalArgumentException("Duplicate unit: week");
                    seenWeek = true;
                    total = total.plus(ChronoUnit.DAYS.getDuration().multipliedBy(7L * n));
                }
                case "day" -> {
                    if (seenDay) throw new IllegalArgumentException("Duplicate unit: day");
                    seenDay = true;
                    total = total.plusDays(n);
                }
                case "hour" -> {
                    if (seenHour) throw new IllegalArgumentException("Duplicate unit: hour");
                    seenHour = true;
                    total = total.plusHours(n);
                }
                case "minute" -> {
                    if (seenMinute) throw new IllegalArgumentException("Duplicate unit: minute");
                    seenMinute = true;
                    total = total.plusMinutes(n);
                }
                case "second" -> {
                    if (seenSecond) throw new IllegalArgumentException("Duplicate unit: second");
                    seenSecond = true;
                    total = total.plusSeconds(n);
                }
                case "millisecond" -> {
                    if (seenMilli) throw new IllegalArgumentException("Duplicate unit: millisecond");
                    seenMilli = true;
                    total = total.plusMillis(n);
                }
                default -> throw new IllegalArgumentException("Unsupported interval unit: " + parts[i + 1]);
            }
        }

        return total;
    }
}
