package io.taskmaster.runtime;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Interval grammar for schedules: {@code @hourly}, {@code @daily}, {@code @every <n>m|h|d},
 * or a bare number of minutes.
 */
public record ScheduleSpec(String spec, int intervalMinutes) {
    private static final Pattern EVERY = Pattern.compile("^@every\\s+(\\d+)\\s*([mhd])$");
    private static final int MAX_MINUTES = 366 * 24 * 60;

    public static ScheduleSpec parse(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("schedule spec must not be blank");
        }
        String v = raw.trim().toLowerCase(Locale.ROOT);
        long minutes;
        if ("@hourly".equals(v)) {
            minutes = 60;
        } else if ("@daily".equals(v)) {
            minutes = 24 * 60;
        } else {
            Matcher m = EVERY.matcher(v);
            if (m.matches()) {
                long n = Long.parseLong(m.group(1));
                minutes = switch (m.group(2)) {
                    case "h" -> n * 60;
                    case "d" -> n * 24 * 60;
                    default -> n;
                };
            } else if (v.chars().allMatch(Character::isDigit)) {
                minutes = Long.parseLong(v);
            } else {
                throw new IllegalArgumentException("Unsupported schedule spec: " + raw);
            }
        }
        if (minutes < 1 || minutes > MAX_MINUTES) {
            throw new IllegalArgumentException("schedule interval out of range (1.." + MAX_MINUTES + " minutes): " + raw);
        }
        return new ScheduleSpec(raw.trim(), (int) minutes);
    }
}
