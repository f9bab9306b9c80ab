package com.strollie.planner.schedule;

import com.strollie.planner.exception.InvalidScheduleExpressionException;
import com.strollie.planner.model.OpeningHoursWindow;

import java.time.DayOfWeek;
import java.time.LocalTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Reads weekly opening-hours text such as {@code Mo-Fr 10:00-18:00; Sa-Su 11:00-16:00}.
 * <p>
 * Rules are separated by {@code ;}. A rule is an optional day selector followed by comma-separated
 * {@code HH:MM-HH:MM} ranges, {@code 24/7}, or {@code off}/{@code closed}. Day selectors are two-letter
 * tokens, ranges ({@code Mo-Fr}) and comma lists; {@code daily} and {@code everyday} mean the whole week.
 * A later rule replaces what earlier rules said about the same day. A close time at or before the open
 * time wraps past midnight; {@code 24:00} is accepted as a closing time.
 */
public final class OpeningHoursParser {

    private static final Map<String, DayOfWeek> DAY_TOKENS = Map.of(
            "mo", DayOfWeek.MONDAY,
            "tu", DayOfWeek.TUESDAY,
            "we", DayOfWeek.WEDNESDAY,
            "th", DayOfWeek.THURSDAY,
            "fr", DayOfWeek.FRIDAY,
            "sa", DayOfWeek.SATURDAY,
            "su", DayOfWeek.SUNDAY
    );

    private OpeningHoursParser() {
    }

    public static List<OpeningHoursWindow> parse(String expression) {
        if (expression == null || expression.isBlank()) {
            throw new InvalidScheduleExpressionException(String.valueOf(expression), "empty expression");
        }

        Map<DayOfWeek, List<LocalTime[]>> byDay = new EnumMap<>(DayOfWeek.class);
        boolean anyRule = false;
        for (String rawRule : expression.split(";")) {
            String rule = normalize(rawRule);
            if (rule.isEmpty()) {
                continue;
            }
            anyRule = true;
            parseRule(expression, rule, byDay);
        }
        if (!anyRule) {
            throw new InvalidScheduleExpressionException(expression, "no rules");
        }
        return group(byDay);
    }

    private static void parseRule(String expression, String rule, Map<DayOfWeek, List<LocalTime[]>> byDay) {
        Set<DayOfWeek> days = EnumSet.allOf(DayOfWeek.class);
        String times = rule;

        if (Character.isLetter(rule.charAt(0)) && !isClosedWord(rule)) {
            int split = rule.indexOf(' ');
            String selector = split < 0 ? rule : rule.substring(0, split);
            days = parseDays(expression, selector);
            times = split < 0 ? "" : rule.substring(split + 1).trim();
        }

        if (times.isEmpty()) {
            throw new InvalidScheduleExpressionException(expression, "rule '" + rule + "' has no hours");
        }

        List<LocalTime[]> ranges = new ArrayList<>();
        if (!isClosedWord(times)) {
            if ("24/7".equals(times)) {
                ranges.add(new LocalTime[]{LocalTime.MIDNIGHT, LocalTime.MIDNIGHT});
            } else {
                for (String range : times.split(",")) {
                    ranges.add(parseRange(expression, range.trim()));
                }
            }
        }
        for (DayOfWeek day : days) {
            byDay.put(day, ranges);
        }
    }

    private static Set<DayOfWeek> parseDays(String expression, String selector) {
        if ("daily".equals(selector) || "everyday".equals(selector) || "24/7".equals(selector)) {
            return EnumSet.allOf(DayOfWeek.class);
        }
        Set<DayOfWeek> days = EnumSet.noneOf(DayOfWeek.class);
        for (String part : selector.split(",")) {
            String token = part.trim();
            int dash = token.indexOf('-');
            if (dash < 0) {
                days.add(day(expression, token));
                continue;
            }
            DayOfWeek from = day(expression, token.substring(0, dash));
            DayOfWeek to = day(expression, token.substring(dash + 1));
            DayOfWeek cursor = from;
            days.add(cursor);
            while (cursor != to) {
                cursor = cursor.plus(1);
                days.add(cursor);
            }
        }
        return days;
    }

    private static DayOfWeek day(String expression, String token) {
        DayOfWeek day = DAY_TOKENS.get(token.trim());
        if (day == null) {
            throw new InvalidScheduleExpressionException(expression, "unknown day '" + token + "'");
        }
        return day;
    }

    private static LocalTime[] parseRange(String expression, String range) {
        int dash = range.indexOf('-');
        if (dash < 0) {
            throw new InvalidScheduleExpressionException(expression, "range '" + range + "' has no '-'");
        }
        LocalTime start = time(expression, range.substring(0, dash));
        LocalTime end = time(expression, range.substring(dash + 1));
        return new LocalTime[]{start, end};
    }

    private static LocalTime time(String expression, String raw) {
        String value = raw.trim();
        if ("24:00".equals(value)) {
            return LocalTime.MIDNIGHT;
        }
        if (value.length() == 4 && value.charAt(1) == ':') {
            value = "0" + value;
        }
        try {
            return LocalTime.parse(value);
        } catch (DateTimeParseException e) {
            throw new InvalidScheduleExpressionException(expression, "bad time '" + raw + "'");
        }
    }

    private static boolean isClosedWord(String value) {
        return "off".equals(value) || "closed".equals(value);
    }

    private static String normalize(String rule) {
        return rule.trim()
                .replace('–', '-')
                .replace('—', '-')
                .replaceAll("\\s*-\\s*", "-")
                .replaceAll("\\s*,\\s*", ",")
                .replaceAll("\\s+", " ")
                .toLowerCase(Locale.ROOT);
    }

    private static List<OpeningHoursWindow> group(Map<DayOfWeek, List<LocalTime[]>> byDay) {
        Map<String, Set<DayOfWeek>> daysByRange = new LinkedHashMap<>();
        Map<String, LocalTime[]> ranges = new LinkedHashMap<>();
        byDay.forEach((day, dayRanges) -> {
            for (LocalTime[] range : dayRanges) {
                String key = range[0] + "-" + range[1];
                daysByRange.computeIfAbsent(key, k -> EnumSet.noneOf(DayOfWeek.class)).add(day);
                ranges.putIfAbsent(key, range);
            }
        });
        List<OpeningHoursWindow> windows = new ArrayList<>();
        daysByRange.forEach((key, days) -> {
            LocalTime[] range = ranges.get(key);
            windows.add(OpeningHoursWindow.of(days, range[0], range[1]));
        });
        return windows;
    }
}
