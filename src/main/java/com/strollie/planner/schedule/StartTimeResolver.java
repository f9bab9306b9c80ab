package com.strollie.planner.schedule;

import com.strollie.planner.config.PlannerProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;

/**
 * Picks the moment a walk starts in the client's time zone.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StartTimeResolver {

    private final PlannerProperties properties;
    private final Clock clock;

    public record StartTime(LocalDateTime start, ZoneId zone, List<String> warnings) {
    }

    public StartTime resolve(String requestedTime, String clientZone, double hours) {
        List<String> warnings = new ArrayList<>();
        ZoneId zone = zone(clientZone, warnings);
        LocalDateTime now = LocalDateTime.now(clock.withZone(zone)).withSecond(0).withNano(0);

        if (requestedTime != null && !requestedTime.isBlank()) {
            try {
                String normalized = requestedTime.trim();
                if (normalized.indexOf(':') == 1) {
                    normalized = "0" + normalized;
                }
                LocalTime time = LocalTime.parse(normalized);
                LocalDateTime start = now.toLocalDate().atTime(time);
                if (start.isBefore(now)) {
                    start = start.plusDays(1);
                    warnings.add("Запрошенное время " + requestedTime + " уже прошло сегодня, планируем на завтра");
                }
                if (!fits(start, hours)) {
                    LocalDateTime suggested = suggest(start, hours);
                    warnings.add(String.format("Запрошенное время %s неоптимально (маршрут займёт %sч). Рекомендуем начать в %s",
                            requestedTime, formatHours(hours), OpeningHoursResolver.HH_MM.format(suggested)));
                }
                log.info("Using requested start time {} ({})", start, zone);
                return new StartTime(start, zone, warnings);
            } catch (DateTimeParseException e) {
                log.warn("Cannot parse requested start time '{}': {}", requestedTime, e.getMessage());
                warnings.add("Не удалось разобрать время '" + requestedTime + "', используем текущее");
            }
        }

        if (fits(now, hours)) {
            log.info("Using current time {} ({})", now, zone);
            return new StartTime(now, zone, warnings);
        }
        LocalDateTime suggested = suggest(now, hours);
        warnings.add("Сейчас " + OpeningHoursResolver.HH_MM.format(now) + ", что неоптимально для прогулки. Планируем маршрут на "
                + OpeningHoursResolver.HH_MM.format(suggested));
        log.info("Adjusted start time to {} ({})", suggested, zone);
        return new StartTime(suggested, zone, warnings);
    }

    /**
     * Starts no earlier than the window opens and finishes no later than its close plus grace, on the same day.
     */
    boolean fits(LocalDateTime start, double hours) {
        PlannerProperties.StartWindow window = properties.getStartWindow();
        LocalDateTime opens = start.toLocalDate().atTime(window.getEarliestHour(), 0);
        LocalDateTime latestFinish = start.toLocalDate().atTime(window.getLatestHour(), 0)
                .plusMinutes(window.getFinishGraceMinutes());
        LocalDateTime finish = start.plusMinutes(Math.round(hours * 60));
        return !start.isBefore(opens) && start.getHour() < window.getLatestHour() && !finish.isAfter(latestFinish);
    }

    LocalDateTime suggest(LocalDateTime from, double hours) {
        int earliest = properties.getStartWindow().getEarliestHour();
        LocalDateTime todayOpening = from.toLocalDate().atTime(earliest, 0);
        if (from.isBefore(todayOpening)) {
            return todayOpening;
        }
        return todayOpening.plusDays(1);
    }

    private ZoneId zone(String clientZone, List<String> warnings) {
        if (clientZone != null && !clientZone.isBlank()) {
            try {
                return ZoneId.of(clientZone.trim());
            } catch (DateTimeException e) {
                log.warn("Invalid timezone {}, using default", clientZone);
                warnings.add("Неизвестный часовой пояс, используем " + properties.getDefaultZone());
            }
        }
        return ZoneId.of(properties.getDefaultZone());
    }

    private static String formatHours(double hours) {
        return hours == Math.rint(hours) ? String.valueOf((long) hours) : String.valueOf(hours);
    }
}
