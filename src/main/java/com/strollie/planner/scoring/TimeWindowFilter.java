package com.strollie.planner.scoring;

import com.strollie.planner.model.CandidateScore;
import com.strollie.planner.model.Poi;
import com.strollie.planner.schedule.OpeningHoursResolver;
import com.strollie.planner.schedule.OpeningStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.stream.Stream;

/**
 * Drops candidates that do not suit the hour of the walk and puts those open at its start first.
 * Opening hours are checked at the start time: the visiting order is not known yet at this stage.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TimeWindowFilter {

    static final List<String> MORNING_AVOID_KEYWORDS = List.of("кофе", "coffee", "кафе", "бар", "brunch");
    static final List<String> NIGHT_UNSAFE_KEYWORDS = List.of("сквер", "тропа", "двор", "аллея", "парк");
    static final List<String> NIGHT_PREFERRED_KEYWORDS = List.of("набереж", "кремл", "центр", "площад");

    static final int MORNING_HOUR = 9;
    static final int NIGHT_HOUR = 21;

    private final OpeningHoursResolver resolver;

    /**
     * Keeps the relative order of the ranking inside each group. Returns the input when everything would be dropped.
     */
    public List<CandidateScore> filter(List<CandidateScore> ranked, LocalDateTime start) {
        if (ranked.isEmpty()) {
            return ranked;
        }
        int hour = start.getHour();
        List<CandidateScore> preferred = new ArrayList<>();
        List<CandidateScore> openNow = new ArrayList<>();
        List<CandidateScore> needsWait = new ArrayList<>();
        int dropped = 0;

        for (CandidateScore candidate : ranked) {
            List<String> keywords = keywords(candidate.getPoi());
            if (hour < MORNING_HOUR && containsAny(keywords, MORNING_AVOID_KEYWORDS)) {
                dropped++;
                continue;
            }
            if (hour >= NIGHT_HOUR && containsAny(keywords, NIGHT_UNSAFE_KEYWORDS)) {
                dropped++;
                continue;
            }
            OpeningStatus status = resolver.resolve(candidate.getPoi(), start);
            if (!status.isOpen()) {
                dropped++;
                continue;
            }
            if (status.getWaitMinutes() > 0) {
                needsWait.add(candidate);
            } else if (hour >= NIGHT_HOUR && containsAny(keywords, NIGHT_PREFERRED_KEYWORDS)) {
                preferred.add(candidate);
            } else {
                openNow.add(candidate);
            }
        }

        if (preferred.isEmpty() && openNow.isEmpty() && needsWait.isEmpty()) {
            log.warn("Time window filter dropped all {} candidates, keeping the ranked list", ranked.size());
            return ranked;
        }
        log.info("Time window filter: {} kept, {} dropped", ranked.size() - dropped, dropped);
        return Stream.of(preferred, openNow, needsWait).flatMap(List::stream).toList();
    }

    static List<String> keywords(Poi poi) {
        List<String> keywords = new ArrayList<>();
        if (poi.getName() != null && !poi.getName().isBlank()) {
            keywords.add(poi.getName().trim().toLowerCase(Locale.ROOT));
        }
        for (String tag : poi.getTags()) {
            if (tag != null && !tag.isBlank()) {
                keywords.add(tag.trim().toLowerCase(Locale.ROOT));
            }
        }
        return keywords;
    }

    static boolean containsAny(List<String> tokens, List<String> keywords) {
        for (String token : tokens) {
            for (String keyword : keywords) {
                if (token.contains(keyword)) {
                    return true;
                }
            }
        }
        return false;
    }
}
