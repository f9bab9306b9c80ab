package com.strollie.planner.schedule;

import com.strollie.planner.model.OpeningHoursWindow;

import java.time.LocalTime;
import java.util.Locale;
import java.util.Map;

/**
 * Usual hours by category, used when a place publishes none.
 */
public final class TypicalOpeningHours {

    public static final OpeningHoursWindow GENERIC = window(9, 0, 21, 0);

    private static final OpeningHoursWindow ALL_DAY = window(0, 0, 0, 0);

    private static final Map<String, OpeningHoursWindow> BY_CATEGORY = Map.ofEntries(
            Map.entry("museum", window(10, 0, 19, 0)),
            Map.entry("art_object", window(9, 0, 21, 0)),
            Map.entry("architecture", window(9, 0, 22, 0)),
            Map.entry("religious_site", window(8, 0, 20, 0)),
            Map.entry("park", ALL_DAY),
            Map.entry("memorial", ALL_DAY),
            Map.entry("monument", ALL_DAY),
            Map.entry("embankment", ALL_DAY),
            Map.entry("viewpoint", window(9, 0, 22, 0)),
            Map.entry("cafe", window(8, 0, 23, 0)),
            Map.entry("bar", window(12, 0, 2, 0)),
            Map.entry("sculpture", window(9, 0, 22, 0))
    );

    private TypicalOpeningHours() {
    }

    public static OpeningHoursWindow forCategory(String category) {
        if (category == null) {
            return GENERIC;
        }
        return BY_CATEGORY.getOrDefault(category.trim().toLowerCase(Locale.ROOT), GENERIC);
    }

    private static OpeningHoursWindow window(int openHour, int openMinute, int closeHour, int closeMinute) {
        return OpeningHoursWindow.everyDay(LocalTime.of(openHour, openMinute), LocalTime.of(closeHour, closeMinute));
    }
}
