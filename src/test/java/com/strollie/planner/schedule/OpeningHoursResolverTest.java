package com.strollie.planner.schedule;

import com.strollie.planner.config.PlannerProperties;
import com.strollie.planner.model.GeoPoint;
import com.strollie.planner.model.OpeningHoursWindow;
import com.strollie.planner.model.Poi;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.time.LocalTime;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("OpeningHoursResolver")
class OpeningHoursResolverTest {

    // 2025-06-02 is a Monday
    private static final LocalDateTime MONDAY_0930 = LocalDateTime.of(2025, 6, 2, 9, 30);
    private static final LocalDateTime MONDAY_1900 = LocalDateTime.of(2025, 6, 2, 19, 0);

    private OpeningHoursResolver resolver;

    @BeforeEach
    void setUp() {
        resolver = new OpeningHoursResolver(new PlannerProperties());
    }

    private static Poi.PoiBuilder poi(String category) {
        return Poi.builder().id("p").name("Place").category(category).location(GeoPoint.of(56.32, 44.0));
    }

    @Test
    @DisplayName("Before opening within the max wait: open with a wait")
    void testOpenWithWait() {
        OpeningStatus status = resolver.resolve("Mo-Fr 10:00-18:00", MONDAY_0930, 45);
        assertTrue(status.isOpen());
        assertEquals(30, status.getWaitMinutes());
        assertEquals(LocalDateTime.of(2025, 6, 2, 10, 0), status.getOpensAt());
        assertTrue(status.isExact());
    }

    @Test
    @DisplayName("After closing: closed")
    void testClosedAfterHours() {
        OpeningStatus status = resolver.resolve("Mo-Fr 10:00-18:00", MONDAY_1900, 45);
        assertFalse(status.isOpen());
        assertEquals(0, status.getWaitMinutes());
        assertFalse(status.hasWindow());
    }

    @Test
    @DisplayName("Wait longer than allowed: closed, but the wait is reported")
    void testWaitTooLong() {
        OpeningStatus status = resolver.resolve("Mo-Fr 10:00-18:00", MONDAY_0930, 15);
        assertFalse(status.isOpen());
        assertEquals(30, status.getWaitMinutes());
    }

    @Test
    @DisplayName("Inside the window: open, no wait, close time known")
    void testOpenNow() {
        OpeningStatus status = resolver.resolve("Mo-Fr 09:00-18:00", MONDAY_0930, 45);
        assertTrue(status.isOpen());
        assertEquals(0, status.getWaitMinutes());
        assertEquals(LocalDateTime.of(2025, 6, 2, 18, 0), status.getClosesAt());
        assertEquals("09:00–18:00 (точное)", status.getLabel());
    }

    @Test
    @DisplayName("Overnight window from the previous day is still open after midnight")
    void testOvernightFromYesterday() {
        OpeningStatus status = resolver.resolve("Su 20:00-03:00", LocalDateTime.of(2025, 6, 2, 1, 0), 45);
        assertTrue(status.isOpen());
        assertEquals(LocalDateTime.of(2025, 6, 2, 3, 0), status.getClosesAt());
    }

    @Test
    @DisplayName("Malformed expression falls back to the generic day")
    void testMalformedFallsBack() {
        OpeningStatus status = resolver.resolve("whenever", LocalDateTime.of(2025, 6, 2, 12, 0), 45);
        assertTrue(status.isOpen());
        assertFalse(status.isExact());
    }

    @Test
    @DisplayName("Structured windows take precedence over the expression")
    void testWeeklyWindowsFirst() {
        Poi place = poi("museum")
                .openingHours("Mo-Su 10:00-18:00")
                .weeklyWindow(OpeningHoursWindow.everyDay(LocalTime.of(8, 0), LocalTime.of(9, 0)))
                .build();
        OpeningStatus status = resolver.resolve(place, MONDAY_0930, 45);
        assertFalse(status.isOpen());
    }

    @Test
    @DisplayName("Open/close pair is used when no expression is given")
    void testOpenClosePair() {
        Poi place = poi("museum").openTime(LocalTime.of(9, 0)).closeTime(LocalTime.of(10, 0)).build();
        assertTrue(resolver.resolve(place, MONDAY_0930).isOpen());
        assertFalse(resolver.resolve(place, LocalDateTime.of(2025, 6, 2, 10, 30)).isOpen());
    }

    @Test
    @DisplayName("Without published hours the category's typical hours apply, marked approximate")
    void testTypicalHours() {
        OpeningStatus park = resolver.resolve(poi("park").build(), LocalDateTime.of(2025, 6, 2, 6, 0));
        assertTrue(park.isOpen());
        assertFalse(park.isExact());
        assertTrue(park.getLabel().endsWith("(ориентировочно)"));

        OpeningStatus museum = resolver.resolve(poi("museum").build(), LocalDateTime.of(2025, 6, 2, 20, 0));
        assertFalse(museum.isOpen());
    }

    @Test
    @DisplayName("Unreadable expression on a place falls through to the next source")
    void testUnreadableExpressionOnPoi() {
        Poi place = poi("museum").openingHours("по записи").build();
        OpeningStatus status = resolver.resolve(place, LocalDateTime.of(2025, 6, 2, 12, 0));
        assertTrue(status.isOpen());
        assertFalse(status.isExact());
    }

    @Test
    @DisplayName("Labels: round the clock and next-day close")
    void testLabels() {
        assertEquals("круглосуточно (точное)", OpeningHoursResolver.label(
                OpeningHoursWindow.everyDay(LocalTime.MIDNIGHT, LocalTime.MIDNIGHT), true));
        assertEquals("20:00–03:00 (+1 день) (ориентировочно)", OpeningHoursResolver.label(
                OpeningHoursWindow.everyDay(LocalTime.of(20, 0), LocalTime.of(3, 0)), false));
    }

    @Test
    @DisplayName("Round-the-clock categories stay open through the last minute of the day")
    void testTypicalAllDayLateEvening() {
        OpeningStatus park = resolver.resolve(poi("park").build(), LocalDateTime.of(2025, 6, 2, 23, 59, 30));
        assertTrue(park.isOpen());
        assertEquals(0, park.getWaitMinutes());
        assertEquals(LocalDateTime.of(2025, 6, 3, 0, 0), park.getClosesAt());
        assertEquals("круглосуточно (ориентировочно)", park.getLabel());
    }
}
