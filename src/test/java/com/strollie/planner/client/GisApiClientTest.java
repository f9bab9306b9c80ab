package com.strollie.planner.client;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.strollie.planner.config.ApiKeysConfig;
import com.strollie.planner.model.GeoPoint;
import com.strollie.planner.model.OpeningHoursWindow;
import com.strollie.planner.model.Poi;
import com.strollie.planner.service.CategoryCacheService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.DayOfWeek;
import java.time.LocalTime;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

@DisplayName("GisApiClient parsing")
class GisApiClientTest {

    private static final String ITEMS = """
            {
              "meta": {"code": 200},
              "result": {
                "total": 3,
                "items": [
                  {
                    "id": "70000001020764757",
                    "name": "Нижегородский государственный художественный музей",
                    "point": {"lat": 56.3285, "lon": 44.0098},
                    "address_name": "Верхне-Волжская набережная, 3",
                    "rubrics": [{"name": "Музеи"}, {"name": "Выставочные залы"}],
                    "reviews": {"general_rating": "4.8"},
                    "schedule": {
                      "Tue": {"working_hours": [{"from": "11:00", "to": "18:00"}]},
                      "Sat": {"working_hours": [{"from": "11:00", "to": "20:00"}]}
                    }
                  },
                  {
                    "id": "70000001030000001",
                    "name": "Чкаловская лестница",
                    "point": {"lat": 56.3316, "lon": 44.0112},
                    "rubrics": [{"name": "Достопримечательности"}],
                    "schedule": {"is_24x7": true}
                  },
                  {
                    "id": "70000001030000002",
                    "name": "Без координат"
                  }
                ]
              }
            }
            """;

    private GisApiClient client;

    @BeforeEach
    void setUp() {
        CategoryCacheService categories = mock(CategoryCacheService.class);
        when(categories.categoryForRubric(anyString())).thenReturn(Optional.empty());
        when(categories.categoryForRubric("Музеи")).thenReturn(Optional.of("museum"));
        when(categories.categoryForRubric("Достопримечательности")).thenReturn(Optional.of("architecture"));
        client = new GisApiClient(mock(WebClient.class), new ApiKeysConfig(), categories, new ObjectMapper());
    }

    @Test
    @DisplayName("Items become places with category, tags, rating and hours")
    void testParseItems() {
        List<Poi> places = client.parseItemsResponse(ITEMS, "museum");
        assertEquals(2, places.size());

        Poi museum = places.get(0);
        assertEquals("70000001020764757", museum.getId());
        assertEquals(GeoPoint.of(56.3285, 44.0098), museum.getLocation());
        assertEquals("museum", museum.getCategory());
        assertEquals(4.8, museum.getRating());
        assertTrue(museum.getTags().contains("выставочные залы"));
        assertEquals("Верхне-Волжская набережная, 3", museum.getAddress());
        assertEquals(2, museum.getWeeklyWindows().size());
        OpeningHoursWindow tuesday = museum.getWeeklyWindows().get(0);
        assertTrue(tuesday.appliesTo(DayOfWeek.TUESDAY));
        assertEquals(LocalTime.of(11, 0), tuesday.getStart());

        Poi stairs = places.get(1);
        assertEquals("architecture", stairs.getCategory());
        assertNull(stairs.getRating());
        assertEquals(LocalTime.MIDNIGHT, stairs.getWeeklyWindows().get(0).getStart());
        assertEquals(7, stairs.getWeeklyWindows().get(0).getDays().size());
    }

    @Test
    @DisplayName("Default category applies when no rubric is known")
    void testDefaultCategory() {
        String body = """
                {"meta": {"code": 200}, "result": {"items": [
                  {"id": "1", "name": "Место", "point": {"lat": 56.3, "lon": 44.0}, "rubrics": [{"name": "Прочее"}]}
                ]}}
                """;
        assertEquals("viewpoint", client.parseItemsResponse(body, "viewpoint").get(0).getCategory());
    }

    @Test
    @DisplayName("Not found is an empty result, other errors are raised")
    void testErrorCodes() {
        assertTrue(client.parseItemsResponse("{\"meta\": {\"code\": 404}}", "museum").isEmpty());
        assertThrows(IllegalStateException.class, () -> client.parseItemsResponse(
                "{\"meta\": {\"code\": 403, \"error\": {\"message\": \"forbidden\"}}}", "museum"));
        assertThrows(IllegalStateException.class, () -> client.parseItemsResponse("", "museum"));
        assertThrows(IllegalStateException.class, () -> client.parseItemsResponse("not json", "museum"));
    }

    @Test
    @DisplayName("Geocoder returns the first item with a point")
    void testParseGeocode() {
        String body = """
                {"meta": {"code": 200}, "result": {"items": [
                  {"id": "a", "name": "без точки"},
                  {"id": "b", "point": {"lat": 56.3213, "lon": 44.0005}}
                ]}}
                """;
        assertEquals(Optional.of(GeoPoint.of(56.3213, 44.0005)), client.parseGeocodeResponse(body));
        assertEquals(Optional.empty(), client.parseGeocodeResponse("{\"meta\": {\"code\": 404}}"));
    }

    @Test
    @DisplayName("API key is masked in logged URLs")
    void testSanitizeUrl() {
        assertEquals("https://x/3.0/items?q=a&key=***&page=1",
                GisApiClient.sanitizeUrl("https://x/3.0/items?q=a&key=secret123&page=1"));
    }
}
