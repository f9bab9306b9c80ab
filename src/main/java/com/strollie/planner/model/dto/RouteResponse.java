package com.strollie.planner.model.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(name = "RouteResponse", description = "Построенный маршрут с расписанием и пояснениями")
public class RouteResponse {

    @Schema(description = "Краткое описание маршрута")
    private String summary;

    @Schema(description = "Время старта", example = "2025-06-01T11:00")
    private String startTime;

    @Schema(description = "Часовой пояс расписания", example = "Europe/Moscow")
    private String timezone;

    @Schema(description = "Точки маршрута в порядке посещения")
    private List<StopDto> stops;

    @Schema(description = "Отрезки пути; первый ведёт от точки старта")
    private List<LegDto> legs;

    @Schema(description = "Общая длина пути, км", example = "3.42")
    private double totalDistanceKm;

    @Schema(description = "Общая длительность, минуты", example = "175")
    private long totalMinutes;

    @Schema(description = "Предупреждения")
    private List<String> warnings;

    @Schema(description = "Советы к прогулке")
    private List<String> notes;

    @Schema(description = "Погода на старте")
    private WeatherDto weather;

    @Schema(description = "Маршрут в 2ГИС", example = "https://2gis.ru/directions/tab/pedestrian/points/...")
    private String directionsUrl;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @Schema(name = "Weather")
    public static class WeatherDto {
        private String description;
        private Double temperatureC;
        private String advice;
    }
}
