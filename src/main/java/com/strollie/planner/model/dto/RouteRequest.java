package com.strollie.planner.model.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.strollie.planner.model.Intensity;
import com.strollie.planner.model.SocialMode;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.Valid;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(name = "RouteRequest", description = "Запрос на построение пешеходного маршрута")
public class RouteRequest {

    @DecimalMin("-90.0")
    @DecimalMax("90.0")
    @Schema(description = "Широта точки старта", example = "56.3287")
    private Double lat;

    @DecimalMin("-180.0")
    @DecimalMax("180.0")
    @Schema(description = "Долгота точки старта", example = "44.0020")
    private Double lon;

    @Size(max = 300)
    @Schema(description = "Адрес точки старта, если координаты не заданы", example = "Большая Покровская, 1")
    private String address;

    @NotNull
    @DecimalMin("0.5")
    @DecimalMax("8.0")
    @Schema(description = "Длительность прогулки в часах", example = "3")
    private Double hours;

    @Schema(description = "Темп прогулки: relaxed, medium, intense", example = "medium")
    private Intensity intensity;

    @Schema(description = "Формат прогулки: solo, friends, couple, family", example = "couple")
    private SocialMode socialMode;

    @NotEmpty
    @Size(max = 16)
    @Schema(description = "Идентификаторы категорий", example = "[\"museum\", \"embankment\"]")
    private List<String> categories;

    @Size(max = 1000)
    @Schema(description = "Свободное описание интересов", example = "История, красивые виды, кофе")
    private String interests;

    @Pattern(regexp = "^([01]?\\d|2[0-3]):[0-5]\\d$", message = "must be HH:MM")
    @Schema(description = "Желаемое время старта HH:MM", example = "11:00")
    private String startTime;

    @Schema(description = "Часовой пояс клиента (IANA)", example = "Europe/Moscow")
    private String timezone;

    @Valid
    @Schema(description = "Настройки кофе-пауз")
    private Breaks breaks;

    @JsonIgnore
    @AssertTrue(message = "either lat/lon or address must be provided")
    public boolean isLocationProvided() {
        return (lat != null && lon != null) || (address != null && !address.isBlank());
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @Schema(name = "BreakSettings", description = "Параметры кофе-пауз")
    public static class Breaks {
        @Schema(description = "Добавлять ли паузы", example = "true")
        private Boolean enabled;

        @Min(15)
        @Max(240)
        @Schema(description = "Интервал между паузами, минуты", example = "90")
        private Integer intervalMinutes;

        @DecimalMin("0.1")
        @DecimalMax("2.0")
        @Schema(description = "Радиус поиска кафе, км", example = "0.6")
        private Double searchRadiusKm;
    }
}
