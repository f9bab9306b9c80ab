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
@Schema(name = "Leg", description = "Пеший отрезок между двумя точками")
public class LegDto {
    @Schema(description = "Номер точки отправления, 0 — старт", example = "0")
    private int fromOrder;
    @Schema(example = "1")
    private int toOrder;
    @Schema(example = "0.62")
    private double distanceKm;
    @Schema(example = "9")
    private long durationMinutes;
    @Schema(description = "true, если отрезок оценён по прямой")
    private boolean estimated;
    @Schema(description = "Линия пути: пары [lon, lat]")
    private List<double[]> geometry;
    @Schema(description = "Подсказки навигации")
    private List<String> instructions;
}
