package com.strollie.planner.model.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(name = "Stop", description = "Точка маршрута с расписанием")
public class StopDto {
    @Schema(example = "1")
    private int order;
    @Schema(description = "Идентификатор места в 2ГИС")
    private String id;
    @Schema(example = "Нижегородский кремль")
    private String name;
    @Schema(example = "architecture")
    private String category;
    private double lat;
    private double lon;
    @Schema(example = "11:12")
    private String arrivalTime;
    @Schema(example = "11:58")
    private String leaveTime;
    @Schema(example = "40")
    private int visitMinutes;
    @Schema(description = "Открыто ли место на время визита")
    private boolean open;
    @Schema(example = "10:00–18:00 (точное)")
    private String openingHours;
    @Schema(description = "Замечание о доступности")
    private String note;
    @Schema(description = "Кофе-пауза")
    private boolean coffeeBreak;
    @Schema(description = "Почему точка в маршруте")
    private String why;
    @Schema(description = "Практический совет")
    private String tip;
    @Schema(example = "0.84")
    private double distanceFromPreviousKm;
}
