package com.strollie.planner.web.error;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.OffsetDateTime;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(name = "ErrorResponse", description = "Ошибка планирования или валидации")
public class ErrorResponse {
    @Schema(description = "Момент времени", example = "2025-06-02T09:00:00+03:00")
    private OffsetDateTime timestamp;
    @Schema(description = "HTTP статус", example = "400")
    private int status;
    @Schema(description = "Название статуса", example = "Bad Request")
    private String error;
    @Schema(description = "Сообщение ошибки", example = "Validation failed")
    private String message;
    @Schema(description = "Путь запроса", example = "uri=/api/routes/generate")
    private String path;
    @Schema(description = "Внешний сервис, из-за которого запрос не выполнен", example = "2gis-catalog")
    private String service;
    @Schema(description = "Нарушения валидации")
    private List<Violation> violations;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @Schema(name = "Violation", description = "Ошибка для конкретного поля")
    public static class Violation {
        @Schema(description = "Поле", example = "hours")
        private String field;
        @Schema(description = "Сообщение", example = "must be less than or equal to 8.0")
        private String message;
    }
}

