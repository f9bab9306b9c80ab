package com.strollie.planner.web;

import com.strollie.planner.model.dto.RouteRequest;
import com.strollie.planner.model.dto.RouteResponse;
import com.strollie.planner.service.RoutePlanningService;
import com.strollie.planner.web.error.ErrorResponse;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.ExampleObject;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/routes")
@Tag(name = "Routes")
public class RouteController {

    private final RoutePlanningService planningService;

    public RouteController(RoutePlanningService planningService) {
        this.planningService = planningService;
    }

    @PostMapping("/generate")
    @Operation(
            summary = "Построение пешеходного маршрута",
            description = "Подбирает места по интересам, упорядочивает их, строит расписание с учётом часов работы и кофе-пауз"
    )
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Маршрут успешно построен",
                    content = @Content(schema = @Schema(implementation = RouteResponse.class))),
            @ApiResponse(responseCode = "400", description = "Ошибка валидации или точка старта не найдена",
                    content = @Content(schema = @Schema(implementation = ErrorResponse.class))),
            @ApiResponse(responseCode = "404", description = "Не найдено подходящих мест",
                    content = @Content(schema = @Schema(implementation = ErrorResponse.class))),
            @ApiResponse(responseCode = "422", description = "Маршрут не укладывается во время",
                    content = @Content(schema = @Schema(implementation = ErrorResponse.class))),
            @ApiResponse(responseCode = "503", description = "Внешний сервис недоступен",
                    content = @Content(schema = @Schema(implementation = ErrorResponse.class)))
    })
    public ResponseEntity<RouteResponse> generateRoute(
            @Valid @RequestBody
            @io.swagger.v3.oas.annotations.parameters.RequestBody(description = "Параметры маршрута",
                    required = true,
                    content = @Content(
                            schema = @Schema(implementation = RouteRequest.class),
                            examples = {
                                    @ExampleObject(name = "Пример",
                                            value = "{\n  \"lat\": 56.3287,\n  \"lon\": 44.0020,\n  \"hours\": 3,\n  \"intensity\": \"medium\",\n  \"socialMode\": \"couple\",\n  \"categories\": [\"museum\", \"embankment\", \"viewpoint\"],\n  \"interests\": \"история и красивые виды\",\n  \"startTime\": \"11:00\",\n  \"breaks\": { \"enabled\": true, \"intervalMinutes\": 90 }\n}")
                            }
                    )
            ) RouteRequest request) {
        return ResponseEntity.ok(planningService.generateRoute(request));
    }

}
