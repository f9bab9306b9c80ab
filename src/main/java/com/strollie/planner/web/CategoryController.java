package com.strollie.planner.web;

import com.strollie.planner.model.dto.CategoryDto;
import com.strollie.planner.service.CategoryCacheService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.ArraySchema;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequiredArgsConstructor
@RequestMapping("/api/categories")
@Tag(name = "Categories", description = "Справочник доступных категорий мест")
public class CategoryController {

    private final CategoryCacheService categoryService;

    @GetMapping
    @Operation(summary = "Получение списка категорий",
            description = "Возвращает категории мест, по которым подбираются точки маршрута")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Список категорий",
                    content = @Content(array = @ArraySchema(schema = @Schema(implementation = CategoryDto.class))))
            ,
            @ApiResponse(responseCode = "500", description = "Внутренняя ошибка",
                    content = @Content(schema = @Schema(hidden = true)))
    })
    public List<CategoryDto> getCategories() {
        return categoryService.getAllCategories();
    }

    @GetMapping("/{id}")
    @Operation(summary = "Категория по идентификатору",
            description = "Возвращает категорию с поисковым запросом и рубриками 2ГИС")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Категория найдена",
                    content = @Content(schema = @Schema(implementation = CategoryDto.class))),
            @ApiResponse(responseCode = "404", description = "Категория не найдена",
                    content = @Content(schema = @Schema(hidden = true)))
    })
    public ResponseEntity<CategoryDto> getCategory(@PathVariable String id) {
        return categoryService.findById(id)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

}
