package com.strollie.planner.model.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
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
@JsonInclude(JsonInclude.Include.NON_EMPTY)
@Schema(name = "Category", description = "Категория места/активности")
public class CategoryDto {

    @JsonProperty("category")
    @Schema(description = "Название категории", example = "Музеи")
    private String name;

    @JsonProperty("id")
    @Schema(description = "Идентификатор категории", example = "museum")
    private String id;

    @JsonProperty("query")
    @Schema(description = "Поисковый запрос в каталоге 2GIS", example = "музей")
    private String searchQuery;

    @JsonProperty("rubrics")
    @Schema(description = "Фрагменты названий рубрик 2GIS, относящихся к категории", example = "[\"музей\"]")
    private List<String> rubricHints;

}
