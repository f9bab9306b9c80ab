package com.strollie.planner.service;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.strollie.planner.model.dto.CategoryDto;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.Resource;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Category catalogue loaded from {@code categories.json}: display names, catalog queries and rubric hints.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CategoryCacheService {

    private final ObjectMapper objectMapper;
    @Value("classpath:categories.json")
    private Resource resourceFile;
    private List<CategoryDto> categories = new ArrayList<>();

    @PostConstruct
    public void init() {
        log.info("Загрузка категорий из файла: {}", resourceFile.getFilename());

        try {
            if (!resourceFile.exists()) {
                log.error("Файл категорий не найден: {}", resourceFile.getDescription());
                throw new IllegalStateException("Файл categories.json не найден");
            }

            categories = objectMapper.readValue(resourceFile.getInputStream(), new TypeReference<List<CategoryDto>>() {
            });

            log.info("Категории успешно загружены. Количество записей: {}", categories.size());

        } catch (IOException e) {
            log.error("Ошибка при чтении файла категорий JSON", e);
            throw new IllegalStateException("Не удалось инициализировать кэш категорий", e);
        }
    }

    public List<CategoryDto> getAllCategories() {
        return categories;
    }

    public Optional<CategoryDto> findById(String id) {
        if (id == null) {
            return Optional.empty();
        }
        String key = id.trim().toLowerCase(Locale.ROOT);
        Optional<CategoryDto> found = categories.stream().filter(c -> c.getId().equals(key)).findFirst();
        if (found.isEmpty()) {
            log.warn("Категория с ID {} не найдена", id);
        }
        return found;
    }

    public String getCategoryNameById(String id) {
        log.debug("Поиск названия категории по ID: {}", id);
        return findById(id).map(CategoryDto::getName).orElse(null);
    }

    /**
     * Query text for the catalog search; the id itself when the category is unknown.
     */
    public String searchQueryFor(String id) {
        return findById(id)
                .map(c -> c.getSearchQuery() != null ? c.getSearchQuery() : c.getName())
                .orElse(id);
    }

    /**
     * Normalized category id for a 2GIS rubric name, matched by the rubric hints.
     */
    public Optional<String> categoryForRubric(String rubricName) {
        if (rubricName == null || rubricName.isBlank()) {
            return Optional.empty();
        }
        String lowered = rubricName.toLowerCase(Locale.ROOT);
        for (CategoryDto category : categories) {
            if (category.getRubricHints() == null) {
                continue;
            }
            for (String hint : category.getRubricHints()) {
                if (lowered.contains(hint)) {
                    return Optional.of(category.getId());
                }
            }
        }
        return Optional.empty();
    }
}
