package com.strollie.planner.explain;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class RouteExplanation {
    private String summary;
    @Builder.Default
    private List<StopExplanation> stops = new ArrayList<>();
    @Builder.Default
    private List<String> notes = new ArrayList<>();

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class StopExplanation {
        private int order;
        private String why;
        private String tip;
    }
}
