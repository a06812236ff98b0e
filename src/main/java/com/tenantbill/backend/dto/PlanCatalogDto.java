package com.tenantbill.backend.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * Public plan catalog, plans in ascending rank order
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class PlanCatalogDto {

    private List<PlanDto> plans;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class PlanDto {
        private String name;
        private int rank;
        private Map<String, Integer> limits;
        private List<String> features;
    }
}
