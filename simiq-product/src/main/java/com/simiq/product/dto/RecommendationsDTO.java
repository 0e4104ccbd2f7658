package com.simiq.product.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Ordered recommendations for one anchor product, nearest first. May be empty.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RecommendationsDTO {

    @Builder.Default
    private List<RecommendationDTO> results = new ArrayList<>();

    public static RecommendationsDTO empty() {
        return new RecommendationsDTO(new ArrayList<>());
    }

    public int size() {
        return results.size();
    }
}
