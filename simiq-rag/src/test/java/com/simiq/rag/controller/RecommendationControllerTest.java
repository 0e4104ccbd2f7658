package com.simiq.rag.controller;

import com.simiq.product.dto.ProductDTO;
import com.simiq.product.dto.RecommendationDTO;
import com.simiq.product.dto.RecommendationsDTO;
import com.simiq.product.exception.ProductException;
import com.simiq.product.exception.ProductExceptionHandler;
import com.simiq.rag.exception.RagExceptionHandler;
import com.simiq.rag.exception.VectorIndexException;
import com.simiq.rag.service.RecommendationService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;
import java.util.Optional;

import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(controllers = RecommendationController.class)
@Import({RecommendationController.class, HealthController.class,
        ProductExceptionHandler.class, RagExceptionHandler.class})
class RecommendationControllerTest {

    @Autowired
    MockMvc mvc;

    @MockBean
    RecommendationService recommendationService;

    @Test
    void returnsRecommendationsNearestFirst() throws Exception {
        when(recommendationService.recommend("P1", 2)).thenReturn(Optional.of(RecommendationsDTO.builder()
                .results(List.of(
                        recommendation("P2", "$90.00", 0.1),
                        recommendation("P3", "$70.00", 0.3)))
                .build()));

        mvc.perform(get("/get-recommendation").param("product_id", "P1").param("limit", "2"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.results.length()").value(2))
                .andExpect(jsonPath("$.results[0].product.product_id").value("P2"))
                .andExpect(jsonPath("$.results[0].product.category").value("electronics"))
                .andExpect(jsonPath("$.results[0].product.sub_category").value("Smartphones"))
                .andExpect(jsonPath("$.results[0].product.price").value("$90.00"))
                .andExpect(jsonPath("$.results[0].distance").value(0.1))
                .andExpect(jsonPath("$.results[1].product.product_id").value("P3"));
    }

    @Test
    void defaultsLimitToFive() throws Exception {
        when(recommendationService.recommend("P1", 5)).thenReturn(Optional.of(RecommendationsDTO.empty()));

        mvc.perform(get("/get-recommendation").param("product_id", "P1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.results").isEmpty());

        verify(recommendationService).recommend("P1", 5);
    }

    @Test
    void rejectsLimitBelowOne() throws Exception {
        mvc.perform(get("/get-recommendation").param("product_id", "P1").param("limit", "0"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorCode").value(ProductException.VALIDATION_ERROR));

        verifyNoInteractions(recommendationService);
    }

    @Test
    void unknownProductIsNotFound() throws Exception {
        when(recommendationService.recommend(eq("ghost"), anyInt())).thenReturn(Optional.empty());

        mvc.perform(get("/get-recommendation").param("product_id", "ghost"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.errorCode").value(ProductException.PRODUCT_NOT_FOUND));
    }

    @Test
    void indexOutageIsServiceUnavailable() throws Exception {
        when(recommendationService.recommend(anyString(), anyInt()))
                .thenThrow(new VectorIndexException("Vector index unavailable during retrieve"));

        mvc.perform(get("/get-recommendation").param("product_id", "P1"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(header().exists("Retry-After"))
                .andExpect(jsonPath("$.errorCode").value(VectorIndexException.INDEX_UNAVAILABLE));
    }

    @Test
    void rootReportsServiceStatus() throws Exception {
        mvc.perform(get("/"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("ok"))
                .andExpect(jsonPath("$.service").value("Similar Product Recommendation Service"));
    }

    private static RecommendationDTO recommendation(String id, String priceUsd, double distance) {
        return RecommendationDTO.fromProduct(ProductDTO.builder()
                .productId(id)
                .mainCategory("electronics")
                .subCategory("Smartphones")
                .priceUsd(priceUsd)
                .build(), distance);
    }
}
