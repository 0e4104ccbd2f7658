package com.simiq.rag.service.batch;

import com.simiq.product.dto.ProductDTO;
import com.simiq.rag.config.RagConfig;
import com.simiq.rag.dto.IndexedPoint;
import com.simiq.rag.exception.VectorIndexException;
import com.simiq.rag.service.VectorIndexGateway;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class BatchIndexUpdateServiceTest {

    @Mock
    private VectorIndexGateway gateway;

    private BatchIndexUpdateService service;

    @BeforeEach
    void setUp() {
        RagConfig config = new RagConfig();
        config.getEmbedding().setDimensions(2);
        config.getIndexing().setBatchSize(2);
        service = new BatchIndexUpdateService(gateway, config);
    }

    @Test
    @SuppressWarnings("unchecked")
    void upsertsInChunksOfConfiguredBatchSize() {
        List<ProductDTO> products = IntStream.rangeClosed(1, 5)
                .mapToObj(i -> product("P" + i, List.of(1.0f, 0.0f)))
                .toList();
        List<Integer> batchSizes = new ArrayList<>();
        doAnswer(invocation -> {
            batchSizes.add(((List<IndexedPoint>) invocation.getArgument(0)).size());
            return null;
        }).when(gateway).upsertMany(anyList());

        BatchIndexUpdateService.PersistResult result = service.updateIndex(products);

        assertThat(result.indexed()).isEqualTo(5);
        assertThat(result.skipped()).isZero();
        assertThat(batchSizes).containsExactly(2, 2, 1);
    }

    @Test
    @SuppressWarnings("unchecked")
    void skipsProductsThatCannotBecomePoints() {
        List<ProductDTO> products = List.of(
                product("P1", List.of(1.0f, 0.0f)),
                product("P2", null),
                product("P3", List.of(1.0f, 0.0f, 0.0f)),
                product(null, List.of(1.0f, 0.0f)));

        BatchIndexUpdateService.PersistResult result = service.updateIndex(products);

        ArgumentCaptor<List<IndexedPoint>> captor = ArgumentCaptor.forClass(List.class);
        verify(gateway).upsertMany(captor.capture());
        assertThat(captor.getValue()).extracting(IndexedPoint::getId).containsExactly("P1");
        assertThat(result.indexed()).isEqualTo(1);
        assertThat(result.skipped()).isEqualTo(3);
    }

    @Test
    void indexFailureAbortsUpdate() {
        doThrow(new VectorIndexException("down")).when(gateway).upsertMany(anyList());

        assertThatThrownBy(() -> service.updateIndex(List.of(
                product("P1", List.of(1.0f, 0.0f)),
                product("P2", List.of(0.0f, 1.0f)),
                product("P3", List.of(0.5f, 0.5f)))))
                .isInstanceOf(VectorIndexException.class);

        verify(gateway, times(1)).upsertMany(anyList());
    }

    @Test
    void emptyInputTouchesNothing() {
        assertThat(service.updateIndex(List.of()).indexed()).isZero();
        verifyNoInteractions(gateway);
    }

    private static ProductDTO product(String id, List<Float> embedding) {
        return ProductDTO.builder()
                .productId(id)
                .productName("Product " + id)
                .mainCategory("electronics")
                .subCategory("Phones")
                .embedding(embedding)
                .build();
    }
}
