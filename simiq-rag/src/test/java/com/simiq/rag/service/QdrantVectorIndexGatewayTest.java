package com.simiq.rag.service;

import com.simiq.product.dto.ProductDTO;
import com.simiq.product.exception.ProductException;
import com.simiq.rag.config.RagConfig;
import com.simiq.rag.dto.IndexedPoint;
import com.simiq.rag.dto.SearchResult;
import com.simiq.rag.exception.VectorIndexException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.*;
import static org.springframework.test.web.client.response.MockRestResponseCreators.*;

class QdrantVectorIndexGatewayTest {

    private static final String BASE = "http://qdrant.test:6333";
    private static final String EXISTING = "{\"result\":{\"collections\":[{\"name\":\"products\"}]},\"status\":\"ok\"}";
    private static final String OK = "{\"result\":true,\"status\":\"ok\"}";
    private static final String INDEXED = "{\"result\":{\"status\":\"green\",\"payload_schema\":"
            + "{\"sub_category\":{\"data_type\":\"keyword\",\"points\":3}}},\"status\":\"ok\"}";
    private static final String NOT_INDEXED = "{\"result\":{\"status\":\"green\",\"payload_schema\":{}},\"status\":\"ok\"}";

    private RagConfig config;
    private RestTemplate restTemplate;
    private MockRestServiceServer server;

    @BeforeEach
    void setUp() {
        config = new RagConfig();
        config.getEmbedding().setDimensions(3);
        config.getVectorSearch().setUrl(BASE + "/");
        config.getVectorSearch().setCollection("products");
        restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();
    }

    private QdrantVectorIndexGateway gateway() {
        return new QdrantVectorIndexGateway(config, restTemplate);
    }

    @Test
    void ensureCollection_createsCosineCollectionAndSubCategoryIndexWhenAbsent() {
        server.expect(requestTo(BASE + "/collections"))
                .andExpect(method(HttpMethod.GET))
                .andRespond(withSuccess("{\"result\":{\"collections\":[]},\"status\":\"ok\"}", MediaType.APPLICATION_JSON));
        server.expect(requestTo(BASE + "/collections/products"))
                .andExpect(method(HttpMethod.PUT))
                .andExpect(jsonPath("$.vectors.size").value(3))
                .andExpect(jsonPath("$.vectors.distance").value("Cosine"))
                .andRespond(withSuccess(OK, MediaType.APPLICATION_JSON));
        server.expect(requestTo(BASE + "/collections/products/index?wait=true"))
                .andExpect(method(HttpMethod.PUT))
                .andExpect(jsonPath("$.field_name").value("sub_category"))
                .andExpect(jsonPath("$.field_schema").value("keyword"))
                .andRespond(withSuccess(OK, MediaType.APPLICATION_JSON));

        gateway().ensureCollection("products", 3);

        server.verify();
    }

    @Test
    void ensureCollection_isNoOpWhenCollectionExists() {
        expectExistingCollection();

        gateway().ensureCollection("products", 3);

        server.verify();
    }

    @Test
    void ensureCollection_recreatesMissingPayloadIndexOnExistingCollection() {
        server.expect(requestTo(BASE + "/collections"))
                .andRespond(withSuccess(EXISTING, MediaType.APPLICATION_JSON));
        server.expect(requestTo(BASE + "/collections/products"))
                .andExpect(method(HttpMethod.GET))
                .andRespond(withSuccess(NOT_INDEXED, MediaType.APPLICATION_JSON));
        server.expect(requestTo(BASE + "/collections/products/index?wait=true"))
                .andExpect(method(HttpMethod.PUT))
                .andExpect(jsonPath("$.field_name").value("sub_category"))
                .andRespond(withSuccess(OK, MediaType.APPLICATION_JSON));

        gateway().ensureCollection("products", 3);

        server.verify();
    }

    @Test
    void ensureCollection_retriesIndexAfterEarlierIndexFailure() {
        server.expect(requestTo(BASE + "/collections"))
                .andRespond(withSuccess("{\"result\":{\"collections\":[]},\"status\":\"ok\"}", MediaType.APPLICATION_JSON));
        server.expect(requestTo(BASE + "/collections/products"))
                .andExpect(method(HttpMethod.PUT))
                .andRespond(withSuccess(OK, MediaType.APPLICATION_JSON));
        server.expect(requestTo(BASE + "/collections/products/index?wait=true"))
                .andRespond(withServerError());
        server.expect(requestTo(BASE + "/collections"))
                .andRespond(withSuccess(EXISTING, MediaType.APPLICATION_JSON));
        server.expect(requestTo(BASE + "/collections/products"))
                .andExpect(method(HttpMethod.GET))
                .andRespond(withSuccess(NOT_INDEXED, MediaType.APPLICATION_JSON));
        server.expect(requestTo(BASE + "/collections/products/index?wait=true"))
                .andExpect(method(HttpMethod.PUT))
                .andRespond(withSuccess(OK, MediaType.APPLICATION_JSON));

        QdrantVectorIndexGateway gateway = gateway();
        assertThatThrownBy(() -> gateway.ensureCollection("products", 3))
                .isInstanceOf(VectorIndexException.class);
        gateway.ensureCollection("products", 3);

        server.verify();
    }

    @Test
    void ensureCollection_toleratesConcurrentCreation() {
        server.expect(requestTo(BASE + "/collections"))
                .andRespond(withSuccess("{\"result\":{\"collections\":[]},\"status\":\"ok\"}", MediaType.APPLICATION_JSON));
        server.expect(requestTo(BASE + "/collections/products"))
                .andRespond(withStatus(HttpStatus.CONFLICT)
                        .contentType(MediaType.APPLICATION_JSON)
                        .body("{\"status\":{\"error\":\"Collection `products` already exists!\"}}"));
        server.expect(requestTo(BASE + "/collections/products"))
                .andExpect(method(HttpMethod.GET))
                .andRespond(withSuccess(INDEXED, MediaType.APPLICATION_JSON));

        assertThatCode(() -> gateway().ensureCollection("products", 3)).doesNotThrowAnyException();
        server.verify();
    }

    @Test
    void upsertMany_sendsWholeBatchInOneRequestAndChecksCollectionOnce() {
        expectExistingCollection();
        server.expect(requestTo(BASE + "/collections/products/points?wait=true"))
                .andExpect(method(HttpMethod.PUT))
                .andExpect(jsonPath("$.points.length()").value(2))
                .andExpect(jsonPath("$.points[0].id").value(QdrantVectorIndexGateway.pointId("P1")))
                .andExpect(jsonPath("$.points[0].payload.product_id").value("P1"))
                .andExpect(jsonPath("$.points[0].vector.length()").value(3))
                .andRespond(withSuccess(OK, MediaType.APPLICATION_JSON));
        server.expect(requestTo(BASE + "/collections/products/points?wait=true"))
                .andExpect(jsonPath("$.points.length()").value(1))
                .andRespond(withSuccess(OK, MediaType.APPLICATION_JSON));

        QdrantVectorIndexGateway gateway = gateway();
        gateway.upsertMany(List.of(point("P1", "Smartphones"), point("P2", "Smartphones")));
        gateway.upsertOne(point("P3", "Laptops"));

        server.verify();
    }

    @Test
    void upsertMany_withWrongDimensionsSendsNothing() {
        IndexedPoint bad = IndexedPoint.builder()
                .id("P9")
                .vector(List.of(1.0f, 0.0f))
                .payload(Map.of("product_id", "P9"))
                .build();

        assertThatThrownBy(() -> gateway().upsertMany(List.of(point("P1", "Smartphones"), bad)))
                .isInstanceOf(ProductException.class)
                .hasFieldOrPropertyWithValue("errorCode", ProductException.VALIDATION_ERROR);

        server.verify();
    }

    @Test
    void getById_returnsPayloadAndVector() {
        expectExistingCollection();
        server.expect(requestTo(BASE + "/collections/products/points"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(jsonPath("$.ids[0]").value(QdrantVectorIndexGateway.pointId("P1")))
                .andExpect(jsonPath("$.with_vector").value(true))
                .andRespond(withSuccess("""
                        {"result":[{"id":"%s","payload":{"product_id":"P1","sub_category":"Smartphones","ratings":4.1,"no_of_ratings":10},
                        "vector":[1.0,0.0,0.0]}],"status":"ok"}
                        """.formatted(QdrantVectorIndexGateway.pointId("P1")), MediaType.APPLICATION_JSON));

        Optional<IndexedPoint> point = gateway().getById("P1", true);

        assertThat(point).isPresent();
        assertThat(point.get().getId()).isEqualTo("P1");
        assertThat(point.get().getVector()).containsExactly(1.0f, 0.0f, 0.0f);
        assertThat(point.get().toProduct().getSubCategory()).isEqualTo("Smartphones");
        assertThat(point.get().toProduct().getNoOfRatings()).isEqualTo(10);
    }

    @Test
    void getById_returnsEmptyForUnknownProduct() {
        expectExistingCollection();
        server.expect(requestTo(BASE + "/collections/products/points"))
                .andRespond(withSuccess("{\"result\":[],\"status\":\"ok\"}", MediaType.APPLICATION_JSON));

        assertThat(gateway().getById("nope", true)).isEmpty();
    }

    @Test
    void searchSimilar_sendsFilterAndConvertsScoreToDistance() {
        expectExistingCollection();
        server.expect(requestTo(BASE + "/collections/products/points/search"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(jsonPath("$.limit").value(3))
                .andExpect(jsonPath("$.with_payload").value(true))
                .andExpect(jsonPath("$.filter.must[0].key").value("sub_category"))
                .andExpect(jsonPath("$.filter.must[0].match.value").value("Smartphones"))
                .andRespond(withSuccess("""
                        {"result":[
                          {"id":"a","score":0.95,"payload":{"product_id":"P2","main_category":"electronics","sub_category":"Smartphones","price_usd":"$10.00"}},
                          {"id":"b","score":0.8,"payload":{"product_id":"P3","main_category":"electronics","sub_category":"Smartphones"}}
                        ],"status":"ok"}
                        """, MediaType.APPLICATION_JSON));

        List<SearchResult> results = gateway().searchSimilar(
                List.of(1.0f, 0.0f, 0.0f), 3, Map.of(ProductDTO.SUB_CATEGORY, "Smartphones"));

        assertThat(results).extracting(SearchResult::getProductId).containsExactly("P2", "P3");
        assertThat(results.get(0).getDistance()).isCloseTo(0.05, within(1e-9));
        assertThat(results.get(1).getDistance()).isCloseTo(0.2, within(1e-9));
        assertThat(results.get(0).getProduct().getPriceUsd()).isEqualTo("$10.00");
    }

    @Test
    void serverErrorBecomesVectorIndexException() {
        server.expect(requestTo(BASE + "/collections"))
                .andRespond(withServerError());

        assertThatThrownBy(() -> gateway().getById("P1"))
                .isInstanceOf(VectorIndexException.class)
                .hasFieldOrPropertyWithValue("errorCode", VectorIndexException.INDEX_UNAVAILABLE);
    }

    @Test
    void malformedResponseBecomesVectorIndexException() {
        expectExistingCollection();
        server.expect(requestTo(BASE + "/collections/products/points/search"))
                .andRespond(withSuccess("{\"status\":\"ok\"}", MediaType.APPLICATION_JSON));

        assertThatThrownBy(() -> gateway().searchSimilar(List.of(1.0f, 0.0f, 0.0f), 1, Map.of()))
                .isInstanceOf(VectorIndexException.class);
    }

    @Test
    void sendsApiKeyHeaderWhenConfigured() {
        config.getVectorSearch().setApiKey("secret");
        server.expect(requestTo(BASE + "/collections"))
                .andExpect(header("api-key", "secret"))
                .andRespond(withSuccess(EXISTING, MediaType.APPLICATION_JSON));
        server.expect(requestTo(BASE + "/collections/products"))
                .andExpect(header("api-key", "secret"))
                .andRespond(withSuccess(INDEXED, MediaType.APPLICATION_JSON));

        gateway().ensureCollection("products", 3);

        server.verify();
    }

    @Test
    void pointId_isStableUuidPerProduct() {
        assertThat(QdrantVectorIndexGateway.pointId("P1"))
                .isEqualTo(QdrantVectorIndexGateway.pointId("P1"))
                .isNotEqualTo(QdrantVectorIndexGateway.pointId("P2"))
                .matches("[0-9a-f]{8}-[0-9a-f]{4}-3[0-9a-f]{3}-[0-9a-f]{4}-[0-9a-f]{12}");
    }

    private void expectExistingCollection() {
        server.expect(requestTo(BASE + "/collections"))
                .andExpect(method(HttpMethod.GET))
                .andRespond(withSuccess(EXISTING, MediaType.APPLICATION_JSON));
        server.expect(requestTo(BASE + "/collections/products"))
                .andExpect(method(HttpMethod.GET))
                .andRespond(withSuccess(INDEXED, MediaType.APPLICATION_JSON));
    }

    private static IndexedPoint point(String id, String subCategory) {
        return IndexedPoint.fromProduct(ProductDTO.builder()
                .productId(id)
                .productName("Product " + id)
                .mainCategory("electronics")
                .subCategory(subCategory)
                .embedding(List.of(1.0f, 0.0f, 0.0f))
                .build());
    }
}
