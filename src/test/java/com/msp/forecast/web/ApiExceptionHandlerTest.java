package com.msp.forecast.web;

import com.msp.forecast.BaseIntegrationTest;
import com.msp.forecast.TestPrices;
import com.msp.forecast.advisory.TrainingRequest;
import com.msp.forecast.persistence.PriceObservationRepository;
import com.msp.forecast.series.TimeSeriesStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * HTTP error contract: failures map to problem responses with the right status.
 */
@DisplayName("ApiExceptionHandler Tests")
class ApiExceptionHandlerTest extends BaseIntegrationTest {

    private static final ParameterizedTypeReference<Map<String, Object>> JSON_MAP = new ParameterizedTypeReference<>() {};

    @Autowired
    private TestRestTemplate restTemplate;

    @Autowired
    private TimeSeriesStore store;

    @Autowired
    private PriceObservationRepository priceRepository;

    @BeforeEach
    void setUp() {
        priceRepository.deleteAll();
        store.ingest(TestPrices.dailySeries("Jute", "West Bengal", "Kolkata", store.today().minusDays(1), 10, i -> 5000));
    }

    private ResponseEntity<Map<String, Object>> get(String url) {
        return restTemplate.exchange(url, HttpMethod.GET, null, JSON_MAP);
    }

    private ResponseEntity<Map<String, Object>> post(String url, Object body) {
        return restTemplate.exchange(url, HttpMethod.POST, new HttpEntity<>(body), JSON_MAP);
    }

    @Test
    @DisplayName("Predict without a model is 404")
    void shouldMapModelUnavailable() {
        ResponseEntity<Map<String, Object>> response = get("/predict/Jute/West Bengal?autoTrain=false");

        assertEquals(HttpStatus.NOT_FOUND, response.getStatusCode());
        assertEquals("jute_west_bengal_all", response.getBody().get("seriesKey"));
        assertEquals("urn:msp-forecast:problem:not-found", response.getBody().get("type"));
    }

    @Test
    @DisplayName("Training on short history is 422")
    void shouldMapInsufficientData() {
        ResponseEntity<Map<String, Object>> response = post("/train", new TrainingRequest("Jute", "West Bengal", null));

        assertEquals(HttpStatus.UNPROCESSABLE_ENTITY, response.getStatusCode());
        assertEquals(10, ((Number) response.getBody().get("available")).intValue());
        assertEquals(30, ((Number) response.getBody().get("required")).intValue());
        assertEquals("jute_west_bengal_all", response.getBody().get("seriesKey"));
    }

    @Test
    @DisplayName("Blank commodity is 400")
    void shouldMapIllegalArgument() {
        ResponseEntity<Map<String, Object>> response = post("/train", new TrainingRequest("", "West Bengal", null));

        assertEquals(HttpStatus.BAD_REQUEST, response.getStatusCode());
        assertEquals("Bad Request", response.getBody().get("title"));
    }

    @Test
    @DisplayName("Out-of-range horizon is 400")
    void shouldRejectHorizonOutOfRange() {
        ResponseEntity<Map<String, Object>> response = get("/predict/Jute/West Bengal?days=30");

        assertEquals(HttpStatus.BAD_REQUEST, response.getStatusCode());
    }

    @Test
    @DisplayName("Missing current price is 400")
    void shouldRequireCurrentPrice() {
        ResponseEntity<Map<String, Object>> response = get("/recommend/Jute/West Bengal");

        assertEquals(HttpStatus.BAD_REQUEST, response.getStatusCode());
    }

    @Test
    @DisplayName("Unknown state has no markets")
    void shouldMapNotFound() {
        ResponseEntity<Map<String, Object>> response = get("/markets/Atlantis");

        assertEquals(HttpStatus.NOT_FOUND, response.getStatusCode());
    }

    @Test
    @DisplayName("Catalog endpoints answer normally")
    void shouldServeCatalog() {
        ResponseEntity<Map<String, Object>> response = get("/commodities");

        assertEquals(HttpStatus.OK, response.getStatusCode());
        assertEquals(1, ((Number) response.getBody().get("count")).intValue());
    }
}
