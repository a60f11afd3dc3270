package com.commodityforecast.controller;

import com.commodityforecast.SyntheticSeries;
import com.commodityforecast.dto.AnalysisOverrides;
import com.commodityforecast.dto.AnalysisRequest;
import com.commodityforecast.dto.InventoryRequest;
import com.commodityforecast.dto.SeriesAnalysisRequest;
import com.commodityforecast.dto.SeriesPayload;
import com.commodityforecast.dto.SupplierQuoteRequest;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.test.context.ActiveProfiles;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
@ActiveProfiles("test")
class AnalysisControllerIntegrationTest {

    @Autowired TestRestTemplate restTemplate;

    private static SeriesPayload payload(String name, double[] values) {
        List<LocalDate> dates = SyntheticSeries.dates(values.length);
        List<SeriesPayload.Observation> points = new ArrayList<>();
        for (int i = 0; i < values.length; i++) {
            points.add(SeriesPayload.Observation.builder().date(dates.get(i)).value(values[i]).build());
        }
        return SeriesPayload.builder().name(name).points(points).build();
    }

    /** Palm oil prices with clustered volatility and an unrelated crude series. */
    private static List<SeriesPayload> marketSeries(int n) {
        double[] returns = SyntheticSeries.garchReturns(new Random(77), n - 1, 1e-5, 0.10, 0.85);
        double[] cpo = new double[n];
        cpo[0] = 800.0;
        for (int i = 1; i < n; i++) {
            cpo[i] = cpo[i - 1] * Math.exp(returns[i - 1]);
        }
        double[] brent = SyntheticSeries.geometricWalk(new Random(78), n, 80.0, 0.015);
        return List.of(payload("cpo", cpo), payload("brent", brent));
    }

    private AnalysisRequest.AnalysisRequestBuilder validRequest() {
        return AnalysisRequest.builder()
            .series(marketSeries(500))
            .target("cpo")
            .horizon(10)
            .exposure(1_000.0)
            .demandRate(100.0)
            .candidateLags(List.of(1, 2, 3))
            .suppliers(List.of(
                SupplierQuoteRequest.builder().name("mill-a").unitPrice(805.0).logisticsCostPerUnit(4.0).build(),
                SupplierQuoteRequest.builder().name("trader-b").pricePremium(0.01).paymentTermsDays(60)
                    .reliability(0.9).build()));
    }

    @Test
    @SuppressWarnings("unchecked")
    void analyze_returnsForecastRiskAndPlan() {
        ResponseEntity<Map> resp = restTemplate.postForEntity("/api/v1/analysis", validRequest().build(), Map.class);

        assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.OK);
        Map<String, Object> body = resp.getBody();
        assertThat(body).containsKeys("stationarity", "drivers", "meanModel", "volatilityModel", "forecast",
            "volatility", "risk", "plan", "factorImpact");
        assertThat(body.get("target")).isEqualTo("cpo");

        Map<String, Object> forecast = (Map<String, Object>) body.get("forecast");
        assertThat(((Number) forecast.get("horizon")).intValue()).isEqualTo(10);
        List<Map<String, Object>> variables = (List<Map<String, Object>>) forecast.get("variables");
        assertThat(variables.get(0).get("variable")).isEqualTo("cpo");
        assertThat((List<?>) variables.get(0).get("points")).hasSize(11);

        Map<String, Object> risk = (Map<String, Object>) body.get("risk");
        assertThat(((Number) risk.get("valueAtRisk")).doubleValue()).isPositive();
        assertThat(risk.get("riskLevel")).isIn("LOW", "MEDIUM", "HIGH");

        Map<String, Object> plan = (Map<String, Object>) body.get("plan");
        assertThat(((Number) plan.get("projectedSavings")).doubleValue()).isGreaterThanOrEqualTo(-1e-6);
        assertThat((List<?>) plan.get("suppliers")).hasSize(2);
    }

    @Test
    @SuppressWarnings("unchecked")
    void analyze_boundsOrderByInventoryPosition() {
        AnalysisRequest request = validRequest()
            .inventory(InventoryRequest.builder()
                .currentInventory(500.0)
                .storageCapacity(900.0)
                .safetyStockDays(2)
                .build())
            .build();

        ResponseEntity<Map> resp = restTemplate.postForEntity("/api/v1/analysis", request, Map.class);

        assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.OK);
        Map<String, Object> plan = (Map<String, Object>) resp.getBody().get("plan");
        Map<String, Object> order = (Map<String, Object>) plan.get("order");
        assertThat(((Number) order.get("quantity")).doubleValue()).isBetween(200.0 - 1e-6, 400.0 + 1e-6);
        Map<String, Object> inventory = (Map<String, Object>) plan.get("inventory");
        assertThat(((Number) inventory.get("daysOfSupply")).doubleValue()).isEqualTo(5.0);
        assertThat(((Number) inventory.get("reorderPoint")).doubleValue()).isEqualTo(1_700.0);
        assertThat(inventory.get("reorderNow")).isEqualTo(true);
    }

    @Test
    void analyze_fullStorageHasNoFeasiblePlan() {
        AnalysisRequest request = validRequest()
            .inventory(InventoryRequest.builder().currentInventory(900.0).storageCapacity(900.0).build())
            .build();

        ResponseEntity<Map> resp = restTemplate.postForEntity("/api/v1/analysis", request, Map.class);

        assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.CONFLICT);
        assertThat(resp.getBody().get("stage")).isEqualTo("procurement");
    }

    @Test
    @SuppressWarnings("unchecked")
    void factorImpact_ranksDriversOfTarget() {
        SeriesAnalysisRequest request = SeriesAnalysisRequest.builder()
            .series(marketSeries(300))
            .target("cpo")
            .build();

        ResponseEntity<Map> resp = restTemplate.postForEntity("/api/v1/analysis/factor-impact", request, Map.class);

        assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat((List<String>) resp.getBody().get("topFactors")).containsExactly("brent");
        List<Map<String, Object>> factors = (List<Map<String, Object>>) resp.getBody().get("factors");
        assertThat(factors.get(0).get("strength")).isIn("VERY_STRONG", "STRONG", "MODERATE", "WEAK");
    }

    @Test
    void factorImpact_withoutTargetIsBadRequest() {
        SeriesAnalysisRequest request = SeriesAnalysisRequest.builder().series(marketSeries(300)).build();

        ResponseEntity<Map> resp = restTemplate.postForEntity("/api/v1/analysis/factor-impact", request, Map.class);

        assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(resp.getBody().get("stage")).isEqualTo("factor-impact");
    }

    @Test
    @SuppressWarnings("unchecked")
    void analyze_missingTargetFailsValidation() {
        AnalysisRequest request = validRequest().target(null).build();

        ResponseEntity<Map> resp = restTemplate.postForEntity("/api/v1/analysis", request, Map.class);

        assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.UNPROCESSABLE_ENTITY);
        List<Map<String, Object>> fieldErrors = (List<Map<String, Object>>) resp.getBody().get("fieldErrors");
        assertThat(fieldErrors).extracting(fe -> fe.get("field")).contains("target");
    }

    @Test
    void analyze_unknownTargetIsBadRequest() {
        AnalysisRequest request = validRequest().target("soybean").build();

        ResponseEntity<Map> resp = restTemplate.postForEntity("/api/v1/analysis", request, Map.class);

        assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(resp.getBody().get("errorCode")).isEqualTo("INVALID_INPUT");
        assertThat(resp.getBody().get("stage")).isEqualTo("pipeline");
    }

    @Test
    void analyze_shortHistoryIsUnprocessable() {
        AnalysisRequest request = validRequest()
            .series(List.of(payload("cpo", SyntheticSeries.geometricWalk(new Random(1), 20, 800.0, 0.01))))
            .build();

        ResponseEntity<Map> resp = restTemplate.postForEntity("/api/v1/analysis", request, Map.class);

        assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.UNPROCESSABLE_ENTITY);
        assertThat(resp.getBody().get("errorCode")).isEqualTo("INSUFFICIENT_DATA");
        assertThat(resp.getBody().get("stage")).isEqualTo("stationarity");
        assertThat(resp.getBody()).containsKey("parameters");
    }

    @Test
    void analyze_malformedBodyIsBadRequest() {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);

        ResponseEntity<Map> resp = restTemplate.postForEntity("/api/v1/analysis",
            new HttpEntity<>("{\"series\": [", headers), Map.class);

        assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
    }

    @Test
    void analyze_echoesRequestId() {
        HttpHeaders headers = new HttpHeaders();
        headers.set("X-Request-ID", "trace-42");
        AnalysisRequest request = validRequest().target("soybean").build();

        ResponseEntity<Map> resp = restTemplate.postForEntity("/api/v1/analysis",
            new HttpEntity<>(request, headers), Map.class);

        assertThat(resp.getHeaders().getFirst("X-Request-ID")).isEqualTo("trace-42");
        assertThat(resp.getBody().get("requestId")).isEqualTo("trace-42");
    }

    @Test
    void analyze_generatesRequestIdWhenAbsent() {
        ResponseEntity<Map> resp = restTemplate.postForEntity("/api/v1/analysis",
            validRequest().target("soybean").build(), Map.class);

        assertThat(resp.getHeaders().getFirst("X-Request-ID")).isNotBlank();
        assertThat(resp.getBody().get("requestId")).isEqualTo(resp.getHeaders().getFirst("X-Request-ID"));
    }

    @Test
    @SuppressWarnings("unchecked")
    void stationarity_reportsEveryVariable() {
        SeriesAnalysisRequest request = SeriesAnalysisRequest.builder().series(marketSeries(300)).build();

        ResponseEntity<Map> resp = restTemplate.postForEntity("/api/v1/analysis/stationarity", request, Map.class);

        assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.OK);
        List<Map<String, Object>> variables = (List<Map<String, Object>>) resp.getBody().get("variables");
        assertThat(variables).extracting(v -> v.get("variable")).containsExactly("cpo", "brent");
    }

    @Test
    @SuppressWarnings("unchecked")
    void causality_returnsEveryDirectedPair() {
        SeriesAnalysisRequest request = SeriesAnalysisRequest.builder()
            .series(marketSeries(300))
            .candidateLags(List.of(1, 2))
            .build();

        ResponseEntity<Map> resp = restTemplate.postForEntity("/api/v1/analysis/causality", request, Map.class);

        assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat((List<?>) resp.getBody().get("pairs")).hasSize(2);
        assertThat(resp.getBody().get("correction")).isEqualTo("BONFERRONI");
    }

    @Test
    void causality_needsTwoSeries() {
        SeriesAnalysisRequest request = SeriesAnalysisRequest.builder()
            .series(List.of(payload("cpo", SyntheticSeries.geometricWalk(new Random(2), 100, 800.0, 0.01))))
            .build();

        ResponseEntity<Map> resp = restTemplate.postForEntity("/api/v1/analysis/causality", request, Map.class);

        assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(resp.getBody().get("errorCode")).isEqualTo("INVALID_INPUT");
    }

    @Test
    @SuppressWarnings("unchecked")
    void overrides_areValidated() {
        AnalysisRequest request = validRequest()
            .overrides(AnalysisOverrides.builder().confidenceLevel(1.5).build())
            .build();

        ResponseEntity<Map> resp = restTemplate.postForEntity("/api/v1/analysis", request, Map.class);

        assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.UNPROCESSABLE_ENTITY);
        List<Map<String, Object>> fieldErrors = (List<Map<String, Object>>) resp.getBody().get("fieldErrors");
        assertThat(fieldErrors).extracting(fe -> fe.get("field")).contains("overrides.confidenceLevel");
    }

    @Test
    void overrides_rejectMissingStressShock() {
        Map<String, Double> scenarios = new HashMap<>();
        scenarios.put("port_strike", null);
        AnalysisRequest request = validRequest()
            .overrides(AnalysisOverrides.builder().stressScenarios(scenarios).build())
            .build();

        ResponseEntity<Map> resp = restTemplate.postForEntity("/api/v1/analysis", request, Map.class);

        assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.UNPROCESSABLE_ENTITY);
        assertThat(resp.getBody().get("errorCode")).isEqualTo("VALIDATION_FAILED");
    }
}
