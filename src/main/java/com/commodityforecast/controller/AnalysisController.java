package com.commodityforecast.controller;

import com.commodityforecast.dto.AnalysisRequest;
import com.commodityforecast.dto.AnalysisResponse;
import com.commodityforecast.dto.SeriesAnalysisRequest;
import com.commodityforecast.model.CausalityResult;
import com.commodityforecast.model.FactorImpact;
import com.commodityforecast.model.StationarityReport;
import com.commodityforecast.service.CommodityAnalysisService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@Validated
@RestController
@RequestMapping("/api/v1/analysis")
@RequiredArgsConstructor
public class AnalysisController {

    private final CommodityAnalysisService analysisService;

    @PostMapping
    public ResponseEntity<AnalysisResponse> analyze(@Valid @RequestBody AnalysisRequest request) {
        return ResponseEntity.ok(analysisService.analyze(request));
    }

    @PostMapping("/stationarity")
    public ResponseEntity<StationarityReport> stationarity(@Valid @RequestBody SeriesAnalysisRequest request) {
        return ResponseEntity.ok(analysisService.stationarity(request));
    }

    @PostMapping("/causality")
    public ResponseEntity<CausalityResult> causality(@Valid @RequestBody SeriesAnalysisRequest request) {
        return ResponseEntity.ok(analysisService.causality(request));
    }

    @PostMapping("/factor-impact")
    public ResponseEntity<FactorImpact> factorImpact(@Valid @RequestBody SeriesAnalysisRequest request) {
        return ResponseEntity.ok(analysisService.factorImpact(request));
    }
}
