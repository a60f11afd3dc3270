package com.commodityforecast.service;

import com.commodityforecast.config.AnalysisConfig;
import com.commodityforecast.config.AnalysisProperties;
import com.commodityforecast.dto.AnalysisOverrides;
import com.commodityforecast.dto.AnalysisRequest;
import com.commodityforecast.dto.AnalysisResponse;
import com.commodityforecast.dto.SeriesAnalysisRequest;
import com.commodityforecast.dto.SeriesPayload;
import com.commodityforecast.dto.SupplierQuoteRequest;
import com.commodityforecast.exception.InvalidInputException;
import com.commodityforecast.model.AnalysisInput;
import com.commodityforecast.model.AnalysisReport;
import com.commodityforecast.model.CausalityResult;
import com.commodityforecast.model.CointegrationResult;
import com.commodityforecast.model.EngleGrangerResult;
import com.commodityforecast.model.FactorImpact;
import com.commodityforecast.model.Forecast;
import com.commodityforecast.model.GarchModel;
import com.commodityforecast.model.ImpulseResponse;
import com.commodityforecast.model.MeanForecastModel;
import com.commodityforecast.model.ModelVariant;
import com.commodityforecast.model.MultivariateSeries;
import com.commodityforecast.model.ProcurementPlan;
import com.commodityforecast.model.RiskAssessment;
import com.commodityforecast.model.StationarityReport;
import com.commodityforecast.model.TimeSeries;
import com.commodityforecast.model.VolatilityPath;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Future;
import java.util.function.Supplier;

/**
 * Runs the full pipeline for one request: unit-root and causality screening, mean model choice,
 * mean and volatility fits, then forecast, risk and procurement. Independent stages run on
 * {@link ModelFitExecutor}; nothing is kept between requests.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CommodityAnalysisService {

    static final String STAGE = "pipeline";

    private final StationarityAnalyzer        stationarityAnalyzer;
    private final CausalityTester             causalityTester;
    private final VectorAutoregressionService vectorAutoregression;
    private final GarchVolatilityService      garchVolatility;
    private final RiskEngine                  riskEngine;
    private final ProcurementOptimizer        procurementOptimizer;
    private final FactorImpactAnalyzer        factorImpactAnalyzer;
    private final ModelFitExecutor            executor;
    private final AnalysisProperties          properties;

    public AnalysisResponse analyze(AnalysisRequest request) {
        AnalysisConfig config = resolve(request.getOverrides());
        AnalysisInput input = AnalysisInput.builder()
            .series(toSeries(request.getSeries(), config))
            .target(request.getTarget())
            .horizon(request.getHorizon())
            .exposure(request.getExposure())
            .demandRate(request.getDemandRate())
            .candidateLags(request.getCandidateLags())
            .suppliers(request.getSuppliers() == null
                ? List.of()
                : request.getSuppliers().stream().map(SupplierQuoteRequest::toQuote).toList())
            .inventory(request.getInventory() != null ? request.getInventory().toPosition() : null)
            .build();
        return toResponse(run(input, config));
    }

    public StationarityReport stationarity(SeriesAnalysisRequest request) {
        AnalysisConfig config = resolve(request.getOverrides());
        return stationarityAnalyzer.analyze(toSeries(request.getSeries(), config), config);
    }

    public CausalityResult causality(SeriesAnalysisRequest request) {
        AnalysisConfig config = resolve(request.getOverrides());
        MultivariateSeries series = toSeries(request.getSeries(), config);
        if (series.dimension() < 2) {
            throw new InvalidInputException(CausalityTester.STAGE, "Causality testing needs at least two series",
                Map.of("variables", series.getVariables()));
        }
        return causalityTester.test(series, request.getCandidateLags(), config);
    }

    public FactorImpact factorImpact(SeriesAnalysisRequest request) {
        AnalysisConfig config = resolve(request.getOverrides());
        return factorImpactAnalyzer.analyze(toSeries(request.getSeries(), config), request.getTarget(),
            request.getTopFactors(), config);
    }

    public AnalysisReport run(AnalysisInput input, AnalysisConfig config) {
        validate(input);
        MultivariateSeries series = input.getSeries();
        String target = input.getTarget();
        List<Integer> candidateLags = input.getCandidateLags() != null && !input.getCandidateLags().isEmpty()
            ? input.getCandidateLags()
            : defaultLags(config.getMaxLagOrder());
        log.info("Pipeline started | target={} | variables={} | n={} | horizon={}",
            target, series.getVariables(), series.size(), input.getHorizon());

        ModelFitExecutor.Deadline screening = executor.deadline(config.getFitTimeout());
        Future<StationarityReport> stationarityJob = executor.submit(StationarityAnalyzer.STAGE,
            () -> stationarityAnalyzer.analyze(series, config));
        Future<CausalityResult> causalityJob = series.dimension() >= 2
            ? executor.submit(CausalityTester.STAGE, () -> causalityTester.test(series, candidateLags, config))
            : null;

        StationarityReport stationarity;
        CausalityResult causality;
        try {
            stationarity = executor.await(stationarityJob, StationarityAnalyzer.STAGE, screening);
            causality = causalityJob != null
                ? executor.await(causalityJob, CausalityTester.STAGE, screening)
                : null;
        } catch (RuntimeException ex) {
            executor.cancel(stationarityJob, causalityJob);
            throw ex;
        }

        List<String> drivers = causality != null
            ? causalityTester.selectDrivers(causality, target)
            : List.of(target);
        MultivariateSeries system = series.select(drivers);
        List<EngleGrangerResult> pairwise = new ArrayList<>();
        for (String driver : drivers.subList(1, drivers.size())) {
            pairwise.add(stationarityAnalyzer.engleGranger(series.series(target), series.series(driver), config));
        }

        MeanModelChoice choice = chooseMeanModel(system, stationarity, config);
        log.info("Mean model chosen | variant={} | drivers={}", choice.variant(), drivers);
        TimeSeries returns = series.series(target).logReturns();
        ModelFitExecutor.Deadline fitting = executor.deadline(config.getFitTimeout());
        Future<MeanForecastModel> meanJob = executor.submit(VectorAutoregressionService.STAGE, choice.fit());
        Future<GarchModel> volatilityJob = executor.submit(GarchVolatilityService.STAGE,
            () -> garchVolatility.fit(returns, config));

        MeanForecastModel meanModel;
        GarchModel volatilityModel;
        try {
            meanModel = executor.await(meanJob, VectorAutoregressionService.STAGE, fitting);
            volatilityModel = executor.await(volatilityJob, GarchVolatilityService.STAGE, fitting);
        } catch (RuntimeException ex) {
            executor.cancel(meanJob, volatilityJob);
            throw ex;
        }

        int horizon = input.getHorizon();
        Forecast forecast = vectorAutoregression.forecast(meanModel, horizon, config.getConfidenceLevel());
        ImpulseResponse impulseResponse = vectorAutoregression.impulseResponse(meanModel, horizon, true);
        VolatilityPath volatility = garchVolatility.forecastVolatility(volatilityModel, horizon);
        RiskAssessment risk = riskEngine.assess(forecast, volatility, input.getExposure(), config);
        ProcurementPlan plan = procurementOptimizer.plan(forecast, risk, input.getSuppliers(),
            input.getDemandRate(), input.getInventory(), config);
        FactorImpact factorImpact = series.dimension() >= 2
            ? factorImpactAnalyzer.analyze(series, target, FactorImpactAnalyzer.DEFAULT_TOP_FACTORS, config)
            : null;

        log.info("Pipeline finished | target={} | model={} | lag={} | risk={} | savings={}",
            target, meanModel.variant(), meanModel.lagOrder(), risk.getRiskLevel(), plan.getProjectedSavings());
        return AnalysisReport.builder()
            .stationarity(stationarity)
            .cointegration(choice.cointegration())
            .pairwiseCointegration(List.copyOf(pairwise))
            .causality(causality)
            .drivers(drivers)
            .meanModel(meanModel)
            .volatilityModel(volatilityModel)
            .forecast(forecast)
            .impulseResponse(impulseResponse)
            .volatility(volatility)
            .risk(risk)
            .plan(plan)
            .factorImpact(factorImpact)
            .build();
    }

    /**
     * Stationary levels get a levels VAR and mixed orders of integration a differenced VAR.
     * An all-integrated system small enough for the rank tables is handed to Johansen.
     */
    private MeanModelChoice chooseMeanModel(MultivariateSeries system, StationarityReport stationarity,
                                            AnalysisConfig config) {
        int maxLag = config.getMaxLagOrder();
        List<String> variables = system.getVariables();
        boolean allStationary = variables.stream().allMatch(v -> stationarity.variable(v).isStationary());
        boolean noneStationary = variables.stream().noneMatch(v -> stationarity.variable(v).isStationary());

        if (allStationary) {
            return new MeanModelChoice(ModelVariant.VAR_LEVELS, null,
                () -> vectorAutoregression.fit(system, maxLag, config.getInformationCriterion()));
        }
        if (variables.size() < 2 || !noneStationary
            || variables.size() > StationarityAnalyzer.MAX_JOHANSEN_VARIABLES) {
            if (variables.size() > StationarityAnalyzer.MAX_JOHANSEN_VARIABLES) {
                log.warn("Rank test skipped for {} variables, falling back to differences", variables.size());
            }
            return differenced(system, config);
        }

        int lagOrder = vectorAutoregression.selectLagOrder(system, maxLag, config.getInformationCriterion());
        CointegrationResult cointegration = stationarityAnalyzer.testCointegration(system, lagOrder, config);
        ModelVariant variant = cointegration.recommendedVariant();
        if (variant == ModelVariant.VECM) {
            return new MeanModelChoice(variant, cointegration,
                () -> vectorAutoregression.fitVecm(system, cointegration));
        }
        if (variant == ModelVariant.VAR_LEVELS) {
            return new MeanModelChoice(variant, cointegration,
                () -> vectorAutoregression.fit(system, maxLag, config.getInformationCriterion()));
        }
        return new MeanModelChoice(variant, cointegration,
            () -> vectorAutoregression.fitDifferenced(system, maxLag, config.getInformationCriterion()));
    }

    private MeanModelChoice differenced(MultivariateSeries system, AnalysisConfig config) {
        return new MeanModelChoice(ModelVariant.VAR_DIFFERENCED, null,
            () -> vectorAutoregression.fitDifferenced(system, config.getMaxLagOrder(),
                config.getInformationCriterion()));
    }

    private void validate(AnalysisInput input) {
        if (input == null || input.getSeries() == null) {
            throw new InvalidInputException(STAGE, "An aligned series is required", Map.of());
        }
        if (input.getTarget() == null || !input.getSeries().contains(input.getTarget())) {
            throw new InvalidInputException(STAGE, "Target [" + input.getTarget() + "] is not one of the series",
                Map.of("target", String.valueOf(input.getTarget()), "available", input.getSeries().getVariables()));
        }
        if (input.getHorizon() < 1) {
            throw new InvalidInputException(STAGE, "Horizon must be >= 1", Map.of("horizon", input.getHorizon()));
        }
        if (!(input.getExposure() >= 0)) {
            throw new InvalidInputException(STAGE, "Exposure must be >= 0", Map.of("exposure", input.getExposure()));
        }
        if (!(input.getDemandRate() > 0)) {
            throw new InvalidInputException(STAGE, "Demand rate must be > 0",
                Map.of("demandRate", input.getDemandRate()));
        }
    }

    private AnalysisConfig resolve(AnalysisOverrides overrides) {
        AnalysisConfig defaults = properties.toConfig();
        return overrides == null ? defaults : overrides.applyTo(defaults);
    }

    private MultivariateSeries toSeries(List<SeriesPayload> payloads, AnalysisConfig config) {
        List<TimeSeries> series = new ArrayList<>();
        for (SeriesPayload payload : payloads) {
            List<SeriesPayload.Observation> points = payload.getPoints().stream()
                .sorted((a, b) -> a.getDate().compareTo(b.getDate()))
                .toList();
            List<LocalDate> dates = points.stream().map(SeriesPayload.Observation::getDate).toList();
            double[] values = points.stream().mapToDouble(SeriesPayload.Observation::getValue).toArray();
            series.add(TimeSeries.of(payload.getName(), dates, values));
        }
        return MultivariateSeries.align(series, config.getGapPolicy());
    }

    private static List<Integer> defaultLags(int maxLag) {
        List<Integer> lags = new ArrayList<>();
        for (int lag = 1; lag <= maxLag; lag++) {
            lags.add(lag);
        }
        return lags;
    }

    private AnalysisResponse toResponse(AnalysisReport report) {
        MeanForecastModel mean = report.getMeanModel();
        GarchModel garch = report.getVolatilityModel();
        CointegrationResult cointegration = report.getCointegration();
        return AnalysisResponse.builder()
            .target(report.getForecast().primary().getVariable())
            .horizon(report.getForecast().getHorizon())
            .generatedAt(Instant.now())
            .stationarity(report.getStationarity())
            .cointegration(cointegration)
            .pairwiseCointegration(report.getPairwiseCointegration())
            .causality(report.getCausality())
            .drivers(report.getDrivers())
            .meanModel(AnalysisResponse.MeanModelSummary.builder()
                .modelId(mean.modelId())
                .variant(mean.variant())
                .variables(mean.variables())
                .lagOrder(mean.lagOrder())
                .rank(mean.variant() == ModelVariant.VECM && cointegration != null ? cointegration.getRank() : null)
                .lastObservationDate(mean.lastObservationDate())
                .diagnostics(mean.diagnostics())
                .build())
            .volatilityModel(AnalysisResponse.VolatilityModelSummary.builder()
                .modelId(garch.modelId())
                .variable(garch.variable())
                .p(garch.order().p())
                .q(garch.order().q())
                .mean(garch.mean())
                .omega(garch.omega())
                .alpha(Arrays.stream(garch.alpha()).boxed().toList())
                .beta(Arrays.stream(garch.beta()).boxed().toList())
                .persistence(garch.persistence())
                .unconditionalVariance(garch.unconditionalVariance())
                .distribution(garch.distribution())
                .degreesOfFreedom(garch.degreesOfFreedom())
                .diagnostics(garch.diagnostics())
                .build())
            .forecast(report.getForecast())
            .impulseResponse(report.getImpulseResponse())
            .volatility(report.getVolatility())
            .risk(report.getRisk())
            .plan(report.getPlan())
            .factorImpact(report.getFactorImpact())
            .build();
    }

    private record MeanModelChoice(ModelVariant variant, CointegrationResult cointegration,
                                   Supplier<MeanForecastModel> fit) {
    }
}
