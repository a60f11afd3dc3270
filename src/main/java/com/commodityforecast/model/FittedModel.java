package com.commodityforecast.model;

/**
 * Read-only result of a fit call. Consumers reach variant-specific behaviour through the
 * {@link MeanForecastModel} and {@link VolatilityModel} capabilities.
 */
public sealed interface FittedModel permits MeanForecastModel, VolatilityModel {

    String modelId();

    ModelVariant variant();

    int lagOrder();

    ModelDiagnostics diagnostics();
}
