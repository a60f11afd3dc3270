package com.commodityforecast.model;

import org.apache.commons.math3.linear.RealMatrix;

import java.time.LocalDate;
import java.util.List;

/**
 * A model that forecasts the conditional mean of every variable in levels.
 */
public sealed interface MeanForecastModel extends FittedModel permits VarModel, VecmModel {

    List<String> variables();

    /** Levels representation used for iterating forecasts and computing MA coefficients. */
    LinearSystem levelsSystem();

    RealMatrix residualCovariance();

    /** The last observations in levels, chronological, at least {@code levelsSystem().order()} rows. */
    List<double[]> recentLevels();

    LocalDate lastObservationDate();
}
