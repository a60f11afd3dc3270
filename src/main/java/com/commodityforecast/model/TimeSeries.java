package com.commodityforecast.model;

import com.commodityforecast.exception.InvalidInputException;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Immutable, strictly date-ordered observations of a single variable.
 */
public final class TimeSeries {

    private static final String STAGE = "series-store";

    private final String name;
    private final SeriesKind kind;
    private final List<LocalDate> dates;
    private final double[] values;

    private TimeSeries(String name, SeriesKind kind, List<LocalDate> dates, double[] values) {
        this.name = name;
        this.kind = kind;
        this.dates = dates;
        this.values = values;
    }

    public static TimeSeries of(String name, List<LocalDate> dates, double[] values) {
        return of(name, SeriesKind.LEVEL, dates, values);
    }

    public static TimeSeries of(String name, SeriesKind kind, List<LocalDate> dates, double[] values) {
        if (name == null || name.isBlank()) {
            throw new InvalidInputException(STAGE, "Series name is required", Map.of());
        }
        if (dates == null || values == null || dates.size() != values.length) {
            throw new InvalidInputException(STAGE, "Series [" + name + "] needs one value per date",
                Map.of("variable", name));
        }
        for (int i = 0; i < values.length; i++) {
            if (dates.get(i) == null) {
                throw new InvalidInputException(STAGE, "Series [" + name + "] has a null date",
                    Map.of("variable", name, "index", i));
            }
            if (!Double.isFinite(values[i])) {
                throw new InvalidInputException(STAGE, "Series [" + name + "] has a non-finite value on " + dates.get(i),
                    Map.of("variable", name, "date", dates.get(i).toString()));
            }
            if (i > 0 && !dates.get(i).isAfter(dates.get(i - 1))) {
                throw new InvalidInputException(STAGE,
                    "Series [" + name + "] timestamps must be strictly increasing, found " + dates.get(i)
                        + " after " + dates.get(i - 1),
                    Map.of("variable", name, "date", dates.get(i).toString()));
            }
        }
        return new TimeSeries(name, kind, Collections.unmodifiableList(new ArrayList<>(dates)), values.clone());
    }

    public String getName() {
        return name;
    }

    public SeriesKind getKind() {
        return kind;
    }

    public int size() {
        return values.length;
    }

    public List<LocalDate> getDates() {
        return dates;
    }

    public double[] getValues() {
        return values.clone();
    }

    public double valueAt(int index) {
        return values[index];
    }

    public LocalDate dateAt(int index) {
        return dates.get(index);
    }

    public double lastValue() {
        if (values.length == 0) {
            throw new InvalidInputException(STAGE, "Series [" + name + "] is empty", Map.of("variable", name));
        }
        return values[values.length - 1];
    }

    public TimeSeries difference() {
        requireAtLeast(2);
        double[] diff = new double[values.length - 1];
        for (int i = 1; i < values.length; i++) {
            diff[i - 1] = values[i] - values[i - 1];
        }
        return new TimeSeries(name, kind, dates.subList(1, dates.size()), diff);
    }

    public TimeSeries logReturns() {
        requireAtLeast(2);
        double[] returns = new double[values.length - 1];
        for (int i = 1; i < values.length; i++) {
            if (values[i] <= 0 || values[i - 1] <= 0) {
                throw new InvalidInputException(STAGE, "Log returns need strictly positive prices in [" + name + "]",
                    Map.of("variable", name, "date", dates.get(i).toString()));
            }
            returns[i - 1] = Math.log(values[i] / values[i - 1]);
        }
        return new TimeSeries(name, SeriesKind.RETURN, dates.subList(1, dates.size()), returns);
    }

    public TimeSeries simpleReturns() {
        requireAtLeast(2);
        double[] returns = new double[values.length - 1];
        for (int i = 1; i < values.length; i++) {
            if (values[i - 1] == 0.0) {
                throw new InvalidInputException(STAGE, "Simple returns undefined after a zero price in [" + name + "]",
                    Map.of("variable", name, "date", dates.get(i - 1).toString()));
            }
            returns[i - 1] = values[i] / values[i - 1] - 1.0;
        }
        return new TimeSeries(name, SeriesKind.RETURN, dates.subList(1, dates.size()), returns);
    }

    private void requireAtLeast(int n) {
        if (values.length < n) {
            throw new InvalidInputException(STAGE, "Series [" + name + "] needs at least " + n + " observations",
                Map.of("variable", name, "observations", values.length));
        }
    }

    @Override
    public String toString() {
        return "TimeSeries{" + name + ", " + kind + ", n=" + values.length
            + (values.length > 0 ? ", " + dates.get(0) + ".." + dates.get(dates.size() - 1) : "") + "}";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof TimeSeries other)) {
            return false;
        }
        return name.equals(other.name) && kind == other.kind && dates.equals(other.dates)
            && Arrays.equals(values, other.values);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * name.hashCode() + dates.hashCode()) + Arrays.hashCode(values);
    }
}
