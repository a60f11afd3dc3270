package com.commodityforecast.model;

import com.commodityforecast.exception.InvalidInputException;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NavigableSet;
import java.util.TreeSet;

/**
 * Variables aligned on one shared date index. Every row holds a value for every variable,
 * so nothing downstream has to deal with missing cells.
 */
public final class MultivariateSeries {

    private static final String STAGE = "series-store";

    private final List<LocalDate> dates;
    private final Map<String, TimeSeries> columns;

    private MultivariateSeries(List<LocalDate> dates, Map<String, TimeSeries> columns) {
        this.dates = dates;
        this.columns = columns;
    }

    public static MultivariateSeries align(List<TimeSeries> series, GapPolicy policy) {
        if (series == null || series.isEmpty()) {
            throw new InvalidInputException(STAGE, "At least one series is required", Map.of());
        }
        Map<String, TimeSeries> byName = new LinkedHashMap<>();
        for (TimeSeries ts : series) {
            if (byName.put(ts.getName(), ts) != null) {
                throw new InvalidInputException(STAGE, "Duplicate variable [" + ts.getName() + "]",
                    Map.of("variable", ts.getName()));
            }
            if (ts.size() == 0) {
                throw new InvalidInputException(STAGE, "Series [" + ts.getName() + "] is empty",
                    Map.of("variable", ts.getName()));
            }
        }

        List<LocalDate> index = policy == GapPolicy.INNER_JOIN ? intersection(series) : union(series);
        if (index.isEmpty()) {
            throw new InvalidInputException(STAGE, "Series share no common dates under " + policy,
                Map.of("gapPolicy", policy.name()));
        }

        Map<String, TimeSeries> aligned = new LinkedHashMap<>();
        for (TimeSeries ts : byName.values()) {
            aligned.put(ts.getName(), reindex(ts, index));
        }
        return new MultivariateSeries(Collections.unmodifiableList(index), Collections.unmodifiableMap(aligned));
    }

    /**
     * Builds an already aligned series from a row-major matrix.
     */
    public static MultivariateSeries ofMatrix(List<String> names, List<LocalDate> dates, double[][] rows) {
        if (names.isEmpty() || rows.length != dates.size()) {
            throw new InvalidInputException(STAGE, "Matrix rows must match the date index",
                Map.of("rows", rows.length, "dates", dates.size()));
        }
        List<TimeSeries> series = new ArrayList<>();
        for (int j = 0; j < names.size(); j++) {
            double[] column = new double[rows.length];
            for (int t = 0; t < rows.length; t++) {
                column[t] = rows[t][j];
            }
            series.add(TimeSeries.of(names.get(j), dates, column));
        }
        return align(series, GapPolicy.INNER_JOIN);
    }

    private static List<LocalDate> intersection(List<TimeSeries> series) {
        NavigableSet<LocalDate> common = new TreeSet<>(series.get(0).getDates());
        for (int i = 1; i < series.size(); i++) {
            common.retainAll(series.get(i).getDates());
        }
        return new ArrayList<>(common);
    }

    private static List<LocalDate> union(List<TimeSeries> series) {
        LocalDate start = series.stream()
            .map(ts -> ts.dateAt(0))
            .max(LocalDate::compareTo)
            .orElseThrow();
        NavigableSet<LocalDate> all = new TreeSet<>();
        series.forEach(ts -> all.addAll(ts.getDates()));
        return new ArrayList<>(all.tailSet(start, true));
    }

    private static TimeSeries reindex(TimeSeries ts, List<LocalDate> index) {
        double[] values = new double[index.size()];
        List<LocalDate> source = ts.getDates();
        int cursor = 0;
        double carried = Double.NaN;
        for (int i = 0; i < index.size(); i++) {
            LocalDate date = index.get(i);
            while (cursor < source.size() && !source.get(cursor).isAfter(date)) {
                carried = ts.valueAt(cursor);
                cursor++;
            }
            values[i] = carried;
        }
        return TimeSeries.of(ts.getName(), ts.getKind(), index, values);
    }

    public List<String> getVariables() {
        return List.copyOf(columns.keySet());
    }

    public List<LocalDate> getDates() {
        return dates;
    }

    public int size() {
        return dates.size();
    }

    public int dimension() {
        return columns.size();
    }

    public boolean contains(String variable) {
        return columns.containsKey(variable);
    }

    public TimeSeries series(String variable) {
        TimeSeries ts = columns.get(variable);
        if (ts == null) {
            throw new InvalidInputException(STAGE, "Unknown variable [" + variable + "]",
                Map.of("variable", variable, "available", getVariables()));
        }
        return ts;
    }

    public double[] column(String variable) {
        return series(variable).getValues();
    }

    /**
     * Row-major copy: {@code matrix()[t][j]} is variable {@code j} at date {@code t}.
     */
    public double[][] matrix() {
        List<String> names = getVariables();
        double[][] rows = new double[size()][names.size()];
        for (int j = 0; j < names.size(); j++) {
            double[] column = columns.get(names.get(j)).getValues();
            for (int t = 0; t < column.length; t++) {
                rows[t][j] = column[t];
            }
        }
        return rows;
    }

    public double[] lastRow() {
        double[][] rows = matrix();
        return rows[rows.length - 1];
    }

    public MultivariateSeries select(List<String> variables) {
        Map<String, TimeSeries> subset = new LinkedHashMap<>();
        for (String variable : variables) {
            subset.put(variable, series(variable));
        }
        return new MultivariateSeries(dates, Collections.unmodifiableMap(subset));
    }

    public MultivariateSeries difference() {
        Map<String, TimeSeries> diffs = new LinkedHashMap<>();
        columns.forEach((name, ts) -> diffs.put(name, ts.difference()));
        return new MultivariateSeries(dates.subList(1, dates.size()), Collections.unmodifiableMap(diffs));
    }

    @Override
    public String toString() {
        return "MultivariateSeries{" + getVariables() + ", n=" + size() + "}";
    }
}
