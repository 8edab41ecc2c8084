package com.msp.forecast.forecast;

import com.msp.forecast.series.DailyPrice;
import com.msp.forecast.stats.StatisticsCalculator;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Additive trend + yearly seasonality model:
 * <pre>
 *   y(t) = b0 + b1 * t / span + sum_k [ s_k * sin(2 pi k t / P) + c_k * cos(2 pi k t / P) ]
 * </pre>
 * with t in days since the first training date and P one tropical year. Coefficients
 * are fitted by least squares with a light ridge penalty on the seasonal terms. The
 * interval is a 90% band from the residual standard deviation.
 */
@Value
@Builder
@Jacksonized
public class SeasonalTrendModel {

    static final double YEAR_DAYS = 365.25;
    static final double INTERVAL_Z = 1.645;
    static final double SEASONAL_RIDGE = 1.0;

    // Each yearly harmonic needs this many days of history to be fitted
    static final int DAYS_PER_HARMONIC = 60;

    LocalDate origin;
    double spanDays;
    int fourierOrder;

    /**
     * [b0, b1, s_1, c_1, ..., s_K, c_K]
     */
    List<Double> coefficients;

    double residualStdDev;

    /**
     * Fits the model, using fewer harmonics than {@code maxFourierOrder} when the
     * history is too short to resolve them.
     *
     * @return empty when the fit is singular or not finite
     */
    public static Optional<SeasonalTrendModel> fit(List<DailyPrice> series, int maxFourierOrder) {
        if (series.size() < 2) {
            return Optional.empty();
        }
        LocalDate origin = series.get(0).getDate();
        double span = Math.max(1, ChronoUnit.DAYS.between(origin, series.get(series.size() - 1).getDate()));
        int order = (int) Math.max(0, Math.min(maxFourierOrder, Math.floor(span / DAYS_PER_HARMONIC)));
        int p = 2 + 2 * order;
        if (series.size() <= p) {
            return Optional.empty();
        }

        double[][] design = new double[series.size()][];
        double[] y = new double[series.size()];
        for (int i = 0; i < series.size(); i++) {
            double t = ChronoUnit.DAYS.between(origin, series.get(i).getDate());
            design[i] = features(t, span, order);
            y[i] = series.get(i).getPrice();
        }

        double[] ridge = new double[p];
        for (int j = 2; j < p; j++) {
            ridge[j] = SEASONAL_RIDGE;
        }

        double[] beta = StatisticsCalculator.leastSquares(design, y, ridge);
        if (beta == null) {
            return Optional.empty();
        }

        double sse = 0.0;
        for (int i = 0; i < y.length; i++) {
            double residual = y[i] - dot(beta, design[i]);
            sse += residual * residual;
        }
        double sigma = Math.sqrt(sse / Math.max(1, y.length - p));

        List<Double> coefficients = new ArrayList<>(p);
        for (double b : beta) {
            if (!Double.isFinite(b)) {
                return Optional.empty();
            }
            coefficients.add(b);
        }

        return Optional.of(SeasonalTrendModel.builder()
                .origin(origin)
                .spanDays(span)
                .fourierOrder(order)
                .coefficients(List.copyOf(coefficients))
                .residualStdDev(sigma)
                .build());
    }

    public double estimate(LocalDate date) {
        double t = ChronoUnit.DAYS.between(origin, date);
        double[] x = features(t, spanDays, fourierOrder);
        double value = 0.0;
        for (int j = 0; j < x.length; j++) {
            value += coefficients.get(j) * x[j];
        }
        return value;
    }

    /**
     * Half width of the 90% interval around {@link #estimate}.
     */
    public double intervalHalfWidth() {
        return INTERVAL_Z * residualStdDev;
    }

    private static double[] features(double t, double span, int order) {
        double[] x = new double[2 + 2 * order];
        x[0] = 1.0;
        x[1] = t / span;
        for (int k = 1; k <= order; k++) {
            double angle = 2 * Math.PI * k * t / YEAR_DAYS;
            x[2 * k] = Math.sin(angle);
            x[2 * k + 1] = Math.cos(angle);
        }
        return x;
    }

    private static double dot(double[] beta, double[] x) {
        double sum = 0.0;
        for (int j = 0; j < x.length; j++) {
            sum += beta[j] * x[j];
        }
        return sum;
    }
}
