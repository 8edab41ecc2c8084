package com.msp.forecast.stats;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Descriptive statistics and least-squares fitting over price arrays.
 * Ratios with a zero denominator evaluate to 0 instead of NaN or infinity.
 */
public class StatisticsCalculator {

    private static final double SINGULAR_PIVOT = 1e-10;

    private StatisticsCalculator() {}

    public static double mean(double[] values) {
        if (values.length == 0) {
            return 0.0;
        }
        double sum = 0.0;
        for (double v : values) {
            sum += v;
        }
        return sum / values.length;
    }

    /**
     * Standard deviation with Bessel's correction (n - 1 denominator).
     */
    public static double sampleStdDev(double[] values) {
        if (values.length < 2) {
            return 0.0;
        }
        return Math.sqrt(sumSquaredDeviations(values) / (values.length - 1));
    }

    /**
     * Standard deviation with an n denominator.
     */
    public static double populationStdDev(double[] values) {
        if (values.length == 0) {
            return 0.0;
        }
        return Math.sqrt(sumSquaredDeviations(values) / values.length);
    }

    /**
     * CV = std / mean * 100, or 0 when the mean is not positive.
     */
    public static double coefficientOfVariation(double stdDev, double mean) {
        return mean > 0 ? stdDev / mean * 100 : 0.0;
    }

    /**
     * Percent change from first to last, or 0 when first is not positive.
     */
    public static double percentChange(double first, double last) {
        return first > 0 ? (last - first) / first * 100 : 0.0;
    }

    /**
     * Degree-1 least-squares fit of values against their index 0..n-1.
     */
    public static LinearFit linearFit(double[] values) {
        int n = values.length;
        if (n == 0) {
            return new LinearFit(0.0, 0.0);
        }
        if (n == 1) {
            return new LinearFit(0.0, values[0]);
        }
        double meanX = (n - 1) / 2.0;
        double meanY = mean(values);
        double sxy = 0.0;
        double sxx = 0.0;
        for (int i = 0; i < n; i++) {
            double dx = i - meanX;
            sxy += dx * (values[i] - meanY);
            sxx += dx * dx;
        }
        double slope = sxy / sxx;
        return new LinearFit(slope, meanY - slope * meanX);
    }

    /**
     * Solves min ||X b - y||^2 + sum(ridge[j] * b[j]^2) through the normal equations.
     *
     * @param design n x p design matrix
     * @param ridge  per-coefficient penalty, 0 for unpenalized columns
     * @return the p coefficients, or null when the system is singular
     */
    public static double[] leastSquares(double[][] design, double[] y, double[] ridge) {
        int p = ridge.length;
        double[][] a = new double[p][p + 1];

        for (int row = 0; row < design.length; row++) {
            double[] x = design[row];
            for (int i = 0; i < p; i++) {
                for (int j = 0; j < p; j++) {
                    a[i][j] += x[i] * x[j];
                }
                a[i][p] += x[i] * y[row];
            }
        }
        for (int i = 0; i < p; i++) {
            a[i][i] += ridge[i];
        }
        return solve(a);
    }

    /**
     * Round half-up to the given number of decimals.
     */
    public static double round(double value, int scale) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return 0.0;
        }
        return BigDecimal.valueOf(value).setScale(scale, RoundingMode.HALF_UP).doubleValue();
    }

    private static double sumSquaredDeviations(double[] values) {
        double mean = mean(values);
        double sum = 0.0;
        for (double v : values) {
            double d = v - mean;
            sum += d * d;
        }
        return sum;
    }

    // Gauss-Jordan elimination with partial pivoting on an augmented p x (p+1) matrix
    private static double[] solve(double[][] a) {
        int p = a.length;
        for (int col = 0; col < p; col++) {
            int pivot = col;
            for (int r = col + 1; r < p; r++) {
                if (Math.abs(a[r][col]) > Math.abs(a[pivot][col])) {
                    pivot = r;
                }
            }
            if (Math.abs(a[pivot][col]) < SINGULAR_PIVOT) {
                return null;
            }
            double[] tmp = a[col];
            a[col] = a[pivot];
            a[pivot] = tmp;

            for (int r = 0; r < p; r++) {
                if (r == col) {
                    continue;
                }
                double factor = a[r][col] / a[col][col];
                for (int c = col; c <= p; c++) {
                    a[r][c] -= factor * a[col][c];
                }
            }
        }
        double[] coefficients = new double[p];
        for (int i = 0; i < p; i++) {
            coefficients[i] = a[i][p] / a[i][i];
        }
        return coefficients;
    }
}
