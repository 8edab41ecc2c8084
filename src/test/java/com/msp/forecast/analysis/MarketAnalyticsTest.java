package com.msp.forecast.analysis;

import com.msp.forecast.TestPrices;
import com.msp.forecast.series.PricePoint;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.time.Month;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for the pure analytics functions of MarketAnalytics.
 */
@DisplayName("MarketAnalytics Tests")
class MarketAnalyticsTest {

    private static final LocalDate START = LocalDate.of(2024, 1, 1);

    private static List<PricePoint> series(double... prices) {
        List<Double> values = new ArrayList<>();
        for (double price : prices) {
            values.add(price);
        }
        return TestPrices.flatSeries(values, START);
    }

    private static List<PricePoint> repeated(List<Double> head, double first, int firstCount,
                                             double second, int secondCount) {
        List<Double> values = new ArrayList<>(head);
        values.addAll(Collections.nCopies(firstCount, first));
        values.addAll(Collections.nCopies(secondCount, second));
        return TestPrices.flatSeries(values, START);
    }

    @Nested
    @DisplayName("Volatility")
    class VolatilityTests {

        @Test
        @DisplayName("Classification boundaries by coefficient of variation")
        void shouldClassifyByCoefficientOfVariation() {
            assertEquals(VolatilityClass.LOW, VolatilityClass.fromCoefficientOfVariation(3));
            assertEquals(VolatilityClass.MODERATE, VolatilityClass.fromCoefficientOfVariation(7));
            assertEquals(VolatilityClass.HIGH, VolatilityClass.fromCoefficientOfVariation(12));
            assertEquals(VolatilityClass.VERY_HIGH, VolatilityClass.fromCoefficientOfVariation(20));

            assertEquals(VolatilityClass.MODERATE, VolatilityClass.fromCoefficientOfVariation(5));
            assertEquals(VolatilityClass.HIGH, VolatilityClass.fromCoefficientOfVariation(10));
            assertEquals(VolatilityClass.VERY_HIGH, VolatilityClass.fromCoefficientOfVariation(15));
        }

        @Test
        @DisplayName("Should use sample standard deviation")
        void shouldUseSampleStandardDeviation() {
            VolatilityProfile profile = MarketAnalytics.volatilityOf(series(90, 110, 90, 110, 100));

            assertEquals(100.0, profile.getMean());
            assertEquals(10.0, profile.getStdDev());
            assertEquals(10.0, profile.getCoefficientOfVariation());
            assertEquals(VolatilityClass.HIGH, profile.getClassification());
            assertEquals(5, profile.getSampleSize());
        }

        @Test
        @DisplayName("Fewer than five observations is insufficient")
        void shouldFlagInsufficientData() {
            VolatilityProfile profile = MarketAnalytics.volatilityOf(series(100, 101, 102, 103));

            assertEquals(VolatilityClass.INSUFFICIENT_DATA, profile.getClassification());
            assertFalse(profile.hasData());
        }
    }

    @Nested
    @DisplayName("Trend")
    class TrendTests {

        @Test
        @DisplayName("Change under 2% is stable")
        void shouldDetectStable() {
            TrendProfile trend = MarketAnalytics.trendOf(series(100, 100.25, 100.5, 100.75, 101, 101.25, 101.5));

            assertEquals(TrendDirection.STABLE, trend.getDirection());
            assertEquals(1.5, trend.getChangePercent());
            assertEquals(TrendStrength.WEAK, trend.getStrengthLabel());
        }

        @Test
        @DisplayName("Rise of 6% is a moderate upward trend")
        void shouldDetectUpward() {
            TrendProfile trend = MarketAnalytics.trendOf(series(100, 101, 102, 103, 104, 105, 106));

            assertEquals(TrendDirection.UPWARD, trend.getDirection());
            assertEquals(6.0, trend.getChangePercent());
            assertEquals(TrendStrength.MODERATE, trend.getStrengthLabel());
            assertEquals(1.0, trend.getSlope());
        }

        @Test
        @DisplayName("Fall of 6% is a moderate downward trend")
        void shouldDetectDownward() {
            TrendProfile trend = MarketAnalytics.trendOf(series(100, 99, 98, 97, 96, 95, 94));

            assertEquals(TrendDirection.DOWNWARD, trend.getDirection());
            assertEquals(-6.0, trend.getChangePercent());
            assertEquals(6.0, trend.getStrength());
        }

        @Test
        @DisplayName("Fewer than seven observations is insufficient")
        void shouldFlagInsufficientData() {
            TrendProfile trend = MarketAnalytics.trendOf(series(100, 101, 102));

            assertEquals(TrendDirection.INSUFFICIENT_DATA, trend.getDirection());
        }
    }

    @Nested
    @DisplayName("Seasonality")
    class SeasonalityTests {

        @Test
        @DisplayName("Should find peak and trough months")
        void shouldFindPeakAndTrough() {
            List<PricePoint> points = new ArrayList<>();
            points.add(TestPrices.point("Onion", "Maharashtra", "Lasalgaon", LocalDate.of(2023, 1, 10), 90));
            points.add(TestPrices.point("Onion", "Maharashtra", "Lasalgaon", LocalDate.of(2023, 1, 20), 110));
            points.add(TestPrices.point("Onion", "Maharashtra", "Lasalgaon", LocalDate.of(2023, 7, 10), 130));

            SeasonalProfile profile = MarketAnalytics.seasonalityOf(points);

            assertTrue(profile.isHasPattern());
            assertEquals(Month.JULY, profile.getPeakMonth());
            assertEquals(130.0, profile.getPeakPrice());
            assertEquals(Month.JANUARY, profile.getTroughMonth());
            assertEquals(100.0, profile.getTroughPrice());
            // monthly averages 100 and 130: population std 15 over mean 115
            assertEquals(13.04, profile.getSeasonalStrength());
            assertEquals(SeasonalStrength.STRONG, profile.getStrengthLabel());
        }

        @Test
        @DisplayName("No data means no pattern")
        void shouldReportNoPattern() {
            assertFalse(MarketAnalytics.seasonalityOf(List.of()).isHasPattern());
        }
    }

    @Nested
    @DisplayName("Anomalies")
    class AnomalyTests {

        @Test
        @DisplayName("Spike and drop at 2.5 standard deviations are moderate")
        void shouldFlagModerateAnomalies() {
            List<PricePoint> points = repeated(List.of(125.0, 75.0), 105, 7, 95, 7);

            List<AnomalyEvent> anomalies = MarketAnalytics.anomaliesOf(points, 2.0);

            assertEquals(2, anomalies.size());
            AnomalyEvent spike = anomalies.stream().filter(a -> a.getType() == AnomalyType.SPIKE).findFirst().orElseThrow();
            AnomalyEvent drop = anomalies.stream().filter(a -> a.getType() == AnomalyType.DROP).findFirst().orElseThrow();
            assertEquals(125.0, spike.getPrice());
            assertEquals(2.5, spike.getZScore());
            assertEquals(AnomalySeverity.MODERATE, spike.getSeverity());
            assertEquals(25.0, spike.getDeviationPercent());
            assertEquals(75.0, drop.getPrice());
            assertEquals(-2.5, drop.getZScore());
            assertEquals(AnomalySeverity.MODERATE, drop.getSeverity());
        }

        @Test
        @DisplayName("Beyond three standard deviations is high severity")
        void shouldFlagHighSeverity() {
            List<PricePoint> points = repeated(List.of(135.0, 65.0), 105, 15, 95, 15);

            List<AnomalyEvent> anomalies = MarketAnalytics.anomaliesOf(points, 2.0);

            assertEquals(2, anomalies.size());
            assertTrue(anomalies.stream().allMatch(a -> a.getSeverity() == AnomalySeverity.HIGH));
            assertEquals(3.5, Math.abs(anomalies.get(0).getZScore()));
        }

        @Test
        @DisplayName("Higher sensitivity suppresses moderate anomalies")
        void shouldRespectSensitivity() {
            List<PricePoint> points = repeated(List.of(125.0, 75.0), 105, 7, 95, 7);

            assertTrue(MarketAnalytics.anomaliesOf(points, 3.0).isEmpty());
        }

        @Test
        @DisplayName("Constant prices and short windows yield nothing")
        void shouldHandleDegenerateInput() {
            assertTrue(MarketAnalytics.anomaliesOf(repeated(List.of(), 100, 12, 100, 0), 2.0).isEmpty());
            assertTrue(MarketAnalytics.anomaliesOf(series(100, 200, 100), 2.0).isEmpty());
        }
    }

    @Nested
    @DisplayName("Market health")
    class HealthTests {

        @Test
        @DisplayName("Penalties accumulate and anomalies are capped")
        void shouldScoreHealth() {
            VolatilityProfile veryHigh = VolatilityProfile.builder().classification(VolatilityClass.VERY_HIGH).build();
            TrendProfile downward = TrendProfile.builder().direction(TrendDirection.DOWNWARD).build();

            MarketHealth health = MarketAnalytics.healthOf(veryHigh, downward, 10);

            assertEquals(35.0, health.getScore());
            assertEquals(HealthStatus.POOR, health.getStatus());
        }

        @Test
        @DisplayName("Calm market is excellent")
        void shouldScoreExcellent() {
            VolatilityProfile low = VolatilityProfile.builder().classification(VolatilityClass.LOW).build();
            TrendProfile upward = TrendProfile.builder().direction(TrendDirection.UPWARD).build();

            MarketHealth health = MarketAnalytics.healthOf(low, upward, 1);

            assertEquals(95.0, health.getScore());
            assertEquals(HealthStatus.EXCELLENT, health.getStatus());
        }
    }
}
