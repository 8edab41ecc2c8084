package com.msp.forecast.forecast;

import com.msp.forecast.TestPrices;
import com.msp.forecast.series.DailyPrice;
import com.msp.forecast.series.SeriesKey;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for EnsembleForecaster over an in-memory artifact store.
 */
@DisplayName("EnsembleForecaster Tests")
class EnsembleForecasterTest {

    private static final LocalDate START = LocalDate.of(2023, 1, 1);
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-03-01T06:00:00Z"), ZoneOffset.UTC);
    private static final SeriesKey KEY = SeriesKey.of("Wheat", "Uttar Pradesh", null);

    private InMemoryArtifactStore artifactStore;
    private ModelRegistry registry;
    private EnsembleForecaster forecaster;

    @BeforeEach
    void setUp() {
        artifactStore = new InMemoryArtifactStore();
        registry = new ModelRegistry(artifactStore);
        forecaster = new EnsembleForecaster(registry, new ConfidenceEstimator(), CLOCK, true, 3);
    }

    private static List<DailyPrice> seasonalSeries(int days) {
        return TestPrices.dailyPrices(START, days,
                i -> 2000 + 200 * Math.sin(2 * Math.PI * i / 365.25) + (i % 3 - 1) * 5);
    }

    private static List<DailyPrice> linearSeries(int days, double base, double slope) {
        return TestPrices.dailyPrices(START, days, i -> base + slope * i);
    }

    @Nested
    @DisplayName("Training")
    class TrainingTests {

        @Test
        @DisplayName("Should reject fewer than 30 points")
        void shouldRejectShortSeries() {
            InsufficientDataException ex = assertThrows(InsufficientDataException.class,
                    () -> forecaster.train(linearSeries(29, 2000, 1), KEY));

            assertEquals(29, ex.getAvailable());
            assertEquals(30, ex.getRequired());
            assertFalse(forecaster.isTrained(KEY));
        }

        @Test
        @DisplayName("Should train on exactly 30 points and persist the model")
        void shouldTrainAtMinimum() {
            assertTrue(forecaster.train(linearSeries(30, 2000, 1), KEY));

            assertTrue(forecaster.isTrained(KEY));
            assertTrue(artifactStore.contains(KEY.asString()));
        }

        @Test
        @DisplayName("Failed persist keeps the previous model")
        void shouldKeepPriorModelOnFailure() {
            forecaster.train(linearSeries(60, 2000, 0), KEY);
            ForecastResult before = forecaster.predict(KEY, 3);

            artifactStore.failNextSave();
            assertThrows(ModelStoreException.class, () -> forecaster.train(linearSeries(60, 3000, 0), KEY));

            ForecastResult after = forecaster.predict(KEY, 3);
            assertEquals(before.getPoints(), after.getPoints());
            assertEquals(2000.0, after.getPoints().get(0).getPointEstimate());
        }

        @Test
        @DisplayName("Retraining on the same data gives the same forecast")
        void shouldBeIdempotent() {
            List<DailyPrice> series = seasonalSeries(200);

            forecaster.train(series, KEY);
            List<ForecastPoint> first = forecaster.predict(KEY, 7).getPoints();
            forecaster.train(series, KEY);
            List<ForecastPoint> second = forecaster.predict(KEY, 7).getPoints();

            assertEquals(first, second);
        }

        @Test
        @DisplayName("Keeps display names on the model")
        void shouldKeepDisplayNames() {
            forecaster.train(linearSeries(40, 2000, 1), SeriesKey.of(" Wheat", "Uttar Pradesh", "Agra"));

            TrainedModel model = registry.find(SeriesKey.of("wheat", "uttar pradesh", "agra")).orElseThrow();
            assertEquals("Wheat", model.getCommodity());
            assertEquals("Uttar Pradesh", model.getRegion());
            assertEquals("Agra", model.getMarket());
            assertEquals(40, model.dataPoints());
        }
    }

    @Nested
    @DisplayName("Prediction")
    class PredictionTests {

        @Test
        @DisplayName("Untrained key is unavailable")
        void shouldFailForUntrainedKey() {
            assertThrows(ModelUnavailableException.class, () -> forecaster.predict(KEY, 7));
        }

        @Test
        @DisplayName("Horizon below one is rejected")
        void shouldRejectInvalidHorizon() {
            forecaster.train(linearSeries(30, 2000, 1), KEY);

            assertThrows(IllegalArgumentException.class, () -> forecaster.predict(KEY, 0));
        }

        @Test
        @DisplayName("Returns one point per day after the last training date")
        void shouldProduceHorizonPoints() {
            List<DailyPrice> series = seasonalSeries(400);
            forecaster.train(series, KEY);

            ForecastResult result = forecaster.predict(KEY, 14);

            assertEquals(14, result.getPoints().size());
            LocalDate lastTraining = series.get(series.size() - 1).getDate();
            for (int i = 0; i < 14; i++) {
                assertEquals(lastTraining.plusDays(i + 1), result.getPoints().get(i).getDate());
            }
        }

        @Test
        @DisplayName("Weights sum to one and bounds enclose the estimate")
        void shouldBlendWithNormalizedWeights() {
            forecaster.train(seasonalSeries(400), KEY);

            ForecastResult result = forecaster.predict(KEY, 7);

            for (ForecastPoint point : result.getPoints()) {
                double sum = point.getWeights().values().stream().mapToDouble(Double::doubleValue).sum();
                assertEquals(1.0, sum, 1e-9);
                assertEquals(0.6, point.getWeights().get(SubModel.SEASONAL_TREND), 1e-9);
                assertTrue(point.getLowerBound() <= point.getPointEstimate());
                assertTrue(point.getUpperBound() >= point.getPointEstimate());
                assertTrue(point.getLowerBound() <= point.getPointEstimate() * 0.95 + 0.01);
            }
            assertTrue(result.getContributingModels().contains(SubModel.SEASONAL_TREND));
        }

        @Test
        @DisplayName("Point weights cannot be modified by callers")
        void shouldExposeReadOnlyWeights() {
            forecaster.train(linearSeries(30, 2000, 1), KEY);

            ForecastPoint point = forecaster.predict(KEY, 1).getPoints().get(0);

            assertThrows(UnsupportedOperationException.class,
                    () -> point.getWeights().put(SubModel.LINEAR_TREND, 1.0));
        }

        @Test
        @DisplayName("Without the seasonal member the blend is 0.75 / 0.25 with a 5% band")
        void shouldRenormalizeWithoutSeasonal() {
            EnsembleForecaster plain = new EnsembleForecaster(registry, new ConfidenceEstimator(), CLOCK, false, 3);
            plain.train(linearSeries(60, 2000, 0), KEY);

            ForecastResult result = plain.predict(KEY, 5);

            for (ForecastPoint point : result.getPoints()) {
                Map<SubModel, Double> weights = point.getWeights();
                assertFalse(point.contributes(SubModel.SEASONAL_TREND));
                assertEquals(0.75, weights.get(SubModel.LINEAR_TREND), 1e-9);
                assertEquals(0.25, weights.get(SubModel.MOVING_AVERAGE), 1e-9);
                assertEquals(2000.0, point.getPointEstimate());
                assertEquals(1900.0, point.getLowerBound());
                assertEquals(2100.0, point.getUpperBound());
            }
            assertEquals(ForecastTrend.STABLE, result.getTrend());
        }

        @Test
        @DisplayName("Steadily rising prices give a rising forecast")
        void shouldDetectRisingTrend() {
            forecaster.train(linearSeries(60, 2000, 5), KEY);

            ForecastResult result = forecaster.predict(KEY, 14);

            assertEquals(ForecastTrend.RISING, result.getTrend());
            assertTrue(result.getTrendPercent() > 1.0);
        }

        @Test
        @DisplayName("Confidence stays within 0-100")
        void shouldBoundConfidence() {
            forecaster.train(TestPrices.dailyPrices(START, 30, i -> i % 2 == 0 ? 1000 : 3000), KEY);

            int confidence = forecaster.predict(KEY, 7).getConfidence();

            assertTrue(confidence >= 0 && confidence <= 100);
        }

        @Test
        @DisplayName("Cache miss reloads the model from the store")
        void shouldReloadFromStore() {
            forecaster.train(seasonalSeries(120), KEY);
            List<ForecastPoint> before = forecaster.predict(KEY, 7).getPoints();

            registry.evict(KEY);
            int loadsBefore = artifactStore.loadCount();
            List<ForecastPoint> after = forecaster.predict(KEY, 7).getPoints();

            assertEquals(before, after);
            assertEquals(loadsBefore + 1, artifactStore.loadCount());
        }
    }
}
