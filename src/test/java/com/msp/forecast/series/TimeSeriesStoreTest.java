package com.msp.forecast.series;

import com.msp.forecast.BaseIntegrationTest;
import com.msp.forecast.TestPrices;
import com.msp.forecast.persistence.PriceObservationRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Integration tests for TimeSeriesStore.
 */
@DisplayName("TimeSeriesStore Tests")
class TimeSeriesStoreTest extends BaseIntegrationTest {

    @Autowired
    private TimeSeriesStore store;

    @Autowired
    private PriceObservationRepository repository;

    private LocalDate today;

    @BeforeEach
    void setUp() {
        repository.deleteAll();
        today = store.today();

        List<PricePoint> points = new ArrayList<>();
        points.add(TestPrices.point("Wheat", "Uttar Pradesh", "Agra", today.minusDays(2), 2100));
        points.add(TestPrices.point("Wheat", "Uttar Pradesh", "Kanpur", today.minusDays(2), 2300));
        points.add(TestPrices.point("Wheat", "Uttar Pradesh", "Agra", today.minusDays(1), 2150));
        points.add(TestPrices.point("Wheat", "Punjab", "Khanna", today.minusDays(1), 2250));
        points.add(TestPrices.point("Wheat", "Uttar Pradesh", "Agra", today.minusDays(60), 1900));
        points.add(TestPrices.point("Rice", "Uttar Pradesh", "Agra", today.minusDays(1), 3100));
        store.ingest(points);
    }

    @Nested
    @DisplayName("Filtered queries")
    class QueryTests {

        @Test
        @DisplayName("Should filter case-insensitively and ignore surrounding whitespace")
        void shouldMatchCaseInsensitively() {
            List<PricePoint> result = store.query(" WHEAT ", "uttar pradesh", null, 30);

            assertEquals(3, result.size());
            assertTrue(result.stream().allMatch(p -> p.getRegion().equals("Uttar Pradesh")));
        }

        @Test
        @DisplayName("Names differing only in internal whitespace select the same rows")
        void shouldCollapseInternalWhitespace() {
            assertEquals(SeriesKey.of("Wheat", "Uttar Pradesh", null), SeriesKey.of("Wheat", "Uttar  Pradesh", null));

            List<PricePoint> result = store.query("Wheat", "Uttar  Pradesh", "Agra", 30);

            assertEquals(2, result.size());
            assertEquals(2, store.aggregateForModeling("Wheat", " uttar   pradesh ", null, 30).size());
            assertEquals(List.of("Agra", "Kanpur"), store.markets("Uttar  Pradesh"));
        }

        @Test
        @DisplayName("Should return observations ascending by date within the window")
        void shouldOrderByDateWithinWindow() {
            List<PricePoint> result = store.query("Wheat", "Uttar Pradesh", "Agra", 90);

            assertEquals(3, result.size());
            assertEquals(today.minusDays(60), result.get(0).getDate());
            assertEquals(today.minusDays(1), result.get(2).getDate());
        }

        @Test
        @DisplayName("Unknown commodity yields an empty list")
        void shouldReturnEmptyForUnknownCommodity() {
            assertTrue(store.query("Saffron", "Kashmir", null, 30).isEmpty());
            assertTrue(store.query("", null, null, 30).isEmpty());
        }

        @Test
        @DisplayName("Non-positive window is rejected")
        void shouldRejectNonPositiveWindow() {
            assertThrows(IllegalArgumentException.class, () -> store.query("Wheat", null, null, 0));
        }
    }

    @Nested
    @DisplayName("Aggregation")
    class AggregationTests {

        @Test
        @DisplayName("Should average modal prices across markets per date")
        void shouldAverageAcrossMarkets() {
            List<DailyPrice> series = store.aggregateForModeling("Wheat", "Uttar Pradesh", null, 30);

            assertEquals(2, series.size());
            assertEquals(today.minusDays(2), series.get(0).getDate());
            assertEquals(2200.0, series.get(0).getPrice(), 1e-9);
            assertEquals(2150.0, series.get(1).getPrice(), 1e-9);
        }

        @Test
        @DisplayName("Should keep one entry per distinct date")
        void shouldHaveUniqueDates() {
            List<DailyPrice> series = store.aggregateForModeling("Wheat", null, null);

            assertEquals(3, series.size());
            for (int i = 1; i < series.size(); i++) {
                assertTrue(series.get(i).getDate().isAfter(series.get(i - 1).getDate()));
            }
        }
    }

    @Nested
    @DisplayName("Catalog")
    class CatalogTests {

        @Test
        @DisplayName("Should list distinct commodities, regions and markets")
        void shouldListCatalog() {
            assertEquals(List.of("Rice", "Wheat"), store.commodities());
            assertEquals(List.of("Punjab", "Uttar Pradesh"), store.regions());
            assertEquals(List.of("Agra", "Kanpur"), store.markets("Uttar Pradesh"));
            assertEquals(List.of("Rice", "Wheat"), store.commodities("Uttar Pradesh"));
        }

        @Test
        @DisplayName("Latest prices treat market names differing in case or spacing as one market")
        void shouldMergeMarketSpellingsInLatestPrices() {
            store.ingest(List.of(TestPrices.point("Wheat", "Uttar Pradesh", " AGRA ", today, 2175)));

            List<PricePoint> latest = store.latestPrices("Wheat", "Uttar Pradesh", 10);

            assertEquals(2, latest.size());
            assertEquals(today, latest.get(0).getDate());
            assertEquals(2175.0, latest.get(0).modalValue(), 1e-9);
        }

        @Test
        @DisplayName("Latest prices keep the newest observation per market")
        void shouldReturnLatestPerMarket() {
            List<PricePoint> latest = store.latestPrices("Wheat", "Uttar Pradesh", 10);

            assertEquals(2, latest.size());
            assertEquals("Agra", latest.get(0).getMarket());
            assertEquals(today.minusDays(1), latest.get(0).getDate());
            assertEquals("Kanpur", latest.get(1).getMarket());
        }
    }
}
