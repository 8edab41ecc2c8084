package com.msp.forecast.series;

import com.msp.forecast.persistence.PriceObservationEntity;
import com.msp.forecast.persistence.PriceObservationRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Read side of the historical price observations.
 *
 * All filters match case-insensitively on trimmed names with internal whitespace collapsed,
 * the same way {@link SeriesKey} normalizes them. A filter that matches nothing
 * yields an empty list, never an exception.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class TimeSeriesStore {

    public static final int MODELING_WINDOW_DAYS = 365;

    private final PriceObservationRepository repository;
    private final Clock clock;

    /**
     * Observations of a commodity within the last {@code windowDays}, ascending by date.
     *
     * @param region optional state filter
     * @param market optional market filter
     */
    @Transactional(readOnly = true)
    public List<PricePoint> query(String commodity, String region, String market, int windowDays) {
        if (commodity == null || commodity.isBlank()) {
            return List.of();
        }
        LocalDate cutoff = cutoff(windowDays);

        List<PricePoint> result = repository
                .findByCommodityIgnoreCaseAndPriceDateGreaterThanEqualOrderByPriceDateAsc(collapseWhitespace(commodity), cutoff)
                .stream()
                .filter(e -> matches(e.getCommodity(), commodity))
                .filter(e -> matches(e.getRegion(), region))
                .filter(e -> matches(e.getMarket(), market))
                .map(TimeSeriesStore::toPricePoint)
                .sorted(Comparator.comparing(PricePoint::getDate))
                .collect(Collectors.toList());

        log.debug("Query {}/{}/{} over {} days: {} observations", commodity, region, market, windowDays, result.size());
        return result;
    }

    /**
     * Daily modeling series: one entry per date holding the mean modal price across the
     * matching markets, ascending by date.
     */
    @Transactional(readOnly = true)
    public List<DailyPrice> aggregateForModeling(String commodity, String region, String market, int windowDays) {
        return aggregateByDate(query(commodity, region, market, windowDays));
    }

    public List<DailyPrice> aggregateForModeling(String commodity, String region, String market) {
        return aggregateForModeling(commodity, region, market, MODELING_WINDOW_DAYS);
    }

    /**
     * Latest observation per market, newest first.
     */
    @Transactional(readOnly = true)
    public List<PricePoint> latestPrices(String commodity, String region, int limit) {
        if (commodity == null || commodity.isBlank()) {
            return List.of();
        }
        Map<String, PricePoint> latestByMarket = new LinkedHashMap<>();
        for (PriceObservationEntity entity : repository.findByCommodityIgnoreCaseOrderByPriceDateAsc(collapseWhitespace(commodity))) {
            if (matches(entity.getRegion(), region)) {
                // ascending order, so later rows overwrite earlier ones
                latestByMarket.put(SeriesKey.normalize(entity.getMarket()), toPricePoint(entity));
            }
        }
        return latestByMarket.values().stream()
                .sorted(Comparator.comparing(PricePoint::getDate).reversed())
                .limit(limit)
                .collect(Collectors.toList());
    }

    /**
     * Every observation of a region within the window, across commodities, ascending by date.
     */
    @Transactional(readOnly = true)
    public List<PricePoint> queryRegion(String region, int windowDays) {
        if (region == null || region.isBlank()) {
            return List.of();
        }
        return repository.findRegionSince(collapseWhitespace(region), cutoff(windowDays)).stream()
                .map(TimeSeriesStore::toPricePoint)
                .collect(Collectors.toList());
    }

    @Transactional
    public int ingest(List<PricePoint> points) {
        List<PriceObservationEntity> entities = new ArrayList<>(points.size());
        for (PricePoint point : points) {
            entities.add(toEntity(point));
        }
        repository.saveAll(entities);
        log.debug("Ingested {} price observations", entities.size());
        return entities.size();
    }

    public List<String> commodities() {
        return repository.findDistinctCommodities();
    }

    public List<String> regions() {
        return repository.findDistinctRegions();
    }

    public List<String> markets(String region) {
        return repository.findDistinctMarketsByRegion(collapseWhitespace(region));
    }

    public List<String> commodities(String region) {
        return repository.findDistinctCommoditiesByRegion(collapseWhitespace(region));
    }

    public long size() {
        return repository.count();
    }

    public LocalDate today() {
        return LocalDate.now(clock);
    }

    static List<DailyPrice> aggregateByDate(List<PricePoint> points) {
        Map<LocalDate, double[]> sums = new TreeMap<>();
        for (PricePoint point : points) {
            double[] acc = sums.computeIfAbsent(point.getDate(), d -> new double[2]);
            acc[0] += point.modalValue();
            acc[1]++;
        }
        List<DailyPrice> series = new ArrayList<>(sums.size());
        sums.forEach((date, acc) -> series.add(DailyPrice.of(date, acc[0] / acc[1])));
        return series;
    }

    private LocalDate cutoff(int windowDays) {
        if (windowDays <= 0) {
            throw new IllegalArgumentException("windowDays must be positive: " + windowDays);
        }
        return today().minusDays(windowDays);
    }

    private static boolean matches(String value, String filter) {
        if (filter == null || filter.isBlank()) {
            return true;
        }
        return value != null && SeriesKey.normalize(value).equals(SeriesKey.normalize(filter));
    }

    private static String collapseWhitespace(String value) {
        return value.trim().replaceAll("\\s+", " ");
    }

    private static PricePoint toPricePoint(PriceObservationEntity entity) {
        return PricePoint.builder()
                .commodity(entity.getCommodity())
                .region(entity.getRegion())
                .district(entity.getDistrict())
                .market(entity.getMarket())
                .variety(entity.getVariety())
                .grade(entity.getGrade())
                .date(entity.getPriceDate())
                .minPrice(entity.getMinPrice())
                .maxPrice(entity.getMaxPrice())
                .modalPrice(entity.getModalPrice())
                .build();
    }

    private static PriceObservationEntity toEntity(PricePoint point) {
        return PriceObservationEntity.builder()
                .commodity(point.getCommodity())
                .region(point.getRegion())
                .district(point.getDistrict())
                .market(point.getMarket())
                .variety(point.getVariety())
                .grade(point.getGrade())
                .priceDate(point.getDate())
                .minPrice(point.getMinPrice())
                .maxPrice(point.getMaxPrice())
                .modalPrice(point.getModalPrice())
                .build();
    }
}
