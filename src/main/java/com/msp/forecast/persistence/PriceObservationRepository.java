package com.msp.forecast.persistence;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.List;

@Repository
public interface PriceObservationRepository extends JpaRepository<PriceObservationEntity, Long> {

    /**
     * All observations of a commodity on or after the cutoff, oldest first.
     */
    List<PriceObservationEntity> findByCommodityIgnoreCaseAndPriceDateGreaterThanEqualOrderByPriceDateAsc(
            String commodity, LocalDate cutoff);

    /**
     * All observations of a commodity regardless of date, oldest first.
     */
    List<PriceObservationEntity> findByCommodityIgnoreCaseOrderByPriceDateAsc(String commodity);

    /**
     * Observations of a region on or after the cutoff, across commodities.
     */
    @Query("SELECT p FROM PriceObservationEntity p WHERE LOWER(p.region) = LOWER(:region) " +
           "AND p.priceDate >= :cutoff ORDER BY p.priceDate ASC")
    List<PriceObservationEntity> findRegionSince(@Param("region") String region,
                                                 @Param("cutoff") LocalDate cutoff);

    @Query("SELECT DISTINCT p.commodity FROM PriceObservationEntity p ORDER BY p.commodity")
    List<String> findDistinctCommodities();

    @Query("SELECT DISTINCT p.region FROM PriceObservationEntity p ORDER BY p.region")
    List<String> findDistinctRegions();

    @Query("SELECT DISTINCT p.market FROM PriceObservationEntity p " +
           "WHERE LOWER(p.region) = LOWER(:region) ORDER BY p.market")
    List<String> findDistinctMarketsByRegion(@Param("region") String region);

    @Query("SELECT DISTINCT p.commodity FROM PriceObservationEntity p " +
           "WHERE LOWER(p.region) = LOWER(:region) ORDER BY p.commodity")
    List<String> findDistinctCommoditiesByRegion(@Param("region") String region);
}
