package com.msp.forecast.persistence;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * One dated mandi price observation. Rows are never updated after ingestion.
 */
@Entity
@Table(name = "price_observation", indexes = {
    @Index(name = "idx_price_commodity_date", columnList = "commodity, price_date"),
    @Index(name = "idx_price_region", columnList = "region")
})
@Getter
@Builder
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
public class PriceObservationEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "commodity", nullable = false, length = 100)
    private String commodity;

    /**
     * State the market belongs to.
     */
    @Column(name = "region", nullable = false, length = 100)
    private String region;

    @Column(name = "district", length = 100)
    private String district;

    @Column(name = "market", nullable = false, length = 150)
    private String market;

    @Column(name = "variety", length = 100)
    private String variety;

    @Column(name = "grade", length = 50)
    private String grade;

    @Column(name = "price_date", nullable = false)
    private LocalDate priceDate;

    @Column(name = "min_price", precision = 12, scale = 2)
    private BigDecimal minPrice;

    @Column(name = "max_price", precision = 12, scale = 2)
    private BigDecimal maxPrice;

    @Column(name = "modal_price", nullable = false, precision = 12, scale = 2)
    private BigDecimal modalPrice;
}
