package com.msp.forecast.advisory;

import com.msp.forecast.analysis.VolatilityClass;
import com.msp.forecast.forecast.ForecastPoint;
import com.msp.forecast.forecast.ForecastTrend;
import com.msp.forecast.recommendation.Recommendation;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AdvisoryReport {

    private String commodity;
    private String region;
    private double currentPrice;
    private Double referencePrice;

    private Recommendation recommendation;
    private VolatilityClass volatility;
    private ForecastTrend forecastTrend;
    private int forecastConfidence;

    // first few forecast days only
    private List<ForecastPoint> forecast;
}
