package com.msp.forecast.advisory;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BulkRecommendationReport {

    private String region;
    private int succeeded;
    private int failed;
    private List<BulkRecommendationItem> items;
}
