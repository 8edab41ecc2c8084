package com.msp.forecast.advisory;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BulkRecommendationItem {

    private String commodity;
    private boolean success;
    private String reason;

    /**
     * Set on success only.
     */
    private AdvisoryReport advisory;
}
