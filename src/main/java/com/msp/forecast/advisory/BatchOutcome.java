package com.msp.forecast.advisory;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BatchOutcome {

    private String seriesKey;
    private boolean success;

    /**
     * Failure cause; null on success.
     */
    private String reason;

    public static BatchOutcome succeeded(String seriesKey) {
        return new BatchOutcome(seriesKey, true, null);
    }

    public static BatchOutcome failed(String seriesKey, String reason) {
        return new BatchOutcome(seriesKey, false, reason);
    }
}
