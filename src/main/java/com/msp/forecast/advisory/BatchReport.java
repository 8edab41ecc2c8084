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
public class BatchReport {

    private int requested;
    private int succeeded;
    private int failed;
    private long durationMs;
    private List<BatchOutcome> outcomes;

    public static BatchReport of(List<BatchOutcome> outcomes, long durationMs) {
        int ok = (int) outcomes.stream().filter(BatchOutcome::isSuccess).count();
        return BatchReport.builder()
                .requested(outcomes.size())
                .succeeded(ok)
                .failed(outcomes.size() - ok)
                .durationMs(durationMs)
                .outcomes(outcomes)
                .build();
    }
}
