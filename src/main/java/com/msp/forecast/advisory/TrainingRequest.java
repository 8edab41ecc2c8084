package com.msp.forecast.advisory;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One series to train. {@code market} is optional.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class TrainingRequest {

    private String commodity;
    private String region;
    private String market;
}
