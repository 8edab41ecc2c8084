package com.msp.forecast.web;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class TrainResponse {

    String status;
    String seriesKey;
    String message;
    String market;
}
