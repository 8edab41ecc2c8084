package com.msp.forecast.forecast;

/**
 * Base of the forecasting failures callers are expected to handle.
 */
public class ForecastException extends RuntimeException {

    public ForecastException(String message) {
        super(message);
    }

    public ForecastException(String message, Throwable cause) {
        super(message, cause);
    }
}
