package com.msp.forecast.forecast;

public class ModelStoreException extends ForecastException {

    public ModelStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
