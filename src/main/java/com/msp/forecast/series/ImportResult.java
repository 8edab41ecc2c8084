package com.msp.forecast.series;

import lombok.Value;

/**
 * Row counts of one CSV import run.
 */
@Value
public class ImportResult {

    int imported;
    int skipped;
}
