package com.msp.forecast.scheduler;

import com.msp.forecast.advisory.BatchReport;
import com.msp.forecast.advisory.BatchTrainingService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Nightly retrain of every stored model so forecasts follow newly imported prices.
 * Disabled with {@code forecast.retrain.cron=-}.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class ModelRetrainScheduler {

    private final BatchTrainingService batchTrainingService;

    @Scheduled(cron = "${forecast.retrain.cron:-}")
    public void retrainModels() {
        log.debug("Model retrain triggered");

        try {
            BatchReport report = batchTrainingService.retrainAll();
            if (report.getFailed() > 0) {
                log.warn("Scheduled retrain: {} of {} models failed", report.getFailed(), report.getRequested());
            }
        } catch (Exception e) {
            log.error("Error during scheduled retrain: {}", e.getMessage(), e);
        }
    }
}
