package com.msp.forecast.advisory;

import com.msp.forecast.forecast.ForecastException;
import com.msp.forecast.forecast.ForecastService;
import com.msp.forecast.persistence.TrainedModelRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Trains several series in one call. Every request yields exactly one outcome; a
 * failing series is reported and does not stop the others.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class BatchTrainingService {

    private final ForecastService forecastService;
    private final TrainedModelRepository trainedModelRepository;

    public BatchReport trainAll(List<TrainingRequest> requests) {
        long start = System.currentTimeMillis();
        List<BatchOutcome> outcomes = new ArrayList<>(requests.size());

        for (TrainingRequest request : requests) {
            String label = label(request);
            try {
                forecastService.train(request.getCommodity(), request.getRegion(), request.getMarket());
                outcomes.add(BatchOutcome.succeeded(label));
            } catch (ForecastException | IllegalArgumentException e) {
                log.warn("Training failed for {}: {}", label, e.getMessage());
                outcomes.add(BatchOutcome.failed(label, e.getMessage()));
            }
        }

        BatchReport report = BatchReport.of(outcomes, System.currentTimeMillis() - start);
        log.info("Batch training finished: {}/{} succeeded in {} ms",
                report.getSucceeded(), report.getRequested(), report.getDurationMs());
        return report;
    }

    /**
     * Re-trains every model present in the backing store on the current price history.
     */
    public BatchReport retrainAll() {
        List<TrainingRequest> requests = new ArrayList<>();
        for (Object[] row : trainedModelRepository.findAllIdentities()) {
            requests.add(new TrainingRequest((String) row[1], (String) row[2], (String) row[3]));
        }
        log.info("Retraining {} stored models", requests.size());
        return trainAll(requests);
    }

    private static String label(TrainingRequest request) {
        String market = request.getMarket() == null || request.getMarket().isBlank() ? "all" : request.getMarket();
        return request.getCommodity() + "/" + request.getRegion() + "/" + market;
    }
}
