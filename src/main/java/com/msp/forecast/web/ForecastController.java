package com.msp.forecast.web;

import com.msp.forecast.advisory.AdvisoryReport;
import com.msp.forecast.advisory.AdvisoryService;
import com.msp.forecast.advisory.BatchReport;
import com.msp.forecast.advisory.BatchTrainingService;
import com.msp.forecast.advisory.BulkRecommendationReport;
import com.msp.forecast.advisory.TrainingRequest;
import com.msp.forecast.forecast.ForecastResult;
import com.msp.forecast.forecast.ForecastService;
import com.msp.forecast.series.SeriesKey;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Training, prediction and sell advice endpoints.
 */
@RestController
@Validated
@RequiredArgsConstructor
public class ForecastController {

    private static final String REFERENCE_PARAM_PREFIX = "msp.";

    private final ForecastService forecastService;
    private final BatchTrainingService batchTrainingService;
    private final AdvisoryService advisoryService;

    @PostMapping("/train")
    public TrainResponse train(@RequestBody TrainingRequest request) {
        SeriesKey key = SeriesKey.of(request.getCommodity(), request.getRegion(), request.getMarket());
        forecastService.train(request.getCommodity(), request.getRegion(), request.getMarket());
        return TrainResponse.builder()
                .status("success")
                .seriesKey(key.asString())
                .message("Ensemble models trained for " + request.getCommodity() + " in " + request.getRegion())
                .market(key.coversAllMarkets() ? "All markets" : request.getMarket())
                .build();
    }

    @PostMapping("/train/batch")
    public BatchReport trainBatch(@RequestBody List<TrainingRequest> requests) {
        return batchTrainingService.trainAll(requests);
    }

    /**
     * @param autoTrain when true a missing model is trained from the stored history first
     */
    @GetMapping("/predict/{commodity}/{state}")
    public ForecastResult predict(@PathVariable String commodity,
                                  @PathVariable String state,
                                  @RequestParam(required = false) String market,
                                  @RequestParam(defaultValue = "${forecast.horizon.default-days:7}") @Min(1) @Max(14) int days,
                                  @RequestParam(defaultValue = "true") boolean autoTrain) {
        return autoTrain
                ? forecastService.predictOrTrain(commodity, state, market, days)
                : forecastService.predict(commodity, state, market, days);
    }

    @GetMapping("/recommend/{commodity}/{state}")
    public AdvisoryReport recommend(@PathVariable String commodity,
                                    @PathVariable String state,
                                    @RequestParam @DecimalMin(value = "0", inclusive = false) double currentPrice,
                                    @RequestParam(required = false) Double msp) {
        return advisoryService.recommend(commodity, state, currentPrice, msp);
    }

    /**
     * Reference prices are passed as {@code msp.<commodity>=<price>} query parameters.
     */
    @GetMapping("/recommendations/bulk/{state}")
    public BulkRecommendationReport bulkRecommendations(@PathVariable String state,
                                                        @RequestParam(required = false) List<String> commodities,
                                                        @RequestParam Map<String, String> params) {
        Map<String, Double> references = new LinkedHashMap<>();
        params.forEach((name, value) -> {
            if (name.startsWith(REFERENCE_PARAM_PREFIX)) {
                references.put(name.substring(REFERENCE_PARAM_PREFIX.length()), Double.parseDouble(value));
            }
        });
        return advisoryService.bulkRecommendations(state, commodities, references);
    }
}
