package com.msp.forecast.forecast;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.msp.forecast.persistence.TrainedModelEntity;
import com.msp.forecast.persistence.TrainedModelRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;

/**
 * Stores each {@link TrainedModel} as a JSON document in the {@code trained_model} table.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class JpaModelArtifactStore implements ModelArtifactStore {

    private final TrainedModelRepository repository;
    private final ObjectMapper objectMapper;

    @Override
    @Transactional(readOnly = true)
    public Optional<TrainedModel> load(String seriesKey) {
        Optional<TrainedModelEntity> row;
        try {
            row = repository.findById(seriesKey);
        } catch (DataAccessException e) {
            throw new ModelStoreException("Failed to read model " + seriesKey, e);
        }
        return row.flatMap(this::decode);
    }

    @Override
    @Transactional
    public void save(String seriesKey, TrainedModel model) {
        String payload;
        try {
            payload = objectMapper.writeValueAsString(model);
        } catch (JsonProcessingException e) {
            throw new ModelStoreException("Failed to serialize model " + seriesKey, e);
        }

        try {
            TrainedModelEntity entity = repository.findById(seriesKey)
                    .orElseGet(() -> TrainedModelEntity.builder().seriesKey(seriesKey).build());
            entity.setCommodity(model.getCommodity());
            entity.setRegion(model.getRegion());
            entity.setMarket(model.getMarket());
            entity.setSchemaVersion(model.getSchemaVersion());
            entity.setPayload(payload);
            entity.setTrainingStart(model.getTrainingStart());
            entity.setTrainingEnd(model.getTrainingEnd());
            entity.setDataPoints(model.dataPoints());
            entity.setTrainedAt(model.getTrainedAt());
            repository.save(entity);
        } catch (DataAccessException e) {
            throw new ModelStoreException("Failed to save model " + seriesKey, e);
        }
        log.debug("Stored model {} ({} bytes)", seriesKey, payload.length());
    }

    private Optional<TrainedModel> decode(TrainedModelEntity entity) {
        if (entity.getSchemaVersion() != TrainedModel.SCHEMA_VERSION) {
            log.warn("Ignoring stored model {}: schema version {} (current {})",
                    entity.getSeriesKey(), entity.getSchemaVersion(), TrainedModel.SCHEMA_VERSION);
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readValue(entity.getPayload(), TrainedModel.class));
        } catch (JsonProcessingException e) {
            throw new ModelStoreException("Corrupt model payload for " + entity.getSeriesKey(), e);
        }
    }
}
