package com.msp.forecast.forecast;

import java.util.Optional;

/**
 * Durable storage of trained models, addressed by normalized series key.
 */
public interface ModelArtifactStore {

    /**
     * @return empty when no usable artifact exists for the key
     * @throws ModelStoreException when the store cannot be read
     */
    Optional<TrainedModel> load(String seriesKey);

    /**
     * Replaces any artifact stored under the key.
     *
     * @throws ModelStoreException when the artifact cannot be written
     */
    void save(String seriesKey, TrainedModel model);
}
