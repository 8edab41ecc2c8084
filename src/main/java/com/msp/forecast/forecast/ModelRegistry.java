package com.msp.forecast.forecast;

import com.google.common.util.concurrent.Striped;
import com.msp.forecast.series.SeriesKey;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.Lock;
import java.util.function.Supplier;

/**
 * In-memory registry of trained models backed by a {@link ModelArtifactStore}.
 *
 * Readers never block: they see either the previous or the new immutable model.
 * Training of one key is serialized through a striped lock; distinct keys train in parallel.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class ModelRegistry {

    private static final int LOCK_STRIPES = 64;

    private final ModelArtifactStore artifactStore;

    private final ConcurrentMap<SeriesKey, TrainedModel> models = new ConcurrentHashMap<>();
    private final Striped<Lock> trainingLocks = Striped.lazyWeakLock(LOCK_STRIPES);

    /**
     * Cached model for the key, loading it from the backing store on a miss.
     */
    public Optional<TrainedModel> find(SeriesKey key) {
        TrainedModel cached = models.get(key);
        if (cached != null) {
            return Optional.of(cached);
        }
        Optional<TrainedModel> stored = artifactStore.load(key.asString());
        stored.ifPresent(model -> {
            log.info("Loaded model {} from store (trained {})", key, model.getTrainedAt());
            // a concurrent train may have published a newer model meanwhile
            models.putIfAbsent(key, model);
        });
        return stored.map(model -> models.getOrDefault(key, model));
    }

    /**
     * Runs {@code action} holding the training lock of the key.
     */
    public <T> T exclusively(SeriesKey key, Supplier<T> action) {
        Lock lock = trainingLocks.get(key);
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Saves the model to the backing store, then makes it visible to readers.
     * If the save fails the previously published model stays in place.
     */
    public void publish(SeriesKey key, TrainedModel model) {
        artifactStore.save(key.asString(), model);
        models.put(key, model);
    }

    /**
     * Drops the in-memory copy; the stored artifact is kept.
     */
    public void evict(SeriesKey key) {
        models.remove(key);
    }

    public int cachedCount() {
        return models.size();
    }
}
