package com.msp.forecast.persistence;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * Persisted forecasting model artifact, one row per normalized series key.
 * The row is overwritten in a single update on every retrain.
 */
@Entity
@Table(name = "trained_model", indexes = {
    @Index(name = "idx_model_trained_at", columnList = "trained_at")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TrainedModelEntity {

    @Id
    @Column(name = "series_key", length = 255)
    private String seriesKey;

    @Column(name = "commodity", nullable = false, length = 100)
    private String commodity;

    @Column(name = "region", nullable = false, length = 100)
    private String region;

    /**
     * Null when the model covers all markets of the region.
     */
    @Column(name = "market", length = 150)
    private String market;

    @Column(name = "schema_version", nullable = false)
    private int schemaVersion;

    /**
     * JSON document holding sub-model parameters and the training snapshot.
     */
    @Column(name = "payload", nullable = false, columnDefinition = "TEXT")
    private String payload;

    @Column(name = "training_start", nullable = false)
    private LocalDate trainingStart;

    @Column(name = "training_end", nullable = false)
    private LocalDate trainingEnd;

    @Column(name = "data_points")
    private int dataPoints;

    @Column(name = "trained_at", nullable = false)
    private LocalDateTime trainedAt;
}
