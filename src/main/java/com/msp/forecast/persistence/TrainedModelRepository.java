package com.msp.forecast.persistence;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface TrainedModelRepository extends JpaRepository<TrainedModelEntity, String> {

    /**
     * Identity columns of every stored model, oldest training first.
     * Each row is {seriesKey, commodity, region, market}.
     */
    @Query("SELECT m.seriesKey, m.commodity, m.region, m.market FROM TrainedModelEntity m ORDER BY m.trainedAt ASC")
    List<Object[]> findAllIdentities();
}
