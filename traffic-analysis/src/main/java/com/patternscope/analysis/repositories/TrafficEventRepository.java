package com.patternscope.analysis.repositories;


import com.patternscope.analysis.model.entities.TrafficEventEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;

@Repository
public interface TrafficEventRepository extends JpaRepository<TrafficEventEntity, Long> {

    List<TrafficEventEntity> findAllByOrderByTimestampAsc();

    List<TrafficEventEntity> findAllByTimestampGreaterThanEqualOrderByTimestampAsc(Instant start);

    List<TrafficEventEntity> findAllByTimestampLessThanEqualOrderByTimestampAsc(Instant end);

    List<TrafficEventEntity> findAllByTimestampBetweenOrderByTimestampAsc(Instant start, Instant end);

}
