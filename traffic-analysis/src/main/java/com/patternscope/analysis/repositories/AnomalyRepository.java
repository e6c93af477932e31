package com.patternscope.analysis.repositories;


import com.patternscope.analysis.model.entities.AnomalyEntity;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.stream.Stream;

@Repository
public interface AnomalyRepository extends JpaRepository<AnomalyEntity, Long> {

    @Query("SELECT a FROM AnomalyEntity a WHERE a.detectedAt >= :start AND a.detectedAt <= :end ORDER BY a.detectedAt DESC")
    Stream<AnomalyEntity> findDetectedBetween(@Param("start") Instant start, @Param("end") Instant end, Pageable pageable);
}
