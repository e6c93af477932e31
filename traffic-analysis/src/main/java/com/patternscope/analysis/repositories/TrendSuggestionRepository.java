package com.patternscope.analysis.repositories;


import com.patternscope.analysis.model.entities.TrendSuggestionEntity;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.stream.Stream;

@Repository
public interface TrendSuggestionRepository extends JpaRepository<TrendSuggestionEntity, Long> {

    @Query("SELECT s FROM TrendSuggestionEntity s WHERE s.createdAt >= :start AND s.createdAt <= :end ORDER BY s.createdAt DESC")
    Stream<TrendSuggestionEntity> findCreatedBetween(@Param("start") Instant start, @Param("end") Instant end, Pageable pageable);
}
