package com.patternscope.simulator.repository;

import com.patternscope.simulator.model.TrafficEventEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface TrafficEventRepository extends JpaRepository<TrafficEventEntity, Long> {
}
