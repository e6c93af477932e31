package com.patternscope.analysis.model.entities;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;

@Getter
@Setter
@Entity
@Table(name = "traffic_events", schema = "public")
public class TrafficEventEntity {

    @Id
    @Column(name = "id", nullable = false)
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "timestamp", nullable = false)
    private Instant timestamp;

    @Column(name = "location_id", nullable = false)
    private Integer locationId;

    @Column(name = "vehicle_count")
    private Integer vehicleCount;

    @Column(name = "avg_speed")
    private Double avgSpeed;

    @Column(name = "min_speed")
    private Double minSpeed;

    @Column(name = "max_speed")
    private Double maxSpeed;

    @Column(name = "traffic_density_score")
    private Double trafficDensityScore;

}
