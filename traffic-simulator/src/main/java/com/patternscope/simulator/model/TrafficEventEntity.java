package com.patternscope.simulator.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.Map;

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

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "color_counts")
    private Map<String, Integer> colorCounts;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "inter_arrival_stats")
    private Map<String, Double> interArrivalStats;

    @Column(name = "traffic_density_score")
    private Double trafficDensityScore;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "raw_features")
    private Map<String, String> rawFeatures;

}
