package com.patternscope.simulator.service;

/**
 * Baseline distributions for one part of the day.
 */
enum TrafficProfile {

    RUSH_HOUR(40, 100, 25, 8, 0.7, 1.0),
    NIGHT(5, 20, 50, 10, 0.1, 0.3),
    NORMAL(20, 60, 40, 12, 0.4, 0.7);

    final int minVehicles;
    final int maxVehicles;
    final double speedMean;
    final double speedStd;
    final double minDensity;
    final double maxDensity;

    TrafficProfile(int minVehicles, int maxVehicles, double speedMean, double speedStd,
                   double minDensity, double maxDensity) {
        this.minVehicles = minVehicles;
        this.maxVehicles = maxVehicles;
        this.speedMean = speedMean;
        this.speedStd = speedStd;
        this.minDensity = minDensity;
        this.maxDensity = maxDensity;
    }

    static TrafficProfile forHour(int hour) {
        if ((hour >= 7 && hour <= 9) || (hour >= 17 && hour <= 19)) {
            return RUSH_HOUR;
        }
        if (hour >= 22 || hour <= 5) {
            return NIGHT;
        }
        return NORMAL;
    }
}
