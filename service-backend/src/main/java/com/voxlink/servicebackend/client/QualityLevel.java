package com.voxlink.servicebackend.client;

public enum QualityLevel {
    EXCELLENT,
    GOOD,
    FAIR,
    POOR;

    public static QualityLevel of(double score) {
        if (score >= 75) {
            return EXCELLENT;
        }
        if (score >= 50) {
            return GOOD;
        }
        if (score >= 30) {
            return FAIR;
        }
        return POOR;
    }
}
