package com.eainde.forecast.model;

public enum CitationType {
    METRIC,
    THEME,
    GAP,
    ANOMALY
}
