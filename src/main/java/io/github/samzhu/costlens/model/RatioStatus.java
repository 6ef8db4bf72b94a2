package io.github.samzhu.costlens.model;

/**
 * 比例健康狀態。
 */
public enum RatioStatus {
    HEALTHY,
    WARNING,
    ALERT
}
