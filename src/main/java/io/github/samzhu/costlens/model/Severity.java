package io.github.samzhu.costlens.model;

/**
 * 異常嚴重度，只由變化幅度決定。
 */
public enum Severity {
    MODERATE,
    HIGH,
    CRITICAL
}
