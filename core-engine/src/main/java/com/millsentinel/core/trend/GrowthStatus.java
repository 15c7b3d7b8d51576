package com.millsentinel.core.trend;

/**
 * Why a month does or does not carry a growth value.
 *
 * @since 1.0.0
 */
public enum GrowthStatus {

    /** Growth computed against the preceding month. */
    DEFINED,

    /** Earliest month in the data; nothing to compare against. */
    NO_PREVIOUS,

    /** The preceding month's value is exactly zero. */
    ZERO_BASE,

    /** The metric is undefined for this month or the preceding one. */
    UNDEFINED_VALUE
}
