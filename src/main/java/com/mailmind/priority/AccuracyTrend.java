package com.mailmind.priority;

/**
 * Direction of accuracy between the first and second half of a window.
 */
public enum AccuracyTrend {
    IMPROVING,
    STABLE,
    DECLINING,
    INSUFFICIENT_DATA
}
