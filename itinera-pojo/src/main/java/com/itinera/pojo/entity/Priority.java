package com.itinera.pojo.entity;

/**
 * 地点对整趟行程的重要程度。
 */
public enum Priority {
    ESSENTIAL,
    HIGH,
    MEDIUM,
    LOW
}
