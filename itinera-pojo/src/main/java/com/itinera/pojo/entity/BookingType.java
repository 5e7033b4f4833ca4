package com.itinera.pojo.entity;

/**
 * REQUIRED 必须预订，RECOMMENDED 建议预订，NONE 无需预订。
 */
public enum BookingType {
    REQUIRED,
    RECOMMENDED,
    NONE
}
