package com.itinera.pojo.entity;

public enum ActivityType {
    SIGHTSEEING,
    DINING,
    EVENT,
    ACCOMMODATION
}
