package com.itinera.pojo.entity;

public enum TransportMode {
    WALKING,
    PUBLIC_TRANSPORT,
    TAXI
}
