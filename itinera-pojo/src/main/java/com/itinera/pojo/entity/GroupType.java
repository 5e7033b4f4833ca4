package com.itinera.pojo.entity;

/**
 * 出行人群类型。
 */
public enum GroupType {
    SOLO,
    COUPLE,
    FRIENDS,
    GROUP
}
