package com.itinera.pojo.entity;

/**
 * 地点变体标签，同时作为 JSON 中的类型字段 "kind"。
 * 所有按变体分派的逻辑都通过对该枚举的 switch 表达式完成，新增变体时编译器会提示遗漏的分支。
 */
public enum PlaceKind {
    LANDMARK,
    ESTABLISHMENT,
    EVENT,
    ACCOMMODATION
}
