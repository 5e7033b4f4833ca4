package com.itinera.pojo.entity;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * 一次预算校验的结果；每轮重新计算，不做增量更新。
 */
@Getter
@ToString
@AllArgsConstructor
public class BudgetTracker {

    private final double totalEstimatedCost;

    private final boolean overBudget;
}
