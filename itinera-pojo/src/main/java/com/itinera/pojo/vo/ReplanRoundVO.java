package com.itinera.pojo.vo;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 一轮日程构建的预算校验记录。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ReplanRoundVO {

    private int round;

    private double totalEstimatedCost;

    private boolean overBudget;
}
