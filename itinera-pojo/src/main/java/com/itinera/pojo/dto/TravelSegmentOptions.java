package com.itinera.pojo.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 计算交通段花费所用的票价参数。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class TravelSegmentOptions {

    public static final String JSON_SHAPE = "{\"averagePublicTransportFare\":2.5,\"baseTaxiFare\":1.5}";

    /**
     * 公共交通平均票价。
     */
    private double averagePublicTransportFare = 2.5;

    /**
     * 出租车起步价。
     */
    private double baseTaxiFare = 1.5;
}
