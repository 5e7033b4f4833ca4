package com.itinera.pojo.vo;

import com.itinera.pojo.entity.TripItinerary;
import lombok.Data;

import java.util.List;

/**
 * 行程规划返回结果 VO。
 * Response for itinerary planning.
 *
 * 包含：
 * - 最终行程；
 * - 每一轮构建的预算校验记录；
 * - 一段给调用方看的执行摘要。
 */
@Data
public class ItineraryPlanVO {

    private TripItinerary itinerary;

    private List<ReplanRoundVO> rounds;

    private String report;
}
