package com.itinera.pojo.entity;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;
import lombok.extern.jackson.Jacksonized;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

/**
 * 最终行程，构建成功后一次性创建，之后不再修改。
 * The finalized itinerary for the entire trip.
 */
@Getter
@ToString
@Builder
@Jacksonized
public class TripItinerary {

    private final String destination;

    private final LocalDate startDate;

    private final LocalDate endDate;

    private final int totalDays;

    private final List<DayItinerary> dailyItineraries;

    private final Accommodation accommodation;

    private final double totalEstimatedCost;

    /**
     * 分类花费：accommodation / dining / attractions / transportation / events / total。
     */
    private final Map<String, Double> budgetBreakdown;

    /**
     * false 表示重排轮数耗尽后按兜底策略采用了仍超预算的版本。
     */
    private final boolean withinBudget;

    /**
     * 实际执行的构建轮数（含首轮）。
     */
    private final int replanRounds;
}
