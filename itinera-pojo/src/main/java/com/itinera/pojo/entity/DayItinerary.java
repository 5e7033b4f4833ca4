package com.itinera.pojo.entity;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;
import lombok.extern.jackson.Jacksonized;

import java.time.LocalDate;
import java.util.Collections;
import java.util.List;

/**
 * 一天的行程。
 * One day of the trip.
 */
@Getter
@ToString
@Builder(toBuilder = true)
@Jacksonized
public class DayItinerary {

    private final LocalDate date;

    /**
     * 第几天，从 1 开始。
     */
    private final int dayNumber;

    private final String theme;

    /**
     * 按开始时间升序。
     */
    @Builder.Default
    private final List<ScheduledActivity> activities = Collections.emptyList();

    @Builder.Default
    private final List<TravelSegment> travelSegments = Collections.emptyList();

    /**
     * 活动花费 + 交通花费。
     */
    private final double totalEstimatedCost;

    /**
     * 当天前 3 个观光类活动的名称。
     */
    @Builder.Default
    private final List<String> keyHighlights = Collections.emptyList();

    private final String weatherNote;
}
