package com.itinera.pojo.entity;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;
import lombok.extern.jackson.Jacksonized;

/**
 * 同一天内两个相邻活动之间的交通段（有方向）。
 */
@Getter
@ToString
@Builder
@Jacksonized
public class TravelSegment {

    private final String fromActivityId;

    private final String toActivityId;

    private final TransportMode transportMode;

    private final int durationMinutes;

    private final double cost;

    /**
     * 给用户看的出行说明，例如 "Walk 350m to Louvre (5 mins)"。
     */
    private final String instructions;
}
