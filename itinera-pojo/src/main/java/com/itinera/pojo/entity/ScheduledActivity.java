package com.itinera.pojo.entity;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;
import lombok.extern.jackson.Jacksonized;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.Collections;
import java.util.List;

/**
 * 行程中的一项具体活动，带有确定的开始 / 结束时间。
 * <p>不可变；路线优化重新计算时间时通过 {@link #withTimes} 产生新实例。</p>
 */
@Getter
@ToString
@Builder(toBuilder = true)
@Jacksonized
public class ScheduledActivity {

    private final String id;

    /**
     * 来源地点 ID，对应本次构建工作集中的某个 Place。
     */
    private final String placeId;

    private final ActivityType activityType;

    private final String name;

    private final String description;

    private final LocalDateTime startTime;

    private final LocalDateTime endTime;

    private final double estimatedCost;

    /**
     * 可能为空，没有坐标的活动不参与路线优化，也不产生交通段。
     */
    private final Coordinates coordinates;

    private final boolean bookingRequired;

    private final String bookingUrl;

    @Builder.Default
    private final List<String> notes = Collections.emptyList();

    public ScheduledActivity withTimes(LocalDateTime start, LocalDateTime end) {
        return toBuilder().startTime(start).endTime(end).build();
    }

    public Duration duration() {
        return Duration.between(startTime, endTime);
    }

    public boolean hasCoordinates() {
        return coordinates != null;
    }
}
