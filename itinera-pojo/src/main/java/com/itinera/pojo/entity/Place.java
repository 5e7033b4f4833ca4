package com.itinera.pojo.entity;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;
import lombok.experimental.SuperBuilder;

import java.util.Collections;
import java.util.Locale;
import java.util.Map;

/**
 * 候选地点（景点 / 餐饮 / 活动 / 住宿）的公共部分。
 * <p>由上游地点发现阶段产出，之后只读；构建引擎从不修改 Place。</p>
 */
@Getter
@ToString
@SuperBuilder
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.EXISTING_PROPERTY, property = "kind")
@JsonSubTypes({
        @JsonSubTypes.Type(value = Landmark.class, name = "LANDMARK"),
        @JsonSubTypes.Type(value = Establishment.class, name = "ESTABLISHMENT"),
        @JsonSubTypes.Type(value = Event.class, name = "EVENT"),
        @JsonSubTypes.Type(value = Accommodation.class, name = "ACCOMMODATION")
})
public abstract class Place {

    /**
     * 在一次构建过程中唯一且稳定的 ID。
     */
    private final String id;

    private final String name;

    /**
     * 可能为空（例如地理编码失败的住宿）。
     */
    private final Coordinates coordinates;

    private final Priority priority;

    /**
     * 简短的推荐理由。
     * A short reason why one should go to this place.
     */
    private final String reasonToGo;

    private final String website;

    @Builder.Default
    private final BookingType bookingType = BookingType.NONE;

    /**
     * 通常停留时长（小时），0 表示未知。
     */
    private final double typicalHoursOfStay;

    private final boolean weatherDependent;

    /**
     * 营业时间，key 为日期范围（如 "Daily"、"Weekends"），value 为时间范围（如 "09:00-15:00"）。
     * 空表示全天开放。
     */
    @Builder.Default
    private final Map<String, String> openingSchedule = Collections.emptyMap();

    public abstract PlaceKind getKind();

    @JsonIgnore
    public boolean isBookingRequired() {
        return bookingType == BookingType.REQUIRED;
    }

    /**
     * 用于关键词匹配的小写文本："{name} {reasonToGo}"。
     */
    @JsonIgnore
    public String getSearchText() {
        String n = name == null ? "" : name;
        String r = reasonToGo == null ? "" : reasonToGo;
        return (n + " " + r).toLowerCase(Locale.ROOT);
    }
}
