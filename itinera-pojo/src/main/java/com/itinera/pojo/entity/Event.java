package com.itinera.pojo.entity;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;
import lombok.experimental.SuperBuilder;
import lombok.extern.jackson.Jacksonized;

import java.time.LocalDateTime;
import java.util.Collections;
import java.util.List;

/**
 * 固定时间举行的活动（演出、展会、比赛等）。
 */
@Getter
@ToString(callSuper = true)
@SuperBuilder
@Jacksonized
public class Event extends Place {

    private final LocalDateTime dateAndTime;

    /**
     * 可选票价（人均），取最低者作为花费。
     */
    @Builder.Default
    private final List<Double> priceOptions = Collections.emptyList();

    @Override
    public PlaceKind getKind() {
        return PlaceKind.EVENT;
    }

    /**
     * JSON 里显式给出 null 时 priceOptions 为 null，按 0 处理。
     */
    @JsonIgnore
    public double getMinPrice() {
        if (priceOptions == null) {
            return 0.0;
        }
        return priceOptions.stream().mapToDouble(Double::doubleValue).min().orElse(0.0);
    }
}
