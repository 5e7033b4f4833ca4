package com.itinera.pojo.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.itinera.pojo.entity.GroupType;
import lombok.Data;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.List;

/**
 * 行程请求。
 * Trip request: destination, dates, budget and group profile.
 */
@Data
public class TripRequestDTO {

    /**
     * 目的地城市 / 国家 / 地区。
     * Target destination.
     */
    private String destination;

    /**
     * 开始日期，必须早于结束日期。
     */
    private LocalDate startDate;

    /**
     * 结束日期，不能早于今天。
     */
    private LocalDate endDate;

    /**
     * 总预算（与币种无关的单位），必须大于 0。
     * Total budget for the whole trip.
     */
    private Double budget;

    /**
     * 出行人数，必须大于 0。
     */
    private Integer travelers;

    private GroupType groupType;

    /**
     * 兴趣关键词，至少一个。
     * Free-text interests, e.g. "art", "street food".
     */
    private List<String> interests;

    /**
     * 晚数 = 结束日期 - 开始日期。
     */
    @JsonIgnore
    public int totalNights() {
        return (int) ChronoUnit.DAYS.between(startDate, endDate);
    }

    /**
     * 天数（含首尾两天）。
     */
    @JsonIgnore
    public int totalDays() {
        return totalNights() + 1;
    }

    /**
     * 人均预算。
     */
    @JsonIgnore
    public double budgetPerTraveler() {
        return budget / travelers;
    }
}
