package com.itinera.pojo.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalTime;

/**
 * 内容生成服务返回的一条安排：哪个地点、几点开始、持续多久。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ActivityScheduleDTO {

    /**
     * 景点 / 餐饮 / 活动的 ID。
     */
    private String placeId;

    private LocalTime startTime;

    private Double durationHours;
}
