package com.itinera.pojo.dto;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * 一天的活动安排（内容生成服务的结构化输出）。
 */
@Data
public class DailyActivitiesDTO {

    /**
     * 给内容生成服务的输出结构说明，字段名与 {@link ActivityScheduleDTO} 一致。
     */
    public static final String JSON_SHAPE =
            "{\"activities\":[{\"placeId\":\"<id from the input>\",\"startTime\":\"HH:mm\",\"durationHours\":1.5}]}";

    private List<ActivityScheduleDTO> activities = new ArrayList<>();
}
