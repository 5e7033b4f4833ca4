package com.itinera.pojo.dto;

import com.itinera.pojo.entity.Accommodation;
import com.itinera.pojo.entity.Establishment;
import com.itinera.pojo.entity.Event;
import com.itinera.pojo.entity.Landmark;
import com.itinera.pojo.entity.Place;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * 上游地点发现的结果，按类别分组。四个列表互不依赖，可以并行发现，构建前必须全部就绪。
 */
@Data
public class DestinationReportDTO {

    private List<Landmark> landmarks = new ArrayList<>();

    private List<Establishment> establishments = new ArrayList<>();

    private List<Event> events = new ArrayList<>();

    private List<Accommodation> accommodations = new ArrayList<>();

    /**
     * 合并后的候选池，顺序为景点、餐饮、活动、住宿。
     */
    public List<Place> allPlaces() {
        List<Place> all = new ArrayList<>();
        if (landmarks != null) {
            all.addAll(landmarks);
        }
        if (establishments != null) {
            all.addAll(establishments);
        }
        if (events != null) {
            all.addAll(events);
        }
        if (accommodations != null) {
            all.addAll(accommodations);
        }
        return all;
    }
}
