package com.itinera.server.planner;

import com.itinera.pojo.entity.Establishment;
import com.itinera.pojo.entity.Event;
import com.itinera.pojo.entity.Place;

/**
 * 单个地点的人均花费估计。
 */
public final class PlaceCosts {

    private PlaceCosts() {
    }

    /**
     * 餐饮取人均价格，活动取最低票价，景点与住宿按 0 计（住宿单独核算）。
     */
    public static double estimate(Place place) {
        return switch (place.getKind()) {
            case ESTABLISHMENT -> ((Establishment) place).getAveragePrice();
            case EVENT -> ((Event) place).getMinPrice();
            case LANDMARK, ACCOMMODATION -> 0.0;
        };
    }
}
