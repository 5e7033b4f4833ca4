package com.itinera.server.planner;

import com.itinera.pojo.dto.TravelSegmentOptions;
import com.itinera.pojo.entity.ScheduledActivity;
import com.itinera.pojo.entity.TransportMode;
import com.itinera.pojo.entity.TravelSegment;
import com.itinera.server.utils.GeoDistance;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * 按距离给相邻两个活动之间的交通定方式、耗时与花费。
 *
 * <ul>
 *     <li>≤ 0.5 km：步行，max(5, ⌊km×12⌋) 分钟，免费</li>
 *     <li>≤ 3 km：公共交通，max(10, ⌊km×8⌋) 分钟，平均票价</li>
 *     <li>其余：出租车，max(15, ⌊km×5⌋) 分钟，起步价 + km × 1.20</li>
 * </ul>
 */
@Component
public class TravelSegmentClassifier {

    static final double WALKING_MAX_KM = 0.5;
    static final double PUBLIC_TRANSPORT_MAX_KM = 3.0;
    static final double TAXI_RATE_PER_KM = 1.20;

    /**
     * 两端都必须有坐标。
     */
    public TravelSegment classify(ScheduledActivity from, ScheduledActivity to, TravelSegmentOptions options) {
        double km = GeoDistance.distanceKm(from.getCoordinates(), to.getCoordinates());
        TravelSegment.TravelSegmentBuilder segment = TravelSegment.builder()
                .fromActivityId(from.getId())
                .toActivityId(to.getId());

        if (km <= WALKING_MAX_KM) {
            int minutes = Math.max(5, (int) (km * 12));
            return segment.transportMode(TransportMode.WALKING)
                    .durationMinutes(minutes)
                    .cost(0.0)
                    .instructions(String.format(Locale.ROOT, "Walk %dm to %s (%d mins)",
                            Math.round(km * 1000), to.getName(), minutes))
                    .build();
        }
        if (km <= PUBLIC_TRANSPORT_MAX_KM) {
            int minutes = Math.max(10, (int) (km * 8));
            double cost = options.getAveragePublicTransportFare();
            return segment.transportMode(TransportMode.PUBLIC_TRANSPORT)
                    .durationMinutes(minutes)
                    .cost(cost)
                    .instructions(String.format(Locale.ROOT, "Take public transport to %s (%d mins, %.2f)",
                            to.getName(), minutes, cost))
                    .build();
        }
        int minutes = Math.max(15, (int) (km * 5));
        double cost = options.getBaseTaxiFare() + km * TAXI_RATE_PER_KM;
        return segment.transportMode(TransportMode.TAXI)
                .durationMinutes(minutes)
                .cost(cost)
                .instructions(String.format(Locale.ROOT, "Take taxi to %s (%d mins, ~%.2f)",
                        to.getName(), minutes, cost))
                .build();
    }

    /**
     * 为按时间排好序的一天活动生成交通段：只处理相邻且都有坐标、开始时间不同的两项。
     */
    public List<TravelSegment> segmentsFor(List<ScheduledActivity> activities, TravelSegmentOptions options) {
        List<TravelSegment> segments = new ArrayList<>();
        for (int i = 0; i + 1 < activities.size(); i++) {
            ScheduledActivity from = activities.get(i);
            ScheduledActivity to = activities.get(i + 1);
            if (!from.hasCoordinates() || !to.hasCoordinates()) {
                continue;
            }
            if (from.getStartTime().equals(to.getStartTime())) {
                continue;
            }
            segments.add(classify(from, to, options));
        }
        return segments;
    }
}
