package com.itinera.server.planner;

import com.itinera.pojo.entity.ActivityType;
import com.itinera.pojo.entity.Place;
import com.itinera.pojo.entity.ScheduledActivity;
import com.itinera.server.utils.GeoDistance;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * 一天之内的路线优化（最近邻启发式）。
 *
 * 只重排有坐标且不是住宿的活动：从输入顺序中的第一个出发，每次走向最近的未访问活动（距离相同取先出现的）。
 * 重排后从第一个活动原来的开始时间起重新排时间：结束 = 开始 + 停留时长，下一个开始 = 上一个结束 + 30 分钟。
 * 其余活动时间不变，合并后按开始时间排序返回。
 */
@Component
@Slf4j
public class RouteOptimizer {

    static final Duration TRAVEL_BUFFER = Duration.ofMinutes(30);

    /**
     * @param activities 当天的活动
     * @param placeIndex placeId → Place，用于取停留时长；找不到按 2 小时
     * @return 按开始时间升序的新列表
     */
    public List<ScheduledActivity> optimize(List<ScheduledActivity> activities, Map<String, Place> placeIndex) {
        List<ScheduledActivity> routable = new ArrayList<>();
        List<ScheduledActivity> fixed = new ArrayList<>();
        for (ScheduledActivity activity : activities) {
            if (activity.hasCoordinates() && activity.getActivityType() != ActivityType.ACCOMMODATION) {
                routable.add(activity);
            } else {
                fixed.add(activity);
            }
        }
        if (routable.size() <= 2) {
            return sortedByStart(activities);
        }

        List<ScheduledActivity> ordered = nearestNeighbour(routable);
        List<ScheduledActivity> merged = new ArrayList<>(fixed);
        merged.addAll(retime(ordered, routable.get(0).getStartTime(), placeIndex));

        if (log.isDebugEnabled()) {
            log.debug("路线优化: routable={}, pathKm {} -> {}",
                    routable.size(), String.format(Locale.ROOT, "%.2f", pathLengthKm(routable)), String.format(Locale.ROOT, "%.2f", pathLengthKm(ordered)));
        }
        return sortedByStart(merged);
    }

    /**
     * 按给定顺序依次走过所有有坐标活动的总距离（公里）。
     */
    public double pathLengthKm(List<ScheduledActivity> activities) {
        double total = 0.0;
        ScheduledActivity previous = null;
        for (ScheduledActivity activity : activities) {
            if (!activity.hasCoordinates()) {
                continue;
            }
            if (previous != null) {
                total += GeoDistance.distanceKm(previous.getCoordinates(), activity.getCoordinates());
            }
            previous = activity;
        }
        return total;
    }

    private List<ScheduledActivity> nearestNeighbour(List<ScheduledActivity> routable) {
        List<ScheduledActivity> remaining = new ArrayList<>(routable);
        List<ScheduledActivity> ordered = new ArrayList<>(routable.size());
        ScheduledActivity current = remaining.remove(0);
        ordered.add(current);
        while (!remaining.isEmpty()) {
            int bestIndex = 0;
            double bestDistance = Double.MAX_VALUE;
            for (int i = 0; i < remaining.size(); i++) {
                double d = GeoDistance.distanceKm(current.getCoordinates(), remaining.get(i).getCoordinates());
                if (d < bestDistance) {
                    bestDistance = d;
                    bestIndex = i;
                }
            }
            current = remaining.remove(bestIndex);
            ordered.add(current);
        }
        return ordered;
    }

    private List<ScheduledActivity> retime(List<ScheduledActivity> ordered, LocalDateTime dayStart,
                                           Map<String, Place> placeIndex) {
        List<ScheduledActivity> result = new ArrayList<>(ordered.size());
        LocalDateTime start = dayStart;
        for (ScheduledActivity activity : ordered) {
            Place place = placeIndex == null ? null : placeIndex.get(activity.getPlaceId());
            LocalDateTime end = start.plus(ScheduledActivityFactory.stayDuration(place, null));
            result.add(activity.withTimes(start, end));
            start = end.plus(TRAVEL_BUFFER);
        }
        return result;
    }

    private static List<ScheduledActivity> sortedByStart(List<ScheduledActivity> activities) {
        List<ScheduledActivity> sorted = new ArrayList<>(activities);
        sorted.sort(Comparator.comparing(ScheduledActivity::getStartTime));
        return sorted;
    }
}
