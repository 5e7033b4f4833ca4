package com.itinera.server.planner;

import com.itinera.pojo.entity.Place;
import com.itinera.pojo.entity.Priority;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 为某一天的主题从可用地点中挑出当天的候选。
 *
 * 先按主题桶过滤（过滤结果为空则取前 8 个），再按优先级限额：
 * 最多 3 个 ESSENTIAL、3 个 HIGH、2 个 MEDIUM，LOW 不入选。
 * 输入非空时输出一定非空。
 */
@Component
@Slf4j
public class ThemeAssigner {

    static final int FALLBACK_PLACE_COUNT = 8;
    static final int MAX_ESSENTIAL = 3;
    static final int MAX_HIGH = 3;
    static final int MAX_MEDIUM = 2;

    public List<Place> assign(List<Place> places, String theme, int dayNumber) {
        if (places == null || places.isEmpty()) {
            return Collections.emptyList();
        }

        ThemeBucket bucket = ThemeBucket.classify(theme);
        List<Place> matched = places.stream()
                .filter(bucket::matches)
                .collect(Collectors.toList());
        if (matched.isEmpty()) {
            log.debug("第 {} 天主题「{}」没有匹配的地点，退回前 {} 个可用地点", dayNumber, theme, FALLBACK_PLACE_COUNT);
            matched = firstN(places, FALLBACK_PLACE_COUNT);
        }

        List<Place> selected = new ArrayList<>();
        selected.addAll(takeByPriority(matched, Priority.ESSENTIAL, MAX_ESSENTIAL));
        selected.addAll(takeByPriority(matched, Priority.HIGH, MAX_HIGH));
        selected.addAll(takeByPriority(matched, Priority.MEDIUM, MAX_MEDIUM));
        if (selected.isEmpty()) {
            // 只剩 LOW 等情况
            selected = firstN(matched, FALLBACK_PLACE_COUNT);
        }

        log.info("第 {} 天主题「{}」归入 {}，匹配 {} 个，入选 {} 个",
                dayNumber, theme, bucket, matched.size(), selected.size());
        return Collections.unmodifiableList(selected);
    }

    private static List<Place> takeByPriority(List<Place> places, Priority priority, int limit) {
        return places.stream()
                .filter(p -> p.getPriority() == priority)
                .limit(limit)
                .collect(Collectors.toList());
    }

    private static List<Place> firstN(List<Place> places, int n) {
        return new ArrayList<>(places.subList(0, Math.min(n, places.size())));
    }
}
