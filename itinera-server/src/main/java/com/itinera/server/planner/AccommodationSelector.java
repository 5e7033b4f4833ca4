package com.itinera.server.planner;

import com.itinera.pojo.dto.TripRequestDTO;
import com.itinera.pojo.entity.Accommodation;
import com.itinera.pojo.entity.Priority;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 选出整趟行程的住宿。
 *
 * 可负担线 = 预算 / 人数 / 晚数 × 1.2（按最低房价比较）。
 * 在可负担的住宿中按「优先级分 + 2 × 归一化便宜程度」取最高；都负担不起时取最便宜的。
 */
@Component
@Slf4j
public class AccommodationSelector {

    static final double AFFORDABILITY_SLACK = 1.2;
    static final double CHEAPNESS_WEIGHT = 2.0;

    /**
     * @throws IllegalArgumentException 没有任何住宿
     */
    public Accommodation select(List<Accommodation> accommodations, TripRequestDTO trip) {
        if (accommodations == null || accommodations.isEmpty()) {
            throw new IllegalArgumentException("accommodations must not be empty");
        }
        int nights = Math.max(1, trip.totalNights());
        double threshold = trip.budgetPerTraveler() / nights * AFFORDABILITY_SLACK;

        List<Accommodation> affordable = accommodations.stream()
                .filter(a -> a.getMinPrice() <= threshold)
                .collect(Collectors.toList());
        if (affordable.isEmpty()) {
            Accommodation cheapest = accommodations.stream()
                    .min(Comparator.comparingDouble(Accommodation::getMinPrice))
                    .orElseThrow();
            log.warn("没有在可负担线 {} 以内的住宿，选择最便宜的: {} ({})",
                    threshold, cheapest.getName(), cheapest.getMinPrice());
            return cheapest;
        }

        double minPrice = affordable.stream().mapToDouble(Accommodation::getMinPrice).min().orElse(0.0);
        double maxPrice = affordable.stream().mapToDouble(Accommodation::getMinPrice).max().orElse(0.0);
        Accommodation best = null;
        double bestScore = -1;
        for (Accommodation candidate : affordable) {
            double cheapness = maxPrice > minPrice ? (maxPrice - candidate.getMinPrice()) / (maxPrice - minPrice) : 1.0;
            double score = priorityScore(candidate.getPriority()) + CHEAPNESS_WEIGHT * cheapness;
            if (score > bestScore) {
                bestScore = score;
                best = candidate;
            }
        }
        log.info("住宿选择: {} (price={}, score={}, threshold={}, affordable={}/{})",
                best.getName(), best.getMinPrice(), bestScore, threshold, affordable.size(), accommodations.size());
        return best;
    }

    private static int priorityScore(Priority priority) {
        if (priority == null) {
            return 0;
        }
        return switch (priority) {
            case ESSENTIAL -> 3;
            case HIGH -> 2;
            case MEDIUM -> 1;
            case LOW -> 0;
        };
    }
}
