package com.itinera.server.planner;

import com.itinera.pojo.dto.TripRequestDTO;
import com.itinera.pojo.entity.Accommodation;
import com.itinera.pojo.entity.BudgetTracker;
import com.itinera.pojo.entity.DayItinerary;
import com.itinera.pojo.entity.ScheduledActivity;
import com.itinera.pojo.entity.TravelSegment;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 预算校验与分类汇总。
 */
@Component
@Slf4j
public class BudgetValidator {

    public static final String ACCOMMODATION = "accommodation";
    public static final String DINING = "dining";
    public static final String ATTRACTIONS = "attractions";
    public static final String TRANSPORTATION = "transportation";
    public static final String EVENTS = "events";
    public static final String TOTAL = "total";

    /**
     * 各天花费之和与总预算比较，严格大于才算超预算。
     */
    public BudgetTracker validate(TripRequestDTO trip, List<DayItinerary> days) {
        double total = days.stream().mapToDouble(DayItinerary::getTotalEstimatedCost).sum();
        boolean overBudget = total > trip.getBudget();
        log.info("预算校验: total={}, budget={}, overBudget={}", total, trip.getBudget(), overBudget);
        return new BudgetTracker(total, overBudget);
    }

    /**
     * 分类花费。住宿 = 最低房价 × 晚数 × 人数，晚数 = 天数 - 1（至少 1）；
     * 餐饮与活动按人数放大；景点与交通按原值；total 为各类之和。
     */
    public Map<String, Double> breakdown(Accommodation accommodation, List<DayItinerary> days, int travelers) {
        int nights = Math.max(1, days.size() - 1);
        double accommodationCost = accommodation == null ? 0.0 : accommodation.getMinPrice() * nights * travelers;
        double dining = 0.0;
        double attractions = 0.0;
        double events = 0.0;
        double transportation = 0.0;
        for (DayItinerary day : days) {
            for (ScheduledActivity activity : day.getActivities()) {
                switch (activity.getActivityType()) {
                    case DINING -> dining += activity.getEstimatedCost() * travelers;
                    case EVENT -> events += activity.getEstimatedCost() * travelers;
                    default -> attractions += activity.getEstimatedCost();
                }
            }
            for (TravelSegment segment : day.getTravelSegments()) {
                transportation += segment.getCost();
            }
        }

        Map<String, Double> breakdown = new LinkedHashMap<>();
        breakdown.put(ACCOMMODATION, accommodationCost);
        breakdown.put(DINING, dining);
        breakdown.put(ATTRACTIONS, attractions);
        breakdown.put(TRANSPORTATION, transportation);
        breakdown.put(EVENTS, events);
        breakdown.put(TOTAL, accommodationCost + dining + attractions + transportation + events);
        return breakdown;
    }
}
