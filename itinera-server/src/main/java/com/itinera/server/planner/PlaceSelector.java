package com.itinera.server.planner;

import com.itinera.pojo.dto.TripRequestDTO;
import com.itinera.pojo.entity.GroupType;
import com.itinera.pojo.entity.Place;
import com.itinera.pojo.entity.PlaceKind;
import com.itinera.pojo.entity.Priority;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * 从全部候选地点中筛出本次行程的工作集。
 *
 * 规则：
 * - 打分 = 优先级权重 + 兴趣命中 + 人群加分；
 * - 按分数降序（同分保持输入顺序）贪心准入；
 * - 总数不超过 天数 × 6，累计人均花费不超过 人均预算 × 0.8；
 * - ESSENTIAL 即使超出花费上限也会准入（只要数量未满），且不计入累计花费。
 */
@Component
@Slf4j
public class PlaceSelector {

    static final int MAX_ACTIVITIES_PER_DAY = 6;
    static final double BUDGET_SHARE = 0.8;

    private static final double INTEREST_BONUS = 2.0;
    private static final double SOCIAL_ESTABLISHMENT_BONUS = 1.0;
    private static final double COUPLE_KEYWORD_BONUS = 1.5;
    private static final List<String> COUPLE_KEYWORDS = List.of("romantic", "sunset", "view", "garden", "park");

    public List<Place> select(List<Place> places, TripRequestDTO trip) {
        if (places == null || places.isEmpty()) {
            return Collections.emptyList();
        }

        List<ScoredPlace> scored = new ArrayList<>(places.size());
        for (Place place : places) {
            scored.add(new ScoredPlace(place, score(place, trip)));
        }
        // List.sort 是稳定排序，同分保持输入顺序
        scored.sort(Comparator.comparingDouble(ScoredPlace::score).reversed());

        int maxCount = trip.totalDays() * MAX_ACTIVITIES_PER_DAY;
        double costLimit = trip.budgetPerTraveler() * BUDGET_SHARE;

        List<Place> selected = new ArrayList<>();
        double runningCost = 0.0;
        for (ScoredPlace candidate : scored) {
            if (selected.size() >= maxCount) {
                break;
            }
            Place place = candidate.place();
            double cost = PlaceCosts.estimate(place);
            if (runningCost + cost <= costLimit) {
                selected.add(place);
                runningCost += cost;
            } else if (place.getPriority() == Priority.ESSENTIAL) {
                selected.add(place);
            }
        }

        log.info("地点筛选完成: candidates={}, selected={}, maxCount={}, costLimit={}, runningCost={}",
                places.size(), selected.size(), maxCount, costLimit, runningCost);
        return Collections.unmodifiableList(selected);
    }

    double score(Place place, TripRequestDTO trip) {
        double score = priorityWeight(place.getPriority());

        String text = place.getSearchText();
        if (trip.getInterests() != null) {
            for (String interest : trip.getInterests()) {
                if (interest != null && !interest.isBlank()
                        && text.contains(interest.toLowerCase(Locale.ROOT).trim())) {
                    score += INTEREST_BONUS;
                }
            }
        }

        GroupType groupType = trip.getGroupType();
        if ((groupType == GroupType.FRIENDS || groupType == GroupType.GROUP)
                && place.getKind() == PlaceKind.ESTABLISHMENT) {
            score += SOCIAL_ESTABLISHMENT_BONUS;
        } else if (groupType == GroupType.COUPLE && hasCoupleKeyword(place)) {
            score += COUPLE_KEYWORD_BONUS;
        }
        return score;
    }

    /**
     * 只看推荐理由，不看名称。
     */
    private static boolean hasCoupleKeyword(Place place) {
        String reason = place.getReasonToGo();
        if (reason == null) {
            return false;
        }
        String lower = reason.toLowerCase(Locale.ROOT);
        return COUPLE_KEYWORDS.stream().anyMatch(lower::contains);
    }

    private static double priorityWeight(Priority priority) {
        if (priority == null) {
            return 1;
        }
        return switch (priority) {
            case ESSENTIAL -> 10;
            case HIGH -> 7;
            case MEDIUM -> 4;
            case LOW -> 1;
        };
    }

    private static final class ScoredPlace {
        private final Place place;
        private final double score;

        private ScoredPlace(Place place, double score) {
            this.place = place;
            this.score = score;
        }

        Place place() {
            return place;
        }

        double score() {
            return score;
        }
    }
}
