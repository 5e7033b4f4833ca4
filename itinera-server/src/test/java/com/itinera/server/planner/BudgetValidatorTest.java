package com.itinera.server.planner;

import com.itinera.pojo.entity.ActivityType;
import com.itinera.pojo.entity.BudgetTracker;
import com.itinera.pojo.entity.DayItinerary;
import com.itinera.pojo.entity.GroupType;
import com.itinera.pojo.entity.Priority;
import com.itinera.pojo.entity.TransportMode;
import com.itinera.pojo.entity.TravelSegment;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

import static com.itinera.server.planner.PlannerFixtures.accommodation;
import static com.itinera.server.planner.PlannerFixtures.activity;
import static com.itinera.server.planner.PlannerFixtures.trip;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class BudgetValidatorTest {

    private static final LocalDateTime NINE = LocalDateTime.of(2030, 5, 1, 9, 0);

    private final BudgetValidator budgetValidator = new BudgetValidator();

    @Test
    void sumsDayTotalsAndComparesStrictly() {
        List<DayItinerary> days = List.of(day(100), day(150), day(90));

        BudgetTracker roomy = budgetValidator.validate(trip(3, 400, 2, GroupType.COUPLE, "art"), days);
        assertEquals(340.0, roomy.getTotalEstimatedCost(), 1e-9);
        assertFalse(roomy.isOverBudget());

        BudgetTracker tight = budgetValidator.validate(trip(3, 300, 2, GroupType.COUPLE, "art"), days);
        assertTrue(tight.isOverBudget());

        BudgetTracker exact = budgetValidator.validate(trip(3, 340, 2, GroupType.COUPLE, "art"), days);
        assertFalse(exact.isOverBudget());
    }

    @Test
    void breakdownScalesPerPersonCategoriesByTravelers() {
        DayItinerary first = DayItinerary.builder()
                .dayNumber(1)
                .activities(List.of(
                        activity("a", ActivityType.SIGHTSEEING, null, NINE, 12),
                        activity("b", ActivityType.DINING, null, NINE.plusHours(2), 30),
                        activity("c", ActivityType.EVENT, null, NINE.plusHours(5), 40)))
                .travelSegments(List.of(segment(2.5), segment(13.5)))
                .build();
        DayItinerary second = DayItinerary.builder()
                .dayNumber(2)
                .activities(List.of(activity("d", ActivityType.DINING, null, NINE.plusDays(1), 20)))
                .build();

        Map<String, Double> breakdown = budgetValidator.breakdown(
                accommodation("h", Priority.HIGH, 120, 80), List.of(first, second), 2);

        // 2 天 -> 1 晚
        assertEquals(80.0 * 1 * 2, breakdown.get(BudgetValidator.ACCOMMODATION), 1e-9);
        assertEquals((30 + 20) * 2.0, breakdown.get(BudgetValidator.DINING), 1e-9);
        assertEquals(40 * 2.0, breakdown.get(BudgetValidator.EVENTS), 1e-9);
        assertEquals(12.0, breakdown.get(BudgetValidator.ATTRACTIONS), 1e-9);
        assertEquals(16.0, breakdown.get(BudgetValidator.TRANSPORTATION), 1e-9);
        assertEquals(160 + 100 + 80 + 12 + 16.0, breakdown.get(BudgetValidator.TOTAL), 1e-9);
    }

    @Test
    void singleDayTripStillChargesOneNight() {
        Map<String, Double> breakdown = budgetValidator.breakdown(
                accommodation("h", Priority.HIGH, 100), List.of(day(0)), 3);

        assertEquals(300.0, breakdown.get(BudgetValidator.ACCOMMODATION), 1e-9);
    }

    private static DayItinerary day(double total) {
        return DayItinerary.builder().totalEstimatedCost(total).build();
    }

    private static TravelSegment segment(double cost) {
        return TravelSegment.builder().transportMode(TransportMode.PUBLIC_TRANSPORT).cost(cost).build();
    }
}
