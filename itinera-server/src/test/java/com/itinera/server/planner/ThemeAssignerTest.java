package com.itinera.server.planner;

import com.itinera.pojo.entity.Landmark;
import com.itinera.pojo.entity.Place;
import com.itinera.pojo.entity.Priority;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static com.itinera.server.planner.PlannerFixtures.establishment;
import static com.itinera.server.planner.PlannerFixtures.landmark;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ThemeAssignerTest {

    private final ThemeAssigner themeAssigner = new ThemeAssigner();

    @Test
    void classifiesThemesByFirstMatchingBucket() {
        assertEquals(ThemeBucket.HISTORIC, ThemeBucket.classify("Historic City Center"));
        assertEquals(ThemeBucket.MUSEUM_CULTURE, ThemeBucket.classify("Museums & Culture"));
        assertEquals(ThemeBucket.FOOD_MARKET, ThemeBucket.classify("Food & Markets"));
        assertEquals(ThemeBucket.NATURE_PARK, ThemeBucket.classify("Nature & Parks"));
        assertEquals(ThemeBucket.NEIGHBORHOOD_LOCAL, ThemeBucket.classify("Local Neighborhoods"));
        assertEquals(ThemeBucket.DEFAULT, ThemeBucket.classify("Hidden Gems"));
        assertEquals(ThemeBucket.HISTORIC, ThemeBucket.classify("Historic Parks"));
        assertEquals(ThemeBucket.DEFAULT, ThemeBucket.classify(null));
    }

    @Test
    void filtersByThemeKeywordsAndAppliesPriorityQuotas() {
        List<Place> places = new ArrayList<>();
        for (int i = 0; i < 5; i++) {
            places.add(landmark("e" + i, "Old Cathedral " + i, Priority.ESSENTIAL));
        }
        for (int i = 0; i < 5; i++) {
            places.add(landmark("h" + i, "Royal Palace " + i, Priority.HIGH));
        }
        for (int i = 0; i < 5; i++) {
            places.add(landmark("m" + i, "Ancient Wall " + i, Priority.MEDIUM));
        }
        places.add(landmark("low", "Old Bridge", Priority.LOW));
        places.add(landmark("beach", "Sunny Beach", Priority.ESSENTIAL));

        List<Place> selected = themeAssigner.assign(places, "Historic City Center", 1);

        assertEquals(8, selected.size());
        assertEquals(3, selected.stream().filter(p -> p.getPriority() == Priority.ESSENTIAL).count());
        assertEquals(3, selected.stream().filter(p -> p.getPriority() == Priority.HIGH).count());
        assertEquals(2, selected.stream().filter(p -> p.getPriority() == Priority.MEDIUM).count());
        assertTrue(selected.stream().noneMatch(p -> p.getId().equals("beach") || p.getId().equals("low")));
        assertEquals("e0", selected.get(0).getId());
    }

    @Test
    void foodThemeMatchesEveryEstablishment() {
        Place bistro = establishment("b", Priority.HIGH, 20);
        Landmark tower = landmark("t", "Tower", Priority.HIGH);

        List<Place> selected = themeAssigner.assign(List.of(tower, bistro), "Food & Markets", 2);

        assertEquals(List.of(bistro), selected);
    }

    @Test
    void fallsBackToFirstPlacesWhenNothingMatchesTheTheme() {
        List<Place> places = new ArrayList<>();
        for (int i = 0; i < 10; i++) {
            places.add(landmark("x" + i, "Tower " + i, Priority.HIGH));
        }

        List<Place> selected = themeAssigner.assign(places, "Nature & Parks", 3);

        // 前 8 个作为候选，再按 HIGH 限额取 3 个
        assertEquals(3, selected.size());
        assertEquals("x0", selected.get(0).getId());
    }

    @Test
    void onlyLowPriorityPlacesStillYieldNonEmptyResult() {
        List<Place> places = List.of(
                landmark("a", "Museum A", Priority.LOW),
                landmark("b", "Museum B", Priority.LOW));

        List<Place> selected = themeAssigner.assign(places, "Museums & Culture", 1);

        assertFalse(selected.isEmpty());
        assertEquals(places, selected);
    }

    @Test
    void emptyInputGivesEmptyOutput() {
        assertTrue(themeAssigner.assign(List.of(), "Hidden Gems", 1).isEmpty());
    }
}
