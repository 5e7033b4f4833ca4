package com.itinera.server.planner;

import com.itinera.pojo.entity.Place;
import com.itinera.pojo.entity.Priority;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static com.itinera.server.planner.PlannerFixtures.landmark;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;

class PlacePoolTest {

    private final List<Place> workingSet = places(8);

    @Test
    void consumeReturnsNewSnapshotWithoutUsedPlaces() {
        PlacePool pool = PlacePool.of(workingSet);

        PlacePool next = pool.consume(Set.of("p0", "p3"));

        assertEquals(8, pool.size());
        assertEquals(6, next.size());
        assertEquals("p1", next.available().get(0).getId());
    }

    @Test
    void replenishesOnlyWhenBelowThreshold() {
        PlacePool pool = PlacePool.of(workingSet).consume(Set.of("p0", "p1"));
        assertSame(pool, pool.replenishIfBelow(6));

        PlacePool starved = pool.consume(Set.of("p2"));
        assertEquals(8, starved.replenishIfBelow(6).size());
    }

    @Test
    void smallWorkingSetIsNotRebuiltEveryDay() {
        PlacePool pool = PlacePool.of(places(3));

        assertSame(pool, pool.replenishIfBelow(6));
    }

    private static List<Place> places(int n) {
        List<Place> places = new ArrayList<>();
        for (int i = 0; i < n; i++) {
            places.add(landmark("p" + i, "Place " + i, Priority.HIGH));
        }
        return places;
    }
}
