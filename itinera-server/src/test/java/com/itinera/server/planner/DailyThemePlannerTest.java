package com.itinera.server.planner;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.itinera.common.exception.ContentGenerationException;
import com.itinera.common.properties.PlannerProperties;
import com.itinera.pojo.dto.DailyThemesDTO;
import com.itinera.pojo.entity.GroupType;
import com.itinera.pojo.entity.Priority;
import com.itinera.server.metrics.MetricsRecorder;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static com.itinera.server.planner.PlannerFixtures.landmark;
import static com.itinera.server.planner.PlannerFixtures.trip;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class DailyThemePlannerTest {

    @Mock
    private ContentGenerationService contentGenerationService;

    @Mock
    private MetricsRecorder metricsRecorder;

    private DailyThemePlanner planner;

    @BeforeEach
    void setUp() {
        GenerationRetryPolicy retryPolicy = new GenerationRetryPolicy(new PlannerProperties(), metricsRecorder);
        planner = new DailyThemePlanner(contentGenerationService, retryPolicy, new ObjectMapper());
    }

    @Test
    void shortAnswerIsPaddedWithExplorationDays() {
        DailyThemesDTO dto = new DailyThemesDTO();
        dto.setThemes(List.of("Old Town", " "));
        when(contentGenerationService.generate(anyString(), eq(DailyThemesDTO.class))).thenReturn(dto);

        List<String> themes = planner.planThemes(trip(3, 900, 2, GroupType.SOLO, "art"),
                List.of(landmark("a", "Tower", Priority.HIGH)));

        assertEquals(List.of("Old Town", "Exploration Day 2", "Exploration Day 3"), themes);
    }

    @Test
    void longAnswerIsTruncated() {
        DailyThemesDTO dto = new DailyThemesDTO();
        dto.setThemes(List.of("A", "B", "C", "D"));
        when(contentGenerationService.generate(anyString(), eq(DailyThemesDTO.class))).thenReturn(dto);

        assertEquals(List.of("A", "B"), planner.planThemes(trip(2, 900, 2, GroupType.SOLO, "art"), List.of()));
    }

    @Test
    void failureFallsBackToRotation() {
        when(contentGenerationService.generate(anyString(), eq(DailyThemesDTO.class)))
                .thenThrow(new ContentGenerationException("down"));

        List<String> themes = planner.planThemes(trip(9, 900, 2, GroupType.SOLO, "art"), List.of());

        assertEquals(9, themes.size());
        assertEquals("Historic City Center", themes.get(0));
        assertEquals("Relaxation Day", themes.get(6));
        assertEquals("Historic City Center", themes.get(7));
        assertEquals("Museums & Culture", themes.get(8));
    }
}
