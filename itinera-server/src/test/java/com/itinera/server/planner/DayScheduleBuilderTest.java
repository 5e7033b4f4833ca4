package com.itinera.server.planner;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.itinera.common.exception.ContentGenerationException;
import com.itinera.common.properties.PlannerProperties;
import com.itinera.pojo.dto.ActivityScheduleDTO;
import com.itinera.pojo.dto.DailyActivitiesDTO;
import com.itinera.pojo.entity.ActivityType;
import com.itinera.pojo.entity.BookingType;
import com.itinera.pojo.entity.Coordinates;
import com.itinera.pojo.entity.Event;
import com.itinera.pojo.entity.Landmark;
import com.itinera.pojo.entity.Place;
import com.itinera.pojo.entity.Priority;
import com.itinera.pojo.entity.ScheduledActivity;
import com.itinera.server.metrics.MetricsRecorder;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static com.itinera.server.planner.PlannerFixtures.START;
import static com.itinera.server.planner.PlannerFixtures.establishment;
import static com.itinera.server.planner.PlannerFixtures.event;
import static com.itinera.server.planner.PlannerFixtures.landmark;
import static com.itinera.server.planner.PlannerFixtures.landmarkAt;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * DayScheduleBuilder 单元测试：内容生成服务用 Mockito 模拟，重试策略用真实实现。
 */
@ExtendWith(MockitoExtension.class)
class DayScheduleBuilderTest {

    private static final LocalDate DAY = START;

    @Mock
    private ContentGenerationService contentGenerationService;

    @Mock
    private MetricsRecorder metricsRecorder;

    private DayScheduleBuilder dayScheduleBuilder;

    @BeforeEach
    void setUp() {
        PlannerProperties properties = new PlannerProperties();
        GenerationRetryPolicy retryPolicy = new GenerationRetryPolicy(properties, metricsRecorder);
        dayScheduleBuilder = new DayScheduleBuilder(contentGenerationService, retryPolicy, properties,
                new ObjectMapper().findAndRegisterModules(), metricsRecorder);
    }

    @Test
    void resolvesEntriesAndAppliesDurationRule() {
        Landmark withStay = landmarkAt("stay", 48.85, 2.35, 1.5);
        Landmark noStay = landmarkAt("nostay", 48.86, 2.36, 0);
        Place bistro = establishment("bistro", Priority.HIGH, 25);
        List<Place> places = List.of(withStay, noStay, bistro);
        givenResponse(
                entry("stay", "09:00", 4.0),
                entry("ghost", "10:00", 1.0),
                entry("bistro", "12:30", null),
                entry("nostay", "14:00", 2.5));

        List<ScheduledActivity> activities = dayScheduleBuilder.build(DAY, places, places, null);

        assertEquals(3, activities.size());
        assertEquals("stay", activities.get(0).getPlaceId());
        assertEquals(Duration.ofMinutes(90), activities.get(0).duration());
        assertEquals(DAY.atTime(9, 0), activities.get(0).getStartTime());

        assertEquals("bistro", activities.get(1).getPlaceId());
        assertEquals(ActivityType.DINING, activities.get(1).getActivityType());
        assertEquals(25.0, activities.get(1).getEstimatedCost(), 1e-9);
        assertEquals(Duration.ofHours(2), activities.get(1).duration());

        assertEquals("nostay", activities.get(2).getPlaceId());
        assertEquals(Duration.ofMinutes(150), activities.get(2).duration());
        verify(metricsRecorder).recordDroppedScheduleEntry("unresolved");
    }

    @Test
    void eventsArePinnedToTheirOwnTimeAndOtherDaysAreDropped() {
        Event tonight = event("tonight", DAY.atTime(20, 30), 35);
        Event tomorrow = event("tomorrow", DAY.plusDays(1).atTime(20, 0), 35);
        Landmark museum = landmark("museum", "Museum", Priority.HIGH);
        List<Place> places = List.of(museum, tonight, tomorrow);
        givenResponse(
                entry("museum", "10:00", 2.0),
                entry("tonight", "18:00", 2.0),
                entry("tomorrow", "21:00", 2.0));

        List<ScheduledActivity> activities = dayScheduleBuilder.build(DAY, places, places, null);

        assertEquals(2, activities.size());
        ScheduledActivity concert = activities.get(1);
        assertEquals(ActivityType.EVENT, concert.getActivityType());
        assertEquals(DAY.atTime(20, 30), concert.getStartTime());
        assertEquals(35.0, concert.getEstimatedCost(), 1e-9);
        verify(metricsRecorder).recordDroppedScheduleEntry("event_other_day");
    }

    @Test
    void contextIsPaddedFromPoolAndListsOnlySameDayEvents() {
        List<Place> dayPlaces = List.of(landmark("day1", "Cathedral", Priority.LOW));
        List<Place> pool = new ArrayList<>(dayPlaces);
        for (int i = 0; i < 8; i++) {
            pool.add(landmark("pool" + i, "Palace " + i, Priority.MEDIUM));
        }
        pool.add(establishment("cafe", Priority.MEDIUM, 8));
        pool.add(event("later", DAY.plusDays(2).atTime(19, 0), 10));
        givenResponse(entry("day1", "09:00", 2.0));

        dayScheduleBuilder.build(DAY, dayPlaces, pool, null);

        ArgumentCaptor<String> payload = ArgumentCaptor.forClass(String.class);
        verify(contentGenerationService).generate(payload.capture(), eq(DailyActivitiesDTO.class));
        String context = payload.getValue();
        assertTrue(context.contains(DailyActivitiesDTO.JSON_SHAPE));
        assertTrue(context.contains("\"day1\""));
        assertTrue(context.contains("\"pool3\""));
        assertFalse(context.contains("\"pool4\""), "landmarks are capped at 5");
        assertTrue(context.contains("\"cafe\""));
        assertFalse(context.contains("\"later\""));
    }

    @Test
    void replanHintMentionsPreviousTotalAndCeiling() {
        List<Place> places = List.of(landmark("a", "Tower", Priority.HIGH));
        givenResponse(entry("a", "09:00", 1.0));

        dayScheduleBuilder.build(DAY, places, places, new DayScheduleBuilder.BudgetHint(300, 2, 100, 412.5));

        ArgumentCaptor<String> payload = ArgumentCaptor.forClass(String.class);
        verify(contentGenerationService).generate(payload.capture(), eq(DailyActivitiesDTO.class));
        assertTrue(payload.getValue().contains("The previous plan cost 412.50"));
        assertTrue(payload.getValue().contains("under 100.00"));
    }

    @Test
    void weatherAndBookingInformationIsCarriedOver() {
        Landmark garden = Landmark.builder()
                .id("garden")
                .name("Botanical Garden")
                .priority(Priority.HIGH)
                .reasonToGo("Rare orchids")
                .coordinates(Coordinates.of(48.84, 2.36))
                .website("https://garden.example")
                .bookingType(BookingType.REQUIRED)
                .weatherDependent(true)
                .openingSchedule(Map.of("Daily", "09:00-18:00"))
                .build();
        givenResponse(entry("garden", "10:00", 2.0));

        ScheduledActivity activity = dayScheduleBuilder.build(DAY, List.of(garden), List.of(garden), null).get(0);

        assertEquals("Rare orchids (Weather dependent - check forecast!)", activity.getDescription());
        assertTrue(activity.isBookingRequired());
        assertEquals("https://garden.example", activity.getBookingUrl());
        assertEquals(List.of("Opening hours: Daily 09:00-18:00", "Booking required"), activity.getNotes());
    }

    @Test
    void unusableResponsesAreRetriedThenFail() {
        List<Place> places = List.of(landmark("a", "Tower", Priority.HIGH));
        givenResponse(entry("nobody", "09:00", 1.0));

        assertThrows(ContentGenerationException.class, () -> dayScheduleBuilder.build(DAY, places, places, null));

        verify(contentGenerationService, times(3)).generate(anyString(), eq(DailyActivitiesDTO.class));
        verify(metricsRecorder, times(3)).recordGenerationFailure(DayScheduleBuilder.CALL_SITE);
    }

    private void givenResponse(ActivityScheduleDTO... entries) {
        DailyActivitiesDTO dto = new DailyActivitiesDTO();
        dto.setActivities(List.of(entries));
        when(contentGenerationService.generate(anyString(), eq(DailyActivitiesDTO.class))).thenReturn(dto);
    }

    private static ActivityScheduleDTO entry(String placeId, String start, Double hours) {
        return new ActivityScheduleDTO(placeId, LocalTime.parse(start), hours);
    }
}
