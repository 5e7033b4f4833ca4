package com.itinera.server.planner;

import com.itinera.pojo.entity.ActivityType;
import com.itinera.pojo.entity.BookingType;
import com.itinera.pojo.entity.Place;
import com.itinera.pojo.entity.ScheduledActivity;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Place → ScheduledActivity 的转换与停留时长规则。
 */
public final class ScheduledActivityFactory {

    static final String WEATHER_SUFFIX = " (Weather dependent - check forecast!)";
    static final Duration DEFAULT_STAY = Duration.ofHours(2);

    private ScheduledActivityFactory() {
    }

    public static ScheduledActivity fromPlace(Place place, LocalDateTime start, Duration stay) {
        String description = place.getReasonToGo() == null ? "" : place.getReasonToGo();
        if (place.isWeatherDependent()) {
            description = description + WEATHER_SUFFIX;
        }
        return ScheduledActivity.builder()
                .id(UUID.randomUUID().toString())
                .placeId(place.getId())
                .activityType(activityTypeOf(place))
                .name(place.getName())
                .description(description)
                .startTime(start)
                .endTime(start.plus(stay))
                .estimatedCost(PlaceCosts.estimate(place))
                .coordinates(place.getCoordinates())
                .bookingRequired(place.isBookingRequired())
                .bookingUrl(place.getWebsite())
                .notes(notesOf(place))
                .build();
    }

    public static ActivityType activityTypeOf(Place place) {
        return switch (place.getKind()) {
            case LANDMARK -> ActivityType.SIGHTSEEING;
            case ESTABLISHMENT -> ActivityType.DINING;
            case EVENT -> ActivityType.EVENT;
            case ACCOMMODATION -> ActivityType.ACCOMMODATION;
        };
    }

    /**
     * 停留时长：地点自身的典型停留时长优先，其次是生成服务给出的时长，都没有则 2 小时。
     *
     * @param requestedHours 生成服务给出的小时数，可为 null
     */
    public static Duration stayDuration(Place place, Double requestedHours) {
        if (place != null && place.getTypicalHoursOfStay() > 0) {
            return hours(place.getTypicalHoursOfStay());
        }
        if (requestedHours != null && requestedHours > 0) {
            return hours(requestedHours);
        }
        return DEFAULT_STAY;
    }

    private static Duration hours(double hours) {
        return Duration.ofMinutes(Math.max(1L, Math.round(hours * 60)));
    }

    private static List<String> notesOf(Place place) {
        List<String> notes = new ArrayList<>();
        Map<String, String> schedule = place.getOpeningSchedule();
        if (schedule != null && !schedule.isEmpty()) {
            notes.add("Opening hours: " + schedule.entrySet().stream()
                    .map(e -> e.getKey() + " " + e.getValue())
                    .collect(Collectors.joining("; ")));
        }
        if (place.getBookingType() == BookingType.REQUIRED) {
            notes.add("Booking required");
        } else if (place.getBookingType() == BookingType.RECOMMENDED) {
            notes.add("Booking recommended");
        }
        return notes;
    }
}
