package com.itinera.server.planner;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.itinera.common.exception.ContentGenerationException;
import com.itinera.common.properties.PlannerProperties;
import com.itinera.pojo.dto.ActivityScheduleDTO;
import com.itinera.pojo.dto.DailyActivitiesDTO;
import com.itinera.pojo.entity.Event;
import com.itinera.pojo.entity.Place;
import com.itinera.pojo.entity.PlaceKind;
import com.itinera.pojo.entity.ScheduledActivity;
import com.itinera.server.metrics.MetricsRecorder;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * 生成某一天的具体活动安排。
 *
 * 流程：
 * 1. 组装上下文：当天的景点、餐饮按优先级排序，再从地点池补足到 5 个景点、4 个餐饮；加上当天举行的活动；
 * 2. 调用内容生成服务，输出 {@link DailyActivitiesDTO}；
 * 3. 把每条安排解析回地点，无法解析的丢弃并计数；活动按自身固定时间落位。
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class DayScheduleBuilder {

    static final int LANDMARK_TARGET = 5;
    static final int ESTABLISHMENT_TARGET = 4;
    static final String CALL_SITE = "day-schedule";

    private static final Comparator<Place> BY_PRIORITY =
            Comparator.comparing(Place::getPriority, Comparator.nullsLast(Comparator.naturalOrder()));

    private final ContentGenerationService contentGenerationService;
    private final GenerationRetryPolicy generationRetryPolicy;
    private final PlannerProperties plannerProperties;
    private final ObjectMapper objectMapper;
    private final MetricsRecorder metricsRecorder;

    /**
     * @param date       当天日期
     * @param dayPlaces  主题筛选后当天的候选
     * @param poolPlaces 当前地点池中仍可用的地点（用于补足与解析）
     * @param hint       预算提示；重排时带上上一轮的总花费
     * @return 按生成服务给出的顺序排列的活动，非空
     * @throws ContentGenerationException 多次尝试后仍没有可用安排
     */
    public List<ScheduledActivity> build(LocalDate date, List<Place> dayPlaces, List<Place> poolPlaces, BudgetHint hint) {
        List<Place> landmarks = candidatesOfKind(dayPlaces, poolPlaces, PlaceKind.LANDMARK, LANDMARK_TARGET);
        List<Place> establishments = candidatesOfKind(dayPlaces, poolPlaces, PlaceKind.ESTABLISHMENT, ESTABLISHMENT_TARGET);
        List<Event> events = eventsOn(date, dayPlaces, poolPlaces);

        Map<String, Place> index = new LinkedHashMap<>();
        poolPlaces.forEach(p -> index.putIfAbsent(p.getId(), p));
        dayPlaces.forEach(p -> index.putIfAbsent(p.getId(), p));

        String payload = buildPayload(date, landmarks, establishments, events, hint);
        log.debug("{} 日程上下文: landmarks={}, establishments={}, events={}",
                date, landmarks.size(), establishments.size(), events.size());

        return generationRetryPolicy.execute(CALL_SITE, () -> {
            DailyActivitiesDTO response = contentGenerationService.generate(payload, DailyActivitiesDTO.class);
            List<ScheduledActivity> activities = toActivities(date, response, index);
            if (activities.isEmpty()) {
                throw new ContentGenerationException(date + " 的生成结果中没有可用的活动");
            }
            return activities;
        });
    }

    private List<Place> candidatesOfKind(List<Place> dayPlaces, List<Place> poolPlaces, PlaceKind kind, int target) {
        List<Place> result = dayPlaces.stream()
                .filter(p -> p.getKind() == kind)
                .sorted(BY_PRIORITY)
                .collect(Collectors.toCollection(ArrayList::new));
        Set<String> ids = result.stream().map(Place::getId).collect(Collectors.toCollection(HashSet::new));
        for (Place place : poolPlaces) {
            if (result.size() >= target) {
                break;
            }
            if (place.getKind() == kind && ids.add(place.getId())) {
                result.add(place);
            }
        }
        return result.size() > target ? new ArrayList<>(result.subList(0, target)) : result;
    }

    private List<Event> eventsOn(LocalDate date, List<Place> dayPlaces, List<Place> poolPlaces) {
        Map<String, Event> events = new LinkedHashMap<>();
        for (List<Place> source : List.of(dayPlaces, poolPlaces)) {
            for (Place place : source) {
                if (place.getKind() == PlaceKind.EVENT) {
                    Event event = (Event) place;
                    if (event.getDateAndTime() != null && event.getDateAndTime().toLocalDate().equals(date)) {
                        events.putIfAbsent(event.getId(), event);
                    }
                }
            }
        }
        return new ArrayList<>(events.values());
    }

    private List<ScheduledActivity> toActivities(LocalDate date, DailyActivitiesDTO response, Map<String, Place> index) {
        List<ScheduledActivity> activities = new ArrayList<>();
        if (response == null || response.getActivities() == null) {
            return activities;
        }
        Set<String> seen = new HashSet<>();
        LocalDateTime cursor = date.atTime(plannerProperties.getDayStartTime());
        for (ActivityScheduleDTO entry : response.getActivities()) {
            Place place = entry == null || entry.getPlaceId() == null ? null : index.get(entry.getPlaceId());
            if (place == null) {
                log.warn("{} 的安排引用了未知地点，已丢弃: placeId={}", date, entry == null ? null : entry.getPlaceId());
                metricsRecorder.recordDroppedScheduleEntry("unresolved");
                continue;
            }
            if (!seen.add(place.getId())) {
                log.warn("{} 的安排重复引用了同一地点，已丢弃: placeId={}", date, place.getId());
                metricsRecorder.recordDroppedScheduleEntry("duplicate");
                continue;
            }

            LocalDateTime start = entry.getStartTime() != null ? date.atTime(entry.getStartTime()) : cursor;
            if (place.getKind() == PlaceKind.EVENT && ((Event) place).getDateAndTime() != null) {
                start = ((Event) place).getDateAndTime();
                if (!start.toLocalDate().equals(date)) {
                    log.warn("{} 的安排引用了其他日期的活动，已丢弃: placeId={}, eventTime={}", date, place.getId(), start);
                    metricsRecorder.recordDroppedScheduleEntry("event_other_day");
                    continue;
                }
            }

            Duration stay = ScheduledActivityFactory.stayDuration(place, entry.getDurationHours());
            ScheduledActivity activity = ScheduledActivityFactory.fromPlace(place, start, stay);
            activities.add(activity);
            cursor = activity.getEndTime();
        }
        return activities;
    }

    private String buildPayload(LocalDate date, List<Place> landmarks, List<Place> establishments,
                                List<Event> events, BudgetHint hint) {
        Map<String, Object> context = new LinkedHashMap<>();
        context.put("date", date.toString());
        context.put("landmarks", landmarks.stream().map(this::describe).collect(Collectors.toList()));
        context.put("establishments", establishments.stream().map(this::describe).collect(Collectors.toList()));
        context.put("events", events.stream().map(this::describe).collect(Collectors.toList()));
        if (hint != null) {
            Map<String, Object> budget = new LinkedHashMap<>();
            budget.put("tripBudget", hint.getTripBudget());
            budget.put("travelers", hint.getTravelers());
            budget.put("dailySpendCeiling", hint.getDailySpendCeiling());
            if (hint.getPreviousRoundTotal() != null) {
                budget.put("previousRoundTotal", hint.getPreviousRoundTotal());
            }
            context.put("budget", budget);
        }

        StringBuilder prompt = new StringBuilder();
        prompt.append("Create the activities for the whole day of ").append(date).append(".\n");
        prompt.append("Pick from the landmarks, establishments and events below, referencing each one by its id in placeId. ");
        prompt.append("Include meals at sensible times, respect opening hours, and keep events at their fixed time. ");
        prompt.append("Each entry has placeId, startTime (HH:mm) and durationHours (decimal hours), e.g. ")
                .append(DailyActivitiesDTO.JSON_SHAPE).append("\n");
        if (hint != null && hint.getPreviousRoundTotal() != null) {
            prompt.append("The previous plan cost ").append(String.format(Locale.ROOT, "%.2f", hint.getPreviousRoundTotal()))
                    .append(" in total, which is over the trip budget of ")
                    .append(String.format(Locale.ROOT, "%.2f", hint.getTripBudget()))
                    .append(". Keep this day's total spending under ")
                    .append(String.format(Locale.ROOT, "%.2f", hint.getDailySpendCeiling()))
                    .append(" by choosing cheaper establishments and fewer paid events.\n");
        }
        try {
            prompt.append("Context (JSON): ").append(objectMapper.writeValueAsString(context));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("序列化日程上下文失败", e);
        }
        return prompt.toString();
    }

    private Map<String, Object> describe(Place place) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("id", place.getId());
        m.put("name", place.getName());
        m.put("priority", place.getPriority() == null ? null : place.getPriority().name());
        m.put("reasonToGo", place.getReasonToGo());
        m.put("typicalHoursOfStay", place.getTypicalHoursOfStay());
        m.put("weatherDependent", place.isWeatherDependent());
        m.put("openingSchedule", place.getOpeningSchedule());
        m.put("estimatedCost", PlaceCosts.estimate(place));
        if (place.getKind() == PlaceKind.EVENT && ((Event) place).getDateAndTime() != null) {
            m.put("dateAndTime", ((Event) place).getDateAndTime().toString());
        }
        return m;
    }

    /**
     * 给生成服务的预算提示。
     */
    @Getter
    @AllArgsConstructor
    public static class BudgetHint {
        private final double tripBudget;
        private final int travelers;
        /**
         * 每天可花费的上限。
         */
        private final double dailySpendCeiling;
        /**
         * 上一轮的总花费，首轮为 null。
         */
        private final Double previousRoundTotal;
    }
}
