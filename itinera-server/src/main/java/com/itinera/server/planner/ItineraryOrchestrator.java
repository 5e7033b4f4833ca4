package com.itinera.server.planner;

import com.itinera.common.exception.BaseException;
import com.itinera.common.exception.ItineraryBuildException;
import com.itinera.common.properties.PlannerProperties;
import com.itinera.common.result.ErrorCode;
import com.itinera.pojo.dto.DestinationReportDTO;
import com.itinera.pojo.dto.ItineraryPlanRequestDTO;
import com.itinera.pojo.dto.TravelSegmentOptions;
import com.itinera.pojo.dto.TripRequestDTO;
import com.itinera.pojo.entity.Accommodation;
import com.itinera.pojo.entity.ActivityType;
import com.itinera.pojo.entity.BudgetTracker;
import com.itinera.pojo.entity.DayItinerary;
import com.itinera.pojo.entity.Place;
import com.itinera.pojo.entity.ScheduledActivity;
import com.itinera.pojo.entity.TravelSegment;
import com.itinera.pojo.entity.TripItinerary;
import com.itinera.server.metrics.MetricsRecorder;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * 行程构建编排器。
 *
 * 状态机：
 * VALIDATE_REQUEST -> FILTER_PLACES -> PLAN_THEMES -> ALLOCATE_ACCOMMODATION -> BUILD_SCHEDULES
 * -> OPTIMIZE_ROUTES -> VALIDATE_BUDGET -> (REPLAN -> BUILD_SCHEDULES | FINALIZE) -> DONE，任一阶段失败 -> ERROR。
 *
 * 重排只重新生成每天的日程，不重新筛选地点；构建轮数（含首轮）受 itinera.planner.max-replan-attempts 限制，
 * 轮数耗尽仍超预算时按 replan-exhausted-policy 处理。
 * 每次 run 持有自己的上下文，不同请求之间没有共享的可变状态。
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ItineraryOrchestrator {

    private final TripRequestValidator tripRequestValidator;
    private final PlaceSelector placeSelector;
    private final DailyThemePlanner dailyThemePlanner;
    private final AccommodationSelector accommodationSelector;
    private final ThemeAssigner themeAssigner;
    private final DayScheduleBuilder dayScheduleBuilder;
    private final RouteOptimizer routeOptimizer;
    private final TravelSegmentClassifier travelSegmentClassifier;
    private final FareAdvisor fareAdvisor;
    private final BudgetValidator budgetValidator;
    private final PlannerProperties plannerProperties;
    private final MetricsRecorder metricsRecorder;

    /**
     * 对外主入口：执行一次完整的行程构建。
     * 不抛异常，失败信息通过 {@link OrchestratorResponse} 返回。
     */
    public OrchestratorResponse run(ItineraryPlanRequestDTO request) {
        OrchestratorResponse resp = new OrchestratorResponse();
        resp.setRounds(new ArrayList<>());

        BuildState state = BuildState.VALIDATE_REQUEST;
        BuildContext ctx = new BuildContext();
        ctx.setRequest(request);

        try {
            while (state != BuildState.DONE && state != BuildState.ERROR) {
                ctx.setStage(state.name());
                switch (state) {
                    case VALIDATE_REQUEST -> {
                        tripRequestValidator.validate(request);
                        ctx.setTrip(request.getTrip());
                        state = BuildState.FILTER_PLACES;
                    }
                    case FILTER_PLACES -> {
                        DestinationReportDTO report = request.getDestinationReport();
                        List<Place> candidates = new ArrayList<>();
                        candidates.addAll(nullSafe(report.getLandmarks()));
                        candidates.addAll(nullSafe(report.getEstablishments()));
                        candidates.addAll(nullSafe(report.getEvents()));
                        List<Place> workingSet = placeSelector.select(candidates, ctx.getTrip());
                        if (workingSet.isEmpty()) {
                            throw new ItineraryBuildException(state.name(), ErrorCode.PLACE_POOL_EMPTY);
                        }
                        ctx.setWorkingSet(workingSet);
                        ctx.setPlaceIndex(indexById(workingSet, report.allPlaces()));
                        state = BuildState.PLAN_THEMES;
                    }
                    case PLAN_THEMES -> {
                        ctx.setThemes(dailyThemePlanner.planThemes(ctx.getTrip(), ctx.getWorkingSet()));
                        log.info("每日主题: {}", ctx.getThemes());
                        state = BuildState.ALLOCATE_ACCOMMODATION;
                    }
                    case ALLOCATE_ACCOMMODATION -> {
                        List<Accommodation> accommodations = nullSafe(request.getDestinationReport().getAccommodations());
                        if (accommodations.isEmpty()) {
                            throw new ItineraryBuildException(state.name(), ErrorCode.NO_ACCOMMODATION);
                        }
                        ctx.setAccommodation(accommodationSelector.select(accommodations, ctx.getTrip()));
                        state = BuildState.BUILD_SCHEDULES;
                    }
                    case BUILD_SCHEDULES -> {
                        ctx.setRound(ctx.getRound() + 1);
                        ctx.setDrafts(buildAllDays(ctx));
                        state = BuildState.OPTIMIZE_ROUTES;
                    }
                    case OPTIMIZE_ROUTES -> {
                        if (ctx.getFares() == null) {
                            ctx.setFares(fareAdvisor.lookup(ctx.getTrip()));
                        }
                        ctx.setDays(ctx.getDrafts().stream()
                                .map(draft -> finishDay(draft, ctx))
                                .collect(Collectors.toList()));
                        state = BuildState.VALIDATE_BUDGET;
                    }
                    case VALIDATE_BUDGET -> {
                        BudgetTracker tracker = budgetValidator.validate(ctx.getTrip(), ctx.getDays());
                        ctx.setBudgetTracker(tracker);
                        resp.getRounds().add(new ReplanRoundRecord(ctx.getRound(),
                                tracker.getTotalEstimatedCost(), tracker.isOverBudget()));
                        rememberCheapest(ctx, tracker);
                        state = nextAfterValidation(ctx, tracker, resp);
                    }
                    case REPLAN -> {
                        metricsRecorder.recordReplan();
                        log.warn("第 {} 轮总花费 {} 超出预算 {}，重新生成每日日程",
                                ctx.getRound(), ctx.getBudgetTracker().getTotalEstimatedCost(), ctx.getTrip().getBudget());
                        state = BuildState.BUILD_SCHEDULES;
                    }
                    case FINALIZE -> {
                        resp.setFinalResult(assemble(ctx));
                        resp.setStatus("DONE");
                        if (resp.getReport() == null) {
                            resp.setReport("第 " + ctx.getRound() + " 轮构建满足预算");
                        }
                        metricsRecorder.recordItineraryBuild(
                                ctx.getBudgetTracker().isOverBudget() ? "best_effort" : "within_budget",
                                state.name(), ctx.getRound());
                        state = BuildState.DONE;
                    }
                    default -> throw new IllegalStateException("未知状态: " + state);
                }
            }
        } catch (ItineraryBuildException e) {
            fail(resp, ctx, e.getStage(), e.getCode(), e.getMessage());
        } catch (BaseException e) {
            fail(resp, ctx, ctx.getStage(), e.getCode(), e.getMessage());
        } catch (Exception e) {
            log.error("ItineraryOrchestrator 执行异常, stage={}", ctx.getStage(), e);
            fail(resp, ctx, ctx.getStage(), ErrorCode.ITINERARY_BUILD_FAILED.getCode(), "服务器内部错误，请稍后重试");
        }
        return resp;
    }

    /**
     * 按天顺序生成日程；每天用掉的地点从池中移除，池不足时重新开放整个工作集。
     */
    private List<DayDraft> buildAllDays(BuildContext ctx) {
        TripRequestDTO trip = ctx.getTrip();
        int totalDays = trip.totalDays();
        Double previousTotal = ctx.getBudgetTracker() == null ? null : ctx.getBudgetTracker().getTotalEstimatedCost();
        DayScheduleBuilder.BudgetHint hint = new DayScheduleBuilder.BudgetHint(
                trip.getBudget(), trip.getTravelers(), trip.getBudget() / totalDays, previousTotal);

        List<DayDraft> drafts = new ArrayList<>(totalDays);
        PlacePool pool = PlacePool.of(ctx.getWorkingSet());
        for (int i = 0; i < totalDays; i++) {
            int dayNumber = i + 1;
            LocalDate date = trip.getStartDate().plusDays(i);
            String theme = ctx.getThemes().get(i);

            pool = pool.replenishIfBelow(plannerProperties.getPoolReplenishThreshold());
            List<Place> dayPlaces = themeAssigner.assign(pool.available(), theme, dayNumber);
            List<ScheduledActivity> activities = dayScheduleBuilder.build(date, dayPlaces, pool.available(), hint);
            if (activities.isEmpty()) {
                throw new ItineraryBuildException(BuildState.BUILD_SCHEDULES.name(), ErrorCode.EMPTY_DAY_SCHEDULE,
                        "第 " + dayNumber + " 天没有可安排的活动");
            }

            Set<String> used = new LinkedHashSet<>();
            dayPlaces.forEach(p -> used.add(p.getId()));
            activities.forEach(a -> used.add(a.getPlaceId()));
            pool = pool.consume(used);
            log.info("第 {} 轮 第 {} 天({})：主题「{}」，活动 {} 个，剩余可用地点 {} 个",
                    ctx.getRound(), dayNumber, date, theme, activities.size(), pool.size());

            drafts.add(new DayDraft(date, dayNumber, theme, activities));
        }
        return drafts;
    }

    /**
     * 路线优化 + 交通段 + 当天花费。交通段必须在重排之后计算。
     */
    private DayItinerary finishDay(DayDraft draft, BuildContext ctx) {
        List<ScheduledActivity> ordered = routeOptimizer.optimize(draft.getActivities(), ctx.getPlaceIndex());
        List<TravelSegment> segments = travelSegmentClassifier.segmentsFor(ordered, ctx.getFares());

        double activityCost = ordered.stream().mapToDouble(ScheduledActivity::getEstimatedCost).sum();
        double travelCost = segments.stream().mapToDouble(TravelSegment::getCost).sum();
        List<String> highlights = ordered.stream()
                .filter(a -> a.getActivityType() == ActivityType.SIGHTSEEING)
                .map(ScheduledActivity::getName)
                .limit(3)
                .collect(Collectors.toList());
        boolean weatherSensitive = ordered.stream()
                .map(a -> ctx.getPlaceIndex().get(a.getPlaceId()))
                .anyMatch(p -> p != null && p.isWeatherDependent());

        return DayItinerary.builder()
                .date(draft.getDate())
                .dayNumber(draft.getDayNumber())
                .theme(draft.getTheme())
                .activities(ordered)
                .travelSegments(segments)
                .totalEstimatedCost(activityCost + travelCost)
                .keyHighlights(highlights)
                .weatherNote(weatherSensitive ? "Some activities depend on the weather, check the forecast for "
                        + draft.getDate() + "." : null)
                .build();
    }

    private BuildState nextAfterValidation(BuildContext ctx, BudgetTracker tracker, OrchestratorResponse resp) {
        if (!tracker.isOverBudget()) {
            return BuildState.FINALIZE;
        }
        int maxRounds = Math.max(1, plannerProperties.getMaxReplanAttempts());
        if (ctx.getRound() < maxRounds) {
            return BuildState.REPLAN;
        }
        if (plannerProperties.getReplanExhaustedPolicy() == PlannerProperties.ReplanExhaustedPolicy.FAIL) {
            throw new ItineraryBuildException(BuildState.VALIDATE_BUDGET.name(), ErrorCode.BUDGET_NOT_SATISFIED,
                    maxRounds + " 轮构建后总花费 " + tracker.getTotalEstimatedCost()
                            + " 仍超出预算 " + ctx.getTrip().getBudget());
        }
        ctx.setDays(ctx.getCheapestDays());
        ctx.setBudgetTracker(ctx.getCheapestTracker());
        log.warn("{} 轮构建后仍超出预算，采用花费最低的第 {} 轮结果: total={}, budget={}",
                maxRounds, ctx.getCheapestRound(), ctx.getCheapestTracker().getTotalEstimatedCost(), ctx.getTrip().getBudget());
        resp.setReport(maxRounds + " 轮构建后仍超出预算，采用花费最低的第 " + ctx.getCheapestRound() + " 轮结果");
        return BuildState.FINALIZE;
    }

    private void rememberCheapest(BuildContext ctx, BudgetTracker tracker) {
        if (ctx.getCheapestTracker() == null
                || tracker.getTotalEstimatedCost() < ctx.getCheapestTracker().getTotalEstimatedCost()) {
            ctx.setCheapestTracker(tracker);
            ctx.setCheapestDays(ctx.getDays());
            ctx.setCheapestRound(ctx.getRound());
        }
    }

    private TripItinerary assemble(BuildContext ctx) {
        TripRequestDTO trip = ctx.getTrip();
        List<DayItinerary> days = ctx.getDays();
        return TripItinerary.builder()
                .destination(trip.getDestination())
                .startDate(trip.getStartDate())
                .endDate(trip.getEndDate())
                .totalDays(days.size())
                .dailyItineraries(days)
                .accommodation(ctx.getAccommodation())
                .totalEstimatedCost(ctx.getBudgetTracker().getTotalEstimatedCost())
                .budgetBreakdown(budgetValidator.breakdown(ctx.getAccommodation(), days, trip.getTravelers()))
                .withinBudget(!ctx.getBudgetTracker().isOverBudget())
                .replanRounds(ctx.getRound())
                .build();
    }

    private void fail(OrchestratorResponse resp, BuildContext ctx, String stage, Integer code, String message) {
        log.warn("行程构建失败: stage={}, code={}, message={}", stage, code, message);
        resp.setStatus("ERROR");
        resp.setFailedStage(stage);
        resp.setErrorCode(code);
        resp.setErrorMessage(message);
        resp.setFinalResult(null);
        metricsRecorder.recordItineraryBuild("error", stage, ctx.getRound());
    }

    private static Map<String, Place> indexById(List<Place> workingSet, List<Place> allPlaces) {
        Map<String, Place> index = new LinkedHashMap<>();
        workingSet.forEach(p -> index.putIfAbsent(p.getId(), p));
        allPlaces.forEach(p -> index.putIfAbsent(p.getId(), p));
        return index;
    }

    private static <T> List<T> nullSafe(List<T> list) {
        return list == null ? new ArrayList<>() : list;
    }

    private enum BuildState {
        VALIDATE_REQUEST,
        FILTER_PLACES,
        PLAN_THEMES,
        ALLOCATE_ACCOMMODATION,
        BUILD_SCHEDULES,
        OPTIMIZE_ROUTES,
        VALIDATE_BUDGET,
        REPLAN,
        FINALIZE,
        DONE,
        ERROR
    }

    @Data
    public static class OrchestratorResponse {
        private String status; // DONE | ERROR
        private String failedStage;
        private Integer errorCode;
        private String errorMessage;
        private List<ReplanRoundRecord> rounds;
        private TripItinerary finalResult;
        private String report;
    }

    @Data
    public static class ReplanRoundRecord {
        private final int round;
        private final double totalEstimatedCost;
        private final boolean overBudget;
    }

    @Data
    private static class DayDraft {
        private final LocalDate date;
        private final int dayNumber;
        private final String theme;
        private final List<ScheduledActivity> activities;
    }

    @Data
    private static class BuildContext {
        private ItineraryPlanRequestDTO request;
        private String stage;
        private TripRequestDTO trip;
        private List<Place> workingSet;
        private Map<String, Place> placeIndex;
        private List<String> themes;
        private Accommodation accommodation;
        private TravelSegmentOptions fares;
        private int round;
        private List<DayDraft> drafts;
        private List<DayItinerary> days;
        private BudgetTracker budgetTracker;
        private List<DayItinerary> cheapestDays;
        private BudgetTracker cheapestTracker;
        private int cheapestRound;
    }
}
