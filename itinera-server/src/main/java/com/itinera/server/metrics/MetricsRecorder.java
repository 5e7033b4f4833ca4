package com.itinera.server.metrics;

import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * 统一的业务指标记录器。
 *
 * 说明：
 * - 使用 Micrometer 的 MeterRegistry 记录 Counter / Timer / Summary；
 * - 指标记录失败只打 debug 日志，不影响行程构建；
 * - 指标命名按「itinera.模块.动作」，便于在监控面板上聚合。
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class MetricsRecorder {

    private final MeterRegistry meterRegistry;

    /**
     * 记录 AI Chat 调用结果（成功/失败/配置缺失等）。
     */
    public void recordAiChatCall(String outcome, String reason, String model) {
        try {
            meterRegistry.counter("itinera.ai.chat.call",
                    "outcome", safe(outcome),
                    "reason", safe(reason),
                    "model", safe(model)).increment();
        } catch (Exception e) {
            log.debug("记录 AI 调用指标失败: {}", e.getMessage());
        }
    }

    /**
     * 记录 AI Chat 调用耗时。
     */
    public void recordAiChatLatencyMs(long latencyMs, String outcome, String model) {
        try {
            meterRegistry.timer("itinera.ai.chat.latency",
                    "outcome", safe(outcome),
                    "model", safe(model))
                    .record(latencyMs, TimeUnit.MILLISECONDS);
        } catch (Exception e) {
            log.debug("记录 AI 耗时指标失败: {}", e.getMessage());
        }
    }

    /**
     * 记录结构化生成的单次失败（之后会按策略重试）。
     *
     * @param callSite 调用点，例如 day-schedule、daily-themes、fare-lookup
     */
    public void recordGenerationFailure(String callSite) {
        try {
            meterRegistry.counter("itinera.generation.failure", "callSite", safe(callSite)).increment();
        } catch (Exception e) {
            log.debug("记录生成失败指标失败: {}", e.getMessage());
        }
    }

    /**
     * 记录被丢弃的日程条目（placeId 无法解析、重复、活动日期不符等）。
     */
    public void recordDroppedScheduleEntry(String reason) {
        try {
            meterRegistry.counter("itinera.schedule.entry.dropped", "reason", safe(reason)).increment();
        } catch (Exception e) {
            log.debug("记录日程条目丢弃指标失败: {}", e.getMessage());
        }
    }

    /**
     * 记录一次行程构建的最终结果以及用了几轮。
     *
     * @param outcome within_budget / best_effort / error
     * @param stage   失败阶段，成功时传 FINALIZE
     */
    public void recordItineraryBuild(String outcome, String stage, int rounds) {
        try {
            meterRegistry.counter("itinera.itinerary.build",
                    "outcome", safe(outcome),
                    "stage", safe(stage)).increment();
            meterRegistry.summary("itinera.itinerary.build.rounds").record(rounds);
        } catch (Exception e) {
            log.debug("记录行程构建指标失败: {}", e.getMessage());
        }
    }

    /**
     * 记录一次因超预算触发的重排。
     */
    public void recordReplan() {
        try {
            meterRegistry.counter("itinera.itinerary.replan").increment();
        } catch (Exception e) {
            log.debug("记录重排指标失败: {}", e.getMessage());
        }
    }

    /**
     * 记录幂等结果缓存的命中/未命中。
     */
    public void recordResultCacheHit(boolean hit) {
        try {
            String outcome = hit ? "hit" : "miss";
            meterRegistry.counter("itinera.itinerary.result_cache", "outcome", outcome).increment();
        } catch (Exception e) {
            log.debug("记录缓存命中指标失败: {}", e.getMessage());
        }
    }

    private String safe(String s) {
        if (s == null || s.isBlank()) {
            return "unknown";
        }
        // tag 不宜过长，避免高基数
        return s.length() > 32 ? s.substring(0, 32) : s;
    }
}
