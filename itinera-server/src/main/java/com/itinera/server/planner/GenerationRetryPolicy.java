package com.itinera.server.planner;

import com.itinera.common.exception.ContentGenerationException;
import com.itinera.common.properties.PlannerProperties;
import com.itinera.server.metrics.MetricsRecorder;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.function.Supplier;

/**
 * 结构化生成调用的固定次数重试。
 * <p>只对 {@link ContentGenerationException} 重试；调用方可在 supplier 内对结果做校验，
 * 校验不通过时抛出同一异常以触发下一次尝试。</p>
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class GenerationRetryPolicy {

    private final PlannerProperties plannerProperties;
    private final MetricsRecorder metricsRecorder;

    public <T> T execute(String callSite, Supplier<T> call) {
        int maxAttempts = Math.max(1, plannerProperties.getGenerationMaxAttempts());
        ContentGenerationException last = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                return call.get();
            } catch (ContentGenerationException e) {
                last = e;
                metricsRecorder.recordGenerationFailure(callSite);
                log.warn("结构化生成失败: callSite={}, attempt={}/{}, reason={}",
                        callSite, attempt, maxAttempts, e.getMessage());
            }
        }
        throw new ContentGenerationException(
                callSite + " 在 " + maxAttempts + " 次尝试后仍未得到可用结果", last);
    }
}
