package com.itinera.common.properties;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.LocalTime;

/**
 * 行程构建引擎配置。
 * Itinerary planner configuration.
 */
@Data
@ConfigurationProperties(prefix = "itinera.planner")
public class PlannerProperties {

    /**
     * 构建轮数上限（含首轮）。超预算时最多重排到这个轮数。
     * Upper bound of schedule-build rounds, the first one included.
     */
    private int maxReplanAttempts = 5;

    /**
     * 轮数耗尽仍超预算时的处理策略。
     */
    private ReplanExhaustedPolicy replanExhaustedPolicy = ReplanExhaustedPolicy.BEST_EFFORT;

    /**
     * 单个结构化生成调用的最大尝试次数（含首次）。
     */
    private int generationMaxAttempts = 3;

    /**
     * 公共交通平均票价的静态兜底值。
     */
    private double defaultPublicTransportFare = 2.5;

    /**
     * 出租车起步价的静态兜底值。
     */
    private double defaultBaseTaxiFare = 1.5;

    /**
     * 剩余可用地点少于该值时，重新开放全部工作集供后续天使用。
     */
    private int poolReplenishThreshold = 6;

    /**
     * 内容生成服务给出的时间不可用时，一天默认的开始时间。
     */
    private LocalTime dayStartTime = LocalTime.of(9, 0);

    public enum ReplanExhaustedPolicy {
        /** 采用所有轮次中总花费最低的一版，并标记为超预算 */
        BEST_EFFORT,
        /** 直接失败 */
        FAIL
    }
}
