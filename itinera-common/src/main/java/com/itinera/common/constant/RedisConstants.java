package com.itinera.common.constant;

public class RedisConstants {

    private RedisConstants() {
    }

    /** 行程规划幂等结果前缀 itinerary:idemp:plan:key */
    public static final String ITINERARY_IDEMPOTENT_KEY = "itinerary:idemp:plan:";

    /** 幂等结果 TTL（分钟） */
    public static final long ITINERARY_IDEMPOTENT_TTL = 10L;

    /** 行程规划接口限流业务前缀（按客户端 IP） */
    public static final String PLAN_RATE_LIMIT_BIZ_KEY = "itinerary:plan:ip";

    /** 限流窗口（秒） */
    public static final long PLAN_RATE_LIMIT_WINDOW_SECONDS = 60L;

    /** 窗口内允许的最大请求数 */
    public static final long PLAN_RATE_LIMIT_MAX_COUNT = 10L;
}
