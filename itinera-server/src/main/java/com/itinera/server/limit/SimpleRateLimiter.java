package com.itinera.server.limit;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * 基于 Redis 的固定窗口计数限流。
 *
 * 说明：
 * - 行程构建会多次调用外部生成服务，成本高，按客户端地址做简单防刷；
 * - 调用方决定限流维度（例如 IP），达到上限返回 false，由接口层返回「请求过于频繁」；
 * - Redis 不可用时放行，限流不应影响主流程。
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SimpleRateLimiter {

    private static final String PREFIX = "itinera:rl:";

    private final StringRedisTemplate stringRedisTemplate;

    /**
     * @param bizKey       业务前缀，例如 itinerary:plan:ip
     * @param identify     限流维度标识，如 IP 地址
     * @param windowSecond 时间窗口（秒）
     * @param maxCount     窗口内允许的最大次数
     * @return true 表示允许本次请求
     */
    public boolean tryAcquire(String bizKey, String identify, long windowSecond, long maxCount) {
        String key = PREFIX + bizKey + ":" + (identify == null ? "unknown" : identify);
        Long count;
        try {
            count = stringRedisTemplate.opsForValue().increment(key);
            if (count != null && count == 1L) {
                stringRedisTemplate.expire(key, windowSecond, TimeUnit.SECONDS);
            }
        } catch (Exception e) {
            log.warn("限流计数失败，放行本次请求: key={}, error={}", key, e.getMessage());
            return true;
        }
        if (count == null) {
            return true;
        }
        boolean allowed = count <= maxCount;
        if (!allowed) {
            log.warn("限流触发: bizKey={}, identify={}, windowSecond={}, maxCount={}, current={}",
                    bizKey, identify, windowSecond, maxCount, count);
        }
        return allowed;
    }
}
