package com.itinera.server.cache;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.itinera.common.constant.RedisConstants;
import com.itinera.pojo.vo.ItineraryPlanVO;
import com.itinera.server.metrics.MetricsRecorder;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.concurrent.TimeUnit;

/**
 * 行程规划结果的幂等缓存：同一个 Idempotency-Key 在 TTL 内直接返回上次的成功结果，不再重新构建。
 * 只缓存成功结果；读写失败只记日志，不影响主流程。
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ItineraryResultCache {

    private final StringRedisTemplate stringRedisTemplate;
    private final ObjectMapper objectMapper;
    private final MetricsRecorder metricsRecorder;

    public ItineraryPlanVO load(String idempotencyKey) {
        if (!StringUtils.hasText(idempotencyKey)) {
            return null;
        }
        try {
            String json = stringRedisTemplate.opsForValue().get(RedisConstants.ITINERARY_IDEMPOTENT_KEY + idempotencyKey);
            if (!StringUtils.hasText(json)) {
                metricsRecorder.recordResultCacheHit(false);
                return null;
            }
            metricsRecorder.recordResultCacheHit(true);
            return objectMapper.readValue(json, ItineraryPlanVO.class);
        } catch (Exception e) {
            log.warn("读取行程幂等结果失败, key={}", idempotencyKey, e);
            return null;
        }
    }

    public void save(String idempotencyKey, ItineraryPlanVO vo) {
        if (!StringUtils.hasText(idempotencyKey) || vo == null) {
            return;
        }
        try {
            stringRedisTemplate.opsForValue().set(RedisConstants.ITINERARY_IDEMPOTENT_KEY + idempotencyKey,
                    objectMapper.writeValueAsString(vo),
                    RedisConstants.ITINERARY_IDEMPOTENT_TTL, TimeUnit.MINUTES);
        } catch (Exception e) {
            log.warn("写入行程幂等结果失败, key={}", idempotencyKey, e);
        }
    }
}
