package com.itinera.server.controller.user;

import com.itinera.common.constant.RedisConstants;
import com.itinera.common.result.ErrorCode;
import com.itinera.common.result.Result;
import com.itinera.pojo.dto.ItineraryPlanRequestDTO;
import com.itinera.pojo.vo.ItineraryPlanVO;
import com.itinera.pojo.vo.ReplanRoundVO;
import com.itinera.server.cache.ItineraryResultCache;
import com.itinera.server.limit.SimpleRateLimiter;
import com.itinera.server.planner.ItineraryOrchestrator;
import com.itinera.server.planner.ItineraryOrchestrator.OrchestratorResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import javax.servlet.http.HttpServletRequest;
import java.util.stream.Collectors;

@RestController
@RequestMapping("/user/itinerary")
@RequiredArgsConstructor
@Slf4j
public class ItineraryController {

    private final ItineraryOrchestrator itineraryOrchestrator;
    private final ItineraryResultCache itineraryResultCache;
    private final SimpleRateLimiter simpleRateLimiter;

    /**
     * 根据行程参数与候选地点生成逐日行程。
     * 带 Idempotency-Key 时，10 分钟内重复请求直接返回上次的成功结果。
     */
    @PostMapping("/plan")
    public Result<ItineraryPlanVO> plan(@RequestBody ItineraryPlanRequestDTO dto,
                                        @RequestHeader(value = "Idempotency-Key", required = false) String idempotencyKey,
                                        HttpServletRequest request) {
        boolean allowed = simpleRateLimiter.tryAcquire(RedisConstants.PLAN_RATE_LIMIT_BIZ_KEY,
                request.getRemoteAddr(),
                RedisConstants.PLAN_RATE_LIMIT_WINDOW_SECONDS,
                RedisConstants.PLAN_RATE_LIMIT_MAX_COUNT);
        if (!allowed) {
            return Result.error(ErrorCode.TOO_MANY_REQUESTS);
        }

        ItineraryPlanVO cached = itineraryResultCache.load(idempotencyKey);
        if (cached != null) {
            log.info("命中行程幂等缓存, key={}", idempotencyKey);
            return Result.success(cached);
        }

        OrchestratorResponse resp = itineraryOrchestrator.run(dto);
        if (!"DONE".equals(resp.getStatus()) || resp.getFinalResult() == null) {
            int code = resp.getErrorCode() == null ? ErrorCode.ITINERARY_BUILD_FAILED.getCode() : resp.getErrorCode();
            return Result.error(code, resp.getErrorMessage() + " (stage=" + resp.getFailedStage() + ")");
        }

        ItineraryPlanVO vo = new ItineraryPlanVO();
        vo.setItinerary(resp.getFinalResult());
        vo.setRounds(resp.getRounds().stream()
                .map(r -> new ReplanRoundVO(r.getRound(), r.getTotalEstimatedCost(), r.isOverBudget()))
                .collect(Collectors.toList()));
        vo.setReport(resp.getReport());
        itineraryResultCache.save(idempotencyKey, vo);
        return Result.success(vo);
    }
}
