package com.itinera.server.controller.user;

import com.itinera.common.constant.RedisConstants;
import com.itinera.common.result.ErrorCode;
import com.itinera.common.result.Result;
import com.itinera.pojo.dto.ItineraryPlanRequestDTO;
import com.itinera.pojo.entity.TripItinerary;
import com.itinera.pojo.vo.ItineraryPlanVO;
import com.itinera.server.cache.ItineraryResultCache;
import com.itinera.server.limit.SimpleRateLimiter;
import com.itinera.server.planner.ItineraryOrchestrator;
import com.itinera.server.planner.ItineraryOrchestrator.OrchestratorResponse;
import com.itinera.server.planner.ItineraryOrchestrator.ReplanRoundRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import javax.servlet.http.HttpServletRequest;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * ItineraryController 单元测试：限流、幂等缓存、失败映射与成功结果组装。
 */
@ExtendWith(MockitoExtension.class)
class ItineraryControllerTest {

    private static final String IP = "10.0.0.1";

    @Mock
    private ItineraryOrchestrator itineraryOrchestrator;

    @Mock
    private ItineraryResultCache itineraryResultCache;

    @Mock
    private SimpleRateLimiter simpleRateLimiter;

    @Mock
    private HttpServletRequest httpRequest;

    @InjectMocks
    private ItineraryController controller;

    private final ItineraryPlanRequestDTO dto = new ItineraryPlanRequestDTO();

    @BeforeEach
    void setUp() {
        when(httpRequest.getRemoteAddr()).thenReturn(IP);
    }

    @Test
    void rejectsWhenRateLimited() {
        givenRateLimit(false);

        Result<ItineraryPlanVO> result = controller.plan(dto, "k1", httpRequest);

        assertEquals(ErrorCode.TOO_MANY_REQUESTS.getCode(), result.getCode());
        verify(itineraryOrchestrator, never()).run(any());
    }

    @Test
    void returnsCachedResultWithoutRebuilding() {
        givenRateLimit(true);
        ItineraryPlanVO cached = new ItineraryPlanVO();
        when(itineraryResultCache.load("k1")).thenReturn(cached);

        Result<ItineraryPlanVO> result = controller.plan(dto, "k1", httpRequest);

        assertTrue(result.isSuccess());
        assertSame(cached, result.getData());
        verify(itineraryOrchestrator, never()).run(any());
    }

    @Test
    void mapsBuildFailureToErrorResult() {
        givenRateLimit(true);
        OrchestratorResponse resp = new OrchestratorResponse();
        resp.setStatus("ERROR");
        resp.setFailedStage("ALLOCATE_ACCOMMODATION");
        resp.setErrorCode(ErrorCode.NO_ACCOMMODATION.getCode());
        resp.setErrorMessage(ErrorCode.NO_ACCOMMODATION.getMsg());
        when(itineraryOrchestrator.run(dto)).thenReturn(resp);

        Result<ItineraryPlanVO> result = controller.plan(dto, null, httpRequest);

        assertFalse(result.isSuccess());
        assertEquals(ErrorCode.NO_ACCOMMODATION.getCode(), result.getCode());
        assertTrue(result.getMsg().contains("stage=ALLOCATE_ACCOMMODATION"));
        verify(itineraryResultCache, never()).save(any(), any());
    }

    @Test
    void wrapsSuccessfulBuildAndCachesIt() {
        givenRateLimit(true);
        TripItinerary itinerary = TripItinerary.builder().destination("Rome").totalDays(3).withinBudget(true).build();
        OrchestratorResponse resp = new OrchestratorResponse();
        resp.setStatus("DONE");
        resp.setFinalResult(itinerary);
        resp.setRounds(List.of(new ReplanRoundRecord(1, 1200.0, true), new ReplanRoundRecord(2, 800.0, false)));
        resp.setReport("第 2 轮构建满足预算");
        when(itineraryOrchestrator.run(dto)).thenReturn(resp);

        Result<ItineraryPlanVO> result = controller.plan(dto, "k1", httpRequest);

        assertTrue(result.isSuccess());
        ItineraryPlanVO vo = result.getData();
        assertSame(itinerary, vo.getItinerary());
        assertEquals(2, vo.getRounds().size());
        assertTrue(vo.getRounds().get(0).isOverBudget());
        assertEquals(800.0, vo.getRounds().get(1).getTotalEstimatedCost(), 1e-9);
        verify(itineraryResultCache).save("k1", vo);
    }

    private void givenRateLimit(boolean allowed) {
        when(simpleRateLimiter.tryAcquire(eq(RedisConstants.PLAN_RATE_LIMIT_BIZ_KEY), eq(IP),
                eq(RedisConstants.PLAN_RATE_LIMIT_WINDOW_SECONDS), eq(RedisConstants.PLAN_RATE_LIMIT_MAX_COUNT)))
                .thenReturn(allowed);
    }
}
