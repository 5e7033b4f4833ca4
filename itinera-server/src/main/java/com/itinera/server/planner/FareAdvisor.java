package com.itinera.server.planner;

import com.itinera.common.exception.ContentGenerationException;
import com.itinera.common.properties.PlannerProperties;
import com.itinera.pojo.dto.TravelSegmentOptions;
import com.itinera.pojo.dto.TripRequestDTO;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * 查询目的地的公共交通平均票价与出租车起步价；查询失败时使用配置中的静态值。
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class FareAdvisor {

    static final String CALL_SITE = "fare-lookup";

    private final ContentGenerationService contentGenerationService;
    private final GenerationRetryPolicy generationRetryPolicy;
    private final PlannerProperties plannerProperties;

    public TravelSegmentOptions lookup(TripRequestDTO trip) {
        String payload = "Estimate local transport prices in " + trip.getDestination()
                + " in the local currency of the trip budget. "
                + "averagePublicTransportFare is the price of one public transport ride, "
                + "baseTaxiFare is the taxi flag-fall price.";
        try {
            TravelSegmentOptions options = generationRetryPolicy.execute(CALL_SITE, () -> {
                TravelSegmentOptions o = contentGenerationService.generate(payload, TravelSegmentOptions.class);
                if (o.getAveragePublicTransportFare() < 0 || o.getBaseTaxiFare() < 0) {
                    throw new ContentGenerationException("票价不能为负数: " + o);
                }
                return o;
            });
            log.info("{} 交通票价: publicTransport={}, baseTaxi={}",
                    trip.getDestination(), options.getAveragePublicTransportFare(), options.getBaseTaxiFare());
            return options;
        } catch (ContentGenerationException e) {
            log.warn("{} 交通票价查询失败，使用默认值: {}", trip.getDestination(), e.getMessage());
            return defaults();
        }
    }

    TravelSegmentOptions defaults() {
        return new TravelSegmentOptions(plannerProperties.getDefaultPublicTransportFare(),
                plannerProperties.getDefaultBaseTaxiFare());
    }
}
