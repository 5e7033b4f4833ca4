package com.itinera.server.planner;

import com.itinera.common.exception.InvalidTripRequestException;
import com.itinera.pojo.dto.DestinationReportDTO;
import com.itinera.pojo.dto.ItineraryPlanRequestDTO;
import com.itinera.pojo.dto.TripRequestDTO;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.time.Clock;
import java.time.LocalDate;

/**
 * 构建开始前的请求校验，任何一项不满足都抛 {@link InvalidTripRequestException}。
 */
@Component
@RequiredArgsConstructor
public class TripRequestValidator {

    private final Clock clock;

    public void validate(ItineraryPlanRequestDTO request) {
        if (request == null || request.getTrip() == null) {
            throw new InvalidTripRequestException("行程参数不能为空");
        }
        validate(request.getTrip());
        DestinationReportDTO report = request.getDestinationReport();
        if (report == null) {
            throw new InvalidTripRequestException("候选地点不能为空");
        }
    }

    public void validate(TripRequestDTO trip) {
        if (!StringUtils.hasText(trip.getDestination())) {
            throw new InvalidTripRequestException("目的地不能为空");
        }
        if (trip.getStartDate() == null || trip.getEndDate() == null) {
            throw new InvalidTripRequestException("开始日期和结束日期不能为空");
        }
        if (!trip.getStartDate().isBefore(trip.getEndDate())) {
            throw new InvalidTripRequestException("开始日期必须早于结束日期");
        }
        if (trip.getEndDate().isBefore(LocalDate.now(clock))) {
            throw new InvalidTripRequestException("结束日期不能早于今天");
        }
        if (trip.getBudget() == null || trip.getBudget() <= 0) {
            throw new InvalidTripRequestException("预算必须大于 0");
        }
        if (trip.getTravelers() == null || trip.getTravelers() <= 0) {
            throw new InvalidTripRequestException("出行人数必须大于 0");
        }
        if (trip.getGroupType() == null) {
            throw new InvalidTripRequestException("出行人群类型不能为空");
        }
        if (trip.getInterests() == null || trip.getInterests().stream().noneMatch(StringUtils::hasText)) {
            throw new InvalidTripRequestException("至少需要一个兴趣关键词");
        }
    }
}
