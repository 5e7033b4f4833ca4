package com.itinera.pojo.dto;

import lombok.Data;

/**
 * 行程规划请求体：行程参数 + 候选地点。
 * Request body for itinerary planning.
 */
@Data
public class ItineraryPlanRequestDTO {

    private TripRequestDTO trip;

    private DestinationReportDTO destinationReport;
}
