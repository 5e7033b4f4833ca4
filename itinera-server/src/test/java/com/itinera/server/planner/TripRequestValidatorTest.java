package com.itinera.server.planner;

import com.itinera.common.exception.InvalidTripRequestException;
import com.itinera.common.result.ErrorCode;
import com.itinera.pojo.dto.DestinationReportDTO;
import com.itinera.pojo.dto.ItineraryPlanRequestDTO;
import com.itinera.pojo.dto.TripRequestDTO;
import com.itinera.pojo.entity.GroupType;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Arrays;
import java.util.List;

import static com.itinera.server.planner.PlannerFixtures.START;
import static com.itinera.server.planner.PlannerFixtures.trip;
import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class TripRequestValidatorTest {

    /**
     * 固定「今天」为 2030-04-01。
     */
    private final Clock clock = Clock.fixed(Instant.parse("2030-04-01T10:00:00Z"), ZoneOffset.UTC);
    private final TripRequestValidator validator = new TripRequestValidator(clock);

    @Test
    void acceptsWellFormedRequest() {
        assertDoesNotThrow(() -> validator.validate(request(trip(3, 900, 2, GroupType.COUPLE, "art"))));
    }

    @Test
    void rejectsStartNotBeforeEnd() {
        TripRequestDTO sameDay = trip(1, 900, 2, GroupType.COUPLE, "art");
        InvalidTripRequestException ex = assertThrows(InvalidTripRequestException.class, () -> validator.validate(sameDay));
        assertEquals(ErrorCode.TRIP_INVALID_REQUEST.getCode(), ex.getCode());

        TripRequestDTO reversed = trip(3, 900, 2, GroupType.COUPLE, "art");
        reversed.setEndDate(START.minusDays(1));
        assertThrows(InvalidTripRequestException.class, () -> validator.validate(reversed));
    }

    @Test
    void rejectsTripThatAlreadyEnded() {
        TripRequestDTO past = trip(3, 900, 2, GroupType.COUPLE, "art");
        past.setStartDate(START.minusYears(1));
        past.setEndDate(START.minusYears(1).plusDays(2));
        assertThrows(InvalidTripRequestException.class, () -> validator.validate(past));
    }

    @Test
    void rejectsNonPositiveBudgetOrTravelers() {
        assertThrows(InvalidTripRequestException.class,
                () -> validator.validate(trip(3, 0, 2, GroupType.COUPLE, "art")));
        assertThrows(InvalidTripRequestException.class,
                () -> validator.validate(trip(3, 900, 0, GroupType.COUPLE, "art")));
    }

    @Test
    void rejectsMissingInterestsDestinationOrGroupType() {
        TripRequestDTO noInterests = trip(3, 900, 2, GroupType.COUPLE);
        assertThrows(InvalidTripRequestException.class, () -> validator.validate(noInterests));

        TripRequestDTO blankInterests = trip(3, 900, 2, GroupType.COUPLE);
        blankInterests.setInterests(Arrays.asList(" ", null));
        assertThrows(InvalidTripRequestException.class, () -> validator.validate(blankInterests));

        TripRequestDTO noDestination = trip(3, 900, 2, GroupType.COUPLE, "art");
        noDestination.setDestination(" ");
        assertThrows(InvalidTripRequestException.class, () -> validator.validate(noDestination));

        TripRequestDTO noGroup = trip(3, 900, 2, null, "art");
        assertThrows(InvalidTripRequestException.class, () -> validator.validate(noGroup));
    }

    @Test
    void rejectsMissingTripOrReport() {
        assertThrows(InvalidTripRequestException.class, () -> validator.validate((ItineraryPlanRequestDTO) null));

        ItineraryPlanRequestDTO noReport = new ItineraryPlanRequestDTO();
        noReport.setTrip(trip(3, 900, 2, GroupType.COUPLE, "art"));
        assertThrows(InvalidTripRequestException.class, () -> validator.validate(noReport));
    }

    private static ItineraryPlanRequestDTO request(TripRequestDTO trip) {
        ItineraryPlanRequestDTO request = new ItineraryPlanRequestDTO();
        request.setTrip(trip);
        request.setDestinationReport(new DestinationReportDTO());
        return request;
    }
}
