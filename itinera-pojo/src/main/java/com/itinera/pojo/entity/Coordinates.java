package com.itinera.pojo.entity;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * 经纬度坐标（十进制度数），不可变。
 * Latitude/longitude in decimal degrees, immutable.
 */
@Getter
@EqualsAndHashCode
@ToString
public class Coordinates {

    private final double latitude;

    private final double longitude;

    @JsonCreator
    public Coordinates(@JsonProperty("latitude") double latitude,
                       @JsonProperty("longitude") double longitude) {
        if (latitude < -90.0 || latitude > 90.0) {
            throw new IllegalArgumentException("latitude must be between -90 and 90, got " + latitude);
        }
        if (longitude < -180.0 || longitude > 180.0) {
            throw new IllegalArgumentException("longitude must be between -180 and 180, got " + longitude);
        }
        this.latitude = latitude;
        this.longitude = longitude;
    }

    public static Coordinates of(double latitude, double longitude) {
        return new Coordinates(latitude, longitude);
    }

    /**
     * "lat,lon" 形式，便于拼接到提示词或日志中。
     */
    public String toLatLonString() {
        return latitude + "," + longitude;
    }
}
