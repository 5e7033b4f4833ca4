package com.itinera.server.utils;

import com.itinera.pojo.entity.Coordinates;

/**
 * 球面距离计算（haversine）。
 * Great-circle distance between two coordinates.
 */
public final class GeoDistance {

    /**
     * 地球半径（公里）。
     */
    public static final double EARTH_RADIUS_KM = 6371.2;

    private GeoDistance() {
    }

    /**
     * 两点间的大圆距离（公里），对称，同一点为 0。
     */
    public static double distanceKm(Coordinates a, Coordinates b) {
        double lat1 = Math.toRadians(a.getLatitude());
        double lat2 = Math.toRadians(b.getLatitude());
        double dLat = lat2 - lat1;
        double dLon = Math.toRadians(b.getLongitude() - a.getLongitude());

        double h = hav(dLat) + Math.cos(lat1) * Math.cos(lat2) * hav(dLon);
        // 浮点误差可能让 h 略大于 1
        h = Math.min(1.0, Math.max(0.0, h));
        return 2 * EARTH_RADIUS_KM * Math.asin(Math.sqrt(h));
    }

    private static double hav(double theta) {
        double s = Math.sin(theta / 2);
        return s * s;
    }
}
