package com.RK8.FieldReport.Service;

import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Encodes a coordinate into India Post's 10-character DIGIPIN, formatted as
 * {@code XXX-XXX-XXXX}. Each character narrows the bounding box to one cell of a
 * 4x4 grid; rows count down from the northern edge.
 */
@Component
public class DigipinEncoder {

    private static final char[][] GRID = {
            {'F', 'C', '9', '8'},
            {'J', '3', '2', '7'},
            {'K', '4', '5', '6'},
            {'L', 'M', 'P', 'T'}
    };

    private static final double MIN_LAT = 2.5;
    private static final double MAX_LAT = 38.5;
    private static final double MIN_LON = 63.5;
    private static final double MAX_LON = 99.5;
    private static final int LENGTH = 10;

    public Optional<String> encode(Double latitude, Double longitude) {
        if (latitude == null || longitude == null) return Optional.empty();
        double lat = latitude;
        double lon = longitude;
        if (lat < MIN_LAT || lat > MAX_LAT || lon < MIN_LON || lon > MAX_LON) {
            return Optional.empty();
        }

        double minLat = MIN_LAT;
        double maxLat = MAX_LAT;
        double minLon = MIN_LON;
        double maxLon = MAX_LON;
        StringBuilder code = new StringBuilder(LENGTH + 2);

        for (int level = 0; level < LENGTH; level++) {
            double latDiv = (maxLat - minLat) / 4;
            double lonDiv = (maxLon - minLon) / 4;

            int col = (int) Math.floor((lon - minLon) / lonDiv);
            int row = 3 - (int) Math.floor((lat - minLat) / latDiv);
            row = Math.max(0, Math.min(row, 3));
            col = Math.max(0, Math.min(col, 3));

            if (level == 3 || level == 6) code.append('-');
            code.append(GRID[row][col]);

            double newMaxLat = minLat + latDiv * (4 - row);
            double newMinLat = minLat + latDiv * (3 - row);
            double newMinLon = minLon + lonDiv * col;
            double newMaxLon = newMinLon + lonDiv;

            minLat = newMinLat;
            maxLat = newMaxLat;
            minLon = newMinLon;
            maxLon = newMaxLon;
        }
        return Optional.of(code.toString());
    }
}
