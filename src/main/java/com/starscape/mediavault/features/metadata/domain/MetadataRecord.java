package com.starscape.mediavault.features.metadata.domain;

import com.starscape.mediavault.common.domain.ValueObject;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDateTime;

/**
 * Metadata read from a media file. Every field is independently optional;
 * a null means "not present in the file", never "failed".
 *
 * <p>GPS coordinates are kept only as a valid pair (latitude in [-90, 90],
 * longitude in [-180, 180]); anything else drops the coordinates and altitude.
 * Coordinates are rounded to 6 decimal places (about 0.1 m), altitude to 2.
 */
public record MetadataRecord(
    Integer width,
    Integer height,
    Double durationSeconds,
    LocalDateTime dateTaken,
    Double gpsLatitude,
    Double gpsLongitude,
    Double gpsAltitude,
    String locationCity,
    String locationState,
    String locationCountry,
    String cameraMake,
    String cameraModel,
    String lensMake,
    String lensModel,
    Integer iso,
    String exposureTime,
    Double fNumber,
    Double focalLength,
    Integer focalLength35mm,
    String videoCodec,
    String keywords
) implements ValueObject {
    
    private static final MetadataRecord EMPTY = builder().build();
    
    public MetadataRecord {
        if (isValidCoordinate(gpsLatitude, 90) && isValidCoordinate(gpsLongitude, 180)) {
            gpsLatitude = round(gpsLatitude, 6);
            gpsLongitude = round(gpsLongitude, 6);
            gpsAltitude = gpsAltitude == null || !Double.isFinite(gpsAltitude) ? null : round(gpsAltitude, 2);
        } else {
            gpsLatitude = null;
            gpsLongitude = null;
            gpsAltitude = null;
        }
        if (width != null && width <= 0) {
            width = null;
        }
        if (height != null && height <= 0) {
            height = null;
        }
        if (durationSeconds != null && (!Double.isFinite(durationSeconds) || durationSeconds < 0)) {
            durationSeconds = null;
        }
        locationCity = blankToNull(locationCity);
        locationState = blankToNull(locationState);
        locationCountry = blankToNull(locationCountry);
        cameraMake = blankToNull(cameraMake);
        cameraModel = blankToNull(cameraModel);
        lensMake = blankToNull(lensMake);
        lensModel = blankToNull(lensModel);
        exposureTime = blankToNull(exposureTime);
        videoCodec = blankToNull(videoCodec);
        keywords = blankToNull(keywords);
    }
    
    public static MetadataRecord empty() {
        return EMPTY;
    }
    
    public static Builder builder() {
        return new Builder();
    }
    
    public boolean hasGps() {
        return gpsLatitude != null && gpsLongitude != null;
    }
    
    public boolean hasPlace() {
        return locationState != null && locationCountry != null;
    }
    
    /**
     * Field-wise merge: each field keeps this record's value unless it is null,
     * in which case the other record's value is used.
     */
    public MetadataRecord orElse(MetadataRecord other) {
        boolean ownGps = hasGps();
        return new MetadataRecord(
            pick(width, other.width),
            pick(height, other.height),
            pick(durationSeconds, other.durationSeconds),
            pick(dateTaken, other.dateTaken),
            ownGps ? gpsLatitude : other.gpsLatitude,
            ownGps ? gpsLongitude : other.gpsLongitude,
            ownGps ? gpsAltitude : other.gpsAltitude,
            pick(locationCity, other.locationCity),
            pick(locationState, other.locationState),
            pick(locationCountry, other.locationCountry),
            pick(cameraMake, other.cameraMake),
            pick(cameraModel, other.cameraModel),
            pick(lensMake, other.lensMake),
            pick(lensModel, other.lensModel),
            pick(iso, other.iso),
            pick(exposureTime, other.exposureTime),
            pick(fNumber, other.fNumber),
            pick(focalLength, other.focalLength),
            pick(focalLength35mm, other.focalLength35mm),
            pick(videoCodec, other.videoCodec),
            pick(keywords, other.keywords)
        );
    }
    
    public MetadataRecord withPlace(String city, String state, String country) {
        return toBuilder().locationCity(city).locationState(state).locationCountry(country).build();
    }
    
    public MetadataRecord withDateTaken(LocalDateTime value) {
        return toBuilder().dateTaken(value).build();
    }
    
    public Builder toBuilder() {
        return new Builder()
            .dimensions(width, height)
            .durationSeconds(durationSeconds)
            .dateTaken(dateTaken)
            .gps(gpsLatitude, gpsLongitude, gpsAltitude)
            .locationCity(locationCity)
            .locationState(locationState)
            .locationCountry(locationCountry)
            .cameraMake(cameraMake)
            .cameraModel(cameraModel)
            .lensMake(lensMake)
            .lensModel(lensModel)
            .iso(iso)
            .exposureTime(exposureTime)
            .fNumber(fNumber)
            .focalLength(focalLength)
            .focalLength35mm(focalLength35mm)
            .videoCodec(videoCodec)
            .keywords(keywords);
    }
    
    private static <T> T pick(T preferred, T fallback) {
        return preferred != null ? preferred : fallback;
    }
    
    private static boolean isValidCoordinate(Double value, double limit) {
        return value != null && Double.isFinite(value) && value >= -limit && value <= limit;
    }
    
    private static double round(double value, int scale) {
        return BigDecimal.valueOf(value).setScale(scale, RoundingMode.HALF_UP).doubleValue();
    }
    
    private static String blankToNull(String value) {
        if (value == null) {
            return null;
        }
        String cleaned = value.replace("\u0000", "").trim();
        return cleaned.isEmpty() ? null : cleaned;
    }
    
    public static final class Builder {
        
        private Integer width;
        private Integer height;
        private Double durationSeconds;
        private LocalDateTime dateTaken;
        private Double gpsLatitude;
        private Double gpsLongitude;
        private Double gpsAltitude;
        private String locationCity;
        private String locationState;
        private String locationCountry;
        private String cameraMake;
        private String cameraModel;
        private String lensMake;
        private String lensModel;
        private Integer iso;
        private String exposureTime;
        private Double fNumber;
        private Double focalLength;
        private Integer focalLength35mm;
        private String videoCodec;
        private String keywords;
        
        private Builder() {
        }
        
        public Builder dimensions(Integer width, Integer height) {
            this.width = width;
            this.height = height;
            return this;
        }
        
        public Builder durationSeconds(Double durationSeconds) {
            this.durationSeconds = durationSeconds;
            return this;
        }
        
        public Builder dateTaken(LocalDateTime dateTaken) {
            this.dateTaken = dateTaken;
            return this;
        }
        
        public Builder gps(Double latitude, Double longitude, Double altitude) {
            this.gpsLatitude = latitude;
            this.gpsLongitude = longitude;
            this.gpsAltitude = altitude;
            return this;
        }
        
        public Builder locationCity(String locationCity) {
            this.locationCity = locationCity;
            return this;
        }
        
        public Builder locationState(String locationState) {
            this.locationState = locationState;
            return this;
        }
        
        public Builder locationCountry(String locationCountry) {
            this.locationCountry = locationCountry;
            return this;
        }
        
        public Builder cameraMake(String cameraMake) {
            this.cameraMake = cameraMake;
            return this;
        }
        
        public Builder cameraModel(String cameraModel) {
            this.cameraModel = cameraModel;
            return this;
        }
        
        public Builder lensMake(String lensMake) {
            this.lensMake = lensMake;
            return this;
        }
        
        public Builder lensModel(String lensModel) {
            this.lensModel = lensModel;
            return this;
        }
        
        public Builder iso(Integer iso) {
            this.iso = iso;
            return this;
        }
        
        public Builder exposureTime(String exposureTime) {
            this.exposureTime = exposureTime;
            return this;
        }
        
        public Builder fNumber(Double fNumber) {
            this.fNumber = fNumber;
            return this;
        }
        
        public Builder focalLength(Double focalLength) {
            this.focalLength = focalLength;
            return this;
        }
        
        public Builder focalLength35mm(Integer focalLength35mm) {
            this.focalLength35mm = focalLength35mm;
            return this;
        }
        
        public Builder videoCodec(String videoCodec) {
            this.videoCodec = videoCodec;
            return this;
        }
        
        public Builder keywords(String keywords) {
            this.keywords = keywords;
            return this;
        }
        
        public MetadataRecord build() {
            return new MetadataRecord(width, height, durationSeconds, dateTaken,
                gpsLatitude, gpsLongitude, gpsAltitude,
                locationCity, locationState, locationCountry,
                cameraMake, cameraModel, lensMake, lensModel,
                iso, exposureTime, fNumber, focalLength, focalLength35mm,
                videoCodec, keywords);
        }
    }
}
