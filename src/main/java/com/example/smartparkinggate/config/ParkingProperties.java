package com.example.smartparkinggate.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "parking")
public class ParkingProperties {

    private String lotId = "lot1";
    private int maxSpots = 30;
    private boolean debugMode = true;
    private String occupancyTable = "ParkingLot";
    private String sessionsTable = "ParkingLogs";
    private final Images images = new Images();
    private final Recognition recognition = new Recognition();
    private final Metrics metrics = new Metrics();

    public String getLotId() {
        return lotId;
    }

    public void setLotId(String lotId) {
        this.lotId = lotId;
    }

    public int getMaxSpots() {
        return maxSpots;
    }

    public void setMaxSpots(int maxSpots) {
        this.maxSpots = maxSpots;
    }

    public boolean isDebugMode() {
        return debugMode;
    }

    public void setDebugMode(boolean debugMode) {
        this.debugMode = debugMode;
    }

    public String getOccupancyTable() {
        return occupancyTable;
    }

    public void setOccupancyTable(String occupancyTable) {
        this.occupancyTable = occupancyTable;
    }

    public String getSessionsTable() {
        return sessionsTable;
    }

    public void setSessionsTable(String sessionsTable) {
        this.sessionsTable = sessionsTable;
    }

    public Images getImages() {
        return images;
    }

    public Recognition getRecognition() {
        return recognition;
    }

    public Metrics getMetrics() {
        return metrics;
    }

    public static class Images {

        private String bucket = "parking-lot-images-cpc357";
        private String region = "ap-southeast-1";
        private String directory = "./captures";

        public String getBucket() {
            return bucket;
        }

        public void setBucket(String bucket) {
            this.bucket = bucket;
        }

        public String getRegion() {
            return region;
        }

        public void setRegion(String region) {
            this.region = region;
        }

        public String getDirectory() {
            return directory;
        }

        public void setDirectory(String directory) {
            this.directory = directory;
        }
    }

    public static class Recognition {

        /**
         * Exclusive lower bound on a text line's confidence, on Tesseract's 0-100 scale.
         */
        private double confidenceThreshold = 70.0;

        /**
         * Directory holding {@code <language>.traineddata}. When unset the
         * {@code TESSDATA_PREFIX} environment variable is tried, then the
         * tessdata bundled with tess4j.
         */
        private String tessdataPath;
        private String language = "eng";

        public double getConfidenceThreshold() {
            return confidenceThreshold;
        }

        public void setConfidenceThreshold(double confidenceThreshold) {
            this.confidenceThreshold = confidenceThreshold;
        }

        public String getTessdataPath() {
            return tessdataPath;
        }

        public void setTessdataPath(String tessdataPath) {
            this.tessdataPath = tessdataPath;
        }

        public String getLanguage() {
            return language;
        }

        public void setLanguage(String language) {
            this.language = language;
        }
    }

    public static class Metrics {

        private String namespace = "SmartParking";

        public String getNamespace() {
            return namespace;
        }

        public void setNamespace(String namespace) {
            this.namespace = namespace;
        }
    }
}
