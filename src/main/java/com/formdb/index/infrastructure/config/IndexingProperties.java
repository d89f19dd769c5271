package com.formdb.index.infrastructure.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Tuning for the spatial and temporal indexes
 */
@Component
@ConfigurationProperties(prefix = "formdb.index")
public class IndexingProperties {

    private int spatialMaxEntries = 10;
    private int spatialMinEntries = 4;
    private boolean rebuildOnMissing = true;

    public int getSpatialMaxEntries() {
        return spatialMaxEntries;
    }

    public void setSpatialMaxEntries(int spatialMaxEntries) {
        this.spatialMaxEntries = spatialMaxEntries;
    }

    public int getSpatialMinEntries() {
        return spatialMinEntries;
    }

    public void setSpatialMinEntries(int spatialMinEntries) {
        this.spatialMinEntries = spatialMinEntries;
    }

    public boolean isRebuildOnMissing() {
        return rebuildOnMissing;
    }

    public void setRebuildOnMissing(boolean rebuildOnMissing) {
        this.rebuildOnMissing = rebuildOnMissing;
    }
}
