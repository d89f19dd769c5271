package com.formdb.index.infrastructure.index.temporal;

record SeriesKey(String database, String seriesId) {

    @Override
    public String toString() {
        return database + "/" + seriesId;
    }
}
