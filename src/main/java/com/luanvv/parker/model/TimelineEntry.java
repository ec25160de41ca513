package com.luanvv.parker.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

public record TimelineEntry(String label, String date) {
    public static final String NOT_AVAILABLE = "N/A";

    public static TimelineEntry missing(String label) {
        return new TimelineEntry(label, NOT_AVAILABLE);
    }

    @JsonIgnore
    public boolean isPresent() {
        return !NOT_AVAILABLE.equals(date);
    }
}
