package com.bubblegrade.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Named regions of the printed answer sheet template.
 */
public enum RegionName {

    OMR("omr"),
    NOMBRE("nombre"),
    CURP("curp");

    private final String key;

    RegionName(String key) {
        this.key = key;
    }

    @JsonValue
    public String key() {
        return key;
    }
}
