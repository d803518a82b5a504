package com.bubblegrade.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * The three regions of interest of one sheet. A region set is always complete: detection
 * failures degrade to a fallback layout instead of dropping a region.
 */
public final class RegionSet {

    private final Map<RegionName, RegionBoundingBox> regions;

    public RegionSet(RegionBoundingBox omr, RegionBoundingBox nombre, RegionBoundingBox curp) {
        EnumMap<RegionName, RegionBoundingBox> map = new EnumMap<>(RegionName.class);
        map.put(RegionName.OMR, Objects.requireNonNull(omr, "omr"));
        map.put(RegionName.NOMBRE, Objects.requireNonNull(nombre, "nombre"));
        map.put(RegionName.CURP, Objects.requireNonNull(curp, "curp"));
        this.regions = Collections.unmodifiableMap(map);
    }

    public RegionBoundingBox get(RegionName name) {
        return regions.get(name);
    }

    @JsonProperty("omr")
    public RegionBoundingBox omr() {
        return regions.get(RegionName.OMR);
    }

    @JsonProperty("nombre")
    public RegionBoundingBox nombre() {
        return regions.get(RegionName.NOMBRE);
    }

    @JsonProperty("curp")
    public RegionBoundingBox curp() {
        return regions.get(RegionName.CURP);
    }

    @JsonIgnore
    public Map<RegionName, RegionBoundingBox> asMap() {
        return regions;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof RegionSet that)) {
            return false;
        }
        return regions.equals(that.regions);
    }

    @Override
    public int hashCode() {
        return regions.hashCode();
    }

    @Override
    public String toString() {
        return "RegionSet" + regions;
    }
}
