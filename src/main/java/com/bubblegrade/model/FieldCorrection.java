package com.bubblegrade.model;

/**
 * Reviewer supplied replacement values. A {@code null} field is left as it is.
 */
public record FieldCorrection(String nombre, String curp) {

    public boolean isEmpty() {
        return nombre == null && curp == null;
    }
}
