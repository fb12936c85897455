package com.sentimento.live.model;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/** The hope/sorrow scalar pair carried by every live event. Both values lie in {@code [0.0, 1.0]}. */
@JsonPropertyOrder({"hope", "sorrow"})
public record Composites(double hope, double sorrow) {

    public static final double MIN = 0.0d;
    public static final double MAX = 1.0d;

    public Composites {
        if (!inRange(hope)) {
            throw new IllegalArgumentException("composites.hope out of range: " + hope);
        }
        if (!inRange(sorrow)) {
            throw new IllegalArgumentException("composites.sorrow out of range: " + sorrow);
        }
    }

    public static boolean inRange(double value) {
        return !Double.isNaN(value) && value >= MIN && value <= MAX;
    }
}
