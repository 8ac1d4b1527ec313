package edu.kit.kastel.vads.flowchart.ir.node;

import java.util.Optional;

/// The fixed payloads of sentinel operation nodes. A marker executes nothing; it only gives an empty statement,
/// a convergence point or a loop exit a node of its own.
public enum Marker {
    EMPTY("/* empty */"),
    JOIN("/* join */"),
    AFTER_WHILE("/* after while */"),
    AFTER_FOR("/* after for */"),
    AFTER_REPEAT("/* after repeat */");

    private final String text;

    Marker(String text) {
        this.text = text;
    }

    public String text() {
        return this.text;
    }

    public static Optional<Marker> fromText(String text) {
        for (Marker marker : values()) {
            if (marker.text.equals(text)) {
                return Optional.of(marker);
            }
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return this.text;
    }
}
