package com.example.workflowsynth.domain;

/**
 * Canvas position of a node. Larger {@code x} means later in the visual flow.
 */
public record Position(double x, double y) {

    public static final Position ORIGIN = new Position(0, 0);

    public double distanceTo(Position other) {
        double dx = x - other.x;
        double dy = y - other.y;
        return Math.sqrt(dx * dx + dy * dy);
    }

    public Position translate(double dx, double dy) {
        return new Position(x + dx, y + dy);
    }
}
