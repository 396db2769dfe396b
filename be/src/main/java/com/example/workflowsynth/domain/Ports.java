package com.example.workflowsynth.domain;

/**
 * Output port indexes.
 */
public final class Ports {

    public static final int SUCCESS = 0;
    public static final int ERROR = 1;

    private Ports() {
    }
}
