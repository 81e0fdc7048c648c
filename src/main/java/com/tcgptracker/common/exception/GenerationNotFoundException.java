package com.tcgptracker.common.exception;

/**
 * Thrown when a generation is not found by name.
 */
public class GenerationNotFoundException extends TrackerException {

    public GenerationNotFoundException(String name) {
        super("Generation not found: " + name);
    }
}
