package com.cppmodel.generator.diagnostics;

import java.util.ArrayList;
import java.util.List;

import lombok.Getter;

/**
 * Errors and warnings accumulated while loading and parsing recorded units.
 *
 * Pure structure only: no logging, no IO.
 */
@Getter
public class ToolDiagnostics {
    private final List<String> errors = new ArrayList<>();
    private final List<String> warnings = new ArrayList<>();

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    public void error(String source, String message) {
        errors.add(source + ": " + message);
    }

    public void warning(String source, String message) {
        warnings.add(source + ": " + message);
    }
}
