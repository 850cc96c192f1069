package com.foo.extract.service;

/** One entry of a run's history: what was attempted and how it went. */
public record ExtractAction(String name, boolean success, String message) {

    public static ExtractAction succeeded(String name, String message) {
        return new ExtractAction(name, true, message);
    }

    public static ExtractAction failed(String name, String message) {
        return new ExtractAction(name, false, message);
    }

    @Override
    public String toString() {
        return "%s [%s] %s".formatted(name, success ? "OK" : "FAILED", message);
    }
}
