package io.github.jakubt4.gwaihir.model;

public record EnvironmentRequirements(boolean indoorSafe, boolean outdoorCapable, String recommendedSpace) {
}
