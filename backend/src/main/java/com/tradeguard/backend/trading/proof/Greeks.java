package com.tradeguard.backend.trading.proof;

public record Greeks(double delta, double theta, double vega) {

    public static final Greeks ZERO = new Greeks(0.0, 0.0, 0.0);

    public double get(String greek) {
        return switch (greek) {
            case "delta" -> delta;
            case "theta" -> theta;
            case "vega" -> vega;
            default -> throw new IllegalArgumentException("Unknown greek " + greek);
        };
    }
}
