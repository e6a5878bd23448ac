package com.ai.leasing.integration;

public record DeliveryResult(Outcome outcome, String providerId, String error) {

    public enum Outcome {
        SUCCESS,
        TRANSIENT_FAILURE,
        PERMANENT_FAILURE
    }

    public static DeliveryResult success(String providerId) {
        return new DeliveryResult(Outcome.SUCCESS, providerId, null);
    }

    public static DeliveryResult transientFailure(String error) {
        return new DeliveryResult(Outcome.TRANSIENT_FAILURE, null, error);
    }

    public static DeliveryResult permanentFailure(String error) {
        return new DeliveryResult(Outcome.PERMANENT_FAILURE, null, error);
    }
}
