package com.vulnscan.backend.dto;

public record DeliveryResult(Long webhookId, Status status, Integer httpStatus, String error) {

    public enum Status {
        DELIVERED,
        FAILED
    }

    public static DeliveryResult delivered(Long webhookId, int httpStatus) {
        return new DeliveryResult(webhookId, Status.DELIVERED, httpStatus, null);
    }

    public static DeliveryResult failed(Long webhookId, Integer httpStatus, String error) {
        return new DeliveryResult(webhookId, Status.FAILED, httpStatus, error);
    }

    public boolean isDelivered() {
        return status == Status.DELIVERED;
    }
}
