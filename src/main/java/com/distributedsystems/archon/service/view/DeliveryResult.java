package com.distributedsystems.archon.service.view;

public record DeliveryResult(String entryId, String operation, String status, int attempts, String error) {
}
