package com.staybook.reservation.domain.model;

public enum PaymentOutcome {
    SUCCEEDED,
    FAILED
}
