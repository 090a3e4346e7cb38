package com.staybook.reservation.domain.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDateTime;

/**
 * Written once per distinct gateway event key or client request key. The row is
 * inserted before the effect is applied and completed afterwards, in the same
 * transaction, so a replay observes either nothing or the finished outcome.
 */
@Entity
@Table(name = "idempotency_records")
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IdempotencyRecord {

    @Id
    @Column(name = "idempotency_key", length = 255)
    private String idempotencyKey;

    @Enumerated(EnumType.STRING)
    @Column(name = "record_type", nullable = false, length = 16)
    private RecordType recordType;

    @Column(name = "reservation_id", length = 32)
    private String reservationId;

    @Column(name = "outcome", length = 32)
    private String outcome;

    @Column(name = "resulting_reservation_status", length = 16)
    private String resultingReservationStatus;

    @Column(name = "response_json", columnDefinition = "TEXT")
    private String responseJson;

    @Column(name = "processed_at", nullable = false)
    private LocalDateTime processedAt;

    public boolean isCompleted() {
        return outcome != null;
    }

    public enum RecordType {
        EVENT,
        COMMAND
    }
}
