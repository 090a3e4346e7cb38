package com.staybook.reservation.events;

import com.staybook.reservation.domain.model.Reservation;
import com.staybook.reservation.domain.model.ReconciliationConflictRecord;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.concurrent.CompletableFuture;

/**
 * Kafka publisher for reservation lifecycle events.
 *
 * Topics:
 * - reservation-confirmed
 * - reservation-cancelled
 * - reservation-expired
 * - reconciliation-conflict
 *
 * Sends are asynchronous; a failed send is logged and does not affect the state change
 * that triggered it.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ReservationEventPublisher {

    static final String TOPIC_RESERVATION_CONFIRMED = "reservation-confirmed";
    static final String TOPIC_RESERVATION_CANCELLED = "reservation-cancelled";
    static final String TOPIC_RESERVATION_EXPIRED = "reservation-expired";
    static final String TOPIC_RECONCILIATION_CONFLICT = "reconciliation-conflict";

    private final KafkaTemplate<String, Object> kafkaTemplate;
    private final Clock clock;

    public void publishReservationConfirmed(Reservation reservation, String paymentAttemptId) {
        ReservationConfirmedEvent event = ReservationConfirmedEvent.builder()
                .reservationId(reservation.getId())
                .guestId(reservation.getGuestId())
                .paymentAttemptId(paymentAttemptId)
                .checkIn(reservation.getCheckIn())
                .checkOut(reservation.getCheckOut())
                .guestCount(reservation.getGuestCount())
                .totalAmountCents(reservation.getTotalAmountCents())
                .timestamp(clock.instant())
                .build();

        publishEvent(TOPIC_RESERVATION_CONFIRMED, reservation.getId(), event);
    }

    public void publishReservationCancelled(Reservation reservation, Reservation.ReservationStatus previousStatus,
                                            long refundAmountCents, String reason) {
        ReservationCancelledEvent event = ReservationCancelledEvent.builder()
                .reservationId(reservation.getId())
                .guestId(reservation.getGuestId())
                .checkIn(reservation.getCheckIn())
                .checkOut(reservation.getCheckOut())
                .previousStatus(previousStatus.name())
                .refundAmountCents(refundAmountCents)
                .reason(reason)
                .timestamp(clock.instant())
                .build();

        publishEvent(TOPIC_RESERVATION_CANCELLED, reservation.getId(), event);
    }

    public void publishReservationExpired(Reservation reservation, int releasedCells) {
        ReservationExpiredEvent event = ReservationExpiredEvent.builder()
                .reservationId(reservation.getId())
                .guestId(reservation.getGuestId())
                .checkIn(reservation.getCheckIn())
                .checkOut(reservation.getCheckOut())
                .releasedCells(releasedCells)
                .timestamp(clock.instant())
                .build();

        publishEvent(TOPIC_RESERVATION_EXPIRED, reservation.getId(), event);
    }

    public void publishReconciliationConflict(ReconciliationConflictRecord conflict) {
        ReconciliationConflictEvent event = ReconciliationConflictEvent.builder()
                .conflictId(conflict.getId())
                .reservationId(conflict.getReservationId())
                .paymentAttemptId(conflict.getPaymentAttemptId())
                .externalSessionId(conflict.getExternalSessionId())
                .reason(conflict.getReason().name())
                .reservationStatus(conflict.getReservationStatus())
                .reportedAmountCents(conflict.getReportedAmountCents())
                .expectedAmountCents(conflict.getExpectedAmountCents())
                .timestamp(clock.instant())
                .build();

        publishEvent(TOPIC_RECONCILIATION_CONFLICT, conflict.getReservationId(), event);
    }

    private void publishEvent(String topic, String key, Object event) {
        log.info("Publishing event to topic {}: {}", topic, event);

        CompletableFuture<SendResult<String, Object>> future = kafkaTemplate.send(topic, key, event);

        future.whenComplete((result, ex) -> {
            if (ex == null) {
                log.info("Event published to topic {}: offset={}",
                        topic, result.getRecordMetadata().offset());
            } else {
                log.error("Failed to publish event to topic {}", topic, ex);
            }
        });
    }
}
