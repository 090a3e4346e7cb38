package com.staybook.reservation.domain.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * One calendar night of the property. Only {@code AvailabilityLedger} writes these rows,
 * and only through the conditional updates of {@code DateCellRepository}.
 */
@Entity
@Table(name = "date_cells", indexes = {
        @Index(name = "idx_date_cells_holder", columnList = "holder_reservation_id")
})
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DateCell {

    @Id
    @Column(name = "cell_date", nullable = false)
    private LocalDate cellDate;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 16)
    private CellStatus status;

    @Column(name = "holder_reservation_id", length = 64)
    private String holderReservationId;

    @Column(name = "hold_expires_at")
    private LocalDateTime holdExpiresAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    /**
     * True when the cell blocks everyone except its holder at {@code now}.
     * A held cell whose hold has elapsed no longer blocks.
     */
    public boolean isBlocking(LocalDateTime now) {
        return switch (status) {
            case FREE -> false;
            case BOOKED -> true;
            case HELD -> holdExpiresAt == null || holdExpiresAt.isAfter(now);
        };
    }

    public boolean isHeldBy(String holderId) {
        return holderId != null && holderId.equals(holderReservationId);
    }

    public enum CellStatus {
        FREE,
        HELD,
        BOOKED
    }
}
