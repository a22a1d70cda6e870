package com.medsuy.appointmentservice.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

import java.time.LocalDateTime;

/**
 * A bookable appointment: time, branch, room and doctor.
 *
 * Rows are created by the scheduling side in AVAILABLE state. Only
 * {@link #reserveFor(Long)} and {@link #release()} change status and holder, and they
 * always change both together: {@code status == RESERVED} iff {@code holderId != null}.
 */
@Entity
@Table(name = "slots", indexes = {
        @Index(name = "idx_slot_status_scheduled", columnList = "status,scheduled_at"),
        @Index(name = "idx_slot_holder", columnList = "holder_id")
})
@Getter
@Setter
@ToString(onlyExplicitlyIncluded = true)
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Slot {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @ToString.Include
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "branch_id", nullable = false, updatable = false)
    private Branch branch;

    @Column(nullable = false, updatable = false)
    private String room;

    @Column(updatable = false)
    private String specialty;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "doctor_id", nullable = false, updatable = false)
    private Doctor doctor;

    @Column(name = "scheduled_at", nullable = false, updatable = false)
    private LocalDateTime scheduledAt;

    @Builder.Default
    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    @ToString.Include
    private SlotStatus status = SlotStatus.AVAILABLE;

    @Column(name = "holder_id")
    @ToString.Include
    private Long holderId;

    public boolean isClaimable() {
        return status == SlotStatus.AVAILABLE && holderId == null;
    }

    public boolean isHeldBy(Long requesterId) {
        return holderId != null && holderId.equals(requesterId);
    }

    public void reserveFor(Long requesterId) {
        this.status = SlotStatus.RESERVED;
        this.holderId = requesterId;
    }

    public void release() {
        this.status = SlotStatus.AVAILABLE;
        this.holderId = null;
    }
}
