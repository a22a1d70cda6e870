package com.medsuy.appointmentservice.repository;

import com.medsuy.appointmentservice.dto.SlotSearchCriteria;
import com.medsuy.appointmentservice.model.Slot;
import com.medsuy.appointmentservice.model.SlotStatus;
import org.springframework.data.jpa.domain.Specification;

import java.time.LocalDateTime;

/**
 * Filters for the available-slots query. Absent criteria are ignored.
 */
public final class SlotSpecifications {

    private SlotSpecifications() {
    }

    public static Specification<Slot> claimable(SlotSearchCriteria criteria) {
        return Specification.where(isAvailable())
                .and(specialtyContains(criteria.getSpecialty()))
                .and(doctorIs(criteria.getDoctorId()))
                .and(branchIs(criteria.getBranchId()))
                .and(scheduledFrom(criteria.getFrom()))
                .and(scheduledUntil(criteria.getTo()));
    }

    static Specification<Slot> isAvailable() {
        return (root, query, cb) -> cb.and(
                cb.equal(root.get("status"), SlotStatus.AVAILABLE),
                cb.isNull(root.get("holderId")));
    }

    static Specification<Slot> specialtyContains(String specialty) {
        if (specialty == null || specialty.isBlank()) {
            return null;
        }
        String pattern = "%" + specialty.trim().toLowerCase() + "%";
        return (root, query, cb) -> cb.like(cb.lower(root.get("specialty")), pattern);
    }

    static Specification<Slot> doctorIs(Long doctorId) {
        return doctorId == null ? null : (root, query, cb) -> cb.equal(root.get("doctor").get("id"), doctorId);
    }

    static Specification<Slot> branchIs(Long branchId) {
        return branchId == null ? null : (root, query, cb) -> cb.equal(root.get("branch").get("id"), branchId);
    }

    static Specification<Slot> scheduledFrom(LocalDateTime from) {
        return from == null ? null : (root, query, cb) -> cb.greaterThanOrEqualTo(root.get("scheduledAt"), from);
    }

    static Specification<Slot> scheduledUntil(LocalDateTime to) {
        return to == null ? null : (root, query, cb) -> cb.lessThanOrEqualTo(root.get("scheduledAt"), to);
    }
}
