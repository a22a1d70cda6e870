package com.medsuy.appointmentservice.service;

import com.medsuy.appointmentservice.config.ReservationProperties;
import com.medsuy.appointmentservice.dto.AppointmentResponse;
import com.medsuy.appointmentservice.dto.AvailableSlotResponse;
import com.medsuy.appointmentservice.dto.SlotSearchCriteria;
import com.medsuy.appointmentservice.event.AppointmentReservedEvent;
import com.medsuy.appointmentservice.exception.RequesterNotFoundException;
import com.medsuy.appointmentservice.exception.SlotLockTimeoutException;
import com.medsuy.appointmentservice.exception.SlotNotFoundException;
import com.medsuy.appointmentservice.exception.SlotUnavailableException;
import com.medsuy.appointmentservice.mapper.SlotMapper;
import com.medsuy.appointmentservice.model.Patient;
import com.medsuy.appointmentservice.model.Slot;
import com.medsuy.appointmentservice.model.SlotStatus;
import com.medsuy.appointmentservice.repository.PatientRepository;
import com.medsuy.appointmentservice.repository.SlotRepository;
import com.medsuy.appointmentservice.repository.SlotSpecifications;
import com.medsuy.common.exception.AccessDeniedException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.dao.PessimisticLockingFailureException;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

@Service
@RequiredArgsConstructor
@Slf4j
public class AppointmentServiceImpl implements AppointmentService {

    private final SlotRepository slotRepository;
    private final PatientRepository patientRepository;
    private final SlotMapper slotMapper;
    private final ApplicationEventPublisher eventPublisher;
    private final ReservationProperties reservationProperties;
    private final Clock clock;

    @Override
    @Transactional(readOnly = true)
    public List<AvailableSlotResponse> findAvailable(SlotSearchCriteria criteria) {
        List<Slot> slots = slotRepository.findAll(
                SlotSpecifications.claimable(criteria),
                Sort.by(Sort.Direction.ASC, "scheduledAt"));

        log.debug("Found {} available slots for criteria={}", slots.size(), criteria);
        return slots.stream().map(slotMapper::toAvailableSlotResponse).toList();
    }

    @Override
    @Transactional(readOnly = true)
    public List<AppointmentResponse> findUpcoming(Long requesterId) {
        getActivePatient(requesterId);

        return slotRepository
                .findByHolderIdAndStatusAndScheduledAtGreaterThanEqualOrderByScheduledAtAsc(
                        requesterId, SlotStatus.RESERVED, LocalDateTime.now(clock))
                .stream()
                .map(slotMapper::toAppointmentResponse)
                .toList();
    }

    @Override
    @Transactional
    public Long claim(Long requesterId, Long slotId) {
        log.info("Claim requested: requesterId={}, slotId={}", requesterId, slotId);

        Patient patient = getActivePatient(requesterId);

        // Row lock makes the check-then-act below atomic
        Slot slot = lockSlot(slotId);

        if (!slot.isClaimable()) {
            log.info("Claim rejected, slot no longer available: slotId={}, status={}, requesterId={}",
                    slotId, slot.getStatus(), requesterId);
            throw new SlotUnavailableException(slotId);
        }

        slot.reserveFor(requesterId);
        slotRepository.save(slot);

        // Delivered to RabbitMQ only after this transaction commits
        eventPublisher.publishEvent(AppointmentReservedEvent.builder()
                .eventId(UUID.randomUUID())
                .requesterId(requesterId)
                .slotId(slot.getId())
                .doctor(slot.getDoctor().getFullName())
                .specialty(slot.getSpecialty())
                .scheduledAt(slot.getScheduledAt())
                .branch(slot.getBranch().getName())
                .destinationAddress(patient.getEmail())
                .occurredAt(Instant.now(clock))
                .build());

        log.info("Slot reserved: slotId={}, requesterId={}", slotId, requesterId);
        return slot.getId();
    }

    @Override
    @Transactional
    public void release(Long requesterId, Long slotId) {
        log.info("Release requested: requesterId={}, slotId={}", requesterId, slotId);

        getActivePatient(requesterId);

        Slot slot = lockSlot(slotId);

        if (!slot.isHeldBy(requesterId)) {
            log.warn("Release rejected, requester is not the holder: slotId={}, requesterId={}",
                    slotId, requesterId);
            throw new AccessDeniedException("You can only cancel your own appointments");
        }

        slot.release();
        slotRepository.save(slot);

        // TODO: publish an appointment.cancelled event once the confirmation email for
        // cancellations is agreed with the clinic
        log.info("Slot released: slotId={}, requesterId={}", slotId, requesterId);
    }

    private Patient getActivePatient(Long requesterId) {
        return patientRepository.findByIdAndIsActiveTrue(requesterId)
                .orElseThrow(() -> new RequesterNotFoundException(requesterId));
    }

    /**
     * SELECT ... FOR UPDATE bounded by the transaction-local lock_timeout.
     */
    private Slot lockSlot(Long slotId) {
        try {
            slotRepository.applyLockTimeout(reservationProperties.getLockTimeout().toMillis() + "ms");
            return slotRepository.findByIdWithLock(slotId)
                    .orElseThrow(() -> new SlotNotFoundException(slotId));
        } catch (PessimisticLockingFailureException e) {
            log.warn("Lock wait exceeded {} for slotId={}", reservationProperties.getLockTimeout(), slotId);
            throw new SlotLockTimeoutException(slotId, e);
        }
    }
}
