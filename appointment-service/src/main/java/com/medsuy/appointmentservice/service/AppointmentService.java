package com.medsuy.appointmentservice.service;

import com.medsuy.appointmentservice.dto.AppointmentResponse;
import com.medsuy.appointmentservice.dto.AvailableSlotResponse;
import com.medsuy.appointmentservice.dto.SlotSearchCriteria;

import java.util.List;

public interface AppointmentService {

    /**
     * Lists slots that can currently be claimed, ordered by scheduled time.
     * Read-only, takes no locks.
     */
    List<AvailableSlotResponse> findAvailable(SlotSearchCriteria criteria);

    /**
     * Lists the requester's reserved slots that have not started yet.
     *
     * @throws com.medsuy.appointmentservice.exception.RequesterNotFoundException
     */
    List<AppointmentResponse> findUpcoming(Long requesterId);

    /**
     * Reserves a slot for the requester. The slot row is locked for the whole check
     * and update, so two concurrent claims on one slot are serialized and only the
     * first can succeed. One appointment.reserved event is published after commit.
     *
     * @return the claimed slot id
     * @throws com.medsuy.appointmentservice.exception.RequesterNotFoundException requester absent or inactive
     * @throws com.medsuy.appointmentservice.exception.SlotNotFoundException       no such slot
     * @throws com.medsuy.appointmentservice.exception.SlotUnavailableException    slot already reserved
     * @throws com.medsuy.appointmentservice.exception.SlotLockTimeoutException    lock wait exceeded, retryable
     */
    Long claim(Long requesterId, Long slotId);

    /**
     * Returns a slot reserved by the requester to the available pool.
     * No event is published.
     *
     * @throws com.medsuy.appointmentservice.exception.RequesterNotFoundException requester absent or inactive
     * @throws com.medsuy.appointmentservice.exception.SlotNotFoundException       no such slot
     * @throws com.medsuy.common.exception.AccessDeniedException                   requester is not the holder
     * @throws com.medsuy.appointmentservice.exception.SlotLockTimeoutException    lock wait exceeded, retryable
     */
    void release(Long requesterId, Long slotId);
}
