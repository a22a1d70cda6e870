package com.medsuy.appointmentservice.repository;

import com.medsuy.appointmentservice.model.Patient;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface PatientRepository extends JpaRepository<Patient, Long> {

    // inactive patients are treated as absent
    Optional<Patient> findByIdAndIsActiveTrue(Long id);
}
