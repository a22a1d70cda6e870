package com.medsuy.appointmentservice;

import com.medsuy.appointmentservice.model.Branch;
import com.medsuy.appointmentservice.model.Doctor;
import com.medsuy.appointmentservice.model.Patient;
import com.medsuy.appointmentservice.model.Slot;
import com.medsuy.appointmentservice.repository.BranchRepository;
import com.medsuy.appointmentservice.repository.DoctorRepository;
import com.medsuy.appointmentservice.repository.OutboxRepository;
import com.medsuy.appointmentservice.repository.PatientRepository;
import com.medsuy.appointmentservice.repository.SlotRepository;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.DockerClientFactory;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.containers.RabbitMQContainer;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.time.LocalDateTime;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
@Testcontainers(disabledWithoutDocker = true)
@ActiveProfiles("test") // picks up application-test.yml
public abstract class AbstractIntegrationTest {

    static final PostgreSQLContainer<?> POSTGRES = new PostgreSQLContainer<>("postgres:15-alpine");

    static final RabbitMQContainer RABBIT = new RabbitMQContainer("rabbitmq:3.11-management-alpine");

    static {
        // Without Docker the subclasses are skipped, don't fail class init
        if (DockerClientFactory.instance().isDockerAvailable()) {
            POSTGRES.start();
            RABBIT.start();
        }
    }

    @Autowired
    protected SlotRepository slotRepository;
    @Autowired
    protected PatientRepository patientRepository;
    @Autowired
    protected DoctorRepository doctorRepository;
    @Autowired
    protected BranchRepository branchRepository;
    @Autowired
    protected OutboxRepository outboxRepository;

    // inject container urls while the spring context starts
    @DynamicPropertySource
    static void dynamicProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", POSTGRES::getJdbcUrl);
        registry.add("spring.datasource.username", POSTGRES::getUsername);
        registry.add("spring.datasource.password", POSTGRES::getPassword);

        registry.add("spring.rabbitmq.host", RABBIT::getHost);
        registry.add("spring.rabbitmq.port", RABBIT::getAmqpPort);
        registry.add("spring.rabbitmq.username", RABBIT::getAdminUsername);
        registry.add("spring.rabbitmq.password", RABBIT::getAdminPassword);
    }

    protected Patient createPatient(String email) {
        return patientRepository.save(Patient.builder()
                .firstName("Ana")
                .lastName("Pereira")
                .email(email)
                .build());
    }

    protected Slot createAvailableSlot(LocalDateTime scheduledAt) {
        Doctor doctor = doctorRepository.save(Doctor.builder().firstName("Laura").lastName("Gomez").build());
        Branch branch = branchRepository.save(Branch.builder().name("Centro").build());
        return slotRepository.save(Slot.builder()
                .doctor(doctor)
                .branch(branch)
                .room("101")
                .specialty("Cardiología")
                .scheduledAt(scheduledAt)
                .build());
    }

    protected void clearDatabase() {
        outboxRepository.deleteAll();
        slotRepository.deleteAll();
        patientRepository.deleteAll();
        doctorRepository.deleteAll();
        branchRepository.deleteAll();
    }
}
