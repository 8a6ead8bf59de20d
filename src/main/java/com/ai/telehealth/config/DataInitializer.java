package com.ai.telehealth.config;

import com.ai.telehealth.entity.Patient;
import com.ai.telehealth.entity.Provider;
import com.ai.telehealth.entity.ProviderAvailability;
import com.ai.telehealth.repository.PatientRepository;
import com.ai.telehealth.repository.ProviderAvailabilityRepository;
import com.ai.telehealth.repository.ProviderRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalTime;
import java.util.List;

/**
 * Idempotent seeder: inserts demo providers, patients and weekday availability
 * when they are missing. Safe to re-run.
 */
@Component
@ConditionalOnProperty(name = "telehealth.seed.enabled", havingValue = "true")
public class DataInitializer {

    private static final Logger log = LoggerFactory.getLogger(DataInitializer.class);

    private final ProviderRepository providerRepository;
    private final PatientRepository patientRepository;
    private final ProviderAvailabilityRepository availabilityRepository;

    public DataInitializer(ProviderRepository providerRepository,
                           PatientRepository patientRepository,
                           ProviderAvailabilityRepository availabilityRepository) {
        this.providerRepository = providerRepository;
        this.patientRepository = patientRepository;
        this.availabilityRepository = availabilityRepository;
    }

    @EventListener(ApplicationReadyEvent.class)
    @Transactional
    public void seed() {
        List<Provider> providers = providerRepository.findByActiveTrueOrderByLastName();
        if (providers.isEmpty()) {
            log.info("Seeding providers...");
            providers = List.of(
                    providerRepository.save(Provider.builder().firstName("Sarah").lastName("Johnson").email("sarah.johnson@example.com").specialization("General Practice").build()),
                    providerRepository.save(Provider.builder().firstName("Michael").lastName("Chen").email("michael.chen@example.com").specialization("Cardiology").build()),
                    providerRepository.save(Provider.builder().firstName("Emily").lastName("Davis").email("emily.davis@example.com").specialization("Pediatrics").build())
            );
        }

        if (patientRepository.count() == 0) {
            log.info("Seeding patients...");
            patientRepository.save(Patient.builder().firstName("John").lastName("Smith").email("john.smith@example.com").phone("+15550100").build());
            patientRepository.save(Patient.builder().firstName("Maria").lastName("Garcia").email("maria.garcia@example.com").phone("+15550101").build());
        }

        for (Provider p : providers) {
            if (availabilityRepository.findByProviderIdOrderByDayOfWeekAscStartTimeAsc(p.getId()).isEmpty()) {
                // Monday (0) to Friday (4)
                for (int day = 0; day <= 4; day++) {
                    availabilityRepository.save(ProviderAvailability.builder().providerId(p.getId()).dayOfWeek(day).startTime(LocalTime.of(9, 0)).endTime(LocalTime.of(13, 0)).build());
                    availabilityRepository.save(ProviderAvailability.builder().providerId(p.getId()).dayOfWeek(day).startTime(LocalTime.of(14, 0)).endTime(LocalTime.of(18, 0)).build());
                }
                log.info("Added availability for Dr. {} {}", p.getFirstName(), p.getLastName());
            }
        }
        log.info("DataInitializer: providers={}, patients={}", providers.size(), patientRepository.count());
    }
}
