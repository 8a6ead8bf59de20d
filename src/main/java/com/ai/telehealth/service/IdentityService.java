package com.ai.telehealth.service;

import com.ai.telehealth.dto.ParticipantProfile;
import com.ai.telehealth.entity.Patient;
import com.ai.telehealth.entity.Provider;
import com.ai.telehealth.exception.ResourceNotFoundException;
import com.ai.telehealth.repository.PatientRepository;
import com.ai.telehealth.repository.ProviderRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Resolves patient and provider references to names and contact addresses.
 */
@Service
@RequiredArgsConstructor
public class IdentityService {

    private final PatientRepository patientRepository;
    private final ProviderRepository providerRepository;

    @Transactional(readOnly = true)
    public ParticipantProfile patient(Long patientId) {
        Patient p = patientRepository.findById(patientId)
                .orElseThrow(() -> new ResourceNotFoundException("Patient", patientId));
        return new ParticipantProfile(p.getId(), p.getFirstName(), p.getLastName(), p.getEmail());
    }

    @Transactional(readOnly = true)
    public ParticipantProfile provider(Long providerId) {
        Provider p = providerRepository.findById(providerId)
                .orElseThrow(() -> new ResourceNotFoundException("Provider", providerId));
        return new ParticipantProfile(p.getId(), p.getFirstName(), p.getLastName(), p.getEmail());
    }

    public void requirePatient(Long patientId) {
        if (patientId == null || !patientRepository.existsById(patientId)) {
            throw new ResourceNotFoundException("Patient", patientId);
        }
    }

    public void requireProvider(Long providerId) {
        if (providerId == null || !providerRepository.existsById(providerId)) {
            throw new ResourceNotFoundException("Provider", providerId);
        }
    }
}
