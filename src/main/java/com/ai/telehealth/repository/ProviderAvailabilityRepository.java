package com.ai.telehealth.repository;

import com.ai.telehealth.entity.ProviderAvailability;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface ProviderAvailabilityRepository extends JpaRepository<ProviderAvailability, Long> {

    List<ProviderAvailability> findByProviderIdOrderByDayOfWeekAscStartTimeAsc(Long providerId);

    List<ProviderAvailability> findByProviderIdAndDayOfWeekAndEnabledTrueOrderByStartTimeAsc(Long providerId, int dayOfWeek);
}
