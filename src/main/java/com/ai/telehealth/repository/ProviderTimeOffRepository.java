package com.ai.telehealth.repository;

import com.ai.telehealth.entity.ProviderTimeOff;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;

@Repository
public interface ProviderTimeOffRepository extends JpaRepository<ProviderTimeOff, Long> {

    List<ProviderTimeOff> findByProviderIdOrderByStartTimeAsc(Long providerId);

    /**
     * Time-off rows sharing at least one instant with the closed window [from, to].
     */
    @Query("SELECT t FROM ProviderTimeOff t WHERE t.providerId = :providerId "
            + "AND t.startTime <= :to AND t.endTime >= :from ORDER BY t.startTime")
    List<ProviderTimeOff> findTouching(@Param("providerId") Long providerId,
                                       @Param("from") LocalDateTime from,
                                       @Param("to") LocalDateTime to);
}
