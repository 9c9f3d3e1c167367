package com.mouse.tracker.repository;

import com.mouse.tracker.entity.CapturedExchange;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface CapturedExchangeRepository extends JpaRepository<CapturedExchange, String> {

    long countByScheduleId(String scheduleId);

    /**
     * Oldest first; used to evict rows once a schedule exceeds its cap
     */
    List<CapturedExchange> findByScheduleIdOrderByCapturedAtAscInsertionSequenceAsc(String scheduleId, Pageable pageable);

    @Query("SELECT MAX(e.insertionSequence) FROM CapturedExchange e")
    Long findMaxInsertionSequence();

    List<CapturedExchange> findByScheduleIdOrderByCapturedAtDesc(String scheduleId);
}
