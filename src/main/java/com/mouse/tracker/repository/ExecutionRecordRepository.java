package com.mouse.tracker.repository;

import com.mouse.tracker.entity.ExecutionRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface ExecutionRecordRepository extends JpaRepository<ExecutionRecord, String> {

    /**
     * Records whose firing never finished (endTime still null)
     */
    List<ExecutionRecord> findByEndTimeIsNull();

    @Query("SELECT COUNT(e) FROM ExecutionRecord e WHERE e.endTime IS NOT NULL AND e.success = true")
    long countSuccessful();

    @Query("SELECT COUNT(e) FROM ExecutionRecord e WHERE e.endTime IS NOT NULL AND e.success = false")
    long countFailed();
}
