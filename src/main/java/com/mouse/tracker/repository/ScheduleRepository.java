package com.mouse.tracker.repository;

import com.mouse.tracker.entity.Schedule;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface ScheduleRepository extends JpaRepository<Schedule, String> {

    /**
     * Schedules the dispatcher considers on every tick
     */
    List<Schedule> findByEnabledTrue();
}
