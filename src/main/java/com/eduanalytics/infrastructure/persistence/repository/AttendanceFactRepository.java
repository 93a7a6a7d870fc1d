package com.eduanalytics.infrastructure.persistence.repository;

import com.eduanalytics.infrastructure.persistence.entity.AttendanceFactEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface AttendanceFactRepository extends JpaRepository<AttendanceFactEntity, Long> {
}
