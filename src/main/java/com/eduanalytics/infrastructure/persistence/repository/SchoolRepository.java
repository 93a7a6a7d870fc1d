package com.eduanalytics.infrastructure.persistence.repository;

import com.eduanalytics.infrastructure.persistence.entity.SchoolEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface SchoolRepository extends JpaRepository<SchoolEntity, Long> {

    boolean existsBySchoolCode(String schoolCode);
}
