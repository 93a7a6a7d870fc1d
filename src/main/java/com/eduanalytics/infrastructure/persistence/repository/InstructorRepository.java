package com.eduanalytics.infrastructure.persistence.repository;

import com.eduanalytics.infrastructure.persistence.entity.InstructorEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface InstructorRepository extends JpaRepository<InstructorEntity, Long> {

    Optional<InstructorEntity> findByInstructorNumber(String instructorNumber);

    boolean existsByInstructorNumber(String instructorNumber);

    boolean existsByEmail(String email);
}
