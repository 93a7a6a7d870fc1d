package com.eduanalytics.infrastructure.persistence.repository;

import com.eduanalytics.domain.model.DepartmentSnapshot;
import com.eduanalytics.infrastructure.persistence.entity.DepartmentEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface DepartmentRepository extends JpaRepository<DepartmentEntity, Long> {

    Optional<DepartmentEntity> findByDepartmentCode(String departmentCode);

    boolean existsByDepartmentCode(String departmentCode);

    @Query("SELECT new com.eduanalytics.domain.model.DepartmentSnapshot(d.departmentId, d.departmentName) " +
           "FROM DepartmentEntity d ORDER BY d.departmentId ASC")
    List<DepartmentSnapshot> findSnapshots();
}
