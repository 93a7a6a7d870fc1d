package com.eduanalytics.infrastructure.persistence.repository;

import com.eduanalytics.domain.model.GroupCount;
import com.eduanalytics.domain.model.StatusCount;
import com.eduanalytics.domain.model.StudentStatus;
import com.eduanalytics.infrastructure.persistence.entity.StudentEntity;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

@Repository
public interface StudentRepository extends JpaRepository<StudentEntity, Long> {

    Optional<StudentEntity> findByStudentNumber(String studentNumber);

    boolean existsByStudentNumber(String studentNumber);

    boolean existsByEmail(String email);

    boolean existsByEmailAndStudentIdNot(String email, Long studentId);

    /**
     * Paginated search. search must already be lower-cased and wrapped in wildcards.
     */
    @Query("SELECT s FROM StudentEntity s WHERE " +
           "(:search IS NULL OR LOWER(s.firstName) LIKE :search " +
           "   OR LOWER(s.lastName) LIKE :search " +
           "   OR LOWER(s.email) LIKE :search " +
           "   OR LOWER(s.studentNumber) LIKE :search) AND " +
           "(:status IS NULL OR s.status = :status) AND " +
           "(:major IS NULL OR s.major = :major)")
    Page<StudentEntity> search(
            @Param("search") String search,
            @Param("status") StudentStatus status,
            @Param("major") String major,
            Pageable pageable
    );

    /**
     * Student population per status. departmentId narrows it to the students affiliated
     * with that department through their major.
     */
    @Query("SELECT new com.eduanalytics.domain.model.StatusCount(s.status, COUNT(s)) " +
           "FROM StudentEntity s WHERE " +
           "(:departmentId IS NULL OR " + DepartmentAffiliation.MAJOR_IN_GIVEN_DEPARTMENT + ") " +
           "GROUP BY s.status")
    List<StatusCount> countByStatus(@Param("departmentId") Long departmentId);

    @Query("SELECT COUNT(s) FROM StudentEntity s WHERE " +
           "s.enrollmentDate IS NOT NULL AND " +
           "(:startDate IS NULL OR s.enrollmentDate >= :startDate) AND " +
           "(:endDate IS NULL OR s.enrollmentDate <= :endDate) AND " +
           "(:departmentId IS NULL OR " + DepartmentAffiliation.MAJOR_IN_GIVEN_DEPARTMENT + ")")
    long countEnrolledBetween(
            @Param("departmentId") Long departmentId,
            @Param("startDate") LocalDate startDate,
            @Param("endDate") LocalDate endDate
    );

    @Query("SELECT new com.eduanalytics.domain.model.GroupCount(d.departmentId, COUNT(s)) " +
           "FROM StudentEntity s, DepartmentEntity d WHERE " +
           DepartmentAffiliation.MAJOR_IN_DEPARTMENT + " " +
           "GROUP BY d.departmentId")
    List<GroupCount> countByDepartment();
}
