package com.eduanalytics.infrastructure.persistence.repository;

import com.eduanalytics.domain.model.CourseLevel;
import com.eduanalytics.domain.model.CourseSnapshot;
import com.eduanalytics.domain.model.GroupCount;
import com.eduanalytics.infrastructure.persistence.entity.CourseEntity;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
public interface CourseRepository extends JpaRepository<CourseEntity, Long> {

    Optional<CourseEntity> findByCourseCode(String courseCode);

    boolean existsByCourseCode(String courseCode);

    List<CourseEntity> findByCourseCodeIn(Collection<String> courseCodes);

    @Query("SELECT c FROM CourseEntity c WHERE " +
           "(:search IS NULL OR LOWER(c.courseName) LIKE :search " +
           "   OR LOWER(c.courseCode) LIKE :search " +
           "   OR LOWER(c.courseDescription) LIKE :search) AND " +
           "(:level IS NULL OR c.level = :level) AND " +
           "(:departmentId IS NULL OR c.department.departmentId = :departmentId) AND " +
           "(:active IS NULL OR c.active = :active)")
    Page<CourseEntity> search(
            @Param("search") String search,
            @Param("level") CourseLevel level,
            @Param("departmentId") Long departmentId,
            @Param("active") Boolean active,
            Pageable pageable
    );

    /**
     * Explicit left join so courses without a department are still reported.
     */
    @Query("SELECT new com.eduanalytics.domain.model.CourseSnapshot(" +
           "c.courseId, c.courseName, d.departmentId, c.level) " +
           "FROM CourseEntity c LEFT JOIN c.department d WHERE " +
           "(:departmentId IS NULL OR d.departmentId = :departmentId) AND " +
           "(:level IS NULL OR c.level = :level) AND " +
           "(:courseId IS NULL OR c.courseId = :courseId) " +
           "ORDER BY c.courseId ASC")
    List<CourseSnapshot> findSnapshots(
            @Param("departmentId") Long departmentId,
            @Param("level") CourseLevel level,
            @Param("courseId") Long courseId
    );

    @Query("SELECT new com.eduanalytics.domain.model.GroupCount(d.departmentId, COUNT(c)) " +
           "FROM CourseEntity c JOIN c.department d " +
           "GROUP BY d.departmentId")
    List<GroupCount> countByDepartment();
}
