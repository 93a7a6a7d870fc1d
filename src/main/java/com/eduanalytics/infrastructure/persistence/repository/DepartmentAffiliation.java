package com.eduanalytics.infrastructure.persistence.repository;

/**
 * JPQL predicates for best-effort department attribution of students.
 *
 * There is no student-to-department key in the warehouse. A student belongs to a department
 * when their major equals, verbatim, the name of one of the department's courses. Students with
 * no major, or a major that matches no course name, belong nowhere. The predicates are EXISTS
 * subqueries, so a student matching several courses of one department still counts once.
 *
 * Both expect the student alias {@code s}.
 */
final class DepartmentAffiliation {

    /**
     * Correlated with a department alias {@code d}.
     */
    static final String MAJOR_IN_DEPARTMENT =
            "EXISTS (SELECT dc.courseId FROM CourseEntity dc " +
            "WHERE dc.department = d AND dc.courseName = s.major)";

    /**
     * Bound to the {@code :departmentId} parameter.
     */
    static final String MAJOR_IN_GIVEN_DEPARTMENT =
            "EXISTS (SELECT dc.courseId FROM CourseEntity dc " +
            "WHERE dc.department.departmentId = :departmentId AND dc.courseName = s.major)";

    private DepartmentAffiliation() {
    }
}
