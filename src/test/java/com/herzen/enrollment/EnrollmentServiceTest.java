package com.herzen.enrollment;

import com.herzen.enrollment.error.CourseNotFoundException;
import com.herzen.enrollment.error.EnrollmentNotFoundException;
import com.herzen.enrollment.error.StudentNotFoundException;
import com.herzen.enrollment.service.CatalogImportService;
import com.herzen.enrollment.service.EnrollmentService;
import com.herzen.enrollment.validation.ValidationModels.EnrollmentDecision;
import com.herzen.enrollment.validation.ValidationModels.IneligibilityReason;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.*;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
class EnrollmentServiceTest {
    private static final String CATALOG = """
            @course code="SVC101" name="Programming I" credits="4" term="1"
            @schedule day="MONDAY" start="08:00" end="10:00"
            @course code="SVC201" name="Programming II" credits="4" term="2" requires="SVC101"
            @schedule day="TUESDAY" start="10:00" end="12:00"
            @course code="SVCM01" name="Mathematics I" credits="6" term="1"
            @schedule day="MONDAY" start="09:30" end="11:30"
            @course code="SVCX01" name="Seminar" credits="2" term="1"
            @schedule day="FRIDAY" start="10:00" end="11:00"
            """;

    @Autowired
    private CatalogImportService importService;

    @Autowired
    private EnrollmentService enrollmentService;

    private String studentId;

    @BeforeEach
    void setUp() {
        assertTrue(importService.importCatalog(CATALOG, false).valid());
        studentId = "st-" + UUID.randomUUID();
        enrollmentService.registerStudent(studentId, "John Doe");
    }

    @Test
    void enrollsOnlyOnEligibleDecision() {
        assertTrue(enrollmentService.enroll(studentId, "SVC101").eligible());

        EnrollmentDecision prereq = enrollmentService.enroll(studentId, "SVC201");
        assertEquals(IneligibilityReason.MISSING_PREREQUISITE, prereq.reason());
        assertEquals("SVC101", prereq.subject());

        EnrollmentDecision conflict = enrollmentService.enroll(studentId, "SVCM01");
        assertEquals(IneligibilityReason.SCHEDULE_CONFLICT, conflict.reason());
        assertEquals("SVC101", conflict.subject());

        var view = enrollmentService.view(studentId);
        assertEquals(1, view.enrollments().size());
        assertEquals("SVC101", view.enrollments().get(0).courseCode());
        assertEquals(4, view.totalCredits());
    }

    @Test
    void secondEnrollmentOfSameCourseIsRejected() {
        assertTrue(enrollmentService.enroll(studentId, "SVC101").eligible());
        assertEquals(IneligibilityReason.ALREADY_ENROLLED, enrollmentService.enroll(studentId, "SVC101").reason());
        assertEquals(1, enrollmentService.view(studentId).enrollments().size());
    }

    @Test
    void evaluateDoesNotEnroll() {
        assertTrue(enrollmentService.evaluate(studentId, "SVC101").eligible());
        assertTrue(enrollmentService.evaluate(studentId, "SVC101").eligible());
        assertTrue(enrollmentService.view(studentId).enrollments().isEmpty());
    }

    @Test
    void approvalUnlocksDependentCourse() {
        enrollmentService.approveCourse(studentId, "SVC101");
        enrollmentService.approveCourse(studentId, "SVC101");

        assertEquals(List.of("SVC101"), enrollmentService.view(studentId).approvedCourseCodes());
        assertTrue(enrollmentService.enroll(studentId, "SVC201").eligible());
    }

    @Test
    void withdrawalFreesTheTimeSlot() {
        assertTrue(enrollmentService.enroll(studentId, "SVC101").eligible());
        assertFalse(enrollmentService.enroll(studentId, "SVCM01").eligible());

        enrollmentService.withdraw(studentId, "SVC101");
        assertTrue(enrollmentService.enroll(studentId, "SVCM01").eligible());
        assertThrows(EnrollmentNotFoundException.class, () -> enrollmentService.withdraw(studentId, "SVC101"));
    }

    @Test
    void unknownStudentOrCourseFailsLookup() {
        assertThrows(StudentNotFoundException.class, () -> enrollmentService.enroll("nobody", "SVC101"));
        assertThrows(CourseNotFoundException.class, () -> enrollmentService.enroll(studentId, "NOPE"));
        assertThrows(CourseNotFoundException.class, () -> enrollmentService.approveCourse(studentId, "NOPE"));
        assertThrows(IllegalArgumentException.class, () -> enrollmentService.registerStudent(studentId, "Twice"));
    }

    @Test
    void concurrentEnrollmentsOfSameCourseAdmitOnlyOne() throws Exception {
        int threads = 8;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<EnrollmentDecision>> futures = new ArrayList<>();
            for (int i = 0; i < threads; i++) {
                futures.add(pool.submit(() -> {
                    start.await();
                    return enrollmentService.enroll(studentId, "SVCX01");
                }));
            }
            start.countDown();

            int eligible = 0;
            for (Future<EnrollmentDecision> f : futures) {
                if (f.get(10, TimeUnit.SECONDS).eligible()) eligible++;
            }
            assertEquals(1, eligible);
            assertEquals(1, enrollmentService.view(studentId).enrollments().size());
        } finally {
            pool.shutdownNow();
        }
    }
}
