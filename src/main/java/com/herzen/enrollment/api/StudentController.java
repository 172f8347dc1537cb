package com.herzen.enrollment.api;

import com.herzen.enrollment.service.EnrollmentService;
import com.herzen.enrollment.validation.ValidationModels.EnrollmentDecision;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/students")
public class StudentController {
    private final EnrollmentService enrollmentService;

    public StudentController(EnrollmentService enrollmentService) {
        this.enrollmentService = enrollmentService;
    }

    @PostMapping
    public ResponseEntity<EnrollmentService.StudentView> register(@RequestBody RegisterRequest request) {
        enrollmentService.registerStudent(request.id(), request.name());
        return ResponseEntity.status(HttpStatus.CREATED).body(enrollmentService.view(request.id()));
    }

    @GetMapping("/{studentId}")
    public ResponseEntity<EnrollmentService.StudentView> student(@PathVariable String studentId) {
        return ResponseEntity.ok(enrollmentService.view(studentId));
    }

    @GetMapping("/{studentId}/evaluate")
    public ResponseEntity<EnrollmentDecision> evaluate(@PathVariable String studentId, @RequestParam String courseCode) {
        return ResponseEntity.ok(enrollmentService.evaluate(studentId, courseCode));
    }

    @PostMapping("/{studentId}/enrollments")
    public ResponseEntity<EnrollmentDecision> enroll(@PathVariable String studentId, @RequestBody CourseRequest request) {
        EnrollmentDecision decision = enrollmentService.enroll(studentId, request.courseCode());
        return ResponseEntity.status(decision.eligible() ? HttpStatus.OK : HttpStatus.UNPROCESSABLE_ENTITY).body(decision);
    }

    @DeleteMapping("/{studentId}/enrollments/{courseCode}")
    public ResponseEntity<Void> withdraw(@PathVariable String studentId, @PathVariable String courseCode) {
        enrollmentService.withdraw(studentId, courseCode);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/{studentId}/approved")
    public ResponseEntity<EnrollmentService.StudentView> approve(@PathVariable String studentId, @RequestBody CourseRequest request) {
        enrollmentService.approveCourse(studentId, request.courseCode());
        return ResponseEntity.ok(enrollmentService.view(studentId));
    }

    public record RegisterRequest(String id, String name) {}

    public record CourseRequest(String courseCode) {}
}
