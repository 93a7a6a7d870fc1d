package com.eduanalytics.api;

import com.eduanalytics.domain.model.*;
import com.eduanalytics.domain.service.DimensionService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/v1/dimensions")
@RequiredArgsConstructor
public class DimensionController {

    private final DimensionService dimensionService;

    @GetMapping("/schools")
    public ResponseEntity<List<SchoolResponse>> schools() {
        return ResponseEntity.ok(dimensionService.listSchools());
    }

    @PostMapping("/schools")
    public ResponseEntity<SchoolResponse> createSchool(@Valid @RequestBody SchoolRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(dimensionService.createSchool(request));
    }

    @GetMapping("/departments")
    public ResponseEntity<List<DepartmentResponse>> departments() {
        return ResponseEntity.ok(dimensionService.listDepartments());
    }

    @PostMapping("/departments")
    public ResponseEntity<DepartmentResponse> createDepartment(@Valid @RequestBody DepartmentRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(dimensionService.createDepartment(request));
    }

    @GetMapping("/instructors")
    public ResponseEntity<List<InstructorResponse>> instructors() {
        return ResponseEntity.ok(dimensionService.listInstructors());
    }

    @PostMapping("/instructors")
    public ResponseEntity<InstructorResponse> createInstructor(@Valid @RequestBody InstructorRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(dimensionService.createInstructor(request));
    }
}
