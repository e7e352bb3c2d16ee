package com.klubtool.backend.modules.motion.presentation;

import java.util.List;
import java.util.UUID;

import com.klubtool.backend.modules.motion.application.MotionService;
import com.klubtool.backend.modules.motion.domain.MotionKind;
import com.klubtool.backend.modules.motion.presentation.dto.MotionRequest;
import com.klubtool.backend.modules.motion.presentation.dto.MotionResponse;
import com.klubtool.backend.modules.motion.presentation.dto.UpdateMotionRequest;

import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/inquiries")
@Tag(name = "Inquiries")
public class InquiryController {

    private final MotionService motionService;

    public InquiryController(MotionService motionService) {
        this.motionService = motionService;
    }

    @GetMapping
    public ResponseEntity<List<MotionResponse>> list() {
        return ResponseEntity.ok(motionService.list(MotionKind.INQUIRY));
    }

    @GetMapping("/{inquiryId}")
    public ResponseEntity<MotionResponse> get(@PathVariable("inquiryId") UUID inquiryId) {
        return ResponseEntity.ok(motionService.get(MotionKind.INQUIRY, inquiryId));
    }

    @PostMapping
    public ResponseEntity<MotionResponse> create(@Valid @RequestBody MotionRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(motionService.create(MotionKind.INQUIRY, request));
    }

    @PatchMapping("/{inquiryId}")
    public ResponseEntity<MotionResponse> update(
            @PathVariable("inquiryId") UUID inquiryId,
            @Valid @RequestBody UpdateMotionRequest request
    ) {
        return ResponseEntity.ok(motionService.update(MotionKind.INQUIRY, inquiryId, request));
    }

    @DeleteMapping("/{inquiryId}")
    public ResponseEntity<Void> delete(@PathVariable("inquiryId") UUID inquiryId) {
        motionService.delete(MotionKind.INQUIRY, inquiryId);
        return ResponseEntity.noContent().build();
    }
}
