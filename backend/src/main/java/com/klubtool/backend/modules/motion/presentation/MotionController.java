package com.klubtool.backend.modules.motion.presentation;

import java.util.List;
import java.util.UUID;

import com.klubtool.backend.modules.motion.application.MotionService;
import com.klubtool.backend.modules.motion.domain.MotionKind;
import com.klubtool.backend.modules.motion.presentation.dto.MotionRequest;
import com.klubtool.backend.modules.motion.presentation.dto.MotionResponse;
import com.klubtool.backend.modules.motion.presentation.dto.UpdateMotionRequest;
import com.klubtool.backend.modules.motion.presentation.dto.VoteRequest;

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
@RequestMapping("/motions")
@Tag(name = "Motions")
public class MotionController {

    private final MotionService motionService;

    public MotionController(MotionService motionService) {
        this.motionService = motionService;
    }

    @GetMapping
    public ResponseEntity<List<MotionResponse>> list() {
        return ResponseEntity.ok(motionService.list(MotionKind.MOTION));
    }

    @GetMapping("/{motionId}")
    public ResponseEntity<MotionResponse> get(@PathVariable("motionId") UUID motionId) {
        return ResponseEntity.ok(motionService.get(MotionKind.MOTION, motionId));
    }

    @PostMapping
    public ResponseEntity<MotionResponse> create(@Valid @RequestBody MotionRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(motionService.create(MotionKind.MOTION, request));
    }

    @PatchMapping("/{motionId}")
    public ResponseEntity<MotionResponse> update(
            @PathVariable("motionId") UUID motionId,
            @Valid @RequestBody UpdateMotionRequest request
    ) {
        return ResponseEntity.ok(motionService.update(MotionKind.MOTION, motionId, request));
    }

    @PostMapping("/{motionId}/votes")
    public ResponseEntity<MotionResponse> vote(
            @PathVariable("motionId") UUID motionId,
            @Valid @RequestBody VoteRequest request
    ) {
        return ResponseEntity.ok(motionService.vote(motionId, request));
    }

    @DeleteMapping("/{motionId}")
    public ResponseEntity<Void> delete(@PathVariable("motionId") UUID motionId) {
        motionService.delete(MotionKind.MOTION, motionId);
        return ResponseEntity.noContent().build();
    }
}
