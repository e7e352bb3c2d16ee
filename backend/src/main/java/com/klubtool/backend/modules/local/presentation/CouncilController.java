package com.klubtool.backend.modules.local.presentation;

import java.util.List;
import java.util.UUID;

import com.klubtool.backend.modules.local.application.CouncilService;
import com.klubtool.backend.modules.local.presentation.dto.CouncilRequest;
import com.klubtool.backend.modules.local.presentation.dto.CouncilResponse;
import com.klubtool.backend.modules.local.presentation.dto.UpdateCouncilRequest;

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
@RequestMapping("/councils")
@Tag(name = "Councils")
public class CouncilController {

    private final CouncilService councilService;

    public CouncilController(CouncilService councilService) {
        this.councilService = councilService;
    }

    @GetMapping
    public ResponseEntity<List<CouncilResponse>> listCouncils() {
        return ResponseEntity.ok(councilService.listCouncils());
    }

    @GetMapping("/{councilId}")
    public ResponseEntity<CouncilResponse> getCouncil(@PathVariable("councilId") UUID councilId) {
        return ResponseEntity.ok(councilService.getCouncil(councilId));
    }

    @PostMapping
    public ResponseEntity<CouncilResponse> createCouncil(@Valid @RequestBody CouncilRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(councilService.createCouncil(request));
    }

    @PatchMapping("/{councilId}")
    public ResponseEntity<CouncilResponse> updateCouncil(
            @PathVariable("councilId") UUID councilId,
            @Valid @RequestBody UpdateCouncilRequest request
    ) {
        return ResponseEntity.ok(councilService.updateCouncil(councilId, request));
    }

    @DeleteMapping("/{councilId}")
    public ResponseEntity<Void> deleteCouncil(@PathVariable("councilId") UUID councilId) {
        councilService.deleteCouncil(councilId);
        return ResponseEntity.noContent().build();
    }
}
