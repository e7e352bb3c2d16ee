package com.klubtool.backend.modules.local.presentation;

import java.util.List;
import java.util.UUID;

import com.klubtool.backend.modules.local.application.LocalService;
import com.klubtool.backend.modules.local.presentation.dto.LocalRequest;
import com.klubtool.backend.modules.local.presentation.dto.LocalResponse;
import com.klubtool.backend.modules.local.presentation.dto.PartyRequest;
import com.klubtool.backend.modules.local.presentation.dto.PartyResponse;
import com.klubtool.backend.modules.local.presentation.dto.UpdateLocalRequest;

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
@RequestMapping("/locals")
@Tag(name = "Locals")
public class LocalController {

    private final LocalService localService;

    public LocalController(LocalService localService) {
        this.localService = localService;
    }

    @GetMapping
    public ResponseEntity<List<LocalResponse>> listLocals() {
        return ResponseEntity.ok(localService.listLocals());
    }

    @GetMapping("/{localId}")
    public ResponseEntity<LocalResponse> getLocal(@PathVariable("localId") UUID localId) {
        return ResponseEntity.ok(localService.getLocal(localId));
    }

    @PostMapping
    public ResponseEntity<LocalResponse> createLocal(@Valid @RequestBody LocalRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(localService.createLocal(request));
    }

    @PatchMapping("/{localId}")
    public ResponseEntity<LocalResponse> updateLocal(
            @PathVariable("localId") UUID localId,
            @Valid @RequestBody UpdateLocalRequest request
    ) {
        return ResponseEntity.ok(localService.updateLocal(localId, request));
    }

    @DeleteMapping("/{localId}")
    public ResponseEntity<Void> deleteLocal(@PathVariable("localId") UUID localId) {
        localService.deleteLocal(localId);
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/{localId}/parties")
    public ResponseEntity<List<PartyResponse>> listParties(@PathVariable("localId") UUID localId) {
        return ResponseEntity.ok(localService.listParties(localId));
    }

    @PostMapping("/{localId}/parties")
    public ResponseEntity<PartyResponse> createParty(
            @PathVariable("localId") UUID localId,
            @Valid @RequestBody PartyRequest request
    ) {
        return ResponseEntity.status(HttpStatus.CREATED).body(localService.createParty(localId, request));
    }
}
