package com.staybook.reservation.api.controller;

import com.staybook.common.dto.BaseResponse;
import com.staybook.reservation.api.dto.ConflictResponse;
import com.staybook.reservation.api.dto.ResolveConflictRequest;
import com.staybook.reservation.domain.model.ReconciliationConflictRecord.ConflictStatus;
import com.staybook.reservation.domain.service.ReconciliationConflictService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * Back-office view of payments that could not be applied.
 */
@RestController
@RequestMapping("/api/v1/reconciliation/conflicts")
@RequiredArgsConstructor
public class ReconciliationController {

    private final ReconciliationConflictService conflictService;

    @GetMapping
    public ResponseEntity<BaseResponse<List<ConflictResponse>>> listConflicts(
            @RequestParam(defaultValue = "OPEN") ConflictStatus status) {
        List<ConflictResponse> response = conflictService.findByStatus(status).stream()
                .map(ConflictResponse::from)
                .toList();
        return ResponseEntity.ok(BaseResponse.success(response));
    }

    @PostMapping("/{id}/resolve")
    public ResponseEntity<BaseResponse<ConflictResponse>> resolveConflict(
            @PathVariable Long id,
            @Valid @RequestBody ResolveConflictRequest request) {
        ConflictResponse response = ConflictResponse.from(conflictService.resolve(id, request.note()));
        return ResponseEntity.ok(BaseResponse.success("Conflict resolved", response));
    }
}
