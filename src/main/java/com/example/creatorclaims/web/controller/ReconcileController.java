package com.example.creatorclaims.web.controller;

import com.example.creatorclaims.service.VerificationReconciler;
import com.example.creatorclaims.web.dto.ReconcileResponse;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Entry point for the external scheduler. Each call runs one bounded reconcile batch.
 */
@RestController
@RequestMapping("/api/workers")
public class ReconcileController {

    private final VerificationReconciler reconciler;

    public ReconcileController(VerificationReconciler reconciler) {
        this.reconciler = reconciler;
    }

    @PostMapping("/reconcile")
    public ResponseEntity<ReconcileResponse> reconcile() {
        return ResponseEntity.ok(ReconcileResponse.from(reconciler.reconcile()));
    }
}
