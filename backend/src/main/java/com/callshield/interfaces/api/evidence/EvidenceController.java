package com.callshield.interfaces.api.evidence;

import com.callshield.application.evidence.EvidencePackageView;
import com.callshield.application.evidence.EvidenceReviewService;
import com.callshield.application.session.command.ReviewStatusUpdateCommand;
import com.callshield.domain.evidence.model.EvidenceVerification;
import com.callshield.domain.evidence.model.SubmissionDocument;
import com.callshield.interfaces.api.dto.StatusUpdateRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/evidence")
@RequiredArgsConstructor
public class EvidenceController {

    private final EvidenceReviewService reviewService;

    @GetMapping("/{packageId}")
    public ResponseEntity<EvidencePackageView> getPackage(@PathVariable String packageId) {
        return ResponseEntity.ok(EvidencePackageView.from(reviewService.get(packageId)));
    }

    @PostMapping("/{packageId}/status")
    public ResponseEntity<EvidencePackageView> updateStatus(@PathVariable String packageId,
                                                            @Valid @RequestBody StatusUpdateRequest request) {
        var command = new ReviewStatusUpdateCommand(packageId, request.newStatus(), request.notes(), request.actor());
        return ResponseEntity.ok(EvidencePackageView.from(reviewService.updateStatus(command)));
    }

    @GetMapping("/{packageId}/verify")
    public ResponseEntity<EvidenceVerification> verify(@PathVariable String packageId) {
        return ResponseEntity.ok(reviewService.verify(packageId));
    }

    @GetMapping("/{packageId}/export")
    public ResponseEntity<SubmissionDocument> export(@PathVariable String packageId,
                                                     @RequestParam(required = false) String actor) {
        return ResponseEntity.ok(reviewService.export(packageId, actor));
    }
}
