package com.cdcportal.backend.modules.content.presentation;

import java.util.List;

import com.cdcportal.backend.global.security.SecurityUtils;
import com.cdcportal.backend.modules.account.domain.UserRoleType;
import com.cdcportal.backend.modules.content.application.AnnouncementService;
import com.cdcportal.backend.modules.content.application.AnnouncementService.AnnouncementDraft;
import com.cdcportal.backend.modules.content.application.AnnouncementService.MultiTenantResult;
import com.cdcportal.backend.modules.content.domain.Announcement;
import com.cdcportal.backend.modules.content.presentation.dto.AnnouncementResponse;
import com.cdcportal.backend.modules.content.presentation.dto.CreateAnnouncementRequest;
import com.cdcportal.backend.modules.content.presentation.dto.MultiCdcAnnouncementRequest;
import com.cdcportal.backend.modules.content.presentation.dto.MultiCdcAnnouncementResponse;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;

import jakarta.validation.Valid;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/announcements")
public class AnnouncementController {

    private final AnnouncementService announcementService;

    public AnnouncementController(AnnouncementService announcementService) {
        this.announcementService = announcementService;
    }

    @Operation(summary = "Publish an announcement to the caller's CDC")
    @PostMapping
    public ResponseEntity<AnnouncementResponse> publish(@Valid @RequestBody CreateAnnouncementRequest request) {
        Announcement announcement = announcementService.publish(SecurityUtils.getCurrentIdentity(), toDraft(request));
        return ResponseEntity.status(HttpStatus.CREATED).body(toResponse(announcement));
    }

    @Operation(summary = "Publish one announcement to several CDCs",
            description = "CDCs that are unknown or outside the caller's scope are reported as failures.")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "At least one copy created"),
            @ApiResponse(responseCode = "422", description = "No copy created")
    })
    @PostMapping("/multi-cdc")
    public ResponseEntity<MultiCdcAnnouncementResponse> publishToCdcs(
            @Valid @RequestBody MultiCdcAnnouncementRequest request
    ) {
        MultiTenantResult result = announcementService.publishToTenants(SecurityUtils.getCurrentIdentity(),
                toDraft(request.announcement()), request.cdcIds());
        MultiCdcAnnouncementResponse response = new MultiCdcAnnouncementResponse(
                result.created().stream()
                        .map(created -> new MultiCdcAnnouncementResponse.Created(created.tenantId(),
                                created.announcementId()))
                        .toList(),
                result.failures().stream()
                        .map(failure -> new MultiCdcAnnouncementResponse.Failed(failure.tenantId(), failure.code()))
                        .toList()
        );
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    @Operation(summary = "Announcements managed by the caller")
    @GetMapping
    public ResponseEntity<List<AnnouncementResponse>> listManaged() {
        return ResponseEntity.ok(toResponses(announcementService.listManaged(SecurityUtils.getCurrentIdentity())));
    }

    @Operation(summary = "Announcements visible to the caller", description = "Filtered by role, CDC, child age band and geography.")
    @GetMapping("/feed")
    public ResponseEntity<List<AnnouncementResponse>> feed() {
        return ResponseEntity.ok(toResponses(announcementService.feed(SecurityUtils.getCurrentIdentity())));
    }

    @Operation(summary = "Delete an announcement")
    @DeleteMapping("/{announcementId}")
    public ResponseEntity<Void> delete(@PathVariable("announcementId") Long announcementId) {
        announcementService.delete(SecurityUtils.getCurrentIdentity(), announcementId);
        return ResponseEntity.noContent().build();
    }

    private static AnnouncementDraft toDraft(CreateAnnouncementRequest request) {
        return new AnnouncementDraft(
                request.title(),
                request.message(),
                request.ageFilter(),
                request.roleFilter(),
                request.attachmentPath(),
                request.attachmentName()
        );
    }

    private static List<AnnouncementResponse> toResponses(List<Announcement> announcements) {
        return announcements.stream().map(AnnouncementController::toResponse).toList();
    }

    private static AnnouncementResponse toResponse(Announcement announcement) {
        return new AnnouncementResponse(
                announcement.getId(),
                announcement.getTitle(),
                announcement.getMessage(),
                announcement.getAuthorName(),
                announcement.getAgeFilter(),
                announcement.getAudience().stream().map(UserRoleType::code).toList(),
                announcement.getTenantId(),
                announcement.getAttachmentPath(),
                announcement.getAttachmentName(),
                announcement.getCreatedAt()
        );
    }
}
