package com.cdcportal.backend.modules.content.presentation;

import java.util.List;

import com.cdcportal.backend.global.security.SecurityUtils;
import com.cdcportal.backend.modules.content.application.ActivityService;
import com.cdcportal.backend.modules.content.application.ActivityService.ActivityDraft;
import com.cdcportal.backend.modules.content.domain.TakeHomeActivity;
import com.cdcportal.backend.modules.content.presentation.dto.ActivityRequest;
import com.cdcportal.backend.modules.content.presentation.dto.ActivityResponse;

import io.swagger.v3.oas.annotations.Operation;

import jakarta.validation.Valid;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/activities")
public class ActivityController {

    private final ActivityService activityService;

    public ActivityController(ActivityService activityService) {
        this.activityService = activityService;
    }

    @Operation(summary = "List take-home activities")
    @GetMapping
    public ResponseEntity<List<ActivityResponse>> list() {
        List<ActivityResponse> response = activityService.list(SecurityUtils.getCurrentIdentity()).stream()
                .map(ActivityController::toResponse)
                .toList();
        return ResponseEntity.ok(response);
    }

    @Operation(summary = "Assign a take-home activity")
    @PostMapping
    public ResponseEntity<ActivityResponse> create(@Valid @RequestBody ActivityRequest request) {
        TakeHomeActivity activity = activityService.create(SecurityUtils.getCurrentIdentity(), toDraft(request));
        return ResponseEntity.status(HttpStatus.CREATED).body(toResponse(activity));
    }

    @Operation(summary = "Update a take-home activity")
    @PutMapping("/{activityId}")
    public ResponseEntity<ActivityResponse> update(
            @PathVariable("activityId") Long activityId,
            @Valid @RequestBody ActivityRequest request
    ) {
        TakeHomeActivity activity = activityService.update(SecurityUtils.getCurrentIdentity(), activityId,
                toDraft(request));
        return ResponseEntity.ok(toResponse(activity));
    }

    @Operation(summary = "Delete a take-home activity")
    @DeleteMapping("/{activityId}")
    public ResponseEntity<Void> delete(@PathVariable("activityId") Long activityId) {
        activityService.delete(SecurityUtils.getCurrentIdentity(), activityId);
        return ResponseEntity.noContent().build();
    }

    private static ActivityDraft toDraft(ActivityRequest request) {
        return new ActivityDraft(request.title(), request.description(), request.dueDate(), request.ageBandId(),
                request.filePath(), request.fileName());
    }

    private static ActivityResponse toResponse(TakeHomeActivity activity) {
        return new ActivityResponse(
                activity.getId(),
                activity.getTitle(),
                activity.getDescription(),
                activity.getDueDate(),
                activity.getAgeBandId(),
                activity.getTenantId(),
                activity.getFilePath(),
                activity.getFileName()
        );
    }
}
