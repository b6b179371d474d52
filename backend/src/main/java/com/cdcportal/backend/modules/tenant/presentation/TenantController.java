package com.cdcportal.backend.modules.tenant.presentation;

import java.util.List;

import com.cdcportal.backend.global.security.SecurityUtils;
import com.cdcportal.backend.modules.tenant.application.TenantService;
import com.cdcportal.backend.modules.tenant.application.TenantService.CreateTenantCommand;
import com.cdcportal.backend.modules.tenant.application.TenantService.DirectoryQuery;
import com.cdcportal.backend.modules.tenant.application.TenantService.TenantView;
import com.cdcportal.backend.modules.tenant.presentation.dto.CreateTenantRequest;
import com.cdcportal.backend.modules.tenant.presentation.dto.TenantPageResponse;
import com.cdcportal.backend.modules.tenant.presentation.dto.TenantResponse;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;

import jakarta.validation.Valid;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/cdcs")
public class TenantController {

    private static final int MAX_PAGE_SIZE = 100;

    private final TenantService tenantService;

    public TenantController(TenantService tenantService) {
        this.tenantService = tenantService;
    }

    @Operation(summary = "Register a CDC", description = "Creates the CDC and its location in one transaction.")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Created"),
            @ApiResponse(responseCode = "403", description = "Not authorized"),
            @ApiResponse(responseCode = "422", description = "Missing required fields")
    })
    @PostMapping
    public ResponseEntity<TenantResponse> createTenant(@Valid @RequestBody CreateTenantRequest request) {
        TenantView view = tenantService.createTenant(SecurityUtils.getCurrentIdentity(), new CreateTenantCommand(
                request.name(),
                request.region(),
                request.province(),
                request.municipality(),
                request.barangay()
        ));
        return ResponseEntity.status(HttpStatus.CREATED).body(toResponse(view));
    }

    @Operation(summary = "Deactivate a CDC")
    @PostMapping("/{tenantId}/deactivate")
    public ResponseEntity<TenantResponse> deactivate(@PathVariable("tenantId") Long tenantId) {
        return ResponseEntity.ok(toResponse(tenantService.deactivate(SecurityUtils.getCurrentIdentity(), tenantId)));
    }

    @Operation(summary = "Reactivate a CDC")
    @PostMapping("/{tenantId}/reactivate")
    public ResponseEntity<TenantResponse> reactivate(@PathVariable("tenantId") Long tenantId) {
        return ResponseEntity.ok(toResponse(tenantService.reactivate(SecurityUtils.getCurrentIdentity(), tenantId)));
    }

    @Operation(summary = "Search the CDC directory", description = "Active CDCs only, filtered by location substrings.")
    @GetMapping
    public ResponseEntity<TenantPageResponse> search(
            @RequestParam(name = "province", required = false) String province,
            @RequestParam(name = "municipality", required = false) String municipality,
            @RequestParam(name = "barangay", required = false) String barangay,
            @RequestParam(name = "page", defaultValue = "0") int page,
            @RequestParam(name = "size", defaultValue = "20") int size
    ) {
        int safePage = Math.max(page, 0);
        int safeSize = Math.min(Math.max(size, 1), MAX_PAGE_SIZE);
        Page<TenantView> result = tenantService.searchDirectory(
                SecurityUtils.getCurrentIdentity(),
                new DirectoryQuery(province, municipality, barangay),
                PageRequest.of(safePage, safeSize)
        );
        List<TenantResponse> items = result.getContent().stream().map(this::toResponse).toList();
        return ResponseEntity.ok(new TenantPageResponse(items, result.getNumber(), result.getSize(),
                result.getTotalElements()));
    }

    @Operation(summary = "Get a CDC with its location")
    @GetMapping("/{tenantId}")
    public ResponseEntity<TenantResponse> getTenant(@PathVariable("tenantId") Long tenantId) {
        return ResponseEntity.ok(toResponse(tenantService.getTenant(SecurityUtils.getCurrentIdentity(), tenantId)));
    }

    private TenantResponse toResponse(TenantView view) {
        return new TenantResponse(
                view.id(),
                view.name(),
                view.status().name(),
                view.region(),
                view.province(),
                view.municipality(),
                view.barangay()
        );
    }
}
