package com.cdcportal.backend.modules.account.presentation;

import com.cdcportal.backend.global.security.SecurityUtils;
import com.cdcportal.backend.modules.account.application.AccountService.AccountView;
import com.cdcportal.backend.modules.account.application.FocalAccountService;
import com.cdcportal.backend.modules.account.application.FocalAccountService.CreateFocalAccountCommand;
import com.cdcportal.backend.modules.account.application.FocalAccountService.FocalAvailability;
import com.cdcportal.backend.modules.account.presentation.dto.AccountResponse;
import com.cdcportal.backend.modules.account.presentation.dto.CreateFocalAccountRequest;
import com.cdcportal.backend.modules.account.presentation.dto.FocalAvailabilityResponse;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;

import jakarta.validation.Valid;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/focal-accounts")
public class FocalAccountController {

    private final FocalAccountService focalAccountService;

    public FocalAccountController(FocalAccountService focalAccountService) {
        this.focalAccountService = focalAccountService;
    }

    @Operation(summary = "Check whether a municipality already has a focal account")
    @GetMapping("/check")
    public ResponseEntity<FocalAvailabilityResponse> check(
            @RequestParam(name = "municipality") String municipality,
            @RequestParam(name = "province") String province
    ) {
        FocalAvailability availability = focalAccountService.checkAvailability(
                SecurityUtils.getCurrentIdentity(), municipality, province);
        return ResponseEntity.ok(new FocalAvailabilityResponse(availability.municipality(), availability.province(),
                availability.exists()));
    }

    @Operation(summary = "Create the focal account of a municipality")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Created"),
            @ApiResponse(responseCode = "409", description = "Username taken or municipality already covered")
    })
    @PostMapping
    public ResponseEntity<AccountResponse> create(@Valid @RequestBody CreateFocalAccountRequest request) {
        AccountView view = focalAccountService.createFocalAccount(SecurityUtils.getCurrentIdentity(),
                new CreateFocalAccountCommand(
                        request.username(),
                        request.password(),
                        request.fullName(),
                        request.barangay(),
                        request.municipality(),
                        request.province(),
                        request.region()
                ));
        return ResponseEntity.status(HttpStatus.CREATED).body(AccountController.toResponse(view));
    }
}
