package com.cdcportal.backend.modules.account.presentation;

import java.util.List;

import com.cdcportal.backend.global.security.SecurityUtils;
import com.cdcportal.backend.modules.account.application.AccountService;
import com.cdcportal.backend.modules.account.application.AccountService.AccountView;
import com.cdcportal.backend.modules.account.application.AccountService.CreateAccountCommand;
import com.cdcportal.backend.modules.account.presentation.dto.AccountResponse;
import com.cdcportal.backend.modules.account.presentation.dto.CreateAccountRequest;

import io.swagger.v3.oas.annotations.Operation;

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
@RequestMapping("/accounts")
public class AccountController {

    private final AccountService accountService;

    public AccountController(AccountService accountService) {
        this.accountService = accountService;
    }

    @Operation(summary = "List accounts of the caller's CDC")
    @GetMapping
    public ResponseEntity<List<AccountResponse>> listAccounts() {
        List<AccountResponse> response = accountService.listAccounts(SecurityUtils.getCurrentIdentity()).stream()
                .map(AccountController::toResponse)
                .toList();
        return ResponseEntity.ok(response);
    }

    @Operation(summary = "Create a worker, president or parent account")
    @PostMapping
    public ResponseEntity<AccountResponse> createAccount(@Valid @RequestBody CreateAccountRequest request) {
        AccountView view = accountService.createAccount(SecurityUtils.getCurrentIdentity(), new CreateAccountCommand(
                request.username(),
                request.password(),
                request.fullName(),
                request.role(),
                request.address()
        ));
        return ResponseEntity.status(HttpStatus.CREATED).body(toResponse(view));
    }

    @Operation(summary = "Delete an account")
    @DeleteMapping("/{accountId}")
    public ResponseEntity<Void> deleteAccount(@PathVariable("accountId") Long accountId) {
        accountService.deleteAccount(SecurityUtils.getCurrentIdentity(), accountId);
        return ResponseEntity.noContent().build();
    }

    static AccountResponse toResponse(AccountView view) {
        return new AccountResponse(view.id(), view.username(), view.fullName(), view.role(), view.tenantId(),
                view.address());
    }
}
