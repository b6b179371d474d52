package com.cdcportal.backend.modules.account.application;

import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

import com.cdcportal.backend.global.error.ProblemException;
import com.cdcportal.backend.modules.access.application.AccessScopeService;
import com.cdcportal.backend.modules.access.domain.AccessDecision;
import com.cdcportal.backend.modules.access.domain.AccessOperation;
import com.cdcportal.backend.modules.access.domain.AccessTarget;
import com.cdcportal.backend.modules.access.domain.Actor;
import com.cdcportal.backend.modules.access.domain.CallerIdentity;
import com.cdcportal.backend.modules.access.domain.DenyReason;
import com.cdcportal.backend.modules.access.domain.NotAuthorizedException;
import com.cdcportal.backend.modules.account.domain.UserAccount;
import com.cdcportal.backend.modules.account.domain.UserRoleType;
import com.cdcportal.backend.modules.account.infrastructure.persistence.UserAccountRepository;
import com.cdcportal.backend.modules.audit.application.AuditLogService;
import com.cdcportal.backend.modules.audit.application.AuditLogService.AuditLogCommand;
import com.cdcportal.backend.modules.student.infrastructure.persistence.GuardianInfoRepository;
import com.cdcportal.backend.modules.tenant.application.TenantDirectory;
import com.cdcportal.backend.modules.tenant.domain.Tenant;
import com.cdcportal.backend.modules.tenant.infrastructure.persistence.TenantRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@Transactional
public class AccountService {

    private static final Logger log = LoggerFactory.getLogger(AccountService.class);

    static final int MIN_PASSWORD_LENGTH = 8;
    private static final Set<UserRoleType> CREATABLE_ROLES =
            EnumSet.of(UserRoleType.WORKER, UserRoleType.PRESIDENT, UserRoleType.PARENT);
    private static final String RESOURCE_TYPE = "USER";

    private final UserAccountRepository userAccountRepository;
    private final GuardianInfoRepository guardianInfoRepository;
    private final TenantRepository tenantRepository;
    private final TenantDirectory tenantDirectory;
    private final AccessScopeService accessScopeService;
    private final AuditLogService auditLogService;
    private final PasswordEncoder passwordEncoder;

    public AccountService(
            UserAccountRepository userAccountRepository,
            GuardianInfoRepository guardianInfoRepository,
            TenantRepository tenantRepository,
            TenantDirectory tenantDirectory,
            AccessScopeService accessScopeService,
            AuditLogService auditLogService,
            PasswordEncoder passwordEncoder
    ) {
        this.userAccountRepository = userAccountRepository;
        this.guardianInfoRepository = guardianInfoRepository;
        this.tenantRepository = tenantRepository;
        this.tenantDirectory = tenantDirectory;
        this.accessScopeService = accessScopeService;
        this.auditLogService = auditLogService;
        this.passwordEncoder = passwordEncoder;
    }

    @Transactional(readOnly = true)
    public List<AccountView> listAccounts(CallerIdentity caller) {
        AccessDecision decision = accessScopeService.require(caller, AccessOperation.VIEW_USERS);
        return userAccountRepository.findAccountsOfTenant(decision.requireTenantId()).stream()
                .map(AccountView::from)
                .toList();
    }

    public AccountView createAccount(CallerIdentity caller, CreateAccountCommand command) {
        Actor actor = accessScopeService.resolveActor(caller);
        UserRoleType role = UserRoleType.fromCode(command.role());
        AccessOperation operation = role == UserRoleType.PRESIDENT
                ? AccessOperation.CREATE_PRESIDENT
                : AccessOperation.MANAGE_USERS;
        AccessDecision decision = accessScopeService.require(actor, operation, AccessTarget.none());

        if (!CREATABLE_ROLES.contains(role)) {
            throw new ProblemException(HttpStatus.UNPROCESSABLE_ENTITY, "INVALID_ROLE",
                    "Role must be one of worker, president, parent");
        }
        String username = normalizeUsername(command.username());
        validatePassword(command.password());
        if (userAccountRepository.existsByUsernameIgnoreCase(username)) {
            throw new ProblemException(HttpStatus.CONFLICT, "USERNAME_TAKEN");
        }

        UserAccount account = new UserAccount(username, passwordEncoder.encode(command.password()),
                command.fullName().trim(), role);
        account.setAddress(command.address());
        if (role != UserRoleType.PARENT) {
            // parents reach a tenant only through their linked child
            Tenant tenant = tenantRepository.getReferenceById(decision.requireTenantId());
            account.setTenant(tenant);
        }
        UserAccount saved = userAccountRepository.save(account);

        auditLogService.record(AuditLogCommand.of(AuditLogService.ACTION_ACCOUNT_CREATED, RESOURCE_TYPE, saved.getId(),
                actor.userId(), Map.of("username", saved.getUsername(), "role", role.code())));
        log.info("Account {} ({}) created by user {}", saved.getId(), role.code(), actor.userId());
        return AccountView.from(saved);
    }

    public void deleteAccount(CallerIdentity caller, Long accountId) {
        Actor actor = accessScopeService.resolveActor(caller);
        UserAccount account = userAccountRepository.findById(accountId)
                .orElseThrow(() -> new NotAuthorizedException(AccessOperation.MANAGE_USERS, actor.userId(),
                        DenyReason.UNKNOWN_TARGET));
        // accounts without a derivable tenant are outside every tenant scope
        Tenant tenant = tenantDirectory.tenantOf(account)
                .orElseThrow(() -> new NotAuthorizedException(AccessOperation.MANAGE_USERS, actor.userId(),
                        DenyReason.UNKNOWN_TARGET));
        AccessTarget target = accessScopeService.tenantTarget(actor, AccessOperation.MANAGE_USERS, tenant.getId());
        accessScopeService.require(actor, AccessOperation.MANAGE_USERS, target);

        if (account.getId().equals(actor.userId())) {
            throw new ProblemException(HttpStatus.CONFLICT, "CANNOT_DELETE_SELF");
        }
        guardianInfoRepository.findByGuardianUserId(account.getId())
                .ifPresent(guardian -> guardian.setGuardianUser(null));
        userAccountRepository.delete(account);

        auditLogService.record(AuditLogCommand.of(AuditLogService.ACTION_ACCOUNT_DELETED, RESOURCE_TYPE, accountId,
                actor.userId(), Map.of("username", account.getUsername())));
        log.info("Account {} deleted by user {}", accountId, actor.userId());
    }

    static String normalizeUsername(String username) {
        if (username == null || username.isBlank()) {
            throw new ProblemException(HttpStatus.UNPROCESSABLE_ENTITY, "INVALID_USERNAME");
        }
        return username.trim().toLowerCase(Locale.ROOT);
    }

    static void validatePassword(String password) {
        if (password == null || password.length() < MIN_PASSWORD_LENGTH) {
            throw new ProblemException(HttpStatus.UNPROCESSABLE_ENTITY, "PASSWORD_TOO_SHORT",
                    "Password must be at least " + MIN_PASSWORD_LENGTH + " characters");
        }
    }

    public record CreateAccountCommand(String username, String password, String fullName, String role, String address) {
    }

    public record AccountView(Long id, String username, String fullName, String role, Long tenantId, String address) {

        public static AccountView from(UserAccount account) {
            return new AccountView(account.getId(), account.getUsername(), account.getFullName(),
                    account.getRole().code(), account.getTenantId(), account.getAddress());
        }
    }
}
