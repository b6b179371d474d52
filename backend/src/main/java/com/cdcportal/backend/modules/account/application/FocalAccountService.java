package com.cdcportal.backend.modules.account.application;

import java.util.Map;

import com.cdcportal.backend.global.error.ProblemException;
import com.cdcportal.backend.modules.access.application.AccessScopeService;
import com.cdcportal.backend.modules.access.domain.AccessOperation;
import com.cdcportal.backend.modules.access.domain.AccessTarget;
import com.cdcportal.backend.modules.access.domain.Actor;
import com.cdcportal.backend.modules.access.domain.CallerIdentity;
import com.cdcportal.backend.modules.account.application.AccountService.AccountView;
import com.cdcportal.backend.modules.account.domain.UserAccount;
import com.cdcportal.backend.modules.account.domain.UserRoleType;
import com.cdcportal.backend.modules.account.infrastructure.persistence.UserAccountRepository;
import com.cdcportal.backend.modules.audit.application.AuditLogService;
import com.cdcportal.backend.modules.audit.application.AuditLogService.AuditLogCommand;
import com.cdcportal.backend.modules.tenant.domain.AddressParser;
import com.cdcportal.backend.modules.tenant.domain.Geography;
import com.cdcportal.backend.modules.tenant.domain.IncompleteAddressException;
import com.cdcportal.backend.modules.tenant.domain.TenantLocation;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Focal accounts, at most one per municipality. Existing focal users are placed by
 * their tenant location when they have one, otherwise by their address text.
 */
@Service
@Transactional
public class FocalAccountService {

    private static final Logger log = LoggerFactory.getLogger(FocalAccountService.class);

    private final UserAccountRepository userAccountRepository;
    private final AccessScopeService accessScopeService;
    private final AuditLogService auditLogService;
    private final PasswordEncoder passwordEncoder;

    public FocalAccountService(
            UserAccountRepository userAccountRepository,
            AccessScopeService accessScopeService,
            AuditLogService auditLogService,
            PasswordEncoder passwordEncoder
    ) {
        this.userAccountRepository = userAccountRepository;
        this.accessScopeService = accessScopeService;
        this.auditLogService = auditLogService;
        this.passwordEncoder = passwordEncoder;
    }

    @Transactional(readOnly = true)
    public FocalAvailability checkAvailability(CallerIdentity caller, String municipality, String province) {
        accessScopeService.require(caller, AccessOperation.CREATE_FOCAL_ACCOUNT);
        Geography requested = requestedGeography(municipality, province);
        return new FocalAvailability(municipality.trim(), province.trim(), focalExistsFor(requested));
    }

    public AccountView createFocalAccount(CallerIdentity caller, CreateFocalAccountCommand command) {
        Actor actor = accessScopeService.resolveActor(caller);
        accessScopeService.require(actor, AccessOperation.CREATE_FOCAL_ACCOUNT, AccessTarget.none());

        String address = formatAddress(command);
        Geography requested = AddressParser.parse(address);
        String username = AccountService.normalizeUsername(command.username());
        AccountService.validatePassword(command.password());
        if (userAccountRepository.existsByUsernameIgnoreCase(username)) {
            throw new ProblemException(HttpStatus.CONFLICT, "USERNAME_TAKEN");
        }
        if (focalExistsFor(requested)) {
            throw new ProblemException(HttpStatus.CONFLICT, "FOCAL_ALREADY_EXISTS",
                    "A focal account already exists for " + requested.municipality() + ", " + requested.province());
        }

        UserAccount account = new UserAccount(username, passwordEncoder.encode(command.password()),
                command.fullName().trim(), UserRoleType.FOCAL);
        account.setAddress(address);
        UserAccount saved = userAccountRepository.save(account);

        auditLogService.record(AuditLogCommand.of(AuditLogService.ACTION_FOCAL_ACCOUNT_CREATED, "USER", saved.getId(),
                actor.userId(), Map.of("municipality", requested.municipality(), "province", requested.province())));
        log.info("Focal account {} created for {}, {} by user {}", saved.getId(), requested.municipality(),
                requested.province(), actor.userId());
        return AccountView.from(saved);
    }

    boolean focalExistsFor(Geography requested) {
        for (UserAccount focal : userAccountRepository.findByRole(UserRoleType.FOCAL)) {
            Geography placed = placementOf(focal);
            if (placed != null && placed.sameMunicipality(requested)) {
                return true;
            }
        }
        return false;
    }

    private Geography placementOf(UserAccount focal) {
        if (focal.getTenant() != null && focal.getTenant().getLocation() != null) {
            TenantLocation location = focal.getTenant().getLocation();
            return location.toGeography();
        }
        try {
            return AddressParser.parse(focal.getAddress());
        } catch (IncompleteAddressException ex) {
            log.warn("Focal account {} has an incomplete address and is ignored for uniqueness", focal.getId());
            return null;
        }
    }

    private static Geography requestedGeography(String municipality, String province) {
        if (municipality == null || municipality.isBlank() || province == null || province.isBlank()) {
            throw new ProblemException(HttpStatus.BAD_REQUEST, "MUNICIPALITY_AND_PROVINCE_REQUIRED");
        }
        return new Geography(null, municipality.trim(), province.trim(), null);
    }

    private static String formatAddress(CreateFocalAccountCommand command) {
        if (isBlank(command.barangay()) || isBlank(command.municipality()) || isBlank(command.province())) {
            throw new ProblemException(HttpStatus.UNPROCESSABLE_ENTITY, "INCOMPLETE_ADDRESS",
                    "Barangay, municipality and province are required");
        }
        return AddressParser.format(command.barangay(), command.municipality(), command.province(), command.region());
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    public record CreateFocalAccountCommand(
            String username,
            String password,
            String fullName,
            String barangay,
            String municipality,
            String province,
            String region
    ) {
    }

    public record FocalAvailability(String municipality, String province, boolean exists) {
    }
}
