package com.cdcportal.backend.modules.tenant.application;

import java.util.Optional;

import com.cdcportal.backend.global.error.ProblemException;
import com.cdcportal.backend.modules.account.domain.UserAccount;
import com.cdcportal.backend.modules.account.domain.UserRoleType;
import com.cdcportal.backend.modules.student.domain.GuardianInfo;
import com.cdcportal.backend.modules.student.domain.Student;
import com.cdcportal.backend.modules.student.infrastructure.persistence.GuardianInfoRepository;
import com.cdcportal.backend.modules.tenant.domain.AddressParser;
import com.cdcportal.backend.modules.tenant.domain.Geography;
import com.cdcportal.backend.modules.tenant.domain.OrphanTenantException;
import com.cdcportal.backend.modules.tenant.domain.Tenant;
import com.cdcportal.backend.modules.tenant.infrastructure.persistence.TenantRepository;

import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Answers which tenant or geography a person belongs to.
 */
@Service
@Transactional(readOnly = true)
public class TenantDirectory {

    private final TenantRepository tenantRepository;
    private final GuardianInfoRepository guardianInfoRepository;

    public TenantDirectory(TenantRepository tenantRepository, GuardianInfoRepository guardianInfoRepository) {
        this.tenantRepository = tenantRepository;
        this.guardianInfoRepository = guardianInfoRepository;
    }

    /**
     * Parents belong to the tenant of their linked child; everyone else to their own.
     */
    public Optional<Tenant> tenantOf(UserAccount user) {
        if (user.getRole() == UserRoleType.PARENT) {
            return linkedStudentOf(user).map(Student::getTenant);
        }
        return Optional.ofNullable(user.getTenant());
    }

    public Tenant tenantOf(Student student) {
        return student.getTenant();
    }

    public Optional<Student> linkedStudentOf(UserAccount user) {
        return guardianInfoRepository.findByGuardianUserId(user.getId()).map(GuardianInfo::getStudent);
    }

    public Geography locationOf(Long tenantId) {
        Tenant tenant = tenantRepository.findWithLocationById(tenantId)
                .orElseThrow(() -> new ProblemException(HttpStatus.NOT_FOUND, "TENANT_NOT_FOUND"));
        if (tenant.getLocation() == null) {
            throw new OrphanTenantException(tenantId);
        }
        return tenant.getLocation().toGeography();
    }

    /**
     * Focal and MSW accounts are placed by their address; other roles by their tenant.
     */
    public Geography resolveViewerGeography(UserAccount user) {
        if (user.getRole().scope() == UserRoleType.ScopeKind.GEOGRAPHY) {
            return AddressParser.parse(user.getAddress());
        }
        Tenant tenant = tenantOf(user)
                .orElseThrow(() -> new ProblemException(HttpStatus.NOT_FOUND, "TENANT_NOT_FOUND"));
        return locationOf(tenant.getId());
    }
}
