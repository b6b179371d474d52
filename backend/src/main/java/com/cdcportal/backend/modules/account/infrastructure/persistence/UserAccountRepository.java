package com.cdcportal.backend.modules.account.infrastructure.persistence;

import java.util.List;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import com.cdcportal.backend.modules.account.domain.UserAccount;
import com.cdcportal.backend.modules.account.domain.UserRoleType;

public interface UserAccountRepository extends JpaRepository<UserAccount, Long> {

    boolean existsByUsernameIgnoreCase(String username);

    List<UserAccount> findByRole(UserRoleType role);

    /**
     * Staff of the tenant plus parent accounts linked to one of its children.
     */
    @Query("""
            select u
              from UserAccount u
             where u.tenant.id = :tenantId
                or u.id in (select g.guardianUser.id
                              from GuardianInfo g
                             where g.student.tenant.id = :tenantId)
             order by u.role, u.fullName
            """)
    List<UserAccount> findAccountsOfTenant(@Param("tenantId") Long tenantId);
}
