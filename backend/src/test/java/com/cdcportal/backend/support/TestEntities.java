package com.cdcportal.backend.support;

import java.time.LocalDate;

import com.cdcportal.backend.modules.account.domain.UserAccount;
import com.cdcportal.backend.modules.account.domain.UserRoleType;
import com.cdcportal.backend.modules.student.domain.Student;
import com.cdcportal.backend.modules.tenant.domain.Tenant;
import com.cdcportal.backend.modules.tenant.domain.TenantLocation;

import org.springframework.test.util.ReflectionTestUtils;

/**
 * Detached entities with assigned ids for service tests that run without a database.
 */
public final class TestEntities {

    private TestEntities() {
    }

    public static <T> T withId(T entity, Long id) {
        ReflectionTestUtils.setField(entity, "id", id);
        return entity;
    }

    public static Tenant tenant(Long id, String municipality, String province) {
        TenantLocation location = withId(new TenantLocation("IV-A", province, municipality, "Poblacion"), id);
        return withId(new Tenant("CDC " + id, location), id);
    }

    public static UserAccount user(Long id, UserRoleType role, Tenant tenant) {
        UserAccount account = withId(new UserAccount("user" + id, "{noop}secret", "User " + id, role), id);
        account.setTenant(tenant);
        return account;
    }

    public static Student student(Long id, LocalDate birthdate, Tenant tenant) {
        return withId(new Student("Child", null, "No" + id, birthdate, "F", tenant), id);
    }
}
