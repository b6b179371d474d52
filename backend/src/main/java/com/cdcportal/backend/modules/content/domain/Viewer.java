package com.cdcportal.backend.modules.content.domain;

import com.cdcportal.backend.modules.account.domain.UserRoleType;
import com.cdcportal.backend.modules.age.domain.ChildAge;
import com.cdcportal.backend.modules.tenant.domain.Geography;

/**
 * Whoever content is being filtered for. {@code childAge} is set when a parent
 * views on behalf of their child; {@code geography} for geography-scoped roles.
 */
public record Viewer(UserRoleType role, Long tenantId, ChildAge childAge, Geography geography) {

    public static Viewer tenantMember(UserRoleType role, Long tenantId) {
        return new Viewer(role, tenantId, null, null);
    }

    public static Viewer parent(Long tenantId, ChildAge childAge) {
        return new Viewer(UserRoleType.PARENT, tenantId, childAge, null);
    }

    public static Viewer geographyScoped(UserRoleType role, Geography geography) {
        return new Viewer(role, null, null, geography);
    }

    public boolean isGeographyScoped() {
        return role != null && role.scope() == UserRoleType.ScopeKind.GEOGRAPHY;
    }

    public boolean actsForChild() {
        return role != null && role.scope() == UserRoleType.ScopeKind.CHILD;
    }
}
