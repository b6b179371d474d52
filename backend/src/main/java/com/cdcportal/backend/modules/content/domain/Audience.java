package com.cdcportal.backend.modules.content.domain;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.Set;
import java.util.stream.Collectors;

import com.cdcportal.backend.modules.account.domain.UserRoleType;

/**
 * Role sets stored as comma separated role codes.
 */
public final class Audience {

    private Audience() {
    }

    public static Set<UserRoleType> parse(String stored) {
        if (stored == null || stored.isBlank()) {
            return EnumSet.noneOf(UserRoleType.class);
        }
        Set<UserRoleType> roles = EnumSet.noneOf(UserRoleType.class);
        Arrays.stream(stored.split(","))
                .map(String::trim)
                .filter(code -> !code.isEmpty())
                .map(UserRoleType::fromCode)
                .filter(role -> role != UserRoleType.UNASSIGNED)
                .forEach(roles::add);
        return roles;
    }

    public static String format(Set<UserRoleType> roles) {
        return roles.stream()
                .sorted()
                .map(UserRoleType::code)
                .collect(Collectors.joining(","));
    }
}
