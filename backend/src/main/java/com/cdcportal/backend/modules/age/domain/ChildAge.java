package com.cdcportal.backend.modules.age.domain;

import java.math.BigDecimal;

/**
 * Age of a child on a reference date. Decisions use {@code totalMonths};
 * {@code decimalYears} is for display.
 */
public record ChildAge(int years, int months, int totalMonths, BigDecimal decimalYears) {
}
