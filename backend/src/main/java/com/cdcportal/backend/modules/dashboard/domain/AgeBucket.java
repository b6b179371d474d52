package com.cdcportal.backend.modules.dashboard.domain;

import com.cdcportal.backend.modules.age.domain.CanonicalAgeBand;
import com.cdcportal.backend.modules.age.domain.ChildAge;

/**
 * Reporting buckets: the canonical bands plus one open bucket on each side.
 */
public enum AgeBucket {
    UNDER_3("UNDER_3"),
    THREE_TO_FOUR("3-4"),
    FOUR_TO_FIVE("4-5"),
    FIVE_TO_SIX("5-6"),
    OVER_6("OVER_6");

    private final String label;

    AgeBucket(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public static AgeBucket of(ChildAge age) {
        return CanonicalAgeBand.fromTotalMonths(age.totalMonths())
                .map(band -> switch (band) {
                    case THREE_TO_FOUR -> THREE_TO_FOUR;
                    case FOUR_TO_FIVE -> FOUR_TO_FIVE;
                    case FIVE_TO_SIX -> FIVE_TO_SIX;
                })
                .orElseGet(() -> age.years() < 3 ? UNDER_3 : OVER_6);
    }
}
