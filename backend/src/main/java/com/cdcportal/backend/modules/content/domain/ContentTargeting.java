package com.cdcportal.backend.modules.content.domain;

import java.util.Objects;

import com.cdcportal.backend.modules.age.domain.AgeBandTable;

/**
 * Decides whether a content item is shown to a viewer. Checks run in a fixed
 * order (role, tenant, age, geography) and stop at the first failure. Missing
 * data hides the item; nothing here throws for bad data.
 */
public final class ContentTargeting {

    public static final String ALL_AGES = "all";

    private final AgeBandTable ageBands;

    public ContentTargeting(AgeBandTable ageBands) {
        this.ageBands = Objects.requireNonNull(ageBands, "ageBands");
    }

    public boolean visible(TargetedContent item, Viewer viewer) {
        if (item == null || viewer == null || viewer.role() == null) {
            return false;
        }
        return roleMatches(item, viewer)
                && tenantMatches(item, viewer)
                && ageMatches(item, viewer)
                && geographyMatches(item, viewer);
    }

    private boolean roleMatches(TargetedContent item, Viewer viewer) {
        return item.audience() != null && item.audience().contains(viewer.role());
    }

    private boolean tenantMatches(TargetedContent item, Viewer viewer) {
        if (viewer.isGeographyScoped()) {
            // broadcast items are tenant-independent and never reach geography viewers
            return item.tenantId() != null;
        }
        return item.tenantId() == null || item.tenantId().equals(viewer.tenantId());
    }

    private boolean ageMatches(TargetedContent item, Viewer viewer) {
        String filter = item.ageFilter();
        if (filter == null || filter.isBlank()) {
            return false;
        }
        if (ALL_AGES.equalsIgnoreCase(filter.trim()) || !viewer.actsForChild()) {
            return true;
        }
        if (viewer.childAge() == null) {
            return false;
        }
        return ageBands.classify(viewer.childAge().totalMonths())
                .map(band -> band.equals(filter.trim()))
                .orElse(false);
    }

    private boolean geographyMatches(TargetedContent item, Viewer viewer) {
        if (!viewer.isGeographyScoped()) {
            return true;
        }
        return viewer.geography() != null && viewer.geography().sameMunicipality(item.tenantGeography());
    }
}
