package com.cdcportal.backend.modules.tenant.domain;

import java.util.Arrays;
import java.util.List;

/**
 * Reads free-text addresses of the form {@code barangay, municipality, province[, region]}.
 */
public final class AddressParser {

    private static final int MIN_PARTS = 3;

    private AddressParser() {
    }

    public static Geography parse(String address) {
        List<String> parts = address == null ? List.of() : Arrays.stream(address.split(","))
                .map(String::trim)
                .filter(part -> !part.isEmpty())
                .toList();
        if (parts.size() < MIN_PARTS) {
            throw new IncompleteAddressException(parts.size());
        }
        String region = parts.size() > MIN_PARTS ? parts.get(3) : null;
        return new Geography(parts.get(0), parts.get(1), parts.get(2), region);
    }

    public static String format(String barangay, String municipality, String province, String region) {
        StringBuilder sb = new StringBuilder()
                .append(barangay.trim()).append(", ")
                .append(municipality.trim()).append(", ")
                .append(province.trim());
        if (region != null && !region.isBlank()) {
            sb.append(", ").append(region.trim());
        }
        return sb.toString();
    }
}
