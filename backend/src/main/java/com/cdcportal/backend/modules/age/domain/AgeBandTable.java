package com.cdcportal.backend.modules.age.domain;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Ordered set of age bands. Classification is first-match in declaration order,
 * so overlapping catalog rows resolve to the earliest one.
 */
public final class AgeBandTable {

    // '?' and U+FFFD both appear where a legacy export lost a character
    private static final String PLACEHOLDER = "[?\\uFFFD]";

    private static final Pattern DOTTED = Pattern.compile(
            "^(\\d+)(?:\\.(\\d+))?[-\\u2013\\u2014](\\d+)(?:\\.(\\d+))?$");
    private static final Pattern PLACEHOLDER_AS_POINT = Pattern.compile(
            "^(\\d+)(?:" + PLACEHOLDER + "(\\d+))?-(\\d+)(?:" + PLACEHOLDER + "(\\d+))?$");
    private static final Pattern PLACEHOLDER_AS_DELIMITER = Pattern.compile(
            "^(\\d+)(?:\\.(\\d+))?" + PLACEHOLDER + "(\\d+)(?:\\.(\\d+))?$");

    private static final List<Pattern> ENCODINGS = List.of(DOTTED, PLACEHOLDER_AS_POINT, PLACEHOLDER_AS_DELIMITER);

    private final Map<String, AgeRange> bands;

    private AgeBandTable(Map<String, AgeRange> bands) {
        this.bands = Collections.unmodifiableMap(bands);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Half-open year bands 3-4, 4-5 and 5-6 used by announcements and enrollment lists.
     */
    public static AgeBandTable canonical() {
        Builder builder = builder();
        for (CanonicalAgeBand band : CanonicalAgeBand.values()) {
            builder.add(band.key(), band.range());
        }
        return builder.build();
    }

    /**
     * Parses the first whitespace-separated token of a catalog range such as
     * {@code 3.1-4.0}, {@code 3?1-4?0} or {@code 5.1?5.11}.
     *
     * @throws UnparseableRangeException when no accepted encoding matches
     */
    public static AgeRange parse(String rawRange) {
        if (rawRange == null || rawRange.isBlank()) {
            throw new UnparseableRangeException(String.valueOf(rawRange), "Empty age range");
        }
        String token = rawRange.trim().split("\\s+", 2)[0];

        for (Pattern encoding : ENCODINGS) {
            Matcher matcher = encoding.matcher(token);
            if (matcher.matches()) {
                int min = toMonths(rawRange, matcher.group(1), matcher.group(2));
                int max = toMonths(rawRange, matcher.group(3), matcher.group(4));
                if (min > max) {
                    throw new UnparseableRangeException(rawRange, "Lower bound above upper bound");
                }
                return new AgeRange(min, max);
            }
        }
        throw new UnparseableRangeException(rawRange, "Unrecognised age range");
    }

    private static int toMonths(String rawRange, String yearsPart, String monthsPart) {
        try {
            int years = Integer.parseInt(yearsPart);
            int months = monthsPart == null ? 0 : Integer.parseInt(monthsPart);
            if (months > 11) {
                throw new UnparseableRangeException(rawRange, "Month component out of range");
            }
            return Math.addExact(Math.multiplyExact(years, 12), months);
        } catch (NumberFormatException | ArithmeticException ex) {
            throw new UnparseableRangeException(rawRange, "Numeric component too large");
        }
    }

    public Optional<String> classify(int totalMonths) {
        for (Map.Entry<String, AgeRange> entry : bands.entrySet()) {
            if (entry.getValue().contains(totalMonths)) {
                return Optional.of(entry.getKey());
            }
        }
        return Optional.empty();
    }

    public boolean hasBand(String key) {
        return bands.containsKey(key);
    }

    public Optional<AgeRange> rangeOf(String key) {
        return Optional.ofNullable(bands.get(key));
    }

    public List<String> keys() {
        return new ArrayList<>(bands.keySet());
    }

    public int size() {
        return bands.size();
    }

    public static final class Builder {

        private final Map<String, AgeRange> bands = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder add(String key, AgeRange range) {
            if (bands.putIfAbsent(key, range) != null) {
                throw new IllegalArgumentException("Duplicate age band key: " + key);
            }
            return this;
        }

        public AgeBandTable build() {
            return new AgeBandTable(new LinkedHashMap<>(bands));
        }
    }
}
