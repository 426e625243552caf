package com.whereq.pilot.executor;

import com.whereq.pilot.model.ResourceType;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * One known failure marker in a captured log, and the reason it maps to.
 *
 * The reason template may use {value} (the extracted quantity, empty when
 * none), {line} (the whole matching line) and {tail} (the text after the
 * last colon).
 */
@Value
@Builder
public class FailureSignature {

    /**
     * Extracts a quantity from a matching line, or from the rendered submit descriptor
     */
    @FunctionalInterface
    public interface ValueExtractor {
        Optional<Double> extract(String line, Map<String, String> descriptor);
    }

    /**
     * Substrings that must all appear on the line
     */
    @Singular
    List<String> markers;

    boolean ignoreCase;

    /**
     * Resource dimension the failure is about, null for non-resource failures
     */
    ResourceType dimension;

    String reasonTemplate;

    ValueExtractor extractor;

    /**
     * A later match replaces a reason already found
     */
    boolean overriding;

    /**
     * The extracted value is the measured usage and goes into the reported resources
     */
    boolean recordsUsage;

    /**
     * Render the value without a fraction
     */
    boolean integralValue;

    public boolean matches(String line) {
        String haystack = ignoreCase ? line.toLowerCase(Locale.ROOT) : line;
        for (String marker : markers) {
            String needle = ignoreCase ? marker.toLowerCase(Locale.ROOT) : marker;
            if (!haystack.contains(needle)) {
                return false;
            }
        }
        return true;
    }

    public Optional<Double> extractValue(String line, Map<String, String> descriptor) {
        if (extractor == null) {
            return Optional.empty();
        }
        return extractor.extract(ignoreCase ? line.toLowerCase(Locale.ROOT) : line, descriptor);
    }

    /**
     * Render the reason for a matching line
     *
     * @param value quantity to substitute, may be null
     */
    public String reason(String line, Object value) {
        String tail = line.contains(":") ? line.substring(line.lastIndexOf(':') + 1).trim() : line;
        String rendered = reasonTemplate
            .replace("{line}", line)
            .replace("{tail}", tail);
        return rendered.replace("{value}", formatValue(value));
    }

    private String formatValue(Object value) {
        if (value == null) {
            return "";
        }
        if (integralValue && value instanceof Number) {
            return String.valueOf(((Number) value).longValue());
        }
        return String.valueOf(value);
    }

    /**
     * Signature for a batch system resource violation, reported as overusage of the dimension
     */
    public static FailureSignatureBuilder overusage(ResourceType dimension) {
        return builder()
            .dimension(dimension)
            .ignoreCase(true)
            .reasonTemplate("Resource overusage for " + dimension.getKey() + ": {value}");
    }

    /**
     * Parse the number between the last occurrence of {@code after} and the next {@code before}
     */
    public static Optional<Double> numberBetween(String line, String after, String before) {
        int start = line.lastIndexOf(after);
        if (start < 0) {
            return Optional.empty();
        }
        String rest = line.substring(start + after.length());
        int end = rest.indexOf(before);
        if (end < 0) {
            return Optional.empty();
        }
        try {
            return Optional.of(Double.parseDouble(rest.substring(0, end).trim()));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    /**
     * Parse a descriptor setting as a number, dividing by a unit factor
     */
    public static Optional<Double> descriptorValue(Map<String, String> descriptor, String key, double divisor) {
        String raw = descriptor.get(key);
        if (raw == null) {
            return Optional.empty();
        }
        String digits = raw.replaceAll("[^0-9.]", "");
        try {
            return Optional.of(Double.parseDouble(digits) / divisor);
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }
}
