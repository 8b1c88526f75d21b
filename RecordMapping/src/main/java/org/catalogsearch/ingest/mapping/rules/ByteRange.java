package org.catalogsearch.ingest.mapping.rules;

import org.catalogsearch.ingest.mapping.ConfigurationException;

/**
 * A {@code start:length} window applied to an extracted value, e.g. {@code 35:3} for the
 * language code in a 008 field.
 */
public record ByteRange(int start, int length) {

    public static ByteRange parse(String spec) {
        var parts = spec.split(":", -1);
        if (parts.length != 2) {
            throw new ConfigurationException("Byte range must look like 'start:length', got '" + spec + "'");
        }
        try {
            var start = Integer.parseInt(parts[0].trim());
            var length = Integer.parseInt(parts[1].trim());
            if (start < 0 || length < 0) {
                throw new ConfigurationException("Byte range must not be negative, got '" + spec + "'");
            }
            try {
                Math.addExact(start, length);
            } catch (ArithmeticException e) {
                throw new ConfigurationException("Byte range ends past the largest offset, got '" + spec + "'", e);
            }
            return new ByteRange(start, length);
        } catch (NumberFormatException e) {
            throw new ConfigurationException("Byte range must look like 'start:length', got '" + spec + "'", e);
        }
    }

    public int end() {
        return start + length;
    }

    public boolean fitsWithin(String value) {
        return (long) start + length <= value.length();
    }

    public String slice(String value) {
        return value.substring(start, end());
    }

    @Override
    public String toString() {
        return start + ":" + length;
    }
}
