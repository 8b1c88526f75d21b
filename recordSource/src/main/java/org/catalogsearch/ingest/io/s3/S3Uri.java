package org.catalogsearch.ingest.io.s3;

import java.net.URI;

import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Utilities;

/**
 * Bucket and key of an {@code s3://bucket/key} location. The key may be empty when the location
 * names the bucket itself; a trailing slash on the key is dropped.
 */
public record S3Uri(String bucketName, String key) {
    public static final String SCHEME_PREFIX = "s3://";

    // Parsing is region independent; the utilities just need one to be built.
    private static final S3Utilities S3_UTILITIES = S3Utilities.builder().region(Region.US_EAST_1).build();

    public S3Uri {
        if (bucketName == null || bucketName.isBlank()) {
            throw new IllegalArgumentException("Bucket name cannot be null or empty");
        }
        key = key == null ? "" : stripTrailingSlash(key);
    }

    public static boolean isS3Uri(String location) {
        return location != null && location.startsWith(SCHEME_PREFIX);
    }

    public static S3Uri parse(String location) {
        if (!isS3Uri(location)) {
            throw new IllegalArgumentException("Not an s3:// location: " + location);
        }
        try {
            var parsed = S3_UTILITIES.parseUri(URI.create(location));
            var bucket = parsed.bucket()
                .orElseThrow(() -> new IllegalArgumentException("No bucket in " + location));
            return new S3Uri(bucket, parsed.key().orElse(""));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid S3 URI: " + location, e);
        }
    }

    public boolean hasKey() {
        return !key.isEmpty();
    }

    /** The bucket alone, as an {@code s3://bucket} location. */
    public S3Uri bucketOnly() {
        return new S3Uri(bucketName, "");
    }

    private static String stripTrailingSlash(String value) {
        return value.endsWith("/") ? value.substring(0, value.length() - 1) : value;
    }

    @Override
    public String toString() {
        return SCHEME_PREFIX + bucketName + (key.isEmpty() ? "" : "/" + key);
    }
}
