package org.catalogsearch.ingest.io.s3;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.util.concurrent.CompletionException;

import org.catalogsearch.ingest.io.BlobSource;

import lombok.extern.slf4j.Slf4j;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.core.async.AsyncResponseTransformer;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3AsyncClient;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.HeadObjectRequest;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;

/**
 * Blobs in an S3 bucket, under an optional key prefix.  Objects are streamed rather than
 * downloaded whole, since record dumps can be several gigabytes.
 */
@Slf4j
public class S3BlobSource implements BlobSource {

    private final S3AsyncClient s3Client;
    private final String bucketName;
    private final String keyPrefix;

    /**
     * @param s3Uri the bucket and key prefix, e.g. {@code s3://bucket/exports}
     * @param region the AWS region, or null to use the SDK's default region lookup
     * @param endpoint custom S3 endpoint, or null for AWS
     */
    public S3BlobSource(S3Uri s3Uri, String region, URI endpoint) {
        this(s3Uri, buildClient(region, endpoint));
    }

    public S3BlobSource(S3Uri s3Uri, S3AsyncClient s3Client) {
        this.bucketName = s3Uri.bucketName();
        this.keyPrefix = s3Uri.key();
        this.s3Client = s3Client;
    }

    private static S3AsyncClient buildClient(String region, URI endpoint) {
        var clientBuilder = S3AsyncClient.builder()
            .credentialsProvider(DefaultCredentialsProvider.create());
        if (region != null) {
            clientBuilder.region(Region.of(region));
        }
        if (endpoint != null) {
            clientBuilder.endpointOverride(endpoint);
        }
        return clientBuilder.build();
    }

    @Override
    public InputStream getBlob(String path) throws IOException {
        String fullKey = buildFullKey(path);
        log.debug("Streaming S3 object: s3://{}/{}", bucketName, fullKey);

        var request = GetObjectRequest.builder()
            .bucket(bucketName)
            .key(fullKey)
            .build();
        try {
            return s3Client.getObject(request, AsyncResponseTransformer.toBlockingInputStream()).join();
        } catch (CompletionException e) {
            throw new IOException("Failed to get S3 object: s3://" + bucketName + "/" + fullKey, e.getCause());
        }
    }

    @Override
    public boolean exists(String path) {
        String fullKey = buildFullKey(path);
        try {
            s3Client.headObject(headRequest(fullKey)).join();
            return true;
        } catch (CompletionException e) {
            if (!(e.getCause() instanceof NoSuchKeyException)) {
                log.warn("Error checking if S3 object exists: s3://{}/{}", bucketName, fullKey, e);
            }
            return false;
        }
    }

    @Override
    public long getBlobSize(String path) throws IOException {
        String fullKey = buildFullKey(path);
        try {
            return s3Client.headObject(headRequest(fullKey)).join().contentLength();
        } catch (CompletionException e) {
            throw new IOException("Failed to get S3 object size: s3://" + bucketName + "/" + fullKey, e.getCause());
        }
    }

    private HeadObjectRequest headRequest(String fullKey) {
        return HeadObjectRequest.builder()
            .bucket(bucketName)
            .key(fullKey)
            .build();
    }

    String buildFullKey(String path) {
        if (keyPrefix.isEmpty()) {
            return path;
        }
        return keyPrefix + "/" + path;
    }

    @Override
    public void close() {
        s3Client.close();
    }
}
