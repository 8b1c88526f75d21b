package org.catalogsearch.ingest.io.s3;

import java.io.IOException;
import java.util.concurrent.CompletableFuture;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import software.amazon.awssdk.services.s3.S3AsyncClient;
import software.amazon.awssdk.services.s3.model.HeadObjectRequest;
import software.amazon.awssdk.services.s3.model.HeadObjectResponse;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class S3BlobSourceTest {

    @Mock
    S3AsyncClient s3Client;

    S3BlobSource blobSource;

    @BeforeEach
    void setUp() {
        blobSource = new S3BlobSource(S3Uri.parse("s3://exports/aleph"), s3Client);
    }

    @Test
    void keysAreResolvedUnderThePrefix() {
        assertEquals("aleph/full.mrc", blobSource.buildFullKey("full.mrc"));
        assertEquals("full.mrc", new S3BlobSource(S3Uri.parse("s3://exports"), s3Client).buildFullKey("full.mrc"));
    }

    @Test
    void sizeComesFromHeadObject() throws IOException {
        when(s3Client.headObject(any(HeadObjectRequest.class)))
            .thenReturn(CompletableFuture.completedFuture(HeadObjectResponse.builder().contentLength(2048L).build()));

        assertEquals(2048L, blobSource.getBlobSize("full.mrc"));

        var request = ArgumentCaptor.forClass(HeadObjectRequest.class);
        verify(s3Client).headObject(request.capture());
        assertEquals("exports", request.getValue().bucket());
        assertEquals("aleph/full.mrc", request.getValue().key());
    }

    @Test
    void missingKeyDoesNotExist() {
        when(s3Client.headObject(any(HeadObjectRequest.class)))
            .thenReturn(CompletableFuture.failedFuture(NoSuchKeyException.builder().message("missing").build()));

        assertFalse(blobSource.exists("missing.mrc"));
    }

    @Test
    void sizeOfMissingKeyFails() {
        when(s3Client.headObject(any(HeadObjectRequest.class)))
            .thenReturn(CompletableFuture.failedFuture(NoSuchKeyException.builder().message("missing").build()));

        var exception = assertThrows(IOException.class, () -> blobSource.getBlobSize("missing.mrc"));
        assertTrue(exception.getMessage().contains("s3://exports/aleph/missing.mrc"));
    }

    @Test
    void closeReleasesTheClient() throws IOException {
        blobSource.close();

        verify(s3Client).close();
    }
}
