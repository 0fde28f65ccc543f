package com.example.fileingest.storage;

import org.junit.jupiter.api.Test;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;

class S3ObjectStorageTest {

    @Test
    void prefixesKeys() {
        try (S3ObjectStorage storage = new S3ObjectStorage(client(), "bucket", "documents//")) {
            assertEquals("documents/abc/file.pdf", storage.objectKey("abc/file.pdf"));
            assertEquals("documents/abc/sub/file.pdf", storage.objectKey("abc\\sub\\file.pdf"));
        }
    }

    @Test
    void emptyPrefixKeepsKey() {
        try (S3ObjectStorage storage = new S3ObjectStorage(client(), "bucket", null)) {
            assertEquals("abc/file.pdf", storage.objectKey(ObjectStorage.keyFor("abc", "file.pdf")));
        }
    }

    @Test
    void noStorageIsDisabled() throws Exception {
        ObjectStorage none = ObjectStorage.none();

        assertFalse(none.enabled());
        assertFalse(none.exists("a/b"));
        assertFalse(none.delete("a/b"));
    }

    private static S3Client client() {
        return S3Client.builder().region(Region.EU_CENTRAL_1).build();
    }
}
