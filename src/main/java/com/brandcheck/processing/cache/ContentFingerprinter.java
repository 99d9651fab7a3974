package com.brandcheck.processing.cache;

import com.brandcheck.processing.model.PageImage;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Derives the cache key of a page: SHA-256 over the length-prefixed page bytes followed by the analysis
 * method version.
 * Identical (content, method version) pairs always produce the same key, across restarts.
 */
@Component
public class ContentFingerprinter {

    private static final String ALGORITHM = "SHA-256";

    public String fingerprint(PageImage contentRef, String methodVersion) throws IOException {
        return fingerprint(Files.readAllBytes(contentRef.getPath()), methodVersion);
    }

    public String fingerprint(byte[] content, String methodVersion) {
        MessageDigest digest = newDigest();
        digest.update(ByteBuffer.allocate(Long.BYTES).putLong(content.length).array());
        digest.update(content);
        if (methodVersion != null) {
            digest.update(methodVersion.getBytes(StandardCharsets.UTF_8));
        }
        return HexFormat.of().formatHex(digest.digest());
    }

    private static MessageDigest newDigest() {
        try {
            return MessageDigest.getInstance(ALGORITHM);
        } catch (NoSuchAlgorithmException e) {
            // Every JRE is required to ship SHA-256
            throw new IllegalStateException(ALGORITHM + " not available", e);
        }
    }
}
