package com.starscape.mediavault.features.library.app;

import com.starscape.mediavault.features.library.domain.ContentHash;
import org.apache.commons.codec.digest.DigestUtils;
import org.springframework.stereotype.Component;

import java.io.BufferedInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Computes SHA-256 content hashes. The file is streamed through the digest in
 * fixed-size chunks, so memory use does not grow with file size.
 */
@Component
public class ContentHasher {
    
    private static final int BUFFER_SIZE = 64 * 1024;
    
    public ContentHash hash(Path file) throws IOException {
        try (InputStream in = new BufferedInputStream(Files.newInputStream(file), BUFFER_SIZE)) {
            return ContentHash.sha256(DigestUtils.sha256Hex(in));
        }
    }
}
