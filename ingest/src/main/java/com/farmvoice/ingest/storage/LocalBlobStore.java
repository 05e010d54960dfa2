package com.farmvoice.ingest.storage;

import com.farmvoice.ingest.port.AudioBlob;
import com.farmvoice.ingest.port.BlobStore;
import com.farmvoice.ingest.port.PipelineException;
import com.farmvoice.ingest.port.PipelineException.Kind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Reads recordings from a directory on local disk.
 *
 * Audio references are paths relative to the storage root. A reference
 * that resolves outside the root is rejected.
 */
@Component
public class LocalBlobStore implements BlobStore {

    private static final Logger log = LoggerFactory.getLogger(LocalBlobStore.class);

    private final Path root;

    public LocalBlobStore(@Value("${farmvoice.storage.local-path:./storage/recordings}") String rootPath) {
        this.root = Paths.get(rootPath).toAbsolutePath().normalize();
        log.info("Local audio storage at {}", root);
    }

    @Override
    public AudioBlob fetch(String audioRef) {
        if (audioRef == null || audioRef.isBlank()) {
            throw new PipelineException(Kind.STORAGE, "Empty audio reference");
        }
        Path file = root.resolve(audioRef).normalize();
        if (!file.startsWith(root)) {
            throw new PipelineException(Kind.STORAGE, "Audio reference outside storage root: " + audioRef);
        }
        if (!Files.isRegularFile(file)) {
            throw new PipelineException(Kind.STORAGE, "File not found: " + audioRef);
        }
        try {
            byte[] content = Files.readAllBytes(file);
            log.debug("Read {} bytes from {}", content.length, file);
            return new AudioBlob(file.getFileName().toString(), content);
        } catch (IOException e) {
            throw new PipelineException(Kind.STORAGE, "Could not read " + audioRef + ": " + e.getMessage(), e);
        }
    }
}
