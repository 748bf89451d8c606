package com.rah.notification.whatsapp.session;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.rah.notification.whatsapp.model.SessionCredentials;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;

/**
 * Stores credentials as {@code creds.json} inside the configured auth directory.
 *
 * Writes go to a temporary file that is then moved over the old one, so a crash in the
 * middle of a write leaves the previous credentials intact.
 */
@Slf4j
public class FileCredentialStore implements CredentialStore {

    static final String FILE_NAME = "creds.json";

    private final Path directory;
    private final ObjectMapper objectMapper;

    public FileCredentialStore(Path directory, ObjectMapper objectMapper) {
        this.directory = directory;
        this.objectMapper = objectMapper;
    }

    @Override
    public Optional<SessionCredentials> load() {
        Path file = credentialsFile();
        if (!Files.exists(file)) {
            log.info("No stored WhatsApp credentials in {}, a new device will be paired", directory);
            return Optional.empty();
        }
        try {
            SessionCredentials credentials = objectMapper.readValue(file.toFile(), SessionCredentials.class);
            log.info("Loaded WhatsApp credentials for session {}", credentials.sessionId());
            return Optional.of(credentials);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read WhatsApp credentials from " + file, e);
        }
    }

    @Override
    public void save(SessionCredentials credentials) {
        Path file = credentialsFile();
        try {
            Files.createDirectories(directory);
            Path temp = Files.createTempFile(directory, FILE_NAME, ".tmp");
            objectMapper.writeValue(temp.toFile(), credentials);
            try {
                Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
            }
            log.debug("Persisted WhatsApp credentials to {}", file);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot write WhatsApp credentials to " + file, e);
        }
    }

    @Override
    public void clear() {
        Path file = credentialsFile();
        try {
            if (Files.deleteIfExists(file)) {
                log.info("Removed stored WhatsApp credentials {}", file);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot delete WhatsApp credentials " + file, e);
        }
    }

    Path credentialsFile() {
        return directory.resolve(FILE_NAME);
    }
}
