package com.tenantclient.service.impl;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tenantclient.config.ClientProperties;
import com.tenantclient.exception.TenantClientException;
import com.tenantclient.service.api.TokenStorage;
import jakarta.annotation.PostConstruct;
import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import lombok.extern.slf4j.Slf4j;
import org.jasypt.encryption.StringEncryptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

/**
 * A file-based {@link TokenStorage} that keeps tokens in a JSON file next to the user's profile.
 * <p>
 * Values are encrypted with a {@link StringEncryptor} before they are held in memory or written to
 * disk, so the file never contains a usable token. Every write is flushed to disk immediately;
 * file I/O is synchronized.
 */
@Service
@Slf4j
public class EncryptedFileTokenStorage implements TokenStorage {

    private static final String DEFAULT_DIRECTORY_NAME = ".tenant-client";
    private static final String TOKEN_FILE_NAME = "tokens.json";

    private final File tokenFile;
    private final StringEncryptor encryptor;
    private final ObjectMapper objectMapper = new ObjectMapper();
    private Map<String, String> values = new ConcurrentHashMap<>();

    /**
     * Resolves the token file from {@link ClientProperties#getStorageDirectory()}, then
     * {@code $TENANT_CLIENT_HOME}, then the user's home directory.
     *
     * @param encryptor  The {@link StringEncryptor} provided by the Jasypt Spring Boot starter.
     * @param properties The client settings.
     */
    @Autowired
    public EncryptedFileTokenStorage(StringEncryptor encryptor, ClientProperties properties) {
        this(encryptor, resolveDirectory(properties).resolve(TOKEN_FILE_NAME));
    }

    public EncryptedFileTokenStorage(StringEncryptor encryptor, Path tokenFile) {
        this.encryptor = encryptor;
        this.tokenFile = tokenFile.toFile();
    }

    @PostConstruct
    public void init() {
        load();
    }

    @Override
    public String read(String key) {
        String encrypted = values.get(key);
        if (encrypted == null) {
            return null;
        }
        try {
            return encryptor.decrypt(encrypted);
        } catch (Exception e) {
            log.error("Could not decrypt stored value '{}'. The encryption password may have changed.", key);
            return null;
        }
    }

    @Override
    public void write(String key, String value) {
        values.put(key, encryptor.encrypt(value));
        save();
    }

    @Override
    public void remove(String... keys) {
        boolean changed = false;
        for (String key : keys) {
            changed |= values.remove(key) != null;
        }
        if (changed) {
            save();
        }
    }

    private synchronized void save() {
        try {
            File parentDir = tokenFile.getParentFile();
            if (parentDir != null && !parentDir.exists() && !parentDir.mkdirs()) {
                throw new IOException("Failed to create parent directories at: " + parentDir.getAbsolutePath());
            }
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(tokenFile, values);
        } catch (IOException e) {
            log.error("Failed to write token file {}", tokenFile.getAbsolutePath(), e);
            throw new TenantClientException("Failed to persist tokens", e);
        }
    }

    /**
     * Loads the stored values. An unreadable file is moved aside with a {@code .corrupted.<millis>}
     * suffix and the session starts without tokens.
     */
    private synchronized void load() {
        if (!tokenFile.exists() || tokenFile.length() == 0) {
            log.info("No token file at {}, starting without a session.", tokenFile.getAbsolutePath());
            return;
        }
        try {
            Map<String, String> stored = objectMapper.readValue(tokenFile, new TypeReference<Map<String, String>>() {});
            values = new ConcurrentHashMap<>(stored);
            log.info("Loaded stored session from {}", tokenFile.getAbsolutePath());
        } catch (IOException e) {
            log.warn("Could not parse token file {}. It will be backed up and ignored. Error: {}",
                    tokenFile.getAbsolutePath(), e.getMessage());
            backupCorruptedFile();
            values = new ConcurrentHashMap<>();
        }
    }

    private void backupCorruptedFile() {
        File backupFile = new File(tokenFile.getAbsolutePath() + ".corrupted." + System.currentTimeMillis());
        try {
            Files.move(tokenFile.toPath(), backupFile.toPath(), StandardCopyOption.REPLACE_EXISTING);
            log.info("Backed up corrupted token file to {}", backupFile.getAbsolutePath());
        } catch (IOException e) {
            log.error("Failed to back up corrupted token file {} to {}",
                    tokenFile.getAbsolutePath(), backupFile.getAbsolutePath(), e);
        }
    }

    private static Path resolveDirectory(ClientProperties properties) {
        if (properties.getStorageDirectory() != null && !properties.getStorageDirectory().isBlank()) {
            return Path.of(properties.getStorageDirectory());
        }
        String home = System.getenv("TENANT_CLIENT_HOME") != null
                ? System.getenv("TENANT_CLIENT_HOME")
                : System.getProperty("user.home");
        return Path.of(home, DEFAULT_DIRECTORY_NAME);
    }
}
