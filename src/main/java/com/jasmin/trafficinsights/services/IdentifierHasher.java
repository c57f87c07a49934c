package com.jasmin.trafficinsights.services;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;

/**
 * Turns raw visitor identifiers (IP addresses) into salted SHA-256 hex digests before
 * they are stored, so visitors stay countable without the raw value ever being kept.
 */
@Service
@Slf4j
public class IdentifierHasher {

    static final int SALT_BYTES = 32;

    private final byte[] salt;

    @Autowired
    public IdentifierHasher(IdentifierProperties props) {
        this(loadOrCreateSalt(Paths.get(props.getSaltFile())));
    }

    IdentifierHasher(byte[] salt) {
        if (salt == null || salt.length == 0) {
            throw new IllegalArgumentException("Salt must not be empty");
        }
        this.salt = salt.clone();
    }

    public String hash(String rawIdentifier) {
        if (rawIdentifier == null) {
            throw new IllegalArgumentException("Identifier must not be null");
        }
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            md.update(salt);
            byte[] out = md.digest(rawIdentifier.getBytes(StandardCharsets.UTF_8));
            StringBuilder sb = new StringBuilder(out.length * 2);
            for (byte b : out) sb.append(String.format("%02x", b));
            return sb.toString();
        } catch (NoSuchAlgorithmException e) {
            // every JRE ships SHA-256
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    static byte[] loadOrCreateSalt(Path saltFile) {
        try {
            if (Files.exists(saltFile)) {
                byte[] salt = Files.readAllBytes(saltFile);
                if (salt.length == 0) {
                    throw new IllegalStateException("Salt file " + saltFile + " is empty");
                }
                return salt;
            }
            Path parent = saltFile.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            byte[] salt = new byte[SALT_BYTES];
            new SecureRandom().nextBytes(salt);
            Files.write(saltFile, salt);
            log.info("Created new identifier salt at {}", saltFile.toAbsolutePath());
            return salt;
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read or create salt file " + saltFile, e);
        }
    }
}
