package com.coderag.store;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

public final class CollectionNames {
    static final int MAX_BASE_LENGTH = 30;

    private CollectionNames() {
    }

    /**
     * Sanitized directory name (at most 30 chars) plus the first 12 hex chars of the md5 of the absolute path.
     */
    public static String forProject(Path projectRoot) {
        Path absolute = projectRoot.toAbsolutePath().normalize();
        Path fileName = absolute.getFileName();
        String base = fileName == null ? "root" : fileName.toString().replaceAll("[^a-zA-Z0-9_-]", "_");
        if (base.length() > MAX_BASE_LENGTH) {
            base = base.substring(0, MAX_BASE_LENGTH);
        }
        if (base.isEmpty()) {
            base = "root";
        }
        return base + "_" + md5Hex(absolute.toString()).substring(0, 12);
    }

    public static String md5Hex(String value) {
        try {
            MessageDigest digest = MessageDigest.getInstance("MD5");
            return HexFormat.of().formatHex(digest.digest(value.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("MD5 unavailable", e);
        }
    }
}
