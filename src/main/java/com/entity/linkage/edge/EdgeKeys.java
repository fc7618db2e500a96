package com.entity.linkage.edge;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Collection;
import java.util.List;
import java.util.TreeSet;

/**
 * Deterministic keys for edges and golden records.
 * Every key is a 32-character MD5 hex digest of identifiers in sorted order,
 * so it does not depend on argument order. Each identifier is length-prefixed
 * before hashing, so identifiers containing separators cannot collide.
 */
public final class EdgeKeys {

    private static final String RESOLVED_PREFIX = "resolved->";

    private EdgeKeys() {
    }

    /**
     * Key of the similarity edge between two records; {@code edgeKey(a, b) == edgeKey(b, a)}.
     */
    public static String edgeKey(String a, String b) {
        requireIds(a, b);
        return a.compareTo(b) <= 0 ? md5Hex(encode(List.of(a, b))) : md5Hex(encode(List.of(b, a)));
    }

    /**
     * Key of a resolved-to edge between a member record and its golden record.
     */
    public static String resolvedEdgeKey(String memberId, String goldenKey) {
        requireIds(memberId, goldenKey);
        List<String> ends = memberId.compareTo(goldenKey) <= 0
                ? List.of(memberId, goldenKey)
                : List.of(goldenKey, memberId);
        return md5Hex(RESOLVED_PREFIX + encode(ends));
    }

    /**
     * Key of the golden record built from a set of member records.
     */
    public static String goldenKey(Collection<String> memberIds) {
        if (memberIds == null || memberIds.isEmpty()) {
            throw new IllegalArgumentException("A golden record needs at least one member");
        }
        List<String> sorted = List.copyOf(new TreeSet<>(memberIds));
        return md5Hex(encode(sorted));
    }

    /**
     * Joins identifiers as {@code length:id|length:id...}.
     */
    static String encode(List<String> ids) {
        StringBuilder sb = new StringBuilder();
        for (String id : ids) {
            if (sb.length() > 0) {
                sb.append('|');
            }
            sb.append(id.length()).append(':').append(id);
        }
        return sb.toString();
    }

    static String md5Hex(String value) {
        try {
            MessageDigest digest = MessageDigest.getInstance("MD5");
            byte[] hash = digest.digest(value.getBytes(StandardCharsets.UTF_8));
            StringBuilder hex = new StringBuilder(hash.length * 2);
            for (byte b : hash) {
                hex.append(Character.forDigit((b >> 4) & 0xF, 16));
                hex.append(Character.forDigit(b & 0xF, 16));
            }
            return hex.toString();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("MD5 not available", e);
        }
    }

    private static void requireIds(String a, String b) {
        if (a == null || b == null) {
            throw new IllegalArgumentException("Edge endpoints must not be null");
        }
    }
}
