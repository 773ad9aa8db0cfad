package com.incidentcommander.common.model;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Map;
import java.util.TreeMap;

/**
 * Canonical SHA-256 digest of a finding's content. Evidence entries are hashed in key order
 * so the digest is independent of map iteration order.
 */
public final class FindingDigests {

    private FindingDigests() {}

    public static String compute(AgentRole role, int round, double confidence,
                                 String recommendedAction, Map<String, Object> evidence) {
        StringBuilder canonical = new StringBuilder()
            .append(role).append('|')
            .append(round).append('|')
            .append(confidence).append('|')
            .append(recommendedAction).append('|');
        if (evidence != null) {
            new TreeMap<>(evidence).forEach((k, v) ->
                canonical.append(k).append('=').append(v).append(';'));
        }
        try {
            MessageDigest sha = MessageDigest.getInstance("SHA-256");
            byte[] hash = sha.digest(canonical.toString().getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash);
        } catch (NoSuchAlgorithmException e) {
            // every JRE is required to ship SHA-256
            throw new IllegalStateException("SHA-256 unavailable", e);
        }
    }
}
