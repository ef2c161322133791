package com.vcc.router.service.experiment;

import java.nio.charset.StandardCharsets;
import java.nio.ByteBuffer;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/**
 * Deterministic traffic bucketing. The same experiment and request key always land in the same bucket.
 */
public final class StableHasher {

    public static final int BUCKETS = 10_000;

    private StableHasher() {
    }

    /**
     * Bucket in [0, 10000) derived from SHA-256 of {@code experimentId:key}.
     */
    public static int bucket(String experimentId, String key) {
        byte[] hash = sha256(experimentId + ":" + key);
        long prefix = ByteBuffer.wrap(hash, 0, Long.BYTES).getLong();
        return (int) Math.floorMod(prefix, (long) BUCKETS);
    }

    /**
     * Whether the bucket falls inside the given traffic share (0 to 100 percent).
     */
    public static boolean inTraffic(String experimentId, String key, double trafficPercent) {
        if (trafficPercent <= 0.0d) {
            return false;
        }
        return bucket(experimentId, key) < trafficPercent * (BUCKETS / 100.0d);
    }

    private static byte[] sha256(String input) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return digest.digest(input.getBytes(StandardCharsets.UTF_8));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 algorithm not available", e);
        }
    }
}
