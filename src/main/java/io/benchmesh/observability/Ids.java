package io.benchmesh.observability;

import java.security.SecureRandom;

public final class Ids {
    private static final SecureRandom RANDOM = new SecureRandom();

    private Ids() {
    }

    public static String newTurnId() {
        return "turn_" + randomHex(8);
    }

    public static String newMessageId() {
        return "msg_" + randomHex(8);
    }

    public static String newLockId() {
        return "lock_" + randomHex(8);
    }

    public static String newSessionId() {
        return "session_" + randomHex(6);
    }

    private static String randomHex(int bytes) {
        byte[] value = new byte[bytes];
        RANDOM.nextBytes(value);
        StringBuilder sb = new StringBuilder(bytes * 2);
        for (byte b : value) {
            sb.append(String.format("%02x", b));
        }
        return sb.toString();
    }
}
