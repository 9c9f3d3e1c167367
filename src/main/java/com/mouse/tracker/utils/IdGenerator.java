package com.mouse.tracker.utils;

import java.util.concurrent.ThreadLocalRandom;

public final class IdGenerator {

    private IdGenerator() {
    }

    /** Base-36 timestamp followed by a random base-36 suffix. */
    public static String newId() {
        return Long.toString(System.currentTimeMillis(), 36) + randomSuffix(9);
    }

    public static String sandboxId() {
        return "sbx_" + newId();
    }

    public static String exchangeId(String prefix) {
        return prefix + "_" + System.currentTimeMillis() + "_" + randomSuffix(9);
    }

    private static String randomSuffix(int length) {
        StringBuilder sb = new StringBuilder(length);
        ThreadLocalRandom random = ThreadLocalRandom.current();
        for (int i = 0; i < length; i++) {
            sb.append(Character.forDigit(random.nextInt(36), 36));
        }
        return sb.toString();
    }
}
