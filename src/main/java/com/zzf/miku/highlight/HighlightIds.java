package com.zzf.miku.highlight;

import java.util.concurrent.ThreadLocalRandom;

public final class HighlightIds {
    private static final char[] BASE36 = "0123456789abcdefghijklmnopqrstuvwxyz".toCharArray();

    private HighlightIds() {}

    public static String suggestionId() {
        return "suggestion-" + System.currentTimeMillis() + "-" + randomBase36(9);
    }

    public static String commandId() {
        return "cmd-" + Long.toString(System.currentTimeMillis(), 36) + "-" + randomBase36(6);
    }

    public static String toolCallId() {
        return "call-" + Long.toString(System.currentTimeMillis(), 36) + "-" + randomBase36(8);
    }

    static String randomBase36(int length) {
        ThreadLocalRandom random = ThreadLocalRandom.current();
        StringBuilder sb = new StringBuilder(length);
        for (int i = 0; i < length; i++) {
            sb.append(BASE36[random.nextInt(BASE36.length)]);
        }
        return sb.toString();
    }
}
