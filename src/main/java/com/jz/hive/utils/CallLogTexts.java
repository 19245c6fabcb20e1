package com.jz.hive.utils;

/**
 * 通话记录消息的展示文案。
 * 时长：秒数四舍五入，不足 60 秒显示秒，否则按分钟向上取整。
 */
public final class CallLogTexts {

    private CallLogTexts() {}

    public static final String VIDEO = "video";
    public static final String AUDIO = "audio";

    public static String normalizeType(String callType) {
        return AUDIO.equalsIgnoreCase(callType) ? AUDIO : VIDEO;
    }

    public static String calling(String callType) {
        return label(callType) + " • Calling...";
    }

    public static String missed(String callType) {
        return VIDEO.equals(normalizeType(callType)) ? "Missed video call" : "Missed audio call";
    }

    public static String ended(String callType, long durationMs) {
        long seconds = Math.round(durationMs / 1000.0);
        if (seconds < 60) {
            return label(callType) + " • " + seconds + "s";
        }
        long minutes = (seconds + 59) / 60;
        return label(callType) + " • " + minutes + " min";
    }

    private static String label(String callType) {
        return VIDEO.equals(normalizeType(callType)) ? "Video call" : "Audio call";
    }
}
