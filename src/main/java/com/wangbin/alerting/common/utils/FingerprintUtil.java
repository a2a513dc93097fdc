package com.wangbin.alerting.common.utils;

import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.TreeMap;

/**
 * 告警指纹工具
 *
 * 与 Alertmanager 兼容：按标签名排序后对 "name 0xFF value 0xFF" 序列做 FNV-1a 64 位哈希，
 * 输出16位小写十六进制。
 */
public final class FingerprintUtil {

    private static final long FNV_OFFSET_BASIS = 0xcbf29ce484222325L;
    private static final long FNV_PRIME = 0x100000001b3L;
    private static final byte SEPARATOR = (byte) 0xFF;

    private FingerprintUtil() {
    }

    public static String fromLabels(Map<String, String> labels) {
        long hash = FNV_OFFSET_BASIS;
        if (labels != null && !labels.isEmpty()) {
            Map<String, String> sorted = labels instanceof TreeMap ? labels : new TreeMap<>(labels);
            for (Map.Entry<String, String> entry : sorted.entrySet()) {
                hash = update(hash, entry.getKey().getBytes(StandardCharsets.UTF_8));
                hash = update(hash, SEPARATOR);
                String value = entry.getValue() == null ? "" : entry.getValue();
                hash = update(hash, value.getBytes(StandardCharsets.UTF_8));
                hash = update(hash, SEPARATOR);
            }
        }
        return String.format("%016x", hash);
    }

    private static long update(long hash, byte[] bytes) {
        for (byte b : bytes) {
            hash = update(hash, b);
        }
        return hash;
    }

    private static long update(long hash, byte b) {
        hash ^= (b & 0xFF);
        return hash * FNV_PRIME;
    }
}
