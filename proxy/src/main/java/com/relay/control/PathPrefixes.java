package com.relay.control;

public final class PathPrefixes {

    private PathPrefixes() {
    }

    public static String normalize(String prefix) {
        String normalized = prefix == null ? "" : prefix.trim();
        if (normalized.endsWith("/*")) {
            normalized = normalized.substring(0, normalized.length() - 2);
        }
        while (normalized.endsWith("/")) {
            normalized = normalized.substring(0, normalized.length() - 1);
        }
        if (!normalized.isEmpty() && !normalized.startsWith("/")) {
            normalized = "/" + normalized;
        }
        return normalized;
    }

    public static boolean matches(String normalizedPrefix, String path) {
        if (normalizedPrefix.isEmpty()) {
            return true;
        }
        if (!path.startsWith(normalizedPrefix)) {
            return false;
        }
        return path.length() == normalizedPrefix.length()
                || path.charAt(normalizedPrefix.length()) == '/';
    }
}
