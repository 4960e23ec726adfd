package com.projectcontext.core.vcs;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Normalizes VCS remote URLs so that different spellings of the same repository
 * compare equal.
 *
 * <p>{@code https://github.com/acme/api.git}, {@code git@github.com:acme/api.git}
 * and {@code ssh://git@GitHub.com:22/acme/api/} all normalize to
 * {@code github.com/acme/api}.
 */
public final class RemoteUrls {

    private static final Pattern URL = Pattern.compile(
        "^[a-zA-Z][a-zA-Z0-9+.-]*://(?:[^@/]+@)?([^/:]+)(?::\\d*)?(?:/(.*))?$");
    private static final Pattern SCP = Pattern.compile("^(?:[^@/]+@)?([^:/]+):(.+)$");

    private RemoteUrls() {
        // Utility class
    }

    /**
     * Normalizes a remote URL to {@code host/path}.
     *
     * @param remote remote URL, may be null
     * @return normalized form, empty for null or blank input
     */
    public static String normalize(String remote) {
        if (remote == null || remote.isBlank()) {
            return "";
        }
        String trimmed = remote.trim();

        Matcher url = URL.matcher(trimmed);
        if (url.matches()) {
            return join(url.group(1), url.group(2));
        }
        Matcher scp = SCP.matcher(trimmed);
        if (scp.matches()) {
            return join(scp.group(1), scp.group(2));
        }
        return stripPath(trimmed);
    }

    private static String join(String host, String path) {
        String normalizedHost = host.toLowerCase(Locale.ROOT);
        String normalizedPath = path == null ? "" : stripPath(path);
        return normalizedPath.isEmpty() ? normalizedHost : normalizedHost + "/" + normalizedPath;
    }

    private static String stripPath(String path) {
        String result = path;
        while (result.endsWith("/")) {
            result = result.substring(0, result.length() - 1);
        }
        if (result.endsWith(".git")) {
            result = result.substring(0, result.length() - ".git".length());
        }
        while (result.endsWith("/")) {
            result = result.substring(0, result.length() - 1);
        }
        while (result.startsWith("/")) {
            result = result.substring(1);
        }
        return result;
    }
}
