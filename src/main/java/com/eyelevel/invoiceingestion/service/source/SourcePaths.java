package com.eyelevel.invoiceingestion.service.source;

/**
 * Helpers for the {@code /}-separated paths used by every {@link SourceConnector}.
 */
public final class SourcePaths {

    private SourcePaths() {
    }

    public static String join(String first, String... more) {
        StringBuilder joined = new StringBuilder(trimTrailingSlash(first));
        for (String part : more) {
            if (part == null || part.isEmpty()) {
                continue;
            }
            String clean = part.startsWith("/") ? part.substring(1) : part;
            if (joined.length() > 0 && joined.charAt(joined.length() - 1) != '/') {
                joined.append('/');
            }
            joined.append(trimTrailingSlash(clean));
        }
        return joined.toString();
    }

    public static String parent(String path) {
        String trimmed = trimTrailingSlash(path);
        int slash = trimmed.lastIndexOf('/');
        if (slash < 0) {
            return "";
        }
        return slash == 0 ? "/" : trimmed.substring(0, slash);
    }

    public static String fileName(String path) {
        String trimmed = trimTrailingSlash(path);
        return trimmed.substring(trimmed.lastIndexOf('/') + 1);
    }

    private static String trimTrailingSlash(String path) {
        if (path == null) {
            return "";
        }
        return path.length() > 1 && path.endsWith("/") ? path.substring(0, path.length() - 1) : path;
    }
}
