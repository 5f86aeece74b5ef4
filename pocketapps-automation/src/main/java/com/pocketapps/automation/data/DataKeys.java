package com.pocketapps.automation.data;

import java.util.regex.Pattern;

/**
 * Rules for data point keys.
 */
public final class DataKeys {

    public static final int MAX_LENGTH = 100;

    public static final Pattern KEY_PATTERN = Pattern.compile("^[a-zA-Z0-9_]{1," + MAX_LENGTH + "}$");

    public static final String UPDATED_AT_SUFFIX = "_updated_at";

    private DataKeys() {
    }

    public static boolean isValid(String key) {
        return key != null && KEY_PATTERN.matcher(key).matches();
    }

    /**
     * Use {@code candidate} if it is a valid key, otherwise derive one from the
     * job id, e.g. {@code job_12_fetch}.
     */
    public static String resolve(String candidate, long jobId, String suffix) {
        if (isValid(candidate)) {
            return candidate;
        }
        return "job_" + jobId + "_" + suffix;
    }

    /**
     * Key holding the completion time of the last successful fetch into
     * {@code outputKey}.
     */
    public static String updatedAtKey(String outputKey) {
        return outputKey + UPDATED_AT_SUFFIX;
    }
}
