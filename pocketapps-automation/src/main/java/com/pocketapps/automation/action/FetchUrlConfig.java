package com.pocketapps.automation.action;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.pocketapps.automation.data.DataKeys;
import com.pocketapps.automation.job.JobValidationException;
import com.pocketapps.common.net.SsrfGuard;

import java.net.URI;
import java.net.URISyntaxException;

/**
 * {@code fetch_url}: fetches an https URL and stores the (optionally
 * path-extracted) body under {@code outputKey}. The URL may contain
 * {@code {key}} variables filled from stored data at fetch time.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record FetchUrlConfig(String url, String outputKey, String dataPath, String triggerOnKey)
        implements ActionConfig {

    /** Longest {@code outputKey} whose {@code _updated_at} companion is still a valid key. */
    static final int MAX_OUTPUT_KEY_LENGTH = DataKeys.MAX_LENGTH - DataKeys.UPDATED_AT_SUFFIX.length();

    @Override
    public ActionKind kind() {
        return ActionKind.FETCH_URL;
    }

    @Override
    public void validate() {
        if (url == null || url.isBlank()) {
            throw new JobValidationException("fetch_url requires 'url'");
        }
        if (outputKey == null || outputKey.isBlank()) {
            throw new JobValidationException("fetch_url requires 'outputKey'");
        }
        if (outputKey.length() > MAX_OUTPUT_KEY_LENGTH) {
            throw new JobValidationException("fetch_url 'outputKey' is longer than "
                    + MAX_OUTPUT_KEY_LENGTH + " characters");
        }
        ActionConfigs.checkTriggerKey(triggerOnKey);

        URI uri;
        try {
            uri = new URI(UrlTemplate.withSampleValues(url.trim()));
        } catch (URISyntaxException e) {
            throw new JobValidationException("fetch_url 'url' is not a valid URL");
        }
        if (uri.getScheme() == null || !uri.getScheme().equalsIgnoreCase("https")) {
            throw new JobValidationException("fetch_url 'url' must use https");
        }
        if (uri.getHost() == null) {
            throw new JobValidationException("fetch_url 'url' has no host");
        }
        try {
            SsrfGuard.validateHostname(uri.getHost(), SsrfGuard.Policy.DEFAULT);
        } catch (SsrfGuard.SsrfBlockedError e) {
            throw new JobValidationException("fetch_url 'url' targets a blocked host: " + e.getMessage());
        }
    }
}
