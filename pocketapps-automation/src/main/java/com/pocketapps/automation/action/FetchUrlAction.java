package com.pocketapps.automation.action;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.TextNode;
import com.pocketapps.automation.data.DataKeys;
import com.pocketapps.automation.data.DataPoint;
import com.pocketapps.automation.job.Job;
import com.pocketapps.automation.store.DataPointStore;
import com.pocketapps.common.json.JsonPaths;
import com.pocketapps.common.net.FetchRejectedException;
import com.pocketapps.common.net.FetchedBody;
import com.pocketapps.common.net.UrlFetcher;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Fetches a URL through the guarded fetcher and stores the result.
 * <p>
 * Writes two data points on success: the value under {@code outputKey} and
 * the completion time under {@code <outputKey>_updated_at}. A rejected or
 * failed fetch writes nothing.
 */
@Slf4j
class FetchUrlAction implements ActionHandler<FetchUrlConfig> {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);

    private final DataPointStore store;
    private final UrlFetcher fetcher;
    private final Clock clock;

    FetchUrlAction(DataPointStore store, UrlFetcher fetcher, Clock clock) {
        this.store = store;
        this.fetcher = fetcher;
        this.clock = clock;
    }

    @Override
    public List<DataPoint> execute(Job job, FetchUrlConfig config) {
        long appId = job.getAppId();
        Optional<String> url = UrlTemplate.expand(config.url().trim(), name -> latestText(appId, name));
        if (url.isEmpty()) {
            log.warn("Job {}: skipping fetch, URL variables {} have no stored value yet",
                    job.getId(), UrlTemplate.variables(config.url()));
            return List.of();
        }

        FetchedBody response;
        try {
            response = fetcher.fetch(url.get());
        } catch (FetchRejectedException e) {
            log.warn("Job {}: fetch failed: {}", job.getId(), e.getMessage());
            return List.of();
        }

        JsonNode value = extract(response.body(), config.dataPath());
        String outputKey = DataKeys.resolve(config.outputKey(), job.getId(), "fetch");

        List<DataPoint> written = new ArrayList<>(2);
        written.add(store.append(appId, outputKey, value));
        written.add(store.append(appId, DataKeys.updatedAtKey(outputKey),
                TextNode.valueOf(clock.instant().toString())));
        log.debug("Job {}: stored {} bytes from fetch under {}", job.getId(), response.byteCount(), outputKey);
        return written;
    }

    /**
     * Parse the body and apply {@code dataPath}. Non-JSON bodies are kept as
     * text; an unresolved path keeps the whole body.
     */
    static JsonNode extract(String body, String dataPath) {
        JsonNode parsed;
        try {
            parsed = MAPPER.readTree(body);
        } catch (JsonProcessingException e) {
            return TextNode.valueOf(body);
        }
        if (parsed == null || parsed.isMissingNode()) {
            return TextNode.valueOf(body);
        }
        if (dataPath == null || dataPath.isBlank()) {
            return parsed;
        }
        return JsonPaths.select(parsed, dataPath).orElse(parsed);
    }

    private Optional<String> latestText(long appId, String key) {
        return store.findLatest(appId, key)
                .map(DataPoint::value)
                .filter(value -> !value.isNull() && !value.isMissingNode())
                .map(value -> value.isValueNode() ? value.asText() : value.toString());
    }
}
