package com.pocketapps.automation.action;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashSet;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * {@code {key}} variables inside fetch URLs, e.g.
 * {@code https://api.example.com/v1/{api_key}/rates}.
 */
final class UrlTemplate {

    private static final Pattern VARIABLE = Pattern.compile("\\{([a-zA-Z0-9_]{1,100})\\}");

    private UrlTemplate() {
    }

    static Set<String> variables(String template) {
        Set<String> names = new LinkedHashSet<>();
        Matcher m = VARIABLE.matcher(template);
        while (m.find()) {
            names.add(m.group(1));
        }
        return names;
    }

    /**
     * Replace every variable with the URL-encoded value from {@code lookup}.
     *
     * @return the expanded URL, or empty if any variable has no value
     */
    static Optional<String> expand(String template, Function<String, Optional<String>> lookup) {
        Matcher m = VARIABLE.matcher(template);
        StringBuilder out = new StringBuilder();
        while (m.find()) {
            Optional<String> value = lookup.apply(m.group(1));
            if (value.isEmpty()) {
                return Optional.empty();
            }
            m.appendReplacement(out, Matcher.quoteReplacement(encode(value.get())));
        }
        m.appendTail(out);
        return Optional.of(out.toString());
    }

    /**
     * Fill every variable with a fixed placeholder so the template can be
     * syntax-checked at registration time.
     */
    static String withSampleValues(String template) {
        return VARIABLE.matcher(template).replaceAll("x");
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8).replace("+", "%20");
    }
}
