package org.stepflow.analysis.referrer;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.inject.Inject;
import io.airlift.log.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Known referrers bundled with the library in {@code referers.yml}, laid out as
 * medium, then source name, then the source's domains. A host that is not listed falls back to its
 * parent domains, so {@code l.facebook.com} resolves through {@code facebook.com}.
 */
public class StaticReferrerProvider
        implements ReferrerProvider {
    private static final Logger LOGGER = Logger.get(StaticReferrerProvider.class);
    private static final String RESOURCE = "referers.yml";

    private final Map<String, ReferrerInfo> referrers;

    @Inject
    public StaticReferrerProvider() {
        this(index(load()));
    }

    public StaticReferrerProvider(Map<String, ReferrerInfo> referrers) {
        this.referrers = ImmutableMap.copyOf(referrers);
    }

    private static Map<Medium, Map<String, Source>> load() {
        ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
        try (InputStream stream = StaticReferrerProvider.class.getResourceAsStream(RESOURCE)) {
            if (stream == null) {
                throw new IllegalStateException("Resource " + RESOURCE + " is missing");
            }
            return mapper.readValue(stream, new TypeReference<Map<Medium, Map<String, Source>>>() {});
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to read " + RESOURCE, e);
        }
    }

    static Map<String, ReferrerInfo> index(Map<Medium, Map<String, Source>> media) {
        Map<String, ReferrerInfo> referrers = new HashMap<>();
        for (Map.Entry<Medium, Map<String, Source>> medium : media.entrySet()) {
            for (Map.Entry<String, Source> source : medium.getValue().entrySet()) {
                for (String domain : source.getValue().domains) {
                    ReferrerInfo info = new ReferrerInfo(source.getKey(), medium.getKey());
                    ReferrerInfo existing = referrers.putIfAbsent(domain.toLowerCase(Locale.ENGLISH), info);
                    if (existing != null && !existing.equals(info)) {
                        throw new IllegalStateException("Domain " + domain + " is listed for both " + existing + " and " + info);
                    }
                }
            }
        }
        LOGGER.debug("Loaded %d known referrer domains", referrers.size());
        return referrers;
    }

    @Override
    public Optional<ReferrerInfo> lookup(String hostname) {
        String host = hostname;
        while (true) {
            ReferrerInfo info = referrers.get(host);
            if (info != null) {
                return Optional.of(info);
            }
            int dot = host.indexOf('.');
            // stop before a bare top-level domain
            if (dot < 0 || host.indexOf('.', dot + 1) < 0) {
                return Optional.empty();
            }
            host = host.substring(dot + 1);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    static class Source {
        final List<String> domains;

        @JsonCreator
        Source(@JsonProperty("domains") List<String> domains) {
            this.domains = domains == null ? ImmutableList.of() : ImmutableList.copyOf(domains);
        }
    }
}
