package org.stepflow.analysis.referrer;

import com.google.common.net.InetAddresses;
import com.google.common.net.InternetDomainName;
import com.google.inject.Inject;

import javax.annotation.Nullable;

import java.net.MalformedURLException;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.URL;
import java.util.Locale;
import java.util.Optional;

/**
 * Normalizes a raw referrer string into a named source. Empty values and the {@code Direct} markers map to
 * {@link ParsedReferrer#DIRECT}; anything that is not a URL keeps its raw text with an empty domain.
 */
public class ReferrerParser {
    private static final String DIRECT = "direct";
    private static final String REFERRER = "referrer";

    private final ReferrerProvider provider;

    @Inject
    public ReferrerParser(ReferrerProvider provider) {
        this.provider = provider;
    }

    public ParsedReferrer parse(@Nullable String referrer) {
        if (referrer == null || referrer.isEmpty() || referrer.equals("Direct") || referrer.equalsIgnoreCase("(direct)")) {
            return ParsedReferrer.DIRECT;
        }

        String url = referrer.startsWith("http://") || referrer.startsWith("https://") ? referrer : "https://" + referrer;
        String host = hostOf(url);
        if (host == null) {
            return unparsable(referrer);
        }

        String hostname = host.toLowerCase(Locale.ENGLISH);
        String withoutWww = hostname.startsWith("www.") ? hostname.substring(4) : hostname;

        Optional<ReferrerInfo> known = provider.lookup(hostname);
        if (!known.isPresent()) {
            known = provider.lookup(withoutWww);
        }
        if (known.isPresent()) {
            return new ParsedReferrer(known.get().name, known.get().getType(), withoutWww, referrer);
        }
        return new ParsedReferrer(withoutWww, REFERRER, withoutWww, referrer);
    }

    /**
     * Grouping key of a referrer, the lower-cased domain or {@code direct} when there is none.
     */
    public static String segmentKey(ParsedReferrer parsed) {
        return parsed.domain == null || parsed.domain.isEmpty() ? DIRECT : parsed.domain.toLowerCase(Locale.ENGLISH);
    }

    /**
     * Host of the URL, or null when there is none. {@link URI} rejects underscores in host names and raw
     * spaces in the query, so the lenient {@link URL} parser is tried next and its host is kept only when it
     * is a valid domain name or IP literal.
     */
    @Nullable
    private static String hostOf(String url) {
        try {
            String host = new URI(url).getHost();
            if (host != null && !host.isEmpty()) {
                return host;
            }
        } catch (URISyntaxException e) {
            // retried below
        }

        String host;
        try {
            host = new URL(url).getHost();
        } catch (MalformedURLException e) {
            return null;
        }
        if (host == null || host.isEmpty()) {
            return null;
        }
        return InternetDomainName.isValid(host) || InetAddresses.isUriInetAddress(host) ? host : null;
    }

    private static ParsedReferrer unparsable(String referrer) {
        return new ParsedReferrer(referrer, REFERRER, "", referrer);
    }
}
