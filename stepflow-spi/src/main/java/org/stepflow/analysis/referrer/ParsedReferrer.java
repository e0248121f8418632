package org.stepflow.analysis.referrer;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

public class ParsedReferrer {
    public static final ParsedReferrer DIRECT = new ParsedReferrer("Direct", "direct", "", "");

    @JsonProperty("name")
    public final String name;
    @JsonProperty("type")
    public final String type;
    @JsonProperty("domain")
    public final String domain;
    @JsonProperty("url")
    public final String url;

    @JsonCreator
    public ParsedReferrer(@JsonProperty("name") String name,
                          @JsonProperty("type") String type,
                          @JsonProperty("domain") String domain,
                          @JsonProperty("url") String url) {
        this.name = name;
        this.type = type;
        this.domain = domain;
        this.url = url;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ParsedReferrer)) {
            return false;
        }
        ParsedReferrer that = (ParsedReferrer) o;
        return Objects.equals(name, that.name) && Objects.equals(type, that.type)
                && Objects.equals(domain, that.domain) && Objects.equals(url, that.url);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, type, domain, url);
    }

    @Override
    public String toString() {
        return name + " (" + type + ", " + domain + ")";
    }
}
