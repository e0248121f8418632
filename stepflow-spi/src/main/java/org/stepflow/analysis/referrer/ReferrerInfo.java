package org.stepflow.analysis.referrer;

import java.util.Objects;

import static java.util.Objects.requireNonNull;

/**
 * Display name and medium of a known referring site.
 */
public class ReferrerInfo {
    public final String name;
    public final Medium medium;

    public ReferrerInfo(String name, Medium medium) {
        this.name = requireNonNull(name, "name is null");
        this.medium = requireNonNull(medium, "medium is null");
    }

    public String getType() {
        return medium.toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ReferrerInfo)) {
            return false;
        }
        ReferrerInfo that = (ReferrerInfo) o;
        return name.equals(that.name) && medium == that.medium;
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, medium);
    }

    @Override
    public String toString() {
        return name + "(" + medium + ")";
    }
}
