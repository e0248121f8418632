package org.stepflow.analysis.referrer;

import java.util.Optional;

public interface ReferrerProvider {
    /**
     * @param hostname lower-cased host, possibly with a leading {@code www.}
     */
    Optional<ReferrerInfo> lookup(String hostname);
}
