package com.regwatch.collectors.api;

import com.regwatch.core.model.Source;

/**
 * Fetches a source and reduces its body to a content digest.
 */
public interface Fingerprinter {
    /**
     * @return lowercase hex digest of the full response body
     * @throws FetchException when the fetch times out, fails at the transport level or
     *                        the server answers outside the 2xx range
     */
    String fingerprint(Source source) throws FetchException, InterruptedException;
}
