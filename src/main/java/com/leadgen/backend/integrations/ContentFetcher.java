package com.leadgen.backend.integrations;

import java.util.Optional;

public interface ContentFetcher {

    /**
     * Fetch a web resource, reading at most {@code maxBytes} of its body.
     *
     * @return the content, or empty when the resource does not exist
     * @throws ThrottledException  when the remote host throttles us
     * @throws CapabilityException on timeouts and other transport failures
     */
    Optional<FetchedContent> fetch(String url, long maxBytes) throws CapabilityException;
}
