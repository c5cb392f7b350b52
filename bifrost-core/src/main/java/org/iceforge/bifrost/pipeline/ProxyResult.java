package org.iceforge.bifrost.pipeline;

import org.iceforge.bifrost.audit.AccessEvent;
import org.iceforge.bifrost.error.ErrorCode;

/** How one pass through the pipeline ended. */
public record ProxyResult(AccessEvent.Outcome outcome, ErrorCode error, long bytes) {

    public boolean succeeded() {
        return outcome == AccessEvent.Outcome.SUCCEEDED;
    }
}
