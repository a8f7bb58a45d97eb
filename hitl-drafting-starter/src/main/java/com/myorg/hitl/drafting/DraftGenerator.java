package com.myorg.hitl.drafting;

import com.myorg.hitl.contracts.drafting.DraftRequest;
import com.myorg.hitl.contracts.drafting.DraftResult;

/**
 * Produces a reply draft for human review. No persistent side effects.
 */
public interface DraftGenerator {

    /**
     * @throws com.myorg.hitl.contracts.core.exception.DraftParseException       output violates the draft schema
     * @throws com.myorg.hitl.contracts.core.exception.ConnectivityException     completion call failed, retry later
     * @throws com.myorg.hitl.contracts.core.exception.UpstreamRejectedException completion service refused the request
     */
    DraftResult draft(DraftRequest request);
}
