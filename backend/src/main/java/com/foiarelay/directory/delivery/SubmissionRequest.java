package com.foiarelay.directory.delivery;

import com.foiarelay.directory.compose.RequestContent;
import com.foiarelay.directory.compose.RequesterDetails;
import com.foiarelay.directory.model.ResolutionQuery;

public record SubmissionRequest(
    String unitId,
    String name,
    RequestContent request,
    RequesterDetails requester
) {
    public ResolutionQuery query() {
        return new ResolutionQuery(unitId, name);
    }
}
