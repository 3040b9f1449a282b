package com.foiarelay.directory.delivery;

import com.foiarelay.directory.compose.SubmissionPayload;
import com.foiarelay.directory.model.ResolutionResult;

public record ComposedSubmission(
    ResolutionResult resolution,
    SubmissionPayload payload
) {}
