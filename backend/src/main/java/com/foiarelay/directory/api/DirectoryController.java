package com.foiarelay.directory.api;

import com.foiarelay.directory.delivery.ComposedSubmission;
import com.foiarelay.directory.delivery.SubmissionOutcome;
import com.foiarelay.directory.delivery.SubmissionRequest;
import com.foiarelay.directory.delivery.SubmissionService;
import com.foiarelay.directory.model.CanonicalRecord;
import com.foiarelay.directory.model.PipelineRunRequest;
import com.foiarelay.directory.model.PipelineRunSummary;
import com.foiarelay.directory.model.ResolutionQuery;
import com.foiarelay.directory.model.ResolutionResult;
import com.foiarelay.directory.resolve.AgencyResolver;
import com.foiarelay.directory.resolve.AgencySearchService;
import com.foiarelay.directory.service.DirectoryPipelineService;
import com.foiarelay.directory.store.DirectoryStore;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;

import static org.springframework.http.HttpStatus.BAD_REQUEST;
import static org.springframework.http.HttpStatus.NOT_FOUND;

@RestController
@RequestMapping("/api")
public class DirectoryController {
    private final AgencySearchService searchService;
    private final AgencyResolver resolver;
    private final DirectoryStore store;
    private final SubmissionService submissionService;
    private final DirectoryPipelineService pipelineService;

    public DirectoryController(
        AgencySearchService searchService,
        AgencyResolver resolver,
        DirectoryStore store,
        SubmissionService submissionService,
        DirectoryPipelineService pipelineService
    ) {
        this.searchService = searchService;
        this.resolver = resolver;
        this.store = store;
        this.submissionService = submissionService;
        this.pipelineService = pipelineService;
    }

    @GetMapping("/agencies")
    public List<CanonicalRecord> searchAgencies(
        @RequestParam(name = "search", required = false) String search,
        @RequestParam(name = "limit", required = false) Integer limit
    ) {
        if (limit != null && limit < 1) {
            throw new ResponseStatusException(BAD_REQUEST, "limit must be positive");
        }
        return searchService.search(search, limit);
    }

    @GetMapping("/agencies/{unitId}")
    public CanonicalRecord getAgency(@PathVariable("unitId") String unitId) {
        return store.findByUnitId(unitId)
            .orElseThrow(() -> new ResponseStatusException(NOT_FOUND, "Unknown agency component " + unitId));
    }

    @PostMapping("/resolve")
    public ResolutionResult resolve(@RequestBody ResolveRequest request) {
        return resolver.resolve(new ResolutionQuery(request.unitId(), request.name()));
    }

    @PostMapping("/compose")
    public ComposedSubmission compose(@RequestBody SubmissionRequest request) {
        return submissionService.compose(request);
    }

    @PostMapping("/submit")
    public SubmissionOutcome submit(@RequestBody SubmissionRequest request) {
        return submissionService.submit(request);
    }

    @PostMapping("/pipeline/run")
    public PipelineRunSummary runPipeline(@RequestBody(required = false) PipelineRunRequest request) {
        return pipelineService.run(request == null ? PipelineRunRequest.defaults() : request);
    }

    @PostMapping("/pipeline/start")
    public PipelineStartResponse startPipeline(@RequestBody(required = false) PipelineRunRequest request) {
        long runId = pipelineService.startAsync(request == null ? PipelineRunRequest.defaults() : request);
        return new PipelineStartResponse(runId, DirectoryPipelineService.STATUS_RUNNING);
    }

    @GetMapping("/pipeline/status")
    public PipelineStatusResponse pipelineStatus() {
        return new PipelineStatusResponse(pipelineService.isActive(), pipelineService.latest().orElse(null));
    }
}
