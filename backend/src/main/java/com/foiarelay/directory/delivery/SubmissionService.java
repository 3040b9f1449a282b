package com.foiarelay.directory.delivery;

import com.foiarelay.config.DirectoryProperties;
import com.foiarelay.directory.compose.EmailPayload;
import com.foiarelay.directory.compose.PortalManifest;
import com.foiarelay.directory.compose.SubmissionComposer;
import com.foiarelay.directory.compose.SubmissionPayload;
import com.foiarelay.directory.model.CanonicalRecord;
import com.foiarelay.directory.model.DeliveryChannel;
import com.foiarelay.directory.model.ResolutionResult;
import com.foiarelay.directory.resolve.AgencyResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;

@Service
public class SubmissionService {
    private static final Logger log = LoggerFactory.getLogger(SubmissionService.class);

    private final AgencyResolver resolver;
    private final SubmissionComposer composer;
    private final MailDispatcher mailDispatcher;
    private final PortalAutomation portalAutomation;
    private final DirectoryProperties properties;
    private final Clock clock;

    public SubmissionService(
        AgencyResolver resolver,
        SubmissionComposer composer,
        MailDispatcher mailDispatcher,
        PortalAutomation portalAutomation,
        DirectoryProperties properties,
        Clock clock
    ) {
        this.resolver = resolver;
        this.composer = composer;
        this.mailDispatcher = mailDispatcher;
        this.portalAutomation = portalAutomation;
        this.properties = properties;
        this.clock = clock;
    }

    /** Resolves and composes without delivering anything. */
    public ComposedSubmission compose(SubmissionRequest request) {
        validate(request);
        ResolutionResult resolution = resolver.resolve(request.query());
        return new ComposedSubmission(resolution, payloadFor(resolution, request));
    }

    public SubmissionOutcome submit(SubmissionRequest request) {
        ComposedSubmission composed = compose(request);
        ResolutionResult resolution = composed.resolution();
        String agencyName = agencyName(resolution.record(), request);
        String portalUrl = properties.getPortal().portalUrlFor(portalUnitId(resolution, request));
        String fallback = properties.getPortal().getManualFallbackMessage();

        try {
            if (composed.payload() instanceof EmailPayload email) {
                mailDispatcher.send(email);
                log.info("FOIA request for {} emailed to {}", agencyName, email.to());
                return new SubmissionOutcome(
                    true,
                    DeliveryChannel.EMAIL,
                    "Your FOIA request has been emailed to " + agencyName + "! They will respond to "
                        + request.requester().email() + ".",
                    "FOIA-" + clock.millis(),
                    email.to(),
                    null,
                    null
                );
            }
            PortalManifest manifest = (PortalManifest) composed.payload();
            portalAutomation.prefill(manifest);
            log.info("Portal form for {} prefilled at {}", agencyName, manifest.portalUrl());
            return new SubmissionOutcome(
                true,
                DeliveryChannel.PORTAL,
                "Portal form opened and pre-filled. Complete the CAPTCHA and click Submit.",
                null,
                null,
                manifest.portalUrl(),
                null
            );
        } catch (DeliveryException e) {
            log.warn("Delivery via {} failed for {}: {}", resolution.channel(), agencyName, e.getMessage());
            return SubmissionOutcome.failure(
                resolution.channel(),
                "Failed to deliver request: " + e.getMessage() + ". " + fallback,
                portalUrl,
                fallback
            );
        } catch (RuntimeException e) {
            log.warn("Submission for {} failed unexpectedly", agencyName, e);
            return SubmissionOutcome.failure(
                resolution.channel(),
                "Submission failed: " + e.getMessage() + ". " + fallback,
                portalUrl,
                fallback
            );
        }
    }

    private SubmissionPayload payloadFor(ResolutionResult resolution, SubmissionRequest request) {
        if (resolution.channel() == DeliveryChannel.EMAIL) {
            return composer.composeEmail(resolution.emailAddress(), request.request(), request.requester());
        }
        return composer.composePortal(portalUnitId(resolution, request), request.request(), request.requester());
    }

    private String portalUnitId(ResolutionResult resolution, SubmissionRequest request) {
        if (resolution.record() != null) {
            return resolution.record().unitId();
        }
        return request.query().hasUnitId() ? request.unitId().trim() : null;
    }

    private String agencyName(CanonicalRecord record, SubmissionRequest request) {
        if (record != null && record.name() != null && !record.name().isBlank()) {
            return record.name();
        }
        return request.query().hasName() ? request.name().trim() : "the agency";
    }

    private void validate(SubmissionRequest request) {
        if (request == null || request.request() == null || request.requester() == null) {
            throw new IllegalArgumentException("request and requester are required");
        }
        if (request.request().rephrasedRequest() == null || request.request().rephrasedRequest().isBlank()) {
            throw new IllegalArgumentException("rephrasedRequest is required");
        }
        String email = request.requester().email();
        if (email == null || email.isBlank()) {
            throw new IllegalArgumentException("requester email is required");
        }
    }
}
