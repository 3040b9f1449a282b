package com.foiarelay.directory.compose;

import com.foiarelay.config.DirectoryProperties;
import com.foiarelay.directory.model.CanonicalRecord;
import com.foiarelay.directory.model.DeliveryChannel;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;

/**
 * Turns a resolved agency plus requester input into the artifact for the chosen channel:
 * a plain-text email, or an ordered manifest of portal form fields.
 */
@Component
public class SubmissionComposer {
    static final String DEFAULT_WAIVER_JUSTIFICATION = "Information will contribute significantly to public understanding.";
    static final String COUNTRY_UNITED_STATES = "246";

    private static final DateTimeFormatter SIGNATURE_DATE = DateTimeFormatter.ofPattern("MM/dd/yyyy");

    private final DirectoryProperties properties;
    private final Clock clock;

    public SubmissionComposer(DirectoryProperties properties, Clock clock) {
        this.properties = properties;
        this.clock = clock;
    }

    public SubmissionPayload compose(
        DeliveryChannel channel,
        CanonicalRecord record,
        RequestContent request,
        RequesterDetails requester
    ) {
        if (channel == DeliveryChannel.EMAIL) {
            if (record == null || !record.hasEmail()) {
                throw new IllegalArgumentException("Email delivery needs an agency record with an email address");
            }
            return composeEmail(record.primaryEmail(), request, requester);
        }
        return composePortal(record == null ? null : record.unitId(), request, requester);
    }

    public EmailPayload composeEmail(String to, RequestContent request, RequesterDetails requester) {
        String subject = "FOIA Request - " + nullToEmpty(request.briefDescription()).trim();
        return new EmailPayload(to, subject, emailBody(request, requester), requester.email(), requester.fullName());
    }

    public PortalManifest composePortal(String unitId, RequestContent request, RequesterDetails requester) {
        DirectoryProperties.Portal portal = properties.getPortal();
        boolean extended = portal.isExtendedFormUnit(unitId);
        PostalAddress address = requester.address();
        String description = nullToEmpty(request.rephrasedRequest());

        List<PortalField> fields = new ArrayList<>();
        fields.add(PortalField.fill("root_requester_contact_name_first", nullToEmpty(requester.firstName())));
        fields.add(PortalField.fill("root_requester_contact_name_last", nullToEmpty(requester.lastName())));
        fields.add(PortalField.fill("root_requester_contact_email", nullToEmpty(requester.email())));
        if (requester.hasPhone()) {
            fields.add(PortalField.fill("root_requester_contact_phone_number", requester.phone().trim()));
        }
        fields.add(PortalField.fill("root_requester_contact_address_line1", nullToEmpty(address.line1())));
        if (address.line2() != null && !address.line2().isBlank()) {
            fields.add(PortalField.fill("root_requester_contact_address_line2", address.line2().trim()));
        }
        fields.add(PortalField.fill("root_requester_contact_address_city", nullToEmpty(address.city())));
        fields.add(PortalField.fill("root_requester_contact_address_zip_postal_code", nullToEmpty(address.zip())));
        fields.add(PortalField.fill("root_requester_contact_address_state_province", nullToEmpty(address.state())));
        fields.add(PortalField.select("root_requester_contact_address_country", COUNTRY_UNITED_STATES));

        if (extended) {
            // Each selection reveals the next control, so order and settle times matter.
            fields.add(PortalField.select("root_supporting_docs_fbi_address_type", "0", 500));
            fields.add(PortalField.select("root_supporting_docs_fbi_state_domestic", UsStates.dropdownIndex(address.state()), 300));
            fields.add(PortalField.select("root_supporting_docs_fbi_request_subject", "2", 500));
            fields.add(PortalField.select("root_supporting_docs_fbi_requester_type", "0", 500));
            fields.add(PortalField.fill("root_supporting_docs_fbi_request_description", description));
            fields.add(PortalField.select("root_supporting_docs_fbi_citizen_confirm", "0", 300));
            fields.add(PortalField.fill("root_supporting_docs_fbi_citizen_signature", requester.fullName()));
            fields.add(PortalField.fill("root_supporting_docs_fbi_citizen_today", LocalDate.now(clock).format(SIGNATURE_DATE)));
        } else {
            fields.add(PortalField.fill("root_request_description_request_description", description));
        }

        fields.add(PortalField.select("root_processing_fees_request_category", requester.feeCategory().portalValue()));
        if (requester.feeWaiverRequested()) {
            fields.add(PortalField.select("root_processing_fees_fee_waiver", "1", 500));
            if (requester.feeWaiverReason() != null && !requester.feeWaiverReason().isBlank()) {
                fields.add(PortalField.fill("root_processing_fees_fee_waiver_explanation", requester.feeWaiverReason().trim()));
            }
        } else {
            fields.add(PortalField.select("root_processing_fees_fee_waiver", "0"));
        }
        fields.add(PortalField.fill("root_processing_fees_fee_amount_willing", requester.maxFeeText()));
        fields.add(PortalField.select("root_expedited_processing_expedited_processing", "0"));

        return new PortalManifest(unitId, portal.portalUrlFor(unitId), extended, fields);
    }

    String emailBody(RequestContent request, RequesterDetails requester) {
        String name = requester.fullName();
        StringBuilder body = new StringBuilder();
        body.append("Dear FOIA Officer,\n\n");
        body.append("Pursuant to the Freedom of Information Act, 5 U.S.C. § 552, ")
            .append("I am requesting access to the following records:\n\n");
        body.append(nullToEmpty(request.rephrasedRequest()).trim()).append("\n\n");

        body.append("REQUESTER INFORMATION:\n");
        body.append("Name: ").append(name).append('\n');
        body.append("Email: ").append(nullToEmpty(requester.email())).append('\n');
        if (requester.hasPhone()) {
            body.append("Phone: ").append(requester.phone().trim()).append('\n');
        }
        body.append("Address: ").append(requester.address().formatted()).append("\n\n");

        body.append("FEE CATEGORY:\n").append(requester.feeCategory().label()).append("\n\n");

        body.append("FEE LIMITATION:\n")
            .append("I am willing to pay up to $").append(requester.maxFeeText())
            .append(" for processing fees. If the estimated cost exceeds this amount, please contact me before proceeding.\n\n");

        if (requester.feeWaiverRequested()) {
            String reason = requester.feeWaiverReason() == null || requester.feeWaiverReason().isBlank()
                ? DEFAULT_WAIVER_JUSTIFICATION
                : requester.feeWaiverReason().trim();
            body.append("FEE WAIVER REQUEST:\n")
                .append("I am requesting a waiver of all fees associated with this request.\n")
                .append("Justification: ").append(reason).append("\n\n");
        }

        body.append("PREFERRED RESPONSE FORMAT:\n")
            .append("I would prefer to receive records in electronic format (PDF or other common digital format) ")
            .append("sent to my email address if possible.\n\n");
        body.append("Thank you for your consideration of this request. ")
            .append("I look forward to your response within the statutory timeframe.\n\n");
        body.append("Sincerely,\n").append(name).append('\n').append(nullToEmpty(requester.email())).append('\n');
        return body.toString();
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
