package com.foiarelay.directory.compose;

import com.foiarelay.config.DirectoryProperties;
import com.foiarelay.directory.model.CanonicalRecord;
import com.foiarelay.directory.model.DeliveryChannel;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SubmissionComposerTest {
    private static final String FBI_ID = "e366935f-20e1-4404-ac40-ed5518a5ce5a";

    private final SubmissionComposer composer = new SubmissionComposer(
        new DirectoryProperties(),
        Clock.fixed(Instant.parse("2026-07-04T15:00:00Z"), ZoneOffset.UTC)
    );

    private final RequestContent request = new RequestContent(
        "All records concerning the 2024 budget review.",
        "Budget review records"
    );

    @Test
    void emailCarriesStatutoryCitationAndRequesterDetails() {
        SubmissionPayload payload = composer.compose(
            DeliveryChannel.EMAIL,
            record("oip", "foia@agency.gov"),
            request,
            requester(true, "Public interest reporting", "555-0100")
        );

        assertThat(payload).isInstanceOf(EmailPayload.class);
        EmailPayload email = (EmailPayload) payload;
        assertThat(email.to()).isEqualTo("foia@agency.gov");
        assertThat(email.subject()).isEqualTo("FOIA Request - Budget review records");
        assertThat(email.replyTo()).isEqualTo("ada@example.com");
        assertThat(email.replyToName()).isEqualTo("Ada Lovelace");
        assertThat(email.body())
            .startsWith("Dear FOIA Officer,")
            .contains("Pursuant to the Freedom of Information Act, 5 U.S.C. § 552")
            .contains("All records concerning the 2024 budget review.")
            .contains("Name: Ada Lovelace")
            .contains("Phone: 555-0100")
            .contains("Address: 12 Analytical Way, Unit 3, London, VA 22201")
            .contains("Representative of the news media")
            .contains("I am willing to pay up to $25.5 for processing fees.")
            .contains("FEE WAIVER REQUEST:")
            .contains("Justification: Public interest reporting")
            .endsWith("Sincerely,\nAda Lovelace\nada@example.com\n");
    }

    @Test
    void emailOmitsWaiverBlockAndPhoneWhenAbsent() {
        EmailPayload email = composer.composeEmail("foia@agency.gov", request, requester(false, null, null));

        assertThat(email.body())
            .doesNotContain("FEE WAIVER REQUEST")
            .doesNotContain("Phone:");
    }

    @Test
    void waiverWithoutReasonUsesDefaultJustification() {
        EmailPayload email = composer.composeEmail("foia@agency.gov", request, requester(true, " ", null));

        assertThat(email.body()).contains("Justification: " + SubmissionComposer.DEFAULT_WAIVER_JUSTIFICATION);
    }

    @Test
    void emailChannelRequiresRecordWithEmail() {
        assertThatThrownBy(() -> composer.compose(DeliveryChannel.EMAIL, record("u", null), request, requester(false, null, null)))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void standardPortalManifestFillsDescriptionAndFees() {
        PortalManifest manifest = composer.composePortal("oip", request, requester(false, null, null));

        assertThat(manifest.extendedFieldSet()).isFalse();
        assertThat(manifest.portalUrl()).isEqualTo("https://www.foia.gov/request/agency-component/oip/");
        Map<String, String> values = manifest.fieldValues();
        assertThat(values)
            .containsEntry("root_requester_contact_name_first", "Ada")
            .containsEntry("root_requester_contact_address_country", "246")
            .containsEntry("root_request_description_request_description", request.rephrasedRequest())
            .containsEntry("root_processing_fees_request_category", "0")
            .containsEntry("root_processing_fees_fee_waiver", "0")
            .containsEntry("root_processing_fees_fee_amount_willing", "25.5")
            .containsEntry("root_expedited_processing_expedited_processing", "0")
            .doesNotContainKey("root_requester_contact_phone_number")
            .doesNotContainKey("root_supporting_docs_fbi_request_description");
    }

    @Test
    void extendedFormUnitGetsDependentFieldSequence() {
        PortalManifest manifest = (PortalManifest) composer.compose(
            DeliveryChannel.PORTAL,
            record(FBI_ID, null),
            request,
            requester(true, "Public interest reporting", null)
        );

        assertThat(manifest.extendedFieldSet()).isTrue();
        List<String> names = manifest.fields().stream().map(PortalField::fieldName).toList();
        assertThat(names).containsSubsequence(
            "root_supporting_docs_fbi_address_type",
            "root_supporting_docs_fbi_state_domestic",
            "root_supporting_docs_fbi_request_subject",
            "root_supporting_docs_fbi_requester_type",
            "root_supporting_docs_fbi_request_description",
            "root_supporting_docs_fbi_citizen_confirm",
            "root_supporting_docs_fbi_citizen_signature",
            "root_supporting_docs_fbi_citizen_today"
        );
        assertThat(names).doesNotContain("root_request_description_request_description");

        Map<String, String> values = manifest.fieldValues();
        assertThat(values)
            .containsEntry("root_supporting_docs_fbi_state_domestic", "46")
            .containsEntry("root_supporting_docs_fbi_request_subject", "2")
            .containsEntry("root_supporting_docs_fbi_citizen_signature", "Ada Lovelace")
            .containsEntry("root_supporting_docs_fbi_citizen_today", "07/04/2026")
            .containsEntry("root_processing_fees_fee_waiver", "1")
            .containsEntry("root_processing_fees_fee_waiver_explanation", "Public interest reporting");

        PortalField addressType = manifest.fields().stream()
            .filter(field -> field.fieldName().equals("root_supporting_docs_fbi_address_type"))
            .findFirst()
            .orElseThrow();
        assertThat(addressType.action()).isEqualTo(FieldAction.SELECT);
        assertThat(addressType.settleAfter()).isEqualTo(Duration.ofMillis(500));
    }

    @Test
    void unmatchedPortalManifestPointsAtGenericRequestPage() {
        PortalManifest manifest = composer.composePortal(null, request, requester(false, null, null));

        assertThat(manifest.portalUrl()).isEqualTo("https://www.foia.gov/request/");
        assertThat(manifest.extendedFieldSet()).isFalse();
    }

    @Test
    void feeCategoriesParseFromWireCodes() {
        assertThat(FeeCategory.fromCode("news_media")).isEqualTo(FeeCategory.NEWS_MEDIA);
        assertThat(FeeCategory.fromCode("Commercial")).isEqualTo(FeeCategory.COMMERCIAL);
        assertThat(FeeCategory.fromCode(null)).isEqualTo(FeeCategory.OTHER);
        assertThat(FeeCategory.EDUCATIONAL.label()).isEqualTo("Educational institution");
        assertThatThrownBy(() -> FeeCategory.fromCode("scientific")).isInstanceOf(IllegalArgumentException.class);
    }

    private static CanonicalRecord record(String unitId, String email) {
        return new CanonicalRecord(
            unitId, "Unit " + unitId, "", "", "", email == null ? List.of() : List.of(email), "", "", "", "", Instant.EPOCH
        );
    }

    private static RequesterDetails requester(boolean waiver, String reason, String phone) {
        return new RequesterDetails(
            "Ada",
            "Lovelace",
            "ada@example.com",
            phone,
            new PostalAddress("12 Analytical Way", "Unit 3", "London", "VA", "22201"),
            FeeCategory.NEWS_MEDIA,
            new BigDecimal("25.50"),
            waiver,
            reason
        );
    }
}
