package com.foiarelay.directory.registry;

import com.foiarelay.directory.model.RegistryRecord;
import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

/**
 * Maps one JSON:API page of {@code agency_components} into registry records, resolving
 * each component's parent agency from the page's {@code included} side-table.
 */
@Component
public class RegistryRecordMapper {

    public List<RegistryRecord> mapPage(JsonNode root) {
        if (root == null || root.isNull()) {
            return List.of();
        }
        Map<String, JsonNode> parents = indexIncluded(root.path("included"));
        List<RegistryRecord> records = new ArrayList<>();
        for (JsonNode component : root.path("data")) {
            RegistryRecord record = mapComponent(component, parents);
            if (record != null) {
                records.add(record);
            }
        }
        return records;
    }

    RegistryRecord mapComponent(JsonNode component, Map<String, JsonNode> parents) {
        String unitId = text(component, "id");
        if (unitId == null) {
            return null;
        }
        JsonNode attrs = component.path("attributes");
        String parentId = text(component.path("relationships").path("agency").path("data"), "id");
        JsonNode parent = parentId == null ? null : parents.get(parentId);
        JsonNode parentAttrs = parent == null ? null : parent.path("attributes");

        return new RegistryRecord(
            unitId,
            blankToEmpty(text(attrs, "title")),
            blankToEmpty(text(attrs, "abbreviation")),
            blankToEmpty(parentId),
            blankToEmpty(text(parentAttrs, "name")),
            blankToEmpty(text(parentAttrs, "abbreviation")),
            collectEmails(attrs),
            blankToEmpty(firstNonBlank(text(attrs.path("website"), "uri"), text(attrs.path("request_form"), "uri"))),
            formatAddress(attrs.path("submission_address")),
            blankToEmpty(text(attrs.path("foia_officer"), "name")),
            blankToEmpty(firstNonBlank(
                text(attrs.path("foia_officer"), "phone"),
                text(attrs.path("public_liaison"), "phone")
            ))
        );
    }

    private Map<String, JsonNode> indexIncluded(JsonNode included) {
        Map<String, JsonNode> byId = new HashMap<>();
        if (included == null || !included.isArray()) {
            return byId;
        }
        for (JsonNode node : included) {
            String id = text(node, "id");
            if (id != null) {
                byId.putIfAbsent(id, node);
            }
        }
        return byId;
    }

    private List<String> collectEmails(JsonNode attrs) {
        LinkedHashSet<String> emails = new LinkedHashSet<>();
        JsonNode listed = attrs.path("emails");
        if (listed.isArray()) {
            for (JsonNode email : listed) {
                addIfPresent(emails, email.isTextual() ? email.asText() : null);
            }
        }
        addIfPresent(emails, text(attrs.path("submission_address"), "email"));
        addIfPresent(emails, text(attrs.path("foia_officer"), "email"));
        addIfPresent(emails, text(attrs.path("request_form"), "email"));
        return new ArrayList<>(emails);
    }

    String formatAddress(JsonNode address) {
        if (address == null || address.isNull() || address.isMissingNode()) {
            return "";
        }
        List<String> parts = new ArrayList<>();
        JsonNode lines = address.path("address_lines");
        if (lines.isArray()) {
            for (JsonNode line : lines) {
                if (line.isTextual() && !line.asText().isBlank()) {
                    parts.add(line.asText().trim());
                }
            }
        }
        String city = blankToEmpty(text(address, "city"));
        String state = blankToEmpty(text(address, "state"));
        String zip = blankToEmpty(text(address, "zip"));
        if (!city.isEmpty() || !state.isEmpty() || !zip.isEmpty()) {
            String stateZip = (state + " " + zip).trim();
            parts.add(city.isEmpty() ? stateZip : (stateZip.isEmpty() ? city : city + ", " + stateZip));
        }
        return String.join(", ", parts);
    }

    private String text(JsonNode node, String field) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return null;
        }
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        if (value.isTextual() || value.isNumber() || value.isBoolean()) {
            String trimmed = value.asText().trim();
            return trimmed.isEmpty() ? null : trimmed;
        }
        return null;
    }

    private void addIfPresent(LinkedHashSet<String> out, String value) {
        if (value != null && !value.isBlank()) {
            out.add(value.trim());
        }
    }

    private String firstNonBlank(String... values) {
        for (String value : values) {
            if (value != null && !value.isBlank()) {
                return value.trim();
            }
        }
        return null;
    }

    private String blankToEmpty(String value) {
        return value == null ? "" : value.trim();
    }
}
