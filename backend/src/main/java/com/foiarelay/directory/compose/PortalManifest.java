package com.foiarelay.directory.compose;

import com.foiarelay.directory.model.DeliveryChannel;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public record PortalManifest(
    String unitId,
    String portalUrl,
    boolean extendedFieldSet,
    List<PortalField> fields
) implements SubmissionPayload {

    public PortalManifest {
        fields = fields == null ? List.of() : List.copyOf(fields);
    }

    @Override
    public DeliveryChannel channel() {
        return DeliveryChannel.PORTAL;
    }

    /** Field values keyed by field name, in fill order. */
    public Map<String, String> fieldValues() {
        Map<String, String> values = new LinkedHashMap<>();
        for (PortalField field : fields) {
            values.put(field.fieldName(), field.value());
        }
        return values;
    }
}
