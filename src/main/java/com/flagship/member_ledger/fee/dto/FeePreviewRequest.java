package com.flagship.member_ledger.fee.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.member_ledger.fee.FeePreview;
import lombok.Value;

import java.util.Map;
import java.util.Set;

@Value
public class FeePreviewRequest {

    @JsonProperty("parts")
    Set<String> parts;

    @JsonProperty("fields")
    Map<String, Object> fields;

    @JsonProperty("is_member")
    boolean member;

    @JsonProperty("is_orga")
    boolean orga;

    public FeePreview toPreview() {
        return new FeePreview(
            parts == null ? Set.of() : Set.copyOf(parts),
            fields == null ? Map.of() : fields,
            member,
            orga);
    }
}
