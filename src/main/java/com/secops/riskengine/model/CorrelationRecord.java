package com.secops.riskengine.model;

import com.fasterxml.jackson.annotation.JsonValue;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;

import java.util.Locale;

@Value
@Builder
@Schema(description = "A link between a warning and the user's login behavior")
public class CorrelationRecord {

    public enum Type {
        TEMPORAL,
        BEHAVIORAL;

        @JsonValue
        public String getValue() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    String userId;

    @Schema(example = "temporal")
    Type type;

    @Schema(description = "Anomaly type for temporal records, behavior check for behavioral ones",
            example = "rapid_location_change")
    String subtype;

    @Schema(example = "5.0")
    double weight;

    String description;

    @Schema(description = "Message of the correlated warning")
    String warningMessage;
}
