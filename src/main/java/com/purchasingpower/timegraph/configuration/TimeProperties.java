package com.purchasingpower.timegraph.configuration;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class TimeProperties {

    /**
     * Zone assumed for zone-less inputs (LocalDateTime, LocalDate, strings without offset).
     */
    @NotBlank
    private String naiveZone = "UTC";
}
