package com.security.anomaly.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(description = "Outcome of training one detector")
public class TrainingResult {

    @Schema(description = "Whether training produced a usable baseline", example = "true")
    private boolean success;

    @Schema(description = "Baseline state of the detector after training", example = "true")
    private boolean baselineEstablished;

    @Schema(description = "Error message when training could not run", example = "Detector not registered")
    private String error;

    public static TrainingResult failed(String error) {
        return TrainingResult.builder().success(false).error(error).build();
    }
}
