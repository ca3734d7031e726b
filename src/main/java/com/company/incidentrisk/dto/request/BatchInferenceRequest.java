package com.company.incidentrisk.dto.request;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BatchInferenceRequest {
    @NotEmpty(message = "At least one feature row is required")
    @Size(max = 10000)
    private List<@Valid FeatureRowRequest> rows;
}
