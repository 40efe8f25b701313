package com.experiment.framework.api;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class VariantDto {

    @NotBlank(message = "variant name is required")
    private String name;

    @NotNull(message = "variant weight is required")
    private Double weight;
}
