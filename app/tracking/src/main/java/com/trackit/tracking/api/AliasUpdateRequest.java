package com.trackit.tracking.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.Size;

/** alias が null/空白の場合は別名の解除として扱う。 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record AliasUpdateRequest(
    @Size(max = 500, message = "alias must be at most 500 characters") String alias) {}
