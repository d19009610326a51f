package com.len.songqueue.api.request.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;

public record SubmitRequest(
        @NotNull @Positive Long trackId,
        @Size(max = 50) String tableTag
) {}
