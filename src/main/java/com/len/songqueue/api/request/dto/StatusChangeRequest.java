package com.len.songqueue.api.request.dto;

import jakarta.validation.constraints.NotBlank;

/**
 * @param expectedStatus 화면에서 보고 있던 상태(선택). 그 사이 바뀌었으면 409
 */
public record StatusChangeRequest(
        @NotBlank String status,
        String expectedStatus
) {}
