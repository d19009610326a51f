package com.len.songqueue.domain.request;

public record StatusCount(RequestStatus status, Long count) {}
