package com.serenity.escalation.api;

/** Error body returned by every failing endpoint. */
public record ApiErrorResponse(String code, String message) {}
