package com.acme.upkeep.web;

/** Simple payload for error responses returned by global exception handlers. */
public record ErrorResponse(String message, String error, int statusCode) {}
