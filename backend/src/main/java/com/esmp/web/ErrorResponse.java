package com.esmp.web;

public record ErrorResponse(String error, String message) {}
