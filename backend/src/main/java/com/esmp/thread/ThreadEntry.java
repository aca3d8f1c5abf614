package com.esmp.thread;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;

public record ThreadEntry(
        ThreadKey threadKey,
        long seq,
        JsonNode envelope,
        Instant appendedAt
) {}
