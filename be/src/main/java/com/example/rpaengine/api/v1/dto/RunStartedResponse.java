package com.example.rpaengine.api.v1.dto;

import java.util.UUID;

public record RunStartedResponse(UUID runId) {
}
