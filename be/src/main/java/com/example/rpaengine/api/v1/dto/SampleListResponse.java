package com.example.rpaengine.api.v1.dto;

import java.util.List;

public record SampleListResponse(List<String> samples) {
}
