package com.example.rpaengine.api;

import lombok.Getter;

@Getter
public class SampleNotFoundException extends RuntimeException {

    private final String sampleName;

    public SampleNotFoundException(String sampleName) {
        super("Sample project not found: " + sampleName);
        this.sampleName = sampleName;
    }
}
