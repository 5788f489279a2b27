package com.memelet.service;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Ordered sample files handed to the vision model for one record.
 */
public class ExtractedSamples {
    private final List<Path> samples;

    public ExtractedSamples(List<Path> samples) {
        this.samples = Collections.unmodifiableList(new ArrayList<>(samples));
    }

    public List<Path> getSamples() {
        return samples;
    }

    public int size() {
        return samples.size();
    }
}
