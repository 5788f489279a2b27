package com.memelet.service;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

/**
 * A vision-capable language model.
 */
public interface VisionClient {

    /**
     * Sends the prompts and sample images and returns the model's raw text answer.
     *
     * @param samples image files, in the order the model should see them
     * @param timeout upper bound for the whole exchange
     * @throws AnalysisException if the model cannot be reached, fails, or answers nothing in time
     */
    String analyze(String systemPrompt, String userPrompt, List<Path> samples, Duration timeout) throws AnalysisException;
}
