package com.memelet.service;

import com.memelet.model.MediaAnalysis;
import com.memelet.model.MediaRecord;
import com.memelet.model.Tag;
import com.memelet.repository.CatalogStore;
import com.memelet.util.FileUtils;
import com.memelet.util.PipelineConfig;
import com.memelet.util.PipelineLogger;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

/**
 * Runs one analysis: frames, prompt, model call, parsing.
 * <p>
 * Temporary frames go to a per-record workspace that is reserved in the catalog for the duration
 * of the call, so two operations on the same record never share a directory. The workspace is
 * removed and released on every exit path.
 */
public class AnalysisDispatcher {

    private static final String CONTEXT = "AnalysisDispatcher";

    private final CatalogStore store;
    private final FrameExtractor frameExtractor;
    private final PromptBuilder promptBuilder;
    private final VisionClient visionClient;
    private final AnalysisResponseParser parser;
    private final Path tempRoot;
    private final Path logDir;
    private final Duration decodeTimeout;

    public AnalysisDispatcher(CatalogStore store, FrameExtractor frameExtractor, PromptBuilder promptBuilder,
                              VisionClient visionClient, AnalysisResponseParser parser, PipelineConfig config) {
        this.store = store;
        this.frameExtractor = frameExtractor;
        this.promptBuilder = promptBuilder;
        this.visionClient = visionClient;
        this.parser = parser;
        this.tempRoot = config.getTempRoot();
        this.logDir = config.getLogDir();
        this.decodeTimeout = Duration.ofSeconds(config.getDecodeTimeoutSeconds());
    }

    public static String workspaceName(MediaRecord record) {
        return "frames-" + record.getId();
    }

    /**
     * @param timeout upper bound for the model call
     * @throws PipelineException when any step fails; the record itself is not modified here
     */
    public MediaAnalysis analyze(MediaRecord record, Duration timeout) throws PipelineException {
        String reservation = workspaceName(record);
        if (!store.reserveWorkspace(reservation)) {
            throw new PipelineException("Record #" + record.getId() + " is already being analyzed (workspace " + reservation + " in use)");
        }

        Path workspace = tempRoot.resolve(String.valueOf(record.getId()));
        try {
            ExtractedSamples samples = frameExtractor.extract(record, workspace, decodeTimeout);

            List<Tag> suggestibleTags = store.findSuggestibleTags();
            String systemPrompt = promptBuilder.buildSystemPrompt();
            String userPrompt = promptBuilder.buildUserPrompt(record.getMediaType(), samples.size(), suggestibleTags);

            String rawText = visionClient.analyze(systemPrompt, userPrompt, samples.getSamples(), timeout);
            PipelineLogger.logInfo(logDir, CONTEXT, "Record #" + record.getId() + " raw response: " + abbreviate(rawText));

            return parser.parse(rawText);
        } finally {
            cleanUp(workspace, reservation);
        }
    }

    private void cleanUp(Path workspace, String reservation) {
        try {
            FileUtils.deleteRecursively(workspace);
        } catch (IOException e) {
            PipelineLogger.logError(logDir, CONTEXT, "Failed to delete frame workspace " + workspace, e);
        } finally {
            store.releaseWorkspace(reservation);
        }
    }

    private static String abbreviate(String text) {
        if (text == null) {
            return "null";
        }
        String singleLine = text.replace('\n', ' ');
        return singleLine.length() <= 200 ? singleLine : singleLine.substring(0, 200) + "...";
    }
}
