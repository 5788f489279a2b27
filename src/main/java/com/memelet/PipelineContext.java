package com.memelet;

import com.memelet.repository.CatalogStore;
import com.memelet.repository.SqliteCatalogStore;
import com.memelet.service.*;
import com.memelet.util.PipelineConfig;
import com.memelet.util.PipelineLogger;

/**
 * Builds the pipeline components from a configuration and owns their lifetime.
 */
public class PipelineContext implements AutoCloseable {

    private static final String CONTEXT = "PipelineContext";

    private final PipelineConfig config;
    private final CatalogStore store;
    private final FrameExtractor frameExtractor;
    private final PipelineOrchestrator orchestrator;
    private final PipelineJobService jobService;

    public PipelineContext(PipelineConfig config) {
        this(config, new SqliteCatalogStore(config.getDatabaseFile()), new ReplicateVisionClient(config));
    }

    // Allows tests and embedding hosts to supply their own store and model
    public PipelineContext(PipelineConfig config, CatalogStore store, VisionClient visionClient) {
        this.config = config;
        this.store = store;

        // Reservations outlive the process; any found now belong to a run that died mid-analysis
        int released = store.releaseAllWorkspaces();
        if (released > 0) {
            PipelineLogger.logWarning(config.getLogDir(), CONTEXT, "Released " + released + " frame workspace(s) left by a previous run");
        }

        ContentHasher hasher = new ContentHasher();
        MediaConverterService converter = new MediaConverterService();
        ThumbnailService thumbnailService = new ThumbnailService(converter, config);

        IdentityVerifier verifier = new IdentityVerifier(store, hasher, config);
        DirectoryScanner scanner = new DirectoryScanner(store, hasher, config);
        this.frameExtractor = new FrameExtractor(converter, thumbnailService, hasher, config);
        AnalysisDispatcher dispatcher = new AnalysisDispatcher(store, frameExtractor, new PromptBuilder(),
                visionClient, new AnalysisResponseParser(), config);
        TagReconciler tagReconciler = new TagReconciler(store, config);

        this.orchestrator = new PipelineOrchestrator(store, verifier, scanner, dispatcher, frameExtractor, tagReconciler, config);
        this.jobService = new PipelineJobService(orchestrator, store, config);
    }

    public PipelineConfig getConfig() { return config; }
    public CatalogStore getStore() { return store; }
    public PipelineOrchestrator getOrchestrator() { return orchestrator; }
    public PipelineJobService getJobService() { return jobService; }

    @Override
    public void close() {
        jobService.shutdown();
        frameExtractor.close();
    }
}
