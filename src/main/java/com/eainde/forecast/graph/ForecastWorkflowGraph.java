package com.eainde.forecast.graph;

import com.eainde.forecast.context.RunContext;
import com.eainde.forecast.fetch.DocumentFetcher;
import com.eainde.forecast.graph.edges.RunRoutingEdge;
import com.eainde.forecast.graph.nodes.AnalyzingNode;
import com.eainde.forecast.graph.nodes.DoneNode;
import com.eainde.forecast.graph.nodes.ExtractingNode;
import com.eainde.forecast.graph.nodes.FailedNode;
import com.eainde.forecast.graph.nodes.GatheringNode;
import com.eainde.forecast.graph.nodes.RunNode;
import com.eainde.forecast.graph.nodes.SynthesizingNode;
import com.eainde.forecast.graph.nodes.ValidatingNode;
import com.eainde.forecast.llm.ResilientModelClient;
import com.eainde.forecast.model.RunState;
import com.eainde.forecast.synthesis.ForecastSynthesizer;
import com.eainde.forecast.synthesis.ForecastValidator;
import com.eainde.forecast.synthesis.SynthesisPromptBuilder;
import com.eainde.forecast.synthesis.SynthesisResponseParser;
import com.eainde.forecast.thread.MdcAwareExecutor;
import com.eainde.forecast.tool.AnalysisTool;
import com.eainde.forecast.tool.ExtractionTool;
import org.bsc.langgraph4j.CompileConfig;
import org.bsc.langgraph4j.CompiledGraph;
import org.bsc.langgraph4j.GraphStateException;
import org.bsc.langgraph4j.StateGraph;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.Map;

import static org.bsc.langgraph4j.StateGraph.END;
import static org.bsc.langgraph4j.StateGraph.START;

/**
 * Builds the state machine of one run.
 *
 * <pre>
 *   START -> gathering -> extracting -> analyzing -> synthesizing -> validating -> done -> END
 *                                                        ^               |
 *                                                        +---------------+  (one revision)
 *   every step may route to failed -> END
 * </pre>
 *
 * <p>A new graph is compiled for every run so that its nodes close over that run's
 * {@link RunContext} and nothing is shared between concurrent runs.</p>
 */
@Component
public class ForecastWorkflowGraph {

    private final DocumentFetcher fetcher;
    private final ExtractionTool extractionTool;
    private final AnalysisTool analysisTool;
    private final ResilientModelClient modelClient;
    private final SynthesisPromptBuilder promptBuilder;
    private final SynthesisResponseParser responseParser;
    private final ForecastSynthesizer synthesizer;
    private final ForecastValidator validator;
    private final MdcAwareExecutor workerExecutor;
    private final RunSettings settings;
    private final RunRoutingEdge routingEdge = new RunRoutingEdge();

    public ForecastWorkflowGraph(
            DocumentFetcher fetcher,
            ExtractionTool extractionTool,
            AnalysisTool analysisTool,
            ResilientModelClient modelClient,
            SynthesisPromptBuilder promptBuilder,
            SynthesisResponseParser responseParser,
            ForecastSynthesizer synthesizer,
            ForecastValidator validator,
            @Qualifier("forecastWorkerExecutor") MdcAwareExecutor workerExecutor,
            RunSettings settings) {
        this.fetcher = fetcher;
        this.extractionTool = extractionTool;
        this.analysisTool = analysisTool;
        this.modelClient = modelClient;
        this.promptBuilder = promptBuilder;
        this.responseParser = responseParser;
        this.synthesizer = synthesizer;
        this.validator = validator;
        this.workerExecutor = workerExecutor;
        this.settings = settings;
    }

    public CompiledGraph<ForecastState> compileFor(RunContext ctx) throws GraphStateException {
        String gathering = RunState.GATHERING.nodeId();
        String extracting = RunState.EXTRACTING.nodeId();
        String analyzing = RunState.ANALYZING.nodeId();
        String synthesizing = RunState.SYNTHESIZING.nodeId();
        String validating = RunState.VALIDATING.nodeId();
        String done = RunState.DONE.nodeId();
        String failed = RunNode.FAILED;

        StateGraph<ForecastState> workflow = new StateGraph<>(ForecastState::new);

        workflow.addNode(gathering, new GatheringNode(ctx, fetcher, workerExecutor));
        workflow.addNode(extracting, new ExtractingNode(ctx, extractionTool, workerExecutor));
        workflow.addNode(analyzing, new AnalyzingNode(ctx, analysisTool));
        workflow.addNode(synthesizing, new SynthesizingNode(ctx, modelClient, promptBuilder, responseParser,
                settings.maxSynthesisRecoveries()));
        workflow.addNode(validating, new ValidatingNode(ctx, synthesizer, validator, settings.maxValidationRevisions()));
        workflow.addNode(done, new DoneNode(ctx));
        workflow.addNode(failed, new FailedNode(ctx));

        workflow.addEdge(START, gathering);
        workflow.addConditionalEdges(gathering, routingEdge, Map.of(extracting, extracting, failed, failed));
        workflow.addConditionalEdges(extracting, routingEdge, Map.of(analyzing, analyzing, failed, failed));
        workflow.addConditionalEdges(analyzing, routingEdge, Map.of(synthesizing, synthesizing, failed, failed));
        workflow.addConditionalEdges(synthesizing, routingEdge, Map.of(validating, validating, failed, failed));
        workflow.addConditionalEdges(validating, routingEdge,
                Map.of(done, done, synthesizing, synthesizing, failed, failed));
        workflow.addEdge(done, END);
        workflow.addEdge(failed, END);

        return workflow.compile(CompileConfig.builder().build());
    }
}
