package com.jreinhal.docqa.service;

import com.jreinhal.docqa.dto.AskResponse;
import com.jreinhal.docqa.dto.QaResponse;
import com.jreinhal.docqa.dto.ResponseStatus;
import com.jreinhal.docqa.dto.SimilarityResponse;
import com.jreinhal.docqa.dto.SourceRef;
import com.jreinhal.docqa.exception.ModelUnavailableException;
import com.jreinhal.docqa.exception.RetrievalFailedException;
import com.jreinhal.docqa.model.AnswerType;
import com.jreinhal.docqa.model.Chunk;
import com.jreinhal.docqa.model.ExtractionResult;
import com.jreinhal.docqa.rag.answer.AnswerCleaner;
import com.jreinhal.docqa.rag.answer.AnswerValidator;
import com.jreinhal.docqa.rag.index.EmbeddingRetrievalIndex;
import com.jreinhal.docqa.rag.index.RetrievalIndex;
import com.jreinhal.docqa.rag.index.ScoredChunk;
import com.jreinhal.docqa.rag.planner.QueryPlanner;
import com.jreinhal.docqa.session.SessionStore;
import com.jreinhal.docqa.util.LogSanitizer;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Request orchestration for ask, summarize, compare and similarity.
 *
 * <p>Every read path sweeps expired sessions first, then resolves a snapshot of indices from
 * the {@link SessionStore}; searches and generation run on that snapshot without holding any
 * store lock. Expired sessions, thin context and an unavailable model are all reported through
 * {@link ResponseStatus}, never as exceptions.</p>
 */
@Service
public class DocumentQaService {
    private static final Logger log = LoggerFactory.getLogger(DocumentQaService.class);
    static final String NO_SESSION_MESSAGE = "No session selected.";
    static final String NOT_FOUND_MESSAGE = "No documents found for selected sessions.";
    static final String SUMMARY_NOT_FOUND_MESSAGE = "No documents found.";
    static final String NO_CONTEXT_MESSAGE = "No relevant context found.";
    static final String COMPARE_MIN_MESSAGE = "Select at least 2 documents.";
    static final String COMPARE_INSUFFICIENT_MESSAGE = "Not enough documents to compare.";
    static final String SIMILARITY_INSUFFICIENT_MESSAGE = "At least 2 available documents are needed to measure similarity.";
    static final String EMPTY_GENERATION_MESSAGE = "The model returned no text. Please try again.";
    static final String SEARCH_UNAVAILABLE_MESSAGE = "Document search is temporarily unavailable. Please try again shortly.";
    static final String SUMMARY_QUERY = "Summarize the document";
    static final String COMPARE_QUERY = "main topics";
    static final String DOCUMENT_SEPARATOR = "\n\n---\n\n";
    private static final int EXCERPT_CHARS = 300;

    private final SessionStore sessionStore;
    private final QueryPlanner queryPlanner;
    private final AnswerValidator answerValidator;
    private final GenerationFunction generationFunction;
    private final Executor ragExecutor;
    @Value("${docqa.retrieval.ask-k:4}")
    private int askK = 4;
    @Value("${docqa.retrieval.summarize-k:6}")
    private int summarizeK = 6;
    @Value("${docqa.retrieval.compare-k:4}")
    private int compareK = 4;
    @Value("${docqa.retrieval.candidate-multiplier:2}")
    private int candidateMultiplier = 2;
    @Value("${docqa.generation.ask-max-tokens:200}")
    private int askMaxTokens = 200;
    @Value("${docqa.generation.summarize-max-tokens:250}")
    private int summarizeMaxTokens = 250;
    @Value("${docqa.generation.compare-max-tokens:300}")
    private int compareMaxTokens = 300;

    public DocumentQaService(SessionStore sessionStore, QueryPlanner queryPlanner, AnswerValidator answerValidator,
            GenerationFunction generationFunction, @Qualifier("ragExecutor") Executor ragExecutor) {
        this.sessionStore = sessionStore;
        this.queryPlanner = queryPlanner;
        this.answerValidator = answerValidator;
        this.generationFunction = generationFunction;
        this.ragExecutor = ragExecutor;
    }

    public AskResponse ask(String question, List<String> sessionIds) {
        if (question == null || question.isBlank()) {
            throw new IllegalArgumentException("Question must not be empty");
        }
        this.sessionStore.sweepExpired();
        if (sessionIds == null || sessionIds.isEmpty()) {
            return AskResponse.message(NO_SESSION_MESSAGE, ResponseStatus.NO_SESSION);
        }
        Map<String, List<RetrievalIndex>> resolved = this.sessionStore.resolveIndices(sessionIds);
        if (resolved.isEmpty()) {
            return AskResponse.message(NOT_FOUND_MESSAGE, ResponseStatus.NOT_FOUND);
        }
        AnswerType answerType = this.queryPlanner.classify(question);
        String expanded = this.queryPlanner.expandQuery(question);
        List<Chunk> candidates;
        try {
            candidates = this.searchAll(flatten(resolved), expanded, this.askK * Math.max(1, this.candidateMultiplier));
        }
        catch (RetrievalFailedException e) {
            log.warn("Search failed for query {}: {}", LogSanitizer.querySummary(question), e.getMessage());
            return AskResponse.message(SEARCH_UNAVAILABLE_MESSAGE, ResponseStatus.UNAVAILABLE);
        }
        List<Chunk> context = this.queryPlanner.rerank(candidates, question, this.askK);
        if (context.isEmpty()) {
            return AskResponse.message(NO_CONTEXT_MESSAGE, ResponseStatus.NO_CONTEXT);
        }
        String contextText = joinContext(context);
        List<SourceRef> sources = sourcesOf(context);
        String raw;
        try {
            raw = this.generationFunction.generate(askPrompt(contextText, question), this.askMaxTokens);
        }
        catch (ModelUnavailableException e) {
            log.warn("Generation unavailable for query {}: {}", LogSanitizer.querySummary(question), e.getMessage());
            return new AskResponse(offlineAnswer(context), ResponseStatus.UNAVAILABLE, answerType, null, sources);
        }
        String cleaned = AnswerCleaner.clean(raw, question);
        ExtractionResult result = this.answerValidator.reconcile(cleaned, question, contextText, answerType);
        log.info("Answered {} as {} via {} (sessions={}, chunks={})", LogSanitizer.querySummary(question), answerType, result.source(), resolved.size(), context.size());
        return new AskResponse(result.text(), ResponseStatus.OK, answerType, result.source(), sources);
    }

    public QaResponse summarize(List<String> sessionIds) {
        this.sessionStore.sweepExpired();
        if (sessionIds == null || sessionIds.isEmpty()) {
            return QaResponse.message(NO_SESSION_MESSAGE, ResponseStatus.NO_SESSION);
        }
        Map<String, List<RetrievalIndex>> resolved = this.sessionStore.resolveIndices(sessionIds);
        if (resolved.isEmpty()) {
            return QaResponse.message(SUMMARY_NOT_FOUND_MESSAGE, ResponseStatus.NOT_FOUND);
        }
        List<Chunk> context;
        try {
            context = this.searchAll(flatten(resolved), SUMMARY_QUERY, this.summarizeK);
        }
        catch (RetrievalFailedException e) {
            log.warn("Summary search failed: {}", e.getMessage());
            return QaResponse.message(SEARCH_UNAVAILABLE_MESSAGE, ResponseStatus.UNAVAILABLE);
        }
        if (context.isEmpty()) {
            return QaResponse.message(NO_CONTEXT_MESSAGE, ResponseStatus.NO_CONTEXT);
        }
        List<SourceRef> sources = sourcesOf(context);
        String prompt = "Summarize this document:\n\n" + joinContext(context) + "\n\nSummary:";
        try {
            String summary = this.generationFunction.generate(prompt, this.summarizeMaxTokens);
            return new QaResponse(nonEmpty(summary), ResponseStatus.OK, sources);
        }
        catch (ModelUnavailableException e) {
            log.warn("Generation unavailable for summary: {}", e.getMessage());
            return new QaResponse(offlineAnswer(context), ResponseStatus.UNAVAILABLE, sources);
        }
    }

    /**
     * Compares two or more sessions using one context per session, built from the session's
     * first document.
     */
    public QaResponse compare(List<String> sessionIds) {
        this.sessionStore.sweepExpired();
        if (sessionIds == null || sessionIds.size() < 2) {
            return QaResponse.message(COMPARE_MIN_MESSAGE, ResponseStatus.INSUFFICIENT);
        }
        Map<String, List<RetrievalIndex>> resolved = this.sessionStore.resolveIndices(sessionIds);
        List<RetrievalIndex> firstIndices = resolved.values().stream()
                .filter(indices -> !indices.isEmpty())
                .map(indices -> indices.get(0))
                .collect(Collectors.toList());
        List<List<ScoredChunk>> perDocument;
        try {
            perDocument = this.searchEach(firstIndices, COMPARE_QUERY, this.compareK);
        }
        catch (RetrievalFailedException e) {
            log.warn("Comparison search failed: {}", e.getMessage());
            return QaResponse.message(SEARCH_UNAVAILABLE_MESSAGE, ResponseStatus.UNAVAILABLE);
        }
        List<String> contexts = new ArrayList<>();
        List<Chunk> used = new ArrayList<>();
        for (List<ScoredChunk> hits : perDocument) {
            List<Chunk> chunks = hits.stream().map(ScoredChunk::chunk).collect(Collectors.toList());
            if (chunks.isEmpty()) {
                continue;
            }
            contexts.add("Document " + (contexts.size() + 1) + ":\n" + joinContext(chunks));
            used.addAll(chunks);
        }
        if (contexts.size() < 2) {
            return QaResponse.message(COMPARE_INSUFFICIENT_MESSAGE, ResponseStatus.INSUFFICIENT);
        }
        List<SourceRef> sources = sourcesOf(used);
        String prompt = "Compare the documents below.\nGive similarities and differences.\n\n"
                + String.join(DOCUMENT_SEPARATOR, contexts) + "\n\nComparison:";
        try {
            String comparison = this.generationFunction.generate(prompt, this.compareMaxTokens);
            log.info("Compared {} documents", contexts.size());
            return new QaResponse(nonEmpty(comparison), ResponseStatus.OK, sources);
        }
        catch (ModelUnavailableException e) {
            log.warn("Generation unavailable for comparison: {}", e.getMessage());
            return new QaResponse(offlineAnswer(used), ResponseStatus.UNAVAILABLE, sources);
        }
    }

    /**
     * Pairwise cosine similarity between session centroids. Each session's centroid averages
     * its documents' centroids.
     */
    public SimilarityResponse similarity(List<String> sessionIds) {
        this.sessionStore.sweepExpired();
        if (sessionIds == null || sessionIds.isEmpty()) {
            return new SimilarityResponse(Map.of(), ResponseStatus.NO_SESSION, NO_SESSION_MESSAGE);
        }
        Map<String, List<RetrievalIndex>> resolved = this.sessionStore.resolveIndices(sessionIds);
        if (resolved.size() < 2) {
            return new SimilarityResponse(Map.of(), ResponseStatus.INSUFFICIENT, SIMILARITY_INSUFFICIENT_MESSAGE);
        }
        Map<String, float[]> centroids = new LinkedHashMap<>();
        resolved.forEach((sessionId, indices) -> centroids.put(sessionId, sessionCentroid(indices)));
        Map<String, Map<String, Double>> matrix = new LinkedHashMap<>();
        for (Map.Entry<String, float[]> row : centroids.entrySet()) {
            Map<String, Double> cells = new LinkedHashMap<>();
            for (Map.Entry<String, float[]> column : centroids.entrySet()) {
                cells.put(column.getKey(), EmbeddingRetrievalIndex.cosineSimilarity(row.getValue(), column.getValue()));
            }
            matrix.put(row.getKey(), cells);
        }
        return new SimilarityResponse(matrix, ResponseStatus.OK, null);
    }

    // Hits from every index are merged by similarity. The sort is stable, so ties keep index order.
    private List<Chunk> searchAll(List<RetrievalIndex> indices, String query, int k) {
        return this.searchEach(indices, query, k).stream()
                .flatMap(List::stream)
                .sorted(Comparator.comparingDouble(ScoredChunk::similarity).reversed())
                .map(ScoredChunk::chunk)
                .collect(Collectors.toList());
    }

    // All searches must finish before the caller reranks the combined candidates.
    private List<List<ScoredChunk>> searchEach(List<RetrievalIndex> indices, String query, int k) {
        List<CompletableFuture<List<ScoredChunk>>> futures = new ArrayList<>(indices.size());
        try {
            for (RetrievalIndex index : indices) {
                futures.add(CompletableFuture.supplyAsync(() -> index.searchScored(query, k), this.ragExecutor));
            }
        }
        catch (RejectedExecutionException e) {
            futures.forEach(future -> future.cancel(true));
            log.warn("Search pool rejected {} of {} index searches", indices.size() - futures.size(), indices.size());
            throw e;
        }
        try {
            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();
        }
        catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException) {
                throw (RuntimeException) e.getCause();
            }
            throw e;
        }
        return futures.stream().map(CompletableFuture::join).collect(Collectors.toList());
    }

    private static List<RetrievalIndex> flatten(Map<String, List<RetrievalIndex>> resolved) {
        return resolved.values().stream().flatMap(List::stream).collect(Collectors.toList());
    }

    private static float[] sessionCentroid(List<RetrievalIndex> indices) {
        float[] sum = null;
        for (RetrievalIndex index : indices) {
            float[] centroid = index.centroid();
            if (sum == null) {
                sum = centroid.clone();
                continue;
            }
            for (int d = 0; d < Math.min(sum.length, centroid.length); ++d) {
                sum[d] += centroid[d];
            }
        }
        return sum == null ? new float[0] : sum;
    }

    static String askPrompt(String context, String question) {
        return "Answer the question using ONLY the provided context.\n\n"
                + "Context:\n" + context + "\n\n"
                + "Question: " + question + "\nAnswer:";
    }

    private static String joinContext(List<Chunk> chunks) {
        return chunks.stream().map(Chunk::text).collect(Collectors.joining("\n\n"));
    }

    private static List<SourceRef> sourcesOf(List<Chunk> chunks) {
        return chunks.stream()
                .map(chunk -> new SourceRef(chunk.sourceId(), chunk.page()))
                .distinct()
                .collect(Collectors.toList());
    }

    private static String nonEmpty(String generated) {
        return generated == null || generated.isBlank() ? EMPTY_GENERATION_MESSAGE : generated.strip();
    }

    static String offlineAnswer(List<Chunk> chunks) {
        StringBuilder sim = new StringBuilder("**System Offline Mode**\n\n");
        sim.append("Answer generation is currently unavailable. Here are relevant excerpts from your documents:\n\n");
        int docNum = 1;
        for (Chunk chunk : chunks) {
            String text = chunk.text();
            String preview = text.substring(0, Math.min(EXCERPT_CHARS, text.length())).replaceAll("\\s+", " ").trim();
            String source = chunk.sourceId().isEmpty() ? "Document" : chunk.sourceId();
            sim.append(docNum++).append(". **").append(source).append("**");
            if (chunk.page() != null) {
                sim.append(" (page ").append(chunk.page() + 1).append(")");
            }
            sim.append("\n\n   ").append(preview).append("...\n\n");
        }
        return sim.toString().strip();
    }
}
