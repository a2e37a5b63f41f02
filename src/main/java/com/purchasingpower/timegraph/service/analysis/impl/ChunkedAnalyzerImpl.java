package com.purchasingpower.timegraph.service.analysis.impl;

import com.google.common.base.Preconditions;
import com.google.common.base.Stopwatch;
import com.purchasingpower.timegraph.configuration.AnalyzerProperties;
import com.purchasingpower.timegraph.configuration.EngineProperties;
import com.purchasingpower.timegraph.core.CancellationToken;
import com.purchasingpower.timegraph.core.Document;
import com.purchasingpower.timegraph.core.RelationKind;
import com.purchasingpower.timegraph.core.Relationship;
import com.purchasingpower.timegraph.knowledge.RelationshipDirection;
import com.purchasingpower.timegraph.knowledge.TemporalGraphStore;
import com.purchasingpower.timegraph.model.analysis.AnalysisRequest;
import com.purchasingpower.timegraph.model.analysis.AnalysisResult;
import com.purchasingpower.timegraph.model.analysis.AnalysisWindow;
import com.purchasingpower.timegraph.model.analysis.CarryoverState;
import com.purchasingpower.timegraph.model.analysis.CausalChain;
import com.purchasingpower.timegraph.model.analysis.ChunkResult;
import com.purchasingpower.timegraph.model.analysis.CriticalEvent;
import com.purchasingpower.timegraph.model.analysis.EntityStat;
import com.purchasingpower.timegraph.model.analysis.OpenQuestion;
import com.purchasingpower.timegraph.model.analysis.PerformanceMetrics;
import com.purchasingpower.timegraph.model.analysis.WindowSummary;
import com.purchasingpower.timegraph.parser.EntityExtractor;
import com.purchasingpower.timegraph.service.analysis.AnalysisWindows;
import com.purchasingpower.timegraph.service.analysis.CausalChainExtractor;
import com.purchasingpower.timegraph.service.analysis.ChunkedAnalyzer;
import com.purchasingpower.timegraph.service.analysis.ImportanceScorer;
import com.purchasingpower.timegraph.service.graph.GraphTraversalService;
import com.purchasingpower.timegraph.service.similarity.SimilarityService;
import com.purchasingpower.timegraph.util.LogFormat;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

/**
 * Markov-style chunked analyzer: window {@code i + 1} depends on nothing but its own documents
 * and the carryover of window {@code i}.
 *
 * <p>Every list in a carryover is cut to its configured capacity before it is handed on.
 */
@Slf4j
@Service
public class ChunkedAnalyzerImpl implements ChunkedAnalyzer {

    private static final Comparator<CriticalEvent> BY_IMPORTANCE =
            Comparator.comparingDouble(CriticalEvent::getImportance).reversed()
                    .thenComparing(CriticalEvent::getDocumentId);

    private static final DateTimeFormatter PERIOD_FORMAT =
            DateTimeFormatter.ISO_LOCAL_DATE.withZone(ZoneOffset.UTC);

    private static final int SUMMARY_EVENTS = 3;
    private static final int SUMMARY_ENTITIES = 5;

    private final TemporalGraphStore store;
    private final GraphTraversalService traversalService;
    private final SimilarityService similarityService;
    private final EntityExtractor entityExtractor;
    private final AnalyzerProperties properties;
    private final ImportanceScorer importanceScorer;
    private final CausalChainExtractor chainExtractor;

    public ChunkedAnalyzerImpl(TemporalGraphStore store,
                               GraphTraversalService traversalService,
                               SimilarityService similarityService,
                               EntityExtractor entityExtractor,
                               EngineProperties properties) {
        this.store = store;
        this.traversalService = traversalService;
        this.similarityService = similarityService;
        this.entityExtractor = entityExtractor;
        this.properties = properties.getAnalyzer();
        this.importanceScorer = new ImportanceScorer(store, this.properties.getWeights());
        this.chainExtractor = new CausalChainExtractor(store);
    }

    // ================================================================
    // Full run
    // ================================================================

    @Override
    public AnalysisResult analyze(AnalysisRequest request) {
        Preconditions.checkNotNull(request, "request");
        Document startDocument = store.getDocument(request.getStartDocumentId());
        Document endDocument = request.getEndDocumentId() == null ? null : store.getDocument(request.getEndDocumentId());

        int maxDays = request.getMaxDays() != null ? request.getMaxDays() : properties.getMaxDays();
        int chunkSizeDays = request.getChunkSizeDays() != null ? request.getChunkSizeDays() : properties.getChunkSizeDays();
        Preconditions.checkArgument(maxDays >= 0, "maxDays must not be negative");
        Preconditions.checkArgument(chunkSizeDays > 0, "chunkSizeDays must be positive");

        Instant spanStart = startDocument.getTimestamp();
        Instant spanEnd = spanStart.plus(Duration.ofDays(maxDays));
        if (endDocument != null) {
            Preconditions.checkArgument(!endDocument.getTimestamp().isBefore(spanStart),
                    "End document %s is earlier than start document %s", endDocument.getId(), startDocument.getId());
            if (endDocument.getTimestamp().isBefore(spanEnd)) {
                spanEnd = endDocument.getTimestamp();
            }
        }

        List<AnalysisWindow> windows = AnalysisWindows.fixedSize(spanStart, spanEnd, chunkSizeDays);
        log.info("🔍 Chunked analysis from {} ({} days, {} windows of {} days)",
                startDocument.getId(), Duration.between(spanStart, spanEnd).toDays(), windows.size(), chunkSizeDays);

        CancellationToken token = request.getCancellationToken() != null
                ? request.getCancellationToken()
                : CancellationToken.none();
        CarryoverState carryover = CarryoverState.empty();
        List<ChunkResult> chunks = new ArrayList<>();
        boolean cancelled = false;
        boolean endReached = false;

        for (AnalysisWindow window : windows) {
            if (token.isCancellationRequested()) {
                cancelled = true;
                log.warn("⚠️ Analysis from {} cancelled after {} of {} windows",
                        startDocument.getId(), chunks.size(), windows.size());
                break;
            }

            ChunkResult chunk = processWindow(window, carryover);
            chunks.add(chunk);
            carryover = chunk.getCarryover();

            if (endDocument != null && chunk.getDocumentIds().contains(endDocument.getId())) {
                endReached = true;
                break;
            }
        }

        AnalysisResult result = synthesize(startDocument, endDocument, spanStart, spanEnd, chunkSizeDays,
                windows.size(), chunks, carryover, cancelled, endReached);
        log.info("✅ Analysis complete: {} windows, {} documents, {} events, {} chains in {} ms",
                chunks.size(), result.getMetrics().getTotalDocuments(), result.getCriticalEvents().size(),
                result.getCausalChains().size(), String.format("%.1f", result.getMetrics().getTotalProcessingTimeMs()));
        return result;
    }

    // ================================================================
    // One window
    // ================================================================

    private ChunkResult processWindow(AnalysisWindow window, CarryoverState carryover) {
        Stopwatch stopwatch = Stopwatch.createStarted();

        List<Document> windowDocuments = documentsIn(window);
        Set<String> windowIds = windowDocuments.stream().map(Document::getId)
                .collect(Collectors.toCollection(LinkedHashSet::new));

        // Working set: this window plus the documents the carryover flags, nothing else.
        Set<String> context = new LinkedHashSet<>(carryover.getFlaggedDocumentIds());
        context.removeAll(windowIds);
        Set<String> workingSet = new LinkedHashSet<>(windowIds);
        workingSet.addAll(context);

        List<String> continuations = continuations(carryover.getFlaggedDocumentIds(), window);

        Map<String, Double> importance = importanceScorer.score(windowDocuments, workingSet,
                carryover.getAttentionScores(), window, properties.isParallelScoring());

        List<CriticalEvent> events = importance.entrySet().stream()
                .limit(properties.getMaxCarryoverEvents())
                .map(entry -> toEvent(store.getDocument(entry.getKey()), entry.getValue(), window.index()))
                .toList();

        List<EntityStat> entities = entityExtractor.extract(windowDocuments, importance,
                properties.getMaxCarryoverEntities());

        List<CausalChain> chains = chainExtractor.extract(workingSet, windowIds, carryover.getCausalChains(),
                properties.getMaxCarryoverChains());

        List<OpenQuestion> raised = openQuestions(chains, window);
        List<OpenQuestion> stillOpen = new ArrayList<>();
        int resolved = 0;
        for (OpenQuestion question : carryover.getOpenQuestions()) {
            if (isResolved(question, chains)) {
                resolved++;
            } else if (isPending(question, window)) {
                stillOpen.add(question);
            }
        }

        CarryoverState next = nextCarryover(carryover, window, windowDocuments, importance, events, entities,
                chains, stillOpen, raised);

        double elapsedMs = stopwatch.elapsed(TimeUnit.MICROSECONDS) / 1000.0;
        log.debug("Window {} [{} - {}]: {} documents, context {}, {} continuations, {} chains, carryover {}",
                window.index(), window.start(), window.end(), windowDocuments.size(), LogFormat.formatIds(context),
                continuations.size(), chains.size(), next.getSize());

        return ChunkResult.builder()
                .windowIndex(window.index())
                .windowStart(window.start())
                .windowEnd(window.end())
                .documentIds(new ArrayList<>(windowIds))
                .continuationIds(continuations)
                .contextDocumentIds(new ArrayList<>(context))
                .criticalEvents(events)
                .keyEntities(entities)
                .causalChains(chains)
                .openQuestions(raised)
                .resolvedQuestions(resolved)
                .carryover(next)
                .processingTimeMs(elapsedMs)
                .workingSetSize(workingSet.size())
                .build();
    }

    private List<Document> documentsIn(AnalysisWindow window) {
        return store.getDocumentsInRange(window.start(), window.end()).stream()
                .filter(document -> window.contains(document.getTimestamp()))
                .toList();
    }

    /**
     * Window documents reachable from flagged documents of earlier windows.
     */
    private List<String> continuations(Set<String> flagged, AnalysisWindow window) {
        Set<String> reached = new LinkedHashSet<>();
        for (String id : flagged) {
            Document source = store.getDocument(id);
            if (source.getTimestamp().isAfter(window.end())) {
                continue;
            }
            long days = Duration.between(source.getTimestamp(), window.end()).toDays() + 1;
            int windowDays = (int) Math.min(Integer.MAX_VALUE, days);
            traversalService.forwardReachable(id, windowDays, properties.getContinuationMaxHops(), Integer.MAX_VALUE)
                    .getDocuments().stream()
                    .filter(document -> window.contains(document.getTimestamp()))
                    .forEach(document -> reached.add(document.getId()));
        }
        return new ArrayList<>(reached);
    }

    private CriticalEvent toEvent(Document document, double importance, int windowIndex) {
        return CriticalEvent.builder()
                .documentId(document.getId())
                .timestamp(document.getTimestamp())
                .importance(importance)
                .summary(LogFormat.abbreviate(document.getContent(), properties.getSummaryLength()))
                .windowIndex(windowIndex)
                .build();
    }

    private List<OpenQuestion> openQuestions(List<CausalChain> chains, AnalysisWindow window) {
        List<OpenQuestion> questions = new ArrayList<>();
        for (CausalChain chain : chains) {
            List<String> pending = chainExtractor.causalSuccessors(chain.getTail(), null).stream()
                    .filter(id -> isBeyond(window, store.getDocument(id).getTimestamp()))
                    .toList();
            if (pending.isEmpty()) {
                continue;
            }
            questions.add(OpenQuestion.builder()
                    .documentId(chain.getTail())
                    .chain(chain.getDocumentIds())
                    .pendingDocumentIds(pending)
                    .text("Chain " + chain + " continues beyond " + PERIOD_FORMAT.format(window.end()))
                    .raisedInWindow(window.index())
                    .build());
        }
        return questions;
    }

    private static boolean isResolved(OpenQuestion question, List<CausalChain> chains) {
        return chains.stream().anyMatch(chain -> {
            int index = chain.getDocumentIds().indexOf(question.getDocumentId());
            return index >= 0 && index < chain.getLength() - 1;
        });
    }

    private boolean isPending(OpenQuestion question, AnalysisWindow window) {
        return question.getPendingDocumentIds().stream()
                .anyMatch(id -> isBeyond(window, store.getDocument(id).getTimestamp()));
    }

    /**
     * At or after the end of a half-open window, strictly after the end of the closed last one.
     */
    private static boolean isBeyond(AnalysisWindow window, Instant timestamp) {
        return !timestamp.isBefore(window.end()) && !window.contains(timestamp);
    }

    // ================================================================
    // Carryover
    // ================================================================

    private CarryoverState nextCarryover(CarryoverState previous, AnalysisWindow window,
                                         List<Document> windowDocuments, Map<String, Double> importance,
                                         List<CriticalEvent> events, List<EntityStat> entities,
                                         List<CausalChain> chains, List<OpenQuestion> stillOpen,
                                         List<OpenQuestion> raised) {
        Map<String, CriticalEvent> eventsById = new HashMap<>();
        for (CriticalEvent event : concat(previous.getCriticalEvents(), events)) {
            eventsById.merge(event.getDocumentId(), event,
                    (a, b) -> a.getImportance() >= b.getImportance() ? a : b);
        }
        List<CriticalEvent> mergedEvents = eventsById.values().stream()
                .sorted(BY_IMPORTANCE)
                .limit(properties.getMaxCarryoverEvents())
                .collect(Collectors.toCollection(ArrayList::new));

        Map<String, EntityStat> entityMerge = new HashMap<>(previous.getKeyEntities());
        entities.forEach(entity -> entityMerge.merge(entity.getToken(), entity, EntityStat::merge));
        Map<String, EntityStat> mergedEntities = new LinkedHashMap<>();
        entityMerge.values().stream()
                .sorted(EntityExtractor.BY_WEIGHT)
                .limit(properties.getMaxCarryoverEntities())
                .forEach(entity -> mergedEntities.put(entity.getToken(), entity));

        List<CausalChain> allChains = CausalChainExtractor.removeContained(concat(previous.getCausalChains(), chains));
        List<CausalChain> sortedChains = allChains.stream().sorted(chainExtractor.byTail()).toList();
        List<CausalChain> recentChains = sortedChains.subList(
                        Math.max(0, sortedChains.size() - properties.getMaxCarryoverChains()), sortedChains.size())
                .stream()
                .map(this::trimToRecent)
                .collect(Collectors.toCollection(ArrayList::new));

        Map<String, OpenQuestion> questionsByTail = new LinkedHashMap<>();
        concat(stillOpen, raised).forEach(question -> questionsByTail.put(question.getDocumentId(), question));
        List<OpenQuestion> questions = new ArrayList<>(questionsByTail.values());
        List<OpenQuestion> recentQuestions = new ArrayList<>(questions.subList(
                Math.max(0, questions.size() - properties.getMaxOpenQuestions()), questions.size()));

        return CarryoverState.builder()
                .criticalEvents(mergedEvents)
                .keyEntities(mergedEntities)
                .causalChains(recentChains)
                .attentionScores(attention(window, windowDocuments, importance))
                .openQuestions(recentQuestions)
                .windowsProcessed(previous.getWindowsProcessed() + 1)
                .documentCount(previous.getDocumentCount() + windowDocuments.size())
                .coveredUntil(window.end())
                .build();
    }

    private CausalChain trimToRecent(CausalChain chain) {
        int maxLength = properties.getMaxChainLength();
        if (chain.getLength() <= maxLength) {
            return chain;
        }
        List<String> ids = chain.getDocumentIds();
        return CausalChain.of(ids.subList(ids.size() - maxLength, ids.size()));
    }

    /**
     * Attention for the next windows: causal or sequential successors past the window end, each
     * scored by the normalized importance of the document pointing at it, damped by their
     * dissimilarity. Window documents themselves are never carried, later windows cannot score them.
     */
    private Map<String, Double> attention(AnalysisWindow window, List<Document> windowDocuments,
                                          Map<String, Double> importance) {
        double maxScore = importanceScorer.maxScore();
        Map<String, Double> scores = new HashMap<>();
        int capacity = properties.getMaxAttentionScores();

        for (Document document : windowDocuments) {
            double normalized = maxScore > 0 ? importance.getOrDefault(document.getId(), 0.0) / maxScore : 0.0;
            if (normalized <= 0) {
                continue;
            }
            for (Relationship relationship : store.getRelationships(document.getId(), RelationshipDirection.OUTGOING)) {
                if (relationship.getKind() != RelationKind.CAUSAL && relationship.getKind() != RelationKind.SEQUENTIAL) {
                    continue;
                }
                Document target = store.getDocument(relationship.getToId());
                if (!isBeyond(window, target.getTimestamp())) {
                    continue;
                }
                double similarity = similarityService.similarity(document.getId(), target.getId());
                scores.merge(target.getId(), normalized * (0.5 + 0.5 * similarity), Math::max);
            }
        }

        Map<String, Double> capped = new LinkedHashMap<>();
        scores.entrySet().stream()
                .sorted(Map.Entry.<String, Double>comparingByValue().reversed()
                        .thenComparing(Map.Entry.<String, Double>comparingByKey()))
                .limit(capacity)
                .forEach(entry -> capped.put(entry.getKey(), entry.getValue()));
        return capped;
    }

    // ================================================================
    // Synthesis
    // ================================================================

    private AnalysisResult synthesize(Document startDocument, Document endDocument, Instant spanStart,
                                      Instant spanEnd, int chunkSizeDays, int plannedWindows,
                                      List<ChunkResult> chunks, CarryoverState finalCarryover,
                                      boolean cancelled, boolean endReached) {
        Map<String, CriticalEvent> eventsById = new HashMap<>();
        Map<String, EntityStat> entitiesByToken = new HashMap<>();
        List<CausalChain> chains = new ArrayList<>();

        for (ChunkResult chunk : chunks) {
            chunk.getCriticalEvents().forEach(event -> eventsById.merge(event.getDocumentId(), event,
                    (a, b) -> a.getImportance() >= b.getImportance() ? a : b));
            chunk.getKeyEntities().forEach(entity -> entitiesByToken.merge(entity.getToken(), entity, EntityStat::merge));
            chains.addAll(chunk.getCausalChains());
        }

        List<CausalChain> uniqueChains = CausalChainExtractor.removeContained(new ArrayList<>(new LinkedHashSet<>(chains)));

        return AnalysisResult.builder()
                .startDocumentId(startDocument.getId())
                .endDocumentId(endDocument == null ? null : endDocument.getId())
                .spanStart(spanStart)
                .spanEnd(spanEnd)
                .totalSpanDays(Duration.between(spanStart, spanEnd).toDays())
                .chunkSizeDays(chunkSizeDays)
                .plannedWindows(plannedWindows)
                .chunkResults(chunks)
                .criticalEvents(eventsById.values().stream().sorted(BY_IMPORTANCE).toList())
                .keyEntities(entitiesByToken.values().stream().sorted(EntityExtractor.BY_WEIGHT).toList())
                .causalChains(uniqueChains.stream().sorted(chainExtractor.byTail()).toList())
                .openQuestions(new ArrayList<>(finalCarryover.getOpenQuestions()))
                .finalCarryover(finalCarryover)
                .metrics(metrics(chunks))
                .cancelled(cancelled)
                .endDocumentReached(endReached)
                .build();
    }

    static PerformanceMetrics metrics(List<ChunkResult> chunks) {
        double totalMs = chunks.stream().mapToDouble(ChunkResult::getProcessingTimeMs).sum();
        int totalDocuments = chunks.stream().mapToInt(chunk -> chunk.getDocumentIds().size()).sum();
        double estimated = estimateUnwindowedMs(totalDocuments);

        return PerformanceMetrics.builder()
                .totalProcessingTimeMs(totalMs)
                .totalDocuments(totalDocuments)
                .avgChunkTimeMs(chunks.isEmpty() ? 0.0 : totalMs / chunks.size())
                .avgChunkSize(chunks.isEmpty() ? 0.0 : (double) totalDocuments / chunks.size())
                .estimatedUnwindowedTimeMs(estimated)
                .speedupFactor(totalMs > 0 ? estimated / totalMs : null)
                .build();
    }

    /**
     * Cost model of analysing every pair at once: linear below 50 documents, quadratic above.
     */
    static double estimateUnwindowedMs(int documents) {
        if (documents < 50) {
            return 10.0 * documents;
        }
        return 0.1 * documents + 0.01 * documents * (double) documents;
    }

    // ================================================================
    // Temporal summary
    // ================================================================

    @Override
    public List<WindowSummary> getTemporalSummary(String startDocumentId, String endDocumentId, int numChunks) {
        Instant start = store.getDocument(startDocumentId).getTimestamp();
        Instant end = store.getDocument(endDocumentId).getTimestamp();
        return getTemporalSummary(start, end, numChunks);
    }

    @Override
    public List<WindowSummary> getTemporalSummary(Instant start, Instant end, int numChunks) {
        Preconditions.checkNotNull(start, "start");
        Preconditions.checkNotNull(end, "end");
        List<AnalysisWindow> windows = AnalysisWindows.equalParts(start, end, numChunks);

        List<WindowSummary> summaries = new ArrayList<>(windows.size());
        for (AnalysisWindow window : windows) {
            summaries.add(summarize(window));
        }
        log.debug("Temporal summary {} - {} in {} windows, {} documents", start, end, numChunks,
                summaries.stream().mapToInt(WindowSummary::getDocumentCount).sum());
        return summaries;
    }

    private WindowSummary summarize(AnalysisWindow window) {
        List<Document> documents = documentsIn(window);
        Set<String> ids = documents.stream().map(Document::getId)
                .collect(Collectors.toCollection(LinkedHashSet::new));

        Map<String, Double> importance = importanceScorer.score(documents, ids, Map.of(), window, false);
        List<CriticalEvent> events = importance.entrySet().stream()
                .limit(SUMMARY_EVENTS)
                .map(entry -> toEvent(store.getDocument(entry.getKey()), entry.getValue(), window.index()))
                .toList();
        List<String> entities = entityExtractor.extract(documents, importance, SUMMARY_ENTITIES).stream()
                .map(EntityStat::getToken)
                .toList();
        int chains = chainExtractor.extract(ids, ids, List.of(), properties.getMaxCarryoverChains()).size();

        return WindowSummary.builder()
                .index(window.index())
                .start(window.start())
                .end(window.end())
                .period(PERIOD_FORMAT.format(window.start()) + " to " + PERIOD_FORMAT.format(window.end()))
                .newDocumentIds(new ArrayList<>(ids))
                .documentCount(documents.size())
                .keyEvents(events)
                .keyEntities(entities)
                .causalChainCount(chains)
                .build();
    }

    private static <T> List<T> concat(List<T> first, List<T> second) {
        List<T> result = new ArrayList<>(first.size() + second.size());
        result.addAll(first);
        result.addAll(second);
        return result;
    }
}
