package net.seanstash.application.ai;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import net.seanstash.adapters.persistence.AiAnalysisRepository;
import net.seanstash.adapters.persistence.AiUsageRepository;
import net.seanstash.config.AiProviderProperties;
import net.seanstash.domain.ai.AnalysisHealth;
import net.seanstash.domain.ai.AnalysisRecord;
import net.seanstash.domain.ai.AnalysisResult;
import net.seanstash.domain.ai.CachedAnalysis;
import net.seanstash.domain.ai.CostEstimate;
import net.seanstash.domain.ai.TokenUsage;
import net.seanstash.domain.ai.UsagePeriod;
import net.seanstash.domain.ai.UsageRecord;
import net.seanstash.domain.ai.UsageReport;
import net.seanstash.util.IdGenerator;
import net.seanstash.util.LoggingUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import tools.jackson.databind.JsonNode;
import tools.jackson.databind.ObjectMapper;

/**
 * Turns a batch of raw terminal commands into validated snippet candidates.
 *
 * <p>Owns the cache-first lookup, prompt construction, the provider call, cost
 * accounting, response extraction and schema validation. Audit and ledger writes
 * are bookkeeping: their failures are logged and never fail the analysis.</p>
 */
@Service
public class CommandAnalysisService {

    private static final Logger log = LoggerFactory.getLogger(CommandAnalysisService.class);
    private static final int RECENT_ANALYSES_LIMIT = 10;
    private static final String NO_VALID_SNIPPETS = "No valid snippets in model response";

    private final TextGenerationProvider provider;
    private final AnalysisCache analysisCache;
    private final AiAnalysisRepository analysisRepository;
    private final AiUsageRepository usageRepository;
    private final AiProviderProperties properties;
    private final AnalysisResponseExtractor extractor;
    private final AnalysisCostCalculator costCalculator;
    private final MeterRegistry meterRegistry;
    private final Timer providerLatency;

    public CommandAnalysisService(TextGenerationProvider provider,
                                  AnalysisCache analysisCache,
                                  AiAnalysisRepository analysisRepository,
                                  AiUsageRepository usageRepository,
                                  AiProviderProperties properties,
                                  ObjectMapper objectMapper,
                                  MeterRegistry meterRegistry) {
        this.provider = provider;
        this.analysisCache = analysisCache;
        this.analysisRepository = analysisRepository;
        this.usageRepository = usageRepository;
        this.properties = properties;
        this.extractor = new AnalysisResponseExtractor(objectMapper);
        this.costCalculator = new AnalysisCostCalculator(
            properties.getInputCostPerMillion(), properties.getOutputCostPerMillion());
        this.meterRegistry = meterRegistry;
        this.providerLatency = meterRegistry.timer("command.analysis.provider.latency");
    }

    /**
     * Analyzes one owner's command batch, serving repeats from the analysis cache.
     *
     * @param ownerId owner whose commands are analyzed
     * @param commands ordered, non-empty command texts
     * @param options candidate cap and grouping hint
     * @return result with {@code success} true when at least one candidate validated
     * @throws AnalysisProviderException when the provider produced no reply
     * @throws AnalysisExtractionException when the reply held no usable JSON
     */
    public AnalysisResult analyze(long ownerId, List<String> commands, AnalysisOptions options) {
        if (commands == null || commands.isEmpty()) {
            throw new IllegalArgumentException("At least one command is required for analysis");
        }
        AnalysisOptions effectiveOptions = options != null ? options : AnalysisOptions.defaults();
        String digest = CommandBatchHasher.digest(commands);

        Optional<CachedAnalysis> cached = lookupCache(digest);
        if (cached.isPresent()) {
            meterRegistry.counter("command.analysis.cache", "result", "hit").increment();
            bookkeeping(() -> analysisCache.touchHit(digest), "cache hit update for digest {}", digest);
            log.info("Serving cached analysis {} for owner {} ({} commands)",
                cached.get().result().analysisId(), ownerId, commands.size());
            return cached.get().result().asCached();
        }
        meterRegistry.counter("command.analysis.cache", "result", "miss").increment();

        if (!provider.isConfigured()) {
            throw new AnalysisProviderException(AnalysisProviderException.ErrorCode.NOT_CONFIGURED,
                "Analysis provider API key is not configured");
        }

        String analysisId = IdGenerator.uuidV7();
        bookkeeping(() -> analysisRepository.createProcessing(analysisId, ownerId, commands),
            "audit row creation for analysis {}", analysisId);

        GenerationRequest request = new GenerationRequest(
            properties.getModel(),
            properties.getMaxTokens(),
            properties.getTemperature(),
            AnalysisPromptBuilder.build(commands, effectiveOptions)
        );

        long startNanos = System.nanoTime();
        GenerationResponse response;
        try {
            response = provider.generate(request);
        } catch (AnalysisProviderException exception) {
            log.warn("Provider call failed for analysis {} (owner {}, code {}): {}",
                analysisId, ownerId, exception.errorCode(), exception.getMessage());
            bookkeeping(() -> analysisRepository.markFailed(analysisId, exception.getMessage(), null, null),
                "audit failure update for analysis {}", analysisId);
            throw exception;
        }
        long processingTimeMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
        providerLatency.record(processingTimeMs, TimeUnit.MILLISECONDS);

        TokenUsage tokens = TokenUsage.of(response.tokensIn(), response.tokensOut());
        CostEstimate cost = costCalculator.estimate(tokens);
        Instant analyzedAt = Instant.now();
        bookkeeping(() -> usageRepository.append(new UsageRecord(
                ownerId, analysisId, tokens.input(), tokens.output(), cost.total(), properties.getModel(), analyzedAt)),
            "usage ledger append for analysis {}", analysisId);

        AnalysisCandidateValidator.Outcome outcome;
        try {
            JsonNode document = extractor.extract(response.text());
            outcome = AnalysisCandidateValidator.validate(document, effectiveOptions.maxCandidates());
        } catch (AnalysisExtractionException exception) {
            log.warn("Analysis {} for owner {} returned unusable output: {}", analysisId, ownerId, exception.getMessage());
            bookkeeping(() -> analysisRepository.markFailed(analysisId, exception.getMessage(), tokens.total(), cost.total()),
                "audit failure update for analysis {}", analysisId);
            throw exception.withAnalysisId(analysisId);
        }

        boolean success = !outcome.validCandidates().isEmpty();
        AnalysisResult result = new AnalysisResult(
            analysisId,
            success,
            false,
            outcome.validCandidates(),
            outcome.errors(),
            tokens,
            cost,
            processingTimeMs,
            properties.getModel(),
            response.text(),
            analyzedAt
        );

        if (!outcome.errors().isEmpty()) {
            log.warn("Analysis {} dropped {} invalid candidates: {}", analysisId, outcome.errors().size(), outcome.errors());
        }

        if (success) {
            bookkeeping(() -> analysisCache.put(digest, String.join("\n", commands), result),
                "cache write for analysis {}", analysisId);
            bookkeeping(() -> analysisRepository.markCompleted(
                    analysisId, result, outcome.validCandidates().size(), tokens.total(), cost.total()),
                "audit completion update for analysis {}", analysisId);
        } else {
            bookkeeping(() -> analysisRepository.markFailed(analysisId, NO_VALID_SNIPPETS, tokens.total(), cost.total()),
                "audit failure update for analysis {}", analysisId);
        }

        log.info("Analysis {} for owner {} finished in {}ms: {} valid, {} rejected, {} tokens, ${}",
            analysisId, ownerId, processingTimeMs, outcome.validCandidates().size(), outcome.errors().size(),
            tokens.total(), String.format("%.6f", cost.total()));
        return result;
    }

    /**
     * Reports provider readiness without calling the provider.
     */
    public AnalysisHealth healthStatus() {
        boolean configured;
        String status;
        try {
            configured = provider.isConfigured();
            status = configured ? AnalysisHealth.READY : AnalysisHealth.NOT_CONFIGURED;
        } catch (RuntimeException exception) {
            LoggingUtils.warn(log, exception, "Failed to resolve analysis provider configuration");
            configured = false;
            status = AnalysisHealth.ERROR;
        }
        return new AnalysisHealth(configured, properties.getModel(), properties.getTemperature(),
            properties.getMaxTokens(), status);
    }

    public Optional<AnalysisRecord> findAnalysis(String analysisId, long ownerId) {
        if (!StringUtils.hasText(analysisId)) {
            throw new IllegalArgumentException("Analysis id is required");
        }
        return analysisRepository.findById(analysisId.trim(), ownerId);
    }

    /**
     * Usage ledger totals for the owner over the period, with the most recent analyses.
     */
    public UsageReport usageReport(long ownerId, UsagePeriod period) {
        Instant since = Instant.now().minus(period.window());
        return new UsageReport(
            period,
            usageRepository.summarize(ownerId, since),
            analysisRepository.findRecent(ownerId, since, RECENT_ANALYSES_LIMIT)
        );
    }

    private Optional<CachedAnalysis> lookupCache(String digest) {
        try {
            return analysisCache.get(digest);
        } catch (DataAccessException exception) {
            LoggingUtils.warn(log, exception, "Analysis cache lookup failed for digest {}; treating as a miss", digest);
            return Optional.empty();
        }
    }

    private void bookkeeping(Runnable write, String description, Object subject) {
        try {
            write.run();
        } catch (DataAccessException exception) {
            LoggingUtils.warn(log, exception, "Bookkeeping failed: " + description, subject);
        }
    }
}
