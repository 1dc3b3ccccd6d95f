package net.seanstash.adapters.ai;

import com.openai.client.OpenAIClient;
import com.openai.client.okhttp.OpenAIOkHttpClient;
import com.openai.core.RequestOptions;
import com.openai.core.Timeout;
import com.openai.errors.OpenAIException;
import com.openai.errors.OpenAIIoException;
import com.openai.errors.OpenAIServiceException;
import com.openai.errors.PermissionDeniedException;
import com.openai.errors.RateLimitException;
import com.openai.errors.UnauthorizedException;
import com.openai.models.ChatModel;
import com.openai.models.chat.completions.ChatCompletion;
import com.openai.models.chat.completions.ChatCompletionCreateParams;
import com.openai.models.chat.completions.ChatCompletionMessageParam;
import com.openai.models.chat.completions.ChatCompletionUserMessageParam;
import com.openai.models.completions.CompletionUsage;
import java.io.InterruptedIOException;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;
import net.seanstash.adapters.persistence.SettingsRepository;
import net.seanstash.application.ai.AnalysisProviderException;
import net.seanstash.application.ai.AnalysisProviderException.ErrorCode;
import net.seanstash.application.ai.GenerationRequest;
import net.seanstash.application.ai.GenerationResponse;
import net.seanstash.application.ai.TextGenerationProvider;
import net.seanstash.config.AiProviderProperties;
import net.seanstash.util.LoggingUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * {@link TextGenerationProvider} backed by the OpenAI Java SDK against an
 * OpenAI-compatible chat completions endpoint.
 *
 * <p>The API key is read from the {@code settings} table first and from configuration
 * second, on every call, so a key saved at runtime takes effect without a restart.
 * One SDK client is kept per distinct key.</p>
 */
@Component
public class OpenAiTextGenerationProvider implements TextGenerationProvider {

    private static final Logger log = LoggerFactory.getLogger(OpenAiTextGenerationProvider.class);

    private final AiProviderProperties properties;
    private final SettingsRepository settingsRepository;
    private final Function<String, OpenAIClient> clientFactory;

    private String clientApiKey;
    private OpenAIClient client;

    @Autowired
    public OpenAiTextGenerationProvider(AiProviderProperties properties, SettingsRepository settingsRepository) {
        this(properties, settingsRepository, apiKey -> OpenAIOkHttpClient.builder()
            .apiKey(apiKey)
            .baseUrl(properties.getBaseUrl())
            .maxRetries(properties.getMaxRetries())
            .build());
    }

    OpenAiTextGenerationProvider(AiProviderProperties properties,
                                 SettingsRepository settingsRepository,
                                 Function<String, OpenAIClient> clientFactory) {
        this.properties = properties;
        this.settingsRepository = settingsRepository;
        this.clientFactory = clientFactory;
    }

    @Override
    public boolean isConfigured() {
        return resolveApiKey().isPresent();
    }

    @Override
    public GenerationResponse generate(GenerationRequest request) {
        String apiKey = resolveApiKey().orElseThrow(() -> new AnalysisProviderException(
            ErrorCode.NOT_CONFIGURED, "Analysis provider API key is not configured"));

        ChatCompletionCreateParams params = ChatCompletionCreateParams.builder()
            .model(ChatModel.of(request.model()))
            .messages(List.of(
                ChatCompletionMessageParam.ofUser(
                    ChatCompletionUserMessageParam.builder().content(request.prompt()).build()
                )
            ))
            .maxTokens(request.maxTokens())
            .temperature(request.temperature())
            .build();

        RequestOptions options = RequestOptions.builder()
            .timeout(Timeout.builder().request(properties.getRequestTimeout()).build())
            .build();

        ChatCompletion completion;
        try {
            completion = clientFor(apiKey).chat().completions().create(params, options);
        } catch (OpenAIException exception) {
            throw translate(exception);
        }
        return toResponse(completion);
    }

    static GenerationResponse toResponse(ChatCompletion completion) {
        if (completion == null || completion.choices().isEmpty()) {
            throw new AnalysisProviderException(ErrorCode.MALFORMED_RESPONSE, "Provider reply contained no choices");
        }
        String text = completion.choices().get(0).message().content().orElse("");
        if (!StringUtils.hasText(text)) {
            throw new AnalysisProviderException(ErrorCode.MALFORMED_RESPONSE, "Empty response from provider");
        }
        long tokensIn = completion.usage().map(CompletionUsage::promptTokens).orElse(0L);
        long tokensOut = completion.usage().map(CompletionUsage::completionTokens).orElse(0L);
        return new GenerationResponse(text, tokensIn, tokensOut);
    }

    /**
     * Maps SDK failures onto provider error codes.
     */
    static AnalysisProviderException translate(OpenAIException exception) {
        String description = describeApiError(exception);
        ErrorCode code;
        if (exception instanceof UnauthorizedException || exception instanceof PermissionDeniedException) {
            code = ErrorCode.AUTHENTICATION;
        } else if (exception instanceof RateLimitException) {
            code = ErrorCode.RATE_LIMITED;
        } else if (exception instanceof OpenAIIoException) {
            code = isTimeout(exception) ? ErrorCode.TIMEOUT : ErrorCode.NETWORK;
        } else {
            code = ErrorCode.PROVIDER_FAILURE;
        }
        return new AnalysisProviderException(code, "Provider call failed: " + description, exception);
    }

    /**
     * Formats an SDK exception into a concise description with HTTP status when available.
     */
    static String describeApiError(OpenAIException ex) {
        if (ex instanceof OpenAIServiceException serviceException) {
            int status = serviceException.statusCode();
            String explanation = switch (status) {
                case 400 -> "bad request";
                case 401 -> "unauthorized, check API key";
                case 403 -> "access denied";
                case 404 -> "not found, check base URL and model name";
                case 422 -> "unprocessable request";
                case 429 -> "rate limited";
                case 500, 502, 503, 529 -> "server error";
                default -> "unexpected status";
            };
            return "HTTP %d %s".formatted(status, explanation);
        }
        if (ex instanceof OpenAIIoException) {
            return "network error: " + LoggingUtils.describe(ex);
        }
        return LoggingUtils.describe(ex);
    }

    private static boolean isTimeout(Throwable exception) {
        for (Throwable cause = exception; cause != null; cause = cause.getCause()) {
            if (cause instanceof InterruptedIOException) {
                return true;
            }
            if (cause.getCause() == cause) {
                break;
            }
        }
        return false;
    }

    private synchronized OpenAIClient clientFor(String apiKey) {
        if (client == null || !apiKey.equals(clientApiKey)) {
            client = clientFactory.apply(apiKey);
            clientApiKey = apiKey;
            log.info("Analysis provider client configured (model={}, baseUrl={})",
                properties.getModel(), properties.getBaseUrl());
        }
        return client;
    }

    private Optional<String> resolveApiKey() {
        try {
            return storedApiKey().or(this::configuredApiKey);
        } catch (DataAccessException exception) {
            LoggingUtils.warn(log, exception, "Settings lookup for {} failed; using configured API key",
                properties.getApiKeySetting());
            return configuredApiKey();
        }
    }

    private Optional<String> storedApiKey() {
        return settingsRepository.findValue(properties.getApiKeySetting())
            .filter(StringUtils::hasText)
            .map(String::trim);
    }

    private Optional<String> configuredApiKey() {
        return Optional.ofNullable(properties.getApiKey())
            .filter(StringUtils::hasText)
            .map(String::trim);
    }
}
