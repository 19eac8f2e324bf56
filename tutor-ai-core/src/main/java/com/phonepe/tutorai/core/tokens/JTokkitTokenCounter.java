package com.phonepe.tutorai.core.tokens;

import com.google.common.base.Strings;
import com.knuddels.jtokkit.Encodings;
import com.knuddels.jtokkit.api.Encoding;
import com.knuddels.jtokkit.api.EncodingRegistry;
import com.knuddels.jtokkit.api.EncodingType;

import com.phonepe.tutorai.core.errors.ErrorType;

import lombok.Builder;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Exact token counts using the jtokkit encodings for OpenAI models.
 * <p>
 * Models jtokkit does not know about can be mapped to an encoding explicitly. Anything still unresolved, or any
 * tokenizer error, is delegated to the fallback counter.
 */
@Slf4j
public class JTokkitTokenCounter implements TokenCounter {
    public static final Map<String, EncodingType> DEFAULT_MODEL_ENCODINGS = Map.of(
            "gpt-4o", EncodingType.O200K_BASE,
            "gpt-4o-mini", EncodingType.O200K_BASE);

    private final EncodingRegistry encodingRegistry;
    private final Map<String, EncodingType> modelEncodings;
    private final TokenCounter fallback;

    public JTokkitTokenCounter() {
        this(null, null, null);
    }

    @Builder
    public JTokkitTokenCounter(EncodingRegistry encodingRegistry,
                               Map<String, EncodingType> modelEncodings,
                               TokenCounter fallback) {
        this.encodingRegistry = Objects.requireNonNullElseGet(encodingRegistry, Encodings::newDefaultEncodingRegistry);
        this.modelEncodings = Objects.requireNonNullElse(modelEncodings, DEFAULT_MODEL_ENCODINGS);
        this.fallback = Objects.requireNonNullElseGet(fallback, ApproximateTokenCounter::new);
    }

    @Override
    public TokenCount count(String text, String model) {
        if (Strings.isNullOrEmpty(text) || text.isBlank()) {
            return TokenCount.exact(0);
        }
        try {
            final var encoding = encoding(model);
            if (encoding.isPresent()) {
                return TokenCount.exact(encoding.get().countTokens(text));
            }
            log.debug("No tokenizer known for model {}. Using approximate count", model);
        }
        catch (RuntimeException e) {
            log.warn(ErrorType.TOKEN_COUNT_UNAVAILABLE.format(model, e.getMessage()));
        }
        return fallback.count(text, model);
    }

    private Optional<Encoding> encoding(String model) {
        if (Strings.isNullOrEmpty(model)) {
            return Optional.empty();
        }
        final var mapped = modelEncodings.get(model);
        if (mapped != null) {
            return Optional.of(encodingRegistry.getEncoding(mapped));
        }
        return encodingRegistry.getEncodingForModel(model);
    }
}
