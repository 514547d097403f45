package com.proposalagents.orchestration.api;

import com.proposalagents.exception.GenerationException;
import org.springframework.lang.Nullable;

import java.time.Duration;

/**
 * Service interface for the external text-generation capability that specialists and the
 * synthesis step call. Implementations are shared by every concurrent task and must be
 * safe to call from several threads at once; each call opens its own provider request.
 */
public interface GenerationCapability {

    /**
     * Generates text for a single instruction.
     *
     * @param instruction The complete instruction sent to the model.
     * @param timeout The longest the caller is prepared to wait; implementations may use it
     *                to bound their own transport.
     * @return The generated text, or {@code null} when the provider answered without text.
     * @throws GenerationException When the provider timed out or returned an unusable payload.
     *                             Any other runtime exception is treated as an upstream failure.
     */
    @Nullable
    String generate(String instruction, Duration timeout);

    /**
     * @return A short label for logs, such as the provider and model in use.
     */
    String describe();

    /**
     * @return {@code true} when the configured provider has a usable client.
     */
    boolean isAvailable();
}
