package dev.lyceum.api;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

/**
 * JSON body of an ask request.
 *
 * @param question the question to answer
 */
public record AskRequest(@NotBlank @Size(max = 2000) String question) {}
