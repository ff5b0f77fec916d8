package org.silc.server.http.dto;

/**
 * Request body of {@code POST /translate}.
 *
 * @param code The source text to translate.
 */
public record TranslateRequestDto(String code) {
}
