package org.silc.server.http.dto;

import java.util.List;

/**
 * Response DTO of {@code GET /translate/backends}.
 *
 * @param sections The section names a translation answers with, intermediate text first.
 * @param backends The configured backend names, in output order.
 */
public record BackendsResponseDto(List<String> sections, List<String> backends) {
}
