package com.incarts.analytics.infrastructure.emulated;

import com.incarts.analytics.domain.exception.BackendQueryException;
import com.incarts.analytics.domain.executor.ExecutorKind;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.SocketTimeoutException;
import java.net.URI;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.StringJoiner;

/**
 * {@link TableBackend} over a PostgREST data API ({@code {url}/rest/v1/{table}}).
 *
 * Filters map to PostgREST operators ({@code eq.}, {@code in.()}, {@code gte.},
 * {@code lte.}, {@code not.is.null}). Counts are read from the {@code Content-Range}
 * header of a zero-row request. Row fetches are split into requests of at most
 * {@code pageSize} rows, since the server caps rows per response.
 */
@Slf4j
public class PostgrestTableBackend implements TableBackend {

    private static final ParameterizedTypeReference<List<Map<String, Object>>> ROWS =
            new ParameterizedTypeReference<>() {
            };

    private final RestTemplate restTemplate;
    private final String baseUrl;
    private final String apiKey;
    private final int pageSize;

    public PostgrestTableBackend(RestTemplate restTemplate, String baseUrl, String apiKey, int pageSize) {
        this.restTemplate = restTemplate;
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.apiKey = apiKey;
        this.pageSize = pageSize;
    }

    @Override
    public BackendCapabilities capabilities() {
        return new BackendCapabilities(true, true);
    }

    @Override
    public TableResult select(TableQuery query) {
        if (query.isCountOnly()) {
            return TableResult.count(count(query));
        }

        List<Map<String, Object>> rows = new ArrayList<>();
        int offset = query.getOffset() != null ? query.getOffset() : 0;
        Integer remaining = query.getLimit();
        while (remaining == null || remaining > 0) {
            int batch = remaining == null ? pageSize : Math.min(pageSize, remaining);
            List<Map<String, Object>> page = fetchPage(query, offset, batch);
            rows.addAll(page);
            if (page.size() < batch) {
                break;
            }
            offset += page.size();
            if (remaining != null) {
                remaining -= page.size();
            }
        }
        return TableResult.rows(rows);
    }

    private long count(TableQuery query) {
        URI uri = uri(query, 0, 0);
        HttpHeaders headers = headers();
        headers.set("Prefer", "count=exact");

        ResponseEntity<List<Map<String, Object>>> response = exchange(query.getTable(), uri, headers);
        String contentRange = response.getHeaders().getFirst(HttpHeaders.CONTENT_RANGE);
        long total = parseTotal(contentRange);
        log.debug("Counted {} rows in {}", total, query.getTable());
        return total;
    }

    private List<Map<String, Object>> fetchPage(TableQuery query, int offset, int limit) {
        URI uri = uri(query, offset, limit);
        ResponseEntity<List<Map<String, Object>>> response = exchange(query.getTable(), uri, headers());
        List<Map<String, Object>> body = response.getBody();
        log.debug("Fetched {} rows from {} at offset {}", body == null ? 0 : body.size(), query.getTable(), offset);
        return body == null ? Collections.emptyList() : body;
    }

    private ResponseEntity<List<Map<String, Object>>> exchange(String table, URI uri, HttpHeaders headers) {
        try {
            return restTemplate.exchange(uri, HttpMethod.GET, new HttpEntity<>(headers), ROWS);
        } catch (HttpStatusCodeException e) {
            throw new BackendQueryException(ExecutorKind.EMULATED,
                    "Request on " + table + " failed with status " + e.getStatusCode().value(), e);
        } catch (ResourceAccessException e) {
            boolean timeout = e.getCause() instanceof SocketTimeoutException;
            throw new BackendQueryException(ExecutorKind.EMULATED,
                    "Request on " + table + (timeout ? " timed out" : " could not reach the data API"), e, timeout);
        } catch (RestClientException e) {
            throw new BackendQueryException(ExecutorKind.EMULATED,
                    "Unreadable response for " + table + ": " + e.getMessage(), e);
        }
    }

    /**
     * Filter operands travel as URI variables so that reserved characters in values
     * ({@code +}, {@code &}, {@code ,}) are percent-encoded rather than read as syntax.
     */
    URI uri(TableQuery query, int offset, int limit) {
        UriComponentsBuilder builder = UriComponentsBuilder.fromHttpUrl(baseUrl)
                .path("/rest/v1/")
                .path(query.getTable())
                .queryParam("select", query.getColumns().isEmpty() ? "*" : String.join(",", query.getColumns()));

        Map<String, Object> operands = new HashMap<>();
        for (TableFilter filter : query.getFilters()) {
            String name = "f" + operands.size();
            operands.put(name, operand(filter));
            builder.queryParam(filter.getColumn(), "{" + name + "}");
        }
        if (!query.getOrdering().isEmpty()) {
            StringJoiner order = new StringJoiner(",");
            for (TableOrder tableOrder : query.getOrdering()) {
                order.add(tableOrder.getColumn() + (tableOrder.isDescending() ? ".desc.nullsfirst" : ".asc.nullslast"));
            }
            builder.queryParam("order", order.toString());
        }
        builder.queryParam("limit", limit);
        if (offset > 0) {
            builder.queryParam("offset", offset);
        }
        return builder.encode().buildAndExpand(operands).toUri();
    }

    private String operand(TableFilter filter) {
        switch (filter.getOperator()) {
            case EQ:
                return "eq." + filter.getValue();
            case GTE:
                return "gte." + filter.getValue();
            case LTE:
                return "lte." + filter.getValue();
            case NOT_NULL:
                return "not.is.null";
            case IN:
                StringJoiner values = new StringJoiner(",", "(", ")");
                for (Object value : filter.values()) {
                    values.add(value instanceof String ? quote((String) value) : String.valueOf(value));
                }
                return "in." + values;
            default:
                throw new IllegalArgumentException("Unhandled operator " + filter.getOperator());
        }
    }

    private String quote(String value) {
        return "\"" + value.replace("\\", "\\\\").replace("\"", "\\\"") + "\"";
    }

    private HttpHeaders headers() {
        HttpHeaders headers = new HttpHeaders();
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));
        headers.set("apikey", apiKey);
        headers.setBearerAuth(apiKey);
        return headers;
    }

    /**
     * {@code Content-Range: 0-24/3573} or {@code *}{@code /3573}; an unknown total ({@code /*}) fails.
     */
    static long parseTotal(String contentRange) {
        if (contentRange == null || contentRange.indexOf('/') < 0) {
            throw new BackendQueryException(ExecutorKind.EMULATED, "Count response has no Content-Range total", null);
        }
        String total = contentRange.substring(contentRange.indexOf('/') + 1).trim();
        if ("*".equals(total)) {
            throw new BackendQueryException(ExecutorKind.EMULATED, "Data API did not report an exact count", null);
        }
        try {
            return Long.parseLong(total);
        } catch (NumberFormatException e) {
            throw new BackendQueryException(ExecutorKind.EMULATED, "Malformed Content-Range '" + contentRange + "'", e);
        }
    }
}
