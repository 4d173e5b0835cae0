package com.gt.vsrs.sync;

import com.gt.vsrs.exception.AuthRequiredException;
import com.gt.vsrs.exception.TransientException;
import com.gt.vsrs.exception.ValidationException;
import com.gt.vsrs.model.ContentCorrection;
import com.gt.vsrs.security.AuthSession;
import com.gt.vsrs.sync.model.CardRow;
import com.gt.vsrs.sync.model.DataApiSnapshot;
import com.gt.vsrs.sync.model.ReviewRow;
import com.gt.vsrs.sync.model.WordRow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Client for the PostgREST style data API that holds the canonical copy of words, cards and reviews.
 * Every call carries the caller's access token. Auth failures surface as {@link AuthRequiredException}, network
 * failures and server errors as {@link TransientException}.
 */
@Component
public class DataApiClient {

    private static final Logger log = LoggerFactory.getLogger(DataApiClient.class);

    private static final ParameterizedTypeReference<List<WordRow>> WORD_ROWS = new ParameterizedTypeReference<>() {};
    private static final ParameterizedTypeReference<List<CardRow>> CARD_ROWS = new ParameterizedTypeReference<>() {};
    private static final ParameterizedTypeReference<List<ReviewRow>> REVIEW_ROWS = new ParameterizedTypeReference<>() {};

    static final String API_KEY_HEADER = "apikey";
    static final String PREFER_HEADER = "Prefer";
    static final String RETURN_REPRESENTATION = "return=representation";

    private final RestClient restClient;
    private final String apiKey;

    @Autowired
    public DataApiClient(@Qualifier("dataApiRestClient") RestClient restClient,
                         @Value("${vsrs.dataApi.apiKey:}") String apiKey) {
        this.restClient = restClient;
        this.apiKey = apiKey;
    }

    public DataApiSnapshot fetchSnapshot(AuthSession session) {
        List<WordRow> words = fetchRows("/words", WORD_ROWS, session);
        List<CardRow> cards = fetchRows("/cards", CARD_ROWS, session);
        List<ReviewRow> reviews = fetchRows("/reviews", REVIEW_ROWS, session);

        log.info("Fetched snapshot with {} words, {} cards, {} reviews", words.size(), cards.size(), reviews.size());
        return new DataApiSnapshot(words, cards, reviews);
    }

    // Returns the number of remote rows updated
    public int updateWordContent(AuthSession session, String itemId, ContentCorrection correction) {
        Map<String, Object> body = new HashMap<>();
        if (correction.text().isSet()) {
            body.put("text", correction.text().getValue());
        }
        if (correction.translation().isSet()) {
            body.put("translation", correction.translation().getValue());
        }

        List<WordRow> updated = call("update word " + itemId, () -> restClient.patch()
                .uri(uriBuilder -> uriBuilder.path("/words").queryParam("id", "eq." + itemId).build())
                .headers(headers -> addAuthHeaders(headers, session))
                .header(PREFER_HEADER, RETURN_REPRESENTATION)
                .contentType(MediaType.APPLICATION_JSON)
                .body(body)
                .retrieve()
                .body(WORD_ROWS));

        return updated == null ? 0 : updated.size();
    }

    private <T> List<T> fetchRows(String path, ParameterizedTypeReference<List<T>> type, AuthSession session) {
        List<T> rows = call("fetch " + path, () -> restClient.get()
                .uri(path)
                .headers(headers -> addAuthHeaders(headers, session))
                .accept(MediaType.APPLICATION_JSON)
                .retrieve()
                .body(type));

        return rows == null ? List.of() : rows;
    }

    private void addAuthHeaders(HttpHeaders headers, AuthSession session) {
        headers.setBearerAuth(session.accessToken());
        if (apiKey != null && !apiKey.isBlank()) {
            headers.set(API_KEY_HEADER, apiKey);
        }
    }

    private <T> T call(String operation, Supplier<T> request) {
        try {
            return request.get();
        } catch (RestClientResponseException ex) {
            HttpStatusCode status = ex.getStatusCode();
            if (status.value() == 401 || status.value() == 403) {
                throw new AuthRequiredException("Data API rejected the session during " + operation, ex);
            } else if (status.is5xxServerError()) {
                throw new TransientException("Data API failed during " + operation + " with status " + status.value(), ex);
            }

            log.warn("Data API returned {} during {}: {}", status.value(), operation, ex.getResponseBodyAsString());
            throw new ValidationException("Data API rejected " + operation + " with status " + status.value(), ex);
        } catch (ResourceAccessException ex) {
            throw new TransientException("Data API unreachable during " + operation, ex);
        } catch (RestClientException ex) {
            throw new ValidationException("Data API returned an unreadable response during " + operation, ex);
        }
    }
}
