package com.gt.vsrs.importer;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.gt.vsrs.exception.TransientException;
import com.gt.vsrs.exception.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

import java.util.List;

// Client for a DeepL style batch translation API
@Component
public class TranslationClient {

    private static final Logger log = LoggerFactory.getLogger(TranslationClient.class);

    static final String DEEPL_AUTH_PREFIX = "DeepL-Auth-Key ";

    private final RestClient restClient;
    private final String authKey;
    private final String authHeader;

    @Autowired
    public TranslationClient(@Qualifier("translationRestClient") RestClient restClient,
                             @Value("${vsrs.translation.authKey:}") String authKey,
                             @Value("${vsrs.translation.authHeader:Authorization}") String authHeader) {
        this.restClient = restClient;
        this.authKey = authKey;
        this.authHeader = authHeader;
    }

    public List<String> translateBatch(List<String> texts, String sourceLang, String targetLang) {
        if (texts.isEmpty()) {
            return List.of();
        }

        TranslateResponse response;
        try {
            response = restClient.post()
                    .headers(this::addAuthHeader)
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(new TranslateRequest(texts, sourceLang, targetLang))
                    .retrieve()
                    .body(TranslateResponse.class);
        } catch (RestClientResponseException ex) {
            if (ex.getStatusCode().is5xxServerError()) {
                throw new TransientException("Translation API failed with status " + ex.getStatusCode().value(), ex);
            }
            throw new ValidationException("Translation API rejected the request with status " + ex.getStatusCode().value(), ex);
        } catch (ResourceAccessException ex) {
            throw new TransientException("Translation API unreachable", ex);
        } catch (RestClientException ex) {
            throw new ValidationException("Translation API returned an unreadable response", ex);
        }

        if (response == null || response.translations() == null || response.translations().size() != texts.size()) {
            throw new ValidationException("Translation API response count mismatch");
        }

        log.debug("Translated {} texts {} -> {}", texts.size(), sourceLang, targetLang);
        return response.translations().stream().map(TranslationItem::text).toList();
    }

    private void addAuthHeader(HttpHeaders headers) {
        if (authKey == null || authKey.isBlank()) {
            return;
        }

        if (authHeader.equalsIgnoreCase(HttpHeaders.AUTHORIZATION)) {
            headers.set(HttpHeaders.AUTHORIZATION, DEEPL_AUTH_PREFIX + authKey);
        } else {
            headers.set(authHeader, authKey);
        }
    }

    private record TranslateRequest(List<String> text,
                                    @JsonProperty("source_lang") String sourceLang,
                                    @JsonProperty("target_lang") String targetLang) { }

    @JsonIgnoreProperties(ignoreUnknown = true)
    private record TranslateResponse(List<TranslationItem> translations) { }

    @JsonIgnoreProperties(ignoreUnknown = true)
    private record TranslationItem(String text) { }
}
