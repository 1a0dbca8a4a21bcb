package com.starscape.mediavault.features.metadata.infra;

import com.fasterxml.jackson.databind.JsonNode;
import com.starscape.mediavault.common.config.GeocodingProperties;
import com.starscape.mediavault.features.metadata.app.ReverseGeocoder;
import com.starscape.mediavault.features.metadata.domain.Place;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.util.Optional;

/**
 * Reverse geocoding against a Nominatim server. Lookups are rate limited by
 * pausing after each request, as the public Nominatim usage policy requires.
 */
@Component
public class NominatimReverseGeocoder implements ReverseGeocoder {
    
    private static final Logger log = LoggerFactory.getLogger(NominatimReverseGeocoder.class);
    
    private final GeocodingProperties properties;
    private final RestClient restClient;
    
    public NominatimReverseGeocoder(GeocodingProperties properties, RestClient.Builder restClientBuilder) {
        this.properties = properties;
        
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout((int) properties.getTimeout().toMillis());
        requestFactory.setReadTimeout((int) properties.getTimeout().toMillis());
        
        this.restClient = restClientBuilder
                .baseUrl(properties.getBaseUrl())
                .defaultHeader(HttpHeaders.USER_AGENT, properties.getUserAgent())
                .requestFactory(requestFactory)
                .build();
    }
    
    @Override
    public boolean isEnabled() {
        return properties.isEnabled();
    }
    
    @Override
    public Optional<Place> lookup(double latitude, double longitude) {
        if (!properties.isEnabled()) {
            return Optional.empty();
        }
        try {
            JsonNode response = restClient.get()
                    .uri(uriBuilder -> uriBuilder
                            .queryParam("format", "json")
                            .queryParam("lat", latitude)
                            .queryParam("lon", longitude)
                            .queryParam("zoom", 10)
                            .queryParam("addressdetails", 1)
                            .build())
                    .retrieve()
                    .body(JsonNode.class);
            return Optional.ofNullable(response).map(NominatimReverseGeocoder::toPlace);
        } catch (RestClientException e) {
            log.debug("Reverse geocoding failed for {},{}: {}", latitude, longitude, e.getMessage());
            return Optional.empty();
        } finally {
            pause();
        }
    }
    
    static Place toPlace(JsonNode response) {
        JsonNode address = response.path("address");
        return new Place(
            firstText(address, "city", "town", "village", "hamlet"),
            firstText(address, "state", "region", "province"),
            firstText(address, "country")
        );
    }
    
    private static String firstText(JsonNode node, String... fields) {
        for (String field : fields) {
            String value = node.path(field).asText(null);
            if (value != null && !value.isBlank()) {
                return value;
            }
        }
        return null;
    }
    
    private void pause() {
        long millis = properties.getRateLimit().toMillis();
        if (millis <= 0) {
            return;
        }
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
