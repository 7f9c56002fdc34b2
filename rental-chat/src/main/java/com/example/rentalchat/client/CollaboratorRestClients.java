package com.example.rentalchat.client;

import java.time.Duration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.util.StringUtils;
import org.springframework.web.client.RestClient;

final class CollaboratorRestClients {

    private CollaboratorRestClients() {}

    /**
     * Client for a collaborator base URL, or {@code null} when the URL is not configured.
     */
    static RestClient create(String baseUrl, Duration timeout) {
        if (!StringUtils.hasText(baseUrl)) {
            return null;
        }
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        int millis = (int) (timeout != null ? timeout : Duration.ofSeconds(2)).toMillis();
        requestFactory.setConnectTimeout(millis);
        requestFactory.setReadTimeout(millis);
        return RestClient.builder()
                .baseUrl(baseUrl)
                .requestFactory(requestFactory)
                .build();
    }
}
