package com.gt.vsrs.conf;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

import java.net.http.HttpClient;
import java.time.Duration;

@Configuration
public class RestClientConfig {

    @Bean
    public RestClient dataApiRestClient(RestClient.Builder restClientBuilder,
                                        @Value("${vsrs.dataApi.url}") String baseUrl,
                                        @Value("${vsrs.dataApi.connectTimeoutMs:5000}") long connectTimeoutMs,
                                        @Value("${vsrs.dataApi.readTimeoutMs:15000}") long readTimeoutMs) {
        return restClientBuilder.clone()
                .baseUrl(baseUrl)
                .requestFactory(requestFactory(connectTimeoutMs, readTimeoutMs))
                .build();
    }

    @Bean
    public RestClient translationRestClient(RestClient.Builder restClientBuilder,
                                            @Value("${vsrs.translation.url}") String baseUrl,
                                            @Value("${vsrs.translation.connectTimeoutMs:5000}") long connectTimeoutMs,
                                            @Value("${vsrs.translation.readTimeoutMs:30000}") long readTimeoutMs) {
        return restClientBuilder.clone()
                .baseUrl(baseUrl)
                .requestFactory(requestFactory(connectTimeoutMs, readTimeoutMs))
                .build();
    }

    // The JDK client supports PATCH, which the data API uses for updates
    private static JdkClientHttpRequestFactory requestFactory(long connectTimeoutMs, long readTimeoutMs) {
        HttpClient httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofMillis(connectTimeoutMs))
                .build();

        JdkClientHttpRequestFactory requestFactory = new JdkClientHttpRequestFactory(httpClient);
        requestFactory.setReadTimeout(Duration.ofMillis(readTimeoutMs));

        return requestFactory;
    }
}
