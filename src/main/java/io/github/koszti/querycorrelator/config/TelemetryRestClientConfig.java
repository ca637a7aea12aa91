package io.github.koszti.querycorrelator.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

import java.net.http.HttpClient;

@Configuration
public class TelemetryRestClientConfig
{
    /**
     * RestClient dedicated to the telemetry API.
     * Base URL, bearer token and per-call timeouts come from CorrelatorTelemetryProperties.
     */
    @Bean
    public RestClient telemetryRestClient(RestClient.Builder builder,
            CorrelatorTelemetryProperties telemetryProps) {
        HttpClient httpClient = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .followRedirects(HttpClient.Redirect.NORMAL)
                .connectTimeout(telemetryProps.getConnectTimeout())
                .build();

        JdkClientHttpRequestFactory requestFactory = new JdkClientHttpRequestFactory(httpClient);
        requestFactory.setReadTimeout(telemetryProps.getRequestTimeout());

        builder = builder
                .baseUrl(telemetryProps.getBaseUrl())
                .requestFactory(requestFactory)
                .defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE);

        String token = telemetryProps.getToken();
        if (token != null && !token.isBlank()) {
            builder = builder.defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + token);
        }
        return builder.build();
    }
}
