package com.example.licitacoes.server.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

import java.net.http.HttpClient;

/**
 * RestClient used to reach the PNCP consultation API.
 * <p>
 * PNCP serves HTTP/1.1 only, and answers slowly for wide date windows, so the read timeout is
 * kept separate from the connect timeout.
 */
@Configuration
public class PncpClientConfig {

    @Bean
    public RestClient pncpRestClient(LicitacoesProperties properties) {
        LicitacoesProperties.Pncp pncp = properties.getPncp();

        HttpClient httpClient = HttpClient.newBuilder()
                .connectTimeout(pncp.getConnectTimeout())
                .version(HttpClient.Version.HTTP_1_1)
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();

        JdkClientHttpRequestFactory requestFactory = new JdkClientHttpRequestFactory(httpClient);
        requestFactory.setReadTimeout(pncp.getReadTimeout());

        return RestClient.builder()
                .baseUrl(pncp.getBaseUrl())
                .requestFactory(requestFactory)
                .defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE)
                .defaultHeader(HttpHeaders.USER_AGENT, pncp.getUserAgent())
                .build();
    }
}
