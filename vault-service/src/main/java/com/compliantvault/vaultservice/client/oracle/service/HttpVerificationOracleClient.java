package com.compliantvault.vaultservice.client.oracle.service;

import com.compliantvault.vaultservice.client.oracle.dto.DispatchResponse;
import com.compliantvault.vaultservice.client.oracle.dto.VerificationRequest;
import com.compliantvault.vaultservice.core.exception.VerificationDispatchException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

@Component
@Slf4j
public class HttpVerificationOracleClient implements VerificationOracle {

    private final RestClient restClient;

    public HttpVerificationOracleClient(
            RestClient.Builder builder,
            @Value("${app.oracle.url}") String oracleUrl
    ) {
        this.restClient = builder.baseUrl(oracleUrl).build();
    }

    @Override
    public String dispatch(VerificationRequest request) {
        DispatchResponse response;
        try {
            response = restClient.post()
                    .uri("/requests")
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(request)
                    .retrieve()
                    .body(DispatchResponse.class);
        } catch (RestClientException e) {
            log.error("Oracle rejected or did not answer dispatch of kind {}: {}", request.args().get(0), e.getMessage());
            throw new VerificationDispatchException("Verification oracle unavailable", e);
        }

        if (response == null || response.requestId() == null || response.requestId().isBlank()) {
            throw new VerificationDispatchException("Verification oracle returned no request id");
        }

        return response.requestId();
    }
}
