package com.compliantvault.vaultservice.client.oracle;

import com.compliantvault.vaultservice.client.oracle.dto.VerificationRequest;
import com.compliantvault.vaultservice.client.oracle.service.HttpVerificationOracleClient;
import com.compliantvault.vaultservice.core.exception.VerificationDispatchException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class HttpVerificationOracleClientTest {

    private MockRestServiceServer mockServer;

    private HttpVerificationOracleClient client;

    private final VerificationRequest request = new VerificationRequest(
            "return 1", "", List.of("1", "alice", "500"), 7L, "don-1", 250_000);

    @BeforeEach
    void setUp() {
        RestClient.Builder builder = RestClient.builder();
        // Bind before the client builds its RestClient
        mockServer = MockRestServiceServer.bindTo(builder).build();
        client = new HttpVerificationOracleClient(builder, "http://oracle.test");
    }

    @Test
    @DisplayName("Dispatch posts the request and returns the oracle's id")
    void testDispatch() {
        mockServer.expect(requestTo("http://oracle.test/requests"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(jsonPath("$.args[0]").value("1"))
                .andExpect(jsonPath("$.args[2]").value("500"))
                .andExpect(jsonPath("$.gasLimit").value(250_000))
                .andRespond(withSuccess("{\"requestId\":\"0xabc\"}", MediaType.APPLICATION_JSON));

        assertThat(client.dispatch(request)).isEqualTo("0xabc");
        mockServer.verify();
    }

    @Test
    @DisplayName("Oracle failure -> VerificationDispatchException")
    void testDispatchServerError() {
        mockServer.expect(requestTo("http://oracle.test/requests"))
                .andRespond(withServerError());

        assertThatThrownBy(() -> client.dispatch(request))
                .isInstanceOf(VerificationDispatchException.class);
    }

    @Test
    @DisplayName("Answer without a request id is a failed dispatch")
    void testDispatchWithoutId() {
        mockServer.expect(requestTo("http://oracle.test/requests"))
                .andRespond(withSuccess("{\"requestId\":\"\"}", MediaType.APPLICATION_JSON));

        assertThatThrownBy(() -> client.dispatch(request))
                .isInstanceOf(VerificationDispatchException.class)
                .hasMessageContaining("no request id");
    }
}
