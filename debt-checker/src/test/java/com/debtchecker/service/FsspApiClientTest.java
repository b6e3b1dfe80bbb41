package com.debtchecker.service;

import com.debtchecker.config.DebtCheckerProperties;
import com.debtchecker.model.ApiReply;
import com.debtchecker.model.ErrorKind;
import com.debtchecker.model.LookupOutcome;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import java.io.IOException;
import java.math.BigDecimal;
import java.net.SocketTimeoutException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.hamcrest.Matchers.startsWith;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.queryParam;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withException;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class FsspApiClientTest {

    private static final String BASE_URL = "http://fssp.test/api/fssp.php";

    private MockRestServiceServer server;
    private DebtCheckerProperties properties;
    private FsspApiClient client;

    @BeforeEach
    void setUp() {
        RestTemplate restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();
        properties = new DebtCheckerProperties();
        properties.getApi().setBaseUrl(BASE_URL);
        properties.getApi().setToken("secret");
        client = new FsspApiClient(restTemplate, new FsspReplyMapper(), new ObjectMapper(), properties);
    }

    private void respond(String body) {
        server.expect(requestTo(startsWith(BASE_URL)))
                .andRespond(withSuccess(body, MediaType.APPLICATION_JSON));
    }

    @Test
    void sendsIdentifierAndTokenOnEveryRequest() {
        server.expect(method(HttpMethod.GET))
                .andExpect(queryParam("type", "ip"))
                .andExpect(queryParam("number", "12345/21/77001-IP"))
                .andExpect(queryParam("token", "secret"))
                .andRespond(withSuccess("{\"status\":200,\"count\":0,\"records\":[]}", MediaType.APPLICATION_JSON));

        assertThat(client.query("12345/21/77001-IP")).isEqualTo(ApiReply.notFound());
        server.verify();
    }

    @Test
    void singleRecordYieldsItsAmount() {
        respond("{\"status\":200,\"count\":1,\"records\":[{\"sum\":\"1520.75\",\"subject\":\"tax\"}]}");

        assertThat(client.query("1")).isEqualTo(ApiReply.found(new BigDecimal("1520.75")));
    }

    @Test
    void numericSumIsAccepted() {
        respond("{\"status\":200,\"count\":1,\"records\":[{\"sum\":300}]}");

        assertThat(client.query("1").amount()).isEqualByComparingTo("300");
    }

    @Test
    void tokenWithoutAccessIsAuthRejection() {
        respond("{\"error\":\"602\",\"message\":\"No access\"}");

        ApiReply reply = client.query("1");

        assertThat(reply.error()).isEqualTo(ErrorKind.AUTH_REJECTED);
        assertThat(reply.detail()).isEqualTo("No access");
    }

    @Test
    void emptyBalanceIsFatal() {
        respond("{\"error\":498,\"message\":\"No money\"}");

        assertThat(client.query("1").error()).isEqualTo(ErrorKind.BALANCE_EXHAUSTED);
    }

    @Test
    void httpStatusesAreClassified() {
        server.expect(requestTo(startsWith(BASE_URL))).andRespond(withStatus(HttpStatus.TOO_MANY_REQUESTS));
        server.expect(requestTo(startsWith(BASE_URL))).andRespond(withServerError());
        server.expect(requestTo(startsWith(BASE_URL))).andRespond(withStatus(HttpStatus.NOT_FOUND));
        server.expect(requestTo(startsWith(BASE_URL))).andRespond(withStatus(HttpStatus.BAD_REQUEST));
        server.expect(requestTo(startsWith(BASE_URL))).andRespond(withStatus(HttpStatus.UNAUTHORIZED));

        assertThat(client.query("1").error()).isEqualTo(ErrorKind.RATE_LIMITED);
        assertThat(client.query("2").error()).isEqualTo(ErrorKind.SERVER_ERROR);
        assertThat(client.query("3").error()).isEqualTo(ErrorKind.INVALID_RESPONSE);
        assertThat(client.query("4").error()).isEqualTo(ErrorKind.MALFORMED_IDENTIFIER);
        assertThat(client.query("5").error()).isEqualTo(ErrorKind.AUTH_REJECTED);
        server.verify();
    }

    @Test
    void notFoundStatusIsAFailureNotNoDebt() {
        server.expect(requestTo(startsWith(BASE_URL))).andRespond(withStatus(HttpStatus.NOT_FOUND));

        LookupOutcome outcome = TestSupport.client(client, 1, 3).lookup("77/21/01-IP");

        assertThat(outcome).isInstanceOf(LookupOutcome.Failed.class);
        LookupOutcome.Failed failed = (LookupOutcome.Failed) outcome;
        assertThat(failed.reason()).isEqualTo(ErrorKind.INVALID_RESPONSE);
        assertThat(failed.attempts()).isEqualTo(1);
        server.verify();
    }

    @Test
    void readTimeoutIsTransient() {
        server.expect(requestTo(startsWith(BASE_URL)))
                .andRespond(withException(new SocketTimeoutException("Read timed out")));

        ApiReply reply = client.query("1");

        assertThat(reply.error()).isEqualTo(ErrorKind.TIMEOUT);
        assertThat(reply.error().isRetryable()).isTrue();
    }

    @Test
    void connectionFailureIsNetworkError() {
        server.expect(requestTo(startsWith(BASE_URL)))
                .andRespond(withException(new IOException("Connection reset")));

        assertThat(client.query("1").error()).isEqualTo(ErrorKind.NETWORK);
    }

    @Test
    void garbageBodyIsInvalidResponse() {
        respond("<html>maintenance</html>");

        assertThat(client.query("1").error()).isEqualTo(ErrorKind.INVALID_RESPONSE);
    }

    @Test
    void blankIdentifierIsNotSent() {
        assertThat(client.query(" ").error()).isEqualTo(ErrorKind.MALFORMED_IDENTIFIER);
        server.verify();
    }

    @Test
    void missingTokenFailsFast() {
        properties.getApi().setToken(" ");

        assertThatThrownBy(client::verifyCredentials)
                .isInstanceOf(FatalRunException.class)
                .hasMessageContaining("API token is not configured");
    }
}
