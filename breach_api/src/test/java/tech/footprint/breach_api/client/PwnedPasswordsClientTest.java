package tech.footprint.breach_api.client;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.RestTemplate;
import tech.footprint.breach_api.model.PasswordRangeEntry;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.*;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class PwnedPasswordsClientTest {

    private MockRestServiceServer server;
    private PwnedPasswordsClient client;

    @BeforeEach
    void setUp() {
        RestTemplate restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();
        client = new PwnedPasswordsClient(restTemplate, "https://range.test/");
    }

    @Test
    @DisplayName("Requests the upper-case prefix with padding and drops padding entries")
    void fetchesRange() {
        server.expect(requestTo("https://range.test/range/5BAA6"))
                .andExpect(method(HttpMethod.GET))
                .andExpect(header("Add-Padding", "true"))
                .andRespond(withSuccess("""
                        003D68EB55068C33ACE09247EE4C639306B:3\r
                        1E4C9B93F3F0682250B6CF8331B7EE68FD8:9545824\r
                        FFFFFFFFFFFFFFFFFFFFFFFFFFFFFFFFFFF:0
                        """, MediaType.TEXT_PLAIN));

        assertThat(client.fetchRange("5baa6")).containsExactly(
                new PasswordRangeEntry("003D68EB55068C33ACE09247EE4C639306B", 3),
                new PasswordRangeEntry("1E4C9B93F3F0682250B6CF8331B7EE68FD8", 9_545_824));
        server.verify();
    }

    @Test
    @DisplayName("Upstream errors surface as RestClientException")
    void upstreamError() {
        server.expect(requestTo("https://range.test/range/00000"))
                .andRespond(withStatus(HttpStatus.SERVICE_UNAVAILABLE));

        assertThatThrownBy(() -> client.fetchRange("00000")).isInstanceOf(HttpServerErrorException.class);
    }

    @Test
    void parseSkipsMalformedLines() {
        assertThat(PwnedPasswordsClient.parse("ABC:x\nnocolon\n:5\ndef:2")).containsExactly(new PasswordRangeEntry("DEF", 2));
        assertThat(PwnedPasswordsClient.parse(null)).isEmpty();
    }
}
