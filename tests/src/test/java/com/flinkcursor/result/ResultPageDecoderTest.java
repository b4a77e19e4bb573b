package com.flinkcursor.result;

import com.flinkcursor.exception.GatewayRequestException;
import com.flinkcursor.test.TestCategories;
import org.junit.jupiter.api.*;

import java.math.BigInteger;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for decoding gateway result responses into pages.
 */
@TestCategories.Tier1
@TestCategories.Unit
@DisplayName("ResultPageDecoder Tests")
public class ResultPageDecoderTest {

    private static final String PAYLOAD = "{"
        + "\"resultType\": \"PAYLOAD\","
        + "\"nextResultUri\": \"/v1/sessions/s1/operations/o1/result/1\","
        + "\"results\": {"
        + "  \"columns\": [{\"name\": \"id\", \"logicalType\": {\"type\": \"INTEGER\"}},"
        + "                {\"name\": \"name\", \"logicalType\": {\"type\": \"VARCHAR\"}},"
        + "                {\"name\": \"active\", \"logicalType\": {\"type\": \"BOOLEAN\"}}],"
        + "  \"data\": [{\"kind\": \"INSERT\", \"fields\": [1, \"alice\", true]},"
        + "           {\"kind\": \"INSERT\", \"fields\": [2, null, false]}]"
        + "}}";

    @Test
    @DisplayName("Decodes columns, rows and continuation of a payload page")
    void testPayloadPage() {
        ResultPage page = ResultPageDecoder.decode(PAYLOAD);

        assertThat(page.getColumnNames()).containsExactly("id", "name", "active");
        assertThat(page.getRows()).containsExactly(Row.of(1, "alice", true), Row.of(2, null, false));
        assertThat(page.getNextResultUri()).contains("/v1/sessions/s1/operations/o1/result/1");
        assertThat(page.isEndOfStream()).isFalse();
    }

    @Test
    @DisplayName("End-of-stream page has no continuation")
    void testEndOfStreamPage() {
        ResultPage page = ResultPageDecoder.decode("{"
            + "\"resultType\": \"EOS\","
            + "\"nextResultUri\": \"/ignored\","
            + "\"results\": {\"columns\": [{\"name\": \"c\"}], \"data\": []}}");

        assertThat(page.isEndOfStream()).isTrue();
        assertThat(page.getNextResultUri()).isEmpty();
        assertThat(page.getRows()).isEmpty();
        assertThat(page.getColumnNames()).containsExactly("c");
    }

    @Test
    @DisplayName("Not-ready page is neither end of stream nor populated")
    void testNotReadyPage() {
        ResultPage page = ResultPageDecoder.decode("{"
            + "\"resultType\": \"NOT_READY\","
            + "\"nextResultUri\": \"/v1/next\","
            + "\"results\": {\"columns\": [], \"data\": []}}");

        assertThat(page.isEndOfStream()).isFalse();
        assertThat(page.getNextResultUri()).contains("/v1/next");
    }

    @Test
    @DisplayName("Missing fields decode as null and extra fields are dropped")
    void testShapeMismatchNotValidated() {
        ResultPage page = ResultPageDecoder.decode("{"
            + "\"resultType\": \"EOS\","
            + "\"results\": {\"columns\": [{\"name\": \"a\"}, {\"name\": \"b\"}],"
            + "  \"data\": [{\"fields\": [1]}, {\"fields\": [1, 2, 3]}]}}");

        assertThat(page.getRows()).containsExactly(Row.of(1, null), Row.of(1, 2));
    }

    @Test
    @DisplayName("Nested values decode to lists and maps")
    void testNestedValues() {
        ResultPage page = ResultPageDecoder.decode("{"
            + "\"resultType\": \"EOS\","
            + "\"results\": {\"columns\": [{\"name\": \"tags\"}, {\"name\": \"attrs\"}, {\"name\": \"score\"}],"
            + "  \"data\": [{\"fields\": [[\"x\", \"y\"], {\"k\": \"v\"}, 1.5]}]}}");

        Row row = page.getRows().get(0);
        assertThat(row.get(0)).isEqualTo(List.of("x", "y"));
        assertThat(row.get(1)).isEqualTo(Map.of("k", "v"));
        assertThat(row.get(2)).isEqualTo(1.5);
    }

    @Test
    @DisplayName("Numbers decode to Integer, Long, BigInteger and Double")
    void testNumericValues() {
        ResultPage page = ResultPageDecoder.decode("{"
            + "\"resultType\": \"EOS\","
            + "\"results\": {\"columns\": [{\"name\": \"i\"}, {\"name\": \"l\"}, {\"name\": \"b\"}, {\"name\": \"d\"}],"
            + "  \"data\": [{\"fields\": [7, 9876543210, 123456789012345678901234567890, 0.25]}]}}");

        Row row = page.getRows().get(0);
        assertThat(row.get(0)).isInstanceOf(Integer.class).isEqualTo(7);
        assertThat(row.get(1)).isInstanceOf(Long.class).isEqualTo(9876543210L);
        assertThat(row.get(2)).isEqualTo(new BigInteger("123456789012345678901234567890"));
        assertThat(row.get(3)).isInstanceOf(Double.class).isEqualTo(0.25);
    }

    @Test
    @DisplayName("Rejects a response without results")
    void testMissingResults() {
        assertThatThrownBy(() -> ResultPageDecoder.decode("{\"resultType\": \"EOS\"}"))
            .isInstanceOf(GatewayRequestException.class)
            .hasMessageContaining("results");
    }

    @Test
    @DisplayName("Rejects a body that is not JSON")
    void testMalformedBody() {
        assertThatThrownBy(() -> ResultPageDecoder.decode("<html>bad gateway</html>"))
            .isInstanceOf(GatewayRequestException.class)
            .hasMessageContaining("Malformed result response");
    }
}
