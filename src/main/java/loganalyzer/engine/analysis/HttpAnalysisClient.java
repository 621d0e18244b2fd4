package loganalyzer.engine.analysis;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import loganalyzer.engine.model.Finding;
import loganalyzer.engine.model.LogLine;
import loganalyzer.engine.model.Severity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Classifier reached over HTTP.
 *
 * Request body: {@code {"organizationId", "jobId", "lines": [{"lineNumber", "content"}]}}.
 * Response body: {@code {"individualResults": [{"lineNumber", "hasSecurityIssue",
 * "severity", "issueType", "description"}]}}. Only entries flagged with
 * {@code hasSecurityIssue} become findings.
 */
public final class HttpAnalysisClient implements AnalysisClient {

    private static final Logger log = LoggerFactory.getLogger(HttpAnalysisClient.class);

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private final HttpClient httpClient;
    private final URI endpoint;
    private final String apiKey;
    private final Duration requestTimeout;

    public HttpAnalysisClient(String endpoint, String apiKey, Duration requestTimeout) {
        this(HttpClient.newBuilder()
                        .version(HttpClient.Version.HTTP_1_1)
                        .connectTimeout(Duration.ofSeconds(10))
                        .build(),
                endpoint, apiKey, requestTimeout);
    }

    public HttpAnalysisClient(HttpClient httpClient, String endpoint, String apiKey, Duration requestTimeout) {
        this.httpClient = httpClient;
        this.endpoint = URI.create(endpoint);
        this.apiKey = apiKey;
        this.requestTimeout = requestTimeout;
    }

    @Override
    public List<Finding> classify(AnalysisRequest request) throws AnalysisException, InterruptedException {
        String body;
        try {
            body = MAPPER.writeValueAsString(new RequestBody(request));
        } catch (JsonProcessingException e) {
            throw new AnalysisException("Failed to encode analysis request", false, e);
        }

        HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(endpoint)
                .timeout(requestTimeout)
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(body));
        if (apiKey != null && !apiKey.isBlank()) {
            builder.header("Authorization", "Bearer " + apiKey);
        }

        HttpResponse<String> response;
        try {
            response = httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new AnalysisException("Analysis service unreachable: " + e.getMessage(), true, e);
        }

        int status = response.statusCode();
        if (status >= 500 || status == 429) {
            throw new AnalysisException("Analysis service returned HTTP " + status, true);
        }
        if (status >= 400) {
            throw new AnalysisException("Analysis service rejected request: HTTP " + status, false);
        }

        return parse(response.body(), request);
    }

    static List<Finding> parse(String body, AnalysisRequest request) throws AnalysisException {
        ResponseBody parsed;
        try {
            parsed = MAPPER.readValue(body, ResponseBody.class);
        } catch (JsonProcessingException e) {
            throw new AnalysisException("Malformed analysis response", true, e);
        }
        if (parsed == null || parsed.individualResults == null) {
            throw new AnalysisException("Analysis response has no individualResults", true);
        }

        List<Finding> findings = new ArrayList<>();
        for (LineResult result : parsed.individualResults) {
            if (result == null || !result.hasSecurityIssue || result.lineNumber == null) {
                continue;
            }
            findings.add(new Finding(result.lineNumber, Severity.parse(result.severity),
                    result.issueType, result.description));
        }
        log.debug("Job {} batch {}: {} of {} lines flagged",
                request.jobId(), request.batchNumber(), findings.size(), request.lines().size());
        return findings;
    }

    // JSON shapes

    private static final class RequestBody {
        @JsonProperty("organizationId")
        final String organizationId;
        @JsonProperty("jobId")
        final String jobId;
        @JsonProperty("lines")
        final List<LogLine> lines;

        RequestBody(AnalysisRequest request) {
            this.organizationId = request.organizationId();
            this.jobId = request.jobId();
            this.lines = request.lines();
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    private static final class ResponseBody {
        @JsonProperty("individualResults")
        List<LineResult> individualResults;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    private static final class LineResult {
        @JsonProperty("lineNumber")
        Long lineNumber;
        @JsonProperty("hasSecurityIssue")
        boolean hasSecurityIssue;
        @JsonProperty("severity")
        String severity;
        @JsonProperty("issueType")
        String issueType;
        @JsonProperty("description")
        String description;
    }
}
