package io.nextrun.tool;

import io.nextrun.core.AgentResult;
import io.nextrun.core.ToolRegistry;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Clock;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Map;

/**
 * Registers the general-purpose tools every agent run can use: the current time,
 * a bounded sleep, and a plain HTTP GET.
 */
@Component
public class BuiltInTools {

    private static final Logger log = LoggerFactory.getLogger(BuiltInTools.class);
    static final String DEFAULT_TIMEZONE = "Asia/Tokyo";
    static final String USER_AGENT = "NextRun-Agent/1.0";

    private final ToolRegistry toolRegistry;
    private final Clock clock;

    @Value("${agent.tools.max-sleep-seconds:300}")
    private int maxSleepSeconds = 300;

    @Value("${agent.tools.http-default-timeout-seconds:10}")
    private int defaultTimeoutSeconds = 10;

    @Value("${agent.tools.http-default-max-bytes:50000}")
    private int defaultMaxBytes = 50_000;

    public BuiltInTools(ToolRegistry toolRegistry, Clock clock) {
        this.toolRegistry = toolRegistry;
        this.clock = clock;
    }

    @PostConstruct
    public void registerTools() {
        toolRegistry.registerAgentTool("current_time",
                "Return the current time in ISO-8601 for the given timezone.",
                """
                {"type":"object","properties":{"tz":{"type":"string","description":"IANA timezone (default: Asia/Tokyo)"}},"required":[]}""",
                this::currentTime);
        toolRegistry.registerAgentTool("sleep_seconds",
                "Sleep for N seconds, then report how long it slept.",
                """
                {"type":"object","properties":{"seconds":{"type":"integer","description":"Seconds to sleep (default: 3)"}},"required":[]}""",
                this::sleepSeconds);
        toolRegistry.registerAgentTool("http_get",
                "Fetch text from a URL. Use for retrieving web pages or JSON APIs.",
                """
                {"type":"object","properties":{"url":{"type":"string","description":"Target URL (http/https)"},"timeout_sec":{"type":"integer","description":"Request timeout in seconds (default: 10)"},"max_bytes":{"type":"integer","description":"Maximum characters to return (default: 50000)"}},"required":["url"]}""",
                this::httpGet);
        log.info("Registered 3 built-in tools");
    }

    AgentResult currentTime(Map<String, Object> args) {
        String tz = stringArg(args, "tz", DEFAULT_TIMEZONE);
        try {
            ZonedDateTime now = ZonedDateTime.now(clock.withZone(ZoneId.of(tz)));
            return AgentResult.of(now.format(DateTimeFormatter.ISO_OFFSET_DATE_TIME));
        } catch (DateTimeException e) {
            return AgentResult.of("Error: Unknown timezone: " + tz);
        }
    }

    AgentResult sleepSeconds(Map<String, Object> args) {
        int seconds = Math.min(Math.max(0, intArg(args, "seconds", 3)), maxSleepSeconds);
        try {
            Thread.sleep(Duration.ofSeconds(seconds).toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return AgentResult.of("Error: Sleep interrupted.");
        }
        return AgentResult.of("Slept %d seconds".formatted(seconds));
    }

    AgentResult httpGet(Map<String, Object> args) {
        String url = stringArg(args, "url", "");
        if (url.isBlank()) {
            return AgentResult.of("Error: 'url' is required.");
        }
        if (!url.startsWith("http://") && !url.startsWith("https://")) {
            return AgentResult.of("Error: URL must start with http:// or https://");
        }
        int timeoutSeconds = Math.max(1, intArg(args, "timeout_sec", defaultTimeoutSeconds));
        int maxBytes = Math.max(1, intArg(args, "max_bytes", defaultMaxBytes));

        try {
            HttpClient client = HttpClient.newBuilder()
                    .followRedirects(HttpClient.Redirect.NORMAL)
                    .connectTimeout(Duration.ofSeconds(timeoutSeconds))
                    .build();

            HttpRequest request = HttpRequest.newBuilder()
                    .uri(URI.create(url))
                    .header("User-Agent", USER_AGENT)
                    .timeout(Duration.ofSeconds(timeoutSeconds))
                    .GET()
                    .build();

            HttpResponse<String> response = client.send(request, HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() >= 400) {
                return AgentResult.of("Error: HTTP %d from %s".formatted(response.statusCode(), url));
            }
            return AgentResult.of(truncate(response.body(), maxBytes));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return AgentResult.of("Error fetching URL: interrupted");
        } catch (Exception e) {
            log.warn("http_get failed for {}: {}", url, e.getMessage());
            return AgentResult.of("Error fetching URL: " + e.getMessage());
        }
    }

    static String truncate(String content, int maxLength) {
        if (content == null) {
            return "";
        }
        if (content.length() <= maxLength) {
            return content;
        }
        return content.substring(0, maxLength) + "\n...[truncated]...";
    }

    private static String stringArg(Map<String, Object> args, String key, String defaultValue) {
        Object val = args.get(key);
        return val != null && !val.toString().isBlank() ? val.toString() : defaultValue;
    }

    private static int intArg(Map<String, Object> args, String key, int defaultValue) {
        Object val = args.get(key);
        if (val instanceof Number number) {
            return number.intValue();
        }
        if (val != null) {
            try {
                return Integer.parseInt(val.toString().trim());
            } catch (NumberFormatException e) {
                return defaultValue;
            }
        }
        return defaultValue;
    }
}
