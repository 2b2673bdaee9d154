package work.lcod.pumslabel.runtime;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.pumslabel.api.DictionaryTarget;

/**
 * Downloads dictionaries over HTTP(S) from a URL template.
 *
 * <p>The template may use {@code {file}}, {@code {year}} and {@code {period}}
 * ({@code 2016} or {@code 2012-2016}).
 */
public final class HttpDictionaryFetcher implements DictionaryFetcher {
    private static final Logger logger = LoggerFactory.getLogger(HttpDictionaryFetcher.class);

    public static final String DEFAULT_URL_TEMPLATE =
        "https://www2.census.gov/programs-surveys/acs/tech_docs/pums/data_dict/{file}";

    private final HttpClient client;
    private final String urlTemplate;
    private final Optional<Duration> timeout;

    public HttpDictionaryFetcher(String urlTemplate, Optional<Duration> timeout) {
        this(
            HttpClient.newBuilder().followRedirects(HttpClient.Redirect.NORMAL).build(),
            urlTemplate,
            timeout
        );
    }

    public HttpDictionaryFetcher(HttpClient client, String urlTemplate, Optional<Duration> timeout) {
        this.client = Objects.requireNonNull(client, "client");
        this.urlTemplate = Objects.requireNonNull(urlTemplate, "urlTemplate");
        this.timeout = Objects.requireNonNull(timeout, "timeout");
        if (urlTemplate.isBlank()) {
            throw new IllegalArgumentException("dictionary URL template must not be blank");
        }
    }

    public URI uriFor(DictionaryTarget target) {
        String url = urlTemplate
            .replace("{file}", target.dictionaryFileName())
            .replace("{year}", Integer.toString(target.year()))
            .replace("{period}", target.periodLabel());
        return URI.create(url);
    }

    @Override
    public String fetch(DictionaryTarget target) throws IOException {
        URI uri = uriFor(target);
        var builder = HttpRequest.newBuilder(uri).GET();
        timeout.filter(value -> !value.isZero()).ifPresent(builder::timeout);
        logger.info("Downloading {} dictionary from {}", target.display(), uri);
        try {
            HttpResponse<String> response = client.send(builder.build(), HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
            int status = response.statusCode();
            if (status < 200 || status >= 300) {
                throw new IOException("Failed to download " + uri + ": HTTP " + status);
            }
            return response.body();
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            var interrupted = new InterruptedIOException("Interrupted while downloading " + uri);
            interrupted.initCause(ex);
            throw interrupted;
        }
    }
}
