package net.evloop.core.handlers;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.net.UrlEscapers;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import net.evloop.core.Handler;
import net.evloop.core.data.RemoteRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fetches the record named by the payload from a JSON API and returns a description of it. The
 * escaped payload is appended to the base URI as-is, so the base normally ends with a slash.
 * Network and decoding failures are returned as an error description.
 */
public class RemoteRecordHandler implements Handler {
  private static final Logger log = LoggerFactory.getLogger(RemoteRecordHandler.class);

  static final String FETCH_ERROR = "Error fetching data from API";
  static final String DECODE_ERROR = "Error decoding data from API";

  private final HttpClient client;
  private final URI baseUri;
  private final ObjectMapper mapper = new ObjectMapper()
      .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

  public RemoteRecordHandler(URI baseUri, Duration connectTimeout) {
    this(HttpClient.newBuilder()
        .connectTimeout(connectTimeout)
        .followRedirects(HttpClient.Redirect.NORMAL)
        .build(), baseUri);
  }

  private RemoteRecordHandler(HttpClient client, URI baseUri) {
    this.client = client;
    this.baseUri = baseUri;
  }

  @Override
  public String handle(String payload) {
    var uri = URI.create(baseUri + UrlEscapers.urlPathSegmentEscaper().escape(payload));
    var request = HttpRequest.newBuilder(uri)
        .header("Accept", "application/json")
        .GET()
        .build();

    HttpResponse<byte[]> response;
    try {
      response = client.send(request, HttpResponse.BodyHandlers.ofByteArray());
    } catch (IOException e) {
      log.warn("Failed to fetch record; uri={}", uri, e);
      return FETCH_ERROR;
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      log.warn("Interrupted while fetching record; uri={}", uri);
      return FETCH_ERROR;
    }

    if (response.statusCode() / 100 != 2) {
      log.warn("Unexpected response status; uri={}, status={}", uri, response.statusCode());
      return FETCH_ERROR;
    }

    RemoteRecord post;
    try {
      post = mapper.readValue(response.body(), RemoteRecord.class);
    } catch (IOException e) {
      log.warn("Failed to decode record; uri={}", uri, e);
      return DECODE_ERROR;
    }

    if (post == null) {
      log.warn("Response body was null; uri={}", uri);
      return DECODE_ERROR;
    }

    return "Fetched post from API: " + post;
  }
}
