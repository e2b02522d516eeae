package dev.jbang.sitecache.client;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import org.apache.hc.client5.http.classic.methods.HttpUriRequestBase;
import org.apache.hc.client5.http.config.ConnectionConfig;
import org.apache.hc.client5.http.config.RequestConfig;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.client5.http.impl.classic.HttpClients;
import org.apache.hc.client5.http.impl.io.PoolingHttpClientConnectionManagerBuilder;
import org.apache.hc.core5.http.ClassicHttpResponse;
import org.apache.hc.core5.http.ContentType;
import org.apache.hc.core5.http.Header;
import org.apache.hc.core5.http.HttpEntity;
import org.apache.hc.core5.http.ParseException;
import org.apache.hc.core5.http.io.entity.EntityUtils;
import org.apache.hc.core5.http.io.entity.StringEntity;
import org.apache.hc.core5.util.Timeout;

/** {@link HttpTransport} backed by Apache HttpClient 5 with redirects and cookie handling disabled */
public class ApacheHttpTransport implements HttpTransport {
	private final CloseableHttpClient httpClient;
	private final Set<HttpUriRequestBase> inFlight = ConcurrentHashMap.newKeySet();

	public ApacheHttpTransport(Duration timeout) {
		Timeout t = Timeout.ofMilliseconds(timeout.toMillis());
		ConnectionConfig connectionConfig = ConnectionConfig.custom()
				.setConnectTimeout(t)
				.setSocketTimeout(t)
				.build();
		RequestConfig requestConfig = RequestConfig.custom()
				.setResponseTimeout(t)
				.setConnectionRequestTimeout(t)
				.setRedirectsEnabled(false)
				.build();
		this.httpClient = HttpClients.custom()
				.setConnectionManager(PoolingHttpClientConnectionManagerBuilder.create()
						.setDefaultConnectionConfig(connectionConfig)
						.build())
				.setDefaultRequestConfig(requestConfig)
				.disableRedirectHandling()
				.disableCookieManagement()
				.disableAutomaticRetries()
				.build();
	}

	@Override
	public TransportResponse execute(TransportRequest request) throws IOException {
		HttpUriRequestBase httpRequest = new HttpUriRequestBase(request.method(), request.uri());
		request.headers().forEach(httpRequest::setHeader);
		if (request.hasBody()) {
			httpRequest.setEntity(new StringEntity(request.body(), ContentType.APPLICATION_FORM_URLENCODED));
		}
		inFlight.add(httpRequest);
		try {
			return httpClient.execute(httpRequest, ApacheHttpTransport::toResponse);
		} finally {
			inFlight.remove(httpRequest);
		}
	}

	private static TransportResponse toResponse(ClassicHttpResponse response) throws IOException, ParseException {
		Map<String, List<String>> headers = new LinkedHashMap<>();
		for (Header header : response.getHeaders()) {
			headers.computeIfAbsent(header.getName().toLowerCase(Locale.ROOT), k -> new ArrayList<>())
					.add(header.getValue());
		}
		HttpEntity entity = response.getEntity();
		String body = entity != null ? EntityUtils.toString(entity, StandardCharsets.UTF_8) : "";
		return new TransportResponse(response.getCode(), headers, body);
	}

	/** Cancels every request in flight, which closes its connection and unblocks the reading thread */
	@Override
	public void abort() {
		for (HttpUriRequestBase request : inFlight) {
			request.cancel();
		}
	}

	@Override
	public void close() throws IOException {
		httpClient.close();
	}
}
