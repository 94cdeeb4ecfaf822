package de.entwicklertraining.capi.interceptor;

import de.entwicklertraining.capi.ApiRequest;
import de.entwicklertraining.capi.ApiResponse;
import de.entwicklertraining.capi.cancellation.CancellationToken;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Logs every request at DEBUG, and every response at DEBUG or, when it carries an error, at ERROR.
 */
public class LoggingInterceptor implements RequestInterceptor, ResponseInterceptor {

    private final Logger logger;

    public LoggingInterceptor() {
        this(LoggerFactory.getLogger(LoggingInterceptor.class.getName()));
    }

    public LoggingInterceptor(Logger logger) {
        this.logger = logger;
    }

    @Override
    public void onRequest(ApiRequest request, CancellationToken cancellationToken) {
        logger.debug("API Request: method={} path={}", request.getMethod(), request.getPath());
    }

    @Override
    public void onResponse(ApiRequest request, ApiResponse response, CancellationToken cancellationToken) {
        if (response.getError().isPresent()) {
            logger.error("API Response Error: method={} path={} error={}",
                    request.getMethod(), request.getPath(), response.getError().get().getMessage());
        } else {
            logger.debug("API Response: method={} path={} status_code={} from_cache={}",
                    request.getMethod(), request.getPath(), response.getStatusCode(), response.isFromCache());
        }
    }
}
