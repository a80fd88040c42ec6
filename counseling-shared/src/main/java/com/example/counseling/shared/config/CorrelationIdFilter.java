package com.example.counseling.shared.config;

import com.example.counseling.shared.util.Constants;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebFilter;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;

import java.util.UUID;

/**
 * Tags every HTTP request, including WebSocket handshakes, with a correlation id.
 * A caller-supplied X-Correlation-ID is kept; otherwise one is generated. The id is echoed on the
 * response and stored as an exchange attribute so socket handlers can log it after the upgrade.
 */
@Component
public class CorrelationIdFilter implements WebFilter {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";
    public static final String CORRELATION_ID_ATTRIBUTE = CorrelationIdFilter.class.getName() + ".correlationId";

    @Override
    public Mono<Void> filter(ServerWebExchange exchange, WebFilterChain chain) {
        String supplied = exchange.getRequest().getHeaders().getFirst(CORRELATION_ID_HEADER);
        String correlationId = StringUtils.hasText(supplied) ? supplied : UUID.randomUUID().toString();

        exchange.getAttributes().put(CORRELATION_ID_ATTRIBUTE, correlationId);
        exchange.getResponse().getHeaders().set(CORRELATION_ID_HEADER, correlationId);
        MDC.put(Constants.CORRELATION_ID_KEY, correlationId);
        return chain.filter(exchange)
                .contextWrite(context -> context.put(Constants.CORRELATION_ID_KEY, correlationId))
                .doFinally(signalType -> MDC.remove(Constants.CORRELATION_ID_KEY));
    }
}
