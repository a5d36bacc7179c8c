package dev.jobboard.web;

import dev.jobboard.exception.UnauthorizedException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.MethodParameter;
import org.springframework.http.HttpHeaders;
import org.springframework.security.oauth2.jwt.JwtException;
import org.springframework.security.oauth2.jwt.ReactiveJwtDecoder;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.BindingContext;
import org.springframework.web.reactive.result.method.HandlerMethodArgumentResolver;
import org.springframework.web.server.ServerWebExchange;
import reactor.core.publisher.Mono;

/**
 * Resolves {@link ActingUser} parameters from {@code Authorization: Bearer <token>}.
 * A missing header resolves to null; a malformed, forged or expired token is a 401.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ActingUserArgumentResolver implements HandlerMethodArgumentResolver {

    static final String BEARER_PREFIX = "Bearer ";

    private final ReactiveJwtDecoder jwtDecoder;

    @Override
    public boolean supportsParameter(MethodParameter parameter) {
        return parameter.hasParameterAnnotation(ActingUser.class);
    }

    @Override
    public Mono<Object> resolveArgument(MethodParameter parameter, BindingContext bindingContext,
            ServerWebExchange exchange) {
        String header = exchange.getRequest().getHeaders().getFirst(HttpHeaders.AUTHORIZATION);
        if (header == null || header.isBlank()) {
            return Mono.empty();
        }
        if (!header.regionMatches(true, 0, BEARER_PREFIX, 0, BEARER_PREFIX.length())) {
            return Mono.error(new UnauthorizedException("Authorization header must use the Bearer scheme"));
        }

        String token = header.substring(BEARER_PREFIX.length()).trim();
        return Mono.defer(() -> jwtDecoder.decode(token))
                .map(jwt -> (Object) Long.valueOf(jwt.getSubject()))
                .onErrorMap(e -> e instanceof JwtException || e instanceof NumberFormatException, e -> {
                    log.debug("Rejected token on {}: {}", exchange.getRequest().getPath(), e.getMessage());
                    return new UnauthorizedException("Invalid or expired token");
                });
    }
}
