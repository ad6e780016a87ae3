package com.platform.clonegovernance.observability;

import ch.qos.logback.classic.LoggerContext;
import jakarta.annotation.PostConstruct;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.UUID;

/**
 * Request and job correlation for log lines.
 *
 * Every HTTP request gets a trace id (taken from {@code X-Correlation-ID} when the caller
 * sends one) and, for administrative calls, the {@code X-Actor} header as MDC actor.
 * Scheduled jobs tag their runs through {@link #setJobContext(String)}.
 */
@Slf4j
@Configuration
public class LoggingConfig {

    public static final String TRACE_ID_KEY = "traceId";
    public static final String ACTOR_KEY = "actor";
    public static final String JOB_KEY = "job";

    @Value("${spring.application.name:clone-governance}")
    private String applicationName;

    @PostConstruct
    public void init() {
        LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
        context.putProperty("application", applicationName);
        log.debug("Log correlation enabled for {}", applicationName);
    }

    @Bean
    public CorrelationIdFilter correlationIdFilter() {
        return new CorrelationIdFilter();
    }

    public static class CorrelationIdFilter extends OncePerRequestFilter {

        static final String CORRELATION_ID_HEADER = "X-Correlation-ID";
        static final String ACTOR_HEADER = "X-Actor";

        @Override
        protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response,
                FilterChain filterChain) throws ServletException, IOException {
            String traceId = request.getHeader(CORRELATION_ID_HEADER);
            if (traceId == null || traceId.isBlank() || traceId.length() > 64) {
                traceId = UUID.randomUUID().toString();
            }
            MDC.put(TRACE_ID_KEY, traceId);
            String actor = request.getHeader(ACTOR_HEADER);
            if (actor != null && !actor.isBlank()) {
                MDC.put(ACTOR_KEY, actor.length() > 100 ? actor.substring(0, 100) : actor);
            }
            response.setHeader(CORRELATION_ID_HEADER, traceId);
            try {
                filterChain.doFilter(request, response);
            } finally {
                MDC.remove(TRACE_ID_KEY);
                MDC.remove(ACTOR_KEY);
            }
        }
    }

    /**
     * Tag log lines of a scheduled job run. Pair with {@link #clearJobContext()}.
     */
    public static void setJobContext(String job) {
        MDC.put(JOB_KEY, job);
        MDC.put(TRACE_ID_KEY, job + "-" + UUID.randomUUID().toString().substring(0, 8));
    }

    public static void clearJobContext() {
        MDC.remove(JOB_KEY);
        MDC.remove(TRACE_ID_KEY);
    }
}
