package com.example.counseling.shared.aspect;

import com.example.counseling.shared.config.MonitoringConfig;
import com.example.counseling.shared.exception.CounselingClientException;
import com.example.counseling.shared.util.Constants;
import io.opentelemetry.api.trace.Span;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.aspectj.lang.reflect.MethodSignature;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;

import java.lang.reflect.Method;

@Aspect
@Component
@RequiredArgsConstructor
@Slf4j
public class MonitoringAspect {

    private final MonitoringConfig.CounselingMetricsCollector metricsCollector;

    @Around("@within(com.example.counseling.shared.aspect.Monitored) || @annotation(com.example.counseling.shared.aspect.Monitored)")
    public Object monitorMethod(ProceedingJoinPoint joinPoint) throws Throwable {
        MethodSignature signature = (MethodSignature) joinPoint.getSignature();
        Method method = signature.getMethod();

        // A method-level annotation overrides the class-level one.
        Monitored monitoredAnnotation = method.getAnnotation(Monitored.class);
        if (monitoredAnnotation == null) {
            monitoredAnnotation = method.getDeclaringClass().getAnnotation(Monitored.class);
        }
        if (monitoredAnnotation == null) {
            return joinPoint.proceed();
        }

        String operationType = monitoredAnnotation.value();
        String className = joinPoint.getTarget().getClass().getSimpleName();
        String methodName = signature.getName();
        long startTime = System.currentTimeMillis();

        Span currentSpan = Span.current();
        String correlationId = MDC.get(Constants.CORRELATION_ID_KEY);
        if (currentSpan.getSpanContext().isValid() && correlationId != null) {
            currentSpan.setAttribute("app.correlation_id", correlationId);
        }

        try {
            Object result = joinPoint.proceed();
            long duration = System.currentTimeMillis() - startTime;

            metricsCollector.recordTimer("counseling." + operationType + ".latency", duration, "class", className, "method", methodName, "status", "success");
            metricsCollector.incrementCounter("counseling." + operationType + ".calls", "class", className, "method", methodName, "status", "success");

            log.debug("{}.{} ({}) completed successfully in {}ms", className, methodName, operationType, duration);
            return result;
        } catch (Exception e) {
            long duration = System.currentTimeMillis() - startTime;

            metricsCollector.recordTimer("counseling." + operationType + ".latency", duration, "class", className, "method", methodName, "status", "error");
            metricsCollector.incrementCounter("counseling." + operationType + ".calls", "class", className, "method", methodName, "status", "error");
            metricsCollector.incrementCounter("counseling.errors", "type", operationType, "class", className, "method", methodName);

            if (currentSpan.getSpanContext().isValid()) {
                currentSpan.recordException(e);
            }

            // Client-side failures (not found, denied, bad frame) are expected traffic, not errors.
            if (e instanceof CounselingClientException) {
                log.debug("{}.{} ({}) rejected after {}ms: {}", className, methodName, operationType, duration, e.getMessage());
            } else {
                log.error("{}.{} ({}) failed after {}ms: {}", className, methodName, operationType, duration, e.getMessage());
            }
            throw e;
        }
    }
}
