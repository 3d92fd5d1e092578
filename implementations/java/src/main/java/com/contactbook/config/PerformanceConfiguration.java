package com.contactbook.config;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.springframework.context.annotation.Configuration;
import org.springframework.stereotype.Component;

/**
 * Performance Monitoring Configuration.
 *
 * Tracks:
 * - Directory (storage) operation latency, by method and outcome
 * - Token verification latency, by outcome
 *
 * Security: No personal data or token material in metric tags.
 */
@Configuration
@Slf4j
public class PerformanceConfiguration {

    /**
     * Aspect for timing directory operations.
     */
    @Aspect
    @Component
    @Slf4j
    public static class DirectoryPerformanceAspect {

        private final MeterRegistry meterRegistry;

        public DirectoryPerformanceAspect(MeterRegistry meterRegistry) {
            this.meterRegistry = meterRegistry;
        }

        @Around("execution(* com.contactbook.infrastructure.persistence.*Directory.*(..))")
        public Object timeDirectoryMethod(ProceedingJoinPoint joinPoint) throws Throwable {
            return timed(meterRegistry, "directory.operation", "Directory operation timing", joinPoint);
        }
    }

    /**
     * Aspect for timing token verification.
     */
    @Aspect
    @Component
    @Slf4j
    public static class TokenPerformanceAspect {

        private final MeterRegistry meterRegistry;

        public TokenPerformanceAspect(MeterRegistry meterRegistry) {
            this.meterRegistry = meterRegistry;
        }

        @Around("execution(* com.contactbook.infrastructure.security.TokenService.read*(..))")
        public Object timeTokenRead(ProceedingJoinPoint joinPoint) throws Throwable {
            return timed(meterRegistry, "token.verification", "Token verification timing", joinPoint);
        }
    }

    private static Object timed(MeterRegistry meterRegistry, String name, String description,
                                ProceedingJoinPoint joinPoint) throws Throwable {
        String methodName = joinPoint.getSignature().toShortString();

        Timer.Sample sample = Timer.start(meterRegistry);

        try {
            Object result = joinPoint.proceed();

            sample.stop(Timer.builder(name)
                .tag("method", methodName)
                .tag("outcome", "success")
                .description(description)
                .register(meterRegistry));

            return result;

        } catch (Exception e) {
            sample.stop(Timer.builder(name)
                .tag("method", methodName)
                .tag("outcome", "failure")
                .description(description)
                .register(meterRegistry));

            throw e;
        }
    }
}
