package com.resourcelocator.config;

import com.resourcelocator.application.Resolution;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.springframework.context.annotation.Configuration;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * Timing of the resolution path.
 *
 * <p>Tags carry outcomes and method names only; no caller ids, logical names or
 * credential material end up in metrics.
 */
@Configuration
@Slf4j
public class PerformanceConfiguration {

    /**
     * Aspect for timing Storage Adapter operations.
     */
    @Aspect
    @Component
    @Slf4j
    public static class StoragePerformanceAspect {

        private final MeterRegistry meterRegistry;

        public StoragePerformanceAspect(MeterRegistry meterRegistry) {
            this.meterRegistry = meterRegistry;
        }

        @Around("execution(* com.resourcelocator.domain.repository.StorageAdapter.*(..))")
        public Object timeStorageOperation(ProceedingJoinPoint joinPoint) throws Throwable {
            String methodName = joinPoint.getSignature().getName();

            Timer.Sample sample = Timer.start(meterRegistry);

            try {
                Object result = joinPoint.proceed();

                sample.stop(Timer.builder("storage.operation")
                    .tag("method", methodName)
                    .tag("outcome", "success")
                    .description("Storage adapter operation timing")
                    .register(meterRegistry));

                return result;

            } catch (Exception e) {
                sample.stop(Timer.builder("storage.operation")
                    .tag("method", methodName)
                    .tag("outcome", "failure")
                    .description("Storage adapter operation timing")
                    .register(meterRegistry));

                throw e;
            }
        }
    }

    /**
     * Aspect for timing resolutions, tagged by outcome.
     */
    @Aspect
    @Component
    @Slf4j
    public static class ResolutionPerformanceAspect {

        private final MeterRegistry meterRegistry;

        public ResolutionPerformanceAspect(MeterRegistry meterRegistry) {
            this.meterRegistry = meterRegistry;
        }

        @Around("execution(* com.resourcelocator.application.SecureResourceLocator.resolve(..))")
        public Object timeResolution(ProceedingJoinPoint joinPoint) throws Throwable {
            Timer.Sample sample = Timer.start(meterRegistry);
            String outcome = "error";

            try {
                Object result = joinPoint.proceed();
                if (result instanceof Resolution) {
                    Resolution resolution = (Resolution) result;
                    outcome = resolution.getFailure()
                        .map(failure -> failure.name().toLowerCase(Locale.ROOT))
                        .orElse("granted");
                }
                return result;
            } finally {
                sample.stop(Timer.builder("locator.resolve")
                    .tag("outcome", outcome)
                    .description("Resolution timing")
                    .register(meterRegistry));
            }
        }
    }

    /**
     * Aspect for timing MAC operations.
     */
    @Aspect
    @Component
    @Slf4j
    public static class CryptoPerformanceAspect {

        private final MeterRegistry meterRegistry;

        public CryptoPerformanceAspect(MeterRegistry meterRegistry) {
            this.meterRegistry = meterRegistry;
        }

        @Around("execution(* com.resourcelocator.infrastructure.crypto.CryptoService.*(..))")
        public Object timeCryptoOperation(ProceedingJoinPoint joinPoint) throws Throwable {
            String methodName = joinPoint.getSignature().getName();

            Timer.Sample sample = Timer.start(meterRegistry);

            try {
                Object result = joinPoint.proceed();

                sample.stop(Timer.builder("crypto.operation")
                    .tag("method", methodName)
                    .tag("outcome", "success")
                    .description("Cryptographic operation timing")
                    .register(meterRegistry));

                return result;

            } catch (Exception e) {
                sample.stop(Timer.builder("crypto.operation")
                    .tag("method", methodName)
                    .tag("outcome", "failure")
                    .description("Cryptographic operation timing")
                    .register(meterRegistry));

                throw e;
            }
        }
    }
}
