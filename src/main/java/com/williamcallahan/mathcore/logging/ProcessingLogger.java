package com.williamcallahan.mathcore.logging;

import com.williamcallahan.mathcore.service.document.DocumentReplacement;
import org.aspectj.lang.JoinPoint;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.AfterReturning;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Logs each conversion step with timing to the {@code PIPELINE} logger.
 */
@Aspect
@Component
public class ProcessingLogger {
    private static final Logger PIPELINE_LOG = LoggerFactory.getLogger("PIPELINE");

    // Thread-local storage for request tracking
    private static final ThreadLocal<String> REQUEST_ID = ThreadLocal.withInitial(() ->
        "REQ-" + System.currentTimeMillis() + "-" + Thread.currentThread().getId()
    );

    /**
     * Log single formula conversion
     */
    @Around("execution(* com.williamcallahan.mathcore.service.MathConversionService.render(..))")
    public Object logFormulaConversion(ProceedingJoinPoint joinPoint) throws Throwable {
        String requestId = REQUEST_ID.get();
        long startTime = System.currentTimeMillis();

        PIPELINE_LOG.info("[{}] STEP 1: FORMULA CONVERSION - Starting", requestId);
        Object[] args = joinPoint.getArgs();
        if (args.length > 1 && args[0] != null) {
            PIPELINE_LOG.debug("[{}] Source length: {}, display: {}", requestId,
                args[0].toString().length(), args[1]);
        }

        try {
            Object result = joinPoint.proceed();
            long duration = System.currentTimeMillis() - startTime;

            PIPELINE_LOG.info("[{}] STEP 1: FORMULA CONVERSION - Completed in {}ms",
                requestId, duration);

            return result;
        } catch (Exception e) {
            PIPELINE_LOG.error("[{}] STEP 1: FORMULA CONVERSION - Failed: {}",
                requestId, e.getMessage());
            throw e;
        } finally {
            REQUEST_ID.remove();
        }
    }

    /**
     * Log document replacement
     */
    @Around("execution(* com.williamcallahan.mathcore.service.MathConversionService.renderDocument(..))")
    public Object logDocumentReplacement(ProceedingJoinPoint joinPoint) throws Throwable {
        String requestId = REQUEST_ID.get();
        long startTime = System.currentTimeMillis();

        PIPELINE_LOG.info("[{}] STEP 2: DOCUMENT REPLACEMENT - Starting", requestId);

        try {
            Object result = joinPoint.proceed();
            long duration = System.currentTimeMillis() - startTime;

            if (result instanceof DocumentReplacement replacement) {
                PIPELINE_LOG.info("[{}] STEP 2: DOCUMENT REPLACEMENT - Converted {} formulas ({} skipped) in {}ms",
                    requestId, replacement.formulas(), replacement.skipped().size(), duration);
            }

            return result;
        } catch (Exception e) {
            PIPELINE_LOG.error("[{}] STEP 2: DOCUMENT REPLACEMENT - Failed: {}",
                requestId, e.getMessage());
            throw e;
        } finally {
            REQUEST_ID.remove();
        }
    }

    /**
     * Log counter resets
     */
    @AfterReturning(
        pointcut = "execution(* com.williamcallahan.mathcore.service.MathConversionService.resetGlobalCounter(..))",
        returning = "result"
    )
    public void logCounterReset(JoinPoint joinPoint, Object result) {
        PIPELINE_LOG.info("[{}] COUNTER RESET - Global numbering restarted after {}", REQUEST_ID.get(), result);
        REQUEST_ID.remove();
    }
}
