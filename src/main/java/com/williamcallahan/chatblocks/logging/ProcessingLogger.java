package com.williamcallahan.chatblocks.logging;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.williamcallahan.chatblocks.domain.blocks.ContentBlock;
import com.williamcallahan.chatblocks.domain.blocks.ParsedMessage;
import org.aspectj.lang.JoinPoint;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.AfterReturning;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Logging aspect for the message parsing pipeline.
 * Logs each step with a request id and its duration.
 */
@Aspect
@Component
public class ProcessingLogger {
    private static final Logger PIPELINE_LOG = LoggerFactory.getLogger("PIPELINE");
    private final ObjectMapper objectMapper = new ObjectMapper();

    // Thread-local storage for request tracking
    private static final ThreadLocal<String> REQUEST_ID = ThreadLocal.withInitial(() ->
        "REQ-" + System.currentTimeMillis() + "-" + Thread.currentThread().getId()
    );

    /**
     * Log message parsing
     */
    @Around("execution(* com.williamcallahan.chatblocks.service.MessageParsingService.parse*(..))")
    public Object logMessageParsing(ProceedingJoinPoint joinPoint) throws Throwable {
        String requestId = REQUEST_ID.get();
        long startTime = System.currentTimeMillis();

        PIPELINE_LOG.info("[{}] STEP 1: MESSAGE PARSING - Starting", requestId);
        Object[] args = joinPoint.getArgs();
        if (args.length > 0 && args[0] instanceof String message) {
            PIPELINE_LOG.debug("[{}] Input text length: {}", requestId, message.length());
        }

        try {
            Object result = joinPoint.proceed();
            long duration = System.currentTimeMillis() - startTime;

            PIPELINE_LOG.info("[{}] STEP 1: MESSAGE PARSING - Completed in {}ms", requestId, duration);
            if (result instanceof ParsedMessage parsed) {
                PIPELINE_LOG.info("[{}] Block kinds: {}", requestId, summarizeBlocks(parsed));
            }
            return result;
        } catch (Exception e) {
            PIPELINE_LOG.error("[{}] STEP 1: MESSAGE PARSING - Failed: {}", requestId, e.getMessage());
            throw e;
        }
    }

    /**
     * Log image reference resolution
     */
    @Around("execution(* com.williamcallahan.chatblocks.service.ImageStore.resolve(..))")
    public Object logImageResolution(ProceedingJoinPoint joinPoint) throws Throwable {
        String requestId = REQUEST_ID.get();
        long startTime = System.currentTimeMillis();

        PIPELINE_LOG.debug("[{}] STEP 2: IMAGE RESOLUTION - Looking up {}", requestId, joinPoint.getArgs()[0]);

        try {
            Object result = joinPoint.proceed();
            long duration = System.currentTimeMillis() - startTime;

            boolean found = result instanceof Optional<?> resolved && resolved.isPresent();
            PIPELINE_LOG.info("[{}] STEP 2: IMAGE RESOLUTION - {} in {}ms",
                requestId, found ? "Resolved" : "Not found", duration);
            return result;
        } catch (Exception e) {
            PIPELINE_LOG.error("[{}] STEP 2: IMAGE RESOLUTION - Failed: {}", requestId, e.getMessage());
            throw e;
        }
    }

    /**
     * Log pipeline summary at the end
     */
    @AfterReturning(
        pointcut = "execution(* com.williamcallahan.chatblocks.web.MessageController.parse(..))",
        returning = "result"
    )
    public void logPipelineSummary(JoinPoint joinPoint, Object result) {
        String requestId = REQUEST_ID.get();

        PIPELINE_LOG.info("[{}] PIPELINE COMPLETE - Parse request answered", requestId);

        // Clear the request ID for this thread
        REQUEST_ID.remove();
    }

    private String summarizeBlocks(ParsedMessage parsed) {
        Map<String, Integer> counts = new TreeMap<>();
        for (ContentBlock block : parsed.blocks()) {
            counts.merge(block.getClass().getSimpleName(), 1, Integer::sum);
        }
        try {
            return objectMapper.writeValueAsString(counts);
        } catch (JsonProcessingException e) {
            return counts.toString();
        }
    }
}
