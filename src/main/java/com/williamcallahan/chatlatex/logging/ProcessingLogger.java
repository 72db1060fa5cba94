package com.williamcallahan.chatlatex.logging;

import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Logging aspect for the export pipeline.
 * Times fragment rendering, document assembly, compiler passes, PDF export and formula rendering,
 * tagging each step with a per-thread request id.
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
     * Log fragment rendering
     */
    @Around("execution(* com.williamcallahan.chatlatex.service.latex.LatexFragmentRenderer.render(..))")
    public Object logFragmentRendering(ProceedingJoinPoint joinPoint) throws Throwable {
        String requestId = REQUEST_ID.get();
        long startTime = System.currentTimeMillis();
        Object[] args = joinPoint.getArgs();
        if (args.length > 0 && args[0] instanceof String content) {
            PIPELINE_LOG.debug("[{}] FRAGMENT: input length {}", requestId, content.length());
        }

        Object result = joinPoint.proceed();
        long duration = System.currentTimeMillis() - startTime;
        if (result instanceof String latex) {
            PIPELINE_LOG.debug("[{}] FRAGMENT: {} characters of LaTeX in {}ms", requestId, latex.length(), duration);
        }
        return result;
    }

    /**
     * Log document assembly
     */
    @Around("execution(* com.williamcallahan.chatlatex.service.latex.LatexDocumentAssembler.assemble(..))")
    public Object logDocumentAssembly(ProceedingJoinPoint joinPoint) throws Throwable {
        return timeStep(joinPoint, "STEP 1: DOCUMENT ASSEMBLY");
    }

    /**
     * Log compiler passes
     */
    @Around("execution(* com.williamcallahan.chatlatex.service.latex.LatexCompiler+.compile(..))")
    public Object logCompilation(ProceedingJoinPoint joinPoint) throws Throwable {
        return timeStep(joinPoint, "STEP 2: LATEX COMPILATION");
    }

    /**
     * Log the complete export
     */
    @Around("execution(* com.williamcallahan.chatlatex.service.ChatPdfExportService.export(..))")
    public Object logExport(ProceedingJoinPoint joinPoint) throws Throwable {
        try {
            return timeStep(joinPoint, "PDF EXPORT");
        } finally {
            // the export is the outermost step of a request
            REQUEST_ID.remove();
        }
    }

    /**
     * Log formula rendering
     */
    @Around("execution(* com.williamcallahan.chatlatex.service.math.MathImageRenderer+.render(..))")
    public Object logFormulaRendering(ProceedingJoinPoint joinPoint) throws Throwable {
        String requestId = REQUEST_ID.get();
        long startTime = System.currentTimeMillis();
        Object result = joinPoint.proceed();
        long duration = System.currentTimeMillis() - startTime;
        boolean rendered = result instanceof Optional<?> image && image.isPresent();
        PIPELINE_LOG.info("[{}] FORMULA RENDER - {} in {}ms", requestId, rendered ? "Rendered" : "Failed", duration);
        return result;
    }

    private Object timeStep(ProceedingJoinPoint joinPoint, String stepName) throws Throwable {
        String requestId = REQUEST_ID.get();
        long startTime = System.currentTimeMillis();

        PIPELINE_LOG.info("[{}] {} - Starting", requestId, stepName);
        PIPELINE_LOG.debug("[{}] Processing method: {}", requestId, joinPoint.getSignature().getName());

        try {
            Object result = joinPoint.proceed();
            long duration = System.currentTimeMillis() - startTime;

            PIPELINE_LOG.info("[{}] {} - Completed in {}ms", requestId, stepName, duration);

            return result;
        } catch (Exception e) {
            PIPELINE_LOG.error("[{}] {} - Failed: {}", requestId, stepName, e.getMessage());
            throw e;
        }
    }
}
