package com.ventture.credit.config;

import com.ventture.credit.engine.error.ArtifactLoadException;
import com.ventture.credit.engine.error.CreditEngineException;
import com.ventture.credit.engine.error.DimensionMismatchException;
import com.ventture.credit.engine.error.ExplanationException;
import com.ventture.credit.engine.error.ExplanationTimeoutException;
import com.ventture.credit.engine.error.ExplanationUnsupportedException;
import com.ventture.credit.engine.error.InvalidValueException;
import com.ventture.credit.engine.error.MissingFeatureException;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.jdbc.BadSqlGrammarException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler({MethodArgumentNotValidException.class, HttpMessageNotReadableException.class})
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, Object> handleValidation(Exception ex, HttpServletRequest req) {
        return body(HttpStatus.BAD_REQUEST, "Bad Request", ex.getMessage(), req);
    }

    @ExceptionHandler(MissingFeatureException.class)
    @ResponseStatus(HttpStatus.UNPROCESSABLE_ENTITY)
    public Map<String, Object> handleMissing(MissingFeatureException ex, HttpServletRequest req) {
        Map<String, Object> out = body(HttpStatus.UNPROCESSABLE_ENTITY, "Missing Feature", ex.getMessage(), req);
        out.put("missingFeatures", ex.getMissingFeatures());
        return out;
    }

    @ExceptionHandler(InvalidValueException.class)
    @ResponseStatus(HttpStatus.UNPROCESSABLE_ENTITY)
    public Map<String, Object> handleInvalid(InvalidValueException ex, HttpServletRequest req) {
        Map<String, Object> out = body(HttpStatus.UNPROCESSABLE_ENTITY, "Invalid Value", ex.getMessage(), req);
        out.put("feature", ex.getFeature());
        return out;
    }

    @ExceptionHandler(ExplanationUnsupportedException.class)
    @ResponseStatus(HttpStatus.NOT_IMPLEMENTED)
    public Map<String, Object> handleUnsupported(ExplanationUnsupportedException ex, HttpServletRequest req) {
        return withPrediction(body(HttpStatus.NOT_IMPLEMENTED, "Explanation Unsupported", ex.getMessage(), req), ex);
    }

    @ExceptionHandler(ExplanationTimeoutException.class)
    @ResponseStatus(HttpStatus.GATEWAY_TIMEOUT)
    public Map<String, Object> handleTimeout(ExplanationTimeoutException ex, HttpServletRequest req) {
        log.warn("Explanation timed out on {}: {}", req.getRequestURI(), ex.getMessage());
        return withPrediction(body(HttpStatus.GATEWAY_TIMEOUT, "Explanation Timeout", ex.getMessage(), req), ex);
    }

    @ExceptionHandler(ArtifactLoadException.class)
    @ResponseStatus(HttpStatus.SERVICE_UNAVAILABLE)
    public Map<String, Object> handleArtifact(ArtifactLoadException ex, HttpServletRequest req) {
        log.error("Artifact load failed on {}: {}", req.getRequestURI(), ex.getMessage());
        return body(HttpStatus.SERVICE_UNAVAILABLE, "Model Unavailable", ex.getMessage(), req);
    }

    @ExceptionHandler({BadSqlGrammarException.class, DataAccessException.class})
    @ResponseStatus(HttpStatus.INTERNAL_SERVER_ERROR)
    public Map<String, Object> handleSql(DataAccessException ex, HttpServletRequest req) {
        log.error("Database error on {}", req.getRequestURI(), ex);
        Throwable cause = ex.getMostSpecificCause();
        return body(HttpStatus.INTERNAL_SERVER_ERROR, "Database Error",
                cause != null ? cause.getMessage() : ex.getMessage(), req);
    }

    @ExceptionHandler({DimensionMismatchException.class, CreditEngineException.class})
    @ResponseStatus(HttpStatus.INTERNAL_SERVER_ERROR)
    public Map<String, Object> handleEngine(CreditEngineException ex, HttpServletRequest req) {
        log.error("Evaluation failed on {}", req.getRequestURI(), ex);
        return body(HttpStatus.INTERNAL_SERVER_ERROR, "Evaluation Error", ex.getMessage(), req);
    }

    @ExceptionHandler(Exception.class)
    @ResponseStatus(HttpStatus.INTERNAL_SERVER_ERROR)
    public Map<String, Object> handleAny(Exception ex, HttpServletRequest req) {
        log.error("Unhandled error on {}", req.getRequestURI(), ex);
        return body(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error", ex.getMessage(), req);
    }

    // the decision stands even when it cannot be explained
    private Map<String, Object> withPrediction(Map<String, Object> out, ExplanationException ex) {
        ex.getPrediction().ifPresent(p -> out.put("prediction", p));
        return out;
    }

    private Map<String, Object> body(HttpStatus status, String error, String message, HttpServletRequest req) {
        // LinkedHashMap: message may be null, which Map.of rejects
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("timestamp", Instant.now());
        out.put("status", status.value());
        out.put("error", error);
        out.put("message", message);
        out.put("path", req.getRequestURI());
        return out;
    }
}
