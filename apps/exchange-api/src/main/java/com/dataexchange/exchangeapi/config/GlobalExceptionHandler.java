package com.dataexchange.exchangeapi.config;

import com.dataexchange.domain.pools.AmmDomainException;
import com.dataexchange.domain.pools.InsufficientAmountException;
import com.dataexchange.domain.pools.InsufficientLiquidityException;
import com.dataexchange.domain.pools.InsufficientPositionException;
import com.dataexchange.domain.pools.InvalidLiquidityAmountException;
import com.dataexchange.domain.pools.InvalidTokenPairException;
import com.dataexchange.domain.pools.InvariantViolationException;
import com.dataexchange.domain.pools.PoolNotFoundException;
import com.dataexchange.domain.pools.SlippageExceededException;
import com.dataexchange.exchangeapi.pools.PoolBusyException;
import com.dataexchange.exchangeapi.settlement.SettlementException;
import java.net.URI;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.security.authentication.AuthenticationCredentialsNotFoundException;
import org.springframework.security.core.AuthenticationException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

@RestControllerAdvice
public class GlobalExceptionHandler {
  private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

  private static final String TYPE_PREFIX = "/problems/";

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ProblemDetail handleValidation(MethodArgumentNotValidException ex) {
    ProblemDetail problem =
        problem(HttpStatus.BAD_REQUEST, "Request validation failed", "validation-error");
    problem.setTitle("Validation Error");
    problem.setProperty(
        "errors",
        ex.getFieldErrors().stream()
            .map(
                fe ->
                    new FieldError(
                        fe.getField(),
                        fe.getDefaultMessage(),
                        String.valueOf(fe.getRejectedValue())))
            .toList());
    return problem;
  }

  @ExceptionHandler(MissingServletRequestParameterException.class)
  public ProblemDetail handleMissingParam(MissingServletRequestParameterException ex) {
    ProblemDetail problem = problem(HttpStatus.BAD_REQUEST, ex.getMessage(), "missing-parameter");
    problem.setTitle("Missing Parameter");
    return problem;
  }

  @ExceptionHandler(MethodArgumentTypeMismatchException.class)
  public ProblemDetail handleTypeMismatch(MethodArgumentTypeMismatchException ex) {
    String detail =
        String.format(
            "Parameter '%s' should be of type '%s'",
            ex.getName(),
            ex.getRequiredType() != null ? ex.getRequiredType().getSimpleName() : "unknown");
    ProblemDetail problem = problem(HttpStatus.BAD_REQUEST, detail, "type-mismatch");
    problem.setTitle("Type Mismatch");
    return problem;
  }

  @ExceptionHandler(HttpMessageNotReadableException.class)
  public ProblemDetail handleUnreadable(HttpMessageNotReadableException ex) {
    ProblemDetail problem =
        problem(HttpStatus.BAD_REQUEST, "Request body is missing or malformed", "malformed-body");
    problem.setTitle("Malformed Request Body");
    return problem;
  }

  @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
  public ProblemDetail handleMethodNotAllowed(HttpRequestMethodNotSupportedException ex) {
    ProblemDetail problem =
        problem(HttpStatus.METHOD_NOT_ALLOWED, ex.getMessage(), "method-not-allowed");
    problem.setTitle("Method Not Allowed");
    return problem;
  }

  @ExceptionHandler(NoResourceFoundException.class)
  public ProblemDetail handleNotFound(NoResourceFoundException ex) {
    ProblemDetail problem = problem(HttpStatus.NOT_FOUND, ex.getMessage(), "not-found");
    problem.setTitle("Not Found");
    return problem;
  }

  @ExceptionHandler(AccessDeniedException.class)
  public ProblemDetail handleAccessDenied(AccessDeniedException ex) {
    ProblemDetail problem =
        problem(
            HttpStatus.FORBIDDEN,
            "You do not have permission to access this resource",
            "access-denied");
    problem.setTitle("Access Denied");
    return problem;
  }

  @ExceptionHandler({
    AuthenticationException.class,
    AuthenticationCredentialsNotFoundException.class
  })
  public ProblemDetail handleAuthentication(Exception ex) {
    ProblemDetail problem =
        problem(
            HttpStatus.UNAUTHORIZED,
            "Authentication is required to access this resource",
            "unauthorized");
    problem.setTitle("Unauthorized");
    return problem;
  }

  @ExceptionHandler(IllegalArgumentException.class)
  public ProblemDetail handleIllegalArgument(IllegalArgumentException ex) {
    ProblemDetail problem = problem(HttpStatus.BAD_REQUEST, ex.getMessage(), "invalid-argument");
    problem.setTitle("Invalid Argument");
    return problem;
  }

  @ExceptionHandler(SlippageExceededException.class)
  public ProblemDetail handleSlippage(SlippageExceededException ex) {
    ProblemDetail problem = problem(HttpStatus.CONFLICT, ex.getMessage(), "slippage-exceeded");
    problem.setTitle("Slippage Exceeded");
    problem.setProperty("minAmountOut", ex.minAmountOut());
    problem.setProperty("actualAmountOut", ex.actualAmountOut());
    return problem;
  }

  @ExceptionHandler(InsufficientLiquidityException.class)
  public ProblemDetail handleInsufficientLiquidity(InsufficientLiquidityException ex) {
    ProblemDetail problem =
        problem(HttpStatus.CONFLICT, ex.getMessage(), "insufficient-liquidity");
    problem.setTitle("Insufficient Liquidity");
    return problem;
  }

  @ExceptionHandler(InsufficientPositionException.class)
  public ProblemDetail handleInsufficientPosition(InsufficientPositionException ex) {
    ProblemDetail problem = problem(HttpStatus.CONFLICT, ex.getMessage(), "insufficient-position");
    problem.setTitle("Insufficient Position");
    problem.setProperty("requested", ex.requested());
    problem.setProperty("held", ex.held());
    return problem;
  }

  @ExceptionHandler(PoolNotFoundException.class)
  public ProblemDetail handlePoolNotFound(PoolNotFoundException ex) {
    ProblemDetail problem = problem(HttpStatus.NOT_FOUND, ex.getMessage(), "pool-not-found");
    problem.setTitle("Pool Not Found");
    problem.setProperty("pairKey", ex.pairKey().value());
    return problem;
  }

  @ExceptionHandler({
    InsufficientAmountException.class,
    InvalidLiquidityAmountException.class,
    InvalidTokenPairException.class
  })
  public ProblemDetail handleInvalidAmount(AmmDomainException ex) {
    String type = ex instanceof InvalidTokenPairException ? "invalid-token-pair" : "invalid-amount";
    ProblemDetail problem = problem(HttpStatus.BAD_REQUEST, ex.getMessage(), type);
    problem.setTitle(
        ex instanceof InvalidTokenPairException ? "Invalid Token Pair" : "Invalid Amount");
    return problem;
  }

  @ExceptionHandler(AmmDomainException.class)
  public ProblemDetail handleAmmDomain(AmmDomainException ex) {
    ProblemDetail problem = problem(HttpStatus.BAD_REQUEST, ex.getMessage(), "amm-error");
    problem.setTitle("Request Rejected");
    return problem;
  }

  @ExceptionHandler(PoolBusyException.class)
  public ProblemDetail handlePoolBusy(PoolBusyException ex) {
    ProblemDetail problem =
        problem(HttpStatus.SERVICE_UNAVAILABLE, ex.getMessage(), "pool-busy");
    problem.setTitle("Pool Busy");
    return problem;
  }

  @ExceptionHandler(SettlementException.class)
  public ProblemDetail handleSettlement(SettlementException ex) {
    log.warn("Settlement failed: {}", ex.getMessage());
    ProblemDetail problem =
        problem(HttpStatus.BAD_GATEWAY, "Settlement was not confirmed", "settlement-failed");
    problem.setTitle("Settlement Failed");
    return problem;
  }

  @ExceptionHandler(DuplicateKeyException.class)
  public ProblemDetail handleDuplicate(DuplicateKeyException ex) {
    ProblemDetail problem =
        problem(HttpStatus.CONFLICT, "Request conflicts with an existing record", "duplicate");
    problem.setTitle("Duplicate Request");
    return problem;
  }

  @ExceptionHandler(InvariantViolationException.class)
  public ProblemDetail handleInvariantViolation(InvariantViolationException ex) {
    log.error(
        "Invariant violation before={} after={}: {}", ex.before(), ex.after(), ex.getMessage());
    return internalError();
  }

  @ExceptionHandler(Exception.class)
  public ProblemDetail handleUnexpected(Exception ex) {
    log.error("Unhandled exception", ex);
    return internalError();
  }

  private static ProblemDetail internalError() {
    ProblemDetail problem =
        problem(
            HttpStatus.INTERNAL_SERVER_ERROR,
            "An unexpected error occurred. Please try again later.",
            "internal-error");
    problem.setTitle("Internal Server Error");
    return problem;
  }

  private static ProblemDetail problem(HttpStatus status, String detail, String type) {
    ProblemDetail problem = ProblemDetail.forStatusAndDetail(status, detail);
    problem.setType(URI.create(TYPE_PREFIX + type));
    return problem;
  }

  private record FieldError(String field, String message, String rejectedValue) {}
}
