package com.riansoft.pickup_vrp.controller;

import com.riansoft.pickup_vrp.dto.ErrorResponseDto;
import com.riansoft.pickup_vrp.dto.RouteSolutionDto;
import com.riansoft.pickup_vrp.dto.SolveRoutesRequestDto;
import com.riansoft.pickup_vrp.exception.InfeasibleException;
import com.riansoft.pickup_vrp.exception.InvalidInputException;
import com.riansoft.pickup_vrp.exception.ResolutionException;
import com.riansoft.pickup_vrp.exception.UpstreamException;
import com.riansoft.pickup_vrp.service.RouteSolveService;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;
import java.util.stream.Collectors;

@RestController
public class RouteController {

    private static final Logger log = LoggerFactory.getLogger(RouteController.class);

    static final String INTERNAL_ERROR_MESSAGE = "Internal server error";

    private final RouteSolveService routeSolveService;

    @Autowired
    public RouteController(RouteSolveService routeSolveService) {
        this.routeSolveService = routeSolveService;
    }

    @GetMapping("/")
    public Map<String, String> readRoot() {
        return Map.of("message", "API is running");
    }

    /**
     * 정류장/승하차 쌍을 받아 행렬 생성 후 최적 경로를 계산해 반환합니다.
     */
    @PostMapping("/api/solve-routes")
    public ResponseEntity<RouteSolutionDto> solveRoutes(@Valid @RequestBody SolveRoutesRequestDto request) {
        return ResponseEntity.ok(routeSolveService.solveRoutes(request));
    }

    @ExceptionHandler(InvalidInputException.class)
    public ResponseEntity<ErrorResponseDto> handleInvalidInput(InvalidInputException e) {
        log.warn("[API] 잘못된 요청: {}", e.getMessage());
        return error(HttpStatus.BAD_REQUEST, e.getCode(), e.getMessage());
    }

    @ExceptionHandler(ResolutionException.class)
    public ResponseEntity<ErrorResponseDto> handleResolution(ResolutionException e) {
        log.warn("[API] 주소 변환 실패: {} (status={}, retryable={})", e.getMessage(), e.getProviderStatus(), e.isRetryable());
        HttpStatus status = e.isRetryable() ? HttpStatus.BAD_GATEWAY : HttpStatus.BAD_REQUEST;
        return error(status, e.getCode(), e.getMessage());
    }

    @ExceptionHandler(UpstreamException.class)
    public ResponseEntity<ErrorResponseDto> handleUpstream(UpstreamException e) {
        log.warn("[API] 외부 API 오류: {} (retryable={})", e.getMessage(), e.isRetryable());
        return error(HttpStatus.BAD_GATEWAY, e.getCode(), e.getMessage());
    }

    @ExceptionHandler(InfeasibleException.class)
    public ResponseEntity<ErrorResponseDto> handleInfeasible(InfeasibleException e) {
        log.warn("[API] 가능한 경로 없음: {} (solver status={})", e.getMessage(), e.getSolverStatus());
        return error(HttpStatus.UNPROCESSABLE_ENTITY, e.getCode(), e.getMessage());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponseDto> handleValidation(MethodArgumentNotValidException e) {
        String message = e.getBindingResult().getFieldErrors().stream()
                .map(fieldError -> fieldError.getField() + " " + fieldError.getDefaultMessage())
                .collect(Collectors.joining(", "));
        return error(HttpStatus.BAD_REQUEST, "INVALID_INPUT", message);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponseDto> handleUnreadable(HttpMessageNotReadableException e) {
        return error(HttpStatus.BAD_REQUEST, "INVALID_INPUT", "Request body is not valid JSON for this endpoint");
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponseDto> handleUnexpected(Exception e) {
        log.error("!!! [API] 처리 중 예기치 못한 오류 !!!", e);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "INTERNAL_ERROR", INTERNAL_ERROR_MESSAGE);
    }

    private ResponseEntity<ErrorResponseDto> error(HttpStatus status, String code, String message) {
        return ResponseEntity.status(status).body(new ErrorResponseDto(code, message));
    }
}
