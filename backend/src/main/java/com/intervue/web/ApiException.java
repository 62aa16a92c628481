package com.intervue.web;

import lombok.Getter;
import org.springframework.http.HttpStatus;

@Getter
public class ApiException extends RuntimeException {

    private final HttpStatus status;
    private final String code;

    public ApiException(HttpStatus status, String code, String message) {
        super(message);
        this.status = status;
        this.code = code;
    }

    public static ApiException notFound(String detail) {
        return new ApiException(
                HttpStatus.NOT_FOUND,
                "not_found",
                detail
        );
    }

    public static ApiException gradeExists(String detail) {
        return new ApiException(
                HttpStatus.CONFLICT,
                "grade_exists",
                detail
        );
    }

    public static ApiException candidateEmailTaken(String detail) {
        return new ApiException(
                HttpStatus.CONFLICT,
                "candidate_email_taken",
                detail
        );
    }

    public static ApiException invalidRequest(String detail) {
        return new ApiException(
                HttpStatus.BAD_REQUEST,
                "invalid_request",
                detail
        );
    }

    public static ApiException storageUnavailable(String detail) {
        return new ApiException(
                HttpStatus.BAD_GATEWAY,
                "storage_unavailable",
                detail
        );
    }
}
