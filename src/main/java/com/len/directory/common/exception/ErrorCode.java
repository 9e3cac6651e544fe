package com.len.directory.common.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;

@Getter
@RequiredArgsConstructor
public enum ErrorCode {

    // 공통
    INTERNAL_ERROR(HttpStatus.INTERNAL_SERVER_ERROR, "INTERNAL_ERROR", "알 수 없는 오류가 발생했습니다."),
    DB_ERROR(HttpStatus.INTERNAL_SERVER_ERROR, "DB_ERROR", "데이터베이스 오류가 발생했습니다."),
    INVALID_REQUEST(HttpStatus.BAD_REQUEST, "INVALID_REQUEST", "요청 값이 올바르지 않습니다."),

    // 인증 / 권한
    UNAUTHORIZED(HttpStatus.UNAUTHORIZED, "UNAUTHORIZED", "API 키 또는 수정 토큰이 필요합니다."),
    API_KEY_REQUIRED(HttpStatus.UNAUTHORIZED, "API_KEY_REQUIRED", "유효한 API 키가 필요합니다."),
    ADMIN_REQUIRED(HttpStatus.FORBIDDEN, "ADMIN_REQUIRED", "관리자 키가 필요합니다."),
    FORBIDDEN(HttpStatus.FORBIDDEN, "FORBIDDEN", "이 리소스를 수정할 권한이 없습니다."),
    ADMIN_FIELD(HttpStatus.FORBIDDEN, "FORBIDDEN", "status/featured/verified 는 관리자만 변경할 수 있습니다."),
    KEY_NOT_FOUND(HttpStatus.NOT_FOUND, "NOT_FOUND", "API 키가 존재하지 않습니다."),

    // 요청 제한
    RATE_LIMITED(HttpStatus.TOO_MANY_REQUESTS, "RATE_LIMITED", "요청 한도를 초과했습니다. 잠시 후 다시 시도해주세요."),
    EXEMPTION_NOT_FOUND(HttpStatus.NOT_FOUND, "NOT_FOUND", "면제 목록에 없는 bucket 입니다."),

    // 앱 목록
    LISTING_NOT_FOUND(HttpStatus.NOT_FOUND, "NOT_FOUND", "앱이 존재하지 않습니다."),
    INVALID_STATUS(HttpStatus.BAD_REQUEST, "INVALID_STATUS", "허용되지 않는 상태값입니다."),
    NO_CHANGES(HttpStatus.BAD_REQUEST, "NO_CHANGES", "변경할 항목이 없습니다."),

    // 웹훅
    WEBHOOK_NOT_FOUND(HttpStatus.NOT_FOUND, "NOT_FOUND", "웹훅이 존재하지 않습니다."),
    INVALID_URL(HttpStatus.BAD_REQUEST, "INVALID_URL", "URL은 http:// 또는 https:// 로 시작해야 합니다."),
    INVALID_EVENT(HttpStatus.BAD_REQUEST, "INVALID_EVENT", "지원하지 않는 이벤트 타입입니다."),

    // 헬스체크
    NO_PROBE_URL(HttpStatus.UNPROCESSABLE_ENTITY, "NO_URL", "헬스체크할 api_url 또는 homepage_url 이 없습니다.");

    private final HttpStatus httpStatus;
    private final String code;
    private final String message;
}
