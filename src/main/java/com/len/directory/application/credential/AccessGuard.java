package com.len.directory.application.credential;

import com.len.directory.common.exception.BusinessException;
import com.len.directory.common.exception.ErrorCode;

public final class AccessGuard {

    private AccessGuard() {}

    public static ResolvedIdentity.Admin requireAdmin(ResolvedIdentity identity) {
        if (identity instanceof ResolvedIdentity.Admin admin) {
            return admin;
        }
        if (identity instanceof ResolvedIdentity.Regular) {
            throw new BusinessException(ErrorCode.ADMIN_REQUIRED);
        }
        throw new BusinessException(ErrorCode.API_KEY_REQUIRED);
    }

    /**
     * 관리자 또는 일반 API 키
     * @return keyId
     */
    public static String requireApiKey(ResolvedIdentity identity) {
        if (identity instanceof ResolvedIdentity.Admin admin) {
            return admin.keyId();
        }
        if (identity instanceof ResolvedIdentity.Regular regular) {
            return regular.keyId();
        }
        throw new BusinessException(ErrorCode.API_KEY_REQUIRED);
    }

    public static boolean isAdmin(ResolvedIdentity identity) {
        return identity instanceof ResolvedIdentity.Admin;
    }
}
