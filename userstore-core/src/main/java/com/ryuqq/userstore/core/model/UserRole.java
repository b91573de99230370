package com.ryuqq.userstore.core.model;

/**
 * 사용자 역할 구분.
 *
 * <p>현재 어떤 User에도 연결되지 않으며, 어떤 연산도 이 값을 참조하지 않습니다.
 * 권한 검사 기능은 제공하지 않습니다.</p>
 *
 * @author User Store Team
 * @since 1.0.0
 */
public enum UserRole {

    /**
     * 관리자.
     */
    ADMIN,

    /**
     * 일반 사용자.
     */
    USER,

    /**
     * 게스트.
     */
    GUEST
}
