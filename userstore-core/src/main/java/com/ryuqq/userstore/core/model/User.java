package com.ryuqq.userstore.core.model;

/**
 * 사용자 엔티티.
 *
 * <p>User는 저장소에 보관되는 불변 레코드로, 식별자와 표시 이름, 이메일로 구성됩니다.</p>
 *
 * <p><strong>필드 구성:</strong></p>
 * <ul>
 *   <li><strong>id:</strong> 저장소 내 고유 식별자 (0 이상)</li>
 *   <li><strong>name:</strong> 표시 이름</li>
 *   <li><strong>email:</strong> 이메일 주소</li>
 * </ul>
 *
 * <p><strong>불변성:</strong> 생성 후 값 변경 불가</p>
 * <p><strong>유효성 검증:</strong> null과 음수 id만 거부합니다.
 * 이름 공백 여부나 이메일 형식은 검사하지 않습니다.</p>
 *
 * <p><strong>예시:</strong></p>
 * <pre>
 * User user = User.of(1L, "Ann", "ann@x.com");
 * </pre>
 *
 * @param id 사용자 식별자
 * @param name 표시 이름
 * @param email 이메일 주소
 *
 * @author User Store Team
 * @since 1.0.0
 */
public record User(
    long id,
    String name,
    String email
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException id가 음수이거나 name, email이 null인 경우
     */
    public User {
        if (id < 0) {
            throw new IllegalArgumentException("id must be non-negative (current: " + id + ")");
        }
        if (name == null) {
            throw new IllegalArgumentException("name cannot be null");
        }
        if (email == null) {
            throw new IllegalArgumentException("email cannot be null");
        }
    }

    /**
     * User 생성.
     *
     * @param id 사용자 식별자
     * @param name 표시 이름
     * @param email 이메일 주소
     * @return 생성된 User
     * @throws IllegalArgumentException id가 음수이거나 name, email이 null인 경우
     */
    public static User of(long id, String name, String email) {
        return new User(id, name, email);
    }
}
