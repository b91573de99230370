package com.ryuqq.userstore.application.user;

import com.ryuqq.userstore.core.model.User;
import com.ryuqq.userstore.core.spi.UserRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 사용자 생성 서비스.
 *
 * <p>식별자를 발급하고 User를 만들어 UserRepository에 저장합니다.</p>
 *
 * <p><strong>소유 관계:</strong></p>
 * <ul>
 *   <li>생성 시 전달받은 UserRepository 하나만 사용합니다.</li>
 *   <li>UserRepository를 외부에 노출하지 않습니다.</li>
 * </ul>
 *
 * <p><strong>식별자 발급:</strong> {@code count() + 1}</p>
 * <p>단조 증가 카운터가 아니므로, createUser 외의 경로로 저장된 User가 있으면
 * 기존 식별자와 충돌할 수 있고 이 경우 기존 User를 덮어씁니다.</p>
 * <pre>
 * repository.add(User.of(5L, "Bob", "bob@x.com"));  // count = 1
 * service.createUser("Ann", "ann@x.com");            // id = 2 (6이 아님)
 * </pre>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * UserService service = new UserService(new InMemoryUserRepository());
 * User ann = service.createUser("Ann", "ann@x.com");   // id = 1
 * User bob = service.createUser("Bob", "bob@x.com");   // id = 2
 * </pre>
 *
 * @author User Store Team
 * @since 1.0.0
 */
public final class UserService {

    private static final Logger log = LoggerFactory.getLogger(UserService.class);

    private final UserRepository repository;

    /**
     * 생성자.
     *
     * @param repository 사용자 저장소
     * @throws IllegalArgumentException repository가 null인 경우
     */
    public UserService(UserRepository repository) {
        if (repository == null) {
            throw new IllegalArgumentException("repository cannot be null");
        }
        this.repository = repository;
    }

    /**
     * 사용자 생성.
     *
     * <p><strong>처리 흐름:</strong></p>
     * <ol>
     *   <li>식별자 발급 (count() + 1)</li>
     *   <li>User 생성</li>
     *   <li>repository.add(user)</li>
     *   <li>생성된 User 반환</li>
     * </ol>
     *
     * @param name 표시 이름
     * @param email 이메일 주소
     * @return 생성된 User
     * @throws IllegalArgumentException name 또는 email이 null인 경우
     */
    public User createUser(String name, String email) {
        long id = generateId();
        User user = User.of(id, name, email);

        if (repository.getById(id).isPresent()) {
            log.warn("Generated id {} is already taken; existing user will be overwritten", id);
        }

        repository.add(user);
        log.info("Created user {}", id);
        return user;
    }

    /**
     * 식별자 발급.
     *
     * @return 현재 저장 건수 + 1
     */
    private long generateId() {
        return repository.count() + 1L;
    }
}
