package com.ryuqq.userstore.application.user;

import com.ryuqq.userstore.core.model.User;
import com.ryuqq.userstore.core.spi.UserRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * UserService 유닛 테스트.
 *
 * <p>UserService의 생성 흐름을 검증합니다:</p>
 * <ul>
 *   <li>식별자 = count() + 1</li>
 *   <li>생성한 User를 repository.add()로 저장</li>
 *   <li>식별자 충돌 시에도 예외 없이 저장</li>
 * </ul>
 *
 * @author User Store Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class UserServiceTest {

    @Mock
    private UserRepository repository;

    private UserService userService;

    @BeforeEach
    void setUp() {
        userService = new UserService(repository);
    }

    // ============================================================
    // 1. 생성자 검증
    // ============================================================

    @Test
    void constructor_null_repository면_예외() {
        assertThatThrownBy(() -> new UserService(null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("repository cannot be null");
    }

    // ============================================================
    // 2. 식별자 발급: count() + 1
    // ============================================================

    @Test
    void createUser_빈_저장소면_id_1로_생성됨() {
        // given
        when(repository.count()).thenReturn(0);
        when(repository.getById(1L)).thenReturn(Optional.empty());

        // when
        User user = userService.createUser("Ann", "ann@x.com");

        // then
        assertThat(user).isEqualTo(User.of(1L, "Ann", "ann@x.com"));
        verify(repository).add(user);
    }

    @Test
    void createUser_저장_건수가_3이면_id_4로_생성됨() {
        // given
        when(repository.count()).thenReturn(3);
        when(repository.getById(4L)).thenReturn(Optional.empty());

        // when
        User user = userService.createUser("Dan", "dan@x.com");

        // then
        assertThat(user.id()).isEqualTo(4L);
    }

    // ============================================================
    // 3. 저장 순서 및 저장 값
    // ============================================================

    @Test
    void createUser_count_조회_후_add_호출됨() {
        // given
        when(repository.count()).thenReturn(0);
        when(repository.getById(1L)).thenReturn(Optional.empty());

        // when
        userService.createUser("Ann", "ann@x.com");

        // then
        InOrder inOrder = inOrder(repository);
        inOrder.verify(repository).count();
        inOrder.verify(repository).add(any(User.class));
    }

    @Test
    void createUser_반환값과_저장값이_동일함() {
        // given
        when(repository.count()).thenReturn(1);
        when(repository.getById(2L)).thenReturn(Optional.empty());
        ArgumentCaptor<User> captor = ArgumentCaptor.forClass(User.class);

        // when
        User returned = userService.createUser("Bob", "bob@x.com");

        // then
        verify(repository).add(captor.capture());
        assertThat(captor.getValue()).isEqualTo(returned);
    }

    // ============================================================
    // 4. 식별자 충돌 (덮어쓰기)
    // ============================================================

    @Test
    void createUser_발급된_id가_이미_있으면_예외_없이_덮어씀() {
        // given
        User existing = User.of(2L, "Old", "old@x.com");
        when(repository.count()).thenReturn(1);
        when(repository.getById(2L)).thenReturn(Optional.of(existing));

        // when
        User created = userService.createUser("New", "new@x.com");

        // then
        assertThat(created.id()).isEqualTo(2L);
        verify(repository).add(created);
    }

    // ============================================================
    // 5. 입력 검증 (null만 거부)
    // ============================================================

    @Test
    void createUser_null_name이면_예외_저장_안됨() {
        // given
        when(repository.count()).thenReturn(0);

        // when & then
        assertThatThrownBy(() -> userService.createUser(null, "ann@x.com"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("name cannot be null");
        verify(repository, never()).add(any());
    }

    @Test
    void createUser_빈_이름도_허용됨() {
        // given
        when(repository.count()).thenReturn(0);
        when(repository.getById(1L)).thenReturn(Optional.empty());

        // when
        User user = userService.createUser("", "");

        // then
        assertThat(user.name()).isEmpty();
        assertThat(user.email()).isEmpty();
    }
}
