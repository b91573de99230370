/**
 * User Store Application Layer - 사용자 생성 API.
 *
 * <h2>핵심 클래스</h2>
 * <ul>
 *   <li>{@link com.ryuqq.userstore.application.user.UserService} - 식별자 발급 및 사용자 저장</li>
 * </ul>
 *
 * <h2>설계 원칙</h2>
 * <ul>
 *   <li><strong>헥사고날 아키텍처:</strong> 저장소는 core SPI(UserRepository)로만 접근</li>
 *   <li><strong>의존성 역전:</strong> 구현체는 adapter-inmemory 모듈에 위치</li>
 * </ul>
 *
 * @author User Store Team
 * @since 1.0.0
 */
package com.ryuqq.userstore.application.user;
