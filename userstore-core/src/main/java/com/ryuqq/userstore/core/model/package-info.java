/**
 * Core domain model package.
 *
 * <h2>Types</h2>
 * <ul>
 *   <li>{@link com.ryuqq.userstore.core.model.User} - Immutable user record (id, name, email)</li>
 *   <li>{@link com.ryuqq.userstore.core.model.UserRole} - Role tag (ADMIN, USER, GUEST), not bound to any user</li>
 * </ul>
 *
 * <h2>Design Principles</h2>
 * <ul>
 *   <li><strong>Immutability:</strong> Users are never mutated after creation</li>
 *   <li><strong>Pure Java:</strong> No external dependencies</li>
 * </ul>
 *
 * @since 1.0.0
 * @author User Store Team
 */
package com.ryuqq.userstore.core.model;
