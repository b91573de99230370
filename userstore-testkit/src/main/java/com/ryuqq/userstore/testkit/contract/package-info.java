/**
 * Contract Test support for UserRepository adapters.
 *
 * <p>{@link com.ryuqq.userstore.testkit.contract.AbstractUserRepositoryContractTest}
 * holds the shared test cases; adapter modules extend it from their test sources.</p>
 *
 * @author User Store Team
 * @since 1.0.0
 */
package com.ryuqq.userstore.testkit.contract;
