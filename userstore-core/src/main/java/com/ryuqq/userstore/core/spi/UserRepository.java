package com.ryuqq.userstore.core.spi;

import com.ryuqq.userstore.core.model.User;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * User storage SPI.
 *
 * <p>Extends the generic {@link Repository} capability with the user-specific
 * operations needed by the application layer.</p>
 *
 * <p><strong>Responsibilities:</strong></p>
 * <ul>
 *   <li>Keyed storage of {@link User} by {@link User#id()} (overwrite on duplicate id)</li>
 *   <li>Entry count, used for identifier generation</li>
 *   <li>Delayed asynchronous lookup</li>
 *   <li>Name search</li>
 * </ul>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * UserRepository repository = new InMemoryUserRepository();
 * repository.add(User.of(1L, "Ann", "ann@x.com"));
 *
 * Optional&lt;User&gt; found = repository.getById(1L);
 * Optional&lt;User&gt; later = repository.getByIdAsync(1L).join();
 * </pre>
 *
 * @author User Store Team
 * @since 1.0.0
 */
public interface UserRepository extends Repository<User> {

    /**
     * Returns the number of stored users.
     *
     * @return stored user count (zero or more)
     */
    int count();

    /**
     * Looks up a user after a fixed artificial delay.
     *
     * <p>The lookup itself is identical to {@link #getById(long)}. The future completes
     * only after the implementation's configured delay has elapsed. Cancelling the future
     * before then produces no result and has no side effect.</p>
     *
     * @param id the user identifier
     * @return a future completing with the stored user, or empty if none exists
     */
    CompletableFuture<Optional<User>> getByIdAsync(long id);

    /**
     * Finds users whose name contains the given fragment.
     *
     * <p><strong>Matching Rules:</strong></p>
     * <ul>
     *   <li>Case-sensitive substring match on {@link User#name()}</li>
     *   <li>An empty fragment matches every user</li>
     *   <li>Results ordered by name ascending, then by id</li>
     * </ul>
     *
     * @param fragment the name fragment to search for
     * @return matching users (may be empty)
     * @throws IllegalArgumentException if fragment is null
     */
    List<User> searchByName(String fragment);
}
